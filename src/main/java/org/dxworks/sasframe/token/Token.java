package org.dxworks.sasframe.token;

import java.util.Locale;

/**
 * Immutable, normalised token. Offsets are character offsets into the source, {@code end} exclusive.
 */
public class Token {
    public final TokenKind kind;
    public final String lexeme;
    public final int start;
    public final int end;
    public final int line;
    public final int column;

    private final String normalized;

    public Token(TokenKind kind, String lexeme, int start, int end, int line, int column) {
        this.kind = kind;
        this.lexeme = lexeme == null ? "" : lexeme;
        this.start = start;
        this.end = end;
        this.line = line;
        this.column = column;
        this.normalized = this.lexeme.trim().toUpperCase(Locale.ROOT);
    }

    /** Upper-cased, trimmed lexeme. */
    public String normalized() {
        return normalized;
    }

    public boolean is(TokenKind kind, String normalizedText) {
        return this.kind == kind && normalized.equals(normalizedText);
    }

    public boolean isKeyword(String keyword) {
        return is(TokenKind.KEYWORD, keyword);
    }

    public boolean isDelimiter(String text) {
        return is(TokenKind.DELIMITER, text);
    }

    public boolean isOperator(String text) {
        return is(TokenKind.OPERATOR, text);
    }

    /** Macro invocations carry the {@code %} sigil on an identifier token. */
    public boolean isMacroReference() {
        return kind == TokenKind.IDENTIFIER && normalized.startsWith("%");
    }

    @Override
    public String toString() {
        return kind + "(" + lexeme + ")@" + line + ":" + column;
    }
}
