package org.dxworks.sasframe.construct;

import org.dxworks.sasframe.token.Token;
import org.dxworks.sasframe.token.TokenKind;

import java.util.List;

/**
 * Tokens of one SAS statement, comments excluded. The body is the statement without its closing
 * {@code ;}.
 */
final class Statement {

    private final List<Token> tokens;
    private final List<Token> body;

    Statement(List<Token> tokens) {
        this.tokens = List.copyOf(tokens);
        Token last = this.tokens.get(this.tokens.size() - 1);
        this.body = last.isDelimiter(";") ? this.tokens.subList(0, this.tokens.size() - 1) : this.tokens;
    }

    List<Token> tokens() {
        return tokens;
    }

    List<Token> body() {
        return body;
    }

    int size() {
        return body.size();
    }

    Token first() {
        return tokens.get(0);
    }

    Token at(int index) {
        return index >= 0 && index < body.size() ? body.get(index) : null;
    }

    Token fromEnd(int offset) {
        return at(body.size() - 1 - offset);
    }

    /** Upper-cased keyword at the start of the statement, or null when it does not start with one. */
    String keyword() {
        Token first = first();
        return first.kind == TokenKind.KEYWORD ? first.normalized() : null;
    }

    boolean isAssignment() {
        Token second = at(1);
        Token first = at(0);
        return first != null && second != null && second.isOperator("=")
                && (first.kind == TokenKind.IDENTIFIER || first.kind == TokenKind.KEYWORD)
                && !first.isMacroReference();
    }

    /** True when the body ends with the given keywords, in order. */
    boolean endsWithKeywords(String... keywords) {
        if (body.size() < keywords.length) {
            return false;
        }
        for (int i = 0; i < keywords.length; i++) {
            Token token = body.get(body.size() - keywords.length + i);
            if (!token.isKeyword(keywords[i])) {
                return false;
            }
        }
        return true;
    }

    int indexOfKeyword(String keyword, int from) {
        for (int i = Math.max(0, from); i < body.size(); i++) {
            if (body.get(i).isKeyword(keyword)) {
                return i;
            }
        }
        return -1;
    }

    String text() {
        return textOf(body, 0, body.size());
    }

    String text(int from, int toExclusive) {
        return textOf(body, from, toExclusive);
    }

    int line() {
        return first().line;
    }

    // Joins lexemes, keeping a single space wherever the source had any gap.
    static String textOf(List<Token> tokens, int from, int toExclusive) {
        StringBuilder sb = new StringBuilder();
        Token previous = null;
        for (int i = Math.max(0, from); i < Math.min(toExclusive, tokens.size()); i++) {
            Token token = tokens.get(i);
            if (previous != null && token.start > previous.end) {
                sb.append(' ');
            }
            sb.append(token.lexeme);
            previous = token;
        }
        return sb.toString();
    }
}
