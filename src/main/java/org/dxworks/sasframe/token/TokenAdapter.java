package org.dxworks.sasframe.token;

import org.dxworks.sasframe.error.ExternalLexException;
import org.dxworks.sasframe.lexer.LexDiagnostic;
import org.dxworks.sasframe.lexer.RawToken;
import org.dxworks.sasframe.lexer.TokenStreamResult;

import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Normalises the lexer's raw token stream into {@link Token}s.
 * <p>
 * The raw stream is treated as untrusted: spans must satisfy {@code stop >= start} and tokens must not
 * overlap or go backwards. Whitespace is dropped; token types this adapter does not know become
 * {@link TokenKind#UNKNOWN} instead of failing the file.
 */
public class TokenAdapter {

    private static final Map<String, TokenKind> KINDS_BY_TYPE = Map.ofEntries(
            Map.entry("KEYWORD", TokenKind.KEYWORD),
            Map.entry("MACRO_KEYWORD", TokenKind.KEYWORD),
            Map.entry("DATALINES_START", TokenKind.KEYWORD),
            Map.entry("IDENTIFIER", TokenKind.IDENTIFIER),
            Map.entry("MACRO_CALL", TokenKind.IDENTIFIER),
            Map.entry("OPERATOR", TokenKind.OPERATOR),
            Map.entry("WORD_OPERATOR", TokenKind.OPERATOR),
            Map.entry("STRING", TokenKind.LITERAL),
            Map.entry("NUMBER", TokenKind.LITERAL),
            Map.entry("DATALINES_BODY", TokenKind.LITERAL),
            Map.entry("COMMENT", TokenKind.COMMENT),
            Map.entry("BLOCK_COMMENT", TokenKind.COMMENT),
            Map.entry("MACRO_COMMENT", TokenKind.COMMENT),
            Map.entry("SEMI", TokenKind.DELIMITER),
            Map.entry("DATALINES_END", TokenKind.DELIMITER),
            Map.entry("COMMA", TokenKind.DELIMITER),
            Map.entry("LPAREN", TokenKind.DELIMITER),
            Map.entry("RPAREN", TokenKind.DELIMITER),
            Map.entry("BRACKET", TokenKind.DELIMITER)
    );

    private static final String WHITESPACE = "WS";

    public TokenSequence adapt(TokenStreamResult raw) {
        return adapt(raw, null);
    }

    /**
     * @param source original text, used to recover lexemes for raw tokens that only carry offsets
     * @throws ExternalLexException when the lexer reported an unrecoverable error
     */
    public TokenSequence adapt(TokenStreamResult raw, String source) {
        for (LexDiagnostic diagnostic : raw.diagnostics) {
            if (diagnostic.fatal) {
                throw new ExternalLexException("lexer failure: " + diagnostic.message
                        + " at line " + diagnostic.line + ", column " + diagnostic.column, diagnostic.line);
            }
        }
        List<RawToken> tokens = raw.tokens;
        return new TokenSequence(() -> new AdaptingIterator(tokens, source));
    }

    static TokenKind kindOf(String rawType) {
        if (rawType == null) {
            return TokenKind.UNKNOWN;
        }
        return KINDS_BY_TYPE.getOrDefault(rawType, TokenKind.UNKNOWN);
    }

    private static class AdaptingIterator implements Iterator<Token> {
        private final List<RawToken> tokens;
        private final String source;
        private int index;
        private int previousStop = 0;
        private Token next;

        AdaptingIterator(List<RawToken> tokens, String source) {
            this.tokens = tokens;
            this.source = source;
        }

        @Override
        public boolean hasNext() {
            if (next == null) {
                next = advance();
            }
            return next != null;
        }

        @Override
        public Token next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            Token current = next;
            next = null;
            return current;
        }

        private Token advance() {
            while (index < tokens.size()) {
                RawToken raw = tokens.get(index++);
                validateSpan(raw);
                if (WHITESPACE.equals(raw.type)) {
                    continue;
                }
                return new Token(kindOf(raw.type), lexemeOf(raw), raw.start, raw.stop, raw.line, raw.column);
            }
            return null;
        }

        private void validateSpan(RawToken raw) {
            if (raw.stop < raw.start) {
                throw new ExternalLexException("token " + raw + " ends before it starts", raw.line);
            }
            if (raw.start < previousStop) {
                throw new ExternalLexException("token " + raw + " starts at " + raw.start
                        + " but the previous token ended at " + previousStop, raw.line);
            }
            previousStop = raw.stop;
        }

        private String lexemeOf(RawToken raw) {
            if (raw.text != null) {
                return raw.text;
            }
            if (source == null) {
                return "";
            }
            if (raw.stop > source.length()) {
                throw new ExternalLexException("token " + raw + " ends at " + raw.stop
                        + " past the end of the source (" + source.length() + " chars)", raw.line);
            }
            return source.substring(raw.start, raw.stop);
        }
    }
}
