package org.dxworks.sasframe.token;

import org.dxworks.sasframe.error.ExternalLexException;
import org.dxworks.sasframe.lexer.LexDiagnostic;
import org.dxworks.sasframe.lexer.RawToken;
import org.dxworks.sasframe.lexer.TokenStreamResult;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class TokenAdapterTest {

    private final TokenAdapter adapter = new TokenAdapter();

    @Test
    void adapt_DropsWhitespaceAndMapsKinds() {
        TokenStreamResult raw = result(
                new RawToken("KEYWORD", "data", 0, 4, 1, 0),
                new RawToken("WS", " ", 4, 5, 1, 4),
                new RawToken("IDENTIFIER", "a", 5, 6, 1, 5),
                new RawToken("SEMI", ";", 6, 7, 1, 6));

        List<Token> tokens = adapter.adapt(raw).toList();

        assertEquals(3, tokens.size());
        assertEquals(TokenKind.KEYWORD, tokens.get(0).kind);
        assertEquals(TokenKind.IDENTIFIER, tokens.get(1).kind);
        assertEquals(TokenKind.DELIMITER, tokens.get(2).kind);
        assertEquals("DATA", tokens.get(0).normalized());
    }

    @Test
    void adapt_UnknownTypeBecomesUnknownKind() {
        TokenStreamResult raw = result(
                new RawToken("ERROR_CHAR", "?", 0, 1, 1, 0),
                new RawToken(null, "!", 1, 2, 1, 1));

        List<Token> tokens = adapter.adapt(raw).toList();

        assertEquals(TokenKind.UNKNOWN, tokens.get(0).kind);
        assertEquals(TokenKind.UNKNOWN, tokens.get(1).kind);
    }

    @Test
    void adapt_MacroTokensKeepTheirRole() {
        assertEquals(TokenKind.KEYWORD, TokenAdapter.kindOf("MACRO_KEYWORD"));
        assertEquals(TokenKind.IDENTIFIER, TokenAdapter.kindOf("MACRO_CALL"));
        assertEquals(TokenKind.KEYWORD, TokenAdapter.kindOf("DATALINES_START"));
        assertEquals(TokenKind.LITERAL, TokenAdapter.kindOf("DATALINES_BODY"));
        assertEquals(TokenKind.DELIMITER, TokenAdapter.kindOf("DATALINES_END"));
    }

    @Test
    void adapt_RecoversLexemeFromSource() {
        TokenStreamResult raw = result(new RawToken("IDENTIFIER", null, 5, 8, 1, 5));

        List<Token> tokens = adapter.adapt(raw, "data abc;").toList();

        assertEquals("abc", tokens.get(0).lexeme);
    }

    @Test
    void adapt_RejectsSpanPastEndOfSource() {
        TokenStreamResult raw = result(new RawToken("IDENTIFIER", null, 5, 12, 2, 5));

        ExternalLexException e = assertThrows(ExternalLexException.class,
                () -> adapter.adapt(raw, "data abc;").toList());
        assertEquals(2, e.getLine());
    }

    @Test
    void adapt_RejectsBackwardSpan() {
        TokenStreamResult raw = result(new RawToken("IDENTIFIER", "a", 5, 4, 1, 5));

        assertThrows(ExternalLexException.class, () -> adapter.adapt(raw).toList());
    }

    @Test
    void adapt_RejectsOverlappingTokens() {
        TokenStreamResult raw = result(
                new RawToken("KEYWORD", "data", 0, 4, 1, 0),
                new RawToken("IDENTIFIER", "ta", 2, 5, 1, 2));

        ExternalLexException e = assertThrows(ExternalLexException.class, () -> adapter.adapt(raw).toList());
        assertEquals(1, e.getLine());
    }

    @Test
    void adapt_FatalDiagnosticStopsImmediately() {
        TokenStreamResult raw = new TokenStreamResult(List.of(),
                List.of(new LexDiagnostic("unterminated string literal", 3, 7, true)));

        ExternalLexException e = assertThrows(ExternalLexException.class, () -> adapter.adapt(raw));
        assertEquals(3, e.getLine());
    }

    @Test
    void adapt_EachPassIsIndependent() {
        TokenSequence sequence = adapter.adapt(result(
                new RawToken("KEYWORD", "run", 0, 3, 1, 0),
                new RawToken("SEMI", ";", 3, 4, 1, 3)));

        assertEquals(sequence.toList().size(), sequence.toList().size());
        assertEquals(2, sequence.toList().size());
    }

    private static TokenStreamResult result(RawToken... tokens) {
        return new TokenStreamResult(List.of(tokens), List.of());
    }
}
