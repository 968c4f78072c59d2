package org.dxworks.sasframe.lexer;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.Vocabulary;
import org.dxworks.sasframe.lexer.generated.SasLexer;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs the ANTLR SAS lexer over a source text and exposes the result as a raw token stream.
 * <p>
 * Besides plain lexing it folds statement comments ({@code * text ;}) into single COMMENT tokens,
 * since whether a {@code *} starts a comment depends on statement position, which the grammar cannot see.
 */
public class SasTokenizer {

    public static final String COMMENT = "COMMENT";

    public TokenStreamResult tokenize(String sourceCode) {
        String source = sourceCode == null ? "" : sourceCode;
        List<LexDiagnostic> diagnostics = new ArrayList<>();

        SasLexer lexer = new SasLexer(CharStreams.fromString(source));
        lexer.removeErrorListeners();
        lexer.addErrorListener(new CollectingListener(diagnostics));

        Vocabulary vocabulary = lexer.getVocabulary();
        List<RawToken> tokens = new ArrayList<>();
        for (Token token : lexer.getAllTokens()) {
            String type = vocabulary.getSymbolicName(token.getType());
            RawToken raw = new RawToken(type, token.getText(), token.getStartIndex(),
                    token.getStopIndex() + 1, token.getLine(), token.getCharPositionInLine());
            reportAnomalies(raw, diagnostics);
            tokens.add(raw);
        }

        return new TokenStreamResult(foldStatementComments(tokens, source, diagnostics), diagnostics);
    }

    private static void reportAnomalies(RawToken token, List<LexDiagnostic> diagnostics) {
        if (token.type == null) {
            return;
        }
        switch (token.type) {
            case "UNTERMINATED_STRING" ->
                    diagnostics.add(new LexDiagnostic("unterminated string literal", token.line, token.column, true));
            case "UNTERMINATED_COMMENT" ->
                    diagnostics.add(new LexDiagnostic("unterminated block comment", token.line, token.column, true));
            case "ERROR_CHAR" ->
                    diagnostics.add(new LexDiagnostic("unexpected character '" + token.text + "'",
                            token.line, token.column, false));
            default -> {
                // regular token
            }
        }
    }

    // Replaces "* ... ;" statements with one COMMENT token spanning the whole statement.
    private static List<RawToken> foldStatementComments(List<RawToken> tokens, String source,
                                                        List<LexDiagnostic> diagnostics) {
        List<RawToken> out = new ArrayList<>(tokens.size());
        boolean atStatementStart = true;
        int i = 0;
        while (i < tokens.size()) {
            RawToken token = tokens.get(i);
            if (isTrivia(token)) {
                out.add(token);
                i++;
                continue;
            }
            if (atStatementStart && "OPERATOR".equals(token.type) && "*".equals(token.text)) {
                int end = i;
                while (end < tokens.size() && !"SEMI".equals(tokens.get(end).type)) {
                    end++;
                }
                if (end == tokens.size()) {
                    diagnostics.add(new LexDiagnostic("comment statement is not terminated by ';'",
                            token.line, token.column, false));
                    end = tokens.size() - 1;
                }
                RawToken last = tokens.get(end);
                out.add(new RawToken(COMMENT, source.substring(token.start, last.stop),
                        token.start, last.stop, token.line, token.column));
                i = end + 1;
                continue;
            }
            atStatementStart = "SEMI".equals(token.type)
                    || "DATALINES_END".equals(token.type)
                    || "MACRO_COMMENT".equals(token.type);
            out.add(token);
            i++;
        }
        return out;
    }

    private static boolean isTrivia(RawToken token) {
        return "WS".equals(token.type) || "BLOCK_COMMENT".equals(token.type);
    }

    private static class CollectingListener extends BaseErrorListener {
        private final List<LexDiagnostic> diagnostics;

        CollectingListener(List<LexDiagnostic> diagnostics) {
            this.diagnostics = diagnostics;
        }

        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol,
                                int line, int charPositionInLine, String msg,
                                RecognitionException e) {
            diagnostics.add(new LexDiagnostic(msg, line, charPositionInLine, false));
        }
    }
}
