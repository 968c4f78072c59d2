package org.dxworks.sasframe.lexer;

import java.util.List;

/**
 * Output of one tokenizer run: the ordered tokens of a file and the diagnostics reported while lexing.
 */
public class TokenStreamResult {
    public final List<RawToken> tokens;
    public final List<LexDiagnostic> diagnostics;

    public TokenStreamResult(List<RawToken> tokens, List<LexDiagnostic> diagnostics) {
        this.tokens = List.copyOf(tokens);
        this.diagnostics = List.copyOf(diagnostics);
    }

    public boolean hasFatalDiagnostic() {
        return diagnostics.stream().anyMatch(d -> d.fatal);
    }
}
