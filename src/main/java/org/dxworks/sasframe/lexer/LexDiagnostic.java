package org.dxworks.sasframe.lexer;

public class LexDiagnostic {
    public final String message;
    public final int line;
    public final int column;
    // Fatal diagnostics make the whole token stream unusable (unterminated string or comment).
    public final boolean fatal;

    public LexDiagnostic(String message, int line, int column, boolean fatal) {
        this.message = message;
        this.line = line;
        this.column = column;
        this.fatal = fatal;
    }

    @Override
    public String toString() {
        return (fatal ? "fatal" : "warning") + " at " + line + ":" + column + ": " + message;
    }
}
