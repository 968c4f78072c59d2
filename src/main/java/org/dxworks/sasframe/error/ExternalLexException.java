package org.dxworks.sasframe.error;

/**
 * The upstream token stream cannot be used: the lexer reported an unrecoverable error,
 * or token spans are malformed or out of order. Analysis of the file stops.
 */
public class ExternalLexException extends RuntimeException {
    private final int line;

    public ExternalLexException(String message, int line) {
        super(message);
        this.line = line;
    }

    public int getLine() {
        return line;
    }
}
