package org.dxworks.sasframe.lexer;

/**
 * A token as delivered by the SAS lexer, before any normalisation.
 * <p>
 * {@code type} is the lexer's symbolic token name (e.g. {@code KEYWORD}, {@code WS}),
 * {@code stop} is exclusive and {@code text} may be null when the producer only reports offsets.
 */
public class RawToken {
    public final String type;
    public final String text;
    public final int start;
    public final int stop;
    public final int line;
    public final int column;

    public RawToken(String type, String text, int start, int stop, int line, int column) {
        this.type = type;
        this.text = text;
        this.start = start;
        this.stop = stop;
        this.line = line;
        this.column = column;
    }

    @Override
    public String toString() {
        return type + "[" + start + ".." + stop + "]@" + line + ":" + column + " '" + text + "'";
    }
}
