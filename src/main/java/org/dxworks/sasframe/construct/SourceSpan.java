package org.dxworks.sasframe.construct;

public class SourceSpan {
    public final int start;
    public final int end;
    public final int line;
    public final int column;
    public final int endLine;

    public SourceSpan(int start, int end, int line, int column, int endLine) {
        this.start = start;
        this.end = end;
        this.line = line;
        this.column = column;
        this.endLine = endLine;
    }

    @Override
    public String toString() {
        return "[" + start + ".." + end + ") lines " + line + "-" + endLine;
    }
}
