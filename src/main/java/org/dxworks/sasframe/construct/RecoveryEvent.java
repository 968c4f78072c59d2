package org.dxworks.sasframe.construct;

import java.util.List;

/**
 * A point where the builder had to repair the block structure: an unmatched terminator, a terminator
 * that skipped over unterminated blocks, a step boundary inside an open block, or blocks left open at
 * end of file. Analysis continues with the repaired tree.
 */
public class RecoveryEvent {
    public final int line;
    public final int column;
    /** The terminator that triggered recovery, null for step boundaries and end of file. */
    public final String terminator;
    public final String message;
    public final List<Integer> forceClosedConstructIds;

    public RecoveryEvent(int line, int column, String terminator, String message,
                         List<Integer> forceClosedConstructIds) {
        this.line = line;
        this.column = column;
        this.terminator = terminator;
        this.message = message;
        this.forceClosedConstructIds = List.copyOf(forceClosedConstructIds);
    }

    @Override
    public String toString() {
        return "line " + line + ": " + message;
    }
}
