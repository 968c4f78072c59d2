package org.dxworks.sasframe.report;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ReportStatus {
    /** Every stage ran without recovery or rule failures. */
    COMPLETE,
    /** The tree was repaired or some rule evaluations were skipped. */
    PARTIAL,
    /** Nothing beyond the file identity and errors could be produced. */
    FAILED;

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}
