package org.dxworks.sasframe.rules;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Severity {
    INFO,
    WARNING,
    CRITICAL;

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Severity parse(String value) {
        return Severity.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
