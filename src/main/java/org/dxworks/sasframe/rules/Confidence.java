package org.dxworks.sasframe.rules;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * How far a blueprint entry can be trusted. {@link #UNSUPPORTED} is reserved for constructs no mapping rule
 * matched.
 */
public enum Confidence {
    HIGH,
    MEDIUM,
    LOW,
    UNSUPPORTED;

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Confidence parse(String value) {
        return Confidence.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
