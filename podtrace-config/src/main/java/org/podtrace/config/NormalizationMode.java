package org.podtrace.config;

import org.podtrace.lang.Cause;
import org.podtrace.lang.Result;

/**
 * Source of the normalization range table.
 */
public enum NormalizationMode {
    /**
     * Hand-specified absolute bounds per metric.
     */
    FIXED("fixed"),
    /**
     * Bounds derived once from a reference set of traces.
     */
    DERIVED("derived");

    private final String value;

    NormalizationMode(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * Parse mode from string, case-insensitive.
     */
    public static Result<NormalizationMode> normalizationMode(String value) {
        if (value == null) {
            return UnknownMode.unknownMode("null").result();
        }
        var normalized = value.trim()
                              .toLowerCase();
        for (var mode : values()) {
            if (mode.value.equals(normalized)) {
                return Result.success(mode);
            }
        }
        return UnknownMode.unknownMode(value).result();
    }

    public record UnknownMode(String value) implements Cause {
        public static UnknownMode unknownMode(String value) {
            return new UnknownMode(value);
        }

        @Override
        public String message() {
            return "Unknown normalization mode: " + value + ". Valid options: fixed, derived";
        }
    }
}
