package com.autofix.core.report;

import java.util.Locale;

public enum ReportFormat {
    TEXT,
    JSON,
    MARKDOWN;

    public static ReportFormat fromString(String value) {
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown report format: " + value + " (expected text, json or markdown)", e);
        }
    }
}
