package com.floodsampler.core.model;

import java.util.Locale;

public enum AlertSeverity {
    STATEMENT,
    ADVISORY,
    WATCH,
    WARNING;

    public boolean atLeast(AlertSeverity threshold) {
        return compareTo(threshold) >= 0;
    }

    public static AlertSeverity fromVtecSignificance(String code) {
        if (code == null) {
            throw new IllegalArgumentException("Missing VTEC significance");
        }
        return switch (code.trim().toUpperCase(Locale.ROOT)) {
            case "W" -> WARNING;
            case "A" -> WATCH;
            case "Y" -> ADVISORY;
            case "S" -> STATEMENT;
            default -> throw new IllegalArgumentException("Unknown VTEC significance: " + code);
        };
    }
}
