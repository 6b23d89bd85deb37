package com.purchasingpower.calcforge.model.classification;

import java.util.Locale;

public enum AlertSeverity {
    ERROR,
    WARNING,
    INFO;

    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Severity implied by an ARGB/RGB color: reds are errors, amber and orange are
     * warnings, greens are informational.
     */
    public static AlertSeverity fromColor(String color) {
        if (color == null || color.isBlank()) {
            return INFO;
        }
        String argb = color.trim().toUpperCase(Locale.ROOT);
        if ((argb.startsWith("FF") && argb.endsWith("0000")) || argb.contains("FF0000")) {
            return ERROR;
        }
        if (argb.contains("FFA500") || argb.contains("FFCC00")) {
            return WARNING;
        }
        return INFO;
    }

    public static AlertSeverity fromValue(String value) {
        if (value == null) {
            return null;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "error", "critical" -> ERROR;
            case "warning", "warn" -> WARNING;
            case "info", "information" -> INFO;
            default -> null;
        };
    }
}
