package org.cbug.analyzer.common;

public enum Severity {
    ERROR("error"), WARNING("warning"), INFO("info");

    public final String label;

    Severity(String label) {
        this.label = label;
    }

    // ordering in a report: errors first
    public int rank() {
        return ordinal();
    }

    public static Severity from(String label) {
        return switch (label) {
            case "error" -> ERROR;
            case "warning" -> WARNING;
            case "info" -> INFO;
            default -> throw new UnsupportedOperationException("Unknown severity " + label);
        };
    }
}
