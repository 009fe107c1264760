package com.slicebot.model;

/**
 * Measurement mode of a slice. Window and cohort data are never interchangeable.
 */
public enum QueryMode {
    WINDOW("window"),
    COHORT("cohort");

    private final String label;

    QueryMode(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static QueryMode fromLabel(String raw) {
        if (raw == null || raw.trim().isEmpty()) {
            return WINDOW;
        }
        String target = raw.trim().toLowerCase();
        for (QueryMode mode : values()) {
            if (mode.label.equals(target)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("unknown query mode: " + raw);
    }
}
