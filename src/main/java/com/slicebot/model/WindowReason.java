package com.slicebot.model;

public enum WindowReason {
    MISSING("missing"),
    STALE("stale"),
    DB_MISSING("db_missing");

    private final String label;

    WindowReason(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
