package com.slicebot.model;

public enum Classification {
    FETCH("fetch"),
    COVERED("covered"),
    UNFETCHABLE("unfetchable");

    private final String label;

    Classification(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
