package com.slicebot.model;

public enum TargetType {
    PARAMETER("parameter"),
    CASE("case");

    private final String label;

    TargetType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
