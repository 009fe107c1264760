package com.slicebot.model;

/**
 * Parameter slot on an edge.
 */
public enum ParamSlot {
    P("p"),
    COST_GBP("cost_gbp"),
    LABOUR_COST("labour_cost");

    private final String label;

    ParamSlot(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static ParamSlot fromLabel(String raw) {
        String target = raw == null ? "" : raw.trim().toLowerCase();
        for (ParamSlot slot : values()) {
            if (slot.label.equals(target)) {
                return slot;
            }
        }
        throw new IllegalArgumentException("unknown parameter slot: " + raw);
    }
}
