package com.slicebot.model;

/**
 * Structural, plan-time reasons an item cannot be fetched. Never raised as errors.
 */
public enum UnfetchableReason {
    NO_CONNECTION("no_connection"),
    NO_CONNECTION_AND_NO_FILE("no_connection_and_no_file"),
    NO_EVENT_IDS("no_event_ids"),
    PARTIAL_EVENT_IDS("partial_event_ids");

    private final String label;

    UnfetchableReason(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public boolean isEventIdReason() {
        return this == NO_EVENT_IDS || this == PARTIAL_EVENT_IDS;
    }
}
