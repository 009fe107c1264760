package com.slicebot.graph;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class GraphNode {
    public final String id;
    public final String label;
    public final String eventId;
    public final CaseBinding caseBinding;

    public boolean hasEventId() {
        return eventId != null && !eventId.trim().isEmpty();
    }
}
