package com.slicebot.graph;

import com.slicebot.coverage.ContextDefinition;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * A graph file as loaded: the graph itself plus the context registry entries and per-connection
 * event-id requirements declared next to it.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
public final class GraphDocument {
    public final Graph graph;
    public final List<ContextDefinition> contexts;
    public final Map<String, Boolean> requiresEventIds;
}
