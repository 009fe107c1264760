package com.slicebot.graph;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * Immutable graph snapshot. Components that change the graph return a new instance via {@code toBuilder()}.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class Graph {
    public final List<GraphNode> nodes;
    public final List<GraphEdge> edges;

    public List<GraphNode> nodesOrEmpty() {
        return nodes == null ? List.of() : nodes;
    }

    public List<GraphEdge> edgesOrEmpty() {
        return edges == null ? List.of() : edges;
    }

    public Optional<GraphNode> findNode(String id) {
        if (id == null) {
            return Optional.empty();
        }
        for (GraphNode node : nodesOrEmpty()) {
            if (id.equals(node.id)) {
                return Optional.of(node);
            }
        }
        return Optional.empty();
    }
}
