package com.slicebot.plan;

import com.slicebot.graph.GraphEdge;
import com.slicebot.graph.GraphNode;
import com.slicebot.graph.ParameterBinding;
import com.slicebot.model.ItemKey;

final class FetchTarget {
    final ItemKey itemKey;
    final GraphEdge edge;
    final GraphNode node;
    final ParameterBinding parameter;
    final String condition;

    FetchTarget(ItemKey itemKey, GraphEdge edge, GraphNode node, ParameterBinding parameter, String condition) {
        this.itemKey = itemKey;
        this.edge = edge;
        this.node = node;
        this.parameter = parameter;
        this.condition = condition == null ? "" : condition.trim();
    }
}
