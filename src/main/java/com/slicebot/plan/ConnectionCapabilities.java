package com.slicebot.plan;

import com.slicebot.graph.GraphEdge;
import com.slicebot.graph.GraphNode;
import com.slicebot.graph.ParameterBinding;

/**
 * What the configured connections can do for a given target.
 */
public interface ConnectionCapabilities {

    boolean hasConnection(GraphEdge edge, ParameterBinding parameter);

    boolean hasCaseConnection(GraphNode node);

    boolean requiresEventIds(String connectionName);
}
