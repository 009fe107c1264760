package com.slicebot.plan;

import com.slicebot.graph.ConditionalParameter;
import com.slicebot.graph.Graph;
import com.slicebot.graph.GraphEdge;
import com.slicebot.graph.GraphNode;
import com.slicebot.graph.ParameterBinding;
import com.slicebot.model.ItemKey;
import com.slicebot.model.ParamSlot;

import java.util.ArrayList;
import java.util.List;

/**
 * Every edge slot, conditional parameter and node case that is bound to a stored object.
 */
final class FetchTargetEnumerator {

    List<FetchTarget> enumerate(Graph graph) {
        List<FetchTarget> out = new ArrayList<>();
        for (GraphEdge edge : graph.edgesOrEmpty()) {
            for (ParamSlot slot : ParamSlot.values()) {
                ParameterBinding binding = edge.parameter(slot);
                if (isBound(binding)) {
                    out.add(new FetchTarget(ItemKey.parameter(binding.objectId, edge.id, slot, null),
                            edge, null, binding, ""));
                }
            }
            List<ConditionalParameter> conditionals = edge.conditionalsOrEmpty();
            for (int i = 0; i < conditionals.size(); i++) {
                ConditionalParameter cp = conditionals.get(i);
                if (cp != null && isBound(cp.parameter)) {
                    out.add(new FetchTarget(ItemKey.parameter(cp.parameter.objectId, edge.id, ParamSlot.P, i),
                            edge, null, cp.parameter, cp.condition));
                }
            }
        }
        for (GraphNode node : graph.nodesOrEmpty()) {
            if (node.caseBinding != null && !isBlank(node.caseBinding.objectId)) {
                out.add(new FetchTarget(ItemKey.caseItem(node.caseBinding.objectId, node.id), null, node, null, ""));
            }
        }
        return out;
    }

    private static boolean isBound(ParameterBinding binding) {
        return binding != null && !isBlank(binding.objectId);
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
