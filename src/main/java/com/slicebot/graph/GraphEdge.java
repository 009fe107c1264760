package com.slicebot.graph;

import com.slicebot.model.ParamSlot;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class GraphEdge {
    public final String id;
    public final String from;
    public final String to;
    public final Map<ParamSlot, ParameterBinding> parameters;
    public final List<ConditionalParameter> conditionals;

    public ParameterBinding parameter(ParamSlot slot) {
        return parameters == null ? null : parameters.get(slot);
    }

    public List<ConditionalParameter> conditionalsOrEmpty() {
        return conditionals == null ? List.of() : conditionals;
    }
}
