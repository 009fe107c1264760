package com.slicebot.graph;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
public final class ConditionalParameter {
    public final String condition;
    public final ParameterBinding parameter;
}
