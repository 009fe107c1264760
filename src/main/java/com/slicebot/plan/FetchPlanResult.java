package com.slicebot.plan;

import com.slicebot.model.FetchPlan;
import com.slicebot.model.SliceConstraint;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
public final class FetchPlanResult {
    public final FetchPlan plan;
    public final SliceConstraint constraint;
    public final FetchPlanDiagnostics diagnostics;
}
