package com.slicebot.slice;

import com.slicebot.model.QueryMode;
import com.slicebot.model.SliceConstraint;
import com.slicebot.model.TimeBounds;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
public final class ResolvedSlice {
    public final String dsl;
    public final SliceConstraint constraint;
    public final TimeBounds timeBounds;
    public final String sliceFamily;
    public final String querySignature;
    public final QueryMode mode;
}
