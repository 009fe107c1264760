package com.slicebot.runner;

import com.slicebot.model.FetchComponent;
import com.slicebot.model.FetchPlanItem;
import com.slicebot.model.FetchWindow;
import com.slicebot.model.SliceConstraint;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class FetchRequest {
    public final FetchPlanItem item;
    /** Slice the result is stored under; one request per component of a contextAny or MECE item. */
    public final FetchComponent component;
    public final String sliceDsl;
    public final SliceConstraint constraint;
    public final List<FetchWindow> windows;
    public final boolean bustCache;
    public final boolean dryRun;
    public final Instant batchTimestamp;

    public String objectId() {
        return item.objectId();
    }

    public String targetId() {
        return item.targetId();
    }

    public String sliceFamily() {
        return component == null ? item.sliceFamily : component.sliceFamily;
    }

    public String querySignature() {
        return component == null ? item.querySignature : component.querySignature;
    }
}
