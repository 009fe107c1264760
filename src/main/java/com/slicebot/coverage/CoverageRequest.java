package com.slicebot.coverage;

import com.slicebot.model.QueryMode;
import com.slicebot.model.SliceConstraint;
import com.slicebot.model.TimeBounds;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class CoverageRequest {
    public final SliceConstraint constraint;
    public final SignatureScheme signatures;
    public final boolean bustCache;
    public final Instant referenceNow;

    public TimeBounds bounds() {
        return constraint.bounds;
    }

    public QueryMode mode() {
        return constraint.mode;
    }

    public SignatureScheme signaturesOrUnsigned() {
        return signatures == null ? SignatureScheme.UNSIGNED : signatures;
    }
}
