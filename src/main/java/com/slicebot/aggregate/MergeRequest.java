package com.slicebot.aggregate;

import com.slicebot.model.DailyPoint;
import com.slicebot.model.QueryMode;
import com.slicebot.model.TimeBounds;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Freshly fetched points for one slice family/signature. {@code fetchedBounds} is the window the provider
 * was asked for; days in it without a returned point are stored as zero counts.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class MergeRequest {
    public final String sliceFamily;
    public final String querySignature;
    public final QueryMode mode;
    public final String cohortAnchor;
    public final TimeBounds fetchedBounds;
    public final List<DailyPoint> points;
    public final Instant retrievedAt;
}
