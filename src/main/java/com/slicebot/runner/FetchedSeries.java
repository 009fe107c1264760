package com.slicebot.runner;

import com.slicebot.model.DailyPoint;
import com.slicebot.model.TimeBounds;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.List;

/**
 * Points returned for one requested window. Blank family or signature means "same as the plan item".
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
public final class FetchedSeries {
    public final String sliceFamily;
    public final String querySignature;
    public final TimeBounds bounds;
    public final List<DailyPoint> points;

    public static FetchedSeries of(TimeBounds bounds, List<DailyPoint> points) {
        return new FetchedSeries(null, null, bounds, points == null ? List.of() : List.copyOf(points));
    }
}
