package com.slicebot.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * One concrete slice an item is fetched and stored under. A plain item has a single component equal to
 * itself; contextAny and MECE items have one per member value that still has gaps.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class FetchComponent {
    public final SliceConstraint constraint;
    public final String sliceFamily;
    public final String querySignature;
    public final List<FetchWindow> windows;

    public int daysToFetch() {
        return windows == null ? 0 : FetchWindow.totalDays(windows);
    }
}
