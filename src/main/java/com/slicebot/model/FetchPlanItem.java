package com.slicebot.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class FetchPlanItem {
    public final ItemKey itemKey;
    public final QueryMode mode;
    public final String sliceFamily;
    public final String querySignature;
    public final String connection;
    public final Classification classification;
    public final List<FetchWindow> windows;
    public final UnfetchableReason unfetchableReason;
    public final List<FetchComponent> components;

    public String objectId() {
        return itemKey.objectId;
    }

    public String targetId() {
        return itemKey.targetId;
    }

    public TargetType type() {
        return itemKey.type;
    }

    /**
     * Components to fetch, or a single one built from the item itself when the plan recorded none.
     */
    public List<FetchComponent> componentsOr(SliceConstraint constraint) {
        if (components != null && !components.isEmpty()) {
            return components;
        }
        return List.of(new FetchComponent(constraint, sliceFamily, querySignature,
                windows == null ? List.of() : windows));
    }

    public int daysToFetch() {
        return windows == null ? 0 : FetchWindow.totalDays(windows);
    }
}
