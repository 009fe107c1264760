package com.slicebot.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Identity of a fetch target. {@link #display()} is only for ordering and logs, never parsed back.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class ItemKey implements Comparable<ItemKey> {
    public final TargetType type;
    public final String objectId;
    public final String targetId;
    public final ParamSlot slot;
    public final Integer conditionalIndex;

    public static ItemKey parameter(String objectId, String targetId, ParamSlot slot, Integer conditionalIndex) {
        return new ItemKey(TargetType.PARAMETER, require(objectId, "objectId"), require(targetId, "targetId"),
                slot == null ? ParamSlot.P : slot, conditionalIndex);
    }

    public static ItemKey caseItem(String objectId, String nodeId) {
        return new ItemKey(TargetType.CASE, require(objectId, "objectId"), require(nodeId, "targetId"), null, null);
    }

    public String display() {
        return type.label() + ":" + objectId + ":" + targetId + ":"
                + (slot == null ? "" : slot.label()) + ":"
                + (conditionalIndex == null ? "" : conditionalIndex.toString());
    }

    @Override
    public int compareTo(ItemKey other) {
        return display().compareTo(other.display());
    }

    private static String require(String value, String name) {
        if (value == null || value.trim().isEmpty()) {
            throw new IllegalArgumentException("item key requires " + name);
        }
        return value.trim();
    }
}
