package com.slicebot.coverage;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Result of checking the context values present in cache against a context definition.
 */
public final class MecePartition {
    public final String contextKey;
    public final OtherPolicy policy;
    public final boolean mece;
    public final boolean complete;
    public final boolean canAggregate;
    public final List<String> expectedValues;
    public final List<String> missingValues;
    public final List<String> extraValues;
    public final List<String> duplicateValues;

    private MecePartition(
            String contextKey,
            OtherPolicy policy,
            boolean mece,
            boolean complete,
            List<String> expectedValues,
            List<String> missingValues,
            List<String> extraValues,
            List<String> duplicateValues
    ) {
        this.contextKey = contextKey;
        this.policy = policy;
        this.mece = mece;
        this.complete = complete;
        this.canAggregate = mece && complete;
        this.expectedValues = List.copyOf(expectedValues);
        this.missingValues = List.copyOf(missingValues);
        this.extraValues = List.copyOf(extraValues);
        this.duplicateValues = List.copyOf(duplicateValues);
    }

    /**
     * @param presentValues one entry per distinct cached slice, so a repeated value means two slices claim it
     * @param definition    registry entry for the key, or null when the key is unknown
     */
    public static MecePartition detect(String contextKey, List<String> presentValues, ContextDefinition definition) {
        OtherPolicy policy = definition == null ? OtherPolicy.UNDEFINED : definition.otherPolicy;
        List<String> expected = definition == null ? List.of() : definition.expectedValues();
        Set<String> seen = new LinkedHashSet<>();
        Set<String> duplicates = new LinkedHashSet<>();
        Set<String> extras = new LinkedHashSet<>();
        for (String value : presentValues) {
            if (!seen.add(value)) {
                duplicates.add(value);
            }
            if (!expected.contains(value)) {
                extras.add(value);
            }
        }
        List<String> missing = new ArrayList<>();
        for (String value : expected) {
            if (!seen.contains(value)) {
                missing.add(value);
            }
        }
        boolean mece = policy != OtherPolicy.UNDEFINED && duplicates.isEmpty() && extras.isEmpty();
        boolean complete = !expected.isEmpty() && missing.isEmpty();
        return new MecePartition(
                contextKey,
                policy,
                mece,
                complete,
                expected,
                missing,
                new ArrayList<>(extras),
                new ArrayList<>(duplicates)
        );
    }

    public String describe() {
        if (canAggregate) {
            return "context '" + contextKey + "' is a complete MECE partition";
        }
        if (policy == OtherPolicy.UNDEFINED) {
            return "context '" + contextKey + "' is not MECE (otherPolicy=undefined)";
        }
        if (!duplicateValues.isEmpty() || !extraValues.isEmpty()) {
            return "context '" + contextKey + "' values do not partition: duplicates=" + duplicateValues
                    + " extras=" + extraValues;
        }
        return "incomplete MECE partition for '" + contextKey + "', missing " + missingValues;
    }
}
