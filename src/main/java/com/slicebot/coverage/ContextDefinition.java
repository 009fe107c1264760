package com.slicebot.coverage;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class ContextDefinition {
    public static final String OTHER = "other";

    public final String id;
    public final List<String> values;
    public final OtherPolicy otherPolicy;

    public static ContextDefinition of(String id, List<String> values, OtherPolicy otherPolicy) {
        if (id == null || id.trim().isEmpty()) {
            throw new IllegalArgumentException("context definition requires an id");
        }
        Set<String> unique = new LinkedHashSet<>();
        for (String v : values == null ? List.<String>of() : values) {
            if (v != null && !v.trim().isEmpty()) {
                unique.add(v.trim());
            }
        }
        return new ContextDefinition(id.trim(), List.copyOf(unique), otherPolicy == null ? OtherPolicy.UNDEFINED : otherPolicy);
    }

    public boolean isMece() {
        return otherPolicy != OtherPolicy.UNDEFINED;
    }

    public List<String> expectedValues() {
        List<String> out = new ArrayList<>(values);
        if (otherPolicy == OtherPolicy.COMPUTED && !out.contains(OTHER)) {
            out.add(OTHER);
        }
        if (otherPolicy == OtherPolicy.UNDEFINED) {
            out.remove(OTHER);
        }
        return List.copyOf(out);
    }
}
