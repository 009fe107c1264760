package com.slicebot.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.Comparator;

/**
 * A single {@code key:value} filter, used for context and case constraints alike.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class ContextPredicate implements Comparable<ContextPredicate> {
    private static final Comparator<ContextPredicate> ORDER = Comparator
            .comparing((ContextPredicate p) -> p.key)
            .thenComparing(p -> p.value);

    public final String key;
    public final String value;

    public static ContextPredicate of(String key, String value) {
        String k = key == null ? "" : key.trim();
        String v = value == null ? "" : value.trim();
        if (k.isEmpty() || v.isEmpty()) {
            throw new IllegalArgumentException("predicate requires key and value: '" + key + ":" + value + "'");
        }
        return new ContextPredicate(k, v);
    }

    public String pair() {
        return key + ":" + value;
    }

    @Override
    public int compareTo(ContextPredicate other) {
        return ORDER.compare(this, other);
    }
}
