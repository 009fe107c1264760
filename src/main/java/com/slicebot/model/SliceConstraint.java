package com.slicebot.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.TreeSet;

/**
 * Resolved constraints of one slice. The slice family is everything except the time bounds that
 * partitions data: context, contextAny and case predicates in canonical order.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder(toBuilder = true)
public final class SliceConstraint {
    public final QueryMode mode;
    public final TimeBounds bounds;
    public final String cohortAnchor;
    public final List<ContextPredicate> contexts;
    public final List<ContextPredicate> contextAny;
    public final List<ContextPredicate> cases;
    public final List<String> visited;
    public final List<String> visitedAny;
    public final List<String> exclude;

    public static SliceConstraint normalized(SliceConstraint raw) {
        return new SliceConstraint(
                raw.mode == null ? QueryMode.WINDOW : raw.mode,
                raw.bounds,
                raw.cohortAnchor == null ? "" : raw.cohortAnchor.trim(),
                sortedPredicates(raw.contexts),
                sortedPredicates(raw.contextAny),
                sortedPredicates(raw.cases),
                sortedStrings(raw.visited),
                sortedStrings(raw.visitedAny),
                sortedStrings(raw.exclude)
        );
    }

    public boolean hasTimeBounds() {
        return bounds != null;
    }

    public boolean isUncontexted() {
        return contexts.isEmpty() && contextAny.isEmpty() && cases.isEmpty();
    }

    public String sliceFamily() {
        List<String> parts = new ArrayList<>();
        for (ContextPredicate p : contexts) {
            parts.add("context(" + p.pair() + ")");
        }
        if (!contextAny.isEmpty()) {
            List<String> pairs = new ArrayList<>();
            for (ContextPredicate p : contextAny) {
                pairs.add(p.pair());
            }
            parts.add("contextAny(" + String.join(",", pairs) + ")");
        }
        for (ContextPredicate p : cases) {
            parts.add("case(" + p.pair() + ")");
        }
        return String.join(".", parts);
    }

    /**
     * One constraint per contextAny member, each with the member promoted to a plain context.
     */
    public List<SliceConstraint> expandContextAny() {
        if (contextAny.isEmpty()) {
            return List.of(this);
        }
        List<SliceConstraint> out = new ArrayList<>(contextAny.size());
        for (ContextPredicate member : contextAny) {
            out.add(withExtraContext(member));
        }
        return out;
    }

    public SliceConstraint withExtraContext(ContextPredicate predicate) {
        List<ContextPredicate> merged = new ArrayList<>(contexts);
        merged.add(predicate);
        return normalized(toBuilder().contexts(merged).contextAny(List.of()).build());
    }

    public SliceConstraint withBounds(TimeBounds newBounds) {
        return toBuilder().bounds(newBounds).build();
    }

    private static List<ContextPredicate> sortedPredicates(List<ContextPredicate> in) {
        if (in == null || in.isEmpty()) {
            return List.of();
        }
        return List.copyOf(new TreeSet<>(in));
    }

    private static List<String> sortedStrings(List<String> in) {
        if (in == null || in.isEmpty()) {
            return List.of();
        }
        TreeSet<String> set = new TreeSet<>();
        for (String s : in) {
            if (s != null && !s.trim().isEmpty()) {
                set.add(s.trim());
            }
        }
        return Collections.unmodifiableList(new ArrayList<>(set));
    }
}
