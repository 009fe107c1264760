package com.slicebot.slice;

import com.slicebot.model.ContextPredicate;
import com.slicebot.model.SliceConstraint;
import org.json.JSONArray;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * SHA-256 over a canonical JSON rendering of the query shape. Time bounds are never part of the input.
 */
public final class QuerySignatureCalculator {

    public String compute(SliceConstraint constraint, QueryShape shape) {
        return sha256(canonicalShape(constraint, shape));
    }

    String canonicalShape(SliceConstraint constraint, QueryShape shape) {
        QueryShape s = shape == null ? QueryShape.EMPTY : shape;
        JSONArray root = new JSONArray();
        root.put(entry("connection", blank(s.connection)));
        root.put(entry("from_event", blank(s.fromEventId)));
        root.put(entry("to_event", blank(s.toEventId)));
        root.put(entry("condition", blank(s.condition)));
        root.put(entry("mode", constraint.mode.label()));
        root.put(entry("cohort_anchor", blank(constraint.cohortAnchor)));
        root.put(entry("visited", new JSONArray(constraint.visited)));
        root.put(entry("visited_any", new JSONArray(constraint.visitedAny)));
        root.put(entry("exclude", new JSONArray(constraint.exclude)));
        root.put(entry("context", pairs(constraint.contexts)));
        root.put(entry("context_any", pairs(constraint.contextAny)));
        root.put(entry("case", pairs(constraint.cases)));
        JSONArray filters = new JSONArray();
        Map<String, String> sorted = new TreeMap<>(s.eventFilters == null ? Map.of() : s.eventFilters);
        for (Map.Entry<String, String> e : sorted.entrySet()) {
            filters.put(entry(e.getKey(), blank(e.getValue())));
        }
        root.put(entry("event_filters", filters));
        return root.toString();
    }

    private static JSONArray entry(String key, Object value) {
        return new JSONArray().put(key).put(value);
    }

    private static JSONArray pairs(List<ContextPredicate> predicates) {
        JSONArray out = new JSONArray();
        for (ContextPredicate p : predicates) {
            out.put(p.pair());
        }
        return out;
    }

    private static String blank(String value) {
        return value == null ? "" : value.trim();
    }

    private static String sha256(String content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] out = digest.digest(content.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder(out.length * 2);
            for (byte b : out) {
                sb.append(String.format("%02x", b));
            }
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("failed to compute query signature", e);
        }
    }
}
