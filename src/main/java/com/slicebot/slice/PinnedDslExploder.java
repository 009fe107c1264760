package com.slicebot.slice;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Splits a pinned query on top-level {@code ;}, keeping first-seen order and dropping duplicates.
 * A part wrapped as {@code or(a,b,...)} contributes each alternative.
 */
public final class PinnedDslExploder implements SliceExploder {

    @Override
    public List<String> explode(String pinnedDsl) {
        String text = pinnedDsl == null ? "" : pinnedDsl.trim();
        Set<String> out = new LinkedHashSet<>();
        for (String part : splitTopLevel(text, ';')) {
            if (part.startsWith("or(") && part.endsWith(")")) {
                for (String alt : splitTopLevel(part.substring(3, part.length() - 1), ',')) {
                    out.add(alt);
                }
            } else {
                out.add(part);
            }
        }
        return new ArrayList<>(out);
    }

    private static List<String> splitTopLevel(String text, char separator) {
        List<String> parts = new ArrayList<>();
        int depth = 0;
        StringBuilder current = new StringBuilder();
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth = Math.max(0, depth - 1);
            }
            if (c == separator && depth == 0) {
                add(parts, current);
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        add(parts, current);
        return parts;
    }

    private static void add(List<String> parts, StringBuilder current) {
        String t = current.toString().trim();
        if (!t.isEmpty()) {
            parts.add(t);
        }
    }
}
