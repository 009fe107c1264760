package com.slicebot.slice;

import com.slicebot.model.ContextPredicate;
import com.slicebot.model.QueryMode;
import com.slicebot.model.SliceConstraint;
import com.slicebot.model.TimeBounds;
import com.slicebot.utils.DslDates;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Parses the constraint clauses of a slice string, e.g.
 * {@code window(1-Jan-26:31-Jan-26).context(channel:google)} or {@code cohort(landing,-30d:).case(exp:b)}.
 * Clause order is irrelevant; the result is normalized.
 */
public final class SliceConstraintParser {

    public SliceConstraint parse(String dsl, LocalDate referenceDate) {
        String text = dsl == null ? "" : dsl.trim();
        QueryMode mode = QueryMode.WINDOW;
        TimeBounds bounds = null;
        String anchor = "";
        boolean sawTime = false;
        List<ContextPredicate> contexts = new ArrayList<>();
        List<ContextPredicate> contextAny = new ArrayList<>();
        List<ContextPredicate> cases = new ArrayList<>();
        List<String> visited = new ArrayList<>();
        List<String> visitedAny = new ArrayList<>();
        List<String> exclude = new ArrayList<>();

        for (String clause : splitClauses(text)) {
            int open = clause.indexOf('(');
            if (open <= 0 || !clause.endsWith(")")) {
                throw new IllegalArgumentException("malformed clause '" + clause + "' in '" + text + "'");
            }
            String name = clause.substring(0, open).trim().toLowerCase(Locale.ROOT);
            String args = clause.substring(open + 1, clause.length() - 1).trim();
            if ("window".equals(name) || "cohort".equals(name)) {
                if (sawTime) {
                    throw new IllegalArgumentException("slice has more than one time clause: '" + text + "'");
                }
                sawTime = true;
                String range = args;
                if ("cohort".equals(name)) {
                    mode = QueryMode.COHORT;
                    int comma = args.indexOf(',');
                    if (comma >= 0) {
                        anchor = args.substring(0, comma).trim();
                        range = args.substring(comma + 1).trim();
                    }
                }
                bounds = parseRange(range, referenceDate, text);
            } else if ("context".equals(name)) {
                contexts.add(parsePair(args, text));
            } else if ("contextany".equals(name)) {
                for (String part : args.split(",")) {
                    contextAny.add(parsePair(part, text));
                }
            } else if ("case".equals(name)) {
                cases.add(parsePair(args, text));
            } else if ("visited".equals(name)) {
                visited.addAll(splitList(args));
            } else if ("visitedany".equals(name)) {
                visitedAny.addAll(splitList(args));
            } else if ("exclude".equals(name)) {
                exclude.addAll(splitList(args));
            } else {
                throw new IllegalArgumentException("unknown clause '" + name + "' in '" + text + "'");
            }
        }

        return SliceConstraint.normalized(SliceConstraint.builder()
                .mode(mode)
                .bounds(bounds)
                .cohortAnchor(anchor)
                .contexts(contexts)
                .contextAny(contextAny)
                .cases(cases)
                .visited(visited)
                .visitedAny(visitedAny)
                .exclude(exclude)
                .build());
    }

    static List<String> splitClauses(String text) {
        List<String> out = new ArrayList<>();
        int depth = 0;
        StringBuilder current = new StringBuilder();
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth < 0) {
                    throw new IllegalArgumentException("unbalanced parentheses in '" + text + "'");
                }
            }
            if (c == '.' && depth == 0) {
                addClause(out, current);
                current.setLength(0);
                continue;
            }
            current.append(c);
        }
        if (depth != 0) {
            throw new IllegalArgumentException("unbalanced parentheses in '" + text + "'");
        }
        addClause(out, current);
        return out;
    }

    private static void addClause(List<String> out, StringBuilder current) {
        String clause = current.toString().trim();
        if (!clause.isEmpty()) {
            out.add(clause);
        }
    }

    private TimeBounds parseRange(String range, LocalDate referenceDate, String text) {
        int colon = range.indexOf(':');
        if (colon < 0) {
            throw new IllegalArgumentException("time clause needs 'start:end' in '" + text + "'");
        }
        String startToken = range.substring(0, colon).trim();
        String endToken = range.substring(colon + 1).trim();
        if (startToken.isEmpty()) {
            throw new IllegalArgumentException("time clause needs a start in '" + text + "'");
        }
        LocalDate start = DslDates.parse(startToken, referenceDate);
        LocalDate end = DslDates.parse(endToken, referenceDate);
        return TimeBounds.of(start, end);
    }

    private ContextPredicate parsePair(String raw, String text) {
        String pair = raw == null ? "" : raw.trim();
        int colon = pair.indexOf(':');
        if (colon <= 0 || colon == pair.length() - 1) {
            throw new IllegalArgumentException("expected key:value but got '" + pair + "' in '" + text + "'");
        }
        return ContextPredicate.of(pair.substring(0, colon), pair.substring(colon + 1));
    }

    private List<String> splitList(String args) {
        List<String> out = new ArrayList<>();
        for (String part : args.split(",")) {
            String t = part.trim();
            if (!t.isEmpty()) {
                out.add(t);
            }
        }
        return out;
    }
}
