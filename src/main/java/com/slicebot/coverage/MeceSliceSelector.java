package com.slicebot.coverage;

import com.slicebot.model.CachedRecord;
import com.slicebot.model.ContextPredicate;
import com.slicebot.model.SliceConstraint;
import com.slicebot.slice.SliceResolver;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 模块说明：MeceSliceSelector（class）。
 * 主要职责：为无上下文查询挑选可求和的缓存切片集合：优先显式无上下文记录，否则寻找单一上下文键上的完整 MECE 划分。
 * 使用建议：只有单键上下文切片参与候选；case 维度与多键切片一律不参与。
 */
public final class MeceSliceSelector {
    private static final LocalDate PARSE_ANCHOR = LocalDate.of(2000, 1, 1);

    private final SliceResolver resolver;
    private final ContextRegistry registry;

    public MeceSliceSelector(SliceResolver resolver, ContextRegistry registry) {
        this.resolver = resolver;
        this.registry = registry;
    }

    /**
     * @param candidates records already narrowed to the requested mode
     */
    public MeceSelection select(List<CachedRecord> candidates) {
        Map<String, Map<String, List<CachedRecord>>> byKey = new LinkedHashMap<>();
        Map<String, List<String>> sliceValuesByKey = new LinkedHashMap<>();
        Map<String, List<String>> seenSlicesByKey = new LinkedHashMap<>();
        for (CachedRecord record : candidates) {
            SliceConstraint c;
            try {
                c = resolver.parse(record.sliceDsl, PARSE_ANCHOR);
            } catch (IllegalArgumentException e) {
                continue;
            }
            if (c.isUncontexted()) {
                return MeceSelection.explicitUncontexted();
            }
            if (c.contexts.size() != 1 || !c.contextAny.isEmpty() || !c.cases.isEmpty()) {
                continue;
            }
            ContextPredicate p = c.contexts.get(0);
            byKey.computeIfAbsent(p.key, ignored -> new LinkedHashMap<>())
                    .computeIfAbsent(p.value, ignored -> new ArrayList<>())
                    .add(record);
            // one entry per distinct slice; several records of the same slice are not duplicates
            String sliceId = p.value + "|" + record.signatureOrBlank();
            List<String> seen = seenSlicesByKey.computeIfAbsent(p.key, ignored -> new ArrayList<>());
            if (!seen.contains(sliceId)) {
                seen.add(sliceId);
                sliceValuesByKey.computeIfAbsent(p.key, ignored -> new ArrayList<>()).add(p.value);
            }
        }
        if (byKey.isEmpty()) {
            return MeceSelection.notResolvable(null, "no eligible single-key context slices found to form a MECE partition");
        }

        MecePartition best = null;
        Instant bestRecency = Instant.EPOCH;
        for (Map.Entry<String, Map<String, List<CachedRecord>>> entry : byKey.entrySet()) {
            String key = entry.getKey();
            ContextDefinition def = registry == null ? null : registry.find(key).orElse(null);
            MecePartition partition = MecePartition.detect(key, sliceValuesByKey.get(key), def);
            Instant recency = newest(entry.getValue());
            if (best == null || rank(partition) > rank(best)
                    || (rank(partition) == rank(best) && recency.isAfter(bestRecency))) {
                best = partition;
                bestRecency = recency;
            }
        }
        if (!best.canAggregate) {
            if (best.mece && !best.expectedValues.isEmpty()) {
                return MeceSelection.incomplete(best, byKey.get(best.contextKey));
            }
            return MeceSelection.notResolvable(best, best.describe());
        }
        return MeceSelection.partition(best, byKey.get(best.contextKey));
    }

    private static int rank(MecePartition p) {
        if (p.canAggregate) {
            return 2;
        }
        return p.mece ? 1 : 0;
    }

    private static Instant newest(Map<String, List<CachedRecord>> byValue) {
        Instant out = Instant.EPOCH;
        for (List<CachedRecord> records : byValue.values()) {
            for (CachedRecord r : records) {
                if (r.retrievedAt != null && r.retrievedAt.isAfter(out)) {
                    out = r.retrievedAt;
                }
            }
        }
        return out;
    }
}
