package com.slicebot.coverage;

import com.slicebot.aggregate.TimeSeriesAggregator;
import com.slicebot.core.diagnostics.CauseCode;
import com.slicebot.core.diagnostics.Outcome;
import com.slicebot.model.CachedRecord;
import com.slicebot.model.Classification;
import com.slicebot.model.ContextPredicate;
import com.slicebot.model.ConversionCounts;
import com.slicebot.model.DailyPoint;
import com.slicebot.model.FetchWindow;
import com.slicebot.model.SliceConstraint;
import com.slicebot.model.TimeBounds;
import com.slicebot.model.WindowReason;
import com.slicebot.slice.SliceResolver;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Set;
import java.util.TreeSet;

/**
 * 模块说明：CoverageAnalyzer（class）。
 * 主要职责：判断请求切片是否已被缓存完整覆盖，并计算最小的缺失日期窗口；
 * 支持单值切片、contextAny 多值求和以及无上下文查询下的 MECE 划分求和。
 * 使用建议：覆盖判断以记录头部窗口为准，缺口计算以日度数组为准；两者不一致时以头部为准判定 covered。
 */
public final class CoverageAnalyzer {
    private static final String OWNER = "coverage";
    static final String INCOMPLETE_PARTITION = "incomplete_partition";

    private final SliceResolver resolver;
    private final MeceSliceSelector meceSelector;
    private final StalenessPolicy staleness;
    private final TimeSeriesAggregator aggregator;

    public CoverageAnalyzer(
            SliceResolver resolver,
            ContextRegistry registry,
            StalenessPolicy staleness,
            TimeSeriesAggregator aggregator
    ) {
        this.resolver = resolver;
        this.meceSelector = new MeceSliceSelector(resolver, registry);
        this.staleness = staleness == null ? StalenessPolicy.NEVER : staleness;
        this.aggregator = aggregator;
    }

    public CoverageResult analyze(CoverageRequest request, List<CachedRecord> records) {
        TimeBounds bounds = request.bounds();
        if (bounds == null) {
            throw new IllegalArgumentException("coverage request needs time bounds");
        }
        SliceConstraint constraint = request.constraint;
        List<CachedRecord> modeRecords = new ArrayList<>();
        for (CachedRecord r : records == null ? List.<CachedRecord>of() : records) {
            if (r.modeOrDefault() == constraint.mode) {
                modeRecords.add(r);
            }
        }
        List<String> notes = new ArrayList<>();

        if (request.bustCache) {
            notes.add("bust_cache: all requested days treated as missing");
            List<ComponentCoverage> components = new ArrayList<>();
            for (SliceConstraint member : constraint.expandContextAny()) {
                components.add(missingEverything(member, request.signaturesOrUnsigned(), bounds));
            }
            return combine(request, CoverageResult.Selection.NONE, components, false, notes);
        }

        if (!constraint.contextAny.isEmpty()) {
            List<ComponentCoverage> components = new ArrayList<>();
            for (SliceConstraint member : constraint.expandContextAny()) {
                components.add(evaluate(member, request.signaturesOrUnsigned(), modeRecords, bounds));
            }
            return combine(request, CoverageResult.Selection.CONTEXT_ANY, components, false, notes);
        }

        ComponentCoverage direct = evaluate(constraint, request.signaturesOrUnsigned(), modeRecords, bounds);
        if (!constraint.isUncontexted() || !direct.matchingRecords.isEmpty()) {
            return combine(request, CoverageResult.Selection.DIRECT, List.of(direct), false, notes);
        }

        List<CachedRecord> contexted = signedContextedRecords(constraint, request.signaturesOrUnsigned(), modeRecords);
        if (contexted.isEmpty()) {
            notes.add("no cached slices for this mode");
            return combine(request, CoverageResult.Selection.DIRECT, List.of(direct), false, notes);
        }
        MeceSelection selection = meceSelector.select(contexted);
        if (selection.kind == MeceSelection.Kind.MECE_PARTITION
                || selection.kind == MeceSelection.Kind.INCOMPLETE_PARTITION) {
            if (selection.kind == MeceSelection.Kind.MECE_PARTITION) {
                notes.add("implicit uncontexted via " + selection.reason);
            } else {
                // missing members are fetched on their own, the partition completes once they land
                notes.add(INCOMPLETE_PARTITION + ": " + selection.reason);
            }
            List<ComponentCoverage> components = new ArrayList<>();
            for (String value : selection.partition.expectedValues) {
                SliceConstraint member = constraint.withExtraContext(
                        ContextPredicate.of(selection.partition.contextKey, value));
                components.add(evaluate(member, request.signaturesOrUnsigned(), modeRecords, bounds));
            }
            return combine(request, CoverageResult.Selection.MECE_PARTITION, components, false, notes);
        }
        notes.add(CauseCode.MECE_AGGREGATION_ERROR.label() + ": " + selection.reason);
        return combine(request, CoverageResult.Selection.DIRECT, List.of(direct), true, notes);
    }

    /**
     * Aggregated n/k for the request, summed from daily arrays of every contributing slice.
     * Fails with MECE_AGGREGATION_ERROR when an uncontexted total cannot be reconstructed, and with
     * DATA_GAP when any requested day is missing.
     */
    public Outcome<ConversionCounts> resolveCounts(CoverageRequest request, List<CachedRecord> records) {
        CoverageResult result = analyze(request.toBuilder().bustCache(false).build(), records);
        String family = request.constraint.sliceFamily();
        if (result.meceAggregationError) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("slice", family);
            details.put("reason", String.join("; ", result.notes));
            return Outcome.failure(CauseCode.MECE_AGGREGATION_ERROR, OWNER, details);
        }
        if (result.missingDays > 0) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("slice", family);
            details.put("missing_days", result.missingDays);
            details.put("gaps", result.gapCount());
            return Outcome.failure(CauseCode.DATA_GAP, OWNER, details);
        }
        TimeBounds bounds = request.bounds();
        ConversionCounts total = ConversionCounts.ZERO;
        for (ComponentCoverage component : result.components) {
            total = total.plus(componentCounts(component, bounds));
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("selection", result.selection.name());
        details.put("components", result.components.size());
        return Outcome.success(total, OWNER, details);
    }

    private ConversionCounts componentCounts(ComponentCoverage component, TimeBounds bounds) {
        NavigableMap<LocalDate, DailyPoint> daily = aggregator.dailyMap(component.matchingRecords, bounds);
        if (daily.isEmpty()) {
            for (CachedRecord r : component.matchingRecords) {
                if (!r.hasDailyData() && bounds.equals(r.header())) {
                    return ConversionCounts.of(r.n, r.k, bounds.dayCount());
                }
            }
        }
        return aggregator.totals(daily);
    }

    private ComponentCoverage evaluate(
            SliceConstraint slice,
            SignatureScheme signatures,
            List<CachedRecord> modeRecords,
            TimeBounds bounds
    ) {
        String family = slice.sliceFamily();
        String signature = blank(signatures.signatureFor(slice));
        List<CachedRecord> matching = new ArrayList<>();
        for (CachedRecord r : modeRecords) {
            if (family.equals(resolver.familyOf(r.sliceDsl)) && signatureMatches(signature, r)) {
                matching.add(r);
            }
        }
        for (CachedRecord r : matching) {
            TimeBounds header = r.header();
            if (header != null && header.covers(bounds)) {
                return new ComponentCoverage(slice, signature, true, matching, Set.of(), List.of());
            }
        }
        Set<LocalDate> existing = new HashSet<>();
        for (CachedRecord r : matching) {
            if (r.hasDailyData()) {
                for (DailyPoint p : r.dailyPoints()) {
                    existing.add(p.date);
                }
            } else if (r.header() != null) {
                existing.addAll(r.header().dates());
            }
        }
        Set<LocalDate> missing = new TreeSet<>();
        for (LocalDate d : bounds.dates()) {
            if (!existing.contains(d)) {
                missing.add(d);
            }
        }
        return new ComponentCoverage(slice, signature, missing.isEmpty(), matching, missing,
                FetchWindow.mergeDates(missing, WindowReason.MISSING));
    }

    private ComponentCoverage missingEverything(SliceConstraint slice, SignatureScheme signatures, TimeBounds bounds) {
        Set<LocalDate> missing = new TreeSet<>(bounds.dates());
        return new ComponentCoverage(slice, blank(signatures.signatureFor(slice)), false, List.of(),
                missing, FetchWindow.mergeDates(missing, WindowReason.MISSING));
    }

    private List<CachedRecord> signedContextedRecords(
            SliceConstraint uncontexted,
            SignatureScheme signatures,
            List<CachedRecord> modeRecords
    ) {
        List<CachedRecord> out = new ArrayList<>();
        for (CachedRecord r : modeRecords) {
            SliceConstraint parsed;
            try {
                parsed = resolver.parse(r.sliceDsl, LocalDate.of(2000, 1, 1));
            } catch (IllegalArgumentException e) {
                continue;
            }
            if (parsed.contexts.size() != 1 || !parsed.contextAny.isEmpty() || !parsed.cases.isEmpty()) {
                continue;
            }
            String expected = blank(signatures.signatureFor(uncontexted.withExtraContext(parsed.contexts.get(0))));
            if (signatureMatches(expected, r)) {
                out.add(r);
            }
        }
        return out;
    }

    private CoverageResult combine(
            CoverageRequest request,
            CoverageResult.Selection selection,
            List<ComponentCoverage> components,
            boolean meceError,
            List<String> notes
    ) {
        TimeBounds bounds = request.bounds();
        Set<LocalDate> missing = new TreeSet<>();
        Set<LocalDate> stale = new TreeSet<>();
        List<ComponentCoverage> withStale = new ArrayList<>(components.size());
        for (ComponentCoverage c : components) {
            missing.addAll(c.missingDates);
            Set<LocalDate> ownStale = new TreeSet<>();
            if (!c.matchingRecords.isEmpty()) {
                for (LocalDate d : staleness.staleDates(c.matchingRecords, bounds, request.referenceNow)) {
                    if (bounds.contains(d) && !c.missingDates.contains(d)) {
                        ownStale.add(d);
                    }
                }
            }
            stale.addAll(ownStale);
            if (ownStale.isEmpty()) {
                withStale.add(c);
            } else {
                List<FetchWindow> own = new ArrayList<>(c.windows);
                own.addAll(FetchWindow.mergeDates(ownStale, WindowReason.STALE));
                withStale.add(c.withWindows(own));
            }
        }
        stale.removeAll(missing);
        List<FetchWindow> windows = new ArrayList<>(FetchWindow.mergeDates(missing, WindowReason.MISSING));
        windows.addAll(FetchWindow.mergeDates(stale, WindowReason.STALE));
        Classification classification = windows.isEmpty() ? Classification.COVERED : Classification.FETCH;
        return new CoverageResult(classification, selection, windows, missing.size(), stale.size(), withStale,
                meceError, notes);
    }

    private static boolean signatureMatches(String expected, CachedRecord record) {
        return expected.isEmpty() || expected.equals(record.signatureOrBlank());
    }

    private static String blank(String value) {
        return value == null ? "" : value.trim();
    }
}
