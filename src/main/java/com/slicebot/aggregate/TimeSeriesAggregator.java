package com.slicebot.aggregate;

import com.slicebot.model.CachedRecord;
import com.slicebot.model.ConversionCounts;
import com.slicebot.model.DailyPoint;
import com.slicebot.model.QueryMode;
import com.slicebot.model.TimeBounds;
import com.slicebot.slice.SliceResolver;
import com.slicebot.utils.DslDates;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * 模块说明：TimeSeriesAggregator（class）。
 * 主要职责：把新抓取的日度点合并进参数缓存记录，并提供区间求和、跨切片逐元素求和视图。
 * 使用建议：汇总 n/k 一律由日度数组求和得到，禁止用 mean × n 反推，否则跨切片相加时会产生舍入漂移。
 */
public final class TimeSeriesAggregator {
    private static final Comparator<CachedRecord> OLDEST_FIRST = Comparator.comparing(
            (CachedRecord r) -> r.retrievedAt == null ? Instant.EPOCH : r.retrievedAt);

    private final SliceResolver resolver;

    public TimeSeriesAggregator(SliceResolver resolver) {
        this.resolver = resolver;
    }

    /**
     * Counts of one record restricted to the given range, summed from its daily arrays.
     */
    public ConversionCounts extractRange(CachedRecord record, TimeBounds range) {
        return totals(dailyMap(List.of(record), range));
    }

    /**
     * Day-by-day view over records of the same slice. Where records overlap, the most recently retrieved wins.
     */
    public NavigableMap<LocalDate, DailyPoint> dailyMap(List<CachedRecord> records, TimeBounds range) {
        NavigableMap<LocalDate, DailyPoint> out = new TreeMap<>();
        List<CachedRecord> ordered = new ArrayList<>(records);
        ordered.sort(OLDEST_FIRST);
        for (CachedRecord record : ordered) {
            for (DailyPoint p : record.dailyPoints()) {
                if (range == null || range.contains(p.date)) {
                    out.put(p.date, p);
                }
            }
        }
        return out;
    }

    /**
     * Elementwise sum over several slices' daily views. Every component must be passed already restricted.
     */
    public NavigableMap<LocalDate, DailyPoint> elementwiseSum(List<NavigableMap<LocalDate, DailyPoint>> components) {
        NavigableMap<LocalDate, DailyPoint> out = new TreeMap<>();
        for (NavigableMap<LocalDate, DailyPoint> component : components) {
            for (DailyPoint p : component.values()) {
                DailyPoint prev = out.get(p.date);
                out.put(p.date, prev == null ? p : DailyPoint.of(p.date, prev.n + p.n, prev.k + p.k));
            }
        }
        return out;
    }

    public ConversionCounts totals(Map<LocalDate, DailyPoint> daily) {
        long n = 0L;
        long k = 0L;
        for (DailyPoint p : daily.values()) {
            n += p.n;
            k += p.k;
        }
        return ConversionCounts.of(n, k, daily.size());
    }

    /**
     * Merge fetched points into a parameter's record set. Window data is unioned per date with fresh points
     * winning; cohort data replaces the family's record outright. Records of other families are untouched.
     */
    public List<CachedRecord> merge(List<CachedRecord> existing, MergeRequest request) {
        if (request == null || request.mode == null) {
            throw new IllegalArgumentException("merge requires a mode");
        }
        String family = request.sliceFamily == null ? "" : request.sliceFamily.trim();
        String signature = request.querySignature == null ? "" : request.querySignature.trim();
        List<CachedRecord> kept = new ArrayList<>();
        List<CachedRecord> sameSlice = new ArrayList<>();
        for (CachedRecord record : existing == null ? List.<CachedRecord>of() : existing) {
            boolean same = record.modeOrDefault() == request.mode
                    && family.equals(resolver.familyOf(record.sliceDsl))
                    && signature.equals(record.signatureOrBlank());
            if (same) {
                sameSlice.add(record);
            } else {
                kept.add(record);
            }
        }

        NavigableMap<LocalDate, DailyPoint> dates = request.mode == QueryMode.COHORT
                ? new TreeMap<>()
                : dailyMap(sameSlice, null);
        if (request.fetchedBounds != null) {
            for (LocalDate d : request.fetchedBounds.dates()) {
                dates.put(d, DailyPoint.of(d, 0L, 0L));
            }
        }
        for (DailyPoint p : request.points == null ? List.<DailyPoint>of() : request.points) {
            dates.put(p.date, p);
        }
        if (dates.isEmpty()) {
            return List.copyOf(existing == null ? List.of() : existing);
        }

        TimeBounds header = headerRun(dates, request.fetchedBounds);
        kept.add(buildRecord(dates, header, family, signature, request));
        return List.copyOf(kept);
    }

    public static double mean(long n, long k) {
        if (n <= 0L) {
            return 0.0;
        }
        return BigDecimal.valueOf(k).divide(BigDecimal.valueOf(n), 3, RoundingMode.HALF_UP).doubleValue();
    }

    public static String canonicalSliceDsl(QueryMode mode, String cohortAnchor, TimeBounds header, String family) {
        String range = DslDates.format(header.start) + ":" + DslDates.format(header.end);
        String time;
        if (mode == QueryMode.COHORT) {
            boolean anchored = cohortAnchor != null && !cohortAnchor.trim().isEmpty();
            time = "cohort(" + (anchored ? cohortAnchor.trim() + "," : "") + range + ")";
        } else {
            time = "window(" + range + ")";
        }
        return family == null || family.isEmpty() ? time : time + "." + family;
    }

    // The header must only claim days that are actually present, so it spans the contiguous run of
    // dates around the fetched window rather than the full min..max.
    private TimeBounds headerRun(NavigableMap<LocalDate, DailyPoint> dates, TimeBounds fetchedBounds) {
        LocalDate seed = fetchedBounds != null ? fetchedBounds.end : dates.lastKey();
        LocalDate start = seed;
        while (dates.containsKey(start.minusDays(1))) {
            start = start.minusDays(1);
        }
        LocalDate end = seed;
        while (dates.containsKey(end.plusDays(1))) {
            end = end.plusDays(1);
        }
        return TimeBounds.of(start, end);
    }

    private CachedRecord buildRecord(
            NavigableMap<LocalDate, DailyPoint> dates,
            TimeBounds header,
            String family,
            String signature,
            MergeRequest request
    ) {
        List<LocalDate> dayList = new ArrayList<>(dates.size());
        List<Long> nDaily = new ArrayList<>(dates.size());
        List<Long> kDaily = new ArrayList<>(dates.size());
        long n = 0L;
        long k = 0L;
        for (DailyPoint p : dates.values()) {
            dayList.add(p.date);
            nDaily.add(p.n);
            kDaily.add(p.k);
            n += p.n;
            k += p.k;
        }
        return CachedRecord.builder()
                .windowFrom(header.start)
                .windowTo(header.end)
                .n(n)
                .k(k)
                .dates(List.copyOf(dayList))
                .nDaily(List.copyOf(nDaily))
                .kDaily(List.copyOf(kDaily))
                .sliceDsl(canonicalSliceDsl(request.mode, request.cohortAnchor, header, family))
                .querySignature(signature)
                .mode(request.mode)
                .retrievedAt(request.retrievedAt)
                .build();
    }
}
