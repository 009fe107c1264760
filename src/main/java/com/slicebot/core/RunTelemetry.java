package com.slicebot.core;

import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Step timings and counters for one retrieval run, rendered as a key=value summary.
 */
public final class RunTelemetry {
    public static final String STEP_PLAN = "PLAN";
    public static final String STEP_FETCH = "FETCH";
    public static final String STEP_MERGE = "MERGE";
    public static final String STEP_COOLDOWN = "COOLDOWN";
    public static final String STEP_HORIZON = "HORIZON";

    private static final DateTimeFormatter ISO = DateTimeFormatter.ISO_INSTANT;

    private final String runMode;
    private final Instant startedAt;
    private Instant finishedAt;

    private int slices;
    private int items;
    private int apiFetches;
    private int cacheHits;
    private long daysFetched;
    private int errorsTotal;
    private boolean aborted;

    private final Map<String, StepStat> steps = new LinkedHashMap<>();
    private final Map<String, Deque<Long>> stepStartsNanos = new HashMap<>();

    public RunTelemetry(String runMode, Instant startedAt) {
        String mode = runMode == null ? "" : runMode.trim();
        this.runMode = mode.isEmpty() ? "MANUAL" : mode;
        this.startedAt = startedAt == null ? Instant.now() : startedAt;
    }

    public synchronized String runMode() {
        return runMode;
    }

    public synchronized void startStep(String name) {
        String key = sanitizeStepName(name);
        steps.putIfAbsent(key, new StepStat(key));
        stepStartsNanos.computeIfAbsent(key, ignored -> new ArrayDeque<>()).push(System.nanoTime());
    }

    public synchronized void endStep(String name, long itemsIn, long itemsOut, long errorCount) {
        endStep(name, itemsIn, itemsOut, errorCount, "");
    }

    public synchronized void endStep(String name, long itemsIn, long itemsOut, long errorCount, String note) {
        String key = sanitizeStepName(name);
        StepStat stat = steps.computeIfAbsent(key, StepStat::new);
        long startedNanos = 0L;
        Deque<Long> stack = stepStartsNanos.get(key);
        if (stack != null && !stack.isEmpty()) {
            startedNanos = stack.pop();
        }
        stat.elapsedMs += startedNanos <= 0L ? 0L : Math.max(0L, (System.nanoTime() - startedNanos) / 1_000_000L);
        stat.calls++;
        stat.itemsIn += Math.max(0L, itemsIn);
        stat.itemsOut += Math.max(0L, itemsOut);
        stat.errorCount += Math.max(0L, errorCount);
        String trimmed = note == null ? "" : note.trim();
        if (!trimmed.isEmpty() && !stat.note.contains(trimmed)) {
            stat.note = stat.note.isEmpty() ? trimmed : stat.note + "; " + trimmed;
        }
    }

    public synchronized void recordTotals(
            int slices,
            int items,
            int apiFetches,
            int cacheHits,
            long daysFetched,
            int errors,
            boolean aborted
    ) {
        this.slices = Math.max(0, slices);
        this.items = Math.max(0, items);
        this.apiFetches = Math.max(0, apiFetches);
        this.cacheHits = Math.max(0, cacheHits);
        this.daysFetched = Math.max(0L, daysFetched);
        this.errorsTotal = Math.max(0, errors);
        this.aborted = aborted;
    }

    public synchronized void finish(Instant at) {
        if (finishedAt == null) {
            finishedAt = at == null ? Instant.now() : at;
        }
    }

    public synchronized Instant finishedAt() {
        return finishedAt;
    }

    public synchronized List<StepRecord> stepRecords() {
        List<StepRecord> out = new ArrayList<>();
        for (StepStat stat : steps.values()) {
            out.add(new StepRecord(stat.name, stat.calls, stat.elapsedMs, stat.itemsIn, stat.itemsOut,
                    stat.errorCount, stat.note));
        }
        return out;
    }

    public synchronized String getSummary() {
        Instant end = finishedAt == null ? Instant.now() : finishedAt;
        StringBuilder sb = new StringBuilder();
        sb.append("run_mode=").append(runMode).append('\n');
        sb.append("started_at=").append(ISO.format(startedAt)).append('\n');
        sb.append("finished_at=").append(ISO.format(end)).append('\n');
        sb.append("total_elapsed_ms=").append(Math.max(0L, Duration.between(startedAt, end).toMillis())).append('\n');
        sb.append("slices=").append(slices).append('\n');
        sb.append("items=").append(items).append('\n');
        sb.append("api_fetches=").append(apiFetches).append('\n');
        sb.append("cache_hits=").append(cacheHits).append('\n');
        sb.append("days_fetched=").append(daysFetched).append('\n');
        sb.append("errors_total=").append(errorsTotal).append('\n');
        sb.append("aborted=").append(aborted).append('\n');
        sb.append("steps:\n");
        for (StepStat stat : steps.values()) {
            sb.append(String.format(
                    Locale.US,
                    "  %s calls=%d elapsed_ms=%d in=%d out=%d err=%d",
                    stat.name,
                    stat.calls,
                    stat.elapsedMs,
                    stat.itemsIn,
                    stat.itemsOut,
                    stat.errorCount
            ));
            if (!stat.note.isEmpty()) {
                sb.append(" note=").append(stat.note);
            }
            sb.append('\n');
        }
        return sb.toString().trim();
    }

    private String sanitizeStepName(String name) {
        String step = name == null ? "" : name.trim();
        return step.isEmpty() ? "UNKNOWN_STEP" : step.toUpperCase(Locale.ROOT);
    }

    private static final class StepStat {
        private final String name;
        private long calls;
        private long elapsedMs;
        private long itemsIn;
        private long itemsOut;
        private long errorCount;
        private String note = "";

        private StepStat(String name) {
            this.name = name;
        }
    }

    public record StepRecord(
            String name,
            long calls,
            long elapsedMs,
            long itemsIn,
            long itemsOut,
            long errorCount,
            String note
    ) {
    }
}
