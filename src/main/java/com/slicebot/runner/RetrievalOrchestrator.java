package com.slicebot.runner;

import com.slicebot.aggregate.MergeRequest;
import com.slicebot.aggregate.TimeSeriesAggregator;
import com.slicebot.config.Config;
import com.slicebot.core.RunTelemetry;
import com.slicebot.core.Sleeper;
import com.slicebot.core.diagnostics.CauseCode;
import com.slicebot.data.RateLimiter;
import com.slicebot.model.CachedRecord;
import com.slicebot.model.Classification;
import com.slicebot.model.FetchComponent;
import com.slicebot.model.FetchPlan;
import com.slicebot.model.FetchPlanItem;
import com.slicebot.model.FetchWindow;
import com.slicebot.model.PlanSummary;
import com.slicebot.model.SliceConstraint;
import com.slicebot.model.WindowReason;
import com.slicebot.plan.FetchPlanBuilder;
import com.slicebot.plan.FetchPlanResult;
import com.slicebot.plan.PlanOptions;
import com.slicebot.slice.SliceExploder;
import com.slicebot.storage.CachedRecordStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 模块说明：RetrievalOrchestrator（class）。
 * 主要职责：按切片顺序构建抓取计划并逐项执行；同一检索作用域（对象、切片族、签名、模式）在一次运行内
 * 共享批次时间戳；限流错误在自动模式下进入可取消冷却并仅对该作用域强制刷新缓存，手动模式下立即中止。
 * 使用建议：执行严格串行；单项失败只计数不中断，只有中止信号或手动模式限流会提前结束运行。
 */
public final class RetrievalOrchestrator {
    private static final Logger LOG = LogManager.getLogger(RetrievalOrchestrator.class);

    private final SliceExploder exploder;
    private final FetchPlanBuilder planBuilder;
    private final TimeSeriesAggregator aggregator;
    private final CachedRecordStore store;
    private final FetchExecutor executor;
    private final RateLimiter rateLimiter;
    private final SuccessMarkerStore successMarker;
    private final HorizonRecomputer horizon;
    private final RunLock runLock;
    private final CooldownTimer cooldownTimer;
    private final Clock clock;

    private final long cooldownMs;
    private final int maxCooldownRetries;
    private final String lockName;

    private volatile RunTelemetry lastTelemetry;

    public RetrievalOrchestrator(
            Config config,
            SliceExploder exploder,
            FetchPlanBuilder planBuilder,
            TimeSeriesAggregator aggregator,
            CachedRecordStore store,
            FetchExecutor executor,
            RateLimiter rateLimiter,
            SuccessMarkerStore successMarker,
            HorizonRecomputer horizon,
            RunLock runLock,
            Sleeper sleeper,
            Clock clock
    ) {
        this.exploder = exploder;
        this.planBuilder = planBuilder;
        this.aggregator = aggregator;
        this.store = store;
        this.executor = executor;
        this.rateLimiter = rateLimiter;
        this.successMarker = successMarker;
        this.horizon = horizon == null ? HorizonRecomputer.NONE : horizon;
        this.runLock = runLock;
        this.cooldownTimer = new CooldownTimer(sleeper, config.getLong("retrieve.cooldown_poll_ms", 1000L));
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.cooldownMs = Math.max(0L, Math.round(config.getDouble("retrieve.cooldown_minutes", 61.0) * 60_000.0));
        this.maxCooldownRetries = Math.max(0, config.getInt("retrieve.max_cooldown_retries", 3));
        this.lockName = config.getString("retrieve.lock_name", "retrieve_all_slices");
    }

    public RetrievalResult execute(RetrievalOptions options) {
        if (options == null || options.graph == null) {
            throw new IllegalArgumentException("retrieval needs a graph");
        }
        if (!options.simulate && executor == null) {
            throw new IllegalStateException("live retrieval needs a FetchExecutor");
        }
        Instant referenceNow = options.referenceNow != null ? options.referenceNow : clock.instant();
        List<String> slices = exploder.explode(options.pinnedDsl);
        RunTelemetry telemetry = new RunTelemetry(runMode(options), clock.instant());
        lastTelemetry = telemetry;
        Run run = new Run(options, referenceNow, telemetry, new RetrievalBatch(clock));
        LOG.info("retrieve start mode={} slices={} reference_now={} bust_cache={}",
                telemetry.runMode(), slices.size(), referenceNow, options.bustCache);

        String owner = lockName + "@" + ProcessHandle.current().pid();
        if (runLock != null && !runLock.tryAcquire(owner)) {
            LOG.warn("retrieve skipped: lock {} is held by another run", lockName);
            run.abort(CauseCode.LOCK_UNAVAILABLE.label());
            run.remainingSlices = slices.size();
            return finish(run, slices.size());
        }
        try {
            for (int i = 0; i < slices.size(); i++) {
                if (options.abortRequested()) {
                    run.abort(CauseCode.ABORTED.label());
                }
                if (run.aborted) {
                    run.remainingSlices = slices.size() - i;
                    break;
                }
                runSlice(run, i, slices.size(), slices.get(i));
                if (run.aborted) {
                    run.remainingSlices = slices.size() - i - 1;
                    break;
                }
            }
            return finish(run, slices.size());
        } finally {
            if (runLock != null) {
                runLock.release(owner);
            }
        }
    }

    public RunTelemetry lastTelemetry() {
        return lastTelemetry;
    }

    private void runSlice(Run run, int sliceIndex, int sliceCount, String dsl) {
        RetrievalOptions options = run.options;
        SliceCounter slice = new SliceCounter(dsl);
        run.telemetry.startStep(RunTelemetry.STEP_PLAN);
        FetchPlanResult planned;
        try {
            planned = planBuilder.build(options.graph, dsl, options.window,
                    new PlanOptions(run.referenceNow, null, options.bustCache));
        } catch (IllegalArgumentException | IllegalStateException e) {
            // an invalid slice or an unreadable store fails this slice only
            run.telemetry.endStep(RunTelemetry.STEP_PLAN, 1, 0, 1,
                    e instanceof IllegalArgumentException ? "invalid slice" : "store unavailable");
            LOG.error("slice {}/{} plan failed slice={} error={}", sliceIndex + 1, sliceCount, dsl, e.getMessage(), e);
            slice.errors++;
            run.errors++;
            run.sliceStats.add(slice.freeze(true));
            return;
        }
        FetchPlan plan = planned.plan;
        PlanSummary summary = plan.summarise();
        run.telemetry.endStep(RunTelemetry.STEP_PLAN, 1, plan.items.size(), 0);
        LOG.info("slice {}/{} planned slice={} items={} covered={} fetch={} unfetchable={} fetch_days={}",
                sliceIndex + 1, sliceCount, dsl, plan.items.size(), summary.coveredItems, summary.fetchItems,
                summary.unfetchableItems, summary.totalFetchDays);

        List<FetchPlanItem> items = plan.items;
        for (int idx = 0; idx < items.size(); idx++) {
            if (options.abortRequested()) {
                run.abort(CauseCode.ABORTED.label());
            }
            if (run.aborted) {
                run.remainingItems += countFetch(items, idx);
                break;
            }
            FetchPlanItem item = items.get(idx);
            run.items++;
            slice.items++;
            emit(run, RetrievalProgress.Type.BEFORE_ITEM, sliceIndex, sliceCount, dsl, item, 0L);
            if (item.classification == Classification.COVERED) {
                run.cacheHits++;
                run.success++;
                slice.cacheHits++;
                slice.success++;
                run.decide(dsl, item, ItemDecision.Action.CACHE_HIT, "covered by cache");
            } else if (item.classification == Classification.UNFETCHABLE) {
                skip(run, slice, dsl, item);
            } else {
                fetch(run, slice, sliceIndex, sliceCount, dsl, planned.constraint, item);
            }
            emit(run, RetrievalProgress.Type.AFTER_ITEM, sliceIndex, sliceCount, dsl, item, 0L);
            if (run.aborted) {
                run.remainingItems += countFetch(items, idx + 1);
                break;
            }
        }
        run.sliceStats.add(slice.freeze(!run.aborted));
        LOG.info("slice {}/{} done slice={} success={} errors={} cache_hits={} api_fetches={} days_fetched={}",
                sliceIndex + 1, sliceCount, dsl, slice.success, slice.errors, slice.cacheHits, slice.apiFetches,
                slice.daysFetched);
    }

    private void skip(Run run, SliceCounter slice, String dsl, FetchPlanItem item) {
        slice.skipped++;
        String reason = item.unfetchableReason == null ? "unfetchable" : item.unfetchableReason.label();
        if (item.unfetchableReason != null && item.unfetchableReason.isEventIdReason()) {
            LOG.info("skip item={} reason={} connection={} (endpoint event ids missing)",
                    item.itemKey.display(), reason, item.connection);
        } else {
            LOG.debug("skip item={} reason={}", item.itemKey.display(), reason);
        }
        run.decide(dsl, item, ItemDecision.Action.SKIPPED, reason);
    }

    private void fetch(
            Run run,
            SliceCounter slice,
            int sliceIndex,
            int sliceCount,
            String dsl,
            SliceConstraint constraint,
            FetchPlanItem item
    ) {
        ItemTally tally = new ItemTally();
        for (FetchComponent component : item.componentsOr(constraint)) {
            if (!fetchComponent(run, slice, sliceIndex, sliceCount, dsl, item, component, tally)) {
                return;
            }
        }
        run.success++;
        slice.success++;
        ItemDecision.Action action;
        if (run.options.simulate) {
            action = ItemDecision.Action.SIMULATED;
        } else if (tally.fetched) {
            action = ItemDecision.Action.FETCHED;
        } else {
            action = ItemDecision.Action.CACHE_HIT;
            run.cacheHits++;
            slice.cacheHits++;
        }
        run.decide(dsl, item, action, String.join("; ", tally.details));
    }

    /**
     * Fetch one component with its own batch scope, rate-limit handling and merge. Returns false when the
     * item has failed or the run was aborted; the outcome is already booked in that case.
     */
    private boolean fetchComponent(
            Run run,
            SliceCounter slice,
            int sliceIndex,
            int sliceCount,
            String dsl,
            FetchPlanItem item,
            FetchComponent component,
            ItemTally tally
    ) {
        RetrievalOptions options = run.options;
        SliceConstraint constraint = component.constraint;
        RetrievalScope scope = RetrievalScope.of(item, component);
        RetrievalBatch.Entry entry = run.batch.resolve(scope);
        String provider = RateLimiter.normalizeProvider(item.connection);
        int cooldowns = 0;
        while (true) {
            boolean bust = options.bustCache || entry.forcedBustCache;
            List<FetchWindow> windows = bust
                    ? List.of(FetchWindow.of(constraint.bounds.start, constraint.bounds.end, WindowReason.MISSING))
                    : component.windows;
            FetchRequest request = FetchRequest.builder()
                    .item(item)
                    .component(component)
                    .sliceDsl(dsl)
                    .constraint(constraint)
                    .windows(windows)
                    .bustCache(bust)
                    .dryRun(options.simulate)
                    .batchTimestamp(entry.batchTimestamp)
                    .build();

            if (options.simulate && executor == null) {
                tally.details.add(String.format(
                        Locale.US, "would fetch %s %d day(s) in %d window(s) batch=%s bust=%s",
                        label(component), FetchWindow.totalDays(windows), windows.size(), entry.batchTimestamp, bust));
                return true;
            }

            FetchExecution execution = null;
            String error;
            run.telemetry.startStep(RunTelemetry.STEP_FETCH);
            try {
                if (!options.simulate) {
                    rateLimiter.waitForRateLimit(provider);
                }
                execution = executor.execute(request);
                if (execution == null) {
                    error = "executor returned no result";
                } else {
                    error = execution.success ? "" : blankTo(execution.error, "fetch failed");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                run.telemetry.endStep(RunTelemetry.STEP_FETCH, 1, 0, 1, "interrupted");
                run.errors++;
                slice.errors++;
                run.abort("interrupted");
                run.decide(dsl, item, ItemDecision.Action.ABORTED, "interrupted while fetching");
                return false;
            } catch (Exception e) {
                error = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            }
            run.telemetry.endStep(RunTelemetry.STEP_FETCH, 1, error.isEmpty() ? 1 : 0, error.isEmpty() ? 0 : 1);

            if (error.isEmpty()) {
                error = complete(run, slice, item, component, execution, scope, entry, provider, tally);
                if (error.isEmpty()) {
                    return true;
                }
                fail(run, slice, dsl, item, CauseCode.EXECUTION_ERROR, error);
                return false;
            }
            if (!RateLimiter.isRateLimitError(error)) {
                fail(run, slice, dsl, item, CauseCode.EXECUTION_ERROR, error);
                return false;
            }
            rateLimiter.reportRateLimitError(provider, error, execution == null ? null : execution.retryAfter);
            if (!options.automated) {
                fail(run, slice, dsl, item, CauseCode.RATE_LIMIT, error);
                run.abort(CauseCode.RATE_LIMIT.label());
                LOG.error("rate limited in manual run, aborting item={} error={}", item.itemKey.display(), error);
                return false;
            }
            if (cooldowns >= maxCooldownRetries) {
                fail(run, slice, dsl, item, CauseCode.RATE_LIMIT,
                        "still rate limited after " + cooldowns + " cooldown(s): " + error);
                return false;
            }
            long waitMs = options.cooldownMillis != null ? Math.max(0L, options.cooldownMillis) : cooldownMs;
            emit(run, RetrievalProgress.Type.COOLDOWN, sliceIndex, sliceCount, dsl, item, waitMs);
            LOG.warn("rate limited item={} component={} provider={}; cooling down {} ms before retry {}",
                    item.itemKey.display(), label(component), provider, waitMs, cooldowns + 1);
            run.telemetry.startStep(RunTelemetry.STEP_COOLDOWN);
            boolean completed;
            try {
                completed = cooldownTimer.await(waitMs, options::abortRequested);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                completed = false;
            }
            run.telemetry.endStep(RunTelemetry.STEP_COOLDOWN, 1, completed ? 1 : 0, 0);
            if (!completed) {
                run.errors++;
                slice.errors++;
                run.abort(CauseCode.ABORTED.label());
                run.decide(dsl, item, ItemDecision.Action.ABORTED, "aborted during cooldown");
                LOG.warn("cooldown aborted item={}", item.itemKey.display());
                return false;
            }
            entry = run.batch.invalidate(scope);
            cooldowns++;
            run.decide(dsl, item, ItemDecision.Action.RETRIED,
                    "cooldown " + cooldowns + " done, new batch=" + entry.batchTimestamp + " bust=true");
        }
    }

    /**
     * Book a successful execution: merge into the store once, clear the scope's forced bust.
     * Returns an error message when the merge could not be persisted, else an empty string.
     */
    private String complete(
            Run run,
            SliceCounter slice,
            FetchPlanItem item,
            FetchComponent component,
            FetchExecution execution,
            RetrievalScope scope,
            RetrievalBatch.Entry entry,
            String provider,
            ItemTally tally
    ) {
        boolean dryRun = run.options.simulate;
        if (!dryRun) {
            rateLimiter.reportSuccess(provider);
            if (!execution.series.isEmpty()) {
                run.telemetry.startStep(RunTelemetry.STEP_MERGE);
                try {
                    int stored = mergeIntoStore(item, component, execution);
                    run.telemetry.endStep(RunTelemetry.STEP_MERGE, execution.series.size(), stored, 0);
                } catch (IllegalStateException | IllegalArgumentException e) {
                    run.telemetry.endStep(RunTelemetry.STEP_MERGE, execution.series.size(), 0, 1);
                    return "merge failed: " + e.getMessage();
                }
            }
        }
        if (entry.forcedBustCache) {
            run.batch.clearForced(scope);
        }
        if (!dryRun && !execution.cacheHit) {
            tally.fetched = true;
            run.apiFetches++;
            slice.apiFetches++;
            run.daysFetched += execution.daysFetched;
            slice.daysFetched += execution.daysFetched;
        }
        tally.details.add(String.format(Locale.US, "%s days_fetched=%d days_from_cache=%d batch=%s",
                label(component), execution.daysFetched, execution.daysFromCache, entry.batchTimestamp));
        return "";
    }

    private int mergeIntoStore(FetchPlanItem item, FetchComponent component, FetchExecution execution) {
        List<CachedRecord> records = store.load(item.objectId());
        Instant retrievedAt = clock.instant();
        for (FetchedSeries series : execution.series) {
            records = aggregator.merge(records, MergeRequest.builder()
                    .sliceFamily(blankTo(series.sliceFamily, component.sliceFamily))
                    .querySignature(blankTo(series.querySignature, component.querySignature))
                    .mode(item.mode)
                    .cohortAnchor(component.constraint.cohortAnchor)
                    .fetchedBounds(series.bounds)
                    .points(series.points)
                    .retrievedAt(retrievedAt)
                    .build());
        }
        store.replace(item.objectId(), records);
        return records.size();
    }

    private void fail(Run run, SliceCounter slice, String dsl, FetchPlanItem item, CauseCode cause, String error) {
        run.errors++;
        slice.errors++;
        LOG.warn("item failed item={} cause={} error={}", item.itemKey.display(), cause.label(), error);
        run.decide(dsl, item, ItemDecision.Action.FAILED, cause.label() + ": " + error);
    }

    private RetrievalResult finish(Run run, int sliceCount) {
        RetrievalOptions options = run.options;
        boolean markerWritten = false;
        if (!options.simulate && run.isClean() && successMarker != null) {
            Instant finishedAt = clock.instant();
            try {
                successMarker.markSuccess(finishedAt);
                markerWritten = true;
                LOG.info("success marker written at {}", finishedAt);
            } catch (IllegalStateException e) {
                LOG.error("success marker write failed: {}", e.getMessage(), e);
            }
        }
        if (!options.simulate && !run.aborted) {
            run.telemetry.startStep(RunTelemetry.STEP_HORIZON);
            try {
                horizon.recompute(options.graph, run.referenceNow);
                run.telemetry.endStep(RunTelemetry.STEP_HORIZON, 1, 1, 0);
            } catch (Exception e) {
                run.telemetry.endStep(RunTelemetry.STEP_HORIZON, 1, 0, 1, e.getClass().getSimpleName());
                LOG.warn("horizon recompute failed, run result unchanged: {}", e.getMessage());
            }
        }
        Instant finishedAt = clock.instant();
        run.telemetry.recordTotals(sliceCount, run.items, run.apiFetches, run.cacheHits, run.daysFetched,
                run.errors, run.aborted);
        run.telemetry.finish(finishedAt);
        LOG.info("retrieve finished\n{}", run.telemetry.getSummary());
        if (run.aborted) {
            LOG.warn("retrieve aborted reason={} remaining_slices={} remaining_items={}",
                    run.abortReason, run.remainingSlices, run.remainingItems);
        }
        return RetrievalResult.builder()
                .totalSlices(sliceCount)
                .totalItems(run.items)
                .totalSuccess(run.success)
                .totalErrors(run.errors)
                .aborted(run.aborted)
                .abortReason(run.abortReason)
                .totalCacheHits(run.cacheHits)
                .totalApiFetches(run.apiFetches)
                .totalDaysFetched(run.daysFetched)
                .remainingSlices(run.remainingSlices)
                .remainingItems(run.remainingItems)
                .simulated(options.simulate)
                .successMarkerWritten(markerWritten)
                .referenceNow(run.referenceNow)
                .finishedAt(finishedAt)
                .sliceStats(List.copyOf(run.sliceStats))
                .decisions(List.copyOf(run.decisions))
                .build();
    }

    private void emit(
            Run run,
            RetrievalProgress.Type type,
            int sliceIndex,
            int sliceCount,
            String dsl,
            FetchPlanItem item,
            long cooldownMs
    ) {
        run.options.progressOrNone().onProgress(RetrievalProgress.builder()
                .type(type)
                .sliceIndex(sliceIndex)
                .sliceCount(sliceCount)
                .slice(dsl)
                .itemKey(item.itemKey)
                .cacheHit(item.classification == Classification.COVERED)
                .daysToFetch(item.daysToFetch())
                .gapCount(item.windows == null ? 0 : item.windows.size())
                .totalSuccess(run.success)
                .totalErrors(run.errors)
                .totalCacheHits(run.cacheHits)
                .totalApiFetches(run.apiFetches)
                .totalDaysFetched(run.daysFetched)
                .cooldownMs(cooldownMs)
                .build());
    }

    private static int countFetch(List<FetchPlanItem> items, int from) {
        int n = 0;
        for (int i = from; i < items.size(); i++) {
            if (items.get(i).classification == Classification.FETCH) {
                n++;
            }
        }
        return n;
    }

    private static String runMode(RetrievalOptions options) {
        if (options.simulate) {
            return "SIMULATE";
        }
        return options.automated ? "AUTOMATED" : "MANUAL";
    }

    private static String label(FetchComponent component) {
        return component.sliceFamily == null || component.sliceFamily.isEmpty() ? "uncontexted" : component.sliceFamily;
    }

    private static String blankTo(String value, String fallback) {
        String text = value == null ? "" : value.trim();
        return text.isEmpty() ? fallback : text;
    }

    private static final class Run {
        private final RetrievalOptions options;
        private final Instant referenceNow;
        private final RunTelemetry telemetry;
        private final RetrievalBatch batch;
        private final List<SliceStat> sliceStats = new ArrayList<>();
        private final List<ItemDecision> decisions = new ArrayList<>();
        private int items;
        private int success;
        private int errors;
        private int cacheHits;
        private int apiFetches;
        private long daysFetched;
        private boolean aborted;
        private String abortReason = "";
        private int remainingSlices;
        private int remainingItems;

        private Run(RetrievalOptions options, Instant referenceNow, RunTelemetry telemetry, RetrievalBatch batch) {
            this.options = options;
            this.referenceNow = referenceNow;
            this.telemetry = telemetry;
            this.batch = batch;
        }

        private void abort(String reason) {
            if (!aborted) {
                aborted = true;
                abortReason = reason;
            }
        }

        private boolean isClean() {
            return !aborted && errors == 0;
        }

        private void decide(String slice, FetchPlanItem item, ItemDecision.Action action, String detail) {
            decisions.add(new ItemDecision(slice, item.itemKey, item.classification, action, detail));
        }
    }

    private static final class ItemTally {
        private final List<String> details = new ArrayList<>();
        private boolean fetched;
    }

    private static final class SliceCounter {
        private final String slice;
        private int items;
        private int success;
        private int errors;
        private int cacheHits;
        private int apiFetches;
        private long daysFetched;
        private int skipped;

        private SliceCounter(String slice) {
            this.slice = slice;
        }

        private SliceStat freeze(boolean completed) {
            return new SliceStat(slice, items, success, errors, cacheHits, apiFetches, daysFetched, skipped, completed);
        }
    }
}
