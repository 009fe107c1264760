package com.slicebot.runner;

import com.slicebot.aggregate.TimeSeriesAggregator;
import com.slicebot.config.Config;
import com.slicebot.coverage.ContextDefinition;
import com.slicebot.coverage.ContextRegistry;
import com.slicebot.coverage.InMemoryContextRegistry;
import com.slicebot.coverage.OtherPolicy;
import com.slicebot.data.RateLimiter;
import com.slicebot.graph.Graph;
import com.slicebot.model.CachedRecord;
import com.slicebot.model.ContextPredicate;
import com.slicebot.model.DailyPoint;
import com.slicebot.model.FetchWindow;
import com.slicebot.model.TimeBounds;
import com.slicebot.model.WindowReason;
import com.slicebot.plan.FetchPlanBuilder;
import com.slicebot.plan.PlanFixtures;
import com.slicebot.slice.PinnedDslExploder;
import com.slicebot.slice.SliceResolver;
import com.slicebot.storage.CachedRecordStore;
import com.slicebot.storage.InMemoryCachedRecordStore;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static com.slicebot.plan.PlanFixtures.edge;
import static com.slicebot.plan.PlanFixtures.node;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RetrievalOrchestratorTest {
    private static final Instant NOW = Instant.parse("2026-02-01T00:00:00Z");
    private static final String SLICE_1 = "window(1-Jan-26:5-Jan-26)";
    private static final String SLICE_2 = "window(6-Jan-26:10-Jan-26)";
    private static final String TWO_SLICES = SLICE_1 + ";" + SLICE_2;
    private static final String RATE_LIMITED = "HTTP 429 Too Many Requests";

    private final InMemoryCachedRecordStore store = new InMemoryCachedRecordStore();
    private final RecordingMarker marker = new RecordingMarker();
    private final RecordingHorizon horizon = new RecordingHorizon();
    private final ProcessRunLock lock = new ProcessRunLock();
    private final RecordingExecutor executor = new RecordingExecutor();
    private ContextRegistry contexts = new InMemoryContextRegistry(List.of());

    @Test
    void sameScopeSharesOneBatchAcrossWindowSlices() {
        RetrievalResult result = orchestrator(executor).execute(options(
                TWO_SLICES + ";cohort(1-Jan-26:5-Jan-26)").build());

        List<FetchRequest> a = executor.requestsFor("param-a");
        assertEquals(3, a.size());
        FetchRequest first = a.get(0);
        FetchRequest second = a.get(1);
        FetchRequest cohort = a.get(2);
        assertEquals(first.batchTimestamp, second.batchTimestamp);
        assertNotEquals(first.batchTimestamp, cohort.batchTimestamp);
        assertFalse(first.bustCache || second.bustCache || cohort.bustCache);
        assertTrue(result.isClean());
        assertNotEquals(first.batchTimestamp, executor.requestsFor("param-b").get(0).batchTimestamp);
        assertEquals(6, result.totalApiFetches);
        assertEquals(30L, result.totalDaysFetched);
        assertTrue(result.successMarkerWritten);
        assertTrue(marker.lastSuccess().isPresent());
        assertEquals(1, horizon.calls.get());
    }

    @Test
    void rateLimitedScopeRetriesWithFreshBatchWhileOtherScopeKeepsItsOwn() {
        executor.failOnce("param-a", SLICE_2, RATE_LIMITED);
        List<RetrievalProgress> events = new ArrayList<>();

        RetrievalResult result = orchestrator(executor).execute(options(TWO_SLICES)
                .automated(true)
                .cooldownMillis(0L)
                .progress(events::add)
                .build());

        List<FetchRequest> a = executor.requestsFor("param-a");
        List<FetchRequest> b = executor.requestsFor("param-b");
        assertEquals(3, a.size());
        assertEquals(2, b.size());
        assertFalse(a.get(1).bustCache);
        assertEquals(a.get(0).batchTimestamp, a.get(1).batchTimestamp);
        assertTrue(a.get(2).bustCache);
        assertNotEquals(a.get(1).batchTimestamp, a.get(2).batchTimestamp);
        assertEquals(List.of(FetchWindow.of(LocalDate.of(2026, 1, 6), LocalDate.of(2026, 1, 10),
                WindowReason.MISSING)), a.get(2).windows);
        assertEquals(b.get(0).batchTimestamp, b.get(1).batchTimestamp);
        assertFalse(b.get(0).bustCache || b.get(1).bustCache);

        assertEquals(0, result.totalErrors);
        assertEquals(4, result.totalSuccess);
        assertTrue(result.successMarkerWritten);
        assertEquals(1, count(result, ItemDecision.Action.RETRIED));
        long cooldowns = events.stream().filter(e -> e.type == RetrievalProgress.Type.COOLDOWN).count();
        assertEquals(1L, cooldowns);
    }

    @Test
    void manualRunAbortsOnFirstRateLimit() {
        executor.failOnce("param-a", SLICE_1, RATE_LIMITED);

        RetrievalResult result = orchestrator(executor).execute(options(TWO_SLICES).build());

        assertTrue(result.aborted);
        assertEquals("RATE_LIMIT", result.abortReason);
        assertEquals(1, result.totalErrors);
        assertEquals(1, result.remainingItems);
        assertEquals(1, result.remainingSlices);
        assertEquals(1, executor.requests.size());
        assertFalse(result.successMarkerWritten);
        assertEquals(0, horizon.calls.get());
        assertFalse(result.sliceStats.get(0).completed);
    }

    @Test
    void abortSignalStopsBeforeNextItem() {
        AtomicBoolean abort = new AtomicBoolean();
        executor.afterEachRequest = () -> abort.set(true);

        RetrievalResult result = orchestrator(executor).execute(options(TWO_SLICES)
                .shouldAbort(abort::get)
                .build());

        assertTrue(result.aborted);
        assertEquals("aborted", result.abortReason);
        assertEquals(1, result.totalSuccess);
        assertEquals(1, result.remainingItems);
        assertEquals(1, result.remainingSlices);
        assertFalse(result.successMarkerWritten);
    }

    @Test
    void abortDuringCooldownCountsAsError() {
        executor.failOnce("param-a", SLICE_1, RATE_LIMITED);
        AtomicBoolean abort = new AtomicBoolean();
        executor.afterEachRequest = () -> abort.set(true);

        RetrievalResult result = orchestrator(executor).execute(options(SLICE_1)
                .automated(true)
                .cooldownMillis(60_000L)
                .shouldAbort(abort::get)
                .build());

        assertTrue(result.aborted);
        assertEquals(1, result.totalErrors);
        assertEquals(1, count(result, ItemDecision.Action.ABORTED));
    }

    @Test
    void simulateWithoutExecutorOnlyTracesDecisions() {
        RetrievalResult result = orchestrator(null).execute(options(TWO_SLICES).simulate(true).build());

        assertTrue(result.simulated);
        assertEquals(4, result.totalSuccess);
        assertEquals(4, count(result, ItemDecision.Action.SIMULATED));
        assertEquals(0, store.writeCount());
        assertFalse(result.successMarkerWritten);
        assertFalse(marker.lastSuccess().isPresent());
        assertEquals(0, horizon.calls.get());
    }

    @Test
    void simulateWithExecutorPassesDryRunAndNeverWrites() {
        RetrievalResult result = orchestrator(executor).execute(options(SLICE_1).simulate(true).build());

        assertEquals(2, executor.requests.size());
        assertTrue(executor.requests.get(0).dryRun);
        assertEquals(0, store.writeCount());
        assertEquals(0, result.totalApiFetches);
        assertFalse(result.successMarkerWritten);
    }

    @Test
    void liveRunWithoutExecutorIsRejected() {
        RetrievalOrchestrator orchestrator = orchestrator(null);

        assertThrows(IllegalStateException.class, () -> orchestrator.execute(options(SLICE_1).build()));
    }

    @Test
    void ordinaryFailureIsCountedAndRunContinues() {
        executor.failOnce("param-a", SLICE_1, "HTTP 500 internal error");

        RetrievalResult result = orchestrator(executor).execute(options(TWO_SLICES).build());

        assertFalse(result.aborted);
        assertEquals(1, result.totalErrors);
        assertEquals(3, result.totalSuccess);
        assertEquals(4, executor.requests.size());
        assertFalse(result.successMarkerWritten);
        assertEquals(1, horizon.calls.get());
        assertTrue(result.sliceStats.get(0).completed);
        assertEquals(1, result.sliceStats.get(0).errors);
    }

    @Test
    void repeatedRunsServeEverythingFromCache() {
        RetrievalOrchestrator orchestrator = orchestrator(executor);
        RetrievalResult first = orchestrator.execute(options(TWO_SLICES).build());
        int writesAfterFirst = store.writeCount();

        RetrievalResult second = orchestrator.execute(options(TWO_SLICES).build());
        RetrievalResult third = orchestrator.execute(options(TWO_SLICES).build());

        assertEquals(4, first.totalApiFetches);
        assertEquals(0, second.totalApiFetches);
        assertEquals(4, second.totalCacheHits);
        assertEquals(4, second.totalSuccess);
        assertEquals(second.sliceStats, third.sliceStats);
        assertEquals(4, executor.requests.size());
        assertEquals(writesAfterFirst, store.writeCount());
    }

    @Test
    void bustCacheRefetchesWholeWindowEvenWhenCached() {
        RetrievalOrchestrator orchestrator = orchestrator(executor);
        orchestrator.execute(options(SLICE_1).build());

        RetrievalResult busted = orchestrator.execute(options(SLICE_1).bustCache(true).build());

        assertEquals(2, busted.totalApiFetches);
        assertEquals(4, executor.requests.size());
        assertTrue(executor.requests.get(2).bustCache);
        assertEquals(5, FetchWindow.totalDays(executor.requests.get(2).windows));
    }

    @Test
    void persistentRateLimitFailsItemAfterRetryCap() {
        executor.alwaysFail("param-a", RATE_LIMITED);
        RetrievalOrchestrator orchestrator = orchestrator(executor, Map.of("retrieve.max_cooldown_retries", "2"));

        RetrievalResult result = orchestrator.execute(options(SLICE_1).automated(true).cooldownMillis(0L).build());

        assertEquals(3, executor.requestsFor("param-a").size());
        assertEquals(1, executor.requestsFor("param-b").size());
        assertFalse(result.aborted);
        assertEquals(1, result.totalErrors);
        assertTrue(result.decisions.stream().anyMatch(d -> d.action == ItemDecision.Action.FAILED
                && d.detail.contains("still rate limited after 2")));
    }

    @Test
    void heldLockAbortsWithoutFetching() {
        assertTrue(lock.tryAcquire("other-run"));

        RetrievalResult result = orchestrator(executor).execute(options(TWO_SLICES).build());

        assertTrue(result.aborted);
        assertEquals("lock_unavailable", result.abortReason);
        assertEquals(2, result.remainingSlices);
        assertTrue(executor.requests.isEmpty());
        assertFalse(result.successMarkerWritten);
    }

    @Test
    void missingEventIdsAreSkippedWithoutErrors() {
        Graph graph = new Graph(
                List.of(node("a", "landing"), node("b", "checkout"), node("c", null)),
                List.of(edge("e1", "a", "b", "param-a", "amplitude-prod"),
                        edge("e2", "a", "c", "param-c", "amplitude-prod")));

        RetrievalResult result = orchestrator(executor).execute(options(SLICE_1).graph(graph).build());

        assertTrue(result.isClean());
        assertEquals(1, result.sliceStats.get(0).skipped);
        assertEquals(1, executor.requests.size());
        assertTrue(result.successMarkerWritten);
    }

    @Test
    void horizonFailureLeavesResultUntouched() {
        horizon.failure = new IllegalStateException("horizon store offline");

        RetrievalResult result = orchestrator(executor).execute(options(SLICE_1).build());

        assertTrue(result.isClean());
        assertTrue(result.successMarkerWritten);
        assertEquals(1, horizon.calls.get());
    }

    @Test
    void contextAnyFetchesEachValueForItsOwnGapsAndIsCoveredOnRerun() {
        RetrievalOrchestrator orchestrator = orchestrator(executor);
        orchestrator.execute(options("window(1-Jan-26:3-Jan-26).context(channel:google)").build());
        int seeded = executor.requests.size();

        RetrievalResult second = orchestrator.execute(options(
                "window(1-Jan-26:5-Jan-26).contextAny(channel:google,channel:facebook)").build());

        Map<String, FetchRequest> byFamily = new HashMap<>();
        for (FetchRequest r : executor.requestsFor("param-a").subList(1, 3)) {
            byFamily.put(r.sliceFamily(), r);
        }
        FetchRequest google = byFamily.get("context(channel:google)");
        FetchRequest facebook = byFamily.get("context(channel:facebook)");
        assertEquals(List.of(FetchWindow.of(LocalDate.of(2026, 1, 4), LocalDate.of(2026, 1, 5),
                WindowReason.MISSING)), google.windows);
        assertEquals(5, FetchWindow.totalDays(facebook.windows));
        assertEquals(List.of(ContextPredicate.of("channel", "facebook")), facebook.constraint.contexts);
        assertTrue(facebook.constraint.contextAny.isEmpty());
        assertNotEquals(google.querySignature(), facebook.querySignature());
        assertEquals(seeded + 4, executor.requests.size());
        assertTrue(second.isClean());

        RetrievalResult third = orchestrator.execute(options(
                "window(1-Jan-26:5-Jan-26).contextAny(channel:facebook,channel:google)").build());

        assertEquals(seeded + 4, executor.requests.size());
        assertEquals(0, third.totalApiFetches);
        assertEquals(2, third.totalCacheHits);
    }

    @Test
    void uncontextedSliceOverIncompletePartitionFetchesOnlyTheMissingValue() {
        contexts = new InMemoryContextRegistry(List.of(ContextDefinition.of("channel",
                List.of("google", "facebook", "other"), OtherPolicy.ENUMERATED)));
        RetrievalOrchestrator orchestrator = orchestrator(executor);
        orchestrator.execute(options("window(1-Jan-26:5-Jan-26).context(channel:google);"
                + "window(1-Jan-26:5-Jan-26).context(channel:facebook)").build());
        int seeded = executor.requests.size();

        orchestrator.execute(options(SLICE_1).build());

        List<FetchRequest> a = executor.requestsFor("param-a");
        assertEquals(seeded + 2, executor.requests.size());
        FetchRequest other = a.get(a.size() - 1);
        assertEquals("context(channel:other)", other.sliceFamily());
        assertEquals(5, FetchWindow.totalDays(other.windows));

        RetrievalResult rerun = orchestrator.execute(options(SLICE_1).build());

        assertEquals(seeded + 2, executor.requests.size());
        assertEquals(2, rerun.totalCacheHits);
        assertTrue(rerun.isClean());
    }

    @Test
    void slicesDifferingOnlyInSignatureGetDistinctBatches() {
        orchestrator(executor).execute(options(SLICE_1 + ";" + SLICE_1 + ".visited(pricing)").build());

        List<FetchRequest> a = executor.requestsFor("param-a");
        assertEquals(2, a.size());
        assertEquals(a.get(0).sliceFamily(), a.get(1).sliceFamily());
        assertNotEquals(a.get(0).querySignature(), a.get(1).querySignature());
        assertNotEquals(a.get(0).batchTimestamp, a.get(1).batchTimestamp);
    }

    @Test
    void unreadableStoreFailsOnlyTheSliceThatHitIt() {
        BreakableStore breakable = new BreakableStore();
        RetrievalResult result = orchestrator(executor, Map.of(), breakable).execute(options(TWO_SLICES)
                .progress(e -> {
                    if (e.type == RetrievalProgress.Type.AFTER_ITEM && e.sliceIndex == 0
                            && "param-b".equals(e.itemKey.objectId)) {
                        breakable.broken = true;
                    }
                })
                .build());

        assertFalse(result.aborted);
        assertEquals(2, result.totalSlices);
        assertEquals(2, result.totalSuccess);
        assertEquals(1, result.totalErrors);
        assertEquals(2, result.sliceStats.size());
        assertEquals(2, result.sliceStats.get(0).success);
        assertEquals(1, result.sliceStats.get(1).errors);
        assertFalse(result.successMarkerWritten);
    }

    @Test
    void progressEventsBracketEveryItem() {
        List<RetrievalProgress> events = new ArrayList<>();

        orchestrator(executor).execute(options(TWO_SLICES).progress(events::add).build());

        long before = events.stream().filter(e -> e.type == RetrievalProgress.Type.BEFORE_ITEM).count();
        long after = events.stream().filter(e -> e.type == RetrievalProgress.Type.AFTER_ITEM).count();
        assertEquals(4L, before);
        assertEquals(4L, after);
        RetrievalProgress last = events.get(events.size() - 1);
        assertEquals(4, last.totalSuccess);
        assertEquals(1, last.sliceIndex);
        assertEquals(2, last.sliceCount);
    }

    @Test
    void telemetryIsKeptForTheLastRun() {
        RetrievalOrchestrator orchestrator = orchestrator(executor);

        orchestrator.execute(options(SLICE_1).build());

        assertTrue(orchestrator.lastTelemetry().getSummary().contains("FETCH"));
    }

    private RetrievalOrchestrator orchestrator(FetchExecutor fetchExecutor) {
        return orchestrator(fetchExecutor, Map.of());
    }

    private RetrievalOrchestrator orchestrator(FetchExecutor fetchExecutor, Map<String, String> overrides) {
        return orchestrator(fetchExecutor, overrides, store);
    }

    private RetrievalOrchestrator orchestrator(
            FetchExecutor fetchExecutor,
            Map<String, String> overrides,
            CachedRecordStore recordStore
    ) {
        Map<String, String> values = new HashMap<>();
        values.put("retrieve.cooldown_poll_ms", "10");
        values.put("ratelimit.min_delay_ms", "0");
        values.putAll(overrides);
        Config config = Config.of(values);
        FetchPlanBuilder planBuilder = PlanFixtures.planBuilder(config, recordStore, contexts);
        return new RetrievalOrchestrator(
                config,
                new PinnedDslExploder(),
                planBuilder,
                new TimeSeriesAggregator(new SliceResolver()),
                recordStore,
                fetchExecutor,
                new RateLimiter(config, () -> 1_000_000L, ms -> {
                }),
                marker,
                horizon,
                lock,
                ms -> {
                },
                Clock.fixed(NOW, ZoneOffset.UTC)
        );
    }

    private static RetrievalOptions.RetrievalOptionsBuilder options(String pinnedDsl) {
        Graph graph = new Graph(
                List.of(node("a", "landing"), node("b", "checkout"), node("c", "paid")),
                List.of(edge("e1", "a", "b", "param-a", "amplitude-prod"),
                        edge("e2", "a", "c", "param-b", "amplitude-prod")));
        return RetrievalOptions.builder()
                .graph(graph)
                .pinnedDsl(pinnedDsl)
                .referenceNow(NOW);
    }

    private static long count(RetrievalResult result, ItemDecision.Action action) {
        return result.decisions.stream().filter(d -> d.action == action).count();
    }

    private static final class RecordingExecutor implements FetchExecutor {
        private final List<FetchRequest> requests = new ArrayList<>();
        private final Map<String, String> onceErrors = new HashMap<>();
        private final Map<String, String> permanentErrors = new HashMap<>();
        private Runnable afterEachRequest = () -> {
        };

        void failOnce(String objectId, String sliceDsl, String error) {
            onceErrors.put(objectId + "|" + sliceDsl, error);
        }

        void alwaysFail(String objectId, String error) {
            permanentErrors.put(objectId, error);
        }

        List<FetchRequest> requestsFor(String objectId) {
            List<FetchRequest> out = new ArrayList<>();
            for (FetchRequest r : requests) {
                if (r.objectId().equals(objectId)) {
                    out.add(r);
                }
            }
            return out;
        }

        @Override
        public FetchExecution execute(FetchRequest request) {
            requests.add(request);
            try {
                String once = onceErrors.remove(request.objectId() + "|" + request.sliceDsl);
                if (once != null) {
                    return FetchExecution.failed(once);
                }
                String permanent = permanentErrors.get(request.objectId());
                if (permanent != null) {
                    return FetchExecution.failed(permanent);
                }
                if (request.dryRun) {
                    return FetchExecution.fetched(0, List.of());
                }
                List<FetchedSeries> series = new ArrayList<>();
                int days = 0;
                for (FetchWindow w : request.windows) {
                    TimeBounds bounds = w.bounds();
                    List<DailyPoint> points = new ArrayList<>();
                    for (LocalDate d : bounds.dates()) {
                        points.add(DailyPoint.of(d, 10L, 2L));
                    }
                    days += bounds.dayCount();
                    series.add(FetchedSeries.of(bounds, points));
                }
                return FetchExecution.fetched(days, series);
            } finally {
                afterEachRequest.run();
            }
        }
    }

    private static final class BreakableStore implements CachedRecordStore {
        private final InMemoryCachedRecordStore delegate = new InMemoryCachedRecordStore();
        private boolean broken;

        @Override
        public List<CachedRecord> load(String objectId) {
            if (broken) {
                throw new IllegalStateException("connection refused");
            }
            return delegate.load(objectId);
        }

        @Override
        public void replace(String objectId, List<CachedRecord> records) {
            delegate.replace(objectId, records);
        }
    }

    private static final class RecordingMarker implements SuccessMarkerStore {
        private Instant last;

        @Override
        public void markSuccess(Instant finishedAt) {
            last = finishedAt;
        }

        @Override
        public Optional<Instant> lastSuccess() {
            return Optional.ofNullable(last);
        }
    }

    private static final class RecordingHorizon implements HorizonRecomputer {
        private final AtomicInteger calls = new AtomicInteger();
        private RuntimeException failure;

        @Override
        public void recompute(Graph graph, Instant referenceNow) {
            calls.incrementAndGet();
            if (failure != null) {
                throw failure;
            }
        }
    }
}
