package com.slicebot.runner;

import com.slicebot.aggregate.ForecastEstimator;
import com.slicebot.aggregate.TimeSeriesAggregator;
import com.slicebot.graph.Graph;
import com.slicebot.graph.GraphEdge;
import com.slicebot.graph.ParameterBinding;
import com.slicebot.model.CachedRecord;
import com.slicebot.model.DailyPoint;
import com.slicebot.model.ParamSlot;
import com.slicebot.model.QueryMode;
import com.slicebot.slice.SliceResolver;
import com.slicebot.storage.CachedRecordStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Re-estimates the mature conversion rate of every latency-bearing parameter from its uncontexted
 * window-mode daily series.
 */
public final class ForecastHorizonRecomputer implements HorizonRecomputer {
    private static final Logger LOG = LogManager.getLogger(ForecastHorizonRecomputer.class);

    private final CachedRecordStore store;
    private final SliceResolver resolver;
    private final TimeSeriesAggregator aggregator;
    private final ForecastEstimator estimator;
    private volatile Map<String, ForecastEstimator.Result> lastEstimates = Map.of();

    public ForecastHorizonRecomputer(
            CachedRecordStore store,
            SliceResolver resolver,
            TimeSeriesAggregator aggregator,
            ForecastEstimator estimator
    ) {
        this.store = store;
        this.resolver = resolver;
        this.aggregator = aggregator;
        this.estimator = estimator;
    }

    @Override
    public void recompute(Graph graph, Instant referenceNow) {
        Map<String, ForecastEstimator.Result> out = new LinkedHashMap<>();
        for (GraphEdge edge : graph.edgesOrEmpty()) {
            ParameterBinding p = edge.parameter(ParamSlot.P);
            if (p == null || p.objectId == null || p.t95Days == null || out.containsKey(p.objectId)) {
                continue;
            }
            List<CachedRecord> base = new ArrayList<>();
            for (CachedRecord r : store.load(p.objectId)) {
                if (r.modeOrDefault() == QueryMode.WINDOW && resolver.familyOf(r.sliceDsl).isEmpty()) {
                    base.add(r);
                }
            }
            List<DailyPoint> series = new ArrayList<>(aggregator.dailyMap(base, null).values());
            if (series.isEmpty()) {
                continue;
            }
            ForecastEstimator.Result result = estimator.estimate(series, p.t95Days);
            out.put(p.objectId, result);
            LOG.debug("horizon param={} t95={} mature_days={} forecast={}",
                    p.objectId, p.t95Days, result.matureDays, result.forecast);
        }
        lastEstimates = Collections.unmodifiableMap(out);
        LOG.info("horizon recompute params={} reference_now={}", out.size(), referenceNow);
    }

    public Map<String, ForecastEstimator.Result> lastEstimates() {
        return lastEstimates;
    }
}
