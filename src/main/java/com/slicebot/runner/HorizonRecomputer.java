package com.slicebot.runner;

import com.slicebot.graph.Graph;

import java.time.Instant;

/**
 * Post-run step refreshing derived latency horizons. Failures never change the run result.
 */
public interface HorizonRecomputer {
    HorizonRecomputer NONE = (graph, referenceNow) -> {
    };

    void recompute(Graph graph, Instant referenceNow) throws Exception;
}
