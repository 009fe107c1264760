package com.slicebot.runner;

import java.time.Instant;
import java.util.Optional;

/**
 * Durable "last clean run" marker read by external automation.
 */
public interface SuccessMarkerStore {

    void markSuccess(Instant finishedAt);

    Optional<Instant> lastSuccess();
}
