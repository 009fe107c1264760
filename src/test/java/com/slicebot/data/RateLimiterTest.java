package com.slicebot.data;

import com.slicebot.config.Config;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RateLimiterTest {
    private final AtomicLong now = new AtomicLong(1_000_000L);
    private final List<Long> sleeps = new ArrayList<>();
    private final RateLimiter limiter = new RateLimiter(
            Config.of(Map.of(
                    "ratelimit.min_delay_ms", "500",
                    "ratelimit.initial_backoff_ms", "5000",
                    "ratelimit.backoff_multiplier", "2.0",
                    "ratelimit.max_backoff_ms", "30000"
            )),
            now::get,
            ms -> {
                sleeps.add(ms);
                now.addAndGet(ms);
            }
    );

    @Test
    void firstRequestDoesNotWaitAndSecondHonoursMinDelay() throws InterruptedException {
        limiter.waitForRateLimit("amplitude-prod");
        now.addAndGet(100L);
        limiter.waitForRateLimit("amplitude-prod");

        assertEquals(List.of(400L), sleeps);
    }

    @Test
    void backoffGrowsGeometricallyUpToCap() {
        List<Long> backoffs = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            limiter.reportRateLimitError("amplitude", null);
            backoffs.add(limiter.snapshot("amplitude").currentBackoffMs);
        }

        assertEquals(List.of(5_000L, 10_000L, 20_000L, 30_000L, 30_000L), backoffs);
        assertEquals(5, limiter.snapshot("amplitude").consecutiveErrors);
    }

    @Test
    void successResetsBackoff() throws InterruptedException {
        limiter.reportRateLimitError("amplitude", null);
        limiter.reportSuccess("amplitude");
        limiter.waitForRateLimit("amplitude");

        assertEquals(0L, limiter.snapshot("amplitude").currentBackoffMs);
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void waitBlocksForCurrentBackoff() throws InterruptedException {
        limiter.reportRateLimitError("amplitude", null);

        limiter.waitForRateLimit("amplitude");

        assertEquals(List.of(5_000L), sleeps);
    }

    @Test
    void providersShareStateByNamePrefix() {
        limiter.reportRateLimitError("amplitude-prod", null);

        assertEquals(5_000L, limiter.pendingWaitMs("amplitude-staging"));
        assertEquals(0L, limiter.pendingWaitMs("sheets-readonly"));
        assertEquals("amplitude", RateLimiter.normalizeProvider(" Amplitude_EU "));
        assertEquals("default", RateLimiter.normalizeProvider(null));
    }

    @Test
    void retryAfterHintFloorsBackoff() {
        limiter.reportRateLimitError("amplitude", "HTTP 429 Too Many Requests; Retry-After: 20");

        assertEquals(20_000L, limiter.snapshot("amplitude").currentBackoffMs);
        assertEquals(7_000L, RateLimiter.parseRetryAfterMs("7", 0L));
        assertEquals(-1L, RateLimiter.parseRetryAfterMs("soon", 0L));
    }

    @Test
    void bareStatusCodeInMessageIsNotARetryAfterHint() {
        limiter.reportRateLimitError("amplitude-prod", "429");

        assertEquals(5_000L, limiter.snapshot("amplitude").currentBackoffMs);
        assertEquals(-1L, RateLimiter.retryAfterFromMessage("429", 0L));
        assertEquals(-1L, RateLimiter.retryAfterFromMessage("HTTP 429 Too Many Requests", 0L));
    }

    @Test
    void retryAfterHeaderWinsOverMessageAndIsCappedAtMaxBackoff() {
        limiter.reportRateLimitError("amplitude", "HTTP 429; Retry-After: 10", "12");
        assertEquals(12_000L, limiter.snapshot("amplitude").currentBackoffMs);

        limiter.reportRateLimitError("mixpanel", "429", "600");
        assertEquals(30_000L, limiter.snapshot("mixpanel").currentBackoffMs);
    }

    @Test
    void rateLimitMessagesAreRecognised() {
        assertTrue(RateLimiter.isRateLimitError("HTTP 429"));
        assertTrue(RateLimiter.isRateLimitError("Too Many Requests"));
        assertTrue(RateLimiter.isRateLimitError("hit the Rate Limit for project"));
        assertTrue(RateLimiter.isRateLimitError("Exceeded concurrent limit"));
        assertTrue(RateLimiter.isRateLimitError("Exceeded rate limit of 360/h"));
        assertFalse(RateLimiter.isRateLimitError("connection reset"));
        assertFalse(RateLimiter.isRateLimitError(null));
    }
}
