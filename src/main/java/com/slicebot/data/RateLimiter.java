package com.slicebot.data;

import com.slicebot.config.Config;
import com.slicebot.core.Sleeper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.LongSupplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Per-provider request throttle with exponential backoff on rate-limit responses.
 * Provider names are normalized to their prefix, so {@code amplitude-prod} and {@code amplitude-staging}
 * share one budget.
 */
public final class RateLimiter {
    private static final Logger LOG = LogManager.getLogger(RateLimiter.class);
    private static final List<String> RATE_LIMIT_MARKERS = List.of(
            "429",
            "too many requests",
            "rate limit",
            "exceeded concurrent limit",
            "exceeded rate limit"
    );
    private static final Pattern RETRY_AFTER_IN_MESSAGE = Pattern.compile("(?i)retry-after\\s*[:=]\\s*([^;,\\n]+)");

    private final long minDelayMs;
    private final long initialBackoffMs;
    private final double backoffMultiplier;
    private final long maxBackoffMs;
    private final LongSupplier clockMs;
    private final Sleeper sleeper;
    private final Map<String, ProviderState> states = new ConcurrentHashMap<>();

    public RateLimiter(Config config) {
        this(config, System::currentTimeMillis, Sleeper.SYSTEM);
    }

    public RateLimiter(Config config, LongSupplier clockMs, Sleeper sleeper) {
        this.minDelayMs = Math.max(0L, config.getLong("ratelimit.min_delay_ms", 500L));
        this.initialBackoffMs = Math.max(1L, config.getLong("ratelimit.initial_backoff_ms", 5_000L));
        this.backoffMultiplier = Math.max(1.0, config.getDouble("ratelimit.backoff_multiplier", 2.0));
        this.maxBackoffMs = Math.max(initialBackoffMs, config.getLong("ratelimit.max_backoff_ms", 300_000L));
        this.clockMs = clockMs;
        this.sleeper = sleeper;
    }

    public static String normalizeProvider(String connectionName) {
        String raw = connectionName == null ? "" : connectionName.trim().toLowerCase(Locale.ROOT);
        if (raw.isEmpty()) {
            return "default";
        }
        int cut = raw.length();
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (c == '-' || c == '_' || c == ' ' || c == '.') {
                cut = i;
                break;
            }
        }
        return cut == 0 ? raw : raw.substring(0, cut);
    }

    public static boolean isRateLimitError(String message) {
        if (message == null || message.isEmpty()) {
            return false;
        }
        String msg = message.toLowerCase(Locale.ROOT);
        for (String marker : RATE_LIMIT_MARKERS) {
            if (msg.contains(marker)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Blocks until the provider may be called again, then records the request time.
     */
    public void waitForRateLimit(String provider) throws InterruptedException {
        ProviderState state = state(provider);
        long waitMs;
        int errors;
        synchronized (state) {
            waitMs = computeWaitMs(state, clockMs.getAsLong());
            errors = state.consecutiveErrors;
        }
        if (waitMs > 0L) {
            if (waitMs >= 1_000L) {
                LOG.info("rate limiter wait provider={} wait_ms={} consecutive_errors={}",
                        normalizeProvider(provider), waitMs, errors);
            }
            sleeper.sleep(waitMs);
        }
        synchronized (state) {
            state.lastRequestAtMs = clockMs.getAsLong();
        }
    }

    public long pendingWaitMs(String provider) {
        ProviderState state = state(provider);
        synchronized (state) {
            return computeWaitMs(state, clockMs.getAsLong());
        }
    }

    public void reportSuccess(String provider) {
        ProviderState state = state(provider);
        synchronized (state) {
            state.currentBackoffMs = 0L;
            state.consecutiveErrors = 0;
        }
    }

    /**
     * @param errorMessage free text of the failure; a Retry-After value is only taken from it when prefixed
     *                     with {@code Retry-After:}
     */
    public void reportRateLimitError(String provider, String errorMessage) {
        reportRateLimitError(provider, errorMessage, null);
    }

    /**
     * @param retryAfterHeader raw Retry-After header value from the provider response, or null; wins over the
     *                         message when both carry one
     */
    public void reportRateLimitError(String provider, String errorMessage, String retryAfterHeader) {
        ProviderState state = state(provider);
        long nowMs = clockMs.getAsLong();
        long retryAfterMs = parseRetryAfterMs(retryAfterHeader, nowMs);
        if (retryAfterMs < 0L) {
            retryAfterMs = retryAfterFromMessage(errorMessage, nowMs);
        }
        synchronized (state) {
            state.consecutiveErrors++;
            long next;
            if (state.consecutiveErrors == 1 || state.currentBackoffMs <= 0L) {
                next = initialBackoffMs;
            } else {
                next = (long) Math.min((double) maxBackoffMs, state.currentBackoffMs * backoffMultiplier);
            }
            if (retryAfterMs > next) {
                next = Math.min(maxBackoffMs, retryAfterMs);
            }
            state.currentBackoffMs = next;
            LOG.warn("rate limit reported provider={} consecutive_errors={} backoff_ms={} retry_after_ms={}",
                    normalizeProvider(provider), state.consecutiveErrors, next, retryAfterMs);
        }
    }

    public Snapshot snapshot(String provider) {
        ProviderState state = state(provider);
        synchronized (state) {
            return new Snapshot(normalizeProvider(provider), state.lastRequestAtMs, state.currentBackoffMs, state.consecutiveErrors);
        }
    }

    /**
     * Milliseconds from a Retry-After header value: delta seconds or an HTTP date. Returns -1 when the value
     * is neither.
     */
    public static long parseRetryAfterMs(String headerValue, long nowMs) {
        if (headerValue == null || headerValue.trim().isEmpty()) {
            return -1L;
        }
        String value = headerValue.trim();
        if (value.matches("\\d{1,9}")) {
            return Long.parseLong(value) * 1_000L;
        }
        try {
            long at = ZonedDateTime.parse(value, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant().toEpochMilli();
            return Math.max(0L, at - nowMs);
        } catch (DateTimeParseException ignored) {
            return -1L;
        }
    }

    /**
     * Milliseconds from a {@code Retry-After: <value>} fragment inside an error message. A bare number such as
     * a status code is not a hint. Returns -1 when no fragment is present.
     */
    public static long retryAfterFromMessage(String message, long nowMs) {
        if (message == null || message.isEmpty()) {
            return -1L;
        }
        Matcher m = RETRY_AFTER_IN_MESSAGE.matcher(message);
        return m.find() ? parseRetryAfterMs(m.group(1), nowMs) : -1L;
    }

    private long computeWaitMs(ProviderState state, long nowMs) {
        long sinceLast = state.lastRequestAtMs <= 0L ? Long.MAX_VALUE : nowMs - state.lastRequestAtMs;
        long throttle = sinceLast >= minDelayMs ? 0L : minDelayMs - sinceLast;
        return Math.max(state.currentBackoffMs, throttle);
    }

    private ProviderState state(String provider) {
        return states.computeIfAbsent(normalizeProvider(provider), ignored -> new ProviderState());
    }

    private static final class ProviderState {
        private long lastRequestAtMs;
        private long currentBackoffMs;
        private int consecutiveErrors;
    }

    public static final class Snapshot {
        public final String provider;
        public final long lastRequestAtMs;
        public final long currentBackoffMs;
        public final int consecutiveErrors;

        private Snapshot(String provider, long lastRequestAtMs, long currentBackoffMs, int consecutiveErrors) {
            this.provider = provider;
            this.lastRequestAtMs = lastRequestAtMs;
            this.currentBackoffMs = currentBackoffMs;
            this.consecutiveErrors = consecutiveErrors;
        }
    }
}
