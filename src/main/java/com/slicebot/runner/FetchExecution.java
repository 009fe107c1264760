package com.slicebot.runner;

import java.util.List;

public final class FetchExecution {
    public final boolean success;
    public final boolean cacheHit;
    public final int daysFetched;
    public final int daysFromCache;
    public final List<FetchedSeries> series;
    public final String error;
    /** Raw Retry-After header of a rate-limited response, or null. */
    public final String retryAfter;

    private FetchExecution(
            boolean success,
            boolean cacheHit,
            int daysFetched,
            int daysFromCache,
            List<FetchedSeries> series,
            String error,
            String retryAfter
    ) {
        this.success = success;
        this.cacheHit = cacheHit;
        this.daysFetched = Math.max(0, daysFetched);
        this.daysFromCache = Math.max(0, daysFromCache);
        this.series = series == null ? List.of() : List.copyOf(series);
        this.error = error == null ? "" : error;
        this.retryAfter = retryAfter;
    }

    public static FetchExecution fetched(int daysFetched, List<FetchedSeries> series) {
        return new FetchExecution(true, false, daysFetched, 0, series, "", null);
    }

    public static FetchExecution fromCache(int daysFromCache) {
        return new FetchExecution(true, true, 0, daysFromCache, List.of(), "", null);
    }

    public static FetchExecution failed(String error) {
        return new FetchExecution(false, false, 0, 0, List.of(), error, null);
    }

    public static FetchExecution rateLimited(String error, String retryAfter) {
        return new FetchExecution(false, false, 0, 0, List.of(), error, retryAfter);
    }
}
