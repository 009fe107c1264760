package com.slicebot.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class ConversionCounts {
    public static final ConversionCounts ZERO = new ConversionCounts(0L, 0L, 0);

    public final long n;
    public final long k;
    public final int days;

    public static ConversionCounts of(long n, long k, int days) {
        return new ConversionCounts(n, k, days);
    }

    public ConversionCounts plus(ConversionCounts other) {
        if (other == null) {
            return this;
        }
        return new ConversionCounts(n + other.n, k + other.k, Math.max(days, other.days));
    }

    public double ratio() {
        return n <= 0L ? Double.NaN : (double) k / (double) n;
    }
}
