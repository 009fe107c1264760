package com.slicebot.plan;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class PlanOptions {
    public final Instant referenceNow;
    public final Instant createdAt;
    public final boolean bustCache;

    public static PlanOptions at(Instant referenceNow) {
        return new PlanOptions(referenceNow, null, false);
    }

    public LocalDate referenceDate() {
        return LocalDate.ofInstant(referenceNow, ZoneOffset.UTC);
    }
}
