package com.slicebot.core;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RunTelemetryTest {

    @Test
    void summaryShouldContainRequiredFields() {
        RunTelemetry telemetry = new RunTelemetry("AUTOMATED", Instant.parse("2026-02-23T00:00:00Z"));
        telemetry.startStep(RunTelemetry.STEP_PLAN);
        telemetry.endStep(RunTelemetry.STEP_PLAN, 1, 7, 0);
        telemetry.startStep(RunTelemetry.STEP_FETCH);
        telemetry.endStep(RunTelemetry.STEP_FETCH, 1, 0, 1, "rate limited");
        telemetry.recordTotals(2, 7, 3, 4, 30L, 1, false);
        telemetry.finish(Instant.parse("2026-02-23T00:00:05Z"));

        String summary = telemetry.getSummary();

        assertTrue(summary.contains("run_mode=AUTOMATED"));
        assertTrue(summary.contains("total_elapsed_ms=5000"));
        assertTrue(summary.contains("api_fetches=3"));
        assertTrue(summary.contains("errors_total=1"));
        assertTrue(summary.contains("steps:"));
        assertTrue(summary.contains(RunTelemetry.STEP_FETCH));
        assertTrue(summary.contains("note=rate limited"));
    }

    @Test
    void repeatedStepsShouldAccumulate() {
        RunTelemetry telemetry = new RunTelemetry(" ", Instant.parse("2026-02-23T00:00:00Z"));
        for (int i = 0; i < 3; i++) {
            telemetry.startStep("fetch");
            telemetry.endStep("fetch", 1, 1, 0);
        }

        List<RunTelemetry.StepRecord> records = telemetry.stepRecords();

        assertEquals("MANUAL", telemetry.runMode());
        assertEquals(1, records.size());
        assertEquals(RunTelemetry.STEP_FETCH, records.get(0).name());
        assertEquals(3L, records.get(0).calls());
        assertEquals(3L, records.get(0).itemsOut());
    }
}
