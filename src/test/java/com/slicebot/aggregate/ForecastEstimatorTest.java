package com.slicebot.aggregate;

import com.slicebot.config.Config;
import com.slicebot.model.DailyPoint;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ForecastEstimatorTest {
    private static final LocalDate START = LocalDate.of(2025, 9, 1);

    @Test
    void immatureRecentDaysAreExcludedNotBlended() {
        ForecastEstimator estimator = new ForecastEstimator(Config.of(Map.of()));

        ForecastEstimator.Result result = estimator.estimate(series(), 30.0);

        assertEquals(0.2, result.forecast, 1e-12);
        assertEquals(89, result.matureDays);
        assertEquals(31, result.immatureDays);
        assertEquals(START.plusDays(88), result.lastMatureDate);
    }

    @Test
    void finiteHalfLifeFavoursRecentMatureDays() {
        ForecastEstimator estimator = new ForecastEstimator(Config.of(Map.of("forecast.half_life_days", "7")));
        List<DailyPoint> series = new ArrayList<>();
        for (int i = 0; i < 60; i++) {
            long k = i < 20 ? 10 : 50;
            series.add(DailyPoint.of(START.plusDays(i), 100, k));
        }

        ForecastEstimator.Result result = estimator.estimate(series, 5.0);

        assertTrue(result.forecast > 0.45);
        assertTrue(result.forecast < 0.5);
    }

    @Test
    void emptySeriesHasNoForecast() {
        ForecastEstimator estimator = new ForecastEstimator(Config.of(Map.of()));

        assertFalse(estimator.estimate(List.of(), 10.0).hasForecast());
    }

    @Test
    void nonPositiveHalfLifeIsRejected() {
        ForecastEstimator estimator = new ForecastEstimator(Config.of(Map.of()));

        assertThrows(IllegalArgumentException.class, () -> estimator.estimate(series(), 30.0, 0.0));
    }

    // 120 days: 89 at p=0.2 followed by the most recent 31 at p=0.9
    private static List<DailyPoint> series() {
        List<DailyPoint> out = new ArrayList<>();
        for (int i = 0; i < 120; i++) {
            long k = i < 89 ? 20 : 90;
            out.add(DailyPoint.of(START.plusDays(i), 100, k));
        }
        return out;
    }
}
