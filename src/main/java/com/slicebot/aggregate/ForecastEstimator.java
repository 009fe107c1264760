package com.slicebot.aggregate;

import com.slicebot.config.Config;
import com.slicebot.model.DailyPoint;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Recency-weighted conversion estimate over settled days only.
 * A day is settled when it is at least {@code ceil(t95) + 1} days older than the series' last date;
 * each settled day is weighted {@code exp(-ln2 * age / halfLife)}.
 */
public final class ForecastEstimator {
    private static final double LN2 = Math.log(2.0);

    private final double defaultHalfLifeDays;

    public ForecastEstimator(Config config) {
        this.defaultHalfLifeDays = config.getDouble("forecast.half_life_days", Double.POSITIVE_INFINITY);
    }

    public Result estimate(List<DailyPoint> series, double t95Days) {
        return estimate(series, t95Days, defaultHalfLifeDays);
    }

    public Result estimate(List<DailyPoint> series, double t95Days, double halfLifeDays) {
        if (Double.isNaN(halfLifeDays) || halfLifeDays <= 0.0) {
            throw new IllegalArgumentException("half-life must be positive or infinite: " + halfLifeDays);
        }
        if (series == null || series.isEmpty()) {
            return new Result(Double.NaN, 0, 0, 0.0, 0.0, null);
        }
        List<DailyPoint> ordered = new ArrayList<>(series);
        ordered.sort(Comparator.comparing((DailyPoint p) -> p.date));
        LocalDate last = ordered.get(ordered.size() - 1).date;
        double t95 = Double.isNaN(t95Days) || t95Days < 0.0 ? 0.0 : t95Days;
        long cutoffDays = (long) Math.ceil(t95) + 1L;

        double weightedN = 0.0;
        double weightedK = 0.0;
        int mature = 0;
        int immature = 0;
        for (DailyPoint p : ordered) {
            long age = ChronoUnit.DAYS.between(p.date, last);
            if (age < cutoffDays) {
                immature++;
                continue;
            }
            double w = Double.isInfinite(halfLifeDays) ? 1.0 : Math.exp(-LN2 * age / halfLifeDays);
            weightedN += w * p.n;
            weightedK += w * p.k;
            mature++;
        }
        double forecast = weightedN > 0.0 ? weightedK / weightedN : Double.NaN;
        return new Result(forecast, mature, immature, weightedN, weightedK, last.minusDays(cutoffDays));
    }

    public static final class Result {
        public final double forecast;
        public final int matureDays;
        public final int immatureDays;
        public final double weightedN;
        public final double weightedK;
        public final LocalDate lastMatureDate;

        private Result(double forecast, int matureDays, int immatureDays, double weightedN, double weightedK, LocalDate lastMatureDate) {
            this.forecast = forecast;
            this.matureDays = matureDays;
            this.immatureDays = immatureDays;
            this.weightedN = weightedN;
            this.weightedK = weightedK;
            this.lastMatureDate = lastMatureDate;
        }

        public boolean hasForecast() {
            return !Double.isNaN(forecast);
        }
    }
}
