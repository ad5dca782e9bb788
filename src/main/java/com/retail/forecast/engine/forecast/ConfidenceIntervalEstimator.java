package com.retail.forecast.engine.forecast;

import com.retail.forecast.engine.stats.SeriesStatistics;
import com.retail.forecast.model.ConfidenceInterval;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.springframework.stereotype.Component;

/**
 * Forecast bands from historical variance. The margin grows linearly with the day index,
 * reaching 1.5x the base margin at the end of the horizon.
 */
@Component
public class ConfidenceIntervalEstimator {

    private static final double HORIZON_WIDENING = 0.5;

    private final NormalDistribution standardNormal = new NormalDistribution();

    /**
     * Two-sided z for the confidence level, e.g. 0.95 -> 1.96.
     */
    public double zScore(double confidenceLevel) {
        if (!(confidenceLevel > 0.0 && confidenceLevel < 1.0)) {
            throw new IllegalArgumentException("Confidence level must be in (0, 1), got " + confidenceLevel);
        }
        return standardNormal.inverseCumulativeProbability(1.0 - (1.0 - confidenceLevel) / 2.0);
    }

    /**
     * Interval for one forecast day.
     *
     * @param predicted       forecast value for the day
     * @param dayIndex        0-based position within the horizon
     * @param totalDays       horizon length
     * @param history         cleaned history the standard deviation is taken from
     * @param confidenceLevel two-sided level
     */
    public ConfidenceInterval estimate(double predicted, int dayIndex, int totalDays,
                                       double[] history, double confidenceLevel) {
        return estimate(predicted, dayIndex, totalDays, SeriesStatistics.stdDev(history), zScore(confidenceLevel));
    }

    public ConfidenceInterval estimate(double predicted, int dayIndex, int totalDays, double stdDev, double z) {
        double horizonFactor = totalDays > 0
                ? 1.0 + ((double) dayIndex / totalDays) * HORIZON_WIDENING
                : 1.0;
        double margin = z * stdDev * horizonFactor;
        return ConfidenceInterval.builder()
                .lower(Math.max(0.0, predicted - margin))
                .upper(predicted + margin)
                .build();
    }
}
