package com.retail.forecast.engine.stats;

import com.retail.forecast.model.DailyObservation;

import java.util.List;

/**
 * Small numeric helpers shared by the analysis components.
 * All standard deviations are population (divide by n).
 */
public final class SeriesStatistics {

    // Abramowitz & Stegun 7.1.26 coefficients
    private static final double P = 0.3275911;
    private static final double A1 = 0.254829592;
    private static final double A2 = -0.284496736;
    private static final double A3 = 1.421413741;
    private static final double A4 = -1.453152027;
    private static final double A5 = 1.061405429;

    private SeriesStatistics() {}

    public static double[] values(List<DailyObservation> series) {
        double[] values = new double[series.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = series.get(i).getValue();
        }
        return values;
    }

    public static double mean(double[] values) {
        return mean(values, 0, values.length);
    }

    /** Mean of values[from, to). Returns 0 for an empty range. */
    public static double mean(double[] values, int from, int to) {
        if (to <= from) return 0.0;
        double sum = 0.0;
        for (int i = from; i < to; i++) {
            sum += values[i];
        }
        return sum / (to - from);
    }

    public static double stdDev(double[] values) {
        return stdDev(values, 0, values.length);
    }

    public static double stdDev(double[] values, int from, int to) {
        if (to <= from) return 0.0;
        double mean = mean(values, from, to);
        double sumSq = 0.0;
        for (int i = from; i < to; i++) {
            double d = values[i] - mean;
            sumSq += d * d;
        }
        return Math.sqrt(sumSq / (to - from));
    }

    /**
     * Error function via Abramowitz & Stegun 7.1.26 (max absolute error 1.5e-7).
     */
    public static double erf(double x) {
        double sign = x < 0 ? -1.0 : 1.0;
        double ax = Math.abs(x);
        double t = 1.0 / (1.0 + P * ax);
        double y = 1.0 - (((((A5 * t + A4) * t) + A3) * t + A2) * t + A1) * t * Math.exp(-ax * ax);
        return sign * y;
    }

    /** Standard normal CDF built on {@link #erf(double)}. */
    public static double normalCdf(double z) {
        return 0.5 * (1.0 + erf(z / Math.sqrt(2.0)));
    }

    public static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
