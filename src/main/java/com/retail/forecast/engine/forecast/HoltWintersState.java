package com.retail.forecast.engine.forecast;

import java.util.Arrays;

/**
 * Immutable level / trend / seasonal-index state of one Holt-Winters fit.
 * Each update returns a new state; the seasonal array is never shared between states.
 */
public record HoltWintersState(double level, double trend, double[] seasonals) {

    public HoltWintersState {
        seasonals = Arrays.copyOf(seasonals, seasonals.length);
    }

    /**
     * Apply observation x at time index t.
     */
    public HoltWintersState next(double x, int t, double alpha, double beta, double gamma) {
        int slot = t % seasonals.length;
        double previousSeasonal = seasonals[slot];

        double newLevel = alpha * (x - previousSeasonal) + (1.0 - alpha) * (level + trend);
        double newTrend = beta * (newLevel - level) + (1.0 - beta) * trend;

        double[] newSeasonals = Arrays.copyOf(seasonals, seasonals.length);
        newSeasonals[slot] = gamma * (x - newLevel) + (1.0 - gamma) * previousSeasonal;

        return new HoltWintersState(newLevel, newTrend, newSeasonals);
    }

    /**
     * Forecast for h steps (1-based) after a history of n points, floored at 0.
     */
    public double forecast(int h, int n) {
        double value = level + h * trend + seasonals[(n + h - 1) % seasonals.length];
        return Math.max(0.0, value);
    }

    @Override
    public double[] seasonals() {
        return Arrays.copyOf(seasonals, seasonals.length);
    }

    public double seasonal(int slot) {
        return seasonals[slot];
    }
}
