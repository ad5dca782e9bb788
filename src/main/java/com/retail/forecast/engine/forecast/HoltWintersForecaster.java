package com.retail.forecast.engine.forecast;

import com.retail.forecast.config.ForecastProperties;
import com.retail.forecast.engine.stats.SeriesStatistics;
import com.retail.forecast.model.ForecastModelType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Additive triple exponential smoothing (level, trend, season).
 *
 * Initial state: level = first value, trend = second minus first value, seasonal indices
 * averaged over the complete cycles of the history. Histories shorter than one season
 * fall back to a flat mean.
 */
@Component
public class HoltWintersForecaster implements Forecaster {

    private static final Logger log = LoggerFactory.getLogger(HoltWintersForecaster.class);

    private final ForecastProperties.Smoothing config;

    public HoltWintersForecaster(ForecastProperties properties) {
        this.config = properties.getSmoothing();
    }

    @Override
    public ForecastModelType getModelType() {
        return ForecastModelType.HOLT_WINTERS;
    }

    @Override
    public double[] forecast(double[] history, int horizon) {
        int n = history.length;
        int seasonLength = config.getSeasonLength();
        if (n < seasonLength) {
            log.debug("History of {} day(s) shorter than season length {}; using flat mean", n, seasonLength);
            return FlatMeanForecaster.flatMean(history, horizon);
        }

        HoltWintersState state = fit(history);
        double[] forecast = new double[horizon];
        for (int i = 0; i < horizon; i++) {
            forecast[i] = state.forecast(i + 1, n);
        }
        return forecast;
    }

    /**
     * Run the smoothing recurrence over the whole history and return the final state.
     * Requires at least one full season of data.
     */
    public HoltWintersState fit(double[] history) {
        int n = history.length;
        int seasonLength = config.getSeasonLength();
        if (n < seasonLength) {
            throw new IllegalArgumentException(
                    "Holt-Winters needs at least " + seasonLength + " points, got " + n);
        }

        double initialTrend = n > 1 ? history[1] - history[0] : 0.0;
        HoltWintersState state = new HoltWintersState(history[0], initialTrend, initialSeasonals(history));

        for (int t = 1; t < n; t++) {
            state = state.next(history[t], t, config.getAlpha(), config.getBeta(), config.getGamma());
        }
        return state;
    }

    private double[] initialSeasonals(double[] history) {
        int seasonLength = config.getSeasonLength();
        int cycles = history.length / seasonLength;
        double[] seasonals = new double[seasonLength];

        for (int c = 0; c < cycles; c++) {
            int from = c * seasonLength;
            double cycleMean = SeriesStatistics.mean(history, from, from + seasonLength);
            for (int k = 0; k < seasonLength; k++) {
                seasonals[k] += history[from + k] - cycleMean;
            }
        }
        for (int k = 0; k < seasonLength; k++) {
            seasonals[k] /= cycles;
        }
        return seasonals;
    }
}
