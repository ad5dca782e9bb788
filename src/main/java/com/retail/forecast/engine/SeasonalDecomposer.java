package com.retail.forecast.engine;

import com.retail.forecast.config.ForecastProperties;
import com.retail.forecast.engine.stats.SeriesStatistics;
import com.retail.forecast.model.DailyObservation;
import com.retail.forecast.model.Decomposition;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Additive trend / day-of-week seasonal / residual decomposition.
 *
 * Trend: the first window's moving average for the opening points, then each later point
 * exponentially smooths the trailing moving average into the previous trend value.
 * Seasonal: one index per day-of-week, the mean of (value - trend) over matching days.
 */
@Component
public class SeasonalDecomposer {

    private static final int DAYS_PER_WEEK = 7;

    private final ForecastProperties.Decomposition config;

    public SeasonalDecomposer(ForecastProperties properties) {
        this.config = properties.getDecomposition();
    }

    public Decomposition decompose(List<DailyObservation> series) {
        int n = series.size();
        double[] values = SeriesStatistics.values(series);

        if (n == 0) {
            return Decomposition.builder()
                    .trend(new double[0])
                    .seasonal(new double[0])
                    .residual(new double[0])
                    .baseline(config.getDefaultBaseline())
                    .seasonalIndices(new double[DAYS_PER_WEEK])
                    .build();
        }

        double mean = SeriesStatistics.mean(values);
        double[] trend = new double[n];
        double[] seasonal = new double[n];
        double[] residual = new double[n];
        double[] indices = new double[DAYS_PER_WEEK];

        if (n < config.getMinSamples()) {
            for (int i = 0; i < n; i++) {
                trend[i] = mean;
                residual[i] = values[i] - mean;
            }
            return Decomposition.builder()
                    .trend(trend)
                    .seasonal(seasonal)
                    .residual(residual)
                    .baseline(mean)
                    .seasonalIndices(indices)
                    .build();
        }

        int window = Math.min(config.getWindowSize(), n);
        double alpha = config.getSmoothingAlpha();
        double firstWindowAverage = SeriesStatistics.mean(values, 0, window);
        for (int i = 0; i < n; i++) {
            if (i < window) {
                trend[i] = firstWindowAverage;
            } else {
                double movingAverage = SeriesStatistics.mean(values, i - window + 1, i + 1);
                trend[i] = alpha * movingAverage + (1.0 - alpha) * trend[i - 1];
            }
        }

        double[] detrendedSum = new double[DAYS_PER_WEEK];
        int[] counts = new int[DAYS_PER_WEEK];
        for (int i = 0; i < n; i++) {
            int dow = series.get(i).getDayOfWeek();
            detrendedSum[dow] += values[i] - trend[i];
            counts[dow]++;
        }
        for (int d = 0; d < DAYS_PER_WEEK; d++) {
            indices[d] = counts[d] > 0 ? detrendedSum[d] / counts[d] : 0.0;
        }

        for (int i = 0; i < n; i++) {
            seasonal[i] = indices[series.get(i).getDayOfWeek()];
            residual[i] = values[i] - trend[i] - seasonal[i];
        }

        return Decomposition.builder()
                .trend(trend)
                .seasonal(seasonal)
                .residual(residual)
                .baseline(mean)
                .seasonalIndices(indices)
                .build();
    }
}
