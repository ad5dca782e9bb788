package com.retail.forecast.engine.forecast;

import com.retail.forecast.engine.stats.SeriesStatistics;
import com.retail.forecast.model.ForecastModelType;
import org.springframework.stereotype.Component;

import java.util.Arrays;

/**
 * Repeats the historical mean for every future day. Also the fallback for histories
 * too short to fit a seasonal model.
 */
@Component
public class FlatMeanForecaster implements Forecaster {

    @Override
    public ForecastModelType getModelType() {
        return ForecastModelType.FLAT_MEAN;
    }

    @Override
    public double[] forecast(double[] history, int horizon) {
        return flatMean(history, horizon);
    }

    static double[] flatMean(double[] history, int horizon) {
        double[] forecast = new double[Math.max(0, horizon)];
        Arrays.fill(forecast, Math.max(0.0, SeriesStatistics.mean(history)));
        return forecast;
    }
}
