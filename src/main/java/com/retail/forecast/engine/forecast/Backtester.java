package com.retail.forecast.engine.forecast;

import com.retail.forecast.config.ForecastProperties;
import com.retail.forecast.model.BacktestResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Arrays;

/**
 * Walk-forward evaluation of a forecaster.
 *
 * Holds out up to maxWindows trailing, non-overlapping windows of one horizon each, trains on
 * everything strictly before each window and compares the forecast with the held-out actuals.
 * MAPE skips days with zero actual demand. Histories shorter than two horizons get a
 * conservative default result with samplesTested = 0.
 */
@Component
public class Backtester {

    private static final Logger log = LoggerFactory.getLogger(Backtester.class);

    private final ForecastProperties.Backtest config;

    public Backtester(ForecastProperties properties) {
        this.config = properties.getBacktest();
    }

    public BacktestResult backtest(double[] history, int horizon, Forecaster forecaster) {
        int n = history.length;
        if (horizon <= 0 || n < 2 * horizon) {
            log.debug("Backtest skipped: {} day(s) of history for horizon {}", n, horizon);
            return defaultResult();
        }

        double absPctErrorSum = 0.0;
        int pctSamples = 0;
        double squaredErrorSum = 0.0;
        double absErrorSum = 0.0;
        int samples = 0;
        int windows = 0;

        for (int w = 0; w < config.getMaxWindows(); w++) {
            int testEnd = n - w * horizon;
            int testStart = testEnd - horizon;
            // Each window needs at least one horizon of training data
            if (testStart < horizon) break;

            double[] train = Arrays.copyOfRange(history, 0, testStart);
            double[] predicted = forecaster.forecast(train, horizon);

            for (int i = 0; i < horizon; i++) {
                double actual = history[testStart + i];
                double error = actual - predicted[i];
                absErrorSum += Math.abs(error);
                squaredErrorSum += error * error;
                samples++;
                if (actual != 0.0) {
                    absPctErrorSum += Math.abs(error / actual);
                    pctSamples++;
                }
            }
            windows++;
        }

        double mape = pctSamples > 0 ? absPctErrorSum / pctSamples : 0.0;
        double rmse = Math.sqrt(squaredErrorSum / samples);
        double mae = absErrorSum / samples;
        double accuracy = Math.max(config.getMinAccuracy(), 1.0 - mape);

        log.debug("Backtest with {}: windows={}, samples={}, mape={}, rmse={}, mae={}, accuracy={}",
                forecaster.getModelType(), windows, samples, mape, rmse, mae, accuracy);

        return BacktestResult.builder()
                .accuracy(accuracy)
                .mape(mape)
                .rmse(rmse)
                .mae(mae)
                .samplesTested(samples)
                .windowsTested(windows)
                .build();
    }

    private BacktestResult defaultResult() {
        return BacktestResult.builder()
                .accuracy(config.getDefaultAccuracy())
                .mape(config.getDefaultMape())
                .rmse(0.0)
                .mae(0.0)
                .samplesTested(0)
                .windowsTested(0)
                .build();
    }
}
