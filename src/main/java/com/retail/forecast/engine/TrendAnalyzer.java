package com.retail.forecast.engine;

import com.retail.forecast.config.ForecastProperties;
import com.retail.forecast.engine.stats.SeriesStatistics;
import com.retail.forecast.model.DailyObservation;
import com.retail.forecast.model.TrendDirection;
import com.retail.forecast.model.TrendResult;
import org.apache.commons.math3.stat.regression.SimpleRegression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Detects a monotonic trend in a daily series.
 *
 * Slope and R² come from an ordinary least-squares fit of value against day index.
 * Significance comes from the Mann-Kendall test; its variance n(n-1)(2n+5)/18 is not
 * adjusted for tied values, so p-values are slightly conservative on series with many ties.
 */
@Component
public class TrendAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(TrendAnalyzer.class);

    private final ForecastProperties.Trend config;

    public TrendAnalyzer(ForecastProperties properties) {
        this.config = properties.getTrend();
    }

    public TrendResult analyze(List<DailyObservation> series) {
        return analyze(SeriesStatistics.values(series));
    }

    public TrendResult analyze(double[] values) {
        int n = values.length;
        if (n < config.getMinSamples()) {
            log.debug("Trend analysis skipped: {} sample(s), need {}", n, config.getMinSamples());
            return TrendResult.stable(n);
        }

        SimpleRegression regression = new SimpleRegression();
        for (int i = 0; i < n; i++) {
            regression.addData(i, values[i]);
        }
        double slope = regression.getSlope();
        double intercept = regression.getIntercept();
        double rSquared = regression.getRSquare();
        // Undefined for a constant series
        if (Double.isNaN(rSquared)) rSquared = 0.0;
        if (Double.isNaN(slope)) slope = 0.0;
        if (Double.isNaN(intercept)) intercept = SeriesStatistics.mean(values);

        long s = mannKendallS(values);
        double pValue = mannKendallPValue(s, n);

        TrendDirection direction = TrendDirection.STABLE;
        if (pValue < config.getSignificanceLevel()) {
            if (slope > 0) {
                direction = TrendDirection.INCREASING;
            } else if (slope < 0) {
                direction = TrendDirection.DECREASING;
            }
        }

        return TrendResult.builder()
                .direction(direction)
                .slope(slope)
                .intercept(intercept)
                .rSquared(rSquared)
                .pValue(pValue)
                .mannKendallS(s)
                .confidence(rSquared * (1.0 - pValue))
                .sampleSize(n)
                .build();
    }

    /** S = sum of sign(x_j - x_i) over all i < j. */
    static long mannKendallS(double[] values) {
        long s = 0;
        for (int i = 0; i < values.length - 1; i++) {
            for (int j = i + 1; j < values.length; j++) {
                s += (long) Math.signum(values[j] - values[i]);
            }
        }
        return s;
    }

    /** Two-sided p-value 2(1 - Phi(|z|)) with z = S / sqrt(n(n-1)(2n+5)/18). */
    static double mannKendallPValue(long s, int n) {
        double variance = n * (n - 1.0) * (2.0 * n + 5.0) / 18.0;
        if (variance <= 0) return 1.0;
        double z = s / Math.sqrt(variance);
        double p = 2.0 * (1.0 - SeriesStatistics.normalCdf(Math.abs(z)));
        return SeriesStatistics.clamp(p, 0.0, 1.0);
    }
}
