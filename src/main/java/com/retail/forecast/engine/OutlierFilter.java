package com.retail.forecast.engine;

import com.retail.forecast.config.ForecastProperties;
import com.retail.forecast.engine.stats.SeriesStatistics;
import com.retail.forecast.model.DailyObservation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Interquartile-range outlier removal.
 *
 * Quartiles are read at index floor(0.25 n) and floor(0.75 n) of the sorted values, without
 * interpolation. This is an approximation kept for reproducibility with historical results.
 */
@Component
public class OutlierFilter {

    private static final Logger log = LoggerFactory.getLogger(OutlierFilter.class);

    private final ForecastProperties.Outlier config;

    public OutlierFilter(ForecastProperties properties) {
        this.config = properties.getOutlier();
    }

    /**
     * Returns the observations inside [Q1 - k*IQR, Q3 + k*IQR] in their original order.
     * Series shorter than the configured minimum are returned unchanged.
     */
    public List<DailyObservation> filter(List<DailyObservation> series) {
        if (series.size() < config.getMinSamples()) {
            return new ArrayList<>(series);
        }

        double[] sorted = SeriesStatistics.values(series);
        Arrays.sort(sorted);
        double q1 = sorted[(int) Math.floor(sorted.length * 0.25)];
        double q3 = sorted[(int) Math.floor(sorted.length * 0.75)];
        double iqr = q3 - q1;
        double lower = q1 - config.getIqrMultiplier() * iqr;
        double upper = q3 + config.getIqrMultiplier() * iqr;

        List<DailyObservation> cleaned = new ArrayList<>(series.size());
        for (DailyObservation observation : series) {
            if (observation.getValue() >= lower && observation.getValue() <= upper) {
                cleaned.add(observation);
            }
        }

        if (cleaned.size() < series.size()) {
            log.debug("Removed {} outlier(s) outside [{}, {}] (Q1={}, Q3={})",
                    series.size() - cleaned.size(), lower, upper, q1, q3);
        }
        return cleaned;
    }
}
