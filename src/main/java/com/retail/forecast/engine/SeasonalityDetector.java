package com.retail.forecast.engine;

import com.retail.forecast.config.ForecastProperties;
import com.retail.forecast.engine.calendar.CalendarEffectCalculator;
import com.retail.forecast.engine.stats.SeriesStatistics;
import com.retail.forecast.model.DailyObservation;
import com.retail.forecast.model.SeasonalityResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.format.TextStyle;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Detects repeating demand patterns.
 *
 * Three signals are combined by taking the maximum:
 * <ul>
 *   <li>autocorrelation at each candidate period with at least two full cycles of data</li>
 *   <li>weekly pattern: spread of day-of-week averages relative to the overall mean</li>
 *   <li>calendar pattern: relative lift of Ramadan and Lebaran days over ordinary days</li>
 * </ul>
 */
@Component
public class SeasonalityDetector {

    private static final Logger log = LoggerFactory.getLogger(SeasonalityDetector.class);

    static final String RAMADAN_PERIOD = "Ramadan Period";
    static final String LEBARAN_PERIOD = "Lebaran Period";

    private static final int DAYS_PER_WEEK = 7;
    private static final int DEFAULT_PERIOD = 7;

    private final ForecastProperties.Seasonality config;
    private final CalendarEffectCalculator calendar;

    public SeasonalityDetector(ForecastProperties properties, CalendarEffectCalculator calendar) {
        this.config = properties.getSeasonality();
        this.calendar = calendar;
    }

    public SeasonalityResult detect(List<DailyObservation> series) {
        int n = series.size();
        if (n < config.getMinSamples()) {
            log.debug("Seasonality detection skipped: {} sample(s), need {}", n, config.getMinSamples());
            return SeasonalityResult.builder()
                    .detected(false)
                    .strength(0.0)
                    .period(DEFAULT_PERIOD)
                    .peakPeriods(Collections.emptyList())
                    .build();
        }

        double[] values = SeriesStatistics.values(series);
        double mean = SeriesStatistics.mean(values);

        int bestPeriod = DEFAULT_PERIOD;
        double bestAutocorrelation = 0.0;
        for (int period : config.getCandidatePeriods()) {
            if (period <= 0 || n < 2 * period) continue;
            double strength = Math.abs(autocorrelation(values, mean, period));
            if (strength > bestAutocorrelation) {
                bestAutocorrelation = strength;
                bestPeriod = period;
            }
        }

        double[] dayAverages = dayOfWeekAverages(series);
        double weeklyStrength = mean > 0 ? SeriesStatistics.stdDev(dayAverages) / mean : 0.0;

        double[] calendarEffects = calendarEffects(series);
        double ramadanEffect = calendarEffects[0];
        double lebaranEffect = calendarEffects[1];
        double calendarStrength = Math.max(Math.abs(ramadanEffect), Math.abs(lebaranEffect));

        double combined = Math.max(bestAutocorrelation, Math.max(weeklyStrength, calendarStrength));
        combined = SeriesStatistics.clamp(combined, 0.0, 1.0);

        List<String> peakPeriods = new ArrayList<>();
        for (DayOfWeek day : DayOfWeek.values()) {
            if (dayAverages[day.getValue() % DAYS_PER_WEEK] > mean) {
                peakPeriods.add(day.getDisplayName(TextStyle.FULL, Locale.ENGLISH));
            }
        }
        if (ramadanEffect > config.getRamadanPeakThreshold()) {
            peakPeriods.add(RAMADAN_PERIOD);
        }
        if (lebaranEffect > config.getLebaranPeakThreshold()) {
            peakPeriods.add(LEBARAN_PERIOD);
        }

        SeasonalityResult result = SeasonalityResult.builder()
                .detected(combined > config.getDetectionThreshold())
                .strength(combined)
                .period(bestPeriod)
                .peakPeriods(peakPeriods)
                .autocorrelationStrength(bestAutocorrelation)
                .weeklyPatternStrength(weeklyStrength)
                .ramadanEffect(ramadanEffect)
                .lebaranEffect(lebaranEffect)
                .build();

        log.debug("Seasonality: detected={}, strength={}, period={}, acf={}, weekly={}, ramadan={}, lebaran={}",
                result.isDetected(), combined, bestPeriod, bestAutocorrelation, weeklyStrength,
                ramadanEffect, lebaranEffect);
        return result;
    }

    /** sum((x_i - mean)(x_{i+lag} - mean)) / sum((x_i - mean)^2); 0 for a constant series. */
    static double autocorrelation(double[] values, double mean, int lag) {
        double denominator = 0.0;
        for (double value : values) {
            double d = value - mean;
            denominator += d * d;
        }
        if (denominator == 0.0) return 0.0;

        double numerator = 0.0;
        for (int i = 0; i + lag < values.length; i++) {
            numerator += (values[i] - mean) * (values[i + lag] - mean);
        }
        return numerator / denominator;
    }

    /** Sunday-first averages; days absent from the series average 0. */
    private double[] dayOfWeekAverages(List<DailyObservation> series) {
        double[] sums = new double[DAYS_PER_WEEK];
        int[] counts = new int[DAYS_PER_WEEK];
        for (DailyObservation observation : series) {
            sums[observation.getDayOfWeek()] += observation.getValue();
            counts[observation.getDayOfWeek()]++;
        }
        double[] averages = new double[DAYS_PER_WEEK];
        for (int d = 0; d < DAYS_PER_WEEK; d++) {
            averages[d] = counts[d] > 0 ? sums[d] / counts[d] : 0.0;
        }
        return averages;
    }

    /** [ramadanEffect, lebaranEffect], each (periodAverage - normalAverage) / normalAverage. */
    private double[] calendarEffects(List<DailyObservation> series) {
        double ramadanSum = 0.0, lebaranSum = 0.0, normalSum = 0.0;
        int ramadanCount = 0, lebaranCount = 0, normalCount = 0;

        for (DailyObservation observation : series) {
            if (calendar.isRamadan(observation.getDate())) {
                ramadanSum += observation.getValue();
                ramadanCount++;
            } else if (calendar.isLebaran(observation.getDate())) {
                lebaranSum += observation.getValue();
                lebaranCount++;
            } else {
                normalSum += observation.getValue();
                normalCount++;
            }
        }

        double normalAverage = normalCount > 0 ? normalSum / normalCount : 0.0;
        if (normalAverage <= 0) {
            return new double[]{0.0, 0.0};
        }
        double ramadanEffect = ramadanCount > 0 ? (ramadanSum / ramadanCount - normalAverage) / normalAverage : 0.0;
        double lebaranEffect = lebaranCount > 0 ? (lebaranSum / lebaranCount - normalAverage) / normalAverage : 0.0;
        return new double[]{ramadanEffect, lebaranEffect};
    }
}
