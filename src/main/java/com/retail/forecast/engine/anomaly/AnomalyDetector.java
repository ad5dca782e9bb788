package com.retail.forecast.engine.anomaly;

import com.retail.forecast.config.ForecastProperties;
import com.retail.forecast.engine.calendar.CalendarEffectCalculator;
import com.retail.forecast.engine.stats.SeriesStatistics;
import com.retail.forecast.model.ActionPriority;
import com.retail.forecast.model.Anomaly;
import com.retail.forecast.model.AnomalyType;
import com.retail.forecast.model.BusinessImpact;
import com.retail.forecast.model.DailyObservation;
import com.retail.forecast.model.PatternContext;
import com.retail.forecast.model.ProductRef;
import com.retail.forecast.model.RecommendedAction;
import com.retail.forecast.model.SeverityLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.Month;
import java.util.ArrayList;
import java.util.List;

/**
 * Sliding-window z-score detector for daily demand.
 *
 * Each point after the first window is compared with the mean and population standard deviation
 * of the preceding window. A point is anomalous when its z-score exceeds the threshold for the
 * sensitivity level and its deviation from the window mean is at least minDeviationPercent.
 * A flat window (standard deviation 0) makes any differing value infinitely unusual.
 */
@Component
public class AnomalyDetector {

    private static final Logger log = LoggerFactory.getLogger(AnomalyDetector.class);

    // Sensitivity level 1..10 -> z-score threshold
    private static final double[] SENSITIVITY_THRESHOLDS = {3.0, 2.8, 2.6, 2.4, 2.2, 2.0, 1.8, 1.6, 1.4, 1.2};

    private static final double HIGH_SEVERITY = 0.7;

    private final ForecastProperties.Anomaly config;
    private final CalendarEffectCalculator calendar;

    public AnomalyDetector(ForecastProperties properties, CalendarEffectCalculator calendar) {
        this.config = properties.getAnomaly();
        this.calendar = calendar;
    }

    public List<Anomaly> detect(List<DailyObservation> series, ProductRef product) {
        return detect(series, product, config.getSensitivityLevel(), config.getMinDeviationPercent());
    }

    /**
     * Detect anomalies with explicit sensitivity (1-10, clamped) and minimum deviation percent.
     * Returned in date order.
     */
    public List<Anomaly> detect(List<DailyObservation> series, ProductRef product,
                                int sensitivityLevel, double minDeviationPercent) {
        int window = config.getWindowSize();
        List<Anomaly> anomalies = new ArrayList<>();
        if (window <= 0 || series.size() <= window) {
            log.debug("Anomaly detection skipped: {} point(s), window {}", series.size(), window);
            return anomalies;
        }

        double threshold = sensitivityThreshold(sensitivityLevel);
        double[] values = SeriesStatistics.values(series);

        for (int i = window; i < values.length; i++) {
            double mean = SeriesStatistics.mean(values, i - window, i);
            double stdDev = SeriesStatistics.stdDev(values, i - window, i);
            double current = values[i];
            double difference = Math.abs(current - mean);

            double zScore;
            if (stdDev > 0) {
                zScore = difference / stdDev;
            } else {
                zScore = difference > 0 ? Double.POSITIVE_INFINITY : 0.0;
            }
            if (zScore <= threshold) continue;

            double deviationPercent = mean > 0 ? (current - mean) / mean * 100.0 : 0.0;
            if (Math.abs(deviationPercent) < minDeviationPercent) continue;

            DailyObservation observation = series.get(i);
            AnomalyType type = classify(observation, current, mean, deviationPercent);
            if (!included(type)) continue;

            anomalies.add(buildAnomaly(observation, product, mean, deviationPercent, zScore, type));
        }

        log.debug("Detected {} anomalie(s) in {} point(s) for product {} (z > {}, |dev| >= {}%)",
                anomalies.size(), values.length, product != null ? product.getProductId() : null,
                threshold, minDeviationPercent);
        return anomalies;
    }

    public static double sensitivityThreshold(int sensitivityLevel) {
        int index = Math.max(0, Math.min(SENSITIVITY_THRESHOLDS.length - 1, sensitivityLevel - 1));
        return SENSITIVITY_THRESHOLDS[index];
    }

    AnomalyType classify(DailyObservation observation, double current, double expected, double deviationPercent) {
        double spikeDrop = config.getSpikeDropPercent();
        if (deviationPercent > spikeDrop) {
            return AnomalyType.SPIKE;
        }
        if (deviationPercent < -spikeDrop) {
            return AnomalyType.DROP;
        }
        if (Math.abs(deviationPercent) > config.getMinDeviationPercent()) {
            return observation.isWeekend() ? AnomalyType.SEASONAL_DEVIATION : AnomalyType.TREND_BREAK;
        }
        return current > expected ? AnomalyType.SPIKE : AnomalyType.DROP;
    }

    private boolean included(AnomalyType type) {
        switch (type) {
            case SPIKE:
                return config.isDetectSpikes();
            case DROP:
                return config.isDetectDrops();
            case SEASONAL_DEVIATION:
                return config.isIncludeSeasonalAnomalies();
            default:
                return true;
        }
    }

    private Anomaly buildAnomaly(DailyObservation observation, ProductRef product, double expected,
                                 double deviationPercent, double zScore, AnomalyType type) {
        double severityScore = Math.min(1.0, zScore / 3.0);
        double confidence = SeriesStatistics.clamp(severityScore, 0.5, 1.0);

        return Anomaly.builder()
                .date(observation.getDate())
                .type(type)
                .expected(expected)
                .actual(observation.getValue())
                .deviationPercent(Math.round(deviationPercent * 100.0) / 100.0)
                .zScore(zScore)
                .severityScore(severityScore)
                .severityLevel(SeverityLevel.fromScore(severityScore))
                .confidence(confidence)
                .possibleCauses(possibleCauses(observation.getDate(), type, deviationPercent))
                .recommendedActions(recommendations(type, severityScore))
                .businessImpact(businessImpact(product, observation.getValue(), expected, type))
                .patternContext(patternContext(observation.getDate(), type))
                .build();
    }

    private List<String> possibleCauses(LocalDate date, AnomalyType type, double deviationPercent) {
        List<String> causes = new ArrayList<>();

        calendar.holidayName(date).ifPresent(name -> causes.add(name + " holiday effect"));
        if (calendar.isRamadan(date)) {
            causes.add("Ramadan demand pattern");
        } else if (calendar.isLebaran(date)) {
            causes.add("Lebaran demand pattern");
        }
        if (CalendarEffectCalculator.isWeekend(date)) {
            causes.add("Weekend demand pattern");
        }
        if (date.getMonth() == Month.DECEMBER || date.getMonth() == Month.JANUARY) {
            causes.add("Year-end holiday season effect");
        }

        if (type == AnomalyType.SPIKE) {
            causes.add("Promotional campaign or viral marketing");
            causes.add("Competitor stockout or supply shortage");
            causes.add("Social media influence or trending product");
            if (Math.abs(deviationPercent) > 100) {
                causes.add("One-time bulk purchase or B2B order");
            }
        } else if (type == AnomalyType.DROP) {
            causes.add("Competitor promotion or price war");
            causes.add("Product quality issue or negative reviews");
            causes.add("Supply chain disruption");
            causes.add("Economic or external market factors");
        }

        causes.add("Data quality issue or system error");
        causes.add("Seasonal shift or trend change");
        return causes;
    }

    private List<RecommendedAction> recommendations(AnomalyType type, double severityScore) {
        List<RecommendedAction> actions = new ArrayList<>();

        if (type == AnomalyType.SPIKE) {
            actions.add(action("Investigate demand drivers and capitalize on the opportunity",
                    ActionPriority.HIGH, "Immediate (24 hours)"));
            if (severityScore > HIGH_SEVERITY) {
                actions.add(action("Check inventory levels and prepare an emergency restock",
                        ActionPriority.HIGH, "Immediate"));
            }
            actions.add(action("Analyze customer segments for targeted marketing",
                    ActionPriority.MEDIUM, "1-3 days"));
        } else if (type == AnomalyType.DROP) {
            actions.add(action("Investigate root cause: competitors, quality, pricing",
                    ActionPriority.HIGH, "Immediate (24 hours)"));
            actions.add(action("Review marketing strategy and promotional activities",
                    ActionPriority.MEDIUM, "2-5 days"));
            if (severityScore > HIGH_SEVERITY) {
                actions.add(action("Consider a pricing adjustment or promotional campaign",
                        ActionPriority.HIGH, "1-2 days"));
            }
        }

        actions.add(action("Update demand forecast models with the new data", ActionPriority.MEDIUM, "1 week"));
        actions.add(action("Set up monitoring alerts for similar patterns", ActionPriority.LOW, "2 weeks"));
        return actions;
    }

    private BusinessImpact businessImpact(ProductRef product, double actual, double expected, AnomalyType type) {
        double price = product != null ? product.getSellingPrice() : 0.0;
        double difference = actual - expected;

        long inventoryImpact = 0;
        int satisfactionImpact = 0;
        if (type == AnomalyType.SPIKE) {
            inventoryImpact = Math.round(-difference);
            // Risk of stockout affecting customers
            satisfactionImpact = inventoryImpact < -10 ? -20 : 0;
        } else if (type == AnomalyType.DROP) {
            inventoryImpact = Math.round(-difference);
            satisfactionImpact = difference < -20 ? -10 : 0;
        }

        return BusinessImpact.builder()
                .revenueImpact(Math.round(difference * price))
                .inventoryImpact(inventoryImpact)
                .customerSatisfactionImpact(satisfactionImpact)
                .build();
    }

    private PatternContext patternContext(LocalDate date, AnomalyType type) {
        DayOfWeek dow = date.getDayOfWeek();
        int dayOfMonth = date.getDayOfMonth();

        if (CalendarEffectCalculator.isWeekend(date) && type == AnomalyType.DROP) {
            return new PatternContext(true, "weekly", true);
        }
        if (dow == DayOfWeek.MONDAY && type == AnomalyType.SPIKE) {
            return new PatternContext(true, "weekly", true);
        }
        if (dayOfMonth > 25 && type == AnomalyType.SPIKE) {
            return new PatternContext(true, "monthly", true);
        }
        return new PatternContext(false, null, false);
    }

    private static RecommendedAction action(String action, ActionPriority priority, String timeline) {
        return RecommendedAction.builder()
                .action(action)
                .priority(priority)
                .timeline(timeline)
                .build();
    }
}
