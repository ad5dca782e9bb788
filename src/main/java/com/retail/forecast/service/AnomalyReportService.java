package com.retail.forecast.service;

import com.retail.forecast.config.MetricsConfig;
import com.retail.forecast.engine.SeriesBuilder;
import com.retail.forecast.engine.anomaly.AnomalyDetector;
import com.retail.forecast.engine.calendar.CalendarEffectCalculator;
import com.retail.forecast.model.Anomaly;
import com.retail.forecast.model.AnomalyReport;
import com.retail.forecast.model.AnomalySummary;
import com.retail.forecast.model.AnomalyType;
import com.retail.forecast.model.DailyObservation;
import com.retail.forecast.model.DemandEvent;
import com.retail.forecast.model.ProductRef;
import com.retail.forecast.model.SeverityLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Builds anomaly reports for a product.
 *
 * Detection runs on the raw daily series; outlier cleaning is a forecasting step only.
 * Anomalies are ordered by severity (highest first), then by date (latest first).
 */
@Service
public class AnomalyReportService {

    private static final Logger log = LoggerFactory.getLogger(AnomalyReportService.class);

    private static final Comparator<Anomaly> BY_SEVERITY_THEN_RECENCY = Comparator
            .comparingDouble(Anomaly::getSeverityScore).reversed()
            .thenComparing(Anomaly::getDate, Comparator.reverseOrder());

    private final SeriesBuilder seriesBuilder;
    private final AnomalyDetector detector;
    private final MetricsConfig metricsConfig;

    public AnomalyReportService(SeriesBuilder seriesBuilder,
                                AnomalyDetector detector,
                                MetricsConfig metricsConfig) {
        this.seriesBuilder = seriesBuilder;
        this.detector = detector;
        this.metricsConfig = metricsConfig;
    }

    public AnomalyReport report(ProductRef product, List<DemandEvent> events, LocalDate start, LocalDate end) {
        List<DailyObservation> series = seriesBuilder.build(
                events != null ? events : Collections.emptyList(), start, end);
        return report(product, series);
    }

    /**
     * @throws com.retail.forecast.engine.SeriesValidationException if the series has duplicate,
     *         out-of-order, undated or negative entries
     */
    public AnomalyReport report(ProductRef product, List<DailyObservation> series) {
        seriesBuilder.validate(series);
        List<Anomaly> anomalies = new ArrayList<>(detector.detect(series, product));
        return buildReport(product, series.size(), anomalies);
    }

    /**
     * Report with per-call sensitivity (1-10) and minimum deviation percent.
     */
    public AnomalyReport report(ProductRef product, List<DailyObservation> series,
                                int sensitivityLevel, double minDeviationPercent) {
        seriesBuilder.validate(series);
        List<Anomaly> anomalies = new ArrayList<>(
                detector.detect(series, product, sensitivityLevel, minDeviationPercent));
        return buildReport(product, series.size(), anomalies);
    }

    private AnomalyReport buildReport(ProductRef product, int days, List<Anomaly> anomalies) {
        anomalies.sort(BY_SEVERITY_THEN_RECENCY);
        for (Anomaly anomaly : anomalies) {
            metricsConfig.recordAnomalyDetected(anomaly.getType().name());
        }

        AnomalySummary summary = summarize(anomalies);
        String productId = product != null ? product.getProductId() : null;
        log.info("Anomaly report for product {}: {} anomalie(s) in {} day(s) (spikes={}, drops={})",
                productId, summary.getTotalAnomalies(), days, summary.getSpikes(), summary.getDrops());

        return AnomalyReport.builder()
                .productId(productId)
                .productName(product != null ? product.getProductName() : null)
                .anomalies(anomalies)
                .summary(summary)
                .insights(insights(anomalies, summary))
                .generatedAt(Instant.now())
                .build();
    }

    AnomalySummary summarize(List<Anomaly> anomalies) {
        Map<SeverityLevel, Long> distribution = new EnumMap<>(SeverityLevel.class);
        for (SeverityLevel level : SeverityLevel.values()) {
            distribution.put(level, 0L);
        }

        int spikes = 0;
        int drops = 0;
        double deviationSum = 0.0;
        for (Anomaly anomaly : anomalies) {
            if (anomaly.getType() == AnomalyType.SPIKE) spikes++;
            if (anomaly.getType() == AnomalyType.DROP) drops++;
            distribution.merge(anomaly.getSeverityLevel(), 1L, Long::sum);
            deviationSum += Math.abs(anomaly.getDeviationPercent());
        }

        return AnomalySummary.builder()
                .totalAnomalies(anomalies.size())
                .spikes(spikes)
                .drops(drops)
                .severityDistribution(distribution)
                .averageDeviation(anomalies.isEmpty() ? 0.0 : deviationSum / anomalies.size())
                .build();
    }

    private List<String> insights(List<Anomaly> anomalies, AnomalySummary summary) {
        List<String> insights = new ArrayList<>();
        if (anomalies.isEmpty()) {
            insights.add("No significant demand anomalies in the analyzed period");
            return insights;
        }

        long weekend = anomalies.stream()
                .filter(a -> CalendarEffectCalculator.isWeekend(a.getDate()))
                .count();
        if (weekend > anomalies.size() * 0.3) {
            insights.add("Weekend demand differs significantly from weekdays");
        }

        if (summary.getSpikes() > summary.getDrops() * 2) {
            insights.add("More demand spikes than drops, suggesting a growing market");
        } else if (summary.getDrops() > summary.getSpikes() * 2) {
            insights.add("More demand drops than spikes, suggesting a declining trend");
        }

        long critical = summary.getSeverityDistribution().getOrDefault(SeverityLevel.CRITICAL, 0L);
        if (critical > 0) {
            insights.add(critical + " critical anomalie(s) need immediate review");
        }

        long recurring = anomalies.stream()
                .filter(a -> a.getPatternContext() != null && a.getPatternContext().isRecurring())
                .count();
        if (recurring > 0) {
            insights.add(recurring + " anomalie(s) match a recurring weekly or monthly pattern");
        }
        return insights;
    }
}
