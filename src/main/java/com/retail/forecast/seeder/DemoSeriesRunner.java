package com.retail.forecast.seeder;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.retail.forecast.engine.calendar.CalendarEffectCalculator;
import com.retail.forecast.model.AnomalyReport;
import com.retail.forecast.model.DemandEvent;
import com.retail.forecast.model.ForecastRequest;
import com.retail.forecast.model.ForecastResult;
import com.retail.forecast.model.ProductRef;
import com.retail.forecast.service.AnomalyReportService;
import com.retail.forecast.service.BatchForecastService;
import com.retail.forecast.service.DemandForecastService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Synthesizes a year of stock movements for a few demo products, then logs a forecast
 * and an anomaly report as JSON. Only runs when the "demo" Spring profile is active.
 *
 * Run with:  mvn spring-boot:run -Dspring-boot.run.profiles=demo
 *
 * Products:
 *   - SKU-001: steady staple with weekly rhythm and calendar lift
 *   - SKU-002: growing product with a few injected spikes and stockout days
 *   - SKU-003: low-volume product with receipts mixed into the movements
 */
@Component
@Profile("demo")
public class DemoSeriesRunner implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(DemoSeriesRunner.class);

    private static final LocalDate HISTORY_START = LocalDate.of(2025, 1, 1);
    private static final LocalDate HISTORY_END = LocalDate.of(2025, 12, 31);

    private final DemandForecastService forecastService;
    private final AnomalyReportService anomalyReportService;
    private final BatchForecastService batchForecastService;
    private final CalendarEffectCalculator calendar;
    private final ObjectMapper objectMapper;
    private final Random random = new Random(42); // fixed seed for reproducibility

    public DemoSeriesRunner(DemandForecastService forecastService,
                            AnomalyReportService anomalyReportService,
                            BatchForecastService batchForecastService,
                            CalendarEffectCalculator calendar) {
        this.forecastService = forecastService;
        this.anomalyReportService = anomalyReportService;
        this.batchForecastService = batchForecastService;
        this.calendar = calendar;
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public void run(String... args) throws Exception {
        log.info("=== Starting demand forecast demo ===");

        ProductRef staple = new ProductRef("SKU-001", "Beras Premium 5kg", 75_000);
        ProductRef growing = new ProductRef("SKU-002", "Sirup Marjan 460ml", 25_000);
        ProductRef slow = new ProductRef("SKU-003", "Kue Kering Nastar", 60_000);

        List<DemandEvent> stapleEvents = generateEvents(40, 0.0, false);
        List<DemandEvent> growingEvents = generateEvents(15, 0.05, true);
        List<DemandEvent> slowEvents = generateEvents(4, 0.0, false);

        ForecastResult forecast = forecastService.forecast(request(staple, stapleEvents));
        log.info("Forecast for {}:\n{}", staple.getProductId(), objectMapper.writeValueAsString(forecast));

        AnomalyReport report = anomalyReportService.report(growing, growingEvents, HISTORY_START, HISTORY_END);
        log.info("Anomaly report for {}:\n{}", growing.getProductId(), objectMapper.writeValueAsString(report));

        List<ForecastResult> batch = batchForecastService.forecastAll(List.of(
                request(staple, stapleEvents),
                request(growing, growingEvents),
                request(slow, slowEvents)));
        for (ForecastResult result : batch) {
            log.info("Batch {}: total={} peak={} on {} accuracy={}",
                    result.getProductId(),
                    result.getSummary().getTotalPredictedDemand(),
                    result.getSummary().getPeakDemand(),
                    result.getSummary().getPeakDate(),
                    String.format("%.3f", result.getAccuracy()));
        }

        log.info("=== Demo complete ===");
    }

    /**
     * Daily sales around baseDemand, shaped by the calendar, with optional daily growth
     * and injected spikes. Every fifth week also gets a restock receipt.
     */
    private List<DemandEvent> generateEvents(double baseDemand, double dailyGrowth, boolean injectAnomalies) {
        List<DemandEvent> events = new ArrayList<>();
        int day = 0;
        for (LocalDate date = HISTORY_START; !date.isAfter(HISTORY_END); date = date.plusDays(1), day++) {
            double expected = baseDemand * (1.0 + dailyGrowth * day / 30.0) * calendar.combinedMultiplier(date);
            double noise = 1.0 + random.nextGaussian() * 0.1;
            double quantity = Math.max(0.0, expected * noise);

            if (injectAnomalies) {
                double roll = random.nextDouble();
                if (roll < 0.01) {
                    quantity *= 5.0;   // bulk order
                } else if (roll < 0.02) {
                    quantity = 0.0;    // stockout
                }
            }

            // Split the day's sales into a couple of transactions
            int transactions = 1 + random.nextInt(3);
            long total = Math.round(quantity);
            for (int t = 0; t < transactions && total > 0; t++) {
                long part = t == transactions - 1 ? total : total / (transactions - t);
                events.add(new DemandEvent(date, -part));
                total -= part;
            }

            if (day % 35 == 0) {
                events.add(new DemandEvent(date, baseDemand * 30));
            }
        }
        log.info("Generated {} movement(s) for base demand {}", events.size(), baseDemand);
        return events;
    }

    private static ForecastRequest request(ProductRef product, List<DemandEvent> events) {
        return ForecastRequest.builder()
                .product(product)
                .events(events)
                .startDate(HISTORY_START)
                .endDate(HISTORY_END)
                .build();
    }
}
