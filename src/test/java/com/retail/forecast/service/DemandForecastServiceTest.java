package com.retail.forecast.service;

import com.retail.forecast.config.ForecastProperties;
import com.retail.forecast.config.MetricsConfig;
import com.retail.forecast.engine.OutlierFilter;
import com.retail.forecast.engine.SeasonalDecomposer;
import com.retail.forecast.engine.SeasonalityDetector;
import com.retail.forecast.engine.SeriesBuilder;
import com.retail.forecast.engine.SeriesErrorType;
import com.retail.forecast.engine.SeriesValidationException;
import com.retail.forecast.engine.TrendAnalyzer;
import com.retail.forecast.engine.calendar.CalendarEffectCalculator;
import com.retail.forecast.engine.forecast.Backtester;
import com.retail.forecast.engine.forecast.ConfidenceIntervalEstimator;
import com.retail.forecast.engine.forecast.FlatMeanForecaster;
import com.retail.forecast.engine.forecast.ForecasterRegistry;
import com.retail.forecast.engine.forecast.HoltWintersForecaster;
import com.retail.forecast.model.DailyObservation;
import com.retail.forecast.model.DemandEvent;
import com.retail.forecast.model.ForecastModelType;
import com.retail.forecast.model.ForecastPoint;
import com.retail.forecast.model.ForecastRequest;
import com.retail.forecast.model.ForecastResult;
import com.retail.forecast.model.ProductRef;
import com.retail.forecast.model.TrendDirection;
import com.retail.forecast.testutil.TestDataFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class DemandForecastServiceTest {

    private static final LocalDate START = LocalDate.of(2024, 6, 1);
    private static final LocalDate END = LocalDate.of(2024, 8, 29);

    private ForecastProperties properties;
    private SimpleMeterRegistry meterRegistry;
    private DemandForecastService service;
    private ProductRef product;

    @BeforeEach
    void setUp() {
        properties = TestDataFactory.createProperties();
        meterRegistry = new SimpleMeterRegistry();
        service = createService(properties);
        product = TestDataFactory.createProduct("SKU-1", 5000);
    }

    private DemandForecastService createService(ForecastProperties props) {
        CalendarEffectCalculator calendar = TestDataFactory.createCalendar(props);
        ForecasterRegistry registry = new ForecasterRegistry(List.of(
                new HoltWintersForecaster(props), new FlatMeanForecaster()));
        return new DemandForecastService(
                props,
                new SeriesBuilder(calendar),
                new OutlierFilter(props),
                new TrendAnalyzer(props),
                new SeasonalDecomposer(props),
                new SeasonalityDetector(props, calendar),
                calendar,
                registry,
                new Backtester(props),
                new ConfidenceIntervalEstimator(),
                new MetricsConfig(meterRegistry));
    }

    private ForecastRequest request(List<DemandEvent> events, int horizonDays) {
        return ForecastRequest.builder()
                .product(product)
                .events(events)
                .startDate(START)
                .endDate(END)
                .horizonDays(horizonDays)
                .build();
    }

    @Test
    void forecast_flatDemand_appliesCalendarEffectsOnly() {
        ForecastResult result = service.forecast(request(TestDataFactory.createDailySales(START, 90, 20), 14));

        assertThat(result.getProductId()).isEqualTo("SKU-1");
        assertThat(result.getModelType()).isEqualTo(ForecastModelType.HOLT_WINTERS);
        assertThat(result.getHistoricalDays()).isEqualTo(90);
        assertThat(result.getOutliersRemoved()).isZero();
        assertThat(result.getTrend().getDirection()).isEqualTo(TrendDirection.STABLE);
        assertThat(result.getSeasonality().isDetected()).isFalse();
        assertThat(result.getAccuracy()).isCloseTo(1.0, within(1e-9));

        List<ForecastPoint> points = result.getForecastData();
        assertThat(points).hasSize(14);
        assertThat(points.get(0).getDate()).isEqualTo(END.plusDays(1));
        assertThat(points.get(13).getDate()).isEqualTo(END.plusDays(14));

        // Wednesday 2024-09-04: no calendar effect
        ForecastPoint plainDay = points.get(5);
        assertThat(plainDay.getDate()).isEqualTo(LocalDate.of(2024, 9, 4));
        assertThat(plainDay.getPredictedDemand()).isEqualTo(20);
        assertThat(plainDay.getResidualComponent()).isCloseTo(0.0, within(1e-9));

        // Saturday 2024-09-07: weekend lift only
        ForecastPoint saturday = points.get(8);
        assertThat(saturday.getPredictedDemand()).isEqualTo(23);
        assertThat(saturday.getResidualComponent()).isCloseTo(0.15, within(1e-9));
    }

    @Test
    void forecast_intervalsAlwaysContainPrediction() {
        List<DemandEvent> events = new ArrayList<>();
        for (int i = 0; i < 90; i++) {
            events.add(new DemandEvent(START.plusDays(i), -(10 + (i * 7) % 13)));
        }

        ForecastResult result = service.forecast(request(events, 30));

        assertThat(result.getForecastData()).hasSize(30).allSatisfy(point -> {
            assertThat(point.getPredictedDemand()).isGreaterThanOrEqualTo(0);
            assertThat(point.getConfidenceInterval().getLower()).isGreaterThanOrEqualTo(0.0);
            assertThat(point.getConfidenceInterval().getLower()).isLessThanOrEqualTo(point.getPredictedDemand());
            assertThat(point.getConfidenceInterval().getUpper()).isGreaterThanOrEqualTo(point.getPredictedDemand());
        });
        assertThat(result.getBacktesting().getAccuracy()).isGreaterThan(0.0).isLessThanOrEqualTo(1.0);
    }

    @Test
    void forecast_summaryMatchesPoints() {
        ForecastResult result = service.forecast(request(TestDataFactory.createDailySales(START, 90, 20), 14));

        long total = result.getForecastData().stream().mapToLong(ForecastPoint::getPredictedDemand).sum();
        long peak = result.getForecastData().stream().mapToLong(ForecastPoint::getPredictedDemand).max().orElse(0);

        assertThat(result.getSummary().getTotalPredictedDemand()).isEqualTo(total);
        assertThat(result.getSummary().getAverageDailyDemand()).isCloseTo(total / 14.0, within(1e-9));
        assertThat(result.getSummary().getPeakDemand()).isEqualTo(peak);
    }

    @Test
    void forecast_outliersRemovedBeforeModelling() {
        List<DemandEvent> events = new ArrayList<>(TestDataFactory.createDailySales(START, 90, 20));
        events.add(new DemandEvent(START.plusDays(40), -2000));

        ForecastResult result = service.forecast(request(events, 7));

        assertThat(result.getOutliersRemoved()).isEqualTo(1);
        assertThat(result.getHistoricalDays()).isEqualTo(90);
        assertThat(result.getForecastData().get(0).getBaseForecast()).isCloseTo(20.0, within(1e-6));
    }

    @Test
    void forecast_risingDemand_reportsIncreasingTrend() {
        List<DemandEvent> events = new ArrayList<>();
        for (int i = 0; i < 90; i++) {
            events.add(new DemandEvent(START.plusDays(i), -(10 + i)));
        }

        ForecastResult result = service.forecast(request(events, 7));

        assertThat(result.getTrend().getDirection()).isEqualTo(TrendDirection.INCREASING);
        assertThat(result.getForecastData().get(6).getTrendComponent()).isGreaterThan(0.0);
        assertThat(result.getForecastData().get(0).getTrendComponent()).isZero();
    }

    @Test
    void forecast_defaultsHorizonFromConfiguration() {
        ForecastResult result = service.forecast(request(TestDataFactory.createDailySales(START, 90, 5), 0));

        assertThat(result.getForecastData()).hasSize(30);
    }

    @Test
    void forecast_flatMeanModelConfigured_usesFlatMean() {
        properties.setModelType(ForecastModelType.FLAT_MEAN);
        DemandForecastService flatService = createService(properties);

        ForecastResult result = flatService.forecast(request(TestDataFactory.createDailySales(START, 90, 8), 7));

        assertThat(result.getModelType()).isEqualTo(ForecastModelType.FLAT_MEAN);
    }

    @Test
    void forecast_noSalesAtAll_forecastsZero() {
        ForecastResult result = service.forecast(request(Collections.emptyList(), 7));

        assertThat(result.getSummary().getTotalPredictedDemand()).isZero();
        assertThat(result.getForecastData()).allSatisfy(point ->
                assertThat(point.getConfidenceInterval().getUpper()).isZero());
    }

    @Test
    void forecast_singleDayHistory_usesFallbacks() {
        ForecastRequest single = ForecastRequest.builder()
                .product(product)
                .events(List.of(new DemandEvent(END, -12)))
                .startDate(END)
                .endDate(END)
                .horizonDays(3)
                .build();

        ForecastResult result = service.forecast(single);

        assertThat(result.getForecastData()).hasSize(3);
        assertThat(result.getBacktesting().getSamplesTested()).isZero();
        assertThat(result.getAccuracy()).isEqualTo(0.75);
        assertThat(result.getForecastData().get(0).getBaseForecast()).isEqualTo(12.0);
    }

    @Test
    void forecast_negativeHorizon_throws() {
        assertThatThrownBy(() -> service.forecast(request(TestDataFactory.createDailySales(START, 90, 5), -1)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Horizon");
    }

    @Test
    void forecast_invalidConfidenceLevel_throws() {
        ForecastRequest bad = request(TestDataFactory.createDailySales(START, 90, 5), 7);
        bad.setConfidenceLevel(1.5);

        assertThatThrownBy(() -> service.forecast(bad)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void forecast_startAfterEnd_throwsValidationError() {
        ForecastRequest bad = request(Collections.emptyList(), 7);
        bad.setStartDate(END.plusDays(1));

        assertThatThrownBy(() -> service.forecast(bad)).isInstanceOf(SeriesValidationException.class);
    }

    @Test
    void forecast_seriesWithDuplicateDate_throwsMalformed() {
        List<DailyObservation> series = TestDataFactory.createFlatSeries(START, 30, 10);
        series.add(TestDataFactory.createObservation(START.plusDays(29), 12));

        assertThatThrownBy(() -> service.forecast(product, series, 7, 0.95))
                .isInstanceOfSatisfying(SeriesValidationException.class, e ->
                        assertThat(e.getErrorType()).isEqualTo(SeriesErrorType.MALFORMED_SERIES))
                .hasMessageContaining("Duplicate date");
        assertThat(meterRegistry.find("forecast.generated.count").counter()).isNull();
    }

    @Test
    void forecast_seriesOutOfOrder_throwsMalformed() {
        // Dates cycle through ten days so the last element is not the latest date
        List<DailyObservation> series = new ArrayList<>();
        for (int i = 0; i < 30; i++) {
            series.add(TestDataFactory.createObservation(START.plusDays((i * 3) % 10), 10));
        }

        assertThatThrownBy(() -> service.forecast(product, series, 7, 0.95))
                .isInstanceOfSatisfying(SeriesValidationException.class, e ->
                        assertThat(e.getErrorType()).isEqualTo(SeriesErrorType.MALFORMED_SERIES))
                .hasMessageContaining("Out-of-order date");
    }

    @Test
    void forecast_recordsMetrics() {
        service.forecast(request(TestDataFactory.createDailySales(START, 90, 20), 7));

        assertThat(meterRegistry.get("forecast.generated.count")
                .tag("model_type", "HOLT_WINTERS").counter().count()).isEqualTo(1.0);
        assertThat(meterRegistry.get("forecast.horizon_days").summary().totalAmount()).isEqualTo(7.0);
    }
}
