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
import com.retail.forecast.engine.forecast.Forecaster;
import com.retail.forecast.engine.forecast.ForecasterRegistry;
import com.retail.forecast.engine.stats.SeriesStatistics;
import com.retail.forecast.model.BacktestResult;
import com.retail.forecast.model.DailyObservation;
import com.retail.forecast.model.Decomposition;
import com.retail.forecast.model.ForecastPoint;
import com.retail.forecast.model.ForecastRequest;
import com.retail.forecast.model.ForecastResult;
import com.retail.forecast.model.ForecastSummary;
import com.retail.forecast.model.ProductRef;
import com.retail.forecast.model.SeasonalityResult;
import com.retail.forecast.model.TrendResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Main orchestrator for demand forecasting.
 *
 * Flow:
 * 1. Build the gap-free daily series from raw stock movements
 * 2. Remove IQR outliers
 * 3. Analyze trend, decompose, detect seasonality
 * 4. Resolve the configured forecaster and walk-forward backtest it
 * 5. Forecast the horizon and apply trend, day-of-week and calendar factors per day
 * 6. Attach confidence bands and summarize
 *
 * Every call works on its own data; the service keeps no state between requests.
 */
@Service
public class DemandForecastService {

    private static final Logger log = LoggerFactory.getLogger(DemandForecastService.class);

    private static final int DAYS_PER_WEEK = 7;

    private final ForecastProperties properties;
    private final SeriesBuilder seriesBuilder;
    private final OutlierFilter outlierFilter;
    private final TrendAnalyzer trendAnalyzer;
    private final SeasonalDecomposer decomposer;
    private final SeasonalityDetector seasonalityDetector;
    private final CalendarEffectCalculator calendar;
    private final ForecasterRegistry forecasterRegistry;
    private final Backtester backtester;
    private final ConfidenceIntervalEstimator intervalEstimator;
    private final MetricsConfig metricsConfig;

    public DemandForecastService(ForecastProperties properties,
                                 SeriesBuilder seriesBuilder,
                                 OutlierFilter outlierFilter,
                                 TrendAnalyzer trendAnalyzer,
                                 SeasonalDecomposer decomposer,
                                 SeasonalityDetector seasonalityDetector,
                                 CalendarEffectCalculator calendar,
                                 ForecasterRegistry forecasterRegistry,
                                 Backtester backtester,
                                 ConfidenceIntervalEstimator intervalEstimator,
                                 MetricsConfig metricsConfig) {
        this.properties = properties;
        this.seriesBuilder = seriesBuilder;
        this.outlierFilter = outlierFilter;
        this.trendAnalyzer = trendAnalyzer;
        this.decomposer = decomposer;
        this.seasonalityDetector = seasonalityDetector;
        this.calendar = calendar;
        this.forecasterRegistry = forecasterRegistry;
        this.backtester = backtester;
        this.intervalEstimator = intervalEstimator;
        this.metricsConfig = metricsConfig;
    }

    /**
     * Forecast demand for the days after request.endDate.
     * Horizon and confidence level default to the configured values when left at 0.
     */
    public ForecastResult forecast(ForecastRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("Forecast request must not be null");
        }
        List<DailyObservation> series = seriesBuilder.build(
                request.getEvents() != null ? request.getEvents() : Collections.emptyList(),
                request.getStartDate(), request.getEndDate());

        return forecast(request.getProduct(), series, request.getHorizonDays(), request.getConfidenceLevel());
    }

    /**
     * Forecast from an already-built daily series. The horizon starts the day after the last observation.
     *
     * @throws SeriesValidationException with {@link SeriesErrorType#MALFORMED_SERIES} if the series is empty
     *         or its dates are duplicated or out of order
     */
    public ForecastResult forecast(ProductRef product, List<DailyObservation> series,
                                   int horizonDays, double confidenceLevel) {
        if (series == null || series.isEmpty()) {
            throw new SeriesValidationException(SeriesErrorType.MALFORMED_SERIES,
                    "Series must contain at least one observation");
        }
        seriesBuilder.validate(series);
        int horizon = horizonDays == 0 ? properties.getHorizonDays() : horizonDays;
        if (horizon <= 0) {
            throw new IllegalArgumentException("Horizon must be positive, got " + horizon);
        }
        double level = confidenceLevel == 0.0 ? properties.getConfidenceLevel() : confidenceLevel;
        double z = intervalEstimator.zScore(level);

        String productId = product != null ? product.getProductId() : null;
        log.debug("Forecasting product {}: {} historical day(s), horizon {}, confidence {}",
                productId, series.size(), horizon, level);

        // 2. Clean
        List<DailyObservation> cleaned = outlierFilter.filter(series);
        int outliersRemoved = series.size() - cleaned.size();
        metricsConfig.recordOutliersRemoved(outliersRemoved);
        double[] history = SeriesStatistics.values(cleaned);

        // 3. Analyze
        TrendResult trend = trendAnalyzer.analyze(history);
        Decomposition decomposition = decomposer.decompose(cleaned);
        SeasonalityResult seasonality = seasonalityDetector.detect(cleaned);

        // 4. Model + backtest
        Forecaster forecaster = forecasterRegistry.resolve(properties.getModelType());
        BacktestResult backtest = backtester.backtest(history, horizon, forecaster);

        // 5. Forecast
        double[] base = forecaster.forecast(history, horizon);
        double stdDev = SeriesStatistics.stdDev(history);
        LocalDate firstDay = series.get(series.size() - 1).getDate().plusDays(1);

        List<ForecastPoint> points = new ArrayList<>(horizon);
        for (int i = 0; i < horizon; i++) {
            LocalDate date = firstDay.plusDays(i);
            points.add(forecastPoint(date, i, horizon, base[i], trend, decomposition.getBaseline(),
                    seasonality, stdDev, z));
        }

        ForecastResult result = ForecastResult.builder()
                .productId(productId)
                .productName(product != null ? product.getProductName() : null)
                .forecastData(points)
                .accuracy(backtest.getAccuracy())
                .trend(trend)
                .seasonality(seasonality)
                .backtesting(backtest)
                .summary(summarize(points))
                .modelType(forecaster.getModelType())
                .historicalDays(series.size())
                .outliersRemoved(outliersRemoved)
                .generatedAt(Instant.now())
                .build();

        metricsConfig.recordForecast(forecaster.getModelType().name(), backtest.getAccuracy(), horizon);
        log.info("Forecast for product {}: model={}, horizon={}, total={}, accuracy={}, trend={}, seasonal={}",
                productId, forecaster.getModelType(), horizon, result.getSummary().getTotalPredictedDemand(),
                String.format("%.3f", backtest.getAccuracy()), trend.getDirection(), seasonality.isDetected());
        return result;
    }

    private ForecastPoint forecastPoint(LocalDate date, int dayIndex, int horizon, double base,
                                        TrendResult trend, double baseline, SeasonalityResult seasonality,
                                        double stdDev, double z) {
        double trendComponent = trendComponent(trend, baseline, dayIndex);
        double seasonalComponent = seasonalComponent(date, seasonality);

        double islamic = calendar.islamicMultiplier(date);
        double businessCycle = calendar.businessCycleMultiplier(date);
        double weekendHoliday = calendar.weekendHolidayMultiplier(date);

        double adjusted = base
                * Math.max(0.0, 1.0 + trendComponent)
                * Math.max(0.0, 1.0 + seasonalComponent)
                * islamic * businessCycle * weekendHoliday;
        long predicted = Math.max(0L, Math.round(adjusted));

        return ForecastPoint.builder()
                .date(date)
                .predictedDemand(predicted)
                .confidenceInterval(intervalEstimator.estimate(predicted, dayIndex, horizon, stdDev, z))
                .baseForecast(base)
                .trendComponent(trendComponent)
                .seasonalComponent(seasonalComponent)
                .residualComponent(islamic * businessCycle * weekendHoliday - 1.0)
                .build();
    }

    /** Slope relative to the baseline, decaying with distance into the horizon and weighted by confidence. */
    private double trendComponent(TrendResult trend, double baseline, int dayIndex) {
        if (baseline <= 0) return 0.0;
        double decay = Math.exp(-properties.getTrend().getDecayRate() * dayIndex);
        // slope is units/day; dividing by the baseline makes it a fraction so it can enter as (1 + trend)
        return (trend.getSlope() / baseline) * dayIndex * decay * trend.getConfidence();
    }

    private double seasonalComponent(LocalDate date, SeasonalityResult seasonality) {
        List<Double> factors = properties.getSeasonality().getDayOfWeekFactors();
        int dow = date.getDayOfWeek().getValue() % DAYS_PER_WEEK;
        double factor = dow < factors.size() ? factors.get(dow) : 1.0;
        return (factor - 1.0) * seasonality.getStrength();
    }

    private ForecastSummary summarize(List<ForecastPoint> points) {
        long total = 0;
        ForecastPoint peak = null;
        for (ForecastPoint point : points) {
            total += point.getPredictedDemand();
            if (peak == null || point.getPredictedDemand() > peak.getPredictedDemand()) {
                peak = point;
            }
        }
        return ForecastSummary.builder()
                .totalPredictedDemand(total)
                .averageDailyDemand(points.isEmpty() ? 0.0 : (double) total / points.size())
                .peakDate(peak != null ? peak.getDate() : null)
                .peakDemand(peak != null ? peak.getPredictedDemand() : 0)
                .build();
    }
}
