package com.retail.forecast.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordForecast(String modelType, double accuracy, int horizonDays) {
        Counter.builder("forecast.generated.count")
                .tag("model_type", modelType)
                .register(registry)
                .increment();

        DistributionSummary.builder("forecast.backtest_accuracy")
                .tag("model_type", modelType)
                .register(registry)
                .record(accuracy);

        DistributionSummary.builder("forecast.horizon_days")
                .register(registry)
                .record(horizonDays);
    }

    public void recordOutliersRemoved(int count) {
        DistributionSummary.builder("forecast.outliers_removed")
                .register(registry)
                .record(count);
    }

    public void recordAnomalyDetected(String anomalyType) {
        Counter.builder("anomaly.detected.count")
                .tag("anomaly_type", anomalyType)
                .register(registry)
                .increment();
    }

    public void recordBatchFailure() {
        Counter.builder("forecast.batch.failure.count")
                .register(registry)
                .increment();
    }
}
