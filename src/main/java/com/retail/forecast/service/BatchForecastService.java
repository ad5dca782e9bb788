package com.retail.forecast.service;

import com.retail.forecast.config.ForecastProperties;
import com.retail.forecast.config.MetricsConfig;
import com.retail.forecast.model.ForecastRequest;
import com.retail.forecast.model.ForecastResult;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Forecasts many products in parallel on a fixed worker pool.
 * Requests are independent; a failing request is logged and left out of the result.
 */
@Service
public class BatchForecastService {

    private static final Logger log = LoggerFactory.getLogger(BatchForecastService.class);

    private final DemandForecastService forecastService;
    private final MetricsConfig metricsConfig;
    private final ExecutorService executor;

    public BatchForecastService(DemandForecastService forecastService,
                                MetricsConfig metricsConfig,
                                ForecastProperties properties) {
        this.forecastService = forecastService;
        this.metricsConfig = metricsConfig;

        int poolSize = Math.max(1, properties.getBatch().getPoolSize());
        AtomicInteger threadCount = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(poolSize, r -> {
            Thread t = new Thread(r, "forecast-worker-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        log.info("Batch forecast pool started with {} worker(s)", poolSize);
    }

    /**
     * Forecast every request. Results keep the order of the successful requests.
     */
    public List<ForecastResult> forecastAll(List<ForecastRequest> requests) {
        List<Future<ForecastResult>> futures = new ArrayList<>(requests.size());
        for (ForecastRequest request : requests) {
            futures.add(executor.submit(() -> forecastService.forecast(request)));
        }

        List<ForecastResult> results = new ArrayList<>(requests.size());
        for (int i = 0; i < futures.size(); i++) {
            try {
                results.add(futures.get(i).get());
            } catch (ExecutionException e) {
                metricsConfig.recordBatchFailure();
                log.error("Forecast failed for product {}", productId(requests.get(i)), e.getCause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Batch forecast interrupted after {} of {} request(s)", i, futures.size());
                cancelRemaining(futures, i);
                break;
            }
        }

        log.info("Batch forecast complete: {} of {} request(s) succeeded", results.size(), requests.size());
        return results;
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static void cancelRemaining(List<Future<ForecastResult>> futures, int from) {
        for (int j = from; j < futures.size(); j++) {
            futures.get(j).cancel(true);
        }
    }

    private static String productId(ForecastRequest request) {
        return request != null && request.getProduct() != null ? request.getProduct().getProductId() : null;
    }
}
