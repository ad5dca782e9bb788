package com.retail.forecast.service;

import com.retail.forecast.config.ForecastProperties;
import com.retail.forecast.config.MetricsConfig;
import com.retail.forecast.model.ForecastRequest;
import com.retail.forecast.model.ForecastResult;
import com.retail.forecast.testutil.TestDataFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BatchForecastServiceTest {

    @Mock private DemandForecastService forecastService;
    @Mock private MetricsConfig metricsConfig;

    private BatchForecastService batchService;

    @BeforeEach
    void setUp() {
        ForecastProperties properties = TestDataFactory.createProperties();
        properties.getBatch().setPoolSize(2);
        batchService = new BatchForecastService(forecastService, metricsConfig, properties);
    }

    @AfterEach
    void tearDown() {
        batchService.shutdown();
    }

    private static ForecastRequest request(String productId) {
        return ForecastRequest.builder()
                .product(TestDataFactory.createProduct(productId, 100))
                .build();
    }

    private static ForecastResult result(String productId) {
        return ForecastResult.builder().productId(productId).build();
    }

    @Test
    void forecastAll_returnsResultsInRequestOrder() {
        ForecastRequest a = request("A");
        ForecastRequest b = request("B");
        ForecastRequest c = request("C");
        when(forecastService.forecast(a)).thenReturn(result("A"));
        when(forecastService.forecast(b)).thenReturn(result("B"));
        when(forecastService.forecast(c)).thenReturn(result("C"));

        List<ForecastResult> results = batchService.forecastAll(List.of(a, b, c));

        assertThat(results).extracting(ForecastResult::getProductId).containsExactly("A", "B", "C");
        verify(metricsConfig, never()).recordBatchFailure();
    }

    @Test
    void forecastAll_failingRequest_isSkipped() {
        ForecastRequest good = request("GOOD");
        ForecastRequest bad = request("BAD");
        when(forecastService.forecast(good)).thenReturn(result("GOOD"));
        when(forecastService.forecast(bad)).thenThrow(new IllegalArgumentException("Horizon must be positive"));

        List<ForecastResult> results = batchService.forecastAll(List.of(bad, good));

        assertThat(results).extracting(ForecastResult::getProductId).containsExactly("GOOD");
        verify(metricsConfig, times(1)).recordBatchFailure();
    }

    @Test
    void forecastAll_emptyBatch_returnsEmpty() {
        assertThat(batchService.forecastAll(Collections.emptyList())).isEmpty();
    }
}
