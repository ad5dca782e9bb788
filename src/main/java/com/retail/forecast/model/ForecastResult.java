package com.retail.forecast.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ForecastResult {

    private String productId;

    private String productName;

    private List<ForecastPoint> forecastData;

    // Backtest accuracy, repeated at top level for consumers that only need one number
    private double accuracy;

    private TrendResult trend;

    private SeasonalityResult seasonality;

    private BacktestResult backtesting;

    private ForecastSummary summary;

    private ForecastModelType modelType;

    private int historicalDays;

    private int outliersRemoved;

    private Instant generatedAt;
}
