package com.retail.forecast.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BacktestResult {

    // max(minAccuracy, 1 - mape)
    private double accuracy;

    private double mape;

    private double rmse;

    private double mae;

    // Number of forecast days compared against actuals. 0 means the default was returned.
    private int samplesTested;

    private int windowsTested;
}
