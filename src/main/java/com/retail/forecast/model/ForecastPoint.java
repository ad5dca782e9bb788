package com.retail.forecast.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ForecastPoint {

    private LocalDate date;

    private long predictedDemand;

    private ConfidenceInterval confidenceInterval;

    // Unadjusted output of the statistical forecaster
    private double baseForecast;

    // Relative trend adjustment applied as (1 + trendComponent)
    private double trendComponent;

    // Relative day-of-week adjustment applied as (1 + seasonalComponent)
    private double seasonalComponent;

    // Combined calendar multiplier minus one
    private double residualComponent;
}
