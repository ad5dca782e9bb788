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
public class ForecastSummary {

    private long totalPredictedDemand;

    private double averageDailyDemand;

    private LocalDate peakDate;

    private long peakDemand;
}
