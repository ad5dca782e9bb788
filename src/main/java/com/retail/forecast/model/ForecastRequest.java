package com.retail.forecast.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.List;

/**
 * Input for a single forecast. Horizon and confidence level fall back to configured
 * defaults when not set (0).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ForecastRequest {

    private ProductRef product;

    private List<DemandEvent> events;

    private LocalDate startDate;

    private LocalDate endDate;

    private int horizonDays;

    private double confidenceLevel;
}
