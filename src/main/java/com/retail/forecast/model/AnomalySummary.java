package com.retail.forecast.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnomalySummary {

    private int totalAnomalies;

    private int spikes;

    private int drops;

    private Map<SeverityLevel, Long> severityDistribution;

    // Mean of |deviationPercent|
    private double averageDeviation;
}
