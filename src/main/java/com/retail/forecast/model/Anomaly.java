package com.retail.forecast.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Anomaly {

    private LocalDate date;

    private AnomalyType type;

    // Mean of the trailing window
    private double expected;

    private double actual;

    private double deviationPercent;

    private double zScore;

    private double severityScore;

    private SeverityLevel severityLevel;

    private double confidence;

    private List<String> possibleCauses;

    private List<RecommendedAction> recommendedActions;

    private BusinessImpact businessImpact;

    private PatternContext patternContext;
}
