package com.retail.forecast.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SeasonalityResult {

    private boolean detected;

    // Combined strength in [0, 1]: max of autocorrelation, weekly pattern and calendar pattern
    private double strength;

    // Lag in days with the strongest autocorrelation
    private int period;

    private List<String> peakPeriods;

    private double autocorrelationStrength;

    private double weeklyPatternStrength;

    private double ramadanEffect;

    private double lebaranEffect;
}
