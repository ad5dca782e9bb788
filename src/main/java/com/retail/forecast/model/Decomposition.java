package com.retail.forecast.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Additive decomposition of a daily series: value[i] ~ trend[i] + seasonal[i] + residual[i].
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Decomposition {

    private double[] trend;

    private double[] seasonal;

    private double[] residual;

    private double baseline;

    // One index per day-of-week (0 = Sunday), reused across the whole series
    private double[] seasonalIndices;
}
