package com.retail.forecast.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TrendResult {

    private TrendDirection direction;

    // Units per day from the least-squares fit
    private double slope;

    private double intercept;

    private double rSquared;

    // Two-sided p-value of the Mann-Kendall test
    private double pValue;

    private long mannKendallS;

    // rSquared * (1 - pValue)
    private double confidence;

    private int sampleSize;

    public static TrendResult stable(int sampleSize) {
        return TrendResult.builder()
                .direction(TrendDirection.STABLE)
                .slope(0.0)
                .intercept(0.0)
                .rSquared(0.0)
                .pValue(1.0)
                .mannKendallS(0)
                .confidence(0.0)
                .sampleSize(sampleSize)
                .build();
    }
}
