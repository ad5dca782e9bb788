package com.retail.forecast.model;

public enum AnomalyType {
    SPIKE,
    DROP,
    SEASONAL_DEVIATION,
    TREND_BREAK
}
