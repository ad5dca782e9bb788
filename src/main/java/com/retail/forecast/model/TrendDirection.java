package com.retail.forecast.model;

public enum TrendDirection {
    INCREASING,
    DECREASING,
    STABLE
}
