package com.retail.forecast.model;

/**
 * Statistical forecasting models the engine can run in-process.
 */
public enum ForecastModelType {
    HOLT_WINTERS,
    FLAT_MEAN
}
