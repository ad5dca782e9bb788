package com.retail.forecast.engine;

public enum SeriesErrorType {
    // Start date after end date
    INVALID_RANGE,
    // Duplicate, out-of-order or negative daily totals
    MALFORMED_SERIES
}
