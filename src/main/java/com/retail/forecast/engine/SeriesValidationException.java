package com.retail.forecast.engine;

import lombok.Getter;

/**
 * Thrown at the series boundary when caller-supplied input cannot form a valid daily series.
 * Thin data never raises this; analysis components fall back to low-confidence results instead.
 */
@Getter
public class SeriesValidationException extends IllegalArgumentException {

    private final SeriesErrorType errorType;

    public SeriesValidationException(SeriesErrorType errorType, String message) {
        super(message);
        this.errorType = errorType;
    }
}
