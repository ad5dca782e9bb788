package com.retail.forecast.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * One day of aggregated demand. Built by the SeriesBuilder and consumed by every
 * analysis component; never mutated after construction.
 */
@Value
@Builder(toBuilder = true)
public class DailyObservation {

    LocalDate date;

    double value;

    // 0 = Sunday ... 6 = Saturday
    int dayOfWeek;

    boolean weekend;

    boolean holiday;
}
