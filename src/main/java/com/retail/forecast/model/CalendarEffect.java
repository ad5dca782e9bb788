package com.retail.forecast.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * A multiplicative demand factor active on a date. Effects on the same date compose by product.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CalendarEffect {

    private LocalDate date;

    private CalendarCause cause;

    private double multiplier;

    private String description;
}
