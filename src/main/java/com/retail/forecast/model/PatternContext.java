package com.retail.forecast.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PatternContext {

    private boolean recurring;

    // "weekly", "monthly" or null
    private String frequency;

    private boolean seasonalPattern;
}
