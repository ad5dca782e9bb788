package com.retail.forecast.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BusinessImpact {

    // (actual - expected) * unit price
    private long revenueImpact;

    // Negative when stock was drawn down faster than expected
    private long inventoryImpact;

    private int customerSatisfactionImpact;
}
