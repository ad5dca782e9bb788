package com.retail.forecast.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * A single stock movement for a product. Negative deltas are outgoing (sales, issues)
 * and count as demand; positive deltas are receipts and do not.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DemandEvent {

    private LocalDate date;

    // Signed quantity change, e.g. -12 for twelve units sold
    private double quantityDelta;

    public boolean isOutgoing() {
        return quantityDelta < 0;
    }
}
