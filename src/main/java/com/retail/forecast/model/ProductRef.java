package com.retail.forecast.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Product identity used to label forecast and anomaly output.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProductRef {

    private String productId;

    private String productName;

    // Unit selling price, used only for anomaly revenue impact. 0 when unknown.
    private double sellingPrice;
}
