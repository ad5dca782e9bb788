package com.retail.forecast.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnomalyReport {

    private String productId;

    private String productName;

    // Sorted by severity (highest first), then by date (latest first)
    private List<Anomaly> anomalies;

    private AnomalySummary summary;

    private List<String> insights;

    private Instant generatedAt;
}
