package com.retail.forecast.model;

public enum SeverityLevel {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public static SeverityLevel fromScore(double severityScore) {
        if (severityScore >= 0.8) return CRITICAL;
        if (severityScore >= 0.6) return HIGH;
        if (severityScore >= 0.4) return MEDIUM;
        return LOW;
    }
}
