package com.retail.forecast.model;

public enum ActionPriority {
    LOW,
    MEDIUM,
    HIGH
}
