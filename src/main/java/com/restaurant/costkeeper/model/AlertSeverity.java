package com.restaurant.costkeeper.model;

// Declaration order is the display order, most urgent first
public enum AlertSeverity {
    EXPIRED,
    CRITICAL,
    WARNING,
    INFO
}
