package com.restaurant.costkeeper.model;

public enum ExpirationStatus {
    EXPIRED,
    EXPIRES_TODAY,
    EXPIRING_SOON,
    FRESH
}
