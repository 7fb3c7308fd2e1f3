package com.restaurant.costkeeper.model;

public enum AlertType {
    EXPIRING_BATCH,
    LOW_STOCK
}
