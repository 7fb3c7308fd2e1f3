package com.restaurant.costkeeper.model;

public enum BatchStatus {
    ACTIVE,
    EXHAUSTED,
    ARCHIVED
}
