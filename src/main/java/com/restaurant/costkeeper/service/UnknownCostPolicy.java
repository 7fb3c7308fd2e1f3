package com.restaurant.costkeeper.service;

/**
 * What the recipe engine does with an ingredient that has no active stock to price it.
 */
public enum UnknownCostPolicy {
    /** Raise {@link com.restaurant.costkeeper.exception.NoStockAvailableException}. */
    FAIL,
    /** Leave the ingredient out of the total and mark the result incomplete. */
    DEGRADE
}
