package com.restaurant.costkeeper.model;

/**
 * Advisory flags raised by the profitability analysis. Never blocks an operation.
 */
public enum ProfitabilityWarning {
    LOW_MARGIN,
    HIGH_FOOD_COST
}
