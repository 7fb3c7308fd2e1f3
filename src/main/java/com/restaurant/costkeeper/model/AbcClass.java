package com.restaurant.costkeeper.model;

import java.math.BigDecimal;

/**
 * Pareto class by cumulative share of revenue: A up to 80%, B up to 95%, C for the rest.
 */
public enum AbcClass {
    A, B, C;

    private static final BigDecimal A_LIMIT = BigDecimal.valueOf(80);
    private static final BigDecimal B_LIMIT = BigDecimal.valueOf(95);

    public static AbcClass ofCumulativeSharePercent(BigDecimal cumulativeSharePercent) {
        if (cumulativeSharePercent.compareTo(A_LIMIT) <= 0) {
            return A;
        }
        if (cumulativeSharePercent.compareTo(B_LIMIT) <= 0) {
            return B;
        }
        return C;
    }
}
