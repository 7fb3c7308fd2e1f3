package com.restaurant.costkeeper.service;

import com.restaurant.costkeeper.exception.InvalidPriceException;
import com.restaurant.costkeeper.exception.InvalidQuantityException;

import java.math.BigDecimal;

/**
 * Construction-time checks shared by the services. Invalid values are rejected before anything
 * is stored.
 */
final class QuantityRules {

    // Scale of every stored quantity column
    static final int QUANTITY_SCALE = 4;

    private QuantityRules() {
    }

    /**
     * Positive and storable without rounding. Used for every quantity that is persisted.
     */
    static BigDecimal requirePositive(BigDecimal quantity, String what) {
        if (quantity == null || quantity.signum() <= 0) {
            throw new InvalidQuantityException(what + " must be greater than zero, got " + quantity);
        }
        return requireStorableScale(quantity, what);
    }

    static BigDecimal requireStorableScale(BigDecimal quantity, String what) {
        if (quantity.stripTrailingZeros().scale() > QUANTITY_SCALE) {
            throw new InvalidQuantityException(what + " has more than " + QUANTITY_SCALE
                    + " decimal places: " + quantity.toPlainString());
        }
        return quantity;
    }

    static BigDecimal requireNonNegative(BigDecimal quantity, String what) {
        if (quantity == null || quantity.signum() < 0) {
            throw new InvalidQuantityException(what + " cannot be negative, got " + quantity);
        }
        return quantity;
    }

    static long requirePositivePrice(Long cents, String what) {
        if (cents == null || cents <= 0) {
            throw new InvalidPriceException(what + " must be greater than zero, got " + cents);
        }
        return cents;
    }

    static long requireNonNegativePrice(Long cents, String what) {
        if (cents == null || cents < 0) {
            throw new InvalidPriceException(what + " cannot be negative, got " + cents);
        }
        return cents;
    }
}
