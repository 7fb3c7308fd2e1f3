package com.restaurant.costkeeper.model;

import java.math.BigDecimal;

public enum MovementType {
    IN,
    OUT_SALE,
    OUT_EXPIRE,
    ADJUSTMENT;

    public boolean isOutbound() {
        return this != IN;
    }

    /**
     * Signed change applied to a batch's remaining quantity for a movement of the given magnitude.
     */
    public BigDecimal signedDelta(BigDecimal quantity) {
        return isOutbound() ? quantity.negate() : quantity;
    }
}
