package com.restaurant.costkeeper.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

import java.math.BigDecimal;

@Getter
public class InsufficientStockException extends CostingException {

    private final Long ingredientId;
    private final String ingredientName;
    private final BigDecimal requested;
    private final BigDecimal available;

    public InsufficientStockException(Long ingredientId, String ingredientName, BigDecimal requested,
            BigDecimal available) {
        super("Insufficient stock of " + ingredientName + ": requested " + requested.stripTrailingZeros().toPlainString()
                + ", available " + available.stripTrailingZeros().toPlainString()
                + ", short by " + requested.subtract(available).stripTrailingZeros().toPlainString());
        this.ingredientId = ingredientId;
        this.ingredientName = ingredientName;
        this.requested = requested;
        this.available = available;
    }

    public BigDecimal getShortfall() {
        return requested.subtract(available);
    }

    @Override
    public HttpStatus getStatus() {
        return HttpStatus.CONFLICT;
    }
}
