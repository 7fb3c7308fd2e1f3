package com.restaurant.costkeeper.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public class NoStockAvailableException extends CostingException {

    private final Long ingredientId;

    public NoStockAvailableException(Long ingredientId, String ingredientName) {
        super("No active stock for " + ingredientName + ", cost cannot be determined");
        this.ingredientId = ingredientId;
    }

    @Override
    public HttpStatus getStatus() {
        return HttpStatus.CONFLICT;
    }
}
