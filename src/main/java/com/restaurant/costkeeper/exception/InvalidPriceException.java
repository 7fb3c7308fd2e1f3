package com.restaurant.costkeeper.exception;

import org.springframework.http.HttpStatus;

public class InvalidPriceException extends CostingException {

    public InvalidPriceException(String message) {
        super(message);
    }

    @Override
    public HttpStatus getStatus() {
        return HttpStatus.BAD_REQUEST;
    }
}
