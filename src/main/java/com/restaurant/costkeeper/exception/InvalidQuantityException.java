package com.restaurant.costkeeper.exception;

import org.springframework.http.HttpStatus;

public class InvalidQuantityException extends CostingException {

    public InvalidQuantityException(String message) {
        super(message);
    }

    @Override
    public HttpStatus getStatus() {
        return HttpStatus.BAD_REQUEST;
    }
}
