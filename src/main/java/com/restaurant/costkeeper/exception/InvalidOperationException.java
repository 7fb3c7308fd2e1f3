package com.restaurant.costkeeper.exception;

import org.springframework.http.HttpStatus;

public class InvalidOperationException extends CostingException {

    public InvalidOperationException(String message) {
        super(message);
    }

    @Override
    public HttpStatus getStatus() {
        return HttpStatus.CONFLICT;
    }
}
