package com.restaurant.costkeeper.exception;

import org.springframework.http.HttpStatus;

/**
 * Base of every business error raised by the costing core. All of them are recoverable by the
 * caller and are reported synchronously.
 */
public abstract class CostingException extends RuntimeException {

    protected CostingException(String message) {
        super(message);
    }

    public abstract HttpStatus getStatus();

    public String getErrorCode() {
        String name = getClass().getSimpleName();
        return name.endsWith("Exception") ? name.substring(0, name.length() - "Exception".length()) : name;
    }
}
