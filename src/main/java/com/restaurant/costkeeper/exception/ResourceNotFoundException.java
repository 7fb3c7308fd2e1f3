package com.restaurant.costkeeper.exception;

import org.springframework.http.HttpStatus;

public class ResourceNotFoundException extends CostingException {

    public ResourceNotFoundException(String resource, Object id) {
        super(resource + " not found: " + id);
    }

    @Override
    public HttpStatus getStatus() {
        return HttpStatus.NOT_FOUND;
    }
}
