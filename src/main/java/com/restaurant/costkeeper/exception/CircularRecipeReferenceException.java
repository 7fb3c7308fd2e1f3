package com.restaurant.costkeeper.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

import java.util.List;

@Getter
public class CircularRecipeReferenceException extends CostingException {

    private final List<String> chain;

    public CircularRecipeReferenceException(List<String> chain) {
        super("Circular recipe reference: " + String.join(" -> ", chain));
        this.chain = List.copyOf(chain);
    }

    @Override
    public HttpStatus getStatus() {
        return HttpStatus.UNPROCESSABLE_ENTITY;
    }
}
