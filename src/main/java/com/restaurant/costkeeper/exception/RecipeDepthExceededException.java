package com.restaurant.costkeeper.exception;

import org.springframework.http.HttpStatus;

public class RecipeDepthExceededException extends CostingException {

    public RecipeDepthExceededException(String recipeName, int maxDepth) {
        super("Recipe " + recipeName + " nests components deeper than " + maxDepth + " levels");
    }

    @Override
    public HttpStatus getStatus() {
        return HttpStatus.UNPROCESSABLE_ENTITY;
    }
}
