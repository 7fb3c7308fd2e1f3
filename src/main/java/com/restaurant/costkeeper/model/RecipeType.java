package com.restaurant.costkeeper.model;

public enum RecipeType {
    /** Semi-finished product, only usable as a component of another recipe. */
    PREPARATION,
    /** Can be sold as a dish. */
    FINAL
}
