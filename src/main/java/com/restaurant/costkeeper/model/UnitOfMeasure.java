package com.restaurant.costkeeper.model;

public enum UnitOfMeasure {
    KILOGRAM,
    GRAM,
    LITER,
    MILLILITER,
    PIECE
}
