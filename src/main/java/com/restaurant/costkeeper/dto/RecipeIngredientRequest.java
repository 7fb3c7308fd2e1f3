package com.restaurant.costkeeper.dto;

import com.restaurant.costkeeper.model.UnitOfMeasure;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.math.BigDecimal;

@Data
public class RecipeIngredientRequest {
    @NotNull
    private Long ingredientId;

    // Per full recipe batch
    @NotNull
    @Digits(integer = 15, fraction = 4)
    private BigDecimal quantity;

    private UnitOfMeasure unit; // defaults to the ingredient's unit
}
