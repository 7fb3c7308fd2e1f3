package com.restaurant.costkeeper.dto;

import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.math.BigDecimal;

@Data
public class AddComponentRequest {
    @NotNull
    private Long componentRecipeId;

    // Fraction of the component's full yield, e.g. 0.25
    @NotNull
    @Digits(integer = 15, fraction = 4)
    private BigDecimal quantity;
}
