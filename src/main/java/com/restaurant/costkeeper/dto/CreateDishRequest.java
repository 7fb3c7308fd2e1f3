package com.restaurant.costkeeper.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class CreateDishRequest {
    @NotNull
    private Long recipeId;

    @NotBlank
    private String name;

    private String description;

    @NotNull
    private Long sellingPriceCents;
}
