package com.restaurant.costkeeper.dto;

import com.restaurant.costkeeper.model.RecipeType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class CreateRecipeRequest {
    @NotBlank
    private String name;

    @NotNull
    @Positive
    private Integer servings;

    private RecipeType type = RecipeType.FINAL;

    private String instructions;

    @Valid
    private List<RecipeIngredientRequest> ingredients = new ArrayList<>();
}
