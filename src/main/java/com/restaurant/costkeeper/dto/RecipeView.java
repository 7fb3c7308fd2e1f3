package com.restaurant.costkeeper.dto;

import com.restaurant.costkeeper.model.Recipe;
import com.restaurant.costkeeper.model.RecipeType;
import com.restaurant.costkeeper.model.UnitOfMeasure;

import java.math.BigDecimal;
import java.util.List;
import java.util.stream.Collectors;

public record RecipeView(Long id, String name, int servings, RecipeType type, String instructions,
        List<IngredientLine> ingredients, List<ComponentLine> components) {

    public record IngredientLine(Long ingredientId, String name, BigDecimal quantity, UnitOfMeasure unit) {
    }

    public record ComponentLine(Long componentRecipeId, String name, BigDecimal quantity) {
    }

    public static RecipeView of(Recipe recipe) {
        List<IngredientLine> ingredients = recipe.getIngredients().stream()
                .map(i -> new IngredientLine(i.getIngredient().getId(), i.getIngredient().getName(), i.getQuantity(),
                        i.getUnit()))
                .collect(Collectors.toList());
        List<ComponentLine> components = recipe.getComponents().stream()
                .map(c -> new ComponentLine(c.getComponentRecipe().getId(), c.getComponentRecipe().getName(),
                        c.getQuantity()))
                .collect(Collectors.toList());
        return new RecipeView(recipe.getId(), recipe.getName(), recipe.getServings(), recipe.getType(),
                recipe.getInstructions(), ingredients, components);
    }
}
