package com.restaurant.costkeeper.dto;

import com.restaurant.costkeeper.model.Dish;

public record DishView(Long id, Long recipeId, String recipeName, String name, String description,
        long sellingPriceCents, boolean active) {

    public static DishView of(Dish dish) {
        return new DishView(dish.getId(), dish.getRecipe().getId(), dish.getRecipe().getName(), dish.getName(),
                dish.getDescription(), dish.getSellingPriceCents(), dish.isActive());
    }
}
