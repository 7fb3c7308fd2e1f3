package com.restaurant.costkeeper.dto;

import lombok.Data;

// Null fields are left unchanged
@Data
public class UpdateDishRequest {
    private String name;
    private String description;
    private Long sellingPriceCents;
    private Long recipeId;
}
