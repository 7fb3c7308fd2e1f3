package com.restaurant.costkeeper.controller;

import com.restaurant.costkeeper.dto.AddComponentRequest;
import com.restaurant.costkeeper.dto.CreateRecipeRequest;
import com.restaurant.costkeeper.dto.RecipeCost;
import com.restaurant.costkeeper.dto.RecipeIngredientRequest;
import com.restaurant.costkeeper.dto.RecipeView;
import com.restaurant.costkeeper.service.RecipeCostEngine;
import com.restaurant.costkeeper.service.RecipeService;
import com.restaurant.costkeeper.service.UnknownCostPolicy;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

import static com.restaurant.costkeeper.controller.InventoryController.TENANT_HEADER;

@RestController
@RequestMapping("/api/recipes")
public class RecipeController {

    private final RecipeService recipeService;
    private final RecipeCostEngine costEngine;

    public RecipeController(RecipeService recipeService, RecipeCostEngine costEngine) {
        this.recipeService = recipeService;
        this.costEngine = costEngine;
    }

    @PostMapping
    public ResponseEntity<RecipeView> create(@RequestHeader(TENANT_HEADER) Long tenantId,
                                             @Valid @RequestBody CreateRecipeRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(recipeService.create(tenantId, request));
    }

    @GetMapping
    public ResponseEntity<List<RecipeView>> list(@RequestHeader(TENANT_HEADER) Long tenantId) {
        return ResponseEntity.ok(recipeService.list(tenantId));
    }

    @GetMapping("/{recipeId}")
    public ResponseEntity<RecipeView> get(@RequestHeader(TENANT_HEADER) Long tenantId,
                                          @PathVariable Long recipeId) {
        return ResponseEntity.ok(recipeService.get(tenantId, recipeId));
    }

    @PutMapping("/{recipeId}/ingredients")
    public ResponseEntity<RecipeView> updateIngredients(@RequestHeader(TENANT_HEADER) Long tenantId,
                                                        @PathVariable Long recipeId,
                                                        @Valid @RequestBody List<RecipeIngredientRequest> ingredients) {
        return ResponseEntity.ok(recipeService.updateIngredients(tenantId, recipeId, ingredients));
    }

    @PostMapping("/{recipeId}/components")
    public ResponseEntity<RecipeView> addComponent(@RequestHeader(TENANT_HEADER) Long tenantId,
                                                   @PathVariable Long recipeId,
                                                   @Valid @RequestBody AddComponentRequest request) {
        return ResponseEntity.ok(recipeService.addComponent(tenantId, recipeId, request.getComponentRecipeId(),
                request.getQuantity()));
    }

    // allowUnknown=true leaves unstocked ingredients out instead of failing
    @GetMapping("/{recipeId}/cost")
    public ResponseEntity<RecipeCost> cost(@RequestHeader(TENANT_HEADER) Long tenantId,
                                           @PathVariable Long recipeId,
                                           @RequestParam(defaultValue = "false") boolean allowUnknown) {
        UnknownCostPolicy policy = allowUnknown ? UnknownCostPolicy.DEGRADE : UnknownCostPolicy.FAIL;
        return ResponseEntity.ok(costEngine.calculateCost(tenantId, recipeId, policy));
    }
}
