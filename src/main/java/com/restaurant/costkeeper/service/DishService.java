package com.restaurant.costkeeper.service;

import com.restaurant.costkeeper.dto.CreateDishRequest;
import com.restaurant.costkeeper.dto.DishAnalysis;
import com.restaurant.costkeeper.dto.DishFinancials;
import com.restaurant.costkeeper.dto.DishView;
import com.restaurant.costkeeper.dto.RecipeCost;
import com.restaurant.costkeeper.dto.UpdateDishRequest;
import com.restaurant.costkeeper.exception.InvalidOperationException;
import com.restaurant.costkeeper.exception.ResourceNotFoundException;
import com.restaurant.costkeeper.model.Dish;
import com.restaurant.costkeeper.model.Recipe;
import com.restaurant.costkeeper.model.RecipeType;
import com.restaurant.costkeeper.repository.DishRepository;
import com.restaurant.costkeeper.repository.RecipeRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.stream.Collectors;

@Slf4j
@Service
public class DishService {

    private final DishRepository dishRepository;
    private final RecipeRepository recipeRepository;
    private final RecipeCostEngine costEngine;
    private final DishProfitabilityCalculator calculator;
    private final AuditService auditService;

    public DishService(DishRepository dishRepository, RecipeRepository recipeRepository,
            RecipeCostEngine costEngine, DishProfitabilityCalculator calculator, AuditService auditService) {
        this.dishRepository = dishRepository;
        this.recipeRepository = recipeRepository;
        this.costEngine = costEngine;
        this.calculator = calculator;
        this.auditService = auditService;
    }

    @Transactional
    public DishView create(Long tenantId, CreateDishRequest request) {
        QuantityRules.requirePositivePrice(request.getSellingPriceCents(), "Selling price");
        Recipe recipe = finalRecipe(tenantId, request.getRecipeId());

        Dish dish = new Dish();
        dish.setTenantId(tenantId);
        dish.setRecipe(recipe);
        dish.setName(request.getName());
        dish.setDescription(request.getDescription());
        dish.setSellingPriceCents(request.getSellingPriceCents());
        Dish saved = dishRepository.save(dish);

        log.info("Created dish {} ({}) for tenant {} at {} cents", saved.getId(), saved.getName(), tenantId,
                saved.getSellingPriceCents());
        auditService.log(tenantId, "CREATE_DISH", "Dish ID: " + saved.getId() + ", Name: " + saved.getName()
                + ", Price: " + saved.getSellingPriceCents());
        return DishView.of(saved);
    }

    @Transactional
    public DishView update(Long tenantId, Long dishId, UpdateDishRequest request) {
        Dish dish = load(tenantId, dishId);
        StringBuilder changes = new StringBuilder();

        if (request.getSellingPriceCents() != null) {
            QuantityRules.requirePositivePrice(request.getSellingPriceCents(), "Selling price");
            changes.append("Price: ").append(dish.getSellingPriceCents()).append(" -> ")
                    .append(request.getSellingPriceCents()).append("; ");
            dish.setSellingPriceCents(request.getSellingPriceCents());
        }
        if (request.getRecipeId() != null) {
            dish.setRecipe(finalRecipe(tenantId, request.getRecipeId()));
            changes.append("Recipe: ").append(request.getRecipeId()).append("; ");
        }
        if (request.getName() != null) {
            dish.setName(request.getName());
        }
        if (request.getDescription() != null) {
            dish.setDescription(request.getDescription());
        }

        Dish saved = dishRepository.save(dish);
        auditService.log(tenantId, "UPDATE_DISH", "Dish ID: " + dishId + (changes.length() > 0 ? ", " + changes : ""));
        return DishView.of(saved);
    }

    @Transactional
    public DishView deactivate(Long tenantId, Long dishId) {
        Dish dish = load(tenantId, dishId);
        if (!dish.isActive()) {
            throw new InvalidOperationException("Dish " + dish.getName() + " is already inactive");
        }
        dish.setActive(false);
        Dish saved = dishRepository.save(dish);
        auditService.log(tenantId, "DEACTIVATE_DISH", "Dish ID: " + dishId + ", Name: " + dish.getName());
        return DishView.of(saved);
    }

    @Transactional(readOnly = true)
    public List<DishView> list(Long tenantId, boolean includeInactive) {
        List<Dish> dishes = includeInactive
                ? dishRepository.findByTenantIdOrderByNameAsc(tenantId)
                : dishRepository.findByTenantIdAndActiveTrueOrderByNameAsc(tenantId);
        return dishes.stream().map(DishView::of).collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public DishView get(Long tenantId, Long dishId) {
        return DishView.of(load(tenantId, dishId));
    }

    @Transactional(readOnly = true)
    public DishAnalysis financials(Long tenantId, Long dishId) {
        return financials(tenantId, dishId, UnknownCostPolicy.FAIL);
    }

    /**
     * Profitability of one portion at current prices. The portion cost is the recipe's cost per
     * serving.
     */
    @Transactional(readOnly = true)
    public DishAnalysis financials(Long tenantId, Long dishId, UnknownCostPolicy policy) {
        Dish dish = load(tenantId, dishId);
        RecipeCost cost = costEngine.calculateCost(dish.getRecipe(), policy);
        DishFinancials financials = calculator.analyze(dish.getSellingPriceCents(), cost.costPerServingCents());
        if (!financials.warnings().isEmpty()) {
            log.debug("Dish {} (tenant {}) raised {}", dish.getName(), tenantId, financials.warnings());
        }
        return new DishAnalysis(dish.getId(), dish.getName(), financials, cost.complete(), cost.partial());
    }

    Dish load(Long tenantId, Long dishId) {
        return dishRepository.findByIdAndTenantId(dishId, tenantId)
                .orElseThrow(() -> new ResourceNotFoundException("Dish", dishId));
    }

    private Recipe finalRecipe(Long tenantId, Long recipeId) {
        Recipe recipe = recipeRepository.findByIdAndTenantId(recipeId, tenantId)
                .orElseThrow(() -> new ResourceNotFoundException("Recipe", recipeId));
        if (recipe.getType() != RecipeType.FINAL) {
            throw new InvalidOperationException("Recipe " + recipe.getName() + " is a " + recipe.getType()
                    + " recipe; only FINAL recipes can be sold as dishes");
        }
        return recipe;
    }
}
