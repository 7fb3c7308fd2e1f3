package com.restaurant.costkeeper.service;

import com.restaurant.costkeeper.dto.CreateRecipeRequest;
import com.restaurant.costkeeper.dto.RecipeIngredientRequest;
import com.restaurant.costkeeper.dto.RecipeView;
import com.restaurant.costkeeper.exception.CircularRecipeReferenceException;
import com.restaurant.costkeeper.exception.InvalidOperationException;
import com.restaurant.costkeeper.exception.InvalidQuantityException;
import com.restaurant.costkeeper.exception.ResourceNotFoundException;
import com.restaurant.costkeeper.model.Ingredient;
import com.restaurant.costkeeper.model.Recipe;
import com.restaurant.costkeeper.model.RecipeComponent;
import com.restaurant.costkeeper.model.RecipeIngredient;
import com.restaurant.costkeeper.model.RecipeType;
import com.restaurant.costkeeper.repository.IngredientRepository;
import com.restaurant.costkeeper.repository.RecipeRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

@Slf4j
@Service
public class RecipeService {

    private final RecipeRepository recipeRepository;
    private final IngredientRepository ingredientRepository;
    private final AuditService auditService;

    public RecipeService(RecipeRepository recipeRepository, IngredientRepository ingredientRepository,
            AuditService auditService) {
        this.recipeRepository = recipeRepository;
        this.ingredientRepository = ingredientRepository;
        this.auditService = auditService;
    }

    @Transactional
    public RecipeView create(Long tenantId, CreateRecipeRequest request) {
        if (request.getServings() == null || request.getServings() <= 0) {
            throw new InvalidQuantityException("Servings must be greater than zero, got " + request.getServings());
        }
        Recipe recipe = new Recipe();
        recipe.setTenantId(tenantId);
        recipe.setName(request.getName());
        recipe.setServings(request.getServings());
        recipe.setType(request.getType() != null ? request.getType() : RecipeType.FINAL);
        recipe.setInstructions(request.getInstructions());
        replaceIngredients(recipe, request.getIngredients());

        Recipe saved = recipeRepository.save(recipe);
        log.info("Created {} recipe {} ({}) for tenant {} with {} ingredient(s)", saved.getType(), saved.getId(),
                saved.getName(), tenantId, saved.getIngredients().size());
        auditService.log(tenantId, "CREATE_RECIPE", "Recipe ID: " + saved.getId() + ", Name: " + saved.getName());
        return RecipeView.of(saved);
    }

    @Transactional(readOnly = true)
    public RecipeView get(Long tenantId, Long recipeId) {
        return RecipeView.of(load(tenantId, recipeId));
    }

    @Transactional(readOnly = true)
    public List<RecipeView> list(Long tenantId) {
        return recipeRepository.findByTenantIdOrderByNameAsc(tenantId).stream()
                .map(RecipeView::of)
                .collect(Collectors.toList());
    }

    @Transactional
    public RecipeView updateIngredients(Long tenantId, Long recipeId, List<RecipeIngredientRequest> ingredients) {
        Recipe recipe = load(tenantId, recipeId);
        replaceIngredients(recipe, ingredients);
        Recipe saved = recipeRepository.save(recipe);
        auditService.log(tenantId, "UPDATE_RECIPE_INGREDIENTS",
                "Recipe ID: " + recipeId + ", Ingredients: " + saved.getIngredients().size());
        return RecipeView.of(saved);
    }

    /**
     * Uses {@code componentRecipeId} inside {@code recipeId}. Rejected when the component already
     * reaches the parent, directly or through other components, since the edge would close a cycle.
     */
    @Transactional
    public RecipeView addComponent(Long tenantId, Long recipeId, Long componentRecipeId, BigDecimal fraction) {
        QuantityRules.requirePositive(fraction, "Component quantity");
        Recipe recipe = load(tenantId, recipeId);
        Recipe component = load(tenantId, componentRecipeId);

        if (recipe.getId().equals(component.getId())) {
            throw new InvalidOperationException("Recipe " + recipe.getName() + " cannot contain itself");
        }
        List<String> cycle = findPath(component, recipe.getId(), new HashSet<>());
        if (cycle != null) {
            List<String> chain = new ArrayList<>();
            chain.add(recipe.getName());
            chain.addAll(cycle);
            throw new CircularRecipeReferenceException(chain);
        }

        RecipeComponent link = new RecipeComponent();
        link.setRecipe(recipe);
        link.setComponentRecipe(component);
        link.setQuantity(fraction);
        recipe.getComponents().add(link);

        Recipe saved = recipeRepository.save(recipe);
        log.info("Recipe {} now uses {} of recipe {} (tenant {})", recipe.getName(), fraction.toPlainString(),
                component.getName(), tenantId);
        auditService.log(tenantId, "ADD_RECIPE_COMPONENT", "Recipe ID: " + recipeId + ", Component ID: "
                + componentRecipeId + ", Quantity: " + fraction.toPlainString());
        return RecipeView.of(saved);
    }

    Recipe load(Long tenantId, Long recipeId) {
        return recipeRepository.findByIdAndTenantId(recipeId, tenantId)
                .orElseThrow(() -> new ResourceNotFoundException("Recipe", recipeId));
    }

    // Names along a component path from `from` down to `targetId`, or null when none exists
    private List<String> findPath(Recipe from, Long targetId, Set<Long> visited) {
        if (from.getId().equals(targetId)) {
            List<String> path = new ArrayList<>();
            path.add(from.getName());
            return path;
        }
        if (!visited.add(from.getId())) {
            return null;
        }
        for (RecipeComponent next : from.getComponents()) {
            List<String> rest = findPath(next.getComponentRecipe(), targetId, visited);
            if (rest != null) {
                rest.add(0, from.getName());
                return rest;
            }
        }
        return null;
    }

    private void replaceIngredients(Recipe recipe, List<RecipeIngredientRequest> requests) {
        recipe.getIngredients().clear();
        if (requests == null) {
            return;
        }
        for (RecipeIngredientRequest request : requests) {
            QuantityRules.requirePositive(request.getQuantity(), "Ingredient quantity");
            Ingredient ingredient = ingredientRepository.findById(request.getIngredientId())
                    .orElseThrow(() -> new ResourceNotFoundException("Ingredient", request.getIngredientId()));

            RecipeIngredient line = new RecipeIngredient();
            line.setRecipe(recipe);
            line.setIngredient(ingredient);
            line.setQuantity(request.getQuantity());
            line.setUnit(request.getUnit() != null ? request.getUnit() : ingredient.getUnit());
            recipe.getIngredients().add(line);
        }
    }
}
