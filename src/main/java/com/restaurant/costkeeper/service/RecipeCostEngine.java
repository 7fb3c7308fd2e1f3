package com.restaurant.costkeeper.service;

import com.restaurant.costkeeper.dto.CostQuote;
import com.restaurant.costkeeper.dto.RecipeCost;
import com.restaurant.costkeeper.dto.RecipeCostLine;
import com.restaurant.costkeeper.dto.RecipeCostLine.LineKind;
import com.restaurant.costkeeper.exception.CircularRecipeReferenceException;
import com.restaurant.costkeeper.exception.NoStockAvailableException;
import com.restaurant.costkeeper.exception.RecipeDepthExceededException;
import com.restaurant.costkeeper.exception.ResourceNotFoundException;
import com.restaurant.costkeeper.model.Recipe;
import com.restaurant.costkeeper.model.RecipeComponent;
import com.restaurant.costkeeper.model.RecipeIngredient;
import com.restaurant.costkeeper.repository.RecipeRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Prices recipes from current stock, including sub-recipes used as components.
 * <p>
 * Totals are carried as exact decimals through the whole tree and rounded half-up once at the
 * end. Component totals are memoised for the duration of one call only, since ingredient prices
 * depend on tenant and time.
 */
@Slf4j
@Service
public class RecipeCostEngine {

    private final RecipeRepository recipeRepository;
    private final IngredientCostResolver costResolver;
    private final int maxDepth;

    public RecipeCostEngine(RecipeRepository recipeRepository, IngredientCostResolver costResolver,
            @Value("${costkeeper.recipe.max-depth:32}") int maxDepth) {
        this.recipeRepository = recipeRepository;
        this.costResolver = costResolver;
        this.maxDepth = maxDepth;
    }

    @Transactional(readOnly = true)
    public RecipeCost calculateCost(Long tenantId, Long recipeId) {
        return calculateCost(tenantId, recipeId, UnknownCostPolicy.FAIL);
    }

    @Transactional(readOnly = true)
    public RecipeCost calculateCost(Long tenantId, Long recipeId, UnknownCostPolicy policy) {
        Recipe recipe = recipeRepository.findByIdAndTenantId(recipeId, tenantId)
                .orElseThrow(() -> new ResourceNotFoundException("Recipe", recipeId));
        return calculateCost(recipe, policy);
    }

    @Transactional(readOnly = true)
    public RecipeCost calculateCost(Recipe recipe, UnknownCostPolicy policy) {
        CostingRun run = new CostingRun(recipe.getTenantId(), policy);
        run.enter(recipe);
        List<RecipeCostLine> lines = new ArrayList<>();
        BigDecimal exactTotal = run.priceLines(recipe, lines);
        run.leave(recipe);

        int servings = recipe.getServings();
        long total = exactTotal.setScale(0, RoundingMode.HALF_UP).longValueExact();
        long perServing = exactTotal.divide(BigDecimal.valueOf(servings), 0, RoundingMode.HALF_UP).longValueExact();

        log.debug("Costed recipe {} ({}) for tenant {}: total {} cents, {} cents/serving, complete={}",
                recipe.getId(), recipe.getName(), recipe.getTenantId(), total, perServing, run.complete);
        return new RecipeCost(recipe.getId(), recipe.getName(), servings, exactTotal, total, perServing,
                List.copyOf(lines), run.complete, run.partial);
    }

    /**
     * State of a single costing call: the recipes on the current path, for cycle detection, and the
     * exact totals of sub-recipes already priced.
     */
    private final class CostingRun {
        private final Long tenantId;
        private final UnknownCostPolicy policy;
        private final LinkedHashMap<Long, String> path = new LinkedHashMap<>();
        private final Map<Long, BigDecimal> memo = new HashMap<>();
        private boolean complete = true;
        private boolean partial = false;

        CostingRun(Long tenantId, UnknownCostPolicy policy) {
            this.tenantId = tenantId;
            this.policy = policy;
        }

        void enter(Recipe recipe) {
            if (path.containsKey(recipe.getId())) {
                List<String> chain = new ArrayList<>(path.values());
                chain.add(recipe.getName());
                throw new CircularRecipeReferenceException(chain);
            }
            if (path.size() >= maxDepth) {
                throw new RecipeDepthExceededException(path.values().iterator().next(), maxDepth);
            }
            path.put(recipe.getId(), recipe.getName());
        }

        void leave(Recipe recipe) {
            path.remove(recipe.getId());
        }

        BigDecimal priceLines(Recipe recipe, List<RecipeCostLine> lines) {
            BigDecimal total = BigDecimal.ZERO;

            for (RecipeIngredient item : recipe.getIngredients()) {
                Long ingredientId = item.getIngredient().getId();
                String name = item.getIngredient().getName();
                try {
                    CostQuote quote = costResolver.resolveCost(tenantId, ingredientId, item.getQuantity());
                    partial |= quote.partial();
                    total = total.add(quote.exactCostCents());
                    if (lines != null) {
                        lines.add(new RecipeCostLine(LineKind.INGREDIENT, ingredientId, name, item.getQuantity(),
                                quote.exactCostCents(), quote.partial()));
                    }
                } catch (NoStockAvailableException e) {
                    if (policy == UnknownCostPolicy.FAIL) {
                        throw e;
                    }
                    complete = false;
                    log.debug("No stock to price {} in recipe {}, cost left unknown", name, recipe.getName());
                    if (lines != null) {
                        lines.add(new RecipeCostLine(LineKind.INGREDIENT, ingredientId, name, item.getQuantity(),
                                null, false));
                    }
                }
            }

            for (RecipeComponent component : recipe.getComponents()) {
                Recipe sub = component.getComponentRecipe();
                if (!tenantId.equals(sub.getTenantId())) {
                    throw new ResourceNotFoundException("Recipe", sub.getId());
                }
                BigDecimal componentCost = component.getQuantity().multiply(componentTotal(sub));
                total = total.add(componentCost);
                if (lines != null) {
                    lines.add(new RecipeCostLine(LineKind.COMPONENT, sub.getId(), sub.getName(),
                            component.getQuantity(), componentCost, false));
                }
            }
            return total;
        }

        private BigDecimal componentTotal(Recipe sub) {
            enter(sub);
            BigDecimal known = memo.get(sub.getId());
            if (known == null) {
                known = priceLines(sub, null);
                memo.put(sub.getId(), known);
            }
            leave(sub);
            return known;
        }
    }
}
