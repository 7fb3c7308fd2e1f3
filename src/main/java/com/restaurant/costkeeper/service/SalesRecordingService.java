package com.restaurant.costkeeper.service;

import com.restaurant.costkeeper.dto.RecipeCost;
import com.restaurant.costkeeper.exception.CircularRecipeReferenceException;
import com.restaurant.costkeeper.exception.InvalidOperationException;
import com.restaurant.costkeeper.exception.InvalidQuantityException;
import com.restaurant.costkeeper.model.Dish;
import com.restaurant.costkeeper.model.DishSale;
import com.restaurant.costkeeper.model.MovementType;
import com.restaurant.costkeeper.model.Recipe;
import com.restaurant.costkeeper.model.RecipeComponent;
import com.restaurant.costkeeper.model.RecipeIngredient;
import com.restaurant.costkeeper.repository.DishSaleRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Records dish sales: snapshots the portion cost, then takes the raw ingredients out of stock.
 */
@Slf4j
@Service
public class SalesRecordingService {

    private final DishService dishService;
    private final RecipeCostEngine costEngine;
    private final BatchLedgerService ledger;
    private final DishSaleRepository saleRepository;
    private final AuditService auditService;
    private final Clock clock;

    public SalesRecordingService(DishService dishService, RecipeCostEngine costEngine, BatchLedgerService ledger,
            DishSaleRepository saleRepository, AuditService auditService, Clock clock) {
        this.dishService = dishService;
        this.costEngine = costEngine;
        this.ledger = ledger;
        this.saleRepository = saleRepository;
        this.auditService = auditService;
        this.clock = clock;
    }

    /**
     * Sells {@code quantity} portions of a dish. The sale and every ingredient consumption commit
     * together; if any ingredient is short the whole sale is rolled back.
     */
    @Transactional
    public DishSale recordSale(Long tenantId, Long dishId, int quantity, LocalDate saleDate, String referenceId) {
        if (quantity <= 0) {
            throw new InvalidQuantityException("Sold quantity must be greater than zero, got " + quantity);
        }
        Dish dish = dishService.load(tenantId, dishId);
        if (!dish.isActive()) {
            throw new InvalidOperationException("Dish " + dish.getName() + " is inactive and cannot be sold");
        }
        String reference = referenceId != null ? referenceId : "sale-" + UUID.randomUUID();

        // Snapshot before consuming, the draw below changes which batches are left
        RecipeCost cost = costEngine.calculateCost(dish.getRecipe(), UnknownCostPolicy.FAIL);

        SortedMap<Long, BigDecimal> demand = expandDemand(dish.getRecipe(), BigDecimal.valueOf(quantity));
        for (Map.Entry<Long, BigDecimal> entry : demand.entrySet()) {
            ledger.consume(tenantId, entry.getKey(), entry.getValue(), MovementType.OUT_SALE, "dish_sale", reference,
                    "Sale of " + quantity + " x " + dish.getName());
        }

        DishSale sale = new DishSale();
        sale.setTenantId(tenantId);
        sale.setDish(dish);
        sale.setQuantity(quantity);
        sale.setUnitSellingPriceCents(dish.getSellingPriceCents());
        sale.setUnitRecipeCostCents(cost.costPerServingCents());
        sale.setSaleDate(saleDate != null ? saleDate : LocalDate.now(clock));
        sale.setReferenceId(reference);
        DishSale saved = saleRepository.save(sale);

        log.info("Recorded sale {} of {} x {} for tenant {} (unit cost {} cents, {} ingredient(s) consumed)",
                reference, quantity, dish.getName(), tenantId, cost.costPerServingCents(), demand.size());
        auditService.log(tenantId, "RECORD_SALE", "Dish ID: " + dishId + ", Qty: " + quantity + ", Ref: " + reference);
        return saved;
    }

    /**
     * Raw ingredient quantities needed for {@code portions} servings of a recipe, keyed by
     * ingredient id in ascending order so that batch locks are always taken in the same order.
     */
    SortedMap<Long, BigDecimal> expandDemand(Recipe recipe, BigDecimal portions) {
        BigDecimal fractionOfBatch = portions.divide(BigDecimal.valueOf(recipe.getServings()), MathContext.DECIMAL64);
        SortedMap<Long, BigDecimal> exact = new TreeMap<>();
        accumulate(recipe, fractionOfBatch, exact, new LinkedHashMap<>());

        SortedMap<Long, BigDecimal> rounded = new TreeMap<>();
        exact.forEach((id, qty) -> {
            BigDecimal scaled = qty.setScale(QuantityRules.QUANTITY_SCALE, RoundingMode.HALF_UP);
            if (scaled.signum() > 0) {
                rounded.put(id, scaled);
            }
        });
        return rounded;
    }

    private void accumulate(Recipe recipe, BigDecimal fraction, Map<Long, BigDecimal> demand,
            LinkedHashMap<Long, String> path) {
        if (path.containsKey(recipe.getId())) {
            List<String> chain = new ArrayList<>(path.values());
            chain.add(recipe.getName());
            throw new CircularRecipeReferenceException(chain);
        }
        path.put(recipe.getId(), recipe.getName());

        for (RecipeIngredient item : recipe.getIngredients()) {
            BigDecimal needed = item.getQuantity().multiply(fraction, MathContext.DECIMAL64);
            demand.merge(item.getIngredient().getId(), needed, BigDecimal::add);
        }
        for (RecipeComponent component : recipe.getComponents()) {
            accumulate(component.getComponentRecipe(), fraction.multiply(component.getQuantity(), MathContext.DECIMAL64),
                    demand, path);
        }
        path.remove(recipe.getId());
    }
}
