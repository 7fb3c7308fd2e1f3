package com.restaurant.costkeeper.service;

import com.restaurant.costkeeper.dto.BatchDraw;
import com.restaurant.costkeeper.dto.CostQuote;
import com.restaurant.costkeeper.exception.NoStockAvailableException;
import com.restaurant.costkeeper.model.Ingredient;
import com.restaurant.costkeeper.model.InventoryBatch;
import com.restaurant.costkeeper.repository.IngredientRepository;
import com.restaurant.costkeeper.repository.InventoryBatchRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Prices a quantity of an ingredient the way the ledger would charge it, without touching stock.
 * Reads are unlocked, so a quote may differ from what a later consumption actually draws.
 */
@Slf4j
@Service
public class IngredientCostResolver {

    private final InventoryBatchRepository batchRepository;
    private final IngredientRepository ingredientRepository;

    public IngredientCostResolver(InventoryBatchRepository batchRepository,
            IngredientRepository ingredientRepository) {
        this.batchRepository = batchRepository;
        this.ingredientRepository = ingredientRepository;
    }

    // NoStockAvailable leaves an enclosing transaction committable
    @Transactional(readOnly = true, noRollbackFor = NoStockAvailableException.class)
    public CostQuote resolveCost(Long tenantId, Long ingredientId, BigDecimal quantity) {
        QuantityRules.requireNonNegative(quantity, "Costed quantity");

        List<InventoryBatch> batches = batchRepository.findActiveFifo(tenantId, ingredientId);
        if (batches.isEmpty()) {
            String name = ingredientRepository.findById(ingredientId)
                    .map(Ingredient::getName)
                    .orElse("ingredient " + ingredientId);
            throw new NoStockAvailableException(ingredientId, name);
        }

        List<BatchDraw> draws = new ArrayList<>();
        BigDecimal stillNeeded = quantity;
        for (InventoryBatch batch : batches) {
            if (stillNeeded.signum() <= 0) {
                break;
            }
            BigDecimal take = stillNeeded.min(batch.getRemainingQuantity());
            if (take.signum() > 0) {
                draws.add(new BatchDraw(batch.getId(), take, batch.getUnitCostCents()));
                stillNeeded = stillNeeded.subtract(take);
            }
        }

        boolean partial = stillNeeded.signum() > 0;
        if (partial) {
            // Price what stock cannot cover at the newest receipt's unit cost
            InventoryBatch newest = batches.get(batches.size() - 1);
            draws.add(new BatchDraw(null, stillNeeded, newest.getUnitCostCents()));
            log.debug("Quote for ingredient {} (tenant {}) exceeds stock by {}, extrapolated at {} cents",
                    ingredientId, tenantId, stillNeeded.toPlainString(), newest.getUnitCostCents());
        }

        BigDecimal exactCost = draws.stream()
                .map(BatchDraw::cost)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        return new CostQuote(ingredientId, quantity, exactCost, List.copyOf(draws), partial);
    }
}
