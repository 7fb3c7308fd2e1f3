package com.restaurant.costkeeper.service;

import com.restaurant.costkeeper.dto.BatchDraw;
import com.restaurant.costkeeper.dto.ConsumptionResult;
import com.restaurant.costkeeper.exception.InsufficientStockException;
import com.restaurant.costkeeper.exception.InvalidOperationException;
import com.restaurant.costkeeper.exception.InvalidQuantityException;
import com.restaurant.costkeeper.exception.ResourceNotFoundException;
import com.restaurant.costkeeper.model.BatchStatus;
import com.restaurant.costkeeper.model.Ingredient;
import com.restaurant.costkeeper.model.InventoryBatch;
import com.restaurant.costkeeper.model.InventoryMovement;
import com.restaurant.costkeeper.model.MovementType;
import com.restaurant.costkeeper.repository.IngredientRepository;
import com.restaurant.costkeeper.repository.InventoryBatchRepository;
import com.restaurant.costkeeper.repository.InventoryMovementRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Owns physical stock: receipt batches plus the append-only movement log.
 * <p>
 * Every quantity change happens inside one transaction that holds a row lock on the batches
 * it touches, so two consumers of the same (tenant, ingredient) are serialized while other
 * pairs proceed in parallel.
 */
@Slf4j
@Service
public class BatchLedgerService {

    private final InventoryBatchRepository batchRepository;
    private final InventoryMovementRepository movementRepository;
    private final IngredientRepository ingredientRepository;
    private final AuditService auditService;
    private final Clock clock;

    public BatchLedgerService(InventoryBatchRepository batchRepository,
            InventoryMovementRepository movementRepository, IngredientRepository ingredientRepository,
            AuditService auditService, Clock clock) {
        this.batchRepository = batchRepository;
        this.movementRepository = movementRepository;
        this.ingredientRepository = ingredientRepository;
        this.auditService = auditService;
        this.clock = clock;
    }

    @Transactional
    public InventoryBatch receive(Long tenantId, Long ingredientId, BigDecimal quantity, Long unitCostCents,
            LocalDateTime receivedAt, LocalDateTime expiresAt, String supplier, String invoiceNumber) {
        QuantityRules.requirePositive(quantity, "Received quantity");
        QuantityRules.requireNonNegativePrice(unitCostCents, "Unit cost");
        if (expiresAt == null) {
            throw new InvalidOperationException("Expiry date is mandatory for every batch");
        }
        LocalDateTime received = receivedAt != null ? receivedAt : LocalDateTime.now(clock);
        if (expiresAt.isBefore(received)) {
            throw new InvalidOperationException("Batch cannot expire (" + expiresAt + ") before it was received ("
                    + received + ")");
        }

        Ingredient ingredient = ingredientRepository.findById(ingredientId)
                .orElseThrow(() -> new ResourceNotFoundException("Ingredient", ingredientId));

        InventoryBatch batch = new InventoryBatch();
        batch.setTenantId(tenantId);
        batch.setIngredient(ingredient);
        batch.setUnitCostCents(unitCostCents);
        batch.setInitialQuantity(quantity);
        batch.setRemainingQuantity(quantity);
        batch.setReceivedAt(received);
        batch.setExpiresAt(expiresAt);
        batch.setSupplier(supplier);
        batch.setInvoiceNumber(invoiceNumber);
        batch.setStatus(BatchStatus.ACTIVE);
        InventoryBatch saved = batchRepository.save(batch);

        recordMovement(saved, MovementType.IN, quantity, "purchase", invoiceNumber, "Purchase/inbound shipment");

        log.info("Received batch {} for tenant {}: {} x {} at {} cents", saved.getId(), tenantId,
                quantity.toPlainString(), ingredient.getName(), unitCostCents);
        auditService.log(tenantId, "RECEIVE_BATCH",
                "Batch ID: " + saved.getId() + ", Ingredient: " + ingredient.getName() + ", Qty: "
                        + quantity.toPlainString() + ", Unit cost: " + unitCostCents);
        return saved;
    }

    /**
     * Removes {@code quantity} of an ingredient, oldest receipt first. Either the whole quantity is
     * drawn or nothing is: the available total is checked under lock before any batch is touched.
     */
    @Transactional
    public ConsumptionResult consume(Long tenantId, Long ingredientId, BigDecimal quantity, MovementType type,
            String referenceType, String referenceId, String reason) {
        QuantityRules.requirePositive(quantity, "Consumed quantity");
        if (type == null || !type.isOutbound()) {
            throw new InvalidOperationException("Consumption requires an outbound movement type, got " + type);
        }

        List<InventoryBatch> batches = batchRepository.findActiveFifoForUpdate(tenantId, ingredientId);

        BigDecimal available = batches.stream()
                .map(InventoryBatch::getRemainingQuantity)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        if (available.compareTo(quantity) < 0) {
            String name = batches.isEmpty()
                    ? ingredientRepository.findById(ingredientId).map(Ingredient::getName).orElse("ingredient " + ingredientId)
                    : batches.get(0).getIngredient().getName();
            log.warn("Rejected consumption of {} {} for tenant {}: only {} available", quantity.toPlainString(), name,
                    tenantId, available.toPlainString());
            throw new InsufficientStockException(ingredientId, name, quantity, available);
        }

        List<BatchDraw> draws = new ArrayList<>();
        BigDecimal stillNeeded = quantity;
        for (InventoryBatch batch : batches) {
            if (stillNeeded.signum() <= 0) {
                break;
            }
            BigDecimal take = stillNeeded.min(batch.getRemainingQuantity());
            if (take.signum() <= 0) {
                continue;
            }
            drain(batch, take);
            batchRepository.save(batch);
            recordMovement(batch, type, take, referenceType, referenceId, reason);

            draws.add(new BatchDraw(batch.getId(), take, batch.getUnitCostCents()));
            stillNeeded = stillNeeded.subtract(take);
        }

        long totalCost = draws.stream()
                .map(BatchDraw::cost)
                .reduce(BigDecimal.ZERO, BigDecimal::add)
                .setScale(0, RoundingMode.HALF_UP)
                .longValueExact();

        log.debug("Consumed {} of ingredient {} for tenant {} from {} batch(es), cost {} cents",
                quantity.toPlainString(), ingredientId, tenantId, draws.size(), totalCost);
        return new ConsumptionResult(ingredientId, quantity, totalCost, List.copyOf(draws));
    }

    /**
     * Writes off every active batch whose expiry instant has passed. Returns the number of batches
     * written off.
     */
    @Transactional
    public int expireBatches(Long tenantId) {
        LocalDateTime now = LocalDateTime.now(clock);
        List<InventoryBatch> expired = batchRepository.findExpiredActiveForUpdate(tenantId, now);

        for (InventoryBatch batch : expired) {
            BigDecimal remaining = batch.getRemainingQuantity();
            drain(batch, remaining);
            batchRepository.save(batch);
            recordMovement(batch, MovementType.OUT_EXPIRE, remaining, "expiration", null,
                    "Written off after expiry on " + batch.getExpiresAt().toLocalDate());
        }

        if (!expired.isEmpty()) {
            log.info("Wrote off {} expired batch(es) for tenant {}", expired.size(), tenantId);
            auditService.log(tenantId, "EXPIRE_BATCHES", "Batches written off: " + expired.size());
        }
        return expired.size();
    }

    /**
     * Stock-take correction of a single batch. Remaining quantity only ever goes down, so a count
     * above the current remaining quantity is rejected.
     */
    @Transactional
    public InventoryBatch adjust(Long tenantId, Long batchId, BigDecimal newRemaining, String reason) {
        QuantityRules.requireNonNegative(newRemaining, "Remaining quantity");
        QuantityRules.requireStorableScale(newRemaining, "Remaining quantity");
        InventoryBatch batch = batchRepository.findByIdForUpdate(batchId, tenantId)
                .orElseThrow(() -> new ResourceNotFoundException("Batch", batchId));

        if (batch.getStatus() != BatchStatus.ACTIVE) {
            throw new InvalidOperationException("Batch " + batchId + " is " + batch.getStatus()
                    + " and cannot be adjusted");
        }
        BigDecimal oldRemaining = batch.getRemainingQuantity();
        if (newRemaining.compareTo(oldRemaining) > 0) {
            throw new InvalidQuantityException("Remaining quantity can only decrease: current "
                    + oldRemaining.toPlainString() + ", requested " + newRemaining.toPlainString());
        }
        BigDecimal writeOff = oldRemaining.subtract(newRemaining);
        if (writeOff.signum() == 0) {
            return batch;
        }

        drain(batch, writeOff);
        InventoryBatch saved = batchRepository.save(batch);
        InventoryMovement movement = recordMovement(saved, MovementType.ADJUSTMENT, writeOff, "adjustment", null,
                reason);

        auditService.log(tenantId, "ADJUST_BATCH", "Batch ID: " + batchId + ", Old: " + oldRemaining.toPlainString()
                + ", New: " + newRemaining.toPlainString() + ", Movement: " + movement.getId());
        return saved;
    }

    @Transactional
    public InventoryBatch archive(Long tenantId, Long batchId) {
        InventoryBatch batch = batchRepository.findByIdForUpdate(batchId, tenantId)
                .orElseThrow(() -> new ResourceNotFoundException("Batch", batchId));
        if (batch.getStatus() == BatchStatus.ARCHIVED) {
            throw new InvalidOperationException("Batch " + batchId + " is already archived");
        }
        BatchStatus previous = batch.getStatus();
        batch.setStatus(BatchStatus.ARCHIVED);
        InventoryBatch saved = batchRepository.save(batch);

        log.info("Archived batch {} for tenant {} (was {})", batchId, tenantId, previous);
        auditService.log(tenantId, "ARCHIVE_BATCH", "Batch ID: " + batchId + ", Previous status: " + previous
                + ", Remaining: " + batch.getRemainingQuantity().toPlainString());
        return saved;
    }

    @Transactional(readOnly = true)
    public List<InventoryBatch> listBatches(Long tenantId, Long ingredientId) {
        if (ingredientId != null) {
            return batchRepository.findByTenantIdAndIngredientIdOrderByReceivedAtDesc(tenantId, ingredientId);
        }
        return batchRepository.findByTenantIdOrderByReceivedAtDesc(tenantId);
    }

    @Transactional(readOnly = true)
    public InventoryBatch getBatch(Long tenantId, Long batchId) {
        return batchRepository.findByIdAndTenantId(batchId, tenantId)
                .orElseThrow(() -> new ResourceNotFoundException("Batch", batchId));
    }

    @Transactional(readOnly = true)
    public List<InventoryMovement> movements(Long tenantId, Long batchId) {
        getBatch(tenantId, batchId);
        return movementRepository.findByTenantIdAndBatchIdOrderByIdAsc(tenantId, batchId);
    }

    private void drain(InventoryBatch batch, BigDecimal take) {
        BigDecimal remaining = batch.getRemainingQuantity().subtract(take);
        if (remaining.signum() < 0) {
            throw new IllegalStateException("Batch " + batch.getId() + " would be overdrawn");
        }
        batch.setRemainingQuantity(remaining);
        if (remaining.signum() == 0) {
            batch.setStatus(BatchStatus.EXHAUSTED);
        }
    }

    private InventoryMovement recordMovement(InventoryBatch batch, MovementType type, BigDecimal quantity,
            String referenceType, String referenceId, String reason) {
        InventoryMovement movement = new InventoryMovement();
        movement.setTenantId(batch.getTenantId());
        movement.setBatch(batch);
        movement.setType(type);
        movement.setQuantity(quantity);
        movement.setUnitCostCents(batch.getUnitCostCents());
        movement.setTotalCostCents(quantity.multiply(BigDecimal.valueOf(batch.getUnitCostCents()))
                .setScale(0, RoundingMode.HALF_UP).longValueExact());
        movement.setReferenceType(referenceType);
        movement.setReferenceId(referenceId);
        movement.setReason(reason);
        movement.setCreatedBy(auditService.currentUsername());
        movement.setCreatedAt(LocalDateTime.now(clock));
        return movementRepository.save(movement);
    }
}
