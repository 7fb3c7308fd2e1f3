package com.restaurant.costkeeper.controller;

import com.restaurant.costkeeper.dto.AdjustBatchRequest;
import com.restaurant.costkeeper.dto.BatchView;
import com.restaurant.costkeeper.dto.ConsumeRequest;
import com.restaurant.costkeeper.dto.ConsumptionResult;
import com.restaurant.costkeeper.dto.CostQuote;
import com.restaurant.costkeeper.dto.InventoryAlert;
import com.restaurant.costkeeper.dto.InventoryDashboard;
import com.restaurant.costkeeper.dto.InventoryHealth;
import com.restaurant.costkeeper.dto.LossReport;
import com.restaurant.costkeeper.dto.MovementView;
import com.restaurant.costkeeper.dto.ReceiveBatchRequest;
import com.restaurant.costkeeper.dto.StockSummary;
import com.restaurant.costkeeper.model.InventoryBatch;
import com.restaurant.costkeeper.service.BatchLedgerService;
import com.restaurant.costkeeper.service.ExpirationClassifier;
import com.restaurant.costkeeper.service.IngredientCostResolver;
import com.restaurant.costkeeper.service.InventoryAlertService;
import com.restaurant.costkeeper.service.StockReportService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/inventory")
public class InventoryController {

    static final String TENANT_HEADER = "X-Tenant-Id";

    private final BatchLedgerService ledger;
    private final IngredientCostResolver costResolver;
    private final ExpirationClassifier expirationClassifier;
    private final StockReportService reportService;
    private final InventoryAlertService alertService;

    public InventoryController(BatchLedgerService ledger, IngredientCostResolver costResolver,
                               ExpirationClassifier expirationClassifier, StockReportService reportService,
                               InventoryAlertService alertService) {
        this.ledger = ledger;
        this.costResolver = costResolver;
        this.expirationClassifier = expirationClassifier;
        this.reportService = reportService;
        this.alertService = alertService;
    }

    @PostMapping("/batches")
    public ResponseEntity<BatchView> receive(@RequestHeader(TENANT_HEADER) Long tenantId,
                                             @Valid @RequestBody ReceiveBatchRequest request) {
        InventoryBatch batch = ledger.receive(tenantId, request.getIngredientId(), request.getQuantity(),
                request.getUnitCostCents(), request.getReceivedAt(), request.getExpiresAt(), request.getSupplier(),
                request.getInvoiceNumber());
        return ResponseEntity.status(HttpStatus.CREATED).body(view(batch));
    }

    @GetMapping("/batches")
    public ResponseEntity<List<BatchView>> listBatches(@RequestHeader(TENANT_HEADER) Long tenantId,
                                                       @RequestParam(required = false) Long ingredientId) {
        List<BatchView> batches = ledger.listBatches(tenantId, ingredientId).stream()
                .map(this::view)
                .collect(Collectors.toList());
        return ResponseEntity.ok(batches);
    }

    @GetMapping("/batches/{batchId}")
    public ResponseEntity<BatchView> getBatch(@RequestHeader(TENANT_HEADER) Long tenantId,
                                              @PathVariable Long batchId) {
        return ResponseEntity.ok(view(ledger.getBatch(tenantId, batchId)));
    }

    @GetMapping("/batches/{batchId}/movements")
    public ResponseEntity<List<MovementView>> movements(@RequestHeader(TENANT_HEADER) Long tenantId,
                                                        @PathVariable Long batchId) {
        List<MovementView> movements = ledger.movements(tenantId, batchId).stream()
                .map(MovementView::of)
                .collect(Collectors.toList());
        return ResponseEntity.ok(movements);
    }

    @PostMapping("/consume")
    public ResponseEntity<Map<String, Object>> consume(@RequestHeader(TENANT_HEADER) Long tenantId,
                                                       @Valid @RequestBody ConsumeRequest request) {
        ConsumptionResult result = ledger.consume(tenantId, request.getIngredientId(), request.getQuantity(),
                request.getMovementType(), request.getReferenceType(), request.getReferenceId(), request.getReason());
        Map<String, Object> body = new HashMap<>();
        body.put("ingredientId", result.ingredientId());
        body.put("quantity", result.quantity());
        body.put("totalCostCents", result.totalCostCents());
        body.put("weightedUnitCostCents", result.weightedUnitCostCents());
        body.put("draws", result.draws());
        return ResponseEntity.ok(body);
    }

    @PostMapping("/batches/{batchId}/adjust")
    public ResponseEntity<BatchView> adjust(@RequestHeader(TENANT_HEADER) Long tenantId,
                                            @PathVariable Long batchId,
                                            @Valid @RequestBody AdjustBatchRequest request) {
        InventoryBatch batch = ledger.adjust(tenantId, batchId, request.getRemainingQuantity(), request.getReason());
        return ResponseEntity.ok(view(batch));
    }

    @PostMapping("/batches/{batchId}/archive")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<BatchView> archive(@RequestHeader(TENANT_HEADER) Long tenantId,
                                             @PathVariable Long batchId) {
        return ResponseEntity.ok(view(ledger.archive(tenantId, batchId)));
    }

    @PostMapping("/expire")
    public ResponseEntity<Map<String, Object>> expire(@RequestHeader(TENANT_HEADER) Long tenantId) {
        int expired = ledger.expireBatches(tenantId);
        return ResponseEntity.ok(Map.of("expiredBatches", expired));
    }

    @GetMapping("/cost")
    public ResponseEntity<Map<String, Object>> cost(@RequestHeader(TENANT_HEADER) Long tenantId,
                                                    @RequestParam Long ingredientId,
                                                    @RequestParam BigDecimal quantity) {
        CostQuote quote = costResolver.resolveCost(tenantId, ingredientId, quantity);
        Map<String, Object> body = new HashMap<>();
        body.put("ingredientId", quote.ingredientId());
        body.put("quantity", quote.quantity());
        body.put("costCents", quote.roundedCostCents());
        body.put("partial", quote.partial());
        body.put("draws", quote.draws());
        return ResponseEntity.ok(body);
    }

    @GetMapping("/summary")
    public ResponseEntity<StockSummary> summary(@RequestHeader(TENANT_HEADER) Long tenantId) {
        return ResponseEntity.ok(reportService.stockSummary(tenantId));
    }

    @GetMapping("/loss-report")
    public ResponseEntity<LossReport> lossReport(@RequestHeader(TENANT_HEADER) Long tenantId,
                                                 @RequestParam(defaultValue = "30") int days) {
        return ResponseEntity.ok(reportService.lossReport(tenantId, days));
    }

    @GetMapping("/expiring")
    public ResponseEntity<List<BatchView>> expiring(@RequestHeader(TENANT_HEADER) Long tenantId,
                                                    @RequestParam(defaultValue = "2") int days) {
        return ResponseEntity.ok(reportService.expiringBatches(tenantId, days));
    }

    @GetMapping("/alerts")
    public ResponseEntity<List<InventoryAlert>> alerts(@RequestHeader(TENANT_HEADER) Long tenantId) {
        return ResponseEntity.ok(alertService.alerts(tenantId));
    }

    @GetMapping("/health")
    public ResponseEntity<InventoryHealth> health(@RequestHeader(TENANT_HEADER) Long tenantId) {
        return ResponseEntity.ok(alertService.status(tenantId));
    }

    @GetMapping("/dashboard")
    public ResponseEntity<InventoryDashboard> dashboard(@RequestHeader(TENANT_HEADER) Long tenantId) {
        return ResponseEntity.ok(reportService.dashboard(tenantId));
    }

    private BatchView view(InventoryBatch batch) {
        return BatchView.of(batch, expirationClassifier.classify(batch));
    }
}
