package com.restaurant.costkeeper.controller;

import com.restaurant.costkeeper.dto.CreateDishRequest;
import com.restaurant.costkeeper.dto.DishAnalysis;
import com.restaurant.costkeeper.dto.DishView;
import com.restaurant.costkeeper.dto.RecordSaleRequest;
import com.restaurant.costkeeper.dto.UpdateDishRequest;
import com.restaurant.costkeeper.model.DishSale;
import com.restaurant.costkeeper.service.DishService;
import com.restaurant.costkeeper.service.SalesRecordingService;
import com.restaurant.costkeeper.service.UnknownCostPolicy;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.restaurant.costkeeper.controller.InventoryController.TENANT_HEADER;

@RestController
@RequestMapping("/api/dishes")
public class DishController {

    private final DishService dishService;
    private final SalesRecordingService salesService;

    public DishController(DishService dishService, SalesRecordingService salesService) {
        this.dishService = dishService;
        this.salesService = salesService;
    }

    @PostMapping
    public ResponseEntity<DishView> create(@RequestHeader(TENANT_HEADER) Long tenantId,
                                           @Valid @RequestBody CreateDishRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(dishService.create(tenantId, request));
    }

    @GetMapping
    public ResponseEntity<List<DishView>> list(@RequestHeader(TENANT_HEADER) Long tenantId,
                                               @RequestParam(defaultValue = "false") boolean includeInactive) {
        return ResponseEntity.ok(dishService.list(tenantId, includeInactive));
    }

    @GetMapping("/{dishId}")
    public ResponseEntity<DishView> get(@RequestHeader(TENANT_HEADER) Long tenantId, @PathVariable Long dishId) {
        return ResponseEntity.ok(dishService.get(tenantId, dishId));
    }

    @PutMapping("/{dishId}")
    public ResponseEntity<DishView> update(@RequestHeader(TENANT_HEADER) Long tenantId,
                                           @PathVariable Long dishId,
                                           @RequestBody UpdateDishRequest request) {
        return ResponseEntity.ok(dishService.update(tenantId, dishId, request));
    }

    @PostMapping("/{dishId}/deactivate")
    public ResponseEntity<DishView> deactivate(@RequestHeader(TENANT_HEADER) Long tenantId,
                                               @PathVariable Long dishId) {
        return ResponseEntity.ok(dishService.deactivate(tenantId, dishId));
    }

    @GetMapping("/{dishId}/financials")
    public ResponseEntity<DishAnalysis> financials(@RequestHeader(TENANT_HEADER) Long tenantId,
                                                   @PathVariable Long dishId,
                                                   @RequestParam(defaultValue = "false") boolean allowUnknown) {
        UnknownCostPolicy policy = allowUnknown ? UnknownCostPolicy.DEGRADE : UnknownCostPolicy.FAIL;
        return ResponseEntity.ok(dishService.financials(tenantId, dishId, policy));
    }

    @PostMapping("/{dishId}/sales")
    public ResponseEntity<Map<String, Object>> recordSale(@RequestHeader(TENANT_HEADER) Long tenantId,
                                                          @PathVariable Long dishId,
                                                          @Valid @RequestBody RecordSaleRequest request) {
        DishSale sale = salesService.recordSale(tenantId, dishId, request.getQuantity(), request.getSaleDate(),
                request.getReferenceId());
        Map<String, Object> body = new HashMap<>();
        body.put("saleId", sale.getId());
        body.put("dishId", dishId);
        body.put("quantity", sale.getQuantity());
        body.put("unitSellingPriceCents", sale.getUnitSellingPriceCents());
        body.put("unitRecipeCostCents", sale.getUnitRecipeCostCents());
        body.put("saleDate", sale.getSaleDate());
        body.put("referenceId", sale.getReferenceId());
        return ResponseEntity.status(HttpStatus.CREATED).body(body);
    }
}
