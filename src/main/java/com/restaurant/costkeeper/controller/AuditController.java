package com.restaurant.costkeeper.controller;

import com.restaurant.costkeeper.model.AuditLog;
import com.restaurant.costkeeper.service.AuditService;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

import static com.restaurant.costkeeper.controller.InventoryController.TENANT_HEADER;

@RestController
@RequestMapping("/api/audit")
public class AuditController {

    private final AuditService auditService;

    public AuditController(AuditService auditService) {
        this.auditService = auditService;
    }

    @GetMapping
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<List<AuditLog>> recent(@RequestHeader(TENANT_HEADER) Long tenantId) {
        return ResponseEntity.ok(auditService.recent(tenantId));
    }
}
