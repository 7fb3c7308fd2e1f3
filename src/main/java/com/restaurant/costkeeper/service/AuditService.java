package com.restaurant.costkeeper.service;

import com.restaurant.costkeeper.model.AuditLog;
import com.restaurant.costkeeper.repository.AuditLogRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Service;

import java.util.List;

@Slf4j
@Service
public class AuditService {

    public static final String SYSTEM_USER = "SYSTEM";

    private final AuditLogRepository auditLogRepository;

    public AuditService(AuditLogRepository auditLogRepository) {
        this.auditLogRepository = auditLogRepository;
    }

    public void log(Long tenantId, String action, String details) {
        try {
            AuditLog entry = new AuditLog();
            entry.setTenantId(tenantId);
            entry.setAction(action);
            entry.setDetails(details);
            entry.setUsername(currentUsername());
            auditLogRepository.save(entry);
        } catch (RuntimeException e) {
            // Audit logging should not break the business operation
            log.warn("Failed to write audit log {} for tenant {}: {}", action, tenantId, e.getMessage());
        }
    }

    public List<AuditLog> recent(Long tenantId) {
        return auditLogRepository.findByTenantIdOrderByTimestampDesc(tenantId);
    }

    public String currentUsername() {
        Authentication auth = SecurityContextHolder.getContext().getAuthentication();
        return auth != null ? auth.getName() : SYSTEM_USER;
    }
}
