package com.restaurant.costkeeper.repository;

import com.restaurant.costkeeper.model.AuditLog;
import org.springframework.data.jpa.repository.JpaRepository;
import java.util.List;

public interface AuditLogRepository extends JpaRepository<AuditLog, Long> {
    List<AuditLog> findByTenantIdOrderByTimestampDesc(Long tenantId);
}
