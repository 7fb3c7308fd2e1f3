package com.restaurant.costkeeper.model;

import jakarta.persistence.*;
import lombok.Data;
import java.time.LocalDateTime;

@Entity
@Table(name = "audit_logs")
@Data
public class AuditLog {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    private String username;

    private Long tenantId;

    private String action; // e.g., "RECEIVE_BATCH", "ARCHIVE_BATCH"

    @Column(length = 1000)
    private String details; // e.g., "Batch ID: 123, Qty: 5.0000"

    private LocalDateTime timestamp;

    @PrePersist
    protected void onCreate() {
        timestamp = LocalDateTime.now();
    }
}
