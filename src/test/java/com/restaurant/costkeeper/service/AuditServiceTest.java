package com.restaurant.costkeeper.service;

import com.restaurant.costkeeper.model.AuditLog;
import com.restaurant.costkeeper.repository.AuditLogRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class AuditServiceTest {

    @Mock
    private AuditLogRepository auditLogRepository;

    @InjectMocks
    private AuditService auditService;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
    }

    @AfterEach
    void clearContext() {
        SecurityContextHolder.clearContext();
    }

    @Test
    void log_ShouldRecordTenantAndCurrentUser() {
        SecurityContextHolder.getContext().setAuthentication(
                new UsernamePasswordAuthenticationToken("chef", "n/a", List.of()));

        auditService.log(8L, "RECEIVE_BATCH", "Batch ID: 1");

        ArgumentCaptor<AuditLog> captor = ArgumentCaptor.forClass(AuditLog.class);
        verify(auditLogRepository).save(captor.capture());
        assertEquals(Long.valueOf(8), captor.getValue().getTenantId());
        assertEquals("chef", captor.getValue().getUsername());
        assertEquals("RECEIVE_BATCH", captor.getValue().getAction());
    }

    @Test
    void log_ShouldFallBackToSystemUser() {
        auditService.log(8L, "EXPIRE_BATCHES", "Batches written off: 2");

        ArgumentCaptor<AuditLog> captor = ArgumentCaptor.forClass(AuditLog.class);
        verify(auditLogRepository).save(captor.capture());
        assertEquals(AuditService.SYSTEM_USER, captor.getValue().getUsername());
    }

    @Test
    void log_ShouldNotFailTheCallerWhenSavingFails() {
        when(auditLogRepository.save(any(AuditLog.class))).thenThrow(new IllegalStateException("disk full"));

        assertDoesNotThrow(() -> auditService.log(8L, "ARCHIVE_BATCH", "Batch ID: 4"));
    }
}
