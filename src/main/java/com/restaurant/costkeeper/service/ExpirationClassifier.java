package com.restaurant.costkeeper.service;

import com.restaurant.costkeeper.model.ExpirationStatus;
import com.restaurant.costkeeper.model.InventoryBatch;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Classifies how close a batch is to expiry, by calendar date against the injected clock.
 * Has no side effects; the ledger never acts on it.
 */
@Component
public class ExpirationClassifier {

    private final Clock clock;
    private final int soonDays;

    public ExpirationClassifier(Clock clock, @Value("${costkeeper.expiry.soon-days:2}") int soonDays) {
        this.clock = clock;
        this.soonDays = soonDays;
    }

    public ExpirationStatus classify(InventoryBatch batch) {
        return classify(batch.getExpiresAt());
    }

    public ExpirationStatus classify(LocalDateTime expiresAt) {
        LocalDate today = LocalDate.now(clock);
        LocalDate expiryDate = expiresAt.toLocalDate();

        if (expiryDate.isBefore(today)) {
            return ExpirationStatus.EXPIRED;
        }
        if (expiryDate.isEqual(today)) {
            return ExpirationStatus.EXPIRES_TODAY;
        }
        if (!expiryDate.isAfter(today.plusDays(soonDays))) {
            return ExpirationStatus.EXPIRING_SOON;
        }
        return ExpirationStatus.FRESH;
    }
}
