package com.restaurant.costkeeper.service;

import com.restaurant.costkeeper.model.ExpirationStatus;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ExpirationClassifierTest {

    // 2024-03-15 14:00 UTC
    private final Clock clock = Clock.fixed(Instant.parse("2024-03-15T14:00:00Z"), ZoneOffset.UTC);
    private final ExpirationClassifier classifier = new ExpirationClassifier(clock, 2);

    @Test
    void classify_ShouldMarkEarlierDateExpired() {
        assertEquals(ExpirationStatus.EXPIRED, classifier.classify(LocalDateTime.of(2024, 3, 14, 23, 59)));
    }

    @Test
    void classify_ShouldMarkSameDateExpiringTodayEvenIfInstantPassed() {
        assertEquals(ExpirationStatus.EXPIRES_TODAY, classifier.classify(LocalDateTime.of(2024, 3, 15, 0, 1)));
        assertEquals(ExpirationStatus.EXPIRES_TODAY, classifier.classify(LocalDateTime.of(2024, 3, 15, 23, 0)));
    }

    @Test
    void classify_ShouldMarkWithinTwoDaysExpiringSoon() {
        assertEquals(ExpirationStatus.EXPIRING_SOON, classifier.classify(LocalDateTime.of(2024, 3, 16, 10, 0)));
        assertEquals(ExpirationStatus.EXPIRING_SOON, classifier.classify(LocalDateTime.of(2024, 3, 17, 23, 0)));
    }

    @Test
    void classify_ShouldMarkLaterDatesFresh() {
        assertEquals(ExpirationStatus.FRESH, classifier.classify(LocalDateTime.of(2024, 3, 18, 0, 0)));
    }
}
