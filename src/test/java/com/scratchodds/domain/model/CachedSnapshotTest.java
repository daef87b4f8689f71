package com.scratchodds.domain.model;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for CachedSnapshot.
 */
class CachedSnapshotTest {

    private static final Instant TAKEN = Instant.parse("2025-03-01T12:00:00Z");

    @Test
    void testIsStale() {
        CachedSnapshot snapshot = new CachedSnapshot(List.of(), TAKEN);

        assertFalse(snapshot.isStale(TAKEN.plus(Duration.ofHours(23))));
        assertFalse(snapshot.isStale(TAKEN.plus(Duration.ofHours(24))));
        assertTrue(snapshot.isStale(TAKEN.plus(Duration.ofHours(25))));
    }

    @Test
    void testDescribeAge() {
        CachedSnapshot snapshot = new CachedSnapshot(null, TAKEN);

        assertEquals("just now", snapshot.describeAge(TAKEN.plus(Duration.ofMinutes(59))));
        assertEquals("1 hour ago", snapshot.describeAge(TAKEN.plus(Duration.ofMinutes(61))));
        assertEquals("5 hours ago", snapshot.describeAge(TAKEN.plus(Duration.ofHours(5))));
        assertEquals("1 day ago", snapshot.describeAge(TAKEN.plus(Duration.ofHours(30))));
        assertEquals("3 days ago", snapshot.describeAge(TAKEN.plus(Duration.ofDays(3))));
        assertTrue(snapshot.games().isEmpty());
    }
}
