package com.archiver.core.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class WeekArchiveTest {

    private static CanonicalEvent event(String requestId) {
        return new CanonicalEvent(
            requestId,
            Instant.parse("2024-06-18T09:30:00Z"),
            OperationCategory.READ,
            "GetObject",
            new CanonicalEvent.Actor("IAMUser", "alice", "203.0.113.7", "aws-cli"),
            new CanonicalEvent.Target("orders", "a.json", Set.of()),
            "us-east-1",
            null,
            null
        );
    }

    @Test
    void empty_shouldHaveNoEventsAndEmptySummary() {
        WeekArchive archive = WeekArchive.empty(new WeekKey(2024, 25));
        
        assertEquals(0, archive.size());
        assertEquals(Summary.empty(), archive.summary());
        assertNull(archive.generatedAt());
    }

    @Test
    void events_shouldBeDefensivelyCopied() {
        Map<String, CanonicalEvent> events = new HashMap<>();
        events.put("r1", event("r1"));
        WeekArchive archive = new WeekArchive(new WeekKey(2024, 25), events, null, Instant.now());
        
        events.put("r2", event("r2"));
        
        assertTrue(archive.contains("r1"));
        assertFalse(archive.contains("r2"));
        assertEquals(1, archive.size());
    }

    @Test
    void canonicalEvent_shouldLabelOtherEventsByRawName() {
        CanonicalEvent read = event("r1");
        CanonicalEvent other = new CanonicalEvent("r2", null, OperationCategory.OTHER, "PutBucketLogging",
            new CanonicalEvent.Actor(null, null, null, null),
            new CanonicalEvent.Target(null, null, null), null, "AccessDenied", "denied");
        
        assertEquals("READ", read.operationLabel());
        assertEquals("PutBucketLogging", other.operationLabel());
        assertTrue(other.isError());
        assertFalse(read.isError());
        assertEquals("Unknown", other.actor().name());
    }
}
