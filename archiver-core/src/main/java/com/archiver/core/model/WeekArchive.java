package com.archiver.core.model;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * The persisted aggregate for one week: the set of canonical events keyed by
 * request id, plus the summary derived from exactly that set.
 * 
 * Invariants:
 * - every key of events equals the requestId of its value
 * - summary was computed over events
 * 
 * Created on the first successful merge of a week, replaced on every later merge,
 * never deleted by the archiver.
 */
public record WeekArchive(
    WeekKey week,
    Map<String, CanonicalEvent> events,
    Summary summary,
    Instant generatedAt
) {
    public WeekArchive {
        Objects.requireNonNull(week, "week");
        events = events != null ? Map.copyOf(events) : Map.of();
        summary = summary != null ? summary : Summary.empty();
    }

    /**
     * An archive for a week that has never been written.
     */
    public static WeekArchive empty(WeekKey week) {
        return new WeekArchive(week, Map.of(), Summary.empty(), null);
    }

    public boolean contains(String requestId) {
        return events.containsKey(requestId);
    }

    public int size() {
        return events.size();
    }
}
