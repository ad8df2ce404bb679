package com.archiver.core.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Rollup statistics of a week archive. Always derived from the archive's
 * events, never maintained on its own.
 * 
 * The top-N maps keep their ranking order (descending count, then key).
 */
public record Summary(
    long totalEvents,
    long errorCount,
    Map<OperationCategory, Long> operationCounts,
    Map<String, Long> topOperations,
    Map<String, Long> topActors,
    Map<String, Long> topSourceIps,
    long uniqueActors,
    long uniqueIps
) {
    public Summary {
        operationCounts = Collections.unmodifiableMap(new EnumMap<>(completeCounts(operationCounts)));
        topOperations = ordered(topOperations);
        topActors = ordered(topActors);
        topSourceIps = ordered(topSourceIps);
    }

    /**
     * Summary of an archive with no events.
     */
    public static Summary empty() {
        return new Summary(0, 0, Map.of(), Map.of(), Map.of(), Map.of(), 0, 0);
    }

    public long countOf(OperationCategory category) {
        return operationCounts.getOrDefault(category, 0L);
    }

    private static Map<OperationCategory, Long> completeCounts(Map<OperationCategory, Long> counts) {
        Map<OperationCategory, Long> complete = new EnumMap<>(OperationCategory.class);
        for (OperationCategory category : OperationCategory.values()) {
            complete.put(category, counts != null ? counts.getOrDefault(category, 0L) : 0L);
        }
        return complete;
    }

    private static Map<String, Long> ordered(Map<String, Long> source) {
        return source != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(source))
            : Map.of();
    }
}
