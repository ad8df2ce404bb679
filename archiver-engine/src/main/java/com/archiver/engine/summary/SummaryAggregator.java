package com.archiver.engine.summary;

import com.archiver.core.model.CanonicalEvent;
import com.archiver.core.model.OperationCategory;
import com.archiver.core.model.Summary;

import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Computes week summaries from event sets.
 *
 * Pure and deterministic: the same set of events always yields an equal summary
 * with identical ranking order, whatever the iteration order of the input.
 * Rankings sort by descending count, then ascending key.
 */
public class SummaryAggregator {

    public static final int DEFAULT_TOP_N = 10;

    private static final Comparator<Map.Entry<String, Long>> RANKING =
        Map.Entry.<String, Long>comparingByValue().reversed()
            .thenComparing(Map.Entry.<String, Long>comparingByKey());

    private final int topN;

    public SummaryAggregator() {
        this(DEFAULT_TOP_N);
    }

    public SummaryAggregator(int topN) {
        if (topN < 1) {
            throw new IllegalArgumentException("topN must be >= 1");
        }
        this.topN = topN;
    }

    public Summary aggregate(Collection<CanonicalEvent> events) {
        Map<OperationCategory, Long> categories = new EnumMap<>(OperationCategory.class);
        Map<String, Long> operations = new HashMap<>();
        Map<String, Long> actors = new HashMap<>();
        Map<String, Long> sourceIps = new HashMap<>();
        long errors = 0;

        for (CanonicalEvent event : events) {
            categories.merge(event.operationCategory(), 1L, Long::sum);
            operations.merge(event.operationLabel(), 1L, Long::sum);
            actors.merge(event.actor().name(), 1L, Long::sum);
            sourceIps.merge(ipKey(event), 1L, Long::sum);
            if (event.isError()) {
                errors++;
            }
        }

        return new Summary(
            events.size(),
            errors,
            categories,
            top(operations),
            top(actors),
            top(sourceIps),
            actors.size(),
            sourceIps.size()
        );
    }

    private Map<String, Long> top(Map<String, Long> counts) {
        Map<String, Long> ranked = new LinkedHashMap<>();
        counts.entrySet().stream()
            .sorted(RANKING)
            .limit(topN)
            .forEachOrdered(e -> ranked.put(e.getKey(), e.getValue()));
        return ranked;
    }

    private static String ipKey(CanonicalEvent event) {
        String ip = event.actor().sourceIp();
        return ip.isEmpty() ? "Unknown" : ip;
    }
}
