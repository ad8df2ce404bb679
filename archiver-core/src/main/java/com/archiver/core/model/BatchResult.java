package com.archiver.core.model;

import java.util.List;

/**
 * What happened to one delivered batch. Partial success is reported per week,
 * never folded into a single flag.
 *
 * @param totalRecords records delivered, including malformed ones
 * @param malformedCount records skipped because they could not be parsed
 * @param filteredOutCount records not about the monitored resource
 * @param relevantCount records normalized and assigned to a week
 * @param mergedCount events newly written across all weeks
 * @param duplicateCount relevant events already archived (redeliveries)
 */
public record BatchResult(
    String batchId,
    int totalRecords,
    int malformedCount,
    int filteredOutCount,
    int relevantCount,
    int mergedCount,
    int duplicateCount,
    List<WeekOutcome> weeks
) {
    public BatchResult {
        weeks = weeks != null ? List.copyOf(weeks) : List.of();
    }

    public boolean isComplete() {
        return weeks.stream().allMatch(WeekOutcome::isSuccess);
    }

    public List<WeekOutcome> failedWeeks() {
        return weeks.stream().filter(w -> !w.isSuccess()).toList();
    }
}
