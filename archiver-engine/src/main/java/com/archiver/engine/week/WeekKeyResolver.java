package com.archiver.engine.week;

import com.archiver.core.exception.MalformedRecordException;
import com.archiver.core.model.CanonicalEvent;
import com.archiver.core.model.WeekKey;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.IsoFields;
import java.time.temporal.TemporalAdjusters;

/**
 * Derives the archive partition of an event.
 *
 * Weeks start Monday 00:00 UTC. The key is the ISO week-based year and ISO
 * week number of that Monday, so 2024-12-30 (a Monday) belongs to 2025-W01
 * and 2021-01-03 (a Sunday) to 2020-W53.
 */
public class WeekKeyResolver {

    private final Clock clock;
    private final MissingTimestampPolicy missingTimestampPolicy;

    public WeekKeyResolver(Clock clock) {
        this(clock, MissingTimestampPolicy.CURRENT_WEEK);
    }

    public WeekKeyResolver(Clock clock, MissingTimestampPolicy missingTimestampPolicy) {
        this.clock = clock;
        this.missingTimestampPolicy = missingTimestampPolicy;
    }

    /**
     * Week of a timestamp; a null timestamp resolves to the current week.
     */
    public WeekKey weekKey(Instant timestamp) {
        Instant effective = timestamp != null ? timestamp : clock.instant();
        LocalDate monday = effective.atZone(ZoneOffset.UTC).toLocalDate()
            .with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
        return new WeekKey(
            monday.get(IsoFields.WEEK_BASED_YEAR),
            monday.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR)
        );
    }

    /**
     * Week of an event, applying the missing timestamp policy.
     *
     * @throws MalformedRecordException if the event has no timestamp and the policy is REJECT
     */
    public WeekKey weekKey(CanonicalEvent event) {
        if (event.timestamp() == null && missingTimestampPolicy == MissingTimestampPolicy.REJECT) {
            throw new MalformedRecordException("event " + event.requestId() + " has no parsable event time");
        }
        return weekKey(event.timestamp());
    }
}
