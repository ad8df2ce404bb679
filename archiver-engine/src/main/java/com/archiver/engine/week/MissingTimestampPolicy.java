package com.archiver.engine.week;

/**
 * What to do with an event whose time is missing or unparsable.
 */
public enum MissingTimestampPolicy {
    /**
     * File the event under the week of the processing instant.
     * Misfiles events when old data is backfilled.
     */
    CURRENT_WEEK,

    /**
     * Treat the record as malformed and skip it.
     */
    REJECT
}
