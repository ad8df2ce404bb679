package com.archiver.engine.merge;

import java.time.Duration;

/**
 * Blocks the merging thread between retry attempts. Tests substitute a recording sleeper.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
