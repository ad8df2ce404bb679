package com.archiver.core.sink;

import com.archiver.core.model.CanonicalEvent;

import java.util.List;

/**
 * Live feed of relevant events, next to the weekly archives.
 * Receives every relevant event of a batch, redeliveries included.
 */
public interface EventSink {

    /**
     * Sink that drops everything. Used when forwarding is switched off.
     */
    EventSink NONE = events -> { };

    /**
     * @param events Relevant events of one batch, in delivery order
     * @throws com.archiver.core.exception.EventSinkException if the events could not be forwarded
     */
    void publish(List<CanonicalEvent> events);
}
