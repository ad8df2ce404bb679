package com.archiver.core.model;

/**
 * Semantic category of an audited operation.
 */
public enum OperationCategory {
    READ,
    WRITE,
    DELETE,
    
    /**
     * Event name absent from the classification table. The raw event name is kept on the event.
     */
    OTHER
}
