package com.foodgraph.hierarchy.service;

/**
 * Unrecoverable failure of a consolidation run. The run stops and nothing
 * further is written.
 */
public class ConsolidationException extends RuntimeException {
    public ConsolidationException(String message) {
        super(message);
    }

    public ConsolidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
