package com.sellerInsight.buyBox.orchestrator.model;

/**
 * Classification of a per-product failure.
 */
public enum FailureKind {
    
    /**
     * Invalid or unknown identifier, authorization failure. Not retried.
     */
    PERMANENT,
    
    /**
     * Transient failure that survived every retry attempt (upstream is down).
     */
    EXHAUSTED_RETRY,
    
    /**
     * Not processed, or abandoned, because the run was cancelled.
     */
    CANCELLED,
    
    /**
     * Anything else, e.g. a payload the normalizer could not read.
     */
    UNEXPECTED
}
