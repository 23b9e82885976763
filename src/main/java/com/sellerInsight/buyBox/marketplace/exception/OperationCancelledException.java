package com.sellerInsight.buyBox.marketplace.exception;

/**
 * Exception thrown when a lookup is abandoned because the run was cancelled
 * (the worker was interrupted while waiting for quota or backoff).
 */
public class OperationCancelledException extends RuntimeException {
    
    public OperationCancelledException(String message) {
        super(message);
    }
    
    public OperationCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
