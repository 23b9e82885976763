package com.sellerInsight.buyBox.marketplace.exception;

/**
 * Exception thrown when a transient failure survived every retry attempt.
 * Distinguishes "upstream is down" from "this identifier is bad".
 */
public class RetriesExhaustedException extends MarketplaceApiException {
    
    private final int attempts;
    
    public RetriesExhaustedException(String message, String productId, int attempts, TransientApiException lastFailure) {
        super(message, productId, lastFailure != null ? lastFailure.getHttpStatus() : null, lastFailure);
        this.attempts = attempts;
    }
    
    public int getAttempts() {
        return attempts;
    }
}
