package com.sellerInsight.buyBox.marketplace.exception;

import java.time.Duration;

/**
 * Exception thrown for failures worth retrying: throttling (429), timeouts,
 * server-side faults and connectivity errors.
 */
public class TransientApiException extends MarketplaceApiException {
    
    private final Duration retryAfter;
    
    public TransientApiException(String message, String productId, Integer httpStatus, Duration retryAfter, Throwable cause) {
        super(message, productId, httpStatus, cause);
        this.retryAfter = retryAfter;
    }
    
    /**
     * Server-provided Retry-After hint, or null when absent.
     */
    public Duration getRetryAfter() {
        return retryAfter;
    }
}
