package com.sellerInsight.buyBox.marketplace.exception;

/**
 * Exception thrown when a lookup can never succeed as issued:
 * invalid or unknown identifier, authorization failure, not found.
 */
public class PermanentApiException extends MarketplaceApiException {
    
    public PermanentApiException(String message, String productId, Integer httpStatus, Throwable cause) {
        super(message, productId, httpStatus, cause);
    }
}
