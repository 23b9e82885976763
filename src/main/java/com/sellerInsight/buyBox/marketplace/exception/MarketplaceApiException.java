package com.sellerInsight.buyBox.marketplace.exception;

/**
 * Base exception for failed marketplace API lookups.
 */
public class MarketplaceApiException extends RuntimeException {
    
    private final String productId;
    private final Integer httpStatus;
    
    public MarketplaceApiException(String message, String productId, Integer httpStatus, Throwable cause) {
        super(message, cause);
        this.productId = productId;
        this.httpStatus = httpStatus;
    }
    
    public String getProductId() {
        return productId;
    }
    
    /**
     * HTTP status returned by the marketplace, or null for connectivity failures.
     */
    public Integer getHttpStatus() {
        return httpStatus;
    }
}
