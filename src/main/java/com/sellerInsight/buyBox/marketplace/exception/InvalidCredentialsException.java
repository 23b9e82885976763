package com.sellerInsight.buyBox.marketplace.exception;

/**
 * Exception thrown when the credential provider cannot authorize lookups.
 * This is the only failure that aborts a whole batch.
 */
public class InvalidCredentialsException extends RuntimeException {
    
    public InvalidCredentialsException(String message) {
        super(message);
    }
}
