package com.sellerInsight.buyBox.marketplace.service;

/**
 * Source of the access token sent with every Selling Partner API call.
 * Token acquisition and refresh live outside this application.
 */
public interface AccessTokenProvider {
    
    /**
     * @return Access token for the {@code x-amz-access-token} header
     */
    String accessToken();
    
    /**
     * @return true if the provider can currently authorize lookups
     */
    boolean isValid();
}
