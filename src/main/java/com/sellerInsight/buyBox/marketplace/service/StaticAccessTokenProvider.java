package com.sellerInsight.buyBox.marketplace.service;

/**
 * Access token provider backed by a fixed, externally issued token.
 */
public class StaticAccessTokenProvider implements AccessTokenProvider {
    
    private final String token;
    
    public StaticAccessTokenProvider(String token) {
        this.token = token;
    }
    
    @Override
    public String accessToken() {
        if (!isValid()) {
            throw new IllegalStateException("SP-API access token is not configured. Set buybox.sp-api.access-token in application.yaml");
        }
        return token;
    }
    
    @Override
    public boolean isValid() {
        return token != null && !token.isBlank();
    }
}
