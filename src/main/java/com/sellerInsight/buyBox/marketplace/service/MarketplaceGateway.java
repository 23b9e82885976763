package com.sellerInsight.buyBox.marketplace.service;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Single-shot access to the marketplace APIs. No rate limiting, no retry.
 * 
 * Implementations classify every failure as
 * {@link com.sellerInsight.buyBox.marketplace.exception.TransientApiException} or
 * {@link com.sellerInsight.buyBox.marketplace.exception.PermanentApiException}.
 */
public interface MarketplaceGateway {
    
    /**
     * Product Pricing API getItemOffers.
     * 
     * @param productId ASIN
     * @return Full response body
     */
    JsonNode getItemOffers(String productId);
    
    /**
     * Catalog Items API getCatalogItem with summaries.
     * 
     * @param productId ASIN
     * @return Full response body
     */
    JsonNode getCatalogItem(String productId);
}
