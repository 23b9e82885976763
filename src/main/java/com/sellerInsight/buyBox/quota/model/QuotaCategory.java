package com.sellerInsight.buyBox.quota.model;

/**
 * API endpoint classes with independent contractual rate limits.
 */
public enum QuotaCategory {
    
    /**
     * Catalog Items API (product name lookups).
     */
    CATALOG,
    
    /**
     * Product Pricing API (competing offer lookups).
     */
    PRICING
}
