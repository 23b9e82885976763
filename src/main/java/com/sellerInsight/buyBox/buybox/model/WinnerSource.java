package com.sellerInsight.buyBox.buybox.model;

/**
 * How the winning offer was selected.
 */
public enum WinnerSource {
    
    /**
     * Exactly one offer was marked as Buy Box winner by the marketplace.
     */
    FEATURED_FLAG,
    
    /**
     * No authoritative flag; lowest total price with deterministic tie-break.
     */
    PRICE_RANKING
}
