package com.sellerInsight.buyBox.buybox.model;

/**
 * One human-readable factor explaining a win.
 * 
 * @param factor Which factor applied
 * @param tier Qualifier for tiered factors (e.g. "EXCELLENT", "HIGH"), null for plain ones
 * @param description Text shown to users, e.g. "Lowest total price (USD 20.00)"
 */
public record BuyBoxReason(ReasonFactor factor, String tier, String description) {
}
