package com.sellerInsight.buyBox.offer.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.math.BigDecimal;

/**
 * One seller's listing state at lookup time.
 * 
 * Immutable once normalized. Nullable fields mean "the source did not say",
 * which is different from zero (an unrated seller is not a 0% seller).
 */
@Value
@Builder(toBuilder = true)
public class Offer {
    
    /**
     * Seller identifier, unique within one product's offer set.
     */
    @NonNull
    String sellerId;
    
    @NonNull
    BigDecimal listingPrice;
    
    @NonNull
    BigDecimal shippingPrice;
    
    /**
     * ISO currency code of the listing price.
     */
    @Builder.Default
    String currencyCode = "USD";
    
    boolean fulfilledByPlatform;
    
    boolean primeEligible;
    
    /**
     * Positive feedback percentage (0-100), null if the seller has no rating history.
     */
    Double sellerFeedbackRating;
    
    /**
     * Number of feedback ratings, null if the source omitted it.
     */
    Integer sellerFeedbackCount;
    
    boolean inStock;
    
    /**
     * Maximum delivery latency in hours, null if unknown.
     */
    Integer shippingHours;
    
    /**
     * True only when the marketplace explicitly marks this offer as the Buy Box winner.
     */
    boolean featuredOffer;
    
    /**
     * Listing price plus shipping. Derived on every call, never stored.
     */
    public BigDecimal getTotalPrice() {
        return listingPrice.add(shippingPrice);
    }
}
