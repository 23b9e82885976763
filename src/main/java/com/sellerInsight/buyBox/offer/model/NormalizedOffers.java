package com.sellerInsight.buyBox.offer.model;

import java.util.List;

/**
 * Normalizer output: usable offers plus the number of raw entries that were dropped.
 */
public record NormalizedOffers(List<Offer> offers, int discardedCount) {
    
    public NormalizedOffers {
        offers = List.copyOf(offers);
    }
    
    public boolean isEmpty() {
        return offers.isEmpty();
    }
}
