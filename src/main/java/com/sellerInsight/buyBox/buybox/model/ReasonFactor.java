package com.sellerInsight.buyBox.buybox.model;

/**
 * Factors that can explain a Buy Box win, in reporting order.
 */
public enum ReasonFactor {
    PRICE,
    FULFILLMENT,
    PRIME,
    SELLER_RATING,
    FEEDBACK_VOLUME,
    AVAILABILITY,
    SHIPPING_SPEED
}
