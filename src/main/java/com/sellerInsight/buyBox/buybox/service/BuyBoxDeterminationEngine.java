package com.sellerInsight.buyBox.buybox.service;

import com.sellerInsight.buyBox.buybox.model.BuyBoxDetermination;
import com.sellerInsight.buyBox.buybox.model.BuyBoxReason;
import com.sellerInsight.buyBox.buybox.model.ReasonFactor;
import com.sellerInsight.buyBox.buybox.model.WinnerSource;
import com.sellerInsight.buyBox.offer.model.Offer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Selects the Buy Box winner among competing offers and explains the win.
 *
 * Winner selection, in priority order:
 * 1. Exactly one offer flagged as Buy Box winner by the marketplace
 * 2. Lowest total price; ties go to in-stock, then platform-fulfilled, then smallest seller id
 * 3. No offers, no winner
 *
 * Reasons are evaluated against the winner independently and reported in a fixed order:
 * price, fulfillment, Prime, seller rating, feedback volume, availability, shipping speed.
 */
@Slf4j
@Service
public class BuyBoxDeterminationEngine {
    
    static final BigDecimal COMPETITIVE_PRICE_FACTOR = new BigDecimal("1.02");
    static final double EXCELLENT_RATING = 95d;
    static final double GOOD_RATING = 90d;
    static final int HIGH_FEEDBACK_COUNT = 10_000;
    static final int STRONG_FEEDBACK_COUNT = 1_000;
    static final int FAST_SHIPPING_HOURS = 48;
    
    /**
     * Price ranking with deterministic tie-break. Booleans sort false before true,
     * hence the reversed order to prefer in-stock and platform-fulfilled offers.
     */
    static final Comparator<Offer> PRICE_RANKING = Comparator.comparing(Offer::getTotalPrice)
            .thenComparing(Offer::isInStock, Comparator.reverseOrder())
            .thenComparing(Offer::isFulfilledByPlatform, Comparator.reverseOrder())
            .thenComparing(Offer::getSellerId);
    
    /**
     * Determines the winner and reasons for one product's offers.
     *
     * @param offers Normalized offers, may be empty
     * @return Determination with winner and ordered reasons
     */
    public BuyBoxDetermination determine(List<Offer> offers) {
        if (offers == null || offers.isEmpty()) {
            return BuyBoxDetermination.noWinner();
        }
        
        // Step 1: authoritative marketplace flag
        List<Offer> featured = offers.stream()
                .filter(Offer::isFeaturedOffer)
                .toList();
        
        Offer winner;
        WinnerSource source;
        if (featured.size() == 1) {
            winner = featured.get(0);
            source = WinnerSource.FEATURED_FLAG;
        } else {
            if (featured.size() > 1) {
                log.warn("Multiple offers flagged as Buy Box winner, falling back to price ranking - flagged: {}",
                        featured.stream().map(Offer::getSellerId).toList());
            }
            // Step 2: price ranking
            winner = offers.stream()
                    .min(PRICE_RANKING)
                    .orElseThrow();
            source = WinnerSource.PRICE_RANKING;
        }
        
        List<BuyBoxReason> reasons = determineReasons(winner, offers);
        log.debug("Buy Box determined - sellerId: {}, source: {}, reasons: {}",
                winner.getSellerId(), source, reasons.size());
        return new BuyBoxDetermination(winner, source, reasons);
    }
    
    private List<BuyBoxReason> determineReasons(Offer winner, List<Offer> offers) {
        List<BuyBoxReason> reasons = new ArrayList<>();
        
        // Price comparison
        BigDecimal minTotal = offers.stream()
                .map(Offer::getTotalPrice)
                .min(Comparator.naturalOrder())
                .orElse(winner.getTotalPrice());
        BigDecimal winnerTotal = winner.getTotalPrice();
        String formattedTotal = formatMoney(winner.getCurrencyCode(), winnerTotal);
        
        if (winnerTotal.compareTo(minTotal) == 0) {
            reasons.add(new BuyBoxReason(ReasonFactor.PRICE, "LOWEST",
                    "Lowest total price (" + formattedTotal + ")"));
        } else if (minTotal.signum() > 0 && winnerTotal.compareTo(minTotal.multiply(COMPETITIVE_PRICE_FACTOR)) <= 0) {
            reasons.add(new BuyBoxReason(ReasonFactor.PRICE, "COMPETITIVE",
                    "Competitive price within 2% of lowest (" + formattedTotal + ")"));
        }
        
        // Fulfillment and Prime
        if (winner.isFulfilledByPlatform()) {
            reasons.add(new BuyBoxReason(ReasonFactor.FULFILLMENT, null, "Fulfilled by Amazon (FBA)"));
        }
        if (winner.isPrimeEligible()) {
            reasons.add(new BuyBoxReason(ReasonFactor.PRIME, null, "Prime eligible"));
        }
        
        // Seller rating
        Double rating = winner.getSellerFeedbackRating();
        if (rating != null) {
            if (rating >= EXCELLENT_RATING) {
                reasons.add(new BuyBoxReason(ReasonFactor.SELLER_RATING, "EXCELLENT",
                        String.format(Locale.US, "Excellent seller rating (%.0f%%)", rating)));
            } else if (rating >= GOOD_RATING) {
                reasons.add(new BuyBoxReason(ReasonFactor.SELLER_RATING, "GOOD",
                        String.format(Locale.US, "Good seller rating (%.0f%%)", rating)));
            }
        }
        
        // Feedback volume
        Integer feedbackCount = winner.getSellerFeedbackCount();
        if (feedbackCount != null) {
            if (feedbackCount >= HIGH_FEEDBACK_COUNT) {
                reasons.add(new BuyBoxReason(ReasonFactor.FEEDBACK_VOLUME, "HIGH",
                        String.format(Locale.US, "High feedback volume (%,d ratings)", feedbackCount)));
            } else if (feedbackCount >= STRONG_FEEDBACK_COUNT) {
                reasons.add(new BuyBoxReason(ReasonFactor.FEEDBACK_VOLUME, "STRONG",
                        String.format(Locale.US, "Strong feedback volume (%,d ratings)", feedbackCount)));
            }
        }
        
        if (winner.isInStock()) {
            reasons.add(new BuyBoxReason(ReasonFactor.AVAILABILITY, null, "In stock and ready to ship"));
        }
        
        Integer shippingHours = winner.getShippingHours();
        if (shippingHours != null && shippingHours <= FAST_SHIPPING_HOURS) {
            reasons.add(new BuyBoxReason(ReasonFactor.SHIPPING_SPEED, null,
                    "Fast shipping (" + shippingHours + "h max)"));
        }
        
        return reasons;
    }
    
    private static String formatMoney(String currencyCode, BigDecimal amount) {
        return currencyCode + " " + amount.setScale(2, RoundingMode.HALF_UP).toPlainString();
    }
}
