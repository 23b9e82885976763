package com.sellerInsight.buyBox.offer.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.sellerInsight.buyBox.offer.model.NormalizedOffers;
import com.sellerInsight.buyBox.offer.model.Offer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Service for normalizing raw getItemOffers payloads into {@link Offer} records.
 *
 * Maps the SP-API offer format:
 * - SellerId -> sellerId
 * - ListingPrice.Amount / CurrencyCode -> listingPrice / currencyCode
 * - Shipping.Amount -> shippingPrice (missing means free shipping)
 * - IsFulfilledByAmazon -> fulfilledByPlatform
 * - PrimeInformation.IsPrime -> primeEligible
 * - SellerFeedbackRating.SellerPositiveFeedbackRating / FeedbackCount -> rating / count (missing stays null)
 * - ShippingTime.maximumHours -> shippingHours (missing or zero stays null)
 * - ShippingTime.availabilityType == NOW -> inStock
 * - IsBuyBoxWinner -> featuredOffer
 *
 * Entries without a usable seller id or price are discarded and counted.
 */
@Slf4j
@Service
public class OfferNormalizer {
    
    static final String AVAILABLE_NOW = "NOW";
    static final String DEFAULT_CURRENCY = "USD";
    
    /**
     * Normalizes the offers of one product.
     *
     * @param productId ASIN, for logging
     * @param payload The getItemOffers {@code payload} object
     * @return Normalized offers and discard count
     */
    public NormalizedOffers normalize(String productId, JsonNode payload) {
        if (payload == null) {
            log.warn("No offer payload to normalize - productId: {}", productId);
            return new NormalizedOffers(List.of(), 0);
        }
        
        JsonNode rawOffers = payload.path("Offers");
        if (!rawOffers.isArray()) {
            log.debug("Payload has no Offers array - productId: {}", productId);
            return new NormalizedOffers(List.of(), 0);
        }
        
        List<Offer> offers = new ArrayList<>();
        Set<String> seenSellers = new HashSet<>();
        int discarded = 0;
        
        for (JsonNode rawOffer : rawOffers) {
            Offer offer = normalizeOffer(productId, rawOffer);
            if (offer == null) {
                discarded++;
                continue;
            }
            if (!seenSellers.add(offer.getSellerId())) {
                log.warn("Discarding duplicate seller offer - productId: {}, sellerId: {}", productId, offer.getSellerId());
                discarded++;
                continue;
            }
            offers.add(offer);
        }
        
        if (discarded > 0) {
            log.info("Normalization discarded entries - productId: {}, kept: {}, discarded: {}",
                    productId, offers.size(), discarded);
        } else {
            log.debug("Normalization completed - productId: {}, offers: {}", productId, offers.size());
        }
        
        return new NormalizedOffers(offers, discarded);
    }
    
    /**
     * Normalizes a single raw offer entry.
     *
     * @return The offer, or null if the entry is unusable
     */
    private Offer normalizeOffer(String productId, JsonNode rawOffer) {
        if (rawOffer == null || !rawOffer.isObject()) {
            log.warn("Discarding non-object offer entry - productId: {}", productId);
            return null;
        }
        
        String sellerId = rawOffer.path("SellerId").asText("").trim();
        if (sellerId.isEmpty()) {
            log.warn("Discarding offer without seller id - productId: {}", productId);
            return null;
        }
        
        JsonNode listingPriceNode = rawOffer.path("ListingPrice");
        BigDecimal listingPrice = parseAmount(listingPriceNode.path("Amount"));
        if (listingPrice == null) {
            log.warn("Discarding offer with missing or malformed listing price - productId: {}, sellerId: {}",
                    productId, sellerId);
            return null;
        }
        
        JsonNode shippingAmount = rawOffer.path("Shipping").path("Amount");
        BigDecimal shippingPrice = BigDecimal.ZERO;
        if (!shippingAmount.isMissingNode() && !shippingAmount.isNull()) {
            shippingPrice = parseAmount(shippingAmount);
            if (shippingPrice == null) {
                log.warn("Discarding offer with malformed shipping price - productId: {}, sellerId: {}",
                        productId, sellerId);
                return null;
            }
        }
        
        String currencyCode = listingPriceNode.path("CurrencyCode").asText("");
        
        JsonNode feedback = rawOffer.path("SellerFeedbackRating");
        JsonNode shippingTime = rawOffer.path("ShippingTime");
        
        return Offer.builder()
                .sellerId(sellerId)
                .listingPrice(listingPrice)
                .shippingPrice(shippingPrice)
                .currencyCode(currencyCode.isBlank() ? DEFAULT_CURRENCY : currencyCode)
                .fulfilledByPlatform(rawOffer.path("IsFulfilledByAmazon").asBoolean(false))
                .primeEligible(rawOffer.path("PrimeInformation").path("IsPrime").asBoolean(false))
                .sellerFeedbackRating(parseRating(feedback.path("SellerPositiveFeedbackRating")))
                .sellerFeedbackCount(parseCount(feedback.path("FeedbackCount")))
                .inStock(AVAILABLE_NOW.equalsIgnoreCase(shippingTime.path("availabilityType").asText("")))
                .shippingHours(parseShippingHours(shippingTime.path("maximumHours")))
                .featuredOffer(rawOffer.path("IsBuyBoxWinner").asBoolean(false))
                .build();
    }
    
    /**
     * Parses a non-negative currency amount given as a JSON number or numeric string.
     */
    private static BigDecimal parseAmount(JsonNode node) {
        BigDecimal amount = null;
        if (node.isNumber()) {
            amount = node.decimalValue();
        } else if (node.isTextual()) {
            try {
                amount = new BigDecimal(node.asText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        if (amount == null || amount.signum() < 0) {
            return null;
        }
        return amount;
    }
    
    private static Double parseRating(JsonNode node) {
        if (!node.isNumber()) {
            return null;
        }
        double rating = node.asDouble();
        return (rating >= 0d && rating <= 100d) ? rating : null;
    }
    
    private static Integer parseCount(JsonNode node) {
        if (!node.canConvertToInt()) {
            return null;
        }
        int count = node.asInt();
        return count >= 0 ? count : null;
    }
    
    private static Integer parseShippingHours(JsonNode node) {
        if (!node.canConvertToInt()) {
            return null;
        }
        int hours = node.asInt();
        return hours > 0 ? hours : null;
    }
}
