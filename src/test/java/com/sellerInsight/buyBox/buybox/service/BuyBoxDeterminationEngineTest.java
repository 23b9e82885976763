package com.sellerInsight.buyBox.buybox.service;

import com.sellerInsight.buyBox.buybox.model.BuyBoxDetermination;
import com.sellerInsight.buyBox.buybox.model.BuyBoxReason;
import com.sellerInsight.buyBox.buybox.model.ReasonFactor;
import com.sellerInsight.buyBox.buybox.model.WinnerSource;
import com.sellerInsight.buyBox.offer.model.Offer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

class BuyBoxDeterminationEngineTest {
    
    private final BuyBoxDeterminationEngine engine = new BuyBoxDeterminationEngine();
    
    @Test
    @DisplayName("Featured winner with every strength gets all seven reasons in order")
    void allReasons() {
        Offer winner = offer("A", "20.00", "0").toBuilder()
                .featuredOffer(true)
                .fulfilledByPlatform(true)
                .primeEligible(true)
                .sellerFeedbackRating(96d)
                .sellerFeedbackCount(15_000)
                .inStock(true)
                .shippingHours(24)
                .build();
        Offer rival = offer("B", "22.00", "0");
        
        BuyBoxDetermination result = engine.determine(List.of(rival, winner));
        
        assertThat(result.winner()).isSameAs(winner);
        assertThat(result.winnerSource()).isEqualTo(WinnerSource.FEATURED_FLAG);
        assertThat(result.reasons()).extracting(BuyBoxReason::factor).containsExactly(
                ReasonFactor.PRICE, ReasonFactor.FULFILLMENT, ReasonFactor.PRIME, ReasonFactor.SELLER_RATING,
                ReasonFactor.FEEDBACK_VOLUME, ReasonFactor.AVAILABILITY, ReasonFactor.SHIPPING_SPEED);
        assertThat(result.reasons()).extracting(BuyBoxReason::description).containsExactly(
                "Lowest total price (USD 20.00)",
                "Fulfilled by Amazon (FBA)",
                "Prime eligible",
                "Excellent seller rating (96%)",
                "High feedback volume (15,000 ratings)",
                "In stock and ready to ship",
                "Fast shipping (24h max)");
    }
    
    @Test
    @DisplayName("Unflagged strong seller at the lowest price wins by price ranking with every reason")
    void lowestPriceStrongSeller() {
        Offer a = offer("A", "20.00", "0").toBuilder()
                .fulfilledByPlatform(true)
                .primeEligible(true)
                .sellerFeedbackRating(96d)
                .sellerFeedbackCount(15_000)
                .inStock(true)
                .shippingHours(24)
                .build();
        Offer b = offer("B", "20.30", "0").toBuilder()
                .sellerFeedbackRating(80d)
                .sellerFeedbackCount(50)
                .inStock(true)
                .shippingHours(96)
                .build();
        
        BuyBoxDetermination result = engine.determine(List.of(b, a));
        
        assertThat(result.winner().getSellerId()).isEqualTo("A");
        assertThat(result.winnerSource()).isEqualTo(WinnerSource.PRICE_RANKING);
        assertThat(result.reasons()).extracting(BuyBoxReason::factor).containsExactly(
                ReasonFactor.PRICE, ReasonFactor.FULFILLMENT, ReasonFactor.PRIME, ReasonFactor.SELLER_RATING,
                ReasonFactor.FEEDBACK_VOLUME, ReasonFactor.AVAILABILITY, ReasonFactor.SHIPPING_SPEED);
        assertThat(result.reasons()).extracting(BuyBoxReason::tier)
                .containsExactly("LOWEST", null, null, "EXCELLENT", "HIGH", null, null);
    }
    
    @Test
    @DisplayName("A single featured offer wins even when it is not the cheapest")
    void featuredFlagIsAuthoritative() {
        Offer featured = offer("EXPENSIVE", "30.00", "0").toBuilder().featuredOffer(true).build();
        Offer cheap = offer("CHEAP", "10.00", "0");
        
        BuyBoxDetermination result = engine.determine(List.of(cheap, featured));
        
        assertThat(result.winner().getSellerId()).isEqualTo("EXPENSIVE");
        assertThat(result.winnerSource()).isEqualTo(WinnerSource.FEATURED_FLAG);
        assertThat(result.reasons()).extracting(BuyBoxReason::factor).doesNotContain(ReasonFactor.PRICE);
    }
    
    @Test
    @DisplayName("Several featured offers fall back to price ranking")
    void multipleFeaturedFallsBackToPrice() {
        Offer first = offer("F1", "15.00", "0").toBuilder().featuredOffer(true).build();
        Offer second = offer("F2", "12.00", "0").toBuilder().featuredOffer(true).build();
        
        BuyBoxDetermination result = engine.determine(List.of(first, second));
        
        assertThat(result.winner().getSellerId()).isEqualTo("F2");
        assertThat(result.winnerSource()).isEqualTo(WinnerSource.PRICE_RANKING);
    }
    
    @Test
    @DisplayName("Without a featured offer the lowest total price wins, shipping included")
    void lowestTotalPriceWins() {
        Offer lowListing = offer("LOW_LISTING", "9.00", "5.00");
        Offer freeShipping = offer("FREE_SHIP", "12.00", "0");
        
        BuyBoxDetermination result = engine.determine(List.of(lowListing, freeShipping));
        
        assertThat(result.winner().getSellerId()).isEqualTo("FREE_SHIP");
        assertThat(result.reasons().get(0).tier()).isEqualTo("LOWEST");
    }
    
    @Test
    @DisplayName("Price ties prefer in-stock, then platform-fulfilled, then smallest seller id")
    void tieBreaks() {
        Offer outOfStock = offer("A", "10.00", "0").toBuilder().fulfilledByPlatform(true).build();
        Offer inStockMerchant = offer("B", "10.00", "0").toBuilder().inStock(true).build();
        Offer inStockFba = offer("C", "10.00", "0").toBuilder().inStock(true).fulfilledByPlatform(true).build();
        Offer inStockFbaLater = offer("D", "10.00", "0").toBuilder().inStock(true).fulfilledByPlatform(true).build();
        
        assertThat(engine.determine(List.of(outOfStock, inStockMerchant)).winner().getSellerId()).isEqualTo("B");
        assertThat(engine.determine(List.of(outOfStock, inStockMerchant, inStockFba)).winner().getSellerId()).isEqualTo("C");
        assertThat(engine.determine(List.of(inStockFbaLater, inStockFba)).winner().getSellerId()).isEqualTo("C");
    }
    
    @Test
    @DisplayName("Winner does not depend on input order")
    void orderIndependent() {
        List<Offer> offers = new ArrayList<>(List.of(
                offer("S3", "10.00", "0"), offer("S1", "10.00", "0"),
                offer("S2", "10.00", "0"), offer("S4", "11.00", "0")));
        Random random = new Random(42);
        
        for (int i = 0; i < 20; i++) {
            Collections.shuffle(offers, random);
            assertThat(engine.determine(offers).winner().getSellerId()).isEqualTo("S1");
        }
    }
    
    @Test
    @DisplayName("Price-ranked winner always has the minimum total price")
    void priceRankedWinnerIsCheapest() {
        Random random = new Random(7);
        for (int run = 0; run < 50; run++) {
            List<Offer> offers = new ArrayList<>();
            int count = 1 + random.nextInt(8);
            for (int i = 0; i < count; i++) {
                offers.add(offer("S" + i, BigDecimal.valueOf(random.nextInt(5_000), 2).toPlainString(),
                        BigDecimal.valueOf(random.nextInt(800), 2).toPlainString()));
            }
            BigDecimal min = offers.stream().map(Offer::getTotalPrice).min(Comparator.naturalOrder()).orElseThrow();
            
            BuyBoxDetermination result = engine.determine(offers);
            
            assertThat(result.winner().getTotalPrice()).isEqualByComparingTo(min);
            assertThat(result.reasons().get(0).factor()).isEqualTo(ReasonFactor.PRICE);
        }
    }
    
    @Test
    @DisplayName("Featured winner within 2% of the lowest price is competitive, beyond that no price reason")
    void competitivePriceBoundary() {
        Offer cheapest = offer("CHEAP", "20.00", "0");
        Offer withinTwoPercent = offer("W", "20.40", "0").toBuilder().featuredOffer(true).build();
        Offer beyond = offer("W", "20.41", "0").toBuilder().featuredOffer(true).build();
        
        List<BuyBoxReason> competitive = engine.determine(List.of(cheapest, withinTwoPercent)).reasons();
        assertThat(competitive).hasSize(1);
        assertThat(competitive.get(0).tier()).isEqualTo("COMPETITIVE");
        assertThat(competitive.get(0).description()).isEqualTo("Competitive price within 2% of lowest (USD 20.40)");
        
        assertThat(engine.determine(List.of(cheapest, beyond)).reasons()).isEmpty();
    }
    
    @Test
    @DisplayName("Rating, feedback and shipping tiers apply at their thresholds only")
    void tierThresholds() {
        Offer good = offer("G", "10.00", "0").toBuilder()
                .sellerFeedbackRating(92d)
                .sellerFeedbackCount(1_500)
                .shippingHours(48)
                .build();
        assertThat(engine.determine(List.of(good)).reasons()).extracting(BuyBoxReason::description).containsExactly(
                "Lowest total price (USD 10.00)",
                "Good seller rating (92%)",
                "Strong feedback volume (1,500 ratings)",
                "Fast shipping (48h max)");
        
        Offer weak = offer("W", "10.00", "0").toBuilder()
                .sellerFeedbackRating(89.9d)
                .sellerFeedbackCount(999)
                .shippingHours(49)
                .build();
        assertThat(engine.determine(List.of(weak)).reasons()).extracting(BuyBoxReason::factor)
                .containsExactly(ReasonFactor.PRICE);
    }
    
    @Test
    @DisplayName("No offers means no winner and no reasons")
    void emptyOffers() {
        BuyBoxDetermination result = engine.determine(List.of());
        
        assertThat(result.hasWinner()).isFalse();
        assertThat(result.winner()).isNull();
        assertThat(result.reasons()).isEmpty();
    }
    
    private static Offer offer(String sellerId, String listing, String shipping) {
        return Offer.builder()
                .sellerId(sellerId)
                .listingPrice(new BigDecimal(listing))
                .shippingPrice(new BigDecimal(shipping))
                .build();
    }
}
