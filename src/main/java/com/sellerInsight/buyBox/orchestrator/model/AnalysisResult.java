package com.sellerInsight.buyBox.orchestrator.model;

import com.sellerInsight.buyBox.buybox.model.BuyBoxReason;
import com.sellerInsight.buyBox.buybox.model.WinnerSource;
import com.sellerInsight.buyBox.offer.model.Offer;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Analysis outcome for one product identifier. Immutable.
 * 
 * Exactly one of these exists per requested identifier, success or failure.
 */
@Value
@Builder
public class AnalysisResult {
    
    @NonNull
    String productId;
    
    /**
     * Catalog title, null when the lookup failed.
     */
    String productName;
    
    /**
     * Winning offer, null when there are no offers or the lookup failed.
     */
    Offer winningOffer;
    
    WinnerSource winnerSource;
    
    int totalOfferCount;
    
    @NonNull
    @Builder.Default
    List<BuyBoxReason> reasons = List.of();
    
    /**
     * Number of unusable offer entries, reported only when they left the offer set empty.
     */
    Integer discardedOfferCount;
    
    /**
     * Null on success.
     */
    AnalysisFailure failure;
    
    @NonNull
    Instant analyzedAt;
    
    public boolean isSuccess() {
        return failure == null;
    }
    
    public boolean hasWinner() {
        return winningOffer != null;
    }
    
    public static AnalysisResult failed(String productId, AnalysisFailure failure) {
        return AnalysisResult.builder()
                .productId(productId)
                .failure(failure)
                .analyzedAt(Instant.now())
                .build();
    }
}
