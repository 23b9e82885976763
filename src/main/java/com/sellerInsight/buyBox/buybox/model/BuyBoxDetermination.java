package com.sellerInsight.buyBox.buybox.model;

import com.sellerInsight.buyBox.offer.model.Offer;

import java.util.List;

/**
 * Outcome of Buy Box determination for one product's offer set.
 * 
 * @param winner Winning offer, null for an empty offer set
 * @param winnerSource How the winner was chosen, null when there is no winner
 * @param reasons Ordered explanation, empty when there is no winner
 */
public record BuyBoxDetermination(Offer winner, WinnerSource winnerSource, List<BuyBoxReason> reasons) {
    
    public BuyBoxDetermination {
        reasons = List.copyOf(reasons);
    }
    
    public static BuyBoxDetermination noWinner() {
        return new BuyBoxDetermination(null, null, List.of());
    }
    
    public boolean hasWinner() {
        return winner != null;
    }
}
