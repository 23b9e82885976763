package com.sellerInsight.buyBox.quota.config;

import com.sellerInsight.buyBox.quota.model.QuotaCategory;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Token bucket settings per quota category.
 * 
 * Defaults mirror the Selling Partner API usage plans:
 * - Catalog Items: 2 requests/second, burst 2
 * - Product Pricing (getItemOffers): 0.5 requests/second, burst 1
 */
@Data
@Validated
@ConfigurationProperties(prefix = "buybox.quota")
public class QuotaProperties {
    
    @Valid
    @NotNull
    private Bucket catalog = new Bucket(2.0d, 2);
    
    @Valid
    @NotNull
    private Bucket pricing = new Bucket(0.5d, 1);
    
    public Bucket forCategory(QuotaCategory category) {
        return switch (category) {
            case CATALOG -> catalog;
            case PRICING -> pricing;
        };
    }
    
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Bucket {
        
        /**
         * Steady refill rate in tokens per second.
         */
        @Positive
        private double refillPerSecond = 1.0d;
        
        /**
         * Maximum number of tokens the bucket can hold.
         */
        @Min(1)
        private int burst = 1;
    }
}
