package com.sellerInsight.buyBox.marketplace.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;

/**
 * Retry settings for one API category, bound from {@code buybox.retry.*}.
 * 
 * Delay before retry n (1-based) is initialDelay * multiplier^(n-1), capped at
 * maxDelay, randomized by +/- jitterRatio, raised to the server's Retry-After
 * hint when that is longer. The final pause never exceeds maxDelay.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RetryPolicy {
    
    /**
     * Total attempts including the first one.
     */
    @Min(1)
    @Builder.Default
    private int maxAttempts = 3;
    
    @NotNull
    @Builder.Default
    private Duration initialDelay = Duration.ofSeconds(1);
    
    @DecimalMin("1.0")
    @Builder.Default
    private double multiplier = 2.0d;
    
    @NotNull
    @Builder.Default
    private Duration maxDelay = Duration.ofSeconds(10);
    
    @DecimalMin("0.0")
    @DecimalMax(value = "1.0", inclusive = false)
    @Builder.Default
    private double jitterRatio = 0.2d;
}
