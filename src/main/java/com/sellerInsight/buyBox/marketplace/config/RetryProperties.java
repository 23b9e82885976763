package com.sellerInsight.buyBox.marketplace.config;

import com.sellerInsight.buyBox.quota.model.QuotaCategory;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Retry policies per API category.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "buybox.retry")
public class RetryProperties {
    
    @Valid
    @NotNull
    private RetryPolicy catalog = RetryPolicy.builder()
            .initialDelay(Duration.ofSeconds(1))
            .maxDelay(Duration.ofSeconds(5))
            .build();
    
    @Valid
    @NotNull
    private RetryPolicy pricing = RetryPolicy.builder()
            .initialDelay(Duration.ofSeconds(2))
            .maxDelay(Duration.ofSeconds(10))
            .build();
    
    public RetryPolicy forCategory(QuotaCategory category) {
        return switch (category) {
            case CATALOG -> catalog;
            case PRICING -> pricing;
        };
    }
}
