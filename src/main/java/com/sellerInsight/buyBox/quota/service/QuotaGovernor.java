package com.sellerInsight.buyBox.quota.service;

import com.sellerInsight.buyBox.quota.config.QuotaProperties;
import com.sellerInsight.buyBox.quota.model.QuotaCategory;
import com.sellerInsight.buyBox.util.Sleeper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.function.LongSupplier;

/**
 * Per-category rate limiter for outbound marketplace API calls.
 * 
 * Each quota category owns an independent token bucket, so a saturated
 * pricing quota never delays catalog lookups and vice versa.
 * Safe for concurrent callers.
 */
@Slf4j
@Service
public class QuotaGovernor {
    
    private final Map<QuotaCategory, TokenBucket> buckets = new EnumMap<>(QuotaCategory.class);
    
    @Autowired
    public QuotaGovernor(QuotaProperties properties) {
        this(properties, System::nanoTime, Sleeper.SYSTEM);
    }
    
    public QuotaGovernor(QuotaProperties properties, LongSupplier nanoClock, Sleeper sleeper) {
        for (QuotaCategory category : QuotaCategory.values()) {
            QuotaProperties.Bucket settings = properties.forCategory(category);
            buckets.put(category, new TokenBucket(
                    category.name(), settings.getRefillPerSecond(), settings.getBurst(), nanoClock, sleeper));
            log.info("Quota bucket configured - category: {}, refillPerSecond: {}, burst: {}", 
                    category, settings.getRefillPerSecond(), settings.getBurst());
        }
    }
    
    /**
     * Blocks the calling thread until a token for the category is available, then consumes it.
     * There is no timeout; interrupt the thread to abandon the wait.
     * 
     * @param category Quota category of the upcoming call
     * @throws InterruptedException if interrupted while waiting for a token
     */
    public void acquire(QuotaCategory category) throws InterruptedException {
        Duration waited = bucket(category).acquire();
        if (!waited.isZero()) {
            log.debug("Quota wait - category: {}, waitedMs: {}", category, waited.toMillis());
        }
    }
    
    public double availableTokens(QuotaCategory category) {
        return bucket(category).availableTokens();
    }
    
    private TokenBucket bucket(QuotaCategory category) {
        TokenBucket bucket = buckets.get(category);
        if (bucket == null) {
            throw new IllegalArgumentException("Unknown quota category: " + category);
        }
        return bucket;
    }
}
