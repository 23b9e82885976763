package com.sellerInsight.buyBox.marketplace.config;

import com.sellerInsight.buyBox.marketplace.exception.TransientApiException;
import io.github.resilience4j.core.IntervalBiFunction;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.RetryConfig;

import java.time.Duration;

/**
 * Builds Resilience4j retry configurations from {@link RetryPolicy} settings.
 * 
 * Only {@link TransientApiException} is retried; every other exception
 * surfaces on the first attempt.
 */
public final class RetryConfigFactory {
    
    private RetryConfigFactory() {
    }
    
    public static RetryConfig fromPolicy(RetryPolicy policy) {
        return RetryConfig.custom()
                .maxAttempts(policy.getMaxAttempts())
                .retryExceptions(TransientApiException.class)
                .intervalBiFunction(backoff(policy))
                .build();
    }
    
    /**
     * Exponential random backoff, stretched to the server's Retry-After hint when
     * that is longer, never above maxDelay.
     * 
     * @param policy Retry settings
     * @return Interval in milliseconds for a 1-based attempt number and its outcome
     */
    public static IntervalBiFunction<Object> backoff(RetryPolicy policy) {
        IntervalFunction exponential = IntervalFunction.ofExponentialRandomBackoff(
                policy.getInitialDelay(), policy.getMultiplier(), policy.getJitterRatio(), policy.getMaxDelay());
        long maxMs = policy.getMaxDelay().toMillis();
        
        return (attempt, outcome) -> {
            long delayMs = exponential.apply(attempt);
            if (outcome != null && outcome.isLeft() && outcome.getLeft() instanceof TransientApiException) {
                Duration retryAfter = ((TransientApiException) outcome.getLeft()).getRetryAfter();
                if (retryAfter != null && !retryAfter.isNegative()) {
                    delayMs = Math.max(delayMs, retryAfter.toMillis());
                }
            }
            return Math.min(delayMs, maxMs);
        };
    }
}
