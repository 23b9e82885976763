package com.sellerInsight.buyBox.util;

import java.time.Duration;

/**
 * Blocking pause used by the quota buckets.
 * Swapped for a recording or no-op implementation in tests.
 */
@FunctionalInterface
public interface Sleeper {
    
    Sleeper SYSTEM = duration -> {
        long nanos = duration.toNanos();
        if (nanos > 0) {
            Thread.sleep(nanos / 1_000_000L, (int) (nanos % 1_000_000L));
        }
    };
    
    void sleep(Duration duration) throws InterruptedException;
}
