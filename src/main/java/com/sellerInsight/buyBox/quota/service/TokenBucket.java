package com.sellerInsight.buyBox.quota.service;

import com.sellerInsight.buyBox.util.Sleeper;

import java.time.Duration;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;

/**
 * Continuous-refill token bucket.
 * 
 * Tokens accumulate fractionally from a monotonic clock and are recomputed lazily
 * on every acquire. The lock only guards token accounting; callers wait outside it.
 */
public class TokenBucket {
    
    private static final double NANOS_PER_SECOND = 1_000_000_000d;
    
    private final String name;
    private final double refillPerSecond;
    private final int burst;
    private final LongSupplier nanoClock;
    private final Sleeper sleeper;
    private final ReentrantLock lock = new ReentrantLock();
    
    private double tokens;
    private long lastRefillNanos;
    
    public TokenBucket(String name, double refillPerSecond, int burst, LongSupplier nanoClock, Sleeper sleeper) {
        if (refillPerSecond <= 0) {
            throw new IllegalArgumentException("refillPerSecond must be positive for bucket " + name);
        }
        if (burst < 1) {
            throw new IllegalArgumentException("burst must be at least 1 for bucket " + name);
        }
        this.name = name;
        this.refillPerSecond = refillPerSecond;
        this.burst = burst;
        this.nanoClock = nanoClock;
        this.sleeper = sleeper;
        this.tokens = burst;
        this.lastRefillNanos = nanoClock.getAsLong();
    }
    
    /**
     * Blocks until a token is available and consumes it.
     * 
     * @return Total time spent waiting (zero when a token was immediately available)
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    public Duration acquire() throws InterruptedException {
        long waitedNanos = 0L;
        while (true) {
            long waitNanos;
            lock.lock();
            try {
                refill();
                if (tokens >= 1.0d) {
                    tokens -= 1.0d;
                    return Duration.ofNanos(waitedNanos);
                }
                waitNanos = (long) Math.ceil((1.0d - tokens) / refillPerSecond * NANOS_PER_SECOND);
            } finally {
                lock.unlock();
            }
            sleeper.sleep(Duration.ofNanos(waitNanos));
            waitedNanos += waitNanos;
        }
    }
    
    /**
     * Current token count after refill, for diagnostics.
     */
    public double availableTokens() {
        lock.lock();
        try {
            refill();
            return tokens;
        } finally {
            lock.unlock();
        }
    }
    
    public String getName() {
        return name;
    }
    
    public double getRefillPerSecond() {
        return refillPerSecond;
    }
    
    public int getBurst() {
        return burst;
    }
    
    private void refill() {
        long now = nanoClock.getAsLong();
        long elapsed = now - lastRefillNanos;
        if (elapsed > 0) {
            tokens = Math.min(burst, tokens + elapsed * refillPerSecond / NANOS_PER_SECOND);
            lastRefillNanos = now;
        }
    }
}
