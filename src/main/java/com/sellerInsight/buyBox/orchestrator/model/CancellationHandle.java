package com.sellerInsight.buyBox.orchestrator.model;

import com.sellerInsight.buyBox.marketplace.exception.OperationCancelledException;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Run-level cancellation signal shared between the caller and the batch orchestrator.
 */
@Slf4j
public class CancellationHandle {
    
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();
    
    /**
     * Requests cancellation. Idempotent; listeners run once, on the calling thread.
     */
    public void cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return;
        }
        log.info("Cancellation requested - listeners: {}", listeners.size());
        for (Runnable listener : listeners) {
            try {
                listener.run();
            } catch (RuntimeException e) {
                log.warn("Cancellation listener failed", e);
            }
        }
    }
    
    public boolean isCancelled() {
        return cancelled.get();
    }
    
    /**
     * Registers a listener; runs it immediately if cancellation already happened.
     * Listeners must be idempotent: a registration racing with cancel() may run twice.
     */
    public void onCancel(Runnable listener) {
        listeners.add(listener);
        if (isCancelled() && listeners.remove(listener)) {
            listener.run();
        }
    }
    
    public void removeListener(Runnable listener) {
        listeners.remove(listener);
    }
    
    /**
     * @throws OperationCancelledException if cancellation was requested
     */
    public void throwIfCancelled(String productId) {
        if (isCancelled()) {
            throw new OperationCancelledException("Run cancelled - productId: " + productId);
        }
    }
}
