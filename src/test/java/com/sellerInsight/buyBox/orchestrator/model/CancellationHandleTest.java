package com.sellerInsight.buyBox.orchestrator.model;

import com.sellerInsight.buyBox.marketplace.exception.OperationCancelledException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CancellationHandleTest {
    
    @Test
    @DisplayName("cancel runs listeners once, however often it is called")
    void cancelIsIdempotent() {
        CancellationHandle handle = new CancellationHandle();
        AtomicInteger calls = new AtomicInteger();
        handle.onCancel(calls::incrementAndGet);
        
        handle.cancel();
        handle.cancel();
        
        assertThat(handle.isCancelled()).isTrue();
        assertThat(calls.get()).isEqualTo(1);
    }
    
    @Test
    @DisplayName("A listener registered after cancellation runs immediately")
    void lateListenerRunsImmediately() {
        CancellationHandle handle = new CancellationHandle();
        handle.cancel();
        AtomicInteger calls = new AtomicInteger();
        
        handle.onCancel(calls::incrementAndGet);
        
        assertThat(calls.get()).isEqualTo(1);
    }
    
    @Test
    @DisplayName("Removed listeners are not notified")
    void removedListenerSkipped() {
        CancellationHandle handle = new CancellationHandle();
        AtomicInteger calls = new AtomicInteger();
        Runnable listener = calls::incrementAndGet;
        handle.onCancel(listener);
        handle.removeListener(listener);
        
        handle.cancel();
        
        assertThat(calls.get()).isZero();
    }
    
    @Test
    @DisplayName("A failing listener does not stop the others")
    void failingListenerIsolated() {
        CancellationHandle handle = new CancellationHandle();
        AtomicInteger calls = new AtomicInteger();
        handle.onCancel(() -> {
            throw new IllegalStateException("listener broke");
        });
        handle.onCancel(calls::incrementAndGet);
        
        handle.cancel();
        
        assertThat(calls.get()).isEqualTo(1);
    }
    
    @Test
    @DisplayName("throwIfCancelled only throws after cancel")
    void throwIfCancelled() {
        CancellationHandle handle = new CancellationHandle();
        handle.throwIfCancelled("B0A");
        
        handle.cancel();
        
        assertThatThrownBy(() -> handle.throwIfCancelled("B0A"))
                .isInstanceOf(OperationCancelledException.class)
                .hasMessageContaining("B0A");
    }
}
