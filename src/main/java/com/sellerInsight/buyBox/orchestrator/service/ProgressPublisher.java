package com.sellerInsight.buyBox.orchestrator.service;

import com.sellerInsight.buyBox.orchestrator.model.AnalysisResult;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Buffered, ordered delivery of progress notifications for one batch run.
 *
 * Workers only enqueue; a single dispatcher thread calls the observer, so a slow
 * or failing observer never stalls the pipeline. Observer exceptions are logged.
 */
@Slf4j
class ProgressPublisher implements AutoCloseable {
    
    private final ProgressObserver observer;
    private final ExecutorService dispatcher;
    private final int totalCount;
    private final String runId;
    private final Duration drainTimeout;
    private int completedCount;
    
    ProgressPublisher(ProgressObserver observer, int totalCount, String runId, Duration drainTimeout) {
        this.observer = observer;
        this.totalCount = totalCount;
        this.runId = runId;
        this.drainTimeout = drainTimeout;
        this.dispatcher = observer == null ? null : Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "buybox-progress-" + runId);
            thread.setDaemon(true);
            return thread;
        });
    }
    
    /**
     * Records one finished product and queues the notification.
     * Synchronized so queued counts are strictly increasing.
     */
    synchronized void completed(AnalysisResult result) {
        completedCount++;
        if (dispatcher == null) {
            return;
        }
        int completed = completedCount;
        dispatcher.execute(() -> notifyObserver(completed, result));
    }
    
    private void notifyObserver(int completed, AnalysisResult result) {
        try {
            observer.onProgress(completed, totalCount, result);
        } catch (RuntimeException e) {
            log.warn("Progress observer failed - runId: {}, completed: {}/{}, error: {}",
                    runId, completed, totalCount, e.getMessage(), e);
        }
    }
    
    /**
     * Lets queued notifications drain, bounded by the drain timeout.
     */
    @Override
    public void close() {
        if (dispatcher == null) {
            return;
        }
        dispatcher.shutdown();
        try {
            if (!dispatcher.awaitTermination(drainTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Progress notifications not drained in time - runId: {}, timeoutMs: {}",
                        runId, drainTimeout.toMillis());
                dispatcher.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            dispatcher.shutdownNow();
        }
    }
}
