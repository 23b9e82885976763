package com.sellerInsight.buyBox.orchestrator.service;

import com.sellerInsight.buyBox.orchestrator.model.AnalysisResult;

/**
 * Receives a notification after each product identifier completes.
 * Invoked from a dedicated dispatcher thread, never from a worker.
 */
@FunctionalInterface
public interface ProgressObserver {
    
    void onProgress(int completedCount, int totalCount, AnalysisResult latestResult);
}
