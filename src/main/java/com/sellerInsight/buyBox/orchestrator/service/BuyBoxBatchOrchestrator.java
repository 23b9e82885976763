package com.sellerInsight.buyBox.orchestrator.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.sellerInsight.buyBox.buybox.model.BuyBoxDetermination;
import com.sellerInsight.buyBox.buybox.service.BuyBoxDeterminationEngine;
import com.sellerInsight.buyBox.marketplace.exception.MarketplaceApiException;
import com.sellerInsight.buyBox.marketplace.exception.OperationCancelledException;
import com.sellerInsight.buyBox.marketplace.exception.PermanentApiException;
import com.sellerInsight.buyBox.marketplace.exception.RetriesExhaustedException;
import com.sellerInsight.buyBox.marketplace.service.ResilientMarketplaceClient;
import com.sellerInsight.buyBox.offer.model.NormalizedOffers;
import com.sellerInsight.buyBox.offer.service.OfferNormalizer;
import com.sellerInsight.buyBox.orchestrator.model.AnalysisFailure;
import com.sellerInsight.buyBox.orchestrator.model.AnalysisResult;
import com.sellerInsight.buyBox.orchestrator.model.CancellationHandle;
import com.sellerInsight.buyBox.orchestrator.model.FailureKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReferenceArray;

/**
 * Batch orchestrator - drives Buy Box analysis across a list of product identifiers.
 *
 * Responsibilities:
 * - Run FETCH_NAME -> FETCH_OFFERS -> NORMALIZE -> DETERMINE per identifier
 * - Convert every per-identifier failure into a failure-carrying result
 * - Keep output order equal to input order regardless of worker concurrency
 * - Honour run cancellation: interrupt in-flight work, record unstarted identifiers as cancelled
 * - Report progress after each identifier without blocking workers
 *
 * The quota buckets are the only state shared between identifiers.
 */
@Slf4j
@Service
public class BuyBoxBatchOrchestrator {
    
    private static final Duration PROGRESS_DRAIN_TIMEOUT = Duration.ofSeconds(5);
    
    private final ResilientMarketplaceClient marketplaceClient;
    private final OfferNormalizer offerNormalizer;
    private final BuyBoxDeterminationEngine determinationEngine;
    private final int workerCount;
    
    public BuyBoxBatchOrchestrator(
            ResilientMarketplaceClient marketplaceClient,
            OfferNormalizer offerNormalizer,
            BuyBoxDeterminationEngine determinationEngine,
            @Value("${buybox.batch.worker-count:2}") int workerCount) {
        this.marketplaceClient = marketplaceClient;
        this.offerNormalizer = offerNormalizer;
        this.determinationEngine = determinationEngine;
        this.workerCount = Math.max(1, workerCount);
    }
    
    /**
     * Analyzes every identifier and returns one result per identifier, in input order.
     * Duplicates are processed independently. Never throws for per-identifier failures.
     *
     * @param productIds Ordered identifiers
     * @param cancellation Optional run-level cancellation handle
     * @param observer Optional progress observer
     * @return Results in the same order as productIds
     */
    public List<AnalysisResult> analyze(List<String> productIds, CancellationHandle cancellation, ProgressObserver observer) {
        return analyze(UUID.randomUUID().toString(), productIds, cancellation, observer);
    }
    
    /**
     * Same as {@link #analyze(List, CancellationHandle, ProgressObserver)} under a caller-chosen run id.
     */
    public List<AnalysisResult> analyze(String runId, List<String> productIds,
                                        CancellationHandle cancellation, ProgressObserver observer) {
        int total = productIds.size();
        if (total == 0) {
            return List.of();
        }
        
        CancellationHandle handle = cancellation != null ? cancellation : new CancellationHandle();
        AtomicReferenceArray<AnalysisResult> slots = new AtomicReferenceArray<>(total);
        int poolSize = Math.min(workerCount, total);
        
        log.info("Starting Buy Box batch - runId: {}, identifiers: {}, workers: {}", runId, total, poolSize);
        
        AtomicInteger threadCounter = new AtomicInteger();
        ExecutorService workers = Executors.newFixedThreadPool(poolSize, runnable ->
                new Thread(runnable, "buybox-worker-" + threadCounter.incrementAndGet()));
        Runnable interruptWorkers = workers::shutdownNow;
        handle.onCancel(interruptWorkers);
        
        try (ProgressPublisher publisher = new ProgressPublisher(observer, total, runId, PROGRESS_DRAIN_TIMEOUT)) {
            for (int i = 0; i < total; i++) {
                int index = i;
                String productId = productIds.get(i);
                try {
                    workers.execute(() -> {
                        AnalysisResult result = handle.isCancelled()
                                ? AnalysisResult.failed(productId, AnalysisFailure.cancelled())
                                : analyzeOne(productId, handle);
                        slots.set(index, result);
                        publisher.completed(result);
                    });
                } catch (RejectedExecutionException e) {
                    log.info("Batch cancelled during submission - runId: {}, submitted: {}/{}", runId, index, total);
                    break;
                }
            }
            
            workers.shutdown();
            awaitWorkers(workers, handle, runId);
            
            // Identifiers that never ran (queued at cancellation) still get a result
            List<AnalysisResult> results = new ArrayList<>(total);
            for (int i = 0; i < total; i++) {
                AnalysisResult result = slots.get(i);
                if (result == null) {
                    result = AnalysisResult.failed(productIds.get(i), AnalysisFailure.cancelled());
                    publisher.completed(result);
                }
                results.add(result);
            }
            
            long failures = results.stream().filter(r -> !r.isSuccess()).count();
            log.info("Buy Box batch completed - runId: {}, identifiers: {}, successful: {}, failed: {}, cancelled: {}",
                    runId, total, total - failures, failures, handle.isCancelled());
            return results;
        } finally {
            handle.removeListener(interruptWorkers);
            workers.shutdownNow();
        }
    }
    
    /**
     * Runs the pipeline for one identifier. Every failure becomes a result.
     */
    AnalysisResult analyzeOne(String productId, CancellationHandle handle) {
        log.debug("Analyzing product - productId: {}", productId);
        try {
            handle.throwIfCancelled(productId);
            String productName = marketplaceClient.fetchProductName(productId);
            
            handle.throwIfCancelled(productId);
            JsonNode payload = marketplaceClient.fetchOffers(productId);
            
            NormalizedOffers normalized = offerNormalizer.normalize(productId, payload);
            BuyBoxDetermination determination = determinationEngine.determine(normalized.offers());
            
            log.info("Product analyzed - productId: {}, offers: {}, winner: {}, reasons: {}",
                    productId, normalized.offers().size(),
                    determination.hasWinner() ? determination.winner().getSellerId() : "none",
                    determination.reasons().size());
            
            return AnalysisResult.builder()
                    .productId(productId)
                    .productName(productName)
                    .winningOffer(determination.winner())
                    .winnerSource(determination.winnerSource())
                    .totalOfferCount(normalized.offers().size())
                    .reasons(determination.reasons())
                    .discardedOfferCount(normalized.isEmpty() && normalized.discardedCount() > 0
                            ? normalized.discardedCount() : null)
                    .analyzedAt(Instant.now())
                    .build();
        
        } catch (PermanentApiException e) {
            log.warn("Permanent failure - productId: {}, status: {}, error: {}", productId, e.getHttpStatus(), e.getMessage());
            return AnalysisResult.failed(productId, failure(FailureKind.PERMANENT, e, null));
        } catch (RetriesExhaustedException e) {
            log.warn("Retries exhausted - productId: {}, attempts: {}, error: {}", productId, e.getAttempts(), e.getMessage());
            return AnalysisResult.failed(productId, failure(FailureKind.EXHAUSTED_RETRY, e, e.getAttempts()));
        } catch (MarketplaceApiException e) {
            log.error("Unclassified marketplace failure - productId: {}", productId, e);
            return AnalysisResult.failed(productId, failure(FailureKind.UNEXPECTED, e, null));
        } catch (OperationCancelledException e) {
            log.info("Product analysis cancelled - productId: {}", productId);
            return AnalysisResult.failed(productId, AnalysisFailure.builder()
                    .kind(FailureKind.CANCELLED)
                    .message(e.getMessage())
                    .build());
        } catch (RuntimeException e) {
            log.error("Unexpected error analyzing product - productId: {}", productId, e);
            return AnalysisResult.failed(productId, AnalysisFailure.builder()
                    .kind(FailureKind.UNEXPECTED)
                    .message(e.getClass().getSimpleName() + ": " + e.getMessage())
                    .build());
        }
    }
    
    private static AnalysisFailure failure(FailureKind kind, MarketplaceApiException e, Integer attempts) {
        return AnalysisFailure.builder()
                .kind(kind)
                .message(e.getMessage())
                .httpStatus(e.getHttpStatus())
                .attempts(attempts)
                .build();
    }
    
    /**
     * Waits for every worker to finish. An interrupt of the calling thread cancels the run.
     */
    private void awaitWorkers(ExecutorService workers, CancellationHandle handle, String runId) {
        boolean interrupted = false;
        while (true) {
            try {
                if (workers.awaitTermination(1, TimeUnit.SECONDS)) {
                    break;
                }
            } catch (InterruptedException e) {
                log.warn("Batch caller interrupted, cancelling run - runId: {}", runId);
                interrupted = true;
                handle.cancel();
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }
}
