package com.sellerInsight.buyBox.orchestrator.service;

import com.sellerInsight.buyBox.marketplace.exception.InvalidCredentialsException;
import com.sellerInsight.buyBox.marketplace.service.AccessTokenProvider;
import com.sellerInsight.buyBox.marketplace.service.ResilientMarketplaceClient;
import com.sellerInsight.buyBox.orchestrator.model.AnalysisResult;
import com.sellerInsight.buyBox.orchestrator.model.BatchSummary;
import com.sellerInsight.buyBox.orchestrator.model.CancellationHandle;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;

/**
 * Entry point for Buy Box analysis runs.
 *
 * Validates run preconditions, delegates to the batch orchestrator and hands the
 * ordered results to the report writer. Only precondition failures abort a run;
 * per-identifier failures are carried inside the results.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BuyBoxAnalysisService {
    
    private final BuyBoxBatchOrchestrator batchOrchestrator;
    private final AccessTokenProvider accessTokenProvider;
    private final ResilientMarketplaceClient marketplaceClient;
    
    /**
     * Analyzes the identifiers and returns one result per identifier, in input order.
     *
     * @param productIds Ordered identifiers; duplicates are analyzed independently
     * @param cancellation Optional cancellation handle
     * @return Ordered results
     * @throws IllegalArgumentException if productIds is null, empty or contains null
     * @throws InvalidCredentialsException if the credential provider cannot authorize lookups
     */
    public List<AnalysisResult> analyze(List<String> productIds, CancellationHandle cancellation) {
        return analyze(productIds, cancellation, null);
    }
    
    public List<AnalysisResult> analyze(List<String> productIds, CancellationHandle cancellation, ProgressObserver observer) {
        return analyze(UUID.randomUUID().toString(), productIds, cancellation, observer);
    }
    
    /**
     * Runs a complete analysis: validate, analyze, write the report, summarize.
     *
     * @param productIds Ordered identifiers
     * @param cancellation Optional cancellation handle
     * @param observer Optional progress observer
     * @param reportWriter Optional report writer receiving the ordered results
     * @return Summary with counts and ordered results
     */
    public BatchSummary run(List<String> productIds, CancellationHandle cancellation,
                            ProgressObserver observer, AnalysisReportWriter reportWriter) {
        String runId = UUID.randomUUID().toString();
        log.info("Starting Buy Box analysis - runId: {}, identifiers: {}", runId,
                productIds != null ? productIds.size() : 0);
        
        List<AnalysisResult> results = analyze(runId, productIds, cancellation, observer);
        
        boolean reportWritten = false;
        if (reportWriter != null) {
            try {
                reportWriter.write(results);
                reportWritten = true;
            } catch (RuntimeException e) {
                log.error("Failed to write Buy Box report - runId: {}", runId, e);
                throw e;
            }
        }
        
        BatchSummary summary = BatchSummary.of(runId, results, reportWritten);
        log.info("Analysis complete - runId: {}, total: {}, successful: {}, failed: {}, failuresByKind: {}",
                runId, summary.getTotalCount(), summary.getSuccessCount(), summary.getFailureCount(),
                summary.getFailuresByKind());
        return summary;
    }
    
    /**
     * Checks that the configured credentials can reach the marketplace.
     */
    public boolean verifyConnection() {
        if (!accessTokenProvider.isValid()) {
            log.error("No SP-API credentials configured");
            return false;
        }
        return marketplaceClient.verifyConnection();
    }
    
    private List<AnalysisResult> analyze(String runId, List<String> productIds,
                                         CancellationHandle cancellation, ProgressObserver observer) {
        validateIdentifiers(productIds);
        validateCredentials();
        return batchOrchestrator.analyze(runId, productIds, cancellation, observer);
    }
    
    private static void validateIdentifiers(List<String> productIds) {
        if (productIds == null || productIds.isEmpty()) {
            throw new IllegalArgumentException("No product identifiers provided");
        }
        if (productIds.stream().anyMatch(id -> id == null)) {
            throw new IllegalArgumentException("Product identifiers must not contain null");
        }
    }
    
    private void validateCredentials() {
        if (!accessTokenProvider.isValid()) {
            log.error("Rejecting run - SP-API credential provider is not valid");
            throw new InvalidCredentialsException("SP-API credentials are not configured or invalid");
        }
    }
}
