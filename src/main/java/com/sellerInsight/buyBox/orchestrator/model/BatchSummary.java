package com.sellerInsight.buyBox.orchestrator.model;

import lombok.Builder;
import lombok.Value;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Totals for one batch run plus the ordered results.
 */
@Value
@Builder
public class BatchSummary {
    
    String runId;
    
    int totalCount;
    
    int successCount;
    
    int failureCount;
    
    Map<FailureKind, Integer> failuresByKind;
    
    List<AnalysisResult> results;
    
    boolean reportWritten;
    
    public static BatchSummary of(String runId, List<AnalysisResult> results, boolean reportWritten) {
        Map<FailureKind, Integer> byKind = new EnumMap<>(FailureKind.class);
        int success = 0;
        for (AnalysisResult result : results) {
            if (result.isSuccess()) {
                success++;
            } else {
                byKind.merge(result.getFailure().getKind(), 1, Integer::sum);
            }
        }
        return BatchSummary.builder()
                .runId(runId)
                .totalCount(results.size())
                .successCount(success)
                .failureCount(results.size() - success)
                .failuresByKind(Map.copyOf(byKind))
                .results(List.copyOf(results))
                .reportWritten(reportWritten)
                .build();
    }
}
