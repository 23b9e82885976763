package com.sellerInsight.buyBox.orchestrator.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Classified failure attached to an {@link AnalysisResult}.
 */
@Value
@Builder
public class AnalysisFailure {
    
    @NonNull
    FailureKind kind;
    
    String message;
    
    /**
     * HTTP status of the last failed call, null if none applies.
     */
    Integer httpStatus;
    
    /**
     * Number of attempts made before giving up, null if not applicable.
     */
    Integer attempts;
    
    public static AnalysisFailure cancelled() {
        return AnalysisFailure.builder()
                .kind(FailureKind.CANCELLED)
                .message("Run cancelled before this product was analyzed")
                .build();
    }
}
