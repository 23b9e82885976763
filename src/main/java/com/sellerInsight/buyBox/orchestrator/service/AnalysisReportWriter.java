package com.sellerInsight.buyBox.orchestrator.service;

import com.sellerInsight.buyBox.orchestrator.model.AnalysisResult;

import java.util.List;

/**
 * Renders the final ordered results (spreadsheet, file, ...). Implemented outside this application.
 */
@FunctionalInterface
public interface AnalysisReportWriter {
    
    void write(List<AnalysisResult> results);
}
