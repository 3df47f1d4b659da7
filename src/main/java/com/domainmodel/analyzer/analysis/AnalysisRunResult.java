package com.domainmodel.analyzer.analysis;

import java.nio.file.Path;

import com.domainmodel.analyzer.diagnostics.AnalysisReport;
import com.domainmodel.analyzer.result.AnalysisDocument;
import com.domainmodel.analyzer.result.AnalysisStatistics;

import lombok.Builder;
import lombok.Data;

/**
 * Result of one analysis run.
 */
@Data
@Builder
public class AnalysisRunResult {
    private boolean success;
    private String errorMessage;

    private AnalysisDocument document;
    private AnalysisReport report;
    private AnalysisStatistics statistics;
    private Path outputPath;

    private int classesAnalyzed;
    private int classesSkipped;
    private int methodsClassified;
    private int aggregateRoots;
    private int repositories;
    private int callEdges;
    private int repositoryCallSites;
    private int cycles;

    public static AnalysisRunResult failure(String errorMessage, AnalysisReport report) {
        return AnalysisRunResult.builder()
                .success(false)
                .errorMessage(errorMessage)
                .report(report)
                .build();
    }
}
