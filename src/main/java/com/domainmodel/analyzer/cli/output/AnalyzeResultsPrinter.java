package com.domainmodel.analyzer.cli.output;

import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.domainmodel.analyzer.analysis.AnalysisRunResult;
import com.domainmodel.analyzer.cli.model.AnalyzeOptions;
import com.domainmodel.analyzer.cli.model.ValidatedAnalyzeOptions;
import com.domainmodel.analyzer.diagnostics.AnalysisIssue;
import com.domainmodel.analyzer.diagnostics.AnalysisReport;
import com.domainmodel.analyzer.result.AnalysisStatistics;
import com.domainmodel.analyzer.util.NamingUtil;

/**
 * Responsible only for printing CLI output for the "analyze" command.
 * No validation, no execution.
 */
public class AnalyzeResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(AnalyzeResultsPrinter.class);

    public void printBanner(AnalyzeOptions o, ValidatedAnalyzeOptions v) {
        log.info("=================================================");
        log.info("Aggregate Field Analyzer");
        log.info("=================================================");
        log.info("Classes Directories: {}", v.getClassDirs());
        log.info("Output File: {}", v.getOutputFile());
        log.info("Aggregate Annotations: {}", o.getAggregateAnnotations());
        if (o.getAggregateRoots() != null && !o.getAggregateRoots().isEmpty()) {
            log.info("Explicit Aggregate Roots: {}", o.getAggregateRoots());
        }
        log.info("Repository Interfaces: {}", o.getRepositoryInterfaces());
        log.info("Repository Annotations: {}", o.getRepositoryAnnotations());
        log.info("Naming Templates: {}", o.getNamingTemplates());
        log.info("Include / Exclude: {} / {}", o.getIncludePackages(), o.getExcludePackages());
        log.info("Max Depth: {}", o.getMaxDepth());
        log.info("Exclude Setter Methods: {}", !o.isIncludeSetterMethods());
        log.info("Cycle Detection: {}", !o.isNoCycleDetection());
        log.info("Parallelism: {}", v.getParallelism());
        log.info("=================================================");
    }

    public void printSuccess(AnalysisRunResult result) {
        log.info("");
        log.info("=================================================");
        log.info("ANALYSIS SUCCESSFUL");
        log.info("=================================================");
        log.info("Output Path: {}", result.getOutputPath() != null ? result.getOutputPath() : "None (not written)");
        log.info("Classes Analyzed: {}", result.getClassesAnalyzed());
        if (result.getClassesSkipped() > 0) {
            log.info("Classes Skipped: {}", result.getClassesSkipped());
        }
        log.info("Methods Classified: {}", result.getMethodsClassified());
        log.info("Aggregate Roots: {}", result.getAggregateRoots());
        log.info("Repositories: {}", result.getRepositories());
        log.info("Call Edges: {}", result.getCallEdges());
        log.info("Repository Call Sites: {}", result.getRepositoryCallSites());
        if (result.getCycles() > 0) {
            log.info("Aggregate-Root Call Cycles: {}", result.getCycles());
        }

        AnalysisStatistics stats = result.getStatistics();
        if (stats != null && stats.getAggregateRoots() > 0) {
            log.info("");
            log.info("Document Summary:");
            log.info("  Aggregate Roots: {}", stats.getAggregateRoots());
            log.info("  Repository Methods: {}", stats.getRepositoryMethods());
            log.info("  Call Sites: {}", stats.getCallSites());
            log.info("  Distinct Required Fields: {}", stats.getDistinctRequiredFields());
            for (Map.Entry<String, Integer> e : stats.getCallSitesPerAggregate().entrySet()) {
                log.info("  {}: {} repository methods, {} call sites", NamingUtil.simpleName(e.getKey()),
                        stats.getRepositoryMethodsPerAggregate().get(e.getKey()), e.getValue());
            }
        }

        printIssues(result.getReport());
        log.info("=================================================");
    }

    public void printFailure(AnalysisRunResult result) {
        log.error("Analysis failed: {}", result.getErrorMessage());
        printIssues(result.getReport());
    }

    private void printIssues(AnalysisReport report) {
        if (report == null || report.getIssues().isEmpty()) {
            return;
        }
        log.info("");
        log.info("Issues: {} errors, {} warnings, {} infos",
                report.getErrors().size(), report.getWarnings().size(), report.getInfos().size());
        for (AnalysisIssue issue : report.getErrors()) {
            log.error("  {}", issue.describe());
        }
        for (AnalysisIssue issue : report.getWarnings()) {
            log.warn("  {}", issue.describe());
        }
        for (AnalysisIssue issue : report.getInfos()) {
            log.debug("  {}", issue.describe());
        }
    }
}
