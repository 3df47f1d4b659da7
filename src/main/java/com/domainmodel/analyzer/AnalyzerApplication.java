package com.domainmodel.analyzer;

import com.domainmodel.analyzer.cli.AnalyzeCommand;

import picocli.CommandLine;

/**
 * Main entry point for the Aggregate Field Analyzer.
 * Analyzes compiled domain classes and writes, for every repository call site,
 * the aggregate-root fields that call site actually needs.
 */
public class AnalyzerApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new AnalyzeCommand()).execute(args);
        System.exit(exitCode);
    }
}
