package com.domainmodel.analyzer.cli.model;

import java.nio.file.Path;
import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed by the executor. Keeps AnalyzeCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedAnalyzeOptions {
    List<Path> classDirs;
    Path outputFile;
    int parallelism;
}
