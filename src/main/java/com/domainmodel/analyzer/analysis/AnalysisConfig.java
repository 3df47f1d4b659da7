package com.domainmodel.analyzer.analysis;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import com.domainmodel.analyzer.analysis.propagation.PropagationConfig;
import com.domainmodel.analyzer.analysis.repository.RepositoryIdentificationConfig;
import com.domainmodel.analyzer.bytecode.ClassNameFilter;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Configuration for one analysis run.
 */
@Value
@Builder(toBuilder = true)
public class AnalysisConfig {

    public static final List<String> DEFAULT_AGGREGATE_ROOT_ANNOTATIONS = List.of("AggregateRoot");

    /** Compiled-output directories to analyze. */
    @Singular
    List<Path> classDirs;

    /** Where the document is written; no file is written when absent. */
    Path outputFile;

    @Builder.Default
    RepositoryIdentificationConfig repositoryIdentification = RepositoryIdentificationConfig.defaults();

    /** Annotation names (qualified or simple) marking aggregate roots. */
    @Builder.Default
    List<String> aggregateRootAnnotations = DEFAULT_AGGREGATE_ROOT_ANNOTATIONS;

    /** Aggregate roots named explicitly, in addition to annotated ones. */
    @Singular
    List<String> aggregateRoots;

    @Builder.Default
    List<String> includePackages = ClassNameFilter.DEFAULT_INCLUDES;

    @Builder.Default
    List<String> excludePackages = ClassNameFilter.DEFAULT_EXCLUDES;

    @Builder.Default
    PropagationConfig propagation = PropagationConfig.defaults();

    @Builder.Default
    int parallelism = Runtime.getRuntime().availableProcessors();

    /** Make configuration and output errors fail the run. */
    boolean failOnError;

    @Builder.Default
    boolean prettyPrint = true;

    public Optional<Path> getOutputFile() {
        return Optional.ofNullable(outputFile);
    }

    public ClassNameFilter classNameFilter() {
        return new ClassNameFilter(includePackages, excludePackages);
    }
}
