package com.domainmodel.analyzer.analysis.repository;

import java.util.List;
import java.util.Optional;

import com.domainmodel.analyzer.diagnostics.AnalysisIssue;
import com.domainmodel.analyzer.model.RepositoryMapping;

import lombok.Value;

/**
 * Outcome of identifying one class: the winning mapping, if any, and an
 * informational issue when several strategies matched.
 */
@Value
public class RepositoryIdentification {

    RepositoryMapping mapping;

    List<AnalysisIssue> issues;

    public static RepositoryIdentification none() {
        return new RepositoryIdentification(null, List.of());
    }

    public Optional<RepositoryMapping> getMapping() {
        return Optional.ofNullable(mapping);
    }
}
