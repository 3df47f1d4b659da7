package com.domainmodel.analyzer.diagnostics;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Taxonomy of problems an analysis run can report.
 *
 * Only {@link #isRunFailing() run-failing} kinds can make a run unsuccessful, and only
 * when fail-on-error is enabled. Everything else is local to one class, method or call
 * site and never aborts the batch.
 */
@Getter
@RequiredArgsConstructor
public enum IssueKind {

    INSTRUCTION_READ_ERROR(Severity.WARNING, false),
    CLASSIFICATION_ERROR(Severity.WARNING, false),
    REPOSITORY_AMBIGUITY(Severity.INFO, false),
    PROPAGATION_DEPTH_EXCEEDED(Severity.WARNING, false),
    PROPAGATION_CYCLE_DETECTED(Severity.WARNING, false),
    CALL_GRAPH_CYCLE(Severity.INFO, false),
    DOCUMENT_INCONSISTENCY(Severity.WARNING, false),
    SERIALIZATION_ERROR(Severity.ERROR, true),
    OUTPUT_WRITE_ERROR(Severity.ERROR, true),
    CONFIGURATION_ERROR(Severity.ERROR, true);

    private final Severity defaultSeverity;
    private final boolean runFailing;
}
