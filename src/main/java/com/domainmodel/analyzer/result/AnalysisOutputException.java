package com.domainmodel.analyzer.result;

import com.domainmodel.analyzer.diagnostics.IssueKind;

/**
 * The analysis document could not be serialized or written. Already computed
 * results are unaffected.
 */
public class AnalysisOutputException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final IssueKind kind;

    public AnalysisOutputException(IssueKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    /** {@link IssueKind#SERIALIZATION_ERROR} or {@link IssueKind#OUTPUT_WRITE_ERROR}. */
    public IssueKind getKind() {
        return kind;
    }
}
