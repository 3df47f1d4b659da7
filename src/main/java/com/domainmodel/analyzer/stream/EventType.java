package com.domainmodel.analyzer.stream;

/**
 * Kinds of events an instruction stream can carry for one method body.
 */
public enum EventType {
    CALL,
    FIELD_READ,
    FIELD_WRITE,
    /** Source line marker; carries no semantics beyond diagnostics. */
    LINE,
    BRANCH_START,
    BRANCH_END
}
