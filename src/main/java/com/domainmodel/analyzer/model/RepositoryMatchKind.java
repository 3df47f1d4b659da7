package com.domainmodel.analyzer.model;

/**
 * How a repository was recognized. Declaration order is precedence order:
 * the most explicit strategy comes first.
 */
public enum RepositoryMatchKind {
    GENERIC_INTERFACE,
    ANNOTATION,
    NAMING_CONVENTION
}
