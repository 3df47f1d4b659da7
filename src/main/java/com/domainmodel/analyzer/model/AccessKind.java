package com.domainmodel.analyzer.model;

public enum AccessKind {
    GET,
    SET
}
