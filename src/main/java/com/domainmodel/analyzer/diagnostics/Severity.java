package com.domainmodel.analyzer.diagnostics;

public enum Severity {
    INFO,
    WARNING,
    ERROR
}
