package com.domainmodel.analyzer.analysis.classifier;

import com.domainmodel.analyzer.model.AccessKind;

/**
 * Property name and access kind recognized from a method name.
 */
public record PropertyCallMatch(String propertyName, AccessKind kind) {
}
