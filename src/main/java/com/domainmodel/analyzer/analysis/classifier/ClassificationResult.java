package com.domainmodel.analyzer.analysis.classifier;

import java.util.List;

import com.domainmodel.analyzer.diagnostics.AnalysisIssue;
import com.domainmodel.analyzer.model.MethodId;
import com.domainmodel.analyzer.model.PropertyAccess;

import lombok.NonNull;
import lombok.Value;

/**
 * Property accesses of one method in first-occurrence order, plus the events
 * that had to be skipped.
 */
@Value
public class ClassificationResult {

    @NonNull
    MethodId method;

    @NonNull
    List<PropertyAccess> accesses;

    @NonNull
    List<AnalysisIssue> issues;
}
