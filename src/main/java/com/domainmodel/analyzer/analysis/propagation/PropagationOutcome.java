package com.domainmodel.analyzer.analysis.propagation;

import java.util.List;

import com.domainmodel.analyzer.diagnostics.AnalysisIssue;
import com.domainmodel.analyzer.model.FieldRequirement;

import lombok.NonNull;
import lombok.Value;

@Value
public class PropagationOutcome {

    @NonNull
    FieldRequirement requirement;

    @NonNull
    List<AnalysisIssue> issues;
}
