package com.domainmodel.analyzer.model;

import java.util.Optional;

import lombok.NonNull;
import lombok.Value;

@Value
public class CallEdge {

    @NonNull
    MethodId caller;

    @NonNull
    MethodId callee;

    SourceSpan sourceSpan;

    public Optional<SourceSpan> getSourceSpan() {
        return Optional.ofNullable(sourceSpan);
    }

    public boolean isSelfLoop() {
        return caller.equals(callee);
    }
}
