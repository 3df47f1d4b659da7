package com.domainmodel.analyzer.model;

import java.util.Optional;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A call from application code into a repository method.
 */
@Value
@Builder(toBuilder = true)
public class RepositoryCallSite {

    @NonNull
    MethodId callerMethod;

    @NonNull
    String repositoryClass;

    @NonNull
    MethodId repositoryMethod;

    @NonNull
    String aggregateRootClass;

    /** Line range of the caller method body. */
    SourceSpan callerSpan;

    public Optional<SourceSpan> getCallerSpan() {
        return Optional.ofNullable(callerSpan);
    }

    /**
     * Stable composite key {@code callerClass.callerMethod+start-end}, with
     * {@code unknown} in place of the span when no line info is present.
     */
    public String callSiteKey() {
        return callerMethod.getOwnerClass() + "." + callerMethod.getName() + "+" + SourceSpan.format(getCallerSpan());
    }
}
