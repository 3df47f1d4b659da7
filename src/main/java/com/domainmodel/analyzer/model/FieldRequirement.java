package com.domainmodel.analyzer.model;

import java.util.List;
import java.util.SortedSet;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Fields of the aggregate root one repository call site needs.
 */
@Value
@Builder(toBuilder = true)
public class FieldRequirement {

    @NonNull
    RepositoryCallSite callSite;

    @Singular
    List<CalledAggregateMethod> calledMethods;

    @NonNull
    SortedSet<String> requiredFields;

    /** Set when a depth bound or cycle cut a branch short; the fields are then a partial union. */
    boolean truncated;

    public String getAggregateRootClass() {
        return callSite.getAggregateRootClass();
    }

    public MethodId getRepositoryMethod() {
        return callSite.getRepositoryMethod();
    }

    public MethodId getCallerMethod() {
        return callSite.getCallerMethod();
    }
}
