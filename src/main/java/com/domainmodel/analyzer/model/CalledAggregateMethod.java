package com.domainmodel.analyzer.model;

import java.util.SortedSet;

import lombok.NonNull;
import lombok.Value;

/**
 * An aggregate-root method invoked directly by a caller, with the fields its
 * own call tree requires.
 */
@Value
public class CalledAggregateMethod {

    @NonNull
    MethodId method;

    @NonNull
    SortedSet<String> requiredFields;
}
