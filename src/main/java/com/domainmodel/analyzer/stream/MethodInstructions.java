package com.domainmodel.analyzer.stream;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Ordered instruction stream of a single method body.
 */
@Value
@Builder(toBuilder = true)
public class MethodInstructions {

    @NonNull
    String name;

    /** JVM descriptor, e.g. {@code (Ljava/lang/String;)V}. */
    @NonNull
    String descriptor;

    /** JVM access flags. */
    int access;

    @NonNull
    @Singular
    List<InstructionEvent> events;
}
