package com.domainmodel.analyzer.analysis.propagation;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class PropagationConfig {

    public static final int DEFAULT_MAX_RECURSION_DEPTH = 10;

    /** Longest chain of aggregate-root methods followed from one directly called method. */
    @Builder.Default
    int maxRecursionDepth = DEFAULT_MAX_RECURSION_DEPTH;

    /** Setter-pattern methods and caller-side writes contribute no fields. */
    @Builder.Default
    boolean excludeSetterMethods = true;

    /**
     * Remember visited methods per propagation root and report re-entry on the
     * current path as a cycle. When off, only the depth bound stops recursion.
     */
    @Builder.Default
    boolean enableCycleDetection = true;

    public static PropagationConfig defaults() {
        return PropagationConfig.builder().build();
    }
}
