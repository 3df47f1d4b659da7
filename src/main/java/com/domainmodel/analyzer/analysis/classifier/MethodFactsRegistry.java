package com.domainmodel.analyzer.analysis.classifier;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import com.domainmodel.analyzer.model.MethodId;
import com.domainmodel.analyzer.model.PropertyAccess;

/**
 * Per-method property accesses of every analyzed class, keyed by {@link MethodId}.
 *
 * Created for one run through {@link Builder}, which worker threads may fill
 * concurrently; the built registry is immutable.
 */
public class MethodFactsRegistry {

    private final Map<MethodId, List<PropertyAccess>> accesses;

    private MethodFactsRegistry(Map<MethodId, List<PropertyAccess>> accesses) {
        this.accesses = Map.copyOf(accesses);
    }

    public static Builder builder() {
        return new Builder();
    }

    /** True when the method was declared by an analyzed class. */
    public boolean isDeclared(MethodId method) {
        return accesses.containsKey(method);
    }

    public List<PropertyAccess> accessesOf(MethodId method) {
        return accesses.getOrDefault(method, List.of());
    }

    public Set<MethodId> getMethods() {
        return accesses.keySet();
    }

    public int size() {
        return accesses.size();
    }

    public static class Builder {

        private final Map<MethodId, List<PropertyAccess>> accesses = new ConcurrentHashMap<>();

        public Builder register(ClassificationResult result) {
            accesses.put(result.getMethod(), List.copyOf(result.getAccesses()));
            return this;
        }

        public Builder register(MethodId method, List<PropertyAccess> methodAccesses) {
            accesses.put(method, List.copyOf(methodAccesses));
            return this;
        }

        public MethodFactsRegistry build() {
            return new MethodFactsRegistry(accesses);
        }
    }
}
