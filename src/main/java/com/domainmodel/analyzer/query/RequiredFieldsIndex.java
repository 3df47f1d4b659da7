package com.domainmodel.analyzer.query;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import com.domainmodel.analyzer.result.AggregateRootEntry;
import com.domainmodel.analyzer.result.AnalysisDocument;
import com.domainmodel.analyzer.result.CallSiteEntry;
import com.domainmodel.analyzer.result.RepositoryMethodEntry;

/**
 * In-memory lookup structure over a loaded document: call sites grouped by
 * aggregate root and caller class. Immutable after construction.
 */
class RequiredFieldsIndex {

    private final Map<String, List<IndexedCall>> byRootAndCaller;
    private final Map<String, List<IndexedCall>> byRoot;

    private RequiredFieldsIndex(Map<String, List<IndexedCall>> byRootAndCaller, Map<String, List<IndexedCall>> byRoot) {
        this.byRootAndCaller = byRootAndCaller;
        this.byRoot = byRoot;
    }

    static RequiredFieldsIndex of(AnalysisDocument document) {
        Map<String, List<IndexedCall>> byRootAndCaller = new HashMap<>();
        Map<String, List<IndexedCall>> byRoot = new HashMap<>();
        Map<String, AggregateRootEntry> callGraph = document.getCallGraph() == null ? Map.of() : document.getCallGraph();

        callGraph.forEach((aggregateRoot, rootEntry) -> {
            if (rootEntry == null || rootEntry.getMethods() == null) {
                return;
            }
            for (Map.Entry<String, RepositoryMethodEntry> method : rootEntry.getMethods().entrySet()) {
                if (method.getValue() == null || method.getValue().getCalls() == null) {
                    continue;
                }
                for (CallSiteEntry call : method.getValue().getCalls().values()) {
                    if (call == null || call.getMethodClass() == null) {
                        continue;
                    }
                    IndexedCall indexed = new IndexedCall(method.getKey(), call);
                    byRootAndCaller.computeIfAbsent(key(aggregateRoot, call.getMethodClass()), k -> new ArrayList<>()).add(indexed);
                    byRoot.computeIfAbsent(aggregateRoot, k -> new ArrayList<>()).add(indexed);
                }
            }
        });
        return new RequiredFieldsIndex(byRootAndCaller, byRoot);
    }

    /**
     * Union of required fields over matching call sites.
     *
     * @param callerMethod name, or name plus descriptor for an exact match
     * @param repositoryMethod null for any; name, or name plus descriptor for an exact match
     */
    Set<String> lookup(String aggregateRoot, String callerClass, String callerMethod, String repositoryMethod) {
        Set<String> fields = new TreeSet<>();
        for (IndexedCall indexed : byRootAndCaller.getOrDefault(key(aggregateRoot, callerClass), List.of())) {
            if (matchesCaller(indexed.call, callerMethod) && matchesRepositoryMethod(indexed, repositoryMethod)) {
                addFields(fields, indexed.call);
            }
        }
        return fields;
    }

    Set<String> lookupByRepositoryMethod(String aggregateRoot, String repositoryMethod) {
        Set<String> fields = new TreeSet<>();
        for (IndexedCall indexed : byRoot.getOrDefault(aggregateRoot, List.of())) {
            if (matchesRepositoryMethod(indexed, repositoryMethod)) {
                addFields(fields, indexed.call);
            }
        }
        return fields;
    }

    private static boolean matchesCaller(CallSiteEntry call, String callerMethod) {
        if (isExact(callerMethod)) {
            return callerMethod.equals(call.getMethod() + call.getMethodDescriptor());
        }
        return callerMethod.equals(call.getMethod());
    }

    private static boolean matchesRepositoryMethod(IndexedCall indexed, String repositoryMethod) {
        if (repositoryMethod == null) {
            return true;
        }
        if (isExact(repositoryMethod)) {
            return repositoryMethod.equals(indexed.repositoryMethodKey);
        }
        return repositoryMethod.equals(indexed.call.getRepositoryMethod());
    }

    private static boolean isExact(String method) {
        return method.indexOf('(') >= 0;
    }

    private static void addFields(Set<String> target, CallSiteEntry call) {
        if (call.getRequiredFields() != null) {
            target.addAll(call.getRequiredFields());
        }
    }

    private static String key(String aggregateRoot, String callerClass) {
        return aggregateRoot + '|' + callerClass;
    }

    private static final class IndexedCall {
        final String repositoryMethodKey;
        final CallSiteEntry call;

        IndexedCall(String repositoryMethodKey, CallSiteEntry call) {
            this.repositoryMethodKey = repositoryMethodKey;
            this.call = call;
        }
    }
}
