package com.domainmodel.analyzer.result;

import java.util.Collections;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import lombok.Value;

/**
 * Counts over an analysis document, for reporting.
 */
@Value
public class AnalysisStatistics {

    int aggregateRoots;
    int repositoryMethods;
    int callSites;
    int distinctRequiredFields;

    /** Repository methods per aggregate root. */
    Map<String, Integer> repositoryMethodsPerAggregate;

    /** Call sites per aggregate root. */
    Map<String, Integer> callSitesPerAggregate;

    public static AnalysisStatistics of(AnalysisDocument document) {
        Map<String, Integer> methodsPerRoot = new TreeMap<>();
        Map<String, Integer> callsPerRoot = new TreeMap<>();
        int methods = 0;
        int calls = 0;

        Map<String, AggregateRootEntry> callGraph =
                document.getCallGraph() == null ? Map.of() : document.getCallGraph();
        Set<String> fields = new HashSet<>();

        for (Map.Entry<String, AggregateRootEntry> root : callGraph.entrySet()) {
            Map<String, RepositoryMethodEntry> rootMethods =
                    root.getValue() == null || root.getValue().getMethods() == null ? Map.of() : root.getValue().getMethods();
            int rootCalls = 0;
            for (RepositoryMethodEntry method : rootMethods.values()) {
                if (method == null || method.getCalls() == null) {
                    continue;
                }
                rootCalls += method.getCalls().size();
                for (CallSiteEntry call : method.getCalls().values()) {
                    if (call != null && call.getRequiredFields() != null) {
                        call.getRequiredFields().forEach(f -> fields.add(root.getKey() + "#" + f));
                    }
                }
            }
            methodsPerRoot.put(root.getKey(), rootMethods.size());
            callsPerRoot.put(root.getKey(), rootCalls);
            methods += rootMethods.size();
            calls += rootCalls;
        }

        return new AnalysisStatistics(callGraph.size(), methods, calls, fields.size(),
                Collections.unmodifiableMap(methodsPerRoot), Collections.unmodifiableMap(callsPerRoot));
    }
}
