package com.domainmodel.analyzer.analysis.callgraph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

import com.domainmodel.analyzer.model.CallEdge;
import com.domainmodel.analyzer.model.MethodId;
import com.domainmodel.analyzer.model.RepositoryCallSite;

/**
 * Immutable whole-program call graph. Edges and call sites are kept in a
 * deterministic order regardless of how the graph was built.
 */
public class CallGraph {

    private final List<CallEdge> edges;
    private final Map<MethodId, List<CallEdge>> outgoing;
    private final List<RepositoryCallSite> repositoryCallSites;

    CallGraph(List<CallEdge> edges, List<RepositoryCallSite> repositoryCallSites) {
        this.edges = List.copyOf(edges);
        this.repositoryCallSites = List.copyOf(repositoryCallSites);

        Map<MethodId, List<CallEdge>> byCaller = new TreeMap<>();
        for (CallEdge edge : this.edges) {
            byCaller.computeIfAbsent(edge.getCaller(), k -> new ArrayList<>()).add(edge);
        }
        byCaller.replaceAll((k, v) -> List.copyOf(v));
        this.outgoing = Collections.unmodifiableMap(byCaller);
    }

    public List<CallEdge> getEdges() {
        return edges;
    }

    private List<CallEdge> outgoing(MethodId caller) {
        return outgoing.getOrDefault(caller, List.of());
    }

    /**
     * Distinct callees of {@code caller}, sorted.
     */
    public Set<MethodId> callees(MethodId caller) {
        Set<MethodId> result = new TreeSet<>();
        for (CallEdge edge : outgoing(caller)) {
            result.add(edge.getCallee());
        }
        return result;
    }

    public Set<MethodId> getCallers() {
        return outgoing.keySet();
    }

    public List<RepositoryCallSite> getRepositoryCallSites() {
        return repositoryCallSites;
    }

    public int edgeCount() {
        return edges.size();
    }
}
