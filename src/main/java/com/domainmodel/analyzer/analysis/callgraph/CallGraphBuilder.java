package com.domainmodel.analyzer.analysis.callgraph;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.domainmodel.analyzer.analysis.repository.RepositoryRegistry;
import com.domainmodel.analyzer.diagnostics.AnalysisIssue;
import com.domainmodel.analyzer.diagnostics.IssueKind;
import com.domainmodel.analyzer.model.CallEdge;
import com.domainmodel.analyzer.model.MethodId;
import com.domainmodel.analyzer.model.RepositoryCallSite;
import com.domainmodel.analyzer.model.RepositoryMapping;
import com.domainmodel.analyzer.model.SourceSpan;
import com.domainmodel.analyzer.stream.ClassInstructions;
import com.domainmodel.analyzer.stream.EventType;
import com.domainmodel.analyzer.stream.InstructionEvent;
import com.domainmodel.analyzer.stream.MethodInstructions;

/**
 * Accumulates call edges class by class and tags calls into known repositories.
 *
 * Requires the complete {@link RepositoryRegistry} up front. {@link #addClass}
 * may be called concurrently and in any order; {@link #build()} always yields
 * the same graph for the same set of classes.
 */
public class CallGraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(CallGraphBuilder.class);

    static final Comparator<CallEdge> EDGE_ORDER = Comparator
            .comparing(CallEdge::getCaller)
            .thenComparing(CallEdge::getCallee)
            .thenComparing(e -> SourceSpan.format(e.getSourceSpan()));

    static final Comparator<RepositoryCallSite> CALL_SITE_ORDER = Comparator
            .comparing(RepositoryCallSite::getAggregateRootClass)
            .thenComparing(RepositoryCallSite::getRepositoryMethod)
            .thenComparing(RepositoryCallSite::getCallerMethod);

    private final RepositoryRegistry registry;

    private final Set<CallEdge> edges = ConcurrentHashMap.newKeySet();
    private final Set<RepositoryCallSite> callSites = ConcurrentHashMap.newKeySet();

    public CallGraphBuilder(RepositoryRegistry registry) {
        this.registry = registry;
    }

    /**
     * Adds the edges of every method of {@code cls}.
     *
     * @return events that could not be turned into edges
     */
    public List<AnalysisIssue> addClass(ClassInstructions cls) {
        List<AnalysisIssue> issues = new ArrayList<>();
        for (MethodInstructions method : cls.getMethods()) {
            addMethod(cls.getClassName(), method, issues);
        }
        return issues;
    }

    private void addMethod(String ownerClass, MethodInstructions method, List<AnalysisIssue> issues) {
        MethodId caller = MethodId.of(ownerClass, method.getName(), method.getDescriptor());
        Optional<SourceSpan> span = methodSpan(method);

        int currentLine = -1;
        for (InstructionEvent event : method.getEvents()) {
            if (event.getType() == EventType.LINE) {
                currentLine = event.getLine();
                continue;
            }
            if (event.getType() != EventType.CALL) {
                continue;
            }
            if (event.getOwnerType() == null || event.getName() == null || event.getDescriptor() == null) {
                log.debug("Call without owner/name/descriptor in {}", caller);
                issues.add(AnalysisIssue.of(IssueKind.CLASSIFICATION_ERROR, caller.toString(),
                        "Call event without owner, name or descriptor left out of the call graph"));
                continue;
            }

            MethodId callee = MethodId.of(event.getOwnerType(), event.getName(), event.getDescriptor());
            SourceSpan edgeSpan = currentLine > 0 ? SourceSpan.of(currentLine, currentLine) : null;
            edges.add(new CallEdge(caller, callee, edgeSpan));

            Optional<RepositoryMapping> repository = registry.find(callee.getOwnerClass());
            if (repository.isPresent()) {
                callSites.add(RepositoryCallSite.builder()
                        .callerMethod(caller)
                        .repositoryClass(repository.get().getRepositoryClass())
                        .repositoryMethod(callee)
                        .aggregateRootClass(repository.get().getAggregateRootClass())
                        .callerSpan(span.orElse(null))
                        .build());
            }
        }
    }

    /**
     * Line range covered by a method's line markers, if it has any.
     */
    static Optional<SourceSpan> methodSpan(MethodInstructions method) {
        int min = Integer.MAX_VALUE;
        int max = Integer.MIN_VALUE;
        for (InstructionEvent event : method.getEvents()) {
            if (event.getType() == EventType.LINE && event.getLine() > 0) {
                min = Math.min(min, event.getLine());
                max = Math.max(max, event.getLine());
            }
        }
        return min == Integer.MAX_VALUE ? Optional.empty() : Optional.of(SourceSpan.of(min, max));
    }

    public CallGraph build() {
        List<CallEdge> sortedEdges = new ArrayList<>(edges);
        sortedEdges.sort(EDGE_ORDER);
        List<RepositoryCallSite> sortedSites = new ArrayList<>(callSites);
        sortedSites.sort(CALL_SITE_ORDER);
        log.debug("Call graph built: {} edges, {} repository call sites", sortedEdges.size(), sortedSites.size());
        return new CallGraph(sortedEdges, sortedSites);
    }
}
