package com.domainmodel.analyzer.analysis.propagation;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.domainmodel.analyzer.analysis.callgraph.CallGraph;
import com.domainmodel.analyzer.analysis.classifier.CallPatternConverter;
import com.domainmodel.analyzer.analysis.classifier.MethodFactsRegistry;
import com.domainmodel.analyzer.diagnostics.AnalysisIssue;
import com.domainmodel.analyzer.diagnostics.IssueKind;
import com.domainmodel.analyzer.model.CalledAggregateMethod;
import com.domainmodel.analyzer.model.FieldRequirement;
import com.domainmodel.analyzer.model.MethodId;
import com.domainmodel.analyzer.model.PropertyAccess;
import com.domainmodel.analyzer.model.RepositoryCallSite;
import com.domainmodel.analyzer.util.DescriptorUtil;

import lombok.RequiredArgsConstructor;

/**
 * Computes the aggregate-root fields a repository call site needs.
 *
 * The caller's own accesses on the aggregate root seed the set. Every
 * aggregate-root method the caller invokes is then walked as its own
 * propagation root: its accesses are added and its calls to further
 * aggregate-root methods are followed, bounded by
 * {@link PropagationConfig#getMaxRecursionDepth()} and guarded by a visited
 * set. A cut branch is reported and the union gathered so far is kept.
 *
 * The walk uses an explicit stack, so the Java stack depth does not depend on
 * the shape of the call graph.
 */
@RequiredArgsConstructor
public class FieldRequirementPropagator {

    private static final Logger log = LoggerFactory.getLogger(FieldRequirementPropagator.class);

    private final PropagationConfig config;
    private final CallGraph callGraph;
    private final MethodFactsRegistry facts;
    private final CallPatternConverter converter;

    public FieldRequirementPropagator(PropagationConfig config, CallGraph callGraph, MethodFactsRegistry facts) {
        this(config, callGraph, facts, new CallPatternConverter());
    }

    public PropagationOutcome propagate(RepositoryCallSite site) {
        String root = site.getAggregateRootClass();
        String location = site.callSiteKey() + " -> " + site.getRepositoryMethod().key();
        List<AnalysisIssue> issues = new ArrayList<>();

        SortedSet<String> required = new TreeSet<>();
        for (PropertyAccess access : facts.accessesOf(site.getCallerMethod())) {
            if (!root.equals(access.getOwnerClass().orElse(null))) {
                continue;
            }
            if (config.isExcludeSetterMethods() && !access.isRead()) {
                continue;
            }
            required.add(access.getPropertyName());
        }

        boolean truncated = false;
        List<CalledAggregateMethod> calledMethods = new ArrayList<>();
        for (MethodId direct : aggregateCallees(site.getCallerMethod(), root)) {
            Walk walk = walk(direct, root, location, issues);
            truncated |= walk.truncated;
            calledMethods.add(new CalledAggregateMethod(direct, Collections.unmodifiableSortedSet(walk.fields)));
            required.addAll(walk.fields);
        }

        FieldRequirement requirement = FieldRequirement.builder()
                .callSite(site)
                .calledMethods(calledMethods)
                .requiredFields(Collections.unmodifiableSortedSet(required))
                .truncated(truncated)
                .build();
        return new PropagationOutcome(requirement, List.copyOf(issues));
    }

    private Walk walk(MethodId start, String root, String location, List<AnalysisIssue> issues) {
        Walk walk = new Walk();
        Set<MethodId> visited = new HashSet<>();
        Set<MethodId> onPath = new HashSet<>();
        Deque<Frame> stack = new ArrayDeque<>();

        enter(start, 1, root, walk, visited, onPath, stack);

        while (!stack.isEmpty()) {
            Frame frame = stack.peek();
            if (!frame.callees.hasNext()) {
                stack.pop();
                onPath.remove(frame.method);
                continue;
            }
            MethodId next = frame.callees.next();
            int depth = frame.depth + 1;

            if (config.isEnableCycleDetection() && onPath.contains(next)) {
                walk.truncated = true;
                log.warn("Cycle at {} while propagating {}", next, location);
                issues.add(AnalysisIssue.of(IssueKind.PROPAGATION_CYCLE_DETECTED, location,
                        "Cycle through " + next + " reached from " + frame.method + "; branch cut"));
                continue;
            }
            if (config.isEnableCycleDetection() && visited.contains(next)) {
                continue;
            }
            if (depth > config.getMaxRecursionDepth()) {
                walk.truncated = true;
                log.warn("Max recursion depth {} exceeded at {} while propagating {}",
                        config.getMaxRecursionDepth(), next, location);
                issues.add(AnalysisIssue.of(IssueKind.PROPAGATION_DEPTH_EXCEEDED, location,
                        "Depth " + config.getMaxRecursionDepth() + " exceeded at " + next + "; branch cut"));
                continue;
            }
            enter(next, depth, root, walk, visited, onPath, stack);
        }
        return walk;
    }

    private void enter(MethodId method, int depth, String root, Walk walk,
                       Set<MethodId> visited, Set<MethodId> onPath, Deque<Frame> stack) {
        if (config.isEnableCycleDetection()) {
            visited.add(method);
            onPath.add(method);
        }
        for (PropertyAccess access : facts.accessesOf(method)) {
            if (access.isOwnedByOrUnowned(root)) {
                walk.fields.add(access.getPropertyName());
            }
        }
        stack.push(new Frame(method, depth, aggregateCallees(method, root).iterator()));
    }

    /**
     * Callees of {@code method} declared on the aggregate root, minus setter
     * methods when those are excluded.
     */
    private List<MethodId> aggregateCallees(MethodId method, String root) {
        List<MethodId> result = new ArrayList<>();
        for (MethodId callee : callGraph.callees(method)) {
            if (!callee.getOwnerClass().equals(root) || !facts.isDeclared(callee)) {
                continue;
            }
            if (config.isExcludeSetterMethods() && isSetter(callee)) {
                continue;
            }
            result.add(callee);
        }
        return result;
    }

    private boolean isSetter(MethodId method) {
        try {
            return converter.isSetterPattern(method.getName(), DescriptorUtil.argumentCount(method.getDescriptor()));
        } catch (IllegalArgumentException e) {
            log.debug("Unreadable descriptor on {}: {}", method, e.getMessage());
            return false;
        }
    }

    private static final class Walk {
        final SortedSet<String> fields = new TreeSet<>();
        boolean truncated;
    }

    private static final class Frame {
        final MethodId method;
        final int depth;
        final Iterator<MethodId> callees;

        Frame(MethodId method, int depth, Iterator<MethodId> callees) {
            this.method = method;
            this.depth = depth;
            this.callees = callees;
        }
    }
}
