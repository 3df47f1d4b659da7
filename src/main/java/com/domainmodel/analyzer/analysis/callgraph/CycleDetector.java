package com.domainmodel.analyzer.analysis.callgraph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Predicate;

import com.domainmodel.analyzer.model.MethodId;

/**
 * Finds groups of mutually recursive methods (strongly connected components
 * with more than one member, or a single member calling itself).
 *
 * Iterative Tarjan, so deep graphs do not grow the Java stack.
 */
public class CycleDetector {

    /**
     * @param graph the call graph
     * @param scope only methods accepted here take part, e.g. aggregate-root methods
     * @return each cycle as a sorted member list; cycles sorted by their first member
     */
    public List<List<MethodId>> findCycles(CallGraph graph, Predicate<MethodId> scope) {
        Map<MethodId, Integer> index = new HashMap<>();
        Map<MethodId, Integer> lowLink = new HashMap<>();
        Set<MethodId> onStack = new HashSet<>();
        Deque<MethodId> stack = new ArrayDeque<>();
        List<List<MethodId>> cycles = new ArrayList<>();
        int counter = 0;

        for (MethodId start : new TreeSet<>(graph.getCallers())) {
            if (!scope.test(start) || index.containsKey(start)) {
                continue;
            }

            Deque<Frame> work = new ArrayDeque<>();
            work.push(new Frame(start, scopedCallees(graph, start, scope)));
            index.put(start, counter);
            lowLink.put(start, counter);
            counter++;
            stack.push(start);
            onStack.add(start);

            while (!work.isEmpty()) {
                Frame frame = work.peek();
                if (frame.callees.hasNext()) {
                    MethodId next = frame.callees.next();
                    if (!index.containsKey(next)) {
                        index.put(next, counter);
                        lowLink.put(next, counter);
                        counter++;
                        stack.push(next);
                        onStack.add(next);
                        work.push(new Frame(next, scopedCallees(graph, next, scope)));
                    } else if (onStack.contains(next)) {
                        lowLink.put(frame.method, Math.min(lowLink.get(frame.method), index.get(next)));
                    }
                    continue;
                }

                work.pop();
                if (!work.isEmpty()) {
                    MethodId parent = work.peek().method;
                    lowLink.put(parent, Math.min(lowLink.get(parent), lowLink.get(frame.method)));
                }

                if (lowLink.get(frame.method).equals(index.get(frame.method))) {
                    List<MethodId> component = new ArrayList<>();
                    MethodId member;
                    do {
                        member = stack.pop();
                        onStack.remove(member);
                        component.add(member);
                    } while (!member.equals(frame.method));

                    if (component.size() > 1 || graph.callees(frame.method).contains(frame.method)) {
                        Collections.sort(component);
                        cycles.add(List.copyOf(component));
                    }
                }
            }
        }

        cycles.sort((a, b) -> a.get(0).compareTo(b.get(0)));
        return cycles;
    }

    private static Iterator<MethodId> scopedCallees(CallGraph graph, MethodId method, Predicate<MethodId> scope) {
        return graph.callees(method).stream().filter(scope).iterator();
    }

    private static final class Frame {
        final MethodId method;
        final Iterator<MethodId> callees;

        Frame(MethodId method, Iterator<MethodId> callees) {
            this.method = method;
            this.callees = callees;
        }
    }
}
