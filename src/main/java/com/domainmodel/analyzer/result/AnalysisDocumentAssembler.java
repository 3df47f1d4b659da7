package com.domainmodel.analyzer.result;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

import com.domainmodel.analyzer.model.CalledAggregateMethod;
import com.domainmodel.analyzer.model.FieldRequirement;
import com.domainmodel.analyzer.model.MethodId;
import com.domainmodel.analyzer.model.RepositoryCallSite;

/**
 * Turns field requirements into the persisted document shape.
 *
 * All maps are sorted and all field lists sorted, so the same requirements
 * always give the same document. Requirements of one caller method landing on
 * the same call-site key are merged by union. Overloads of one caller without
 * line info share a key too; the overload with the lowest descriptor keeps it
 * and the others get the key suffixed with {@code #descriptor}, so each keeps
 * its own entry and exact-descriptor lookups still find it.
 */
public class AnalysisDocumentAssembler {

    static final char OVERLOAD_SEPARATOR = '#';

    private static final Comparator<CalledMethodEntry> CALLED_METHOD_ORDER = Comparator
            .comparing(CalledMethodEntry::getAggregateRootMethod)
            .thenComparing(CalledMethodEntry::getAggregateRootMethodDescriptor);

    public AnalysisDocument assemble(Collection<FieldRequirement> requirements, Instant timestamp) {
        // root -> repository method key -> call-site key -> caller descriptor -> entry
        Map<String, Map<String, Map<String, Map<String, CallSiteEntry>>>> grouped = new TreeMap<>();

        for (FieldRequirement requirement : requirements) {
            RepositoryCallSite site = requirement.getCallSite();
            grouped.computeIfAbsent(site.getAggregateRootClass(), k -> new TreeMap<>())
                    .computeIfAbsent(site.getRepositoryMethod().key(), k -> new TreeMap<>())
                    .computeIfAbsent(site.callSiteKey(), k -> new TreeMap<>())
                    .merge(site.getCallerMethod().getDescriptor(), toEntry(requirement), AnalysisDocumentAssembler::union);
        }

        Map<String, AggregateRootEntry> callGraph = new TreeMap<>();
        grouped.forEach((rootClass, methods) -> {
            AggregateRootEntry root = AggregateRootEntry.builder().build();
            methods.forEach((methodKey, sites) -> {
                RepositoryMethodEntry repositoryMethod = RepositoryMethodEntry.builder().build();
                sites.forEach((siteKey, overloads) -> putOverloads(repositoryMethod.getCalls(), siteKey, overloads));
                root.getMethods().put(methodKey, repositoryMethod);
            });
            callGraph.put(rootClass, root);
        });

        return AnalysisDocument.builder()
                .version(AnalysisDocument.CURRENT_VERSION)
                .timestamp(timestamp.toString())
                .callGraph(callGraph)
                .build();
    }

    private static void putOverloads(Map<String, CallSiteEntry> calls, String siteKey,
                                     Map<String, CallSiteEntry> overloads) {
        boolean first = true;
        for (Map.Entry<String, CallSiteEntry> overload : overloads.entrySet()) {
            String key = first ? siteKey : siteKey + OVERLOAD_SEPARATOR + overload.getKey();
            calls.put(key, overload.getValue());
            first = false;
        }
    }

    CallSiteEntry toEntry(FieldRequirement requirement) {
        RepositoryCallSite site = requirement.getCallSite();
        MethodId caller = site.getCallerMethod();
        MethodId repositoryMethod = site.getRepositoryMethod();

        List<CalledMethodEntry> called = new ArrayList<>();
        for (CalledAggregateMethod method : requirement.getCalledMethods()) {
            called.add(CalledMethodEntry.builder()
                    .aggregateRootMethod(method.getMethod().getName())
                    .aggregateRootMethodDescriptor(method.getMethod().getDescriptor())
                    .requiredFields(new ArrayList<>(method.getRequiredFields()))
                    .build());
        }
        called.sort(CALLED_METHOD_ORDER);

        return CallSiteEntry.builder()
                .methodClass(caller.getOwnerClass())
                .method(caller.getName())
                .methodDescriptor(caller.getDescriptor())
                .repository(site.getRepositoryClass())
                .repositoryMethod(repositoryMethod.getName())
                .repositoryMethodDescriptor(repositoryMethod.getDescriptor())
                .aggregateRoot(site.getAggregateRootClass())
                .calledAggregateRootMethod(called)
                .requiredFields(new ArrayList<>(new TreeSet<>(requirement.getRequiredFields())))
                .build();
    }

    private static CallSiteEntry union(CallSiteEntry first, CallSiteEntry second) {
        TreeSet<String> fields = new TreeSet<>(first.getRequiredFields());
        fields.addAll(second.getRequiredFields());

        Map<String, CalledMethodEntry> called = new TreeMap<>();
        for (CalledMethodEntry e : first.getCalledAggregateRootMethod()) {
            called.put(e.getAggregateRootMethod() + e.getAggregateRootMethodDescriptor(), e);
        }
        for (CalledMethodEntry e : second.getCalledAggregateRootMethod()) {
            called.putIfAbsent(e.getAggregateRootMethod() + e.getAggregateRootMethodDescriptor(), e);
        }
        List<CalledMethodEntry> calledList = new ArrayList<>(called.values());
        calledList.sort(CALLED_METHOD_ORDER);

        return first.toBuilder()
                .requiredFields(new ArrayList<>(fields))
                .calledAggregateRootMethod(calledList)
                .build();
    }
}
