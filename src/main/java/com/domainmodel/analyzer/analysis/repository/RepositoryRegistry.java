package com.domainmodel.analyzer.analysis.repository;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

import com.domainmodel.analyzer.model.RepositoryMapping;

/**
 * Repository mappings and aggregate roots known to one analysis run.
 * Built once, then read from any thread.
 */
public class RepositoryRegistry {

    private final Map<String, RepositoryMapping> byRepository;
    private final Set<String> aggregateRoots;

    private RepositoryRegistry(Map<String, RepositoryMapping> byRepository, Set<String> aggregateRoots) {
        this.byRepository = byRepository;
        this.aggregateRoots = aggregateRoots;
    }

    public static RepositoryRegistry of(Collection<RepositoryMapping> mappings, Collection<String> aggregateRoots) {
        Map<String, RepositoryMapping> map = new TreeMap<>();
        for (RepositoryMapping m : mappings) {
            RepositoryMapping previous = map.putIfAbsent(m.getRepositoryClass(), m);
            if (previous != null && !previous.equals(m)) {
                throw new IllegalArgumentException("Repository " + m.getRepositoryClass()
                        + " mapped twice: " + previous.getAggregateRootClass() + " and " + m.getAggregateRootClass());
            }
        }
        Set<String> roots = new TreeSet<>(aggregateRoots);
        mappings.forEach(m -> roots.add(m.getAggregateRootClass()));
        return new RepositoryRegistry(Map.copyOf(map), Set.copyOf(roots));
    }

    public static RepositoryRegistry empty() {
        return of(List.of(), List.of());
    }

    public Optional<RepositoryMapping> find(String repositoryClass) {
        return Optional.ofNullable(byRepository.get(repositoryClass));
    }

    public boolean isRepository(String className) {
        return byRepository.containsKey(className);
    }

    public boolean isAggregateRoot(String className) {
        return aggregateRoots.contains(className);
    }

    public List<RepositoryMapping> getMappings() {
        return byRepository.values().stream()
                .sorted((a, b) -> a.getRepositoryClass().compareTo(b.getRepositoryClass()))
                .toList();
    }

    public Set<String> getAggregateRoots() {
        return new TreeSet<>(aggregateRoots);
    }
}
