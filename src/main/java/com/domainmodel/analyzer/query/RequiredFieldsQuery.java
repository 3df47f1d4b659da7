package com.domainmodel.analyzer.query;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.domainmodel.analyzer.result.AnalysisDocument;

/**
 * Runtime lookup of the fields a repository call site needs.
 *
 * The document is loaded once, on first use. Answers are cached per loaded
 * document, so {@link #clearCache()} drops both together; a lookup still running
 * against the old document only writes into the old cache. Nothing here throws
 * for a missing document or an unknown call site: the answer is then an empty set, and {@link #isAnalysisAvailable()}
 * tells the two situations apart.
 */
public class RequiredFieldsQuery {

    private static final Logger log = LoggerFactory.getLogger(RequiredFieldsQuery.class);

    private final AnalysisDocumentLoader loader;

    private volatile Loaded loaded;

    public RequiredFieldsQuery() {
        this(AnalysisDocumentLoader.fromClasspath());
    }

    public RequiredFieldsQuery(AnalysisDocumentLoader loader) {
        this.loader = loader;
    }

    public boolean isAnalysisAvailable() {
        return loaded().document.isPresent();
    }

    /**
     * Fields needed by the call site in {@code callerClass.callerMethod}.
     *
     * @param callerMethod method name, or name plus descriptor ({@code handle(J)V}) for an exact match;
     *        a bare name unions all overloads
     * @param repositoryMethod null for every repository method of the aggregate; otherwise name, or
     *        name plus descriptor for an exact match
     * @return sorted, unmodifiable; empty when unknown
     */
    public Set<String> getRequiredFields(String aggregateRootClass, String callerClass, String callerMethod,
                                         String repositoryMethod) {
        if (aggregateRootClass == null || callerClass == null || callerMethod == null) {
            return Collections.emptySortedSet();
        }
        String cacheKey = aggregateRootClass + '|' + callerClass + '|' + callerMethod + '|'
                + (repositoryMethod == null ? "*" : repositoryMethod);
        Loaded current = loaded();
        Set<String> cached = current.cache.get(cacheKey);
        if (cached != null) {
            return cached;
        }
        Set<String> computed = current.index
                .map(i -> i.lookup(aggregateRootClass, callerClass, callerMethod, repositoryMethod))
                .map(RequiredFieldsQuery::freeze)
                .orElse(Collections.emptySortedSet());
        current.cache.put(cacheKey, computed);
        return computed;
    }

    public Set<String> getRequiredFields(Class<?> aggregateRoot, Class<?> caller, String callerMethod,
                                         String repositoryMethod) {
        return getRequiredFields(aggregateRoot.getName(), caller.getName(), callerMethod, repositoryMethod);
    }

    /**
     * Union over every call site of one repository method.
     */
    public Set<String> getRequiredFieldsForRepositoryMethod(String aggregateRootClass, String repositoryMethod) {
        if (aggregateRootClass == null || repositoryMethod == null) {
            return Collections.emptySortedSet();
        }
        String cacheKey = aggregateRootClass + "|*|*|" + repositoryMethod;
        Loaded current = loaded();
        return current.cache.computeIfAbsent(cacheKey, k -> current.index
                .map(i -> i.lookupByRepositoryMethod(aggregateRootClass, repositoryMethod))
                .map(RequiredFieldsQuery::freeze)
                .orElse(Collections.emptySortedSet()));
    }

    public Optional<String> getVersion() {
        return loaded().document.map(AnalysisDocument::getVersion);
    }

    public Optional<String> getTimestamp() {
        return loaded().document.map(AnalysisDocument::getTimestamp);
    }

    /**
     * Drops cached answers and the loaded document; the next call loads again.
     */
    public void clearCache() {
        synchronized (this) {
            loaded = null;
        }
        log.debug("Required-fields cache cleared");
    }

    private Loaded loaded() {
        Loaded current = loaded;
        if (current != null) {
            return current;
        }
        synchronized (this) {
            if (loaded == null) {
                Optional<AnalysisDocument> document = loader.load();
                loaded = new Loaded(document, document.map(RequiredFieldsIndex::of));
                if (document.isPresent()) {
                    log.info("Loaded field analysis version {} ({})", document.get().getVersion(), document.get().getTimestamp());
                } else {
                    log.info("No field analysis available; required-field lookups will be empty");
                }
            }
            return loaded;
        }
    }

    private static Set<String> freeze(Set<String> fields) {
        SortedSet<String> sorted = new TreeSet<>(fields);
        return Collections.unmodifiableSortedSet(sorted);
    }

    private static final class Loaded {
        final Optional<AnalysisDocument> document;
        final Optional<RequiredFieldsIndex> index;
        final Map<String, Set<String>> cache = new ConcurrentHashMap<>();

        Loaded(Optional<AnalysisDocument> document, Optional<RequiredFieldsIndex> index) {
            this.document = document;
            this.index = index;
        }
    }
}
