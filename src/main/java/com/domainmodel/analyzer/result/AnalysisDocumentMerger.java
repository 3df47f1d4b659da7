package com.domainmodel.analyzer.result;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Merges documents produced for several source sets into one.
 *
 * Documents are applied in order; a call-site entry with the same key as an
 * earlier one replaces it. The result carries the latest timestamp and the
 * version of the document that had it.
 */
public class AnalysisDocumentMerger {

    private static final Comparator<AnalysisDocument> BY_TIMESTAMP =
            Comparator.comparing(d -> parseTimestamp(d.getTimestamp()).orElse(Instant.EPOCH));

    public AnalysisDocument merge(List<AnalysisDocument> documents) {
        Map<String, AggregateRootEntry> callGraph = new TreeMap<>();

        for (AnalysisDocument document : documents) {
            if (document.getCallGraph() == null) {
                continue;
            }
            document.getCallGraph().forEach((aggregateRoot, rootEntry) -> {
                if (rootEntry == null || rootEntry.getMethods() == null) {
                    return;
                }
                AggregateRootEntry target = callGraph.computeIfAbsent(aggregateRoot,
                        k -> AggregateRootEntry.builder().build());
                rootEntry.getMethods().forEach((methodKey, methodEntry) -> {
                    if (methodEntry == null || methodEntry.getCalls() == null) {
                        return;
                    }
                    RepositoryMethodEntry targetMethod = target.getMethods().computeIfAbsent(methodKey,
                            k -> RepositoryMethodEntry.builder().build());
                    targetMethod.getCalls().putAll(methodEntry.getCalls());
                });
            });
        }

        Optional<AnalysisDocument> latest = documents.stream().max(BY_TIMESTAMP);
        return AnalysisDocument.builder()
                .version(latest.map(AnalysisDocument::getVersion).orElse(AnalysisDocument.CURRENT_VERSION))
                .timestamp(latest.map(AnalysisDocument::getTimestamp).orElse(null))
                .callGraph(callGraph)
                .build();
    }

    private static Optional<Instant> parseTimestamp(String timestamp) {
        if (timestamp == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(Instant.parse(timestamp));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
