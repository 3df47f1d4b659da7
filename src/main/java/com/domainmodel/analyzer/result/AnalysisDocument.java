package com.domainmodel.analyzer.result;

import java.util.Map;
import java.util.TreeMap;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Persisted analysis result: aggregate root -> repository method -> call site.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({ "version", "timestamp", "callGraph" })
public class AnalysisDocument {

    public static final String CURRENT_VERSION = "1.0";

    private String version;

    /** ISO-8601 instant of the run that produced the document. */
    private String timestamp;

    @Builder.Default
    private Map<String, AggregateRootEntry> callGraph = new TreeMap<>();
}
