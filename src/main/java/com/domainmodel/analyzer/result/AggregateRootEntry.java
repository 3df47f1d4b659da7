package com.domainmodel.analyzer.result;

import java.util.Map;
import java.util.TreeMap;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Repository methods of one aggregate root, keyed by method name plus descriptor.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class AggregateRootEntry {

    @Builder.Default
    private Map<String, RepositoryMethodEntry> methods = new TreeMap<>();
}
