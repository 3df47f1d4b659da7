package com.domainmodel.analyzer.result;

import java.util.Map;
import java.util.TreeMap;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Call sites of one repository method, keyed by {@code callerClass.callerMethod+start-end}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class RepositoryMethodEntry {

    @Builder.Default
    private Map<String, CallSiteEntry> calls = new TreeMap<>();
}
