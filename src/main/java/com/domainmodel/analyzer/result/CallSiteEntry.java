package com.domainmodel.analyzer.result;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({ "methodClass", "method", "methodDescriptor", "repository", "repositoryMethod",
        "repositoryMethodDescriptor", "aggregateRoot", "calledAggregateRootMethod", "requiredFields" })
public class CallSiteEntry {

    /** Caller class. */
    private String methodClass;
    /** Caller method name. */
    private String method;
    private String methodDescriptor;

    private String repository;
    private String repositoryMethod;
    private String repositoryMethodDescriptor;

    private String aggregateRoot;

    @Builder.Default
    private List<CalledMethodEntry> calledAggregateRootMethod = new ArrayList<>();

    /** Sorted. */
    @Builder.Default
    private List<String> requiredFields = new ArrayList<>();
}
