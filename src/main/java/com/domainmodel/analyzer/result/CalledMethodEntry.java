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
@JsonPropertyOrder({ "aggregateRootMethod", "aggregateRootMethodDescriptor", "requiredFields" })
public class CalledMethodEntry {

    private String aggregateRootMethod;
    private String aggregateRootMethodDescriptor;

    @Builder.Default
    private List<String> requiredFields = new ArrayList<>();
}
