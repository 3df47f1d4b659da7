package com.domainmodel.analyzer.analysis.repository;

import java.util.List;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * How repositories are recognized. Interface and annotation names may be given
 * qualified or simple; templates use {@code {Aggregate}} as the placeholder for
 * the aggregate root's simple name.
 */
@Value
@Builder(toBuilder = true)
public class RepositoryIdentificationConfig {

    public static final String AGGREGATE_PLACEHOLDER = "{Aggregate}";

    public static final List<String> DEFAULT_NAMING_TEMPLATES =
            List.of("{Aggregate}Repository", "I{Aggregate}Repository", "{Aggregate}Repo");

    public static final List<String> DEFAULT_MARKER_INTERFACES = List.of("DomainRepository");

    public static final List<String> DEFAULT_REPOSITORY_ANNOTATIONS = List.of("DomainRepository");

    @Singular
    List<String> markerInterfaces;

    @Singular
    List<String> repositoryAnnotations;

    @Singular
    List<String> namingTemplates;

    public static RepositoryIdentificationConfig defaults() {
        return RepositoryIdentificationConfig.builder()
                .markerInterfaces(DEFAULT_MARKER_INTERFACES)
                .repositoryAnnotations(DEFAULT_REPOSITORY_ANNOTATIONS)
                .namingTemplates(DEFAULT_NAMING_TEMPLATES)
                .build();
    }
}
