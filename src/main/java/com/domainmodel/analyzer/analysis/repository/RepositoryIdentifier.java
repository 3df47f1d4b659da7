package com.domainmodel.analyzer.analysis.repository;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.domainmodel.analyzer.diagnostics.AnalysisIssue;
import com.domainmodel.analyzer.diagnostics.IssueKind;
import com.domainmodel.analyzer.model.RepositoryMapping;
import com.domainmodel.analyzer.model.RepositoryMatchKind;
import com.domainmodel.analyzer.stream.AnnotationInfo;
import com.domainmodel.analyzer.stream.ClassInstructions;
import com.domainmodel.analyzer.stream.TypeReference;
import com.domainmodel.analyzer.util.NamingUtil;

import lombok.RequiredArgsConstructor;

/**
 * Decides whether a class is a repository and for which aggregate root.
 *
 * Strategies in precedence order:
 * <ol>
 *   <li>{@link RepositoryMatchKind#GENERIC_INTERFACE}: a marker interface with a single concrete type argument</li>
 *   <li>{@link RepositoryMatchKind#ANNOTATION}: a repository annotation naming its target type</li>
 *   <li>{@link RepositoryMatchKind#NAMING_CONVENTION}: a naming template matched against a known aggregate root</li>
 * </ol>
 * A class maps to at most one aggregate root.
 */
@RequiredArgsConstructor
public class RepositoryIdentifier {

    private static final Logger log = LoggerFactory.getLogger(RepositoryIdentifier.class);

    private static final Set<String> NON_AGGREGATE_TARGETS =
            Set.of("java.lang.Object", "kotlin.Any", "java.lang.Void", "void");

    private final RepositoryIdentificationConfig config;

    public RepositoryIdentification identify(ClassInstructions cls, Set<String> knownAggregateRoots) {
        Map<RepositoryMatchKind, String> candidates = new EnumMap<>(RepositoryMatchKind.class);
        matchGenericInterface(cls).ifPresent(t -> candidates.put(RepositoryMatchKind.GENERIC_INTERFACE, t));
        matchAnnotation(cls, knownAggregateRoots).ifPresent(t -> candidates.put(RepositoryMatchKind.ANNOTATION, t));
        matchNamingConvention(cls, knownAggregateRoots).ifPresent(t -> candidates.put(RepositoryMatchKind.NAMING_CONVENTION, t));

        if (candidates.isEmpty()) {
            return RepositoryIdentification.none();
        }

        // EnumMap iterates in declaration order, which is precedence order
        Map.Entry<RepositoryMatchKind, String> winner = candidates.entrySet().iterator().next();
        RepositoryMapping mapping = new RepositoryMapping(winner.getValue(), cls.getClassName(), winner.getKey());
        log.debug("Repository {} -> {} ({})", cls.getClassName(), winner.getValue(), winner.getKey());

        if (candidates.size() == 1) {
            return new RepositoryIdentification(mapping, List.of());
        }

        String matched = candidates.entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(", "));
        AnalysisIssue ambiguity = AnalysisIssue.of(IssueKind.REPOSITORY_AMBIGUITY, cls.getClassName(),
                "Several strategies matched (" + matched + "); using " + winner.getKey() + " -> " + winner.getValue());
        return new RepositoryIdentification(mapping, List.of(ambiguity));
    }

    Optional<String> matchGenericInterface(ClassInstructions cls) {
        for (TypeReference supertype : cls.getGenericSupertypes()) {
            if (!isConfiguredName(supertype.getRawType(), config.getMarkerInterfaces())) {
                continue;
            }
            if (supertype.getTypeArguments().size() != 1) {
                continue;
            }
            TypeReference argument = supertype.getTypeArguments().get(0);
            if (argument.isTypeVariable() || NON_AGGREGATE_TARGETS.contains(argument.getRawType())) {
                continue;
            }
            return Optional.of(argument.getRawType());
        }
        return Optional.empty();
    }

    Optional<String> matchAnnotation(ClassInstructions cls, Set<String> knownAggregateRoots) {
        for (AnnotationInfo annotation : cls.getAnnotations()) {
            if (!isConfiguredName(annotation.getName(), config.getRepositoryAnnotations())) {
                continue;
            }
            Optional<String> target = annotation.argument("targetType")
                    .or(() -> annotation.argument("value"))
                    .map(String::trim)
                    .filter(t -> !t.isEmpty() && !NON_AGGREGATE_TARGETS.contains(t));
            if (target.isEmpty()) {
                continue;
            }
            String name = target.get();
            if (name.indexOf('.') >= 0) {
                return Optional.of(name);
            }
            // Simple name given; resolve against known aggregates
            Optional<String> resolved = knownAggregateRoots.stream()
                    .filter(a -> NamingUtil.simpleName(a).equals(name))
                    .sorted()
                    .findFirst();
            if (resolved.isPresent()) {
                return resolved;
            }
        }
        return Optional.empty();
    }

    Optional<String> matchNamingConvention(ClassInstructions cls, Set<String> knownAggregateRoots) {
        String simpleName = cls.getSimpleName();
        for (String template : config.getNamingTemplates()) {
            Optional<String> match = knownAggregateRoots.stream()
                    .filter(a -> expandTemplate(template, a).equals(simpleName))
                    .sorted()
                    .findFirst();
            if (match.isPresent()) {
                return match;
            }
        }
        return Optional.empty();
    }

    private static String expandTemplate(String template, String aggregateRoot) {
        return template.replace(RepositoryIdentificationConfig.AGGREGATE_PLACEHOLDER, NamingUtil.simpleName(aggregateRoot));
    }

    private static boolean isConfiguredName(String actual, List<String> configured) {
        String simple = NamingUtil.simpleName(actual);
        return configured.stream().anyMatch(c -> c.equals(actual) || c.equals(simple));
    }
}
