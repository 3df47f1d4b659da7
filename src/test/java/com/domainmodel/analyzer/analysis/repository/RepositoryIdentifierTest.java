package com.domainmodel.analyzer.analysis.repository;

import java.util.Set;

import org.junit.jupiter.api.Test;

import com.domainmodel.analyzer.diagnostics.IssueKind;
import com.domainmodel.analyzer.diagnostics.Severity;
import com.domainmodel.analyzer.model.RepositoryMapping;
import com.domainmodel.analyzer.model.RepositoryMatchKind;
import com.domainmodel.analyzer.stream.AnnotationInfo;
import com.domainmodel.analyzer.stream.ClassInstructions;
import com.domainmodel.analyzer.stream.TypeReference;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for RepositoryIdentifier.
 */
class RepositoryIdentifierTest {

    private static final String MARKER = "com.shop.DomainRepository";
    private static final String ORDER = "com.shop.Order";
    private static final String CUSTOMER = "com.shop.Customer";

    private final RepositoryIdentifier identifier = new RepositoryIdentifier(RepositoryIdentificationConfig.defaults());

    @Test
    void testGenericInterfaceMatch() {
        ClassInstructions repo = ClassInstructions.builder()
                .className("com.shop.OrderStore")
                .genericSupertype(generic(MARKER, TypeReference.of(ORDER)))
                .build();

        RepositoryIdentification result = identifier.identify(repo, Set.of());

        assertThat(result.getMapping()).contains(
                new RepositoryMapping(ORDER, "com.shop.OrderStore", RepositoryMatchKind.GENERIC_INTERFACE));
        assertThat(result.getIssues()).isEmpty();
    }

    @Test
    void testGenericInterfaceWinsOverNamingConvention() {
        // OrderRepository : DomainRepository<Customer> with Order also a known root
        ClassInstructions repo = ClassInstructions.builder()
                .className("com.shop.OrderRepository")
                .genericSupertype(generic(MARKER, TypeReference.of(CUSTOMER)))
                .build();

        RepositoryIdentification result = identifier.identify(repo, Set.of(ORDER, CUSTOMER));

        assertThat(result.getMapping()).map(RepositoryMapping::getAggregateRootClass).contains(CUSTOMER);
        assertThat(result.getMapping()).map(RepositoryMapping::getMatchKind).contains(RepositoryMatchKind.GENERIC_INTERFACE);
        assertThat(result.getIssues()).singleElement().satisfies(issue -> {
            assertThat(issue.getKind()).isEqualTo(IssueKind.REPOSITORY_AMBIGUITY);
            assertThat(issue.getSeverity()).isEqualTo(Severity.INFO);
        });
    }

    @Test
    void testTypeVariableArgumentIsNotAMatch() {
        ClassInstructions repo = ClassInstructions.builder()
                .className("com.shop.BaseRepository")
                .genericSupertype(generic(MARKER, TypeReference.variable("T")))
                .build();

        assertThat(identifier.identify(repo, Set.of(ORDER)).getMapping()).isEmpty();
    }

    @Test
    void testObjectArgumentIsNotAMatch() {
        ClassInstructions repo = ClassInstructions.builder()
                .className("com.shop.AnyStore")
                .genericSupertype(generic(MARKER, TypeReference.of("java.lang.Object")))
                .build();

        assertThat(identifier.identify(repo, Set.of()).getMapping()).isEmpty();
    }

    @Test
    void testUnrelatedGenericInterfaceIsIgnored() {
        ClassInstructions repo = ClassInstructions.builder()
                .className("com.shop.OrderComparator")
                .genericSupertype(generic("java.util.Comparator", TypeReference.of(ORDER)))
                .build();

        assertThat(identifier.identify(repo, Set.of()).getMapping()).isEmpty();
    }

    @Test
    void testAnnotationWithQualifiedTarget() {
        ClassInstructions repo = ClassInstructions.builder()
                .className("com.shop.persistence.Orders")
                .annotation(AnnotationInfo.builder()
                        .name("com.shop.DomainRepository")
                        .argument("targetType", ORDER)
                        .build())
                .build();

        assertThat(identifier.identify(repo, Set.of()).getMapping()).contains(
                new RepositoryMapping(ORDER, "com.shop.persistence.Orders", RepositoryMatchKind.ANNOTATION));
    }

    @Test
    void testAnnotationWithSimpleNameResolvesAgainstKnownRoots() {
        ClassInstructions repo = ClassInstructions.builder()
                .className("com.shop.persistence.Orders")
                .annotation(AnnotationInfo.builder()
                        .name("DomainRepository")
                        .argument("value", "Order")
                        .build())
                .build();

        assertThat(identifier.identify(repo, Set.of(ORDER, CUSTOMER)).getMapping())
                .map(RepositoryMapping::getAggregateRootClass)
                .contains(ORDER);
        assertThat(identifier.identify(repo, Set.of(CUSTOMER)).getMapping()).isEmpty();
    }

    @Test
    void testNamingConventionTemplates() {
        Set<String> roots = Set.of(ORDER);

        assertThat(identifier.identify(named("com.shop.OrderRepository"), roots).getMapping())
                .map(RepositoryMapping::getMatchKind)
                .contains(RepositoryMatchKind.NAMING_CONVENTION);
        assertThat(identifier.identify(named("com.shop.IOrderRepository"), roots).getMapping()).isPresent();
        assertThat(identifier.identify(named("com.shop.OrderRepo"), roots).getMapping()).isPresent();
        assertThat(identifier.identify(named("com.shop.OrderService"), roots).getMapping()).isEmpty();
    }

    @Test
    void testNamingConventionNeedsKnownRoot() {
        assertThat(identifier.identify(named("com.shop.OrderRepository"), Set.of()).getMapping()).isEmpty();
    }

    @Test
    void testCustomTemplate() {
        RepositoryIdentifier custom = new RepositoryIdentifier(RepositoryIdentificationConfig.builder()
                .namingTemplate("{Aggregate}Dao")
                .build());

        assertThat(custom.identify(named("com.shop.OrderDao"), Set.of(ORDER)).getMapping())
                .map(RepositoryMapping::getAggregateRootClass)
                .contains(ORDER);
        assertThat(custom.identify(named("com.shop.OrderRepository"), Set.of(ORDER)).getMapping()).isEmpty();
    }

    @Test
    void testPlainClassIsNotARepository() {
        RepositoryIdentification result = identifier.identify(named("com.shop.Order"), Set.of(ORDER));

        assertThat(result.getMapping()).isEmpty();
        assertThat(result.getIssues()).isEmpty();
    }

    private static ClassInstructions named(String className) {
        return ClassInstructions.builder().className(className).build();
    }

    private static TypeReference generic(String raw, TypeReference argument) {
        return TypeReference.builder().rawType(raw).typeArgument(argument).build();
    }
}
