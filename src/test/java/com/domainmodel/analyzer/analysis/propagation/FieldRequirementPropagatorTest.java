package com.domainmodel.analyzer.analysis.propagation;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.domainmodel.analyzer.analysis.callgraph.CallGraph;
import com.domainmodel.analyzer.analysis.callgraph.CallGraphBuilder;
import com.domainmodel.analyzer.analysis.classifier.MethodFactsRegistry;
import com.domainmodel.analyzer.analysis.classifier.PropertyAccessClassifier;
import com.domainmodel.analyzer.analysis.repository.RepositoryRegistry;
import com.domainmodel.analyzer.diagnostics.AnalysisIssue;
import com.domainmodel.analyzer.diagnostics.IssueKind;
import com.domainmodel.analyzer.model.CalledAggregateMethod;
import com.domainmodel.analyzer.model.FieldRequirement;
import com.domainmodel.analyzer.model.MethodId;
import com.domainmodel.analyzer.model.RepositoryCallSite;
import com.domainmodel.analyzer.model.RepositoryMapping;
import com.domainmodel.analyzer.model.RepositoryMatchKind;
import com.domainmodel.analyzer.stream.ClassInstructions;
import com.domainmodel.analyzer.stream.MethodInstructions;

import static com.domainmodel.analyzer.stream.TestStreams.*;
import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for FieldRequirementPropagator.
 */
class FieldRequirementPropagatorTest {

    private static final String GOODS = "com.shop.Goods";
    private static final String REPO = "com.shop.GoodsRepository";
    private static final String HANDLER = "com.shop.GoodsHandler";
    private static final String FIND = "(J)Lcom/shop/Goods;";

    @Test
    void testCallerPlusAggregateMethod() {
        ClassInstructions goods = cls(GOODS,
                method("changeAddress", "(Ljava/lang/String;)V",
                        read(GOODS, "name"),
                        write(GOODS, "nowAddress1")));
        ClassInstructions handler = cls(HANDLER,
                method("handle", "(JLjava/lang/String;)V",
                        line(10),
                        call(REPO, "findByIdOrErr", FIND),
                        line(11),
                        call(GOODS, "changeAddress", "(Ljava/lang/String;)V")));

        FieldRequirement requirement = propagate(PropagationConfig.defaults(), goods, handler).getRequirement();

        assertThat(requirement.getRequiredFields()).containsExactly("name", "nowAddress1");
        assertThat(requirement.isTruncated()).isFalse();
        assertThat(requirement.getCalledMethods()).singleElement().satisfies(called -> {
            assertThat(called.getMethod()).isEqualTo(MethodId.of(GOODS, "changeAddress", "(Ljava/lang/String;)V"));
            assertThat(called.getRequiredFields()).containsExactly("name", "nowAddress1");
        });
    }

    @Test
    void testCallerGetterContributes() {
        ClassInstructions goods = cls(GOODS, method("getName", "()Ljava/lang/String;", read(GOODS, "name")));
        ClassInstructions handler = cls(HANDLER,
                method("handle", "(J)V",
                        call(REPO, "findByIdOrErr", FIND),
                        call(GOODS, "getName", "()Ljava/lang/String;"),
                        call(GOODS, "getStock", "()I")));

        FieldRequirement requirement = propagate(PropagationConfig.defaults(), goods, handler).getRequirement();

        // getStock is not declared by an analyzed class, but the getter call itself is a GET on Goods
        assertThat(requirement.getRequiredFields()).containsExactly("name", "stock");
        assertThat(requirement.getCalledMethods()).extracting(CalledAggregateMethod::getMethod)
                .containsExactly(MethodId.of(GOODS, "getName", "()Ljava/lang/String;"));
    }

    @Test
    void testSetterMethodsExcludedByDefault() {
        ClassInstructions goods = cls(GOODS, method("setName", "(Ljava/lang/String;)V", write(GOODS, "name")));
        ClassInstructions handler = cls(HANDLER,
                method("rename", "(J)V",
                        call(REPO, "findByIdOrErr", FIND),
                        call(GOODS, "setName", "(Ljava/lang/String;)V")));

        PropagationOutcome excluded = propagate(PropagationConfig.defaults(), goods, handler);
        PropagationOutcome included = propagate(
                PropagationConfig.builder().excludeSetterMethods(false).build(), goods, handler);

        assertThat(excluded.getRequirement().getRequiredFields()).isEmpty();
        assertThat(excluded.getRequirement().getCalledMethods()).isEmpty();
        assertThat(included.getRequirement().getRequiredFields()).containsExactly("name");
    }

    @Test
    void testMutualRecursionIsCut() {
        ClassInstructions goods = cls(GOODS,
                method("a", "()V", read(GOODS, "x"), call(GOODS, "b", "()V")),
                method("b", "()V", read(GOODS, "y"), call(GOODS, "a", "()V")));
        ClassInstructions handler = cls(HANDLER,
                method("handle", "()V",
                        call(REPO, "findByIdOrErr", FIND),
                        call(GOODS, "a", "()V")));

        PropagationOutcome outcome = propagate(PropagationConfig.defaults(), goods, handler);

        assertThat(outcome.getRequirement().getRequiredFields()).containsExactly("x", "y");
        assertThat(outcome.getRequirement().isTruncated()).isTrue();
        assertThat(outcome.getIssues()).extracting(AnalysisIssue::getKind)
                .containsExactly(IssueKind.PROPAGATION_CYCLE_DETECTED);
    }

    @Test
    void testDepthBound() {
        ClassInstructions goods = cls(GOODS,
                method("m1", "()V", read(GOODS, "f1"), call(GOODS, "m2", "()V")),
                method("m2", "()V", read(GOODS, "f2"), call(GOODS, "m3", "()V")),
                method("m3", "()V", read(GOODS, "f3"), call(GOODS, "m4", "()V")),
                method("m4", "()V", read(GOODS, "f4")));
        ClassInstructions handler = cls(HANDLER,
                method("handle", "()V",
                        call(REPO, "findByIdOrErr", FIND),
                        call(GOODS, "m1", "()V")));

        PropagationOutcome outcome = propagate(PropagationConfig.builder().maxRecursionDepth(3).build(), goods, handler);

        assertThat(outcome.getRequirement().getRequiredFields()).containsExactly("f1", "f2", "f3");
        assertThat(outcome.getRequirement().isTruncated()).isTrue();
        assertThat(outcome.getIssues()).singleElement()
                .extracting(AnalysisIssue::getKind)
                .isEqualTo(IssueKind.PROPAGATION_DEPTH_EXCEEDED);
    }

    @Test
    void testSelfRecursionWithoutCycleDetectionStopsAtDepth() {
        ClassInstructions goods = cls(GOODS,
                method("rebalance", "(I)V", read(GOODS, "stock"), call(GOODS, "rebalance", "(I)V")));
        ClassInstructions handler = cls(HANDLER,
                method("restock", "(J)V",
                        call(REPO, "findByIdOrErr", FIND),
                        call(GOODS, "rebalance", "(I)V")));

        PropagationOutcome outcome = propagate(
                PropagationConfig.builder().enableCycleDetection(false).maxRecursionDepth(5).build(), goods, handler);

        assertThat(outcome.getRequirement().getRequiredFields()).containsExactly("stock");
        assertThat(outcome.getIssues()).extracting(AnalysisIssue::getKind)
                .containsExactly(IssueKind.PROPAGATION_DEPTH_EXCEEDED);
    }

    @Test
    void testSelfRecursionWithCycleDetection() {
        ClassInstructions goods = cls(GOODS,
                method("rebalance", "(I)V", read(GOODS, "stock"), call(GOODS, "rebalance", "(I)V")));
        ClassInstructions handler = cls(HANDLER,
                method("restock", "(J)V",
                        call(REPO, "findByIdOrErr", FIND),
                        call(GOODS, "rebalance", "(I)V")));

        PropagationOutcome outcome = propagate(PropagationConfig.defaults(), goods, handler);

        assertThat(outcome.getRequirement().getRequiredFields()).containsExactly("stock");
        assertThat(outcome.getIssues()).extracting(AnalysisIssue::getKind)
                .containsExactly(IssueKind.PROPAGATION_CYCLE_DETECTED);
    }

    @Test
    void testDiamondIsNotACycle() {
        ClassInstructions goods = cls(GOODS,
                method("top", "()V", call(GOODS, "left", "()V"), call(GOODS, "right", "()V")),
                method("left", "()V", read(GOODS, "l"), call(GOODS, "bottom", "()V")),
                method("right", "()V", read(GOODS, "r"), call(GOODS, "bottom", "()V")),
                method("bottom", "()V", read(GOODS, "b")));
        ClassInstructions handler = cls(HANDLER,
                method("handle", "()V",
                        call(REPO, "findByIdOrErr", FIND),
                        call(GOODS, "top", "()V")));

        PropagationOutcome outcome = propagate(PropagationConfig.defaults(), goods, handler);

        assertThat(outcome.getRequirement().getRequiredFields()).containsExactly("b", "l", "r");
        assertThat(outcome.getRequirement().isTruncated()).isFalse();
        assertThat(outcome.getIssues()).isEmpty();
    }

    @Test
    void testForeignOwnedAccessesAndCalleesAreIgnored() {
        ClassInstructions goods = cls(GOODS,
                method("ship", "()V",
                        read(GOODS, "address"),
                        call("com.shop.Address", "getCity", "()Ljava/lang/String;"),
                        call("com.shop.Address", "format", "()V")));
        ClassInstructions address = cls("com.shop.Address",
                method("format", "()V", read("com.shop.Address", "zip")));
        ClassInstructions handler = cls(HANDLER,
                method("handle", "()V",
                        call(REPO, "findByIdOrErr", FIND),
                        call("com.shop.Address", "getStreet", "()Ljava/lang/String;"),
                        call(GOODS, "ship", "()V")));

        FieldRequirement requirement = propagate(PropagationConfig.defaults(), goods, address, handler).getRequirement();

        assertThat(requirement.getRequiredFields()).containsExactly("address");
    }

    @Test
    void testCallSiteWithoutAggregateInteraction() {
        ClassInstructions handler = cls(HANDLER,
                method("exists", "(J)Z", call(REPO, "findByIdOrErr", FIND)));

        PropagationOutcome outcome = propagate(PropagationConfig.defaults(), handler);

        assertThat(outcome.getRequirement().getRequiredFields()).isEmpty();
        assertThat(outcome.getRequirement().getCalledMethods()).isEmpty();
        assertThat(outcome.getIssues()).isEmpty();
    }

    private static PropagationOutcome propagate(PropagationConfig config, ClassInstructions... classes) {
        RepositoryRegistry registry = RepositoryRegistry.of(
                List.of(new RepositoryMapping(GOODS, REPO, RepositoryMatchKind.GENERIC_INTERFACE)), List.of());
        PropertyAccessClassifier classifier = new PropertyAccessClassifier();
        MethodFactsRegistry.Builder facts = MethodFactsRegistry.builder();
        CallGraphBuilder graphBuilder = new CallGraphBuilder(registry);
        for (ClassInstructions cls : classes) {
            for (MethodInstructions m : cls.getMethods()) {
                facts.register(classifier.classify(cls.getClassName(), m));
            }
            graphBuilder.addClass(cls);
        }
        CallGraph graph = graphBuilder.build();
        RepositoryCallSite site = graph.getRepositoryCallSites().get(0);

        return new FieldRequirementPropagator(config, graph, facts.build()).propagate(site);
    }
}
