package com.domainmodel.analyzer.query;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.domainmodel.analyzer.model.FieldRequirement;
import com.domainmodel.analyzer.model.MethodId;
import com.domainmodel.analyzer.model.RepositoryCallSite;
import com.domainmodel.analyzer.model.SourceSpan;
import com.domainmodel.analyzer.result.AnalysisDocument;
import com.domainmodel.analyzer.result.AnalysisDocumentAssembler;
import com.domainmodel.analyzer.result.AnalysisDocumentSerializer;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for RequiredFieldsQuery.
 */
class RequiredFieldsQueryTest {

    private static final String GOODS = "com.shop.Goods";
    private static final String REPO = "com.shop.GoodsRepository";
    private static final String HANDLER = "com.shop.GoodsHandler";

    @TempDir
    Path tempDir;

    @Test
    void testLookupFromClasspathResource() {
        RequiredFieldsQuery query = new RequiredFieldsQuery();

        assertThat(query.isAnalysisAvailable()).isTrue();
        assertThat(query.getVersion()).contains("1.0");
        assertThat(query.getTimestamp()).contains("2024-03-01T10:15:30Z");
        assertThat(query.getRequiredFields(GOODS, HANDLER, "handle", "findByIdOrErr"))
                .containsExactly("name", "nowAddress1");
        assertThat(query.getRequiredFields(GOODS, HANDLER, "describe", null)).containsExactly("name");
    }

    @Test
    void testUnknownCallSiteIsEmpty() {
        RequiredFieldsQuery query = new RequiredFieldsQuery(AnalysisDocumentLoader.of(document()));

        assertThat(query.getRequiredFields(GOODS, HANDLER, "unknown", null)).isEmpty();
        assertThat(query.getRequiredFields(GOODS, "com.shop.Other", "handle", null)).isEmpty();
        assertThat(query.getRequiredFields("com.shop.Order", HANDLER, "handle", null)).isEmpty();
        assertThat(query.getRequiredFields(GOODS, HANDLER, "handle", "findAll")).isEmpty();
        assertThat(query.getRequiredFields(null, HANDLER, "handle", null)).isEmpty();
    }

    @Test
    void testOverloadsByNameAndByDescriptor() {
        RequiredFieldsQuery query = new RequiredFieldsQuery(AnalysisDocumentLoader.of(document()));

        assertThat(query.getRequiredFields(GOODS, HANDLER, "load", null)).containsExactly("id", "stock");
        assertThat(query.getRequiredFields(GOODS, HANDLER, "load(J)V", null)).containsExactly("id");
        assertThat(query.getRequiredFields(GOODS, HANDLER, "load(Ljava/lang/String;)V", null)).containsExactly("stock");
        assertThat(query.getRequiredFields(GOODS, HANDLER, "load", "findByIdOrErr(J)Lcom/shop/Goods;"))
                .containsExactly("id");
    }

    @Test
    void testByRepositoryMethod() {
        RequiredFieldsQuery query = new RequiredFieldsQuery(AnalysisDocumentLoader.of(document()));

        assertThat(query.getRequiredFieldsForRepositoryMethod(GOODS, "findByIdOrErr"))
                .containsExactly("id", "name", "nowAddress1");
        assertThat(query.getRequiredFieldsForRepositoryMethod(GOODS, "findByName")).containsExactly("stock");
    }

    @Test
    void testResultIsUnmodifiable() {
        RequiredFieldsQuery query = new RequiredFieldsQuery(AnalysisDocumentLoader.of(document()));
        Set<String> fields = query.getRequiredFields(GOODS, HANDLER, "handle", null);

        assertThatThrownBy(() -> fields.add("x")).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void testMissingDocument() {
        RequiredFieldsQuery query = new RequiredFieldsQuery(Optional::empty);

        assertThat(query.isAnalysisAvailable()).isFalse();
        assertThat(query.getRequiredFields(GOODS, HANDLER, "handle", null)).isEmpty();
        assertThat(query.getVersion()).isEmpty();
    }

    @Test
    void testMissingAndBrokenFiles() throws Exception {
        Path broken = tempDir.resolve("broken.json");
        Files.writeString(broken, "{ not json");

        assertThat(AnalysisDocumentLoader.fromFile(tempDir.resolve("absent.json")).load()).isEmpty();
        assertThat(AnalysisDocumentLoader.fromFile(broken).load()).isEmpty();
        assertThat(AnalysisDocumentLoader.fromClasspath("absent/resource.json", getClass().getClassLoader()).load())
                .isEmpty();
    }

    @Test
    void testLoadsOnceAndReloadsAfterClear() throws Exception {
        Path file = tempDir.resolve("call-analysis.json");
        new AnalysisDocumentSerializer().write(document(), file);
        AtomicInteger loads = new AtomicInteger();
        AnalysisDocumentLoader fileLoader = AnalysisDocumentLoader.fromFile(file);
        RequiredFieldsQuery query = new RequiredFieldsQuery(() -> {
            loads.incrementAndGet();
            return fileLoader.load();
        });

        query.getRequiredFields(GOODS, HANDLER, "handle", null);
        query.getRequiredFields(GOODS, HANDLER, "describe", null);
        assertThat(loads).hasValue(1);

        Files.delete(file);
        assertThat(query.getRequiredFields(GOODS, HANDLER, "handle", null)).isNotEmpty();

        query.clearCache();
        assertThat(query.getRequiredFields(GOODS, HANDLER, "handle", null)).isEmpty();
        assertThat(loads).hasValue(2);
    }

    @Test
    void testClearCacheServesAnswersFromSwappedDocument() {
        MethodId find = MethodId.of(REPO, "findByIdOrErr", "(J)Lcom/shop/Goods;");
        AnalysisDocument updated = new AnalysisDocumentAssembler().assemble(List.of(
                requirement(site(MethodId.of(HANDLER, "handle", "(J)V"), find, SourceSpan.of(10, 14)), "stock")),
                Instant.parse("2024-03-02T08:00:00Z"));
        AtomicReference<AnalysisDocument> current = new AtomicReference<>(document());
        RequiredFieldsQuery query = new RequiredFieldsQuery(() -> Optional.of(current.get()));

        assertThat(query.getRequiredFields(GOODS, HANDLER, "handle", null)).containsExactly("name", "nowAddress1");
        assertThat(query.getRequiredFieldsForRepositoryMethod(GOODS, "findByIdOrErr")).contains("name");

        current.set(updated);
        assertThat(query.getRequiredFields(GOODS, HANDLER, "handle", null)).containsExactly("name", "nowAddress1");

        query.clearCache();
        assertThat(query.getRequiredFields(GOODS, HANDLER, "handle", null)).containsExactly("stock");
        assertThat(query.getRequiredFieldsForRepositoryMethod(GOODS, "findByIdOrErr")).containsExactly("stock");
        assertThat(query.getTimestamp()).contains("2024-03-02T08:00:00Z");
    }

    @Test
    void testClassOverload() {
        RequiredFieldsQuery query = new RequiredFieldsQuery(AnalysisDocumentLoader.of(document()));

        assertThat(query.getRequiredFields(String.class, Integer.class, "handle", null)).isEmpty();
    }

    private static AnalysisDocument document() {
        MethodId find = MethodId.of(REPO, "findByIdOrErr", "(J)Lcom/shop/Goods;");
        MethodId findByName = MethodId.of(REPO, "findByName", "(Ljava/lang/String;)Lcom/shop/Goods;");
        return new AnalysisDocumentAssembler().assemble(List.of(
                requirement(site(MethodId.of(HANDLER, "handle", "(J)V"), find, SourceSpan.of(10, 12)), "name", "nowAddress1"),
                requirement(site(MethodId.of(HANDLER, "load", "(J)V"), find, SourceSpan.of(20, 22)), "id"),
                requirement(site(MethodId.of(HANDLER, "load", "(Ljava/lang/String;)V"), findByName, SourceSpan.of(30, 32)), "stock")),
                Instant.parse("2024-03-01T10:15:30Z"));
    }

    private static RepositoryCallSite site(MethodId caller, MethodId repositoryMethod, SourceSpan span) {
        return RepositoryCallSite.builder()
                .callerMethod(caller)
                .repositoryClass(REPO)
                .repositoryMethod(repositoryMethod)
                .aggregateRootClass(GOODS)
                .callerSpan(span)
                .build();
    }

    private static FieldRequirement requirement(RepositoryCallSite site, String... fields) {
        return FieldRequirement.builder()
                .callSite(site)
                .requiredFields(new TreeSet<>(List.of(fields)))
                .build();
    }
}
