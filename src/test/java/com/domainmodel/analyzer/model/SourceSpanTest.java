package com.domainmodel.analyzer.model;

import java.util.Optional;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for SourceSpan and MethodId.
 */
class SourceSpanTest {

    @Test
    void testFormatAndParse() {
        assertThat(SourceSpan.format(Optional.of(SourceSpan.of(12, 10)))).isEqualTo("10-12");
        assertThat(SourceSpan.format(Optional.empty())).isEqualTo("unknown");
        assertThat(SourceSpan.parse("10-12")).contains(SourceSpan.of(10, 12));
        assertThat(SourceSpan.parse("unknown")).isEmpty();
        assertThat(SourceSpan.parse("a-b")).isEmpty();
        assertThat(SourceSpan.of(10, 12).contains(11)).isTrue();
    }

    @Test
    void testMethodIdOrderingAndKey() {
        MethodId load = MethodId.of("com.shop.Service", "load", "(J)V");
        MethodId loadByName = MethodId.of("com.shop.Service", "load", "(Ljava/lang/String;)V");

        assertThat(load.key()).isEqualTo("load(J)V");
        assertThat(load).isLessThan(loadByName);
        assertThat(load).hasToString("com.shop.Service.load(J)V");
        assertThat(load.withOwner("com.shop.Other").getOwnerClass()).isEqualTo("com.shop.Other");
    }
}
