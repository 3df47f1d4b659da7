package com.domainmodel.analyzer.analysis.classifier;

import org.junit.jupiter.api.Test;

import com.domainmodel.analyzer.model.AccessKind;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for CallPatternConverter.
 */
class CallPatternConverterTest {

    private final CallPatternConverter converter = new CallPatternConverter();

    @Test
    void testSyntheticSetter() {
        assertThat(converter.convert("<set-status>", 1))
                .contains(new PropertyCallMatch("status", AccessKind.SET));
    }

    @Test
    void testSyntheticGetter() {
        assertThat(converter.convert("<get-status>", 0))
                .contains(new PropertyCallMatch("status", AccessKind.GET));
    }

    @Test
    void testSyntheticAccessorKeepsPropertyNameAsIs() {
        assertThat(converter.convert("<get-URL>", 0))
                .contains(new PropertyCallMatch("URL", AccessKind.GET));
    }

    @Test
    void testSyntheticAccessorWithInvalidNameIsNoMatch() {
        assertThat(converter.convert("<get->", 0)).isEmpty();
        assertThat(converter.convert("<set-1abc>", 1)).isEmpty();
        assertThat(converter.convert("<get-a.b>", 0)).isEmpty();
    }

    @Test
    void testBeanGetter() {
        assertThat(converter.convert("getName", 0))
                .contains(new PropertyCallMatch("name", AccessKind.GET));
    }

    @Test
    void testBooleanGetter() {
        assertThat(converter.convert("isActive", 0))
                .contains(new PropertyCallMatch("active", AccessKind.GET));
    }

    @Test
    void testBeanSetter() {
        assertThat(converter.convert("setName", 1))
                .contains(new PropertyCallMatch("name", AccessKind.SET));
    }

    @Test
    void testGetterWithArgumentsIsNoMatch() {
        assertThat(converter.convert("getName", 1)).isEmpty();
    }

    @Test
    void testSetterWithWrongArityIsNoMatch() {
        assertThat(converter.convert("setName", 0)).isEmpty();
        assertThat(converter.convert("setName", 2)).isEmpty();
    }

    @Test
    void testLowercaseAfterPrefixIsNoMatch() {
        assertThat(converter.convert("getaway", 0)).isEmpty();
        assertThat(converter.convert("settle", 1)).isEmpty();
        assertThat(converter.convert("island", 0)).isEmpty();
    }

    @Test
    void testBarePrefixesYieldNothing() {
        assertThat(converter.convert("get", 0)).isEmpty();
        assertThat(converter.convert("is", 0)).isEmpty();
        assertThat(converter.convert("set", 1)).isEmpty();
        assertThat(converter.convert("", 0)).isEmpty();
        assertThat(converter.convert(null, 0)).isEmpty();
    }

    @Test
    void testPlainMethodIsNoMatch() {
        assertThat(converter.convert("changeAddress", 1)).isEmpty();
    }

    @Test
    void testSetterPattern() {
        assertThat(converter.isSetterPattern("setName", 1)).isTrue();
        assertThat(converter.isSetterPattern("<set-name>", 1)).isTrue();
        assertThat(converter.isSetterPattern("getName", 0)).isFalse();
        assertThat(converter.isSetterPattern("setName", 2)).isFalse();
    }
}
