package com.domainmodel.analyzer.bytecode;

import java.util.List;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for ClassNameFilter.
 */
class ClassNameFilterTest {

    @Test
    void testDefaults() {
        ClassNameFilter filter = ClassNameFilter.defaults();

        assertThat(filter.accept("com.shop.Order")).isTrue();
        assertThat(filter.accept("com.shop.test.OrderFixture")).isFalse();
        assertThat(filter.accept("com.shop.tests.OrderFixture")).isFalse();
        assertThat(filter.accept("com.shop.testing.Order")).isTrue();
    }

    @Test
    void testBuiltInExclusions() {
        ClassNameFilter filter = new ClassNameFilter(List.of("**"), List.of());

        assertThat(filter.accept("com.shop.Order$$EnhancerBySpringCGLIB$$1")).isFalse();
        assertThat(filter.accept("com.shop.OrderService$lambda$1")).isFalse();
        assertThat(filter.accept("com.shop.package-info")).isFalse();
        assertThat(filter.accept("module-info")).isFalse();
        assertThat(filter.accept("java.lang.String")).isFalse();
        assertThat(filter.accept("kotlin.collections.CollectionsKt")).isFalse();
        assertThat(filter.accept("org.springframework.data.Repository")).isFalse();
        assertThat(filter.accept("com.shop.Order$Line")).isTrue();
    }

    @Test
    void testSingleStarStaysInPackage() {
        ClassNameFilter filter = new ClassNameFilter(List.of("com.shop.*"), List.of());

        assertThat(filter.accept("com.shop.Order")).isTrue();
        assertThat(filter.accept("com.shop.domain.Order")).isFalse();
    }

    @Test
    void testDoubleStarCrossesPackages() {
        ClassNameFilter filter = new ClassNameFilter(List.of("com.shop.**"), List.of("**.internal.**"));

        assertThat(filter.accept("com.shop.domain.Order")).isTrue();
        assertThat(filter.accept("com.shop.internal.Cache")).isFalse();
        assertThat(filter.accept("org.other.Order")).isFalse();
    }

    @Test
    void testEmptyIncludesMeanEverything() {
        assertThat(new ClassNameFilter(List.of(), null).accept("com.shop.Order")).isTrue();
        assertThat(new ClassNameFilter(null, null).accept("com.shop.test.Order")).isTrue();
    }

    @Test
    void testRegex() {
        assertThat(ClassNameFilter.toRegex("com.*.Order$Line").pattern()).isEqualTo("com\\.[^.]*\\.Order\\$Line");
    }
}
