package com.domainmodel.analyzer.bytecode;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.domainmodel.analyzer.stream.TypeReference;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for GenericSignatureParser.
 */
class GenericSignatureParserTest {

    @Test
    void testParameterizedInterface() {
        List<TypeReference> supertypes = GenericSignatureParser.parseSupertypes(
                "Ljava/lang/Object;Lcom/shop/DomainRepository<Lcom/shop/Order;>;");

        assertThat(supertypes).hasSize(2);
        assertThat(supertypes.get(0).getRawType()).isEqualTo("java.lang.Object");
        TypeReference repo = supertypes.get(1);
        assertThat(repo.getRawType()).isEqualTo("com.shop.DomainRepository");
        assertThat(repo.getTypeArguments()).singleElement().satisfies(arg -> {
            assertThat(arg.getRawType()).isEqualTo("com.shop.Order");
            assertThat(arg.isTypeVariable()).isFalse();
        });
    }

    @Test
    void testTypeVariableArgument() {
        List<TypeReference> supertypes = GenericSignatureParser.parseSupertypes(
                "<T:Ljava/lang/Object;>Ljava/lang/Object;Lcom/shop/DomainRepository<TT;>;");

        assertThat(supertypes).extracting(TypeReference::getRawType)
                .containsExactly("java.lang.Object", "com.shop.DomainRepository");
        assertThat(supertypes.get(1).getTypeArguments()).singleElement()
                .satisfies(arg -> assertThat(arg.isTypeVariable()).isTrue());
    }

    @Test
    void testNestedArguments() {
        List<TypeReference> supertypes = GenericSignatureParser.parseSupertypes(
                "Ljava/lang/Object;Ljava/util/Map<Ljava/lang/String;Ljava/util/List<Lcom/shop/Order;>;>;");

        assertThat(supertypes.get(1)).hasToString("java.util.Map<java.lang.String, java.util.List<com.shop.Order>>");
    }

    @Test
    void testWildcardAndArrayArguments() {
        List<TypeReference> supertypes = GenericSignatureParser.parseSupertypes(
                "Ljava/lang/Object;Lcom/shop/Box<*[I>;");

        assertThat(supertypes.get(1).getTypeArguments()).extracting(TypeReference::getRawType)
                .containsExactly("?", "I[]");
    }

    @Test
    void testInnerClass() {
        List<TypeReference> supertypes = GenericSignatureParser.parseSupertypes(
                "Lcom/shop/Outer<Lcom/shop/Order;>.Inner<Lcom/shop/Customer;>;");

        assertThat(supertypes).singleElement().hasToString("com.shop.Outer$Inner<com.shop.Customer>");
    }

    @Test
    void testNoSignature() {
        assertThat(GenericSignatureParser.parseSupertypes(null)).isEmpty();
        assertThat(GenericSignatureParser.parseSupertypes("")).isEmpty();
    }
}
