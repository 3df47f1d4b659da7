package com.domainmodel.analyzer.stream;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * A (possibly parameterized) type as declared in a generic signature,
 * e.g. {@code DomainRepository<Order>}.
 */
@Value
@Builder(toBuilder = true)
public class TypeReference {

    /** Qualified raw type name, or the variable name when {@link #typeVariable} is set. */
    @NonNull
    String rawType;

    @Singular
    List<TypeReference> typeArguments;

    boolean typeVariable;

    public static TypeReference of(String rawType) {
        return TypeReference.builder().rawType(rawType).build();
    }

    public static TypeReference variable(String name) {
        return TypeReference.builder().rawType(name).typeVariable(true).build();
    }

    @Override
    public String toString() {
        if (typeArguments.isEmpty()) {
            return rawType;
        }
        StringBuilder sb = new StringBuilder(rawType).append('<');
        for (int i = 0; i < typeArguments.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(typeArguments.get(i));
        }
        return sb.append('>').toString();
    }
}
