package com.domainmodel.analyzer.stream;

import java.lang.reflect.Modifier;
import java.util.List;
import java.util.Optional;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Everything the analysis needs to know about one compiled class: identity,
 * modifiers, supertypes (raw and generic), annotations and method streams.
 */
@Value
@Builder(toBuilder = true)
public class ClassInstructions {

    /** Qualified, dot-separated class name. */
    @NonNull
    String className;

    int access;

    String superName;

    @Singular("anInterface")
    List<String> interfaces;

    /** Raw generic signature as declared, if any. */
    String genericSignature;

    /** Superclass and interfaces with their type arguments, parsed from the generic signature. */
    @Singular
    List<TypeReference> genericSupertypes;

    @Singular
    List<AnnotationInfo> annotations;

    @Singular
    List<MethodInstructions> methods;

    public Optional<String> getGenericSignature() {
        return Optional.ofNullable(genericSignature);
    }

    public boolean isInterface() {
        return Modifier.isInterface(access);
    }

    public String getSimpleName() {
        int dot = Math.max(className.lastIndexOf('.'), className.lastIndexOf('$'));
        return dot < 0 ? className : className.substring(dot + 1);
    }

    public String getPackageName() {
        int dot = className.lastIndexOf('.');
        return dot < 0 ? "" : className.substring(0, dot);
    }

    public Optional<AnnotationInfo> findAnnotation(String nameOrSimpleName) {
        return annotations.stream()
                .filter(a -> a.getName().equals(nameOrSimpleName) || a.getSimpleName().equals(nameOrSimpleName))
                .findFirst();
    }
}
