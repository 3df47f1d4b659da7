package com.domainmodel.analyzer.stream;

import java.util.Map;
import java.util.Optional;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Plain annotation name plus its arguments. Class-valued arguments are given
 * as qualified class names, arrays as comma-separated values.
 */
@Value
@Builder(toBuilder = true)
public class AnnotationInfo {

    @NonNull
    String name;

    @Singular
    Map<String, String> arguments;

    public Optional<String> argument(String key) {
        return Optional.ofNullable(arguments.get(key));
    }

    public String getSimpleName() {
        int dot = Math.max(name.lastIndexOf('.'), name.lastIndexOf('$'));
        return dot < 0 ? name : name.substring(dot + 1);
    }
}
