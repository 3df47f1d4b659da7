package com.domainmodel.analyzer.model;

import java.util.Optional;

import lombok.NonNull;
import lombok.Value;

/**
 * A classified read or write of a named property. Equality covers all three
 * components, so a GET and a SET of the same property are distinct.
 */
@Value
public class PropertyAccess {

    @NonNull
    String propertyName;

    @NonNull
    AccessKind kind;

    String ownerClass;

    public static PropertyAccess get(String propertyName, String ownerClass) {
        return new PropertyAccess(propertyName, AccessKind.GET, ownerClass);
    }

    public static PropertyAccess set(String propertyName, String ownerClass) {
        return new PropertyAccess(propertyName, AccessKind.SET, ownerClass);
    }

    public Optional<String> getOwnerClass() {
        return Optional.ofNullable(ownerClass);
    }

    /** True when the access has no owner or is owned by {@code className}. */
    public boolean isOwnedByOrUnowned(String className) {
        return ownerClass == null || ownerClass.equals(className);
    }

    public boolean isRead() {
        return kind == AccessKind.GET;
    }
}
