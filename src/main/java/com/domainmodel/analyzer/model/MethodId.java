package com.domainmodel.analyzer.model;

import lombok.NonNull;
import lombok.Value;

/**
 * Identity of a method: owner, name and JVM descriptor. The descriptor
 * disambiguates overloads.
 */
@Value
public class MethodId implements Comparable<MethodId> {

    @NonNull
    String ownerClass;

    @NonNull
    String name;

    @NonNull
    String descriptor;

    public static MethodId of(String ownerClass, String name, String descriptor) {
        return new MethodId(ownerClass, name, descriptor);
    }

    /** Name plus descriptor, e.g. {@code findById(J)Lcom/x/Order;}. */
    public String key() {
        return name + descriptor;
    }

    public MethodId withOwner(String owner) {
        return new MethodId(owner, name, descriptor);
    }

    @Override
    public int compareTo(MethodId o) {
        int c = ownerClass.compareTo(o.ownerClass);
        if (c != 0) return c;
        c = name.compareTo(o.name);
        return c != 0 ? c : descriptor.compareTo(o.descriptor);
    }

    @Override
    public String toString() {
        return ownerClass + "." + name + descriptor;
    }
}
