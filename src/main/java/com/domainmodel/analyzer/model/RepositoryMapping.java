package com.domainmodel.analyzer.model;

import lombok.NonNull;
import lombok.Value;

@Value
public class RepositoryMapping {

    @NonNull
    String aggregateRootClass;

    @NonNull
    String repositoryClass;

    @NonNull
    RepositoryMatchKind matchKind;
}
