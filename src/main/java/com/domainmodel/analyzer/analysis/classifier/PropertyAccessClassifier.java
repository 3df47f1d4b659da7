package com.domainmodel.analyzer.analysis.classifier;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.domainmodel.analyzer.diagnostics.AnalysisIssue;
import com.domainmodel.analyzer.diagnostics.IssueKind;
import com.domainmodel.analyzer.model.MethodId;
import com.domainmodel.analyzer.model.PropertyAccess;
import com.domainmodel.analyzer.stream.EventType;
import com.domainmodel.analyzer.stream.InstructionEvent;
import com.domainmodel.analyzer.stream.MethodInstructions;
import com.domainmodel.analyzer.util.NamingUtil;

import lombok.RequiredArgsConstructor;

/**
 * Classifies every property touch in one method body as GET or SET.
 *
 * Field events count only when they target the enclosing class; call events
 * go through {@link CallPatternConverter}. Branches are flattened: accesses in
 * conditions and in every branch body land in the same set. A compound update
 * arrives as a read followed by a write and both are kept.
 */
@RequiredArgsConstructor
public class PropertyAccessClassifier {

    private static final Logger log = LoggerFactory.getLogger(PropertyAccessClassifier.class);

    private final CallPatternConverter converter;

    public PropertyAccessClassifier() {
        this(new CallPatternConverter());
    }

    public ClassificationResult classify(String enclosingClass, MethodInstructions method) {
        MethodId methodId = MethodId.of(enclosingClass, method.getName(), method.getDescriptor());
        Set<PropertyAccess> accesses = new LinkedHashSet<>();
        List<AnalysisIssue> issues = new ArrayList<>();

        int index = 0;
        for (InstructionEvent event : method.getEvents()) {
            try {
                classifyEvent(enclosingClass, event).ifPresent(accesses::add);
            } catch (MalformedEventException e) {
                log.warn("Skipping event #{} in {}: {}", index, methodId, e.getMessage());
                issues.add(AnalysisIssue.of(IssueKind.CLASSIFICATION_ERROR, methodId.toString(),
                        "Event #" + index + " skipped: " + e.getMessage()));
            }
            index++;
        }

        return new ClassificationResult(methodId, List.copyOf(accesses), List.copyOf(issues));
    }

    private Optional<PropertyAccess> classifyEvent(String enclosingClass, InstructionEvent event)
            throws MalformedEventException {
        switch (event.getType()) {
            case FIELD_READ:
            case FIELD_WRITE: {
                String owner = requireOwner(event);
                String field = requireName(event);
                if (!owner.equals(enclosingClass)) {
                    return Optional.empty();
                }
                return Optional.of(event.getType() == EventType.FIELD_READ
                        ? PropertyAccess.get(field, owner)
                        : PropertyAccess.set(field, owner));
            }
            case CALL: {
                String owner = requireOwner(event);
                String name = requireName(event);
                return converter.convert(name, event.getArgTypes().size())
                        .map(m -> new PropertyAccess(m.propertyName(), m.kind(), owner));
            }
            default:
                return Optional.empty();
        }
    }

    private static String requireOwner(InstructionEvent event) throws MalformedEventException {
        String owner = event.getOwnerType();
        if (owner == null || owner.isBlank()) {
            throw new MalformedEventException(event.getType() + " without owner type");
        }
        for (String part : owner.split("\\.", -1)) {
            if (!NamingUtil.isIdentifier(part.replace("$", "_"))) {
                throw new MalformedEventException("malformed owner type '" + owner + "'");
            }
        }
        return owner;
    }

    private static String requireName(InstructionEvent event) throws MalformedEventException {
        String name = event.getName();
        if (name == null || name.isBlank()) {
            throw new MalformedEventException(event.getType() + " on " + event.getOwnerType() + " without a name");
        }
        return name;
    }

    private static class MalformedEventException extends Exception {

        private static final long serialVersionUID = 1L;

        MalformedEventException(String message) {
            super(message);
        }
    }
}
