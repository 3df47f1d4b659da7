package com.domainmodel.analyzer.stream;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * One event in a method's instruction stream.
 *
 * Which attributes are populated depends on {@link #type}:
 * CALL uses owner/name/descriptor/argTypes, FIELD_READ uses owner/name,
 * FIELD_WRITE additionally carries valueType, LINE carries line.
 */
@Value
@Builder(toBuilder = true)
public class InstructionEvent {

    @NonNull
    EventType type;

    /** Qualified, dot-separated owner type of the called method or accessed field. */
    String ownerType;

    /** Method or field name. */
    String name;

    /** JVM method descriptor of the callee, when known. */
    String descriptor;

    @Singular
    List<String> argTypes;

    String valueType;

    int line;

    public static InstructionEvent call(String ownerType, String methodName, String descriptor, List<String> argTypes) {
        return InstructionEvent.builder()
                .type(EventType.CALL)
                .ownerType(ownerType)
                .name(methodName)
                .descriptor(descriptor)
                .argTypes(argTypes == null ? List.of() : argTypes)
                .build();
    }

    public static InstructionEvent fieldRead(String ownerType, String fieldName) {
        return InstructionEvent.builder()
                .type(EventType.FIELD_READ)
                .ownerType(ownerType)
                .name(fieldName)
                .build();
    }

    public static InstructionEvent fieldWrite(String ownerType, String fieldName, String valueType) {
        return InstructionEvent.builder()
                .type(EventType.FIELD_WRITE)
                .ownerType(ownerType)
                .name(fieldName)
                .valueType(valueType)
                .build();
    }

    public static InstructionEvent line(int line) {
        return InstructionEvent.builder()
                .type(EventType.LINE)
                .line(line)
                .build();
    }

    public static InstructionEvent branchStart() {
        return InstructionEvent.builder().type(EventType.BRANCH_START).build();
    }

    public static InstructionEvent branchEnd() {
        return InstructionEvent.builder().type(EventType.BRANCH_END).build();
    }

    public boolean isCall() {
        return type == EventType.CALL;
    }

    public boolean isFieldAccess() {
        return type == EventType.FIELD_READ || type == EventType.FIELD_WRITE;
    }
}
