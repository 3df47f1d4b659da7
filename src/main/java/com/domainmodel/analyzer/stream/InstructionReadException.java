package com.domainmodel.analyzer.stream;

/**
 * Raised by an {@link InstructionStreamSource} when a class cannot be read
 * or its instruction stream is malformed. Affects only that class.
 */
public class InstructionReadException extends Exception {

    private static final long serialVersionUID = 1L;

    private final String className;

    public InstructionReadException(String className, String message) {
        super(message);
        this.className = className;
    }

    public InstructionReadException(String className, String message, Throwable cause) {
        super(message, cause);
        this.className = className;
    }

    public String getClassName() {
        return className;
    }
}
