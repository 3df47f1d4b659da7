package com.domainmodel.analyzer.stream;

import java.util.List;

/**
 * Supplies per-class instruction streams to the analysis. Implemented by the
 * host integration (bytecode reader, compiler plugin, test fixture).
 *
 * Implementations must allow {@link #readClass(String)} to be called from
 * several threads at once.
 */
public interface InstructionStreamSource {

    /**
     * Lists the qualified names of all classes this source can supply.
     *
     * @throws InstructionReadException if the source as a whole is unreadable
     */
    List<String> discoverClasses() throws InstructionReadException;

    /**
     * Reads the instruction stream of one class.
     *
     * @throws InstructionReadException if that class cannot be read
     */
    ClassInstructions readClass(String className) throws InstructionReadException;
}
