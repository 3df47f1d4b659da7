package com.domainmodel.analyzer.stream;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Instruction stream source over already materialized class streams, for
 * hosts that hand over streams directly.
 */
public class InMemoryInstructionStreamSource implements InstructionStreamSource {

    private final Map<String, ClassInstructions> classes = new LinkedHashMap<>();

    public InMemoryInstructionStreamSource(Collection<ClassInstructions> classes) {
        for (ClassInstructions c : classes) {
            this.classes.put(c.getClassName(), c);
        }
    }

    public static InMemoryInstructionStreamSource of(ClassInstructions... classes) {
        return new InMemoryInstructionStreamSource(List.of(classes));
    }

    @Override
    public List<String> discoverClasses() {
        return new ArrayList<>(classes.keySet());
    }

    @Override
    public ClassInstructions readClass(String className) throws InstructionReadException {
        ClassInstructions found = classes.get(className);
        if (found == null) {
            throw new InstructionReadException(className, "No instruction stream registered for " + className);
        }
        return found;
    }
}
