package com.domainmodel.analyzer.bytecode;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.objectweb.asm.ClassReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.domainmodel.analyzer.stream.ClassInstructions;
import com.domainmodel.analyzer.stream.InstructionReadException;
import com.domainmodel.analyzer.stream.InstructionStreamSource;

/**
 * Instruction streams read from compiled {@code .class} files with ASM.
 *
 * Discovery runs once; afterwards {@link #readClass(String)} is safe to call
 * from several threads.
 */
public class BytecodeInstructionStreamSource implements InstructionStreamSource {

    private static final Logger log = LoggerFactory.getLogger(BytecodeInstructionStreamSource.class);

    private final List<Path> classDirs;
    private final ClassFileDiscoveryService discoveryService;

    private volatile Map<String, Path> classFiles;

    public BytecodeInstructionStreamSource(List<Path> classDirs, ClassNameFilter filter) {
        this.classDirs = List.copyOf(classDirs);
        this.discoveryService = new ClassFileDiscoveryService(filter);
    }

    @Override
    public List<String> discoverClasses() throws InstructionReadException {
        return new ArrayList<>(classFiles().keySet());
    }

    @Override
    public ClassInstructions readClass(String className) throws InstructionReadException {
        Path file = classFiles().get(className);
        if (file == null) {
            throw new InstructionReadException(className, "Class not found in " + classDirs);
        }
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(file);
        } catch (IOException e) {
            throw new InstructionReadException(className, "Cannot read " + file + ": " + e.getMessage(), e);
        }
        try {
            ClassReader reader = new ClassReader(bytes);
            InstructionRecordingClassVisitor visitor = new InstructionRecordingClassVisitor();
            reader.accept(visitor, ClassReader.SKIP_FRAMES);
            return visitor.toClassInstructions();
        } catch (RuntimeException e) {
            // ASM signals corrupt class files with unchecked exceptions
            throw new InstructionReadException(className, "Malformed class file " + file + ": " + e, e);
        }
    }

    private Map<String, Path> classFiles() throws InstructionReadException {
        Map<String, Path> current = classFiles;
        if (current != null) {
            return current;
        }
        synchronized (this) {
            if (classFiles == null) {
                try {
                    classFiles = discoveryService.discover(classDirs);
                    log.debug("Discovered {} classes in {}", classFiles.size(), classDirs);
                } catch (IOException e) {
                    throw new InstructionReadException(null, "Cannot scan class directories " + classDirs + ": " + e.getMessage(), e);
                }
            }
            return classFiles;
        }
    }
}
