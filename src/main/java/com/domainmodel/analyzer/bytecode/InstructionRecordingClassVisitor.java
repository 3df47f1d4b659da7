package com.domainmodel.analyzer.bytecode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

import org.objectweb.asm.AnnotationVisitor;
import org.objectweb.asm.ClassVisitor;
import org.objectweb.asm.MethodVisitor;
import org.objectweb.asm.Opcodes;
import org.objectweb.asm.Type;

import com.domainmodel.analyzer.stream.AnnotationInfo;
import com.domainmodel.analyzer.stream.ClassInstructions;
import com.domainmodel.analyzer.stream.MethodInstructions;
import com.domainmodel.analyzer.util.NamingUtil;

/**
 * Records one class file as {@link ClassInstructions}. Bridge methods are
 * skipped, they only forward to the real implementation.
 *
 * Single use: accept it on one {@link org.objectweb.asm.ClassReader}, then call {@link #toClassInstructions()}.
 */
class InstructionRecordingClassVisitor extends ClassVisitor {

    private final ClassInstructions.ClassInstructionsBuilder builder = ClassInstructions.builder();
    private final List<InstructionRecordingMethodVisitor> methodVisitors = new ArrayList<>();

    InstructionRecordingClassVisitor() {
        super(Opcodes.ASM9);
    }

    @Override
    public void visit(int version, int access, String name, String signature, String superName, String[] interfaces) {
        builder.className(NamingUtil.toQualifiedName(name))
                .access(access)
                .superName(NamingUtil.toQualifiedName(superName))
                .genericSignature(signature)
                .genericSupertypes(GenericSignatureParser.parseSupertypes(signature));
        if (interfaces != null) {
            for (String itf : interfaces) {
                builder.anInterface(NamingUtil.toQualifiedName(itf));
            }
        }
    }

    @Override
    public AnnotationVisitor visitAnnotation(String descriptor, boolean visible) {
        String annotationName = Type.getType(descriptor).getClassName();
        return new ArgumentCollector(arguments -> builder.annotation(AnnotationInfo.builder()
                .name(annotationName)
                .arguments(arguments)
                .build()));
    }

    @Override
    public MethodVisitor visitMethod(int access, String name, String descriptor, String signature, String[] exceptions) {
        if ((access & Opcodes.ACC_BRIDGE) != 0) {
            return null;
        }
        InstructionRecordingMethodVisitor visitor = new InstructionRecordingMethodVisitor(access, name, descriptor);
        methodVisitors.add(visitor);
        return visitor;
    }

    ClassInstructions toClassInstructions() {
        for (InstructionRecordingMethodVisitor visitor : methodVisitors) {
            MethodInstructions method = visitor.toMethodInstructions();
            builder.method(method);
        }
        return builder.build();
    }

    /**
     * Flattens annotation arguments into strings: class literals become
     * qualified names, enum constants their name, arrays comma-separated values.
     */
    private static final class ArgumentCollector extends AnnotationVisitor {

        private final Map<String, String> arguments = new LinkedHashMap<>();
        private final Consumer<Map<String, String>> onEnd;

        ArgumentCollector(Consumer<Map<String, String>> onEnd) {
            super(Opcodes.ASM9);
            this.onEnd = onEnd;
        }

        @Override
        public void visit(String name, Object value) {
            arguments.put(name, render(value));
        }

        @Override
        public void visitEnum(String name, String descriptor, String value) {
            arguments.put(name, value);
        }

        @Override
        public AnnotationVisitor visitArray(String name) {
            List<String> values = new ArrayList<>();
            return new AnnotationVisitor(Opcodes.ASM9) {
                @Override
                public void visit(String ignored, Object value) {
                    values.add(render(value));
                }

                @Override
                public void visitEnum(String ignored, String descriptor, String value) {
                    values.add(value);
                }

                @Override
                public void visitEnd() {
                    arguments.put(name, String.join(",", values));
                }
            };
        }

        @Override
        public void visitEnd() {
            onEnd.accept(arguments);
        }

        private static String render(Object value) {
            if (value instanceof Type type) {
                return type.getClassName();
            }
            return String.valueOf(value);
        }
    }
}
