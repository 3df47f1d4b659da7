package com.domainmodel.analyzer.bytecode;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

import org.objectweb.asm.Opcodes;
import org.objectweb.asm.signature.SignatureReader;
import org.objectweb.asm.signature.SignatureVisitor;

import com.domainmodel.analyzer.stream.TypeReference;
import com.domainmodel.analyzer.util.NamingUtil;

/**
 * Extracts the generic superclass and interfaces declared in a class signature,
 * e.g. {@code Ljava/lang/Object;Lcom/x/DomainRepository<Lcom/x/Order;>;}.
 */
public class GenericSignatureParser {

    private GenericSignatureParser() {
        // Utility class
    }

    /**
     * @return superclass first, then interfaces; empty for a null signature
     */
    public static List<TypeReference> parseSupertypes(String classSignature) {
        List<TypeReference> result = new ArrayList<>();
        if (classSignature == null || classSignature.isEmpty()) {
            return result;
        }
        new SignatureReader(classSignature).accept(new SignatureVisitor(Opcodes.ASM9) {
            @Override
            public SignatureVisitor visitClassBound() {
                return new TypeCollector(t -> { });
            }

            @Override
            public SignatureVisitor visitInterfaceBound() {
                return new TypeCollector(t -> { });
            }

            @Override
            public SignatureVisitor visitSuperclass() {
                return new TypeCollector(result::add);
            }

            @Override
            public SignatureVisitor visitInterface() {
                return new TypeCollector(result::add);
            }
        });
        return result;
    }

    /**
     * Builds one {@link TypeReference} and hands it to the sink when the type ends.
     */
    private static final class TypeCollector extends SignatureVisitor {

        private final Consumer<TypeReference> sink;
        private String rawType;
        private final List<TypeReference> arguments = new ArrayList<>();
        private int arrayDepth;

        TypeCollector(Consumer<TypeReference> sink) {
            super(Opcodes.ASM9);
            this.sink = sink;
        }

        @Override
        public void visitClassType(String name) {
            rawType = NamingUtil.toQualifiedName(name);
        }

        @Override
        public void visitInnerClassType(String name) {
            rawType = rawType + "$" + name;
            arguments.clear();
        }

        @Override
        public void visitTypeVariable(String name) {
            sink.accept(TypeReference.variable(name));
        }

        @Override
        public void visitBaseType(char descriptor) {
            sink.accept(TypeReference.of(descriptor + "[]".repeat(arrayDepth)));
        }

        @Override
        public SignatureVisitor visitArrayType() {
            arrayDepth++;
            return this;
        }

        @Override
        public void visitTypeArgument() {
            arguments.add(TypeReference.variable("?"));
        }

        @Override
        public SignatureVisitor visitTypeArgument(char wildcard) {
            return new TypeCollector(arguments::add);
        }

        @Override
        public void visitEnd() {
            String name = rawType + "[]".repeat(arrayDepth);
            sink.accept(TypeReference.builder().rawType(name).typeArguments(arguments).build());
        }
    }
}
