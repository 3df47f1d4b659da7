package com.domainmodel.analyzer.bytecode;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.objectweb.asm.Label;
import org.objectweb.asm.MethodVisitor;
import org.objectweb.asm.Opcodes;
import org.objectweb.asm.Type;

import com.domainmodel.analyzer.stream.InstructionEvent;
import com.domainmodel.analyzer.stream.MethodInstructions;
import com.domainmodel.analyzer.util.NamingUtil;

/**
 * Turns a method body into instruction events: calls, instance field reads
 * and writes, line markers, and a branch start/end pair around each
 * conditional jump. Static field instructions carry no property semantics
 * and are dropped.
 */
class InstructionRecordingMethodVisitor extends MethodVisitor {

    private final MethodInstructions.MethodInstructionsBuilder builder;
    private final Set<Label> pendingBranchTargets = new HashSet<>();

    InstructionRecordingMethodVisitor(int access, String name, String descriptor) {
        super(Opcodes.ASM9);
        this.builder = MethodInstructions.builder()
                .name(name)
                .descriptor(descriptor)
                .access(access);
    }

    @Override
    public void visitLineNumber(int line, Label start) {
        builder.event(InstructionEvent.line(line));
    }

    @Override
    public void visitFieldInsn(int opcode, String owner, String name, String descriptor) {
        String ownerClass = NamingUtil.toQualifiedName(owner);
        if (opcode == Opcodes.GETFIELD) {
            builder.event(InstructionEvent.fieldRead(ownerClass, name));
        } else if (opcode == Opcodes.PUTFIELD) {
            builder.event(InstructionEvent.fieldWrite(ownerClass, name, Type.getType(descriptor).getClassName()));
        }
    }

    @Override
    public void visitMethodInsn(int opcode, String owner, String name, String descriptor, boolean isInterface) {
        if (owner.startsWith("[")) {
            // array pseudo-methods such as clone()
            return;
        }
        List<String> argTypes = Arrays.stream(Type.getArgumentTypes(descriptor))
                .map(Type::getClassName)
                .toList();
        builder.event(InstructionEvent.call(NamingUtil.toQualifiedName(owner), name, descriptor, argTypes));
    }

    @Override
    public void visitJumpInsn(int opcode, Label label) {
        if (opcode != Opcodes.GOTO && opcode != Opcodes.JSR) {
            builder.event(InstructionEvent.branchStart());
            pendingBranchTargets.add(label);
        }
    }

    @Override
    public void visitLabel(Label label) {
        if (pendingBranchTargets.remove(label)) {
            builder.event(InstructionEvent.branchEnd());
        }
    }

    MethodInstructions toMethodInstructions() {
        return builder.build();
    }
}
