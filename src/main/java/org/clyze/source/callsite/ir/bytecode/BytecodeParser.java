package org.clyze.source.callsite.ir.bytecode;

import java.util.*;

import org.clyze.source.callsite.ir.CompiledUnit;
import org.clyze.source.callsite.ir.Instruction;
import org.clyze.source.callsite.ir.UnitId;
import org.objectweb.asm.ClassReader;
import org.objectweb.asm.tree.*;

/** Reads class files into {@link CompiledUnit}s, one per method with code. */
public class BytecodeParser {
    private final boolean debug;

    public BytecodeParser(boolean debug) {
        this.debug = debug;
    }

    public List<CompiledUnit> parseClass(byte[] bytes) {
        ClassReader reader = new ClassReader(bytes);
        ClassNode node = new ClassNode();
        reader.accept(node, ClassReader.SKIP_FRAMES);
        Map<String, int[]> offsets = CodeOffsets.decode(reader);
        String className = node.name.replace('/', '.');
        List<CompiledUnit> units = new ArrayList<>();
        for (MethodNode mNode : node.methods) {
            int[] methodOffsets = offsets.get(mNode.name + mNode.desc);
            if (methodOffsets == null)
                continue;
            UnitId id = new UnitId(className, mNode.name, mNode.desc);
            units.add(new CompiledUnit(id, readInstructions(id, mNode, methodOffsets)));
        }
        return units;
    }

    /**
     * Reads a single method.
     * @param bytes        the class file
     * @param methodName   the method name
     * @param descriptor   the method descriptor, null to accept any overload
     * @return             the unit, or null if the class has no single such method
     */
    public CompiledUnit parseUnit(byte[] bytes, String methodName, String descriptor) {
        CompiledUnit found = null;
        for (CompiledUnit unit : parseClass(bytes))
            if (unit.id.methodName.equals(methodName) && (descriptor == null || descriptor.equals(unit.id.descriptor))) {
                if (found != null)
                    return null;
                found = unit;
            }
        return found;
    }

    private List<Instruction> readInstructions(UnitId id, MethodNode mNode, int[] offsets) {
        List<Instruction> instructions = new ArrayList<>();
        int line = -1;
        int index = 0;
        for (AbstractInsnNode insn : mNode.instructions) {
            if (insn instanceof LineNumberNode) {
                line = ((LineNumberNode) insn).line;
                continue;
            }
            int opcode = insn.getOpcode();
            // Labels and frames are not instructions.
            if (opcode < 0)
                continue;
            if (index >= offsets.length)
                throw new IllegalStateException("Instruction count mismatch in " + id);
            instructions.add(toInstruction(offsets[index++], opcode, line, insn));
        }
        if (index != offsets.length)
            throw new IllegalStateException("Instruction count mismatch in " + id + ": " + index + " vs " + offsets.length);
        if (debug)
            System.out.println("Bytecode: " + id + ", " + instructions.size() + " instructions");
        return instructions;
    }

    private static Instruction toInstruction(int offset, int opcode, int line, AbstractInsnNode insn) {
        if (insn instanceof LdcInsnNode)
            return new Instruction(offset, opcode, line, ((LdcInsnNode) insn).cst, null, null, null);
        if (insn instanceof MethodInsnNode) {
            MethodInsnNode min = (MethodInsnNode) insn;
            return new Instruction(offset, opcode, line, null, min.owner, min.name, min.desc);
        }
        if (insn instanceof InvokeDynamicInsnNode) {
            InvokeDynamicInsnNode indy = (InvokeDynamicInsnNode) insn;
            return new Instruction(offset, opcode, line, null, null, indy.name, indy.desc);
        }
        return new Instruction(offset, opcode, line, null, null, null, null);
    }
}
