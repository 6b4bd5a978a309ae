package org.clyze.source.callsite.ir;

import org.objectweb.asm.Opcodes;
import org.objectweb.asm.util.Printer;

/** A bytecode instruction with its offset in the method's code. */
public class Instruction {
    public final int offset;
    public final int opcode;
    /** The source line, or -1 when the method has no line table. */
    public final int line;
    /** The loaded constant, for LDC instructions. */
    public final Object constant;
    public final String owner;
    public final String name;
    public final String descriptor;

    public Instruction(int offset, int opcode, int line, Object constant,
                       String owner, String name, String descriptor) {
        this.offset = offset;
        this.opcode = opcode;
        this.line = line;
        this.constant = constant;
        this.owner = owner;
        this.name = name;
        this.descriptor = descriptor;
    }

    /** Returns true for the instructions that perform a method call. */
    public boolean isCall() {
        return opcode >= Opcodes.INVOKEVIRTUAL && opcode <= Opcodes.INVOKEDYNAMIC;
    }

    public boolean loadsConstant(Object value) {
        return opcode == Opcodes.LDC && value.equals(constant);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(offset).append(": ").append(Printer.OPCODES[opcode].toLowerCase());
        if (constant != null)
            sb.append(' ').append(constant instanceof String ? "\"" + constant + "\"" : constant);
        if (name != null)
            sb.append(' ').append(owner == null ? "" : owner + ".").append(name).append(descriptor);
        if (line >= 0)
            sb.append(" [line ").append(line).append(']');
        return sb.toString();
    }
}
