package org.clyze.source.callsite.ir.bytecode;

import java.util.HashMap;
import java.util.Map;
import org.objectweb.asm.ClassReader;
import org.objectweb.asm.Opcodes;

/**
 * Decodes the Code attributes of a class file to recover the bytecode
 * offset of every instruction. ASM's tree API keeps the instructions but
 * not their offsets, and offsets cannot be recomputed from it since it
 * hides encoding choices such as LDC versus LDC_W.
 */
class CodeOffsets {
    private static final int[] SIZES = new int[202];

    static {
        java.util.Arrays.fill(SIZES, 1);
        SIZES[Opcodes.BIPUSH] = 2;
        SIZES[Opcodes.SIPUSH] = 3;
        SIZES[Opcodes.LDC] = 2;
        SIZES[19] = 3; // ldc_w
        SIZES[20] = 3; // ldc2_w
        for (int op = Opcodes.ILOAD; op <= Opcodes.ALOAD; op++)
            SIZES[op] = 2;
        for (int op = Opcodes.ISTORE; op <= Opcodes.ASTORE; op++)
            SIZES[op] = 2;
        SIZES[Opcodes.IINC] = 3;
        for (int op = Opcodes.IFEQ; op <= Opcodes.JSR; op++)
            SIZES[op] = 3;
        SIZES[Opcodes.RET] = 2;
        for (int op = Opcodes.GETSTATIC; op <= Opcodes.INVOKESTATIC; op++)
            SIZES[op] = 3;
        SIZES[Opcodes.INVOKEINTERFACE] = 5;
        SIZES[Opcodes.INVOKEDYNAMIC] = 5;
        SIZES[Opcodes.NEW] = 3;
        SIZES[Opcodes.NEWARRAY] = 2;
        SIZES[Opcodes.ANEWARRAY] = 3;
        SIZES[Opcodes.CHECKCAST] = 3;
        SIZES[Opcodes.INSTANCEOF] = 3;
        SIZES[Opcodes.MULTIANEWARRAY] = 4;
        SIZES[Opcodes.IFNULL] = 3;
        SIZES[Opcodes.IFNONNULL] = 3;
        SIZES[200] = 5; // goto_w
        SIZES[201] = 5; // jsr_w
    }

    private static final int WIDE = 196;

    /**
     * Decode the instruction offsets of all methods with code.
     * @param reader   the class reader
     * @return         the offsets per method, keyed by name + descriptor
     */
    static Map<String, int[]> decode(ClassReader reader) {
        Map<String, int[]> offsets = new HashMap<>();
        char[] buf = new char[reader.getMaxStringLength()];
        // Skip access flags, this class and super class.
        int u = reader.header + 6;
        u += 2 + 2 * reader.readUnsignedShort(u);
        u = skipMembers(reader, u);
        int methods = reader.readUnsignedShort(u);
        u += 2;
        for (int m = 0; m < methods; m++) {
            String name = reader.readUTF8(u + 2, buf);
            String desc = reader.readUTF8(u + 4, buf);
            int attributes = reader.readUnsignedShort(u + 6);
            u += 8;
            for (int a = 0; a < attributes; a++) {
                String attrName = reader.readUTF8(u, buf);
                int length = reader.readInt(u + 2);
                if ("Code".equals(attrName)) {
                    int codeLength = reader.readInt(u + 10);
                    offsets.put(name + desc, decodeCode(reader, u + 14, codeLength));
                }
                u += 6 + length;
            }
        }
        return offsets;
    }

    private static int skipMembers(ClassReader reader, int u) {
        int count = reader.readUnsignedShort(u);
        u += 2;
        for (int i = 0; i < count; i++) {
            int attributes = reader.readUnsignedShort(u + 6);
            u += 8;
            for (int a = 0; a < attributes; a++)
                u += 6 + reader.readInt(u + 2);
        }
        return u;
    }

    private static int[] decodeCode(ClassReader reader, int start, int length) {
        int[] found = new int[length];
        int count = 0;
        int pc = 0;
        while (pc < length) {
            found[count++] = pc;
            int opcode = reader.readByte(start + pc);
            pc += sizeOf(reader, start, pc, opcode);
        }
        return java.util.Arrays.copyOf(found, count);
    }

    private static int sizeOf(ClassReader reader, int start, int pc, int opcode) {
        if (opcode == Opcodes.TABLESWITCH) {
            int p = align(pc + 1);
            int low = reader.readInt(start + p + 4);
            int high = reader.readInt(start + p + 8);
            return p + 12 + 4 * (high - low + 1) - pc;
        } else if (opcode == Opcodes.LOOKUPSWITCH) {
            int p = align(pc + 1);
            int pairs = reader.readInt(start + p + 4);
            return p + 8 + 8 * pairs - pc;
        } else if (opcode == WIDE)
            return reader.readByte(start + pc + 1) == Opcodes.IINC ? 6 : 4;
        else if (opcode < SIZES.length)
            return SIZES[opcode];
        throw new IllegalStateException("Unknown opcode " + opcode + " at offset " + pc);
    }

    private static int align(int p) {
        return p + (4 - p % 4) % 4;
    }
}
