package org.clyze.source.callsite.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** The instructions of one compiled method. */
public class CompiledUnit {
    public final UnitId id;
    public final List<Instruction> instructions;
    private final List<Instruction> calls = new ArrayList<>();

    public CompiledUnit(UnitId id, List<Instruction> instructions) {
        this.id = id;
        this.instructions = Collections.unmodifiableList(instructions);
        for (Instruction insn : instructions)
            if (insn.isCall())
                calls.add(insn);
    }

    public List<Instruction> getCallInstructions() {
        return Collections.unmodifiableList(calls);
    }

    public UnitKind getKind() {
        return id.getKind();
    }

    /** Returns the smallest line number of the unit, or -1 without line information. */
    public int getFirstLine() {
        int first = -1;
        for (Instruction insn : instructions)
            if (insn.line >= 0 && (first < 0 || insn.line < first))
                first = insn.line;
        return first;
    }

    /**
     * Find the call instruction at a bytecode offset.
     * @param offset   the bytecode index
     * @return         the position of the instruction among the call
     *                 instructions, or -1 if no call starts at the offset
     */
    public int callIndexAt(int offset) {
        for (int i = 0; i < calls.size(); i++)
            if (calls.get(i).offset == offset)
                return i;
        return -1;
    }

    /**
     * Find all loads of a string constant.
     * @param constant  the constant
     * @return          positions in {@link #instructions}
     */
    public List<Integer> findConstantLoads(String constant) {
        List<Integer> positions = new ArrayList<>();
        for (int i = 0; i < instructions.size(); i++)
            if (instructions.get(i).loadsConstant(constant))
                positions.add(i);
        return positions;
    }

    /** Returns the number of call instructions before a position in {@link #instructions}. */
    public int countCallsBefore(int position) {
        int count = 0;
        for (int i = 0; i < position; i++)
            if (instructions.get(i).isCall())
                count++;
        return count;
    }

    /**
     * Find the call instruction nearest to a constant load, on the given side.
     * @param position  the position of the load in {@link #instructions}
     * @param side      where the sentinel sits relative to its call
     * @return          the call index of the nearest call, or -1 if none
     */
    public int nearestCallIndex(int position, SentinelSide side) {
        if (side == SentinelSide.BEFORE_CALL) {
            for (int i = position + 1; i < instructions.size(); i++)
                if (instructions.get(i).isCall())
                    return countCallsBefore(i);
        } else {
            for (int i = position - 1; i >= 0; i--)
                if (instructions.get(i).isCall())
                    return countCallsBefore(i);
        }
        return -1;
    }

    public String dump() {
        StringBuilder sb = new StringBuilder(id.toString());
        for (Instruction insn : instructions)
            sb.append("\n  ").append(insn);
        return sb.toString();
    }

    @Override
    public String toString() {
        return id + " (" + instructions.size() + " instructions, " + calls.size() + " calls)";
    }
}
