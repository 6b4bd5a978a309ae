package org.clyze.source.callsite.ir;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.clyze.source.callsite.ir.bytecode.BytecodeParser;

/** Finds the compiled counterpart of a runtime unit in a recompilation. */
public class UnitLocator {
    private final BytecodeParser parser;
    private final boolean debug;

    public UnitLocator(BytecodeParser parser, boolean debug) {
        this.parser = parser;
        this.debug = debug;
    }

    /**
     * Locate a unit, first by identity, then structurally: the single unit
     * of the same kind starting on the same line.
     * @param result      a successful compilation
     * @param id          the runtime unit
     * @param firstLine   the first line of the runtime unit, or null if unknown
     * @return            the unit, or null if it cannot be located uniquely
     */
    public CompiledUnit locate(CompilationResult result, UnitId id, Integer firstLine) {
        byte[] bytes = result.classes.get(id.className);
        if (bytes != null) {
            CompiledUnit unit = parser.parseUnit(bytes, id.methodName, id.descriptor);
            if (unit != null)
                return unit;
        }
        if (firstLine == null) {
            if (debug)
                System.out.println("Unit " + id + " not found in " + result.classes.keySet());
            return null;
        }
        UnitKind kind = id.getKind();
        List<CompiledUnit> candidates = new ArrayList<>();
        for (Map.Entry<String, byte[]> entry : result.classes.entrySet())
            for (CompiledUnit unit : parser.parseClass(entry.getValue()))
                if (unit.getKind() == kind && unit.getFirstLine() == firstLine)
                    candidates.add(unit);
        if (debug)
            System.out.println("Structural candidates for " + id + " (line " + firstLine + "): " + candidates);
        return candidates.size() == 1 ? candidates.get(0) : null;
    }
}
