package org.clyze.source.callsite;

import java.nio.file.Path;
import org.clyze.source.callsite.ir.UnitId;

/** A point of execution: a source line, a bytecode index and the executing method. */
public class ExecutionPosition {
    public final Path sourcePath;
    public final int line;
    /** The bytecode index of the executing instruction. */
    public final int offset;
    public final UnitId unit;
    /** The first line of the runtime unit, when its class file was available. */
    public final Integer unitFirstLine;

    public ExecutionPosition(Path sourcePath, int line, int offset, UnitId unit, Integer unitFirstLine) {
        this.sourcePath = sourcePath;
        this.line = line;
        this.offset = offset;
        this.unit = unit;
        this.unitFirstLine = unitFirstLine;
    }

    public ExecutionPosition(Path sourcePath, int line, int offset, UnitId unit) {
        this(sourcePath, line, offset, unit, null);
    }

    @Override
    public String toString() {
        return sourcePath + ":" + line + " @" + offset + " in " + unit;
    }
}
