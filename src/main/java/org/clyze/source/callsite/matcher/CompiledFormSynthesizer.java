package org.clyze.source.callsite.matcher;

import java.util.ArrayList;
import java.util.List;
import org.clyze.source.callsite.AmbiguousCallSiteException;
import org.clyze.source.callsite.ExecutionPosition;
import org.clyze.source.callsite.ir.CompilationResult;
import org.clyze.source.callsite.ir.CompiledUnit;
import org.clyze.source.callsite.ir.UnitLocator;
import org.clyze.source.callsite.ir.bytecode.BytecodeParser;
import org.clyze.source.callsite.source.model.SourceFile;
import org.clyze.source.callsite.source.model.SyntaxNode;

/**
 * Produces the compiled form of the code around a statement group. A
 * statement cannot be compiled on its own without changing how its names
 * resolve, so the whole file is recompiled and the executing method is
 * extracted from it. That keeps the group in its real structural context.
 */
public class CompiledFormSynthesizer {
    private final UnitLocator locator;
    private final MatchCache<CompilationResult> baselines = new MatchCache<>();
    private final MatchCache<Integer> statementOffsets = new MatchCache<>();
    private final boolean debug;

    public CompiledFormSynthesizer(boolean debug) {
        this.locator = new UnitLocator(new BytecodeParser(debug), debug);
        this.debug = debug;
    }

    private CompilationResult compile(SourceFile sf, Marker marker) {
        if (marker == null)
            return baselines.get(() -> sf.processor.compile(sf, null), sf.file);
        CompilationResult result = sf.processor.compile(sf, marker);
        if (debug && !result.isSuccess())
            System.out.println("Trial compilation failed for " + marker + ": " + result.diagnostics);
        return result;
    }

    /**
     * Compile the unit executing a statement group.
     * @param group      the statement group
     * @param position   the execution position, identifying the unit
     * @param marker     a sentinel marker, or null for the unmodified code
     * @return           the compiled unit, or null when a marked compilation
     *                   fails or does not contain the unit
     * @throws AmbiguousCallSiteException if the unmodified code cannot be
     *         compiled or does not contain the unit
     */
    public CompiledUnit compileSubset(StatementGroup group, ExecutionPosition position, Marker marker) {
        SourceFile sf = group.sourceFile;
        CompilationResult result = compile(sf, marker);
        if (!result.isSuccess()) {
            if (marker == null)
                throw new AmbiguousCallSiteException("Cannot recompile " + sf + ": " + result.diagnostics);
            return null;
        }
        CompiledUnit unit = locator.locate(result, position.unit, position.unitFirstLine);
        if (unit == null && marker == null)
            throw new AmbiguousCallSiteException("Cannot locate " + position.unit + " in the recompiled " + sf);
        if (debug && unit != null && marker == null)
            System.out.println(unit.dump());
        return unit;
    }

    /**
     * Compile with a sentinel on one call and find that call's instructions.
     * @param group      the statement group containing the call
     * @param position   the execution position, identifying the unit
     * @param call       the candidate call
     * @return           the call indices of the candidate in the executing
     *                   unit; empty if it compiles elsewhere or not at all
     */
    public List<Integer> markedCallIndices(StatementGroup group, ExecutionPosition position, SyntaxNode call) {
        List<Integer> indices = new ArrayList<>();
        Marker marker = Marker.call(call);
        CompilationResult result = compile(group.sourceFile, marker);
        if (!result.isSuccess())
            return indices;
        CompiledUnit unit = locator.locate(result, position.unit, position.unitFirstLine);
        if (unit == null)
            return indices;
        // Code duplicated by the compiler (finally blocks) holds several loads.
        for (int load : unit.findConstantLoads(marker.sentinel)) {
            int index = unit.nearestCallIndex(load, result.side);
            if (index >= 0)
                indices.add(index);
        }
        return indices;
    }

    /**
     * Count the call instructions that precede a statement in its unit, by
     * compiling with a marker statement placed before it.
     * @param group       the statement group, giving the file
     * @param position    the execution position, identifying the unit
     * @param statement   the statement to measure, the group's own or the next one
     * @return            the number of calls before the statement, or -1 when
     *                    the marker cannot be placed, lands in another unit or
     *                    is duplicated by the compiler
     */
    public int precedingCalls(StatementGroup group, ExecutionPosition position, SyntaxNode statement) {
        SourceFile sf = group.sourceFile;
        return statementOffsets.get(() -> {
            CompiledUnit unit = compileSubset(group, position, Marker.statement(statement));
            if (unit == null)
                return -1;
            List<Integer> loads = unit.findConstantLoads(Sentinels.SENTINEL);
            int count = loads.size() == 1 ? unit.countCallsBefore(loads.get(0)) : -1;
            if (debug)
                System.out.println("Calls before " + sf.getSource(statement) + " in " + unit.id + ": " + count);
            return count;
        }, sf.file, position.unit, statement.index);
    }
}
