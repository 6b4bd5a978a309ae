package org.clyze.source.callsite.matcher;

import java.util.List;
import org.clyze.source.callsite.AmbiguousCallSiteException;
import org.clyze.source.callsite.ExecutionPosition;
import org.clyze.source.callsite.ir.CompiledUnit;
import org.clyze.source.callsite.source.model.SourceFile;
import org.clyze.source.callsite.source.model.SyntaxNode;

/**
 * Decides which call of a statement is executing at a bytecode offset.
 * Each candidate call is recompiled with a sentinel attached to it alone;
 * the candidate whose call instruction has the same index among the
 * unit's calls as the executing instruction is the one.
 */
public class InstructionMatcher {
    private final CompiledFormSynthesizer synthesizer;
    private final MatchCache<SyntaxNode> resolved = new MatchCache<>();
    private final MatchCache<List<Integer>> trials = new MatchCache<>();
    private final boolean debug;

    public InstructionMatcher(CompiledFormSynthesizer synthesizer, boolean debug) {
        this.synthesizer = synthesizer;
        this.debug = debug;
    }

    /**
     * Find the call executing at a position.
     * @param position   the execution position
     * @param sf         the indexed source file of the position
     * @return           the call node
     * @throws AmbiguousCallSiteException if no single call can be identified
     */
    public SyntaxNode matchCall(ExecutionPosition position, SourceFile sf) {
        return resolved.get(() -> {
            StatementGroup group = StatementGroup.at(sf, position.line);
            return matchCall(position, group, group.getCalls());
        }, sf.file, position.unit, position.offset);
    }

    /**
     * Pick the executing call among candidates.
     * @param position     the execution position
     * @param group        the statement group owning the position's line
     * @param candidates   the candidate calls, outer to inner, left to right
     * @return             the first candidate whose call instruction is the executing one
     * @throws AmbiguousCallSiteException if no candidate matches
     */
    public SyntaxNode matchCall(ExecutionPosition position, StatementGroup group, List<SyntaxNode> candidates) {
        if (candidates.isEmpty())
            throw new AmbiguousCallSiteException("No call expression at " + group);
        if (debug)
            System.out.println("Candidates at " + position + ": " + candidates);
        CompiledUnit baseline = synthesizer.compileSubset(group, position, null);
        int target = baseline.callIndexAt(position.offset);
        if (target < 0)
            throw new AmbiguousCallSiteException("Offset " + position.offset + " is not a call instruction in " + baseline.id);
        checkWindow(position, group, baseline, target);
        SourceFile sf = group.sourceFile;
        for (SyntaxNode candidate : candidates) {
            List<Integer> indices = trials.get(() -> synthesizer.markedCallIndices(group, position, candidate),
                    sf.file, position.unit, candidate.index);
            if (debug)
                System.out.println("Candidate " + candidate + ": call indices " + indices + ", target " + target);
            if (indices.contains(target))
                return candidate;
        }
        throw new AmbiguousCallSiteException("No candidate call matches offset " + position.offset + " at " + group);
    }

    /**
     * Check that the executing call lies between the calls that precede the
     * group and those that precede the next statement. A bound is skipped
     * when its marker cannot be measured (nested units, duplicated code).
     */
    private void checkWindow(ExecutionPosition position, StatementGroup group, CompiledUnit baseline, int target) {
        int start = synthesizer.precedingCalls(group, position, group.first());
        SyntaxNode next = group.next();
        int end = next == null ? -1 : synthesizer.precedingCalls(group, position, next);
        if (end < 0)
            end = baseline.getCallInstructions().size();
        if (debug)
            System.out.println("Call window of " + group + ": [" + start + ", " + end + "), target " + target);
        if (target < start || target >= end)
            throw new AmbiguousCallSiteException("Offset " + position.offset + " is outside the calls of " + group +
                    " (call " + target + ", statement calls [" + Math.max(start, 0) + ", " + end + "))");
    }
}
