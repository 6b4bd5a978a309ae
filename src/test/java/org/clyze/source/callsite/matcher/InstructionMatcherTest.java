package org.clyze.source.callsite.matcher;

import java.util.List;
import org.clyze.source.callsite.AmbiguousCallSiteException;
import org.clyze.source.callsite.CallSite;
import org.clyze.source.callsite.CallSiteResolver;
import org.clyze.source.callsite.ExecutionPosition;
import org.clyze.source.callsite.fixtures.JavaCalls;
import org.clyze.source.callsite.ir.CompiledUnit;
import org.clyze.source.callsite.ir.UnitId;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class InstructionMatcherTest {

    @Test
    void statementCallWindow() {
        CallSite site = JavaCalls.afterOtherCalls();
        ExecutionPosition position = site.getPosition();
        StatementGroup group = StatementGroup.at(site.getSourceFile(), position.line);
        CompiledFormSynthesizer synthesizer = new CompiledFormSynthesizer(false);
        CompiledUnit baseline = synthesizer.compileSubset(group, position, null);
        int target = baseline.callIndexAt(position.offset);
        assertTrue(target > 0, baseline.dump());
        // The statement holds a single call: the probe.
        assertEquals(target, synthesizer.precedingCalls(group, position, group.first()));
        assertNotNull(group.next());
        assertEquals(target + 1, synthesizer.precedingCalls(group, position, group.next()));
    }

    @Test
    void offsetOfAnotherStatement() {
        CallSite site = JavaCalls.afterOtherCalls();
        ExecutionPosition position = site.getPosition();
        StatementGroup group = StatementGroup.at(site.getSourceFile(), position.line);
        CompiledFormSynthesizer synthesizer = new CompiledFormSynthesizer(false);
        CompiledUnit baseline = synthesizer.compileSubset(group, position, null);
        int target = baseline.callIndexAt(position.offset);
        // Same line, but the offset of the call made by the statement before.
        int earlier = baseline.getCallInstructions().get(target - 1).offset;
        ExecutionPosition shifted = new ExecutionPosition(position.sourcePath, position.line, earlier,
                position.unit, position.unitFirstLine);
        InstructionMatcher matcher = new InstructionMatcher(synthesizer, false);
        AmbiguousCallSiteException ex = assertThrows(AmbiguousCallSiteException.class,
                () -> matcher.matchCall(shifted, site.getSourceFile()));
        assertTrue(ex.getMessage().contains("outside"), ex.getMessage());
    }

    @Test
    void lambdaFoundByKindAndFirstLine() {
        ExecutionPosition position = JavaCalls.lambda().getPosition();
        assertNotNull(position.unitFirstLine);
        UnitId renamed = new UnitId(position.unit.className, "lambda$renamed$7", position.unit.descriptor);
        ExecutionPosition moved = new ExecutionPosition(position.sourcePath, position.line, position.offset,
                renamed, position.unitFirstLine);
        CallSite site = new CallSiteResolver().resolveCallSite(moved);
        assertEquals("Probe.here()", site.getCallSource());
    }

    @Test
    void lambdasSharingALine() {
        List<CallSite> sites = JavaCalls.twoLambdas();
        assertNotSame(sites.get(0).getCall(), sites.get(1).getCall());
        ExecutionPosition position = sites.get(0).getPosition();
        UnitId renamed = new UnitId(position.unit.className, "lambda$renamed$7", position.unit.descriptor);
        ExecutionPosition moved = new ExecutionPosition(position.sourcePath, position.line, position.offset,
                renamed, position.unitFirstLine);
        assertThrows(AmbiguousCallSiteException.class, () -> new CallSiteResolver().resolveCallSite(moved));
    }
}
