package org.clyze.source.callsite.matcher;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.clyze.source.callsite.AmbiguousCallSiteException;
import org.clyze.source.callsite.CallSite;
import org.clyze.source.callsite.CallSiteResolver;
import org.clyze.source.callsite.NoBindingFoundException;
import org.clyze.source.callsite.fixtures.JavaCalls;
import org.clyze.source.callsite.ir.UnitKind;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/** Resolves call sites of probes running in compiled Java code. */
public class JavaCallSiteTest {

    @Test
    void simpleCall() {
        CallSite site = JavaCalls.simple();
        assertEquals("Probe.here()", site.getCallSource());
        assertEquals(Collections.singletonList("site"), site.assignedNames(true, false).names);
        assertThrows(NoBindingFoundException.class, () -> site.assignedNames(false, false));
    }

    @Test
    void identicalCallsOnOneLine() {
        List<CallSite> twins = JavaCalls.twins();
        CallSite first = twins.get(0);
        CallSite second = twins.get(1);
        assertEquals("Probe.here()", first.getCallSource());
        assertEquals("Probe.here()", second.getCallSource());
        assertEquals(first.getCall().range.startLine, second.getCall().range.startLine);
        assertTrue(first.getCall().range.startColumn < second.getCall().range.startColumn);
    }

    @Test
    void nestedCalls() {
        List<CallSite> sites = JavaCalls.nested();
        assertEquals("Probe.here()", sites.get(0).getCallSource());
        assertEquals("Probe.pair(Probe.here())", sites.get(1).getCallSource());
    }

    @Test
    void lambdaBody() {
        CallSite site = JavaCalls.lambda();
        assertEquals("Probe.here()", site.getCallSource());
        assertEquals(UnitKind.LAMBDA, site.getPosition().unit.getKind());
    }

    @Test
    void anonymousClassMethod() {
        CallSite site = JavaCalls.anonymous();
        assertEquals("Probe.here()", site.getCallSource());
        assertEquals(UnitKind.ANONYMOUS_CLASS_METHOD, site.getPosition().unit.getKind());
    }

    @Test
    void callOnContinuationLine() {
        assertEquals("Probe.here()", JavaCalls.multiLine());
    }

    @Test
    void loopIterable() {
        List<CallSite> looped = JavaCalls.loop();
        assertEquals(2, looped.size());
        CallSite site = looped.get(0);
        assertEquals("Probe.many(2)", site.getCallSource());
        assertEquals(Collections.singletonList("each"), site.assignedNames(true, true).names);
        assertThrows(NoBindingFoundException.class, () -> site.assignedNames(true, false));
    }

    @Test
    void statementsSharingALine() {
        assertThrows(AmbiguousCallSiteException.class, JavaCalls::sameLine);
    }

    @Test
    void argumentSources() {
        CallSite site = JavaCalls.arguments();
        assertEquals("withArgs", site.getCallExpression().name);
        assertEquals(Arrays.asList("1 + 2", "\"two\""), site.getArgumentSources());
        assertTrue(site.getCallExpression().keywordArguments.isEmpty());
    }

    @Test
    void callAfterOtherStatements() {
        CallSite site = JavaCalls.afterOtherCalls();
        assertEquals("Probe.here()", site.getCallSource());
    }

    @Test
    void primitiveResult() {
        assertEquals("Probe.depth()".length() + 1, JavaCalls.primitive());
    }

    @Test
    void voidCallStatement() {
        assertEquals("Probe.record()", JavaCalls.statement().getCallSource());
    }

    @Test
    void callsInSwitchCases() {
        CallSite one = JavaCalls.switching(1);
        CallSite other = JavaCalls.switching(7);
        assertEquals("Probe.here()", one.getCallSource());
        assertEquals("Probe.here()", other.getCallSource());
        assertNotSame(one.getCall(), other.getCall());
        assertTrue(one.getCall().range.startLine < other.getCall().range.startLine);
    }

    @Test
    void callAfterLookupSwitch() {
        CallSite site = JavaCalls.afterSwitch(100);
        assertEquals("Probe.withArgs(code)", site.getCallSource());
    }

    @Test
    void repeatedResolutionIsCached() {
        CallSite first = JavaCalls.simple();
        CallSite second = JavaCalls.simple();
        assertSame(first.getCall(), second.getCall());
        assertSame(first.getSourceFile(), second.getSourceFile());
    }

    @Test
    void independentResolversShareNothing() {
        CallSite shared = JavaCalls.simple();
        CallSite fresh = new CallSiteResolver().resolveCallSite(shared.getPosition());
        assertNotSame(shared.getSourceFile(), fresh.getSourceFile());
        assertEquals(shared.getCall().index, fresh.getCall().index);
    }
}
