package org.clyze.source.callsite.fixtures;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import org.clyze.source.callsite.CallSite;
import org.clyze.source.callsite.CallSiteResolver;
import org.clyze.source.callsite.ExecutionPosition;

/** Methods that report where they were called from. */
public final class Probe {
    public static final CallSiteResolver RESOLVER = new CallSiteResolver();
    private static volatile CallSite last = null;

    private Probe() {}

    public static CallSite here() {
        return RESOLVER.resolveCaller(Probe.class);
    }

    /** Returns the call site of an inner probe together with this call's own site. */
    public static List<CallSite> pair(CallSite inner) {
        CallSite outer = RESOLVER.resolveCaller(Probe.class);
        return Arrays.asList(inner, outer);
    }

    public static List<CallSite> many(int copies) {
        return Collections.nCopies(copies, RESOLVER.resolveCaller(Probe.class));
    }

    public static List<CallSite> twice() {
        return Collections.nCopies(2, RESOLVER.resolveCaller(Probe.class));
    }

    public static CallSite withArgs(Object... args) {
        return RESOLVER.resolveCaller(Probe.class);
    }

    public static CallSite keywords(Map<String, ?> named) {
        return RESOLVER.resolveCaller(Probe.class);
    }

    public static int depth() {
        return RESOLVER.resolveCaller(Probe.class).getCallSource().length();
    }

    public static void record() {
        last = RESOLVER.resolveCaller(Probe.class);
    }

    public static CallSite last() {
        return last;
    }

    public static ExecutionPosition position() {
        return RESOLVER.capture(Probe.class);
    }
}
