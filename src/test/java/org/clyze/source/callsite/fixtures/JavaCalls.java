package org.clyze.source.callsite.fixtures;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Supplier;
import org.clyze.source.callsite.CallSite;
import org.clyze.source.callsite.ExecutionPosition;

/** Calls probes in the shapes the resolver must tell apart. */
public class JavaCalls {

    public static CallSite simple() {
        CallSite site = Probe.here();
        return site;
    }

    public static List<CallSite> twins() {
        return Arrays.asList(Probe.here(), Probe.here());
    }

    public static List<CallSite> nested() {
        return Probe.pair(Probe.here());
    }

    public static CallSite lambda() {
        Supplier<CallSite> supplier = () -> Probe.here();
        return supplier.get();
    }

    public static CallSite anonymous() {
        Supplier<CallSite> supplier = new Supplier<CallSite>() {
            @Override
            public CallSite get() {
                return Probe.here();
            }
        };
        return supplier.get();
    }

    public static String multiLine() {
        String text = String.valueOf(
                Probe.here().getCallSource());
        return text;
    }

    public static List<CallSite> loop() {
        List<CallSite> looped = new ArrayList<>();
        for (CallSite each : Probe.many(2))
            looped.add(each);
        return looped;
    }

    public static CallSite[] sameLine() {
        CallSite first = Probe.here(); CallSite second = Probe.here();
        return new CallSite[] { first, second };
    }

    public static CallSite arguments() {
        return Probe.withArgs(1 + 2, "two");
    }

    public static CallSite afterOtherCalls() {
        String warmUp = String.valueOf(System.nanoTime()).trim();
        List<String> names = new ArrayList<>();
        names.add(warmUp);
        CallSite site = Probe.here();
        return site;
    }

    public static int primitive() {
        int depth = Probe.depth() + 1;
        return depth;
    }

    public static CallSite statement() {
        Probe.record();
        return Probe.last();
    }

    public static CallSite switching(int k) {
        switch (k) {
            case 0: return null;
            case 1: return Probe.here();
            case 2: return null;
            default: return Probe.here();
        }
    }

    public static CallSite afterSwitch(int k) {
        int code;
        switch (k) {
            case 1: code = 10; break;
            case 100: code = 20; break;
            case 10000: code = 30; break;
            default: code = 0;
        }
        CallSite site = Probe.withArgs(code);
        return site;
    }

    public static ExecutionPosition position() {
        ExecutionPosition position = Probe.position();
        return position;
    }

    public static List<CallSite> twoLambdas() {
        Supplier<CallSite> first = () -> Probe.here(), second = () -> Probe.here();
        return Arrays.asList(first.get(), second.get());
    }
}
