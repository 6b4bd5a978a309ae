package org.clyze.source.callsite.ir;

import java.util.Collections;
import java.util.Map;

/** The classes produced by recompiling a source file, or the reason it failed. */
public class CompilationResult {
    /** Class bytes by binary class name (dotted). */
    public final Map<String, byte[]> classes;
    public final SentinelSide side;
    public final String diagnostics;

    private CompilationResult(Map<String, byte[]> classes, SentinelSide side, String diagnostics) {
        this.classes = classes;
        this.side = side;
        this.diagnostics = diagnostics;
    }

    public static CompilationResult success(Map<String, byte[]> classes, SentinelSide side) {
        return new CompilationResult(Collections.unmodifiableMap(classes), side, "");
    }

    public static CompilationResult failure(String diagnostics) {
        return new CompilationResult(Collections.emptyMap(), null, diagnostics);
    }

    public boolean isSuccess() {
        return side != null;
    }

    @Override
    public String toString() {
        return isSuccess() ? "compiled " + classes.keySet() : "failed: " + diagnostics;
    }
}
