package org.clyze.source.callsite;

import com.google.common.collect.ImmutableSet;
import java.io.IOException;
import java.io.InputStream;
import java.lang.StackWalker.StackFrame;
import java.nio.file.Path;
import java.util.Optional;
import java.util.Set;
import org.apache.commons.io.IOUtils;
import org.clyze.source.callsite.ir.CompiledUnit;
import org.clyze.source.callsite.ir.UnitId;
import org.clyze.source.callsite.ir.bytecode.BytecodeParser;
import org.clyze.source.callsite.source.SourceLocator;

/** Captures the execution position of the caller of a method, from the current stack. */
public class PositionCapture {
    /** Packages of runtime plumbing that sits between real callers and callees. */
    private static final Set<String> PLUMBING = ImmutableSet.of(
            "java.lang.invoke.", "java.lang.reflect.", "jdk.internal.", "sun.reflect.",
            "org.codehaus.groovy.", "org.apache.groovy.", "groovy.lang.");

    private final StackWalker walker = StackWalker.getInstance(StackWalker.Option.RETAIN_CLASS_REFERENCE);
    private final SourceLocator locator;
    private final Set<String> excludedClasses;
    private final BytecodeParser parser;

    public PositionCapture(SourceLocator locator, Set<String> excludedClasses, boolean debug) {
        this.locator = locator;
        this.excludedClasses = excludedClasses;
        this.parser = new BytecodeParser(debug);
    }

    /**
     * Find the frame that called a method of {@code callee}, skipping the
     * callee's own frames, runtime plumbing and excluded forwarders.
     * @param callee   the class whose caller is wanted
     * @return         the caller's execution position
     * @throws ResolutionException if there is no such frame or its source is missing
     */
    public ExecutionPosition callerOf(Class<?> callee) {
        Optional<StackFrame> caller = walker.walk(frames -> frames
                .dropWhile(f -> f.getDeclaringClass() != callee)
                .dropWhile(f -> f.getDeclaringClass() == callee || isSkipped(f))
                .findFirst());
        if (!caller.isPresent())
            throw new ResolutionException("No caller of " + callee.getName() + " on the stack");
        return toPosition(caller.get());
    }

    private boolean isSkipped(StackFrame frame) {
        if (frame.getLineNumber() < 0 || frame.getByteCodeIndex() < 0 || frame.getFileName() == null)
            return true;
        String className = frame.getClassName();
        if (excludedClasses.contains(className))
            return true;
        for (String prefix : PLUMBING)
            if (className.startsWith(prefix))
                return true;
        return false;
    }

    private ExecutionPosition toPosition(StackFrame frame) {
        Class<?> c = frame.getDeclaringClass();
        Path source = locator.locate(c, frame.getFileName());
        if (source == null)
            throw new ResolutionException("No source file found for " + c.getName() + " (" + frame.getFileName() + ")");
        UnitId unit = new UnitId(c.getName(), frame.getMethodName(), frame.getDescriptor());
        return new ExecutionPosition(source, frame.getLineNumber(), frame.getByteCodeIndex(), unit, firstLineOf(c, unit));
    }

    /** Reads the first line of a unit from its class file, if the class loader exposes it. */
    private Integer firstLineOf(Class<?> c, UnitId unit) {
        ClassLoader loader = c.getClassLoader();
        if (loader == null)
            return null;
        try (InputStream in = loader.getResourceAsStream(c.getName().replace('.', '/') + ".class")) {
            if (in == null)
                return null;
            CompiledUnit compiled = parser.parseUnit(IOUtils.toByteArray(in), unit.methodName, unit.descriptor);
            return compiled == null || compiled.getFirstLine() < 0 ? null : compiled.getFirstLine();
        } catch (IOException ex) {
            throw new ResolutionException("Cannot read class file of " + c.getName(), ex);
        }
    }
}
