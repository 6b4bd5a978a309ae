package org.clyze.source.callsite.source.groovy;

import groovy.lang.GroovyClassLoader;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import org.codehaus.groovy.control.CompilationFailedException;
import org.codehaus.groovy.control.CompilationUnit;
import org.codehaus.groovy.control.CompilerConfiguration;
import org.codehaus.groovy.control.Phases;
import org.codehaus.groovy.tools.GroovyClass;
import org.clyze.source.callsite.ir.CompilationResult;
import org.clyze.source.callsite.ir.SentinelSide;
import org.clyze.source.callsite.matcher.Marker;
import org.clyze.source.callsite.source.model.SourceFile;

/** Recompiles Groovy source files in memory. */
public class GroovyCompiler {
    private final CompilerConfiguration config;
    private final ClassLoader parentLoader;
    private final boolean debug;

    public GroovyCompiler(CompilerConfiguration config, ClassLoader parentLoader, boolean debug) {
        this.config = config;
        this.parentLoader = parentLoader;
        this.debug = debug;
    }

    /**
     * Compile a source file up to class generation.
     * @param sf       the source file
     * @param marker   the marker to place (on a fresh AST), or null
     * @return         the generated classes or the compiler's failure
     */
    public CompilationResult compile(SourceFile sf, Marker marker) {
        CompilerConfiguration unitConfig = new CompilerConfiguration(config);
        SentinelCustomizer customizer = null;
        if (marker != null) {
            customizer = new SentinelCustomizer(marker, debug);
            unitConfig.addCompilationCustomizers(customizer);
        }
        try (GroovyClassLoader loader = new GroovyClassLoader(parentLoader, unitConfig)) {
            CompilationUnit unit = new CompilationUnit(unitConfig, null, loader);
            // Same unit name as the file, so that script classes get their runtime names.
            unit.addSource(sf.getName(), sf.text);
            unit.compile(Phases.CLASS_GENERATION);
            if (customizer != null && !customizer.isApplied())
                return CompilationResult.failure("sentinel could not be placed for " + marker);
            Map<String, byte[]> classes = new LinkedHashMap<>();
            for (GroovyClass gc : unit.getClasses())
                classes.put(gc.getName(), gc.getBytes());
            return CompilationResult.success(classes, SentinelSide.BEFORE_CALL);
        } catch (CompilationFailedException ex) {
            return CompilationResult.failure(ex.getMessage());
        } catch (IOException ex) {
            return CompilationResult.failure("I/O error: " + ex.getMessage());
        }
    }
}
