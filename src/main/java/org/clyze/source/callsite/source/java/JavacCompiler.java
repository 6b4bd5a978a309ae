package org.clyze.source.callsite.source.java;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.OutputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.*;
import java.util.stream.Collectors;
import javax.tools.*;
import org.clyze.source.callsite.ir.CompilationResult;
import org.clyze.source.callsite.ir.SentinelSide;
import org.clyze.source.callsite.matcher.Marker;
import org.clyze.source.callsite.source.model.SourceFile;

/** Recompiles Java source files in memory with the system compiler. */
public class JavacCompiler {
    private final List<String> classpath;
    private final boolean debug;

    public JavacCompiler(List<String> classpath, boolean debug) {
        this.classpath = classpath;
        this.debug = debug;
    }

    /**
     * Compile a source file, trying each sentinel placement until one compiles.
     * @param sf       the source file
     * @param marker   the marker to place, or null for the unmodified text
     * @return         the result of the first successful compilation, or the
     *                 last failure
     */
    public CompilationResult compile(SourceFile sf, Marker marker) {
        if (marker == null)
            return compileText(sf.getName(), sf.text);
        List<String> variants = JavaSentinelPatch.variants(sf, marker);
        CompilationResult result = CompilationResult.failure("no sentinel placement for " + marker);
        for (String variant : variants) {
            result = compileText(sf.getName(), variant);
            if (result.isSuccess())
                return result;
            if (debug)
                System.out.println("Sentinel placement rejected for " + marker + ": " + result.diagnostics);
        }
        return result;
    }

    private CompilationResult compileText(String fileName, String text) {
        JavaCompiler javac = ToolProvider.getSystemJavaCompiler();
        if (javac == null)
            throw new IllegalStateException("No system Java compiler available, a JDK is required");
        DiagnosticCollector<JavaFileObject> diagnostics = new DiagnosticCollector<>();
        Map<String, byte[]> classes = new LinkedHashMap<>();
        List<String> options = Arrays.asList("-proc:none", "-g", "-nowarn", "-implicit:none",
                "-classpath", String.join(File.pathSeparator, classpath));
        StandardJavaFileManager std = javac.getStandardFileManager(diagnostics, Locale.ROOT, StandardCharsets.UTF_8);
        try (MemoryFileManager fileManager = new MemoryFileManager(std, classes)) {
            JavaFileObject source = new SourceText(fileName, text);
            Boolean ok = javac.getTask(null, fileManager, diagnostics, options, null, Collections.singletonList(source)).call();
            if (!Boolean.TRUE.equals(ok)) {
                String messages = diagnostics.getDiagnostics().stream()
                        .filter(d -> d.getKind() == Diagnostic.Kind.ERROR)
                        .map(d -> "line " + d.getLineNumber() + ": " + d.getMessage(Locale.ROOT))
                        .collect(Collectors.joining("\n"));
                return CompilationResult.failure(messages);
            }
        } catch (IOException ex) {
            return CompilationResult.failure("I/O error: " + ex.getMessage());
        }
        return CompilationResult.success(classes, SentinelSide.AFTER_CALL);
    }

    private static class SourceText extends SimpleJavaFileObject {
        private final String text;

        SourceText(String fileName, String text) {
            super(URI.create("string:///" + fileName), Kind.SOURCE);
            this.text = text;
        }

        @Override
        public CharSequence getCharContent(boolean ignoreEncodingErrors) {
            return text;
        }
    }

    private static class ClassBytes extends SimpleJavaFileObject {
        private final String className;
        private final Map<String, byte[]> sink;

        ClassBytes(String className, Map<String, byte[]> sink) {
            super(URI.create("bytes:///" + className.replace('.', '/') + Kind.CLASS.extension), Kind.CLASS);
            this.className = className;
            this.sink = sink;
        }

        @Override
        public OutputStream openOutputStream() {
            return new ByteArrayOutputStream() {
                @Override
                public void close() throws IOException {
                    super.close();
                    sink.put(className, toByteArray());
                }
            };
        }
    }

    private static class MemoryFileManager extends ForwardingJavaFileManager<StandardJavaFileManager> {
        private final Map<String, byte[]> classes;

        MemoryFileManager(StandardJavaFileManager fileManager, Map<String, byte[]> classes) {
            super(fileManager);
            this.classes = classes;
        }

        @Override
        public JavaFileObject getJavaFileForOutput(Location location, String className,
                                                   JavaFileObject.Kind kind, FileObject sibling) {
            return new ClassBytes(className, classes);
        }
    }
}
