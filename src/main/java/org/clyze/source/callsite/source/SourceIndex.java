package org.clyze.source.callsite.source;

import com.google.common.collect.ImmutableMap;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.clyze.source.callsite.MalformedSourceException;
import org.clyze.source.callsite.ResolverOptions;
import org.clyze.source.callsite.SourceProcessor;
import org.clyze.source.callsite.source.groovy.GroovyProcessor;
import org.clyze.source.callsite.source.java.JavaProcessor;
import org.clyze.source.callsite.source.model.SourceFile;

/**
 * Parses and indexes source files on first use. Each file is published at
 * most once, so all callers see the same {@link SourceFile} for a path.
 */
public class SourceIndex {
    private final Map<String, SourceProcessor> processors;
    private final ConcurrentMap<Path, SourceFile> files = new ConcurrentHashMap<>();
    private final boolean debug;

    public SourceIndex(ResolverOptions options) {
        this.debug = options.isDebug();
        this.processors = ImmutableMap.of(
                ".java", new JavaProcessor(options.getClasspath(), debug),
                ".groovy", new GroovyProcessor(options.getGroovyConfiguration(), options.getClassLoader(), debug));
    }

    /**
     * Return the indexed form of a source file, parsing it if needed.
     * @param path   the path of the source file
     * @return       the cached source file
     * @throws MalformedSourceException if the file cannot be read or parsed
     */
    public SourceFile index(Path path) {
        Path key = path.toAbsolutePath().normalize();
        SourceFile sf = files.get(key);
        if (sf != null)
            return sf;
        SourceProcessor processor = processorFor(key);
        if (processor == null)
            throw new MalformedSourceException(key.toFile(), "unsupported source language");
        // Concurrent first calls may both parse; only one result is published.
        SourceFile parsed = processor.process(key.toFile());
        SourceFile existing = files.putIfAbsent(key, parsed);
        if (existing != null)
            return existing;
        if (debug)
            System.out.println("Source index: " + key);
        return parsed;
    }

    private SourceProcessor processorFor(Path path) {
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot < 0 ? null : processors.get(name.substring(dot));
    }

    public boolean isIndexed(Path path) {
        return files.containsKey(path.toAbsolutePath().normalize());
    }
}
