package org.clyze.source.callsite;

import java.io.File;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.security.CodeSource;
import java.util.*;
import org.apache.commons.io.FileUtils;
import org.codehaus.groovy.control.CompilerConfiguration;
import org.clyze.source.callsite.matcher.Sentinels;

/** The configuration of a {@link CallSiteResolver}. */
public class ResolverOptions {
    /** The source roots searched when a class does not point at its own source. */
    public static final List<String> DEFAULT_SOURCE_ROOTS = Collections.unmodifiableList(Arrays.asList(
            "src/main/java", "src/test/java", "src/main/groovy", "src/test/groovy"));

    private boolean debug = false;
    private final List<Path> sourceRoots = new ArrayList<>();
    private final List<String> classpath = new ArrayList<>();
    private ClassLoader classLoader;
    private CompilerConfiguration groovyConfiguration;
    private final Set<String> excludedClasses = new LinkedHashSet<>();

    /** Returns options with the default source roots and compile classpath. */
    public static ResolverOptions defaults() {
        ResolverOptions options = new ResolverOptions();
        for (String root : DEFAULT_SOURCE_ROOTS)
            options.sourceRoots.add(Paths.get(root));
        String javaClassPath = System.getProperty("java.class.path", "");
        for (String entry : javaClassPath.split(File.pathSeparator))
            if (!entry.isEmpty())
                options.classpath.add(entry);
        String own = codeSourceOf(Sentinels.class);
        if (own != null && !options.classpath.contains(own))
            options.classpath.add(own);
        return options;
    }

    private static String codeSourceOf(Class<?> c) {
        CodeSource cs = c.getProtectionDomain().getCodeSource();
        if (cs == null || cs.getLocation() == null)
            return null;
        // Null for locations that are not local files.
        File file = FileUtils.toFile(cs.getLocation());
        return file == null ? null : file.getPath();
    }

    public boolean isDebug() {
        return debug;
    }

    public ResolverOptions setDebug(boolean debug) {
        this.debug = debug;
        return this;
    }

    public List<Path> getSourceRoots() {
        return Collections.unmodifiableList(sourceRoots);
    }

    public ResolverOptions addSourceRoot(Path root) {
        sourceRoots.add(root);
        return this;
    }

    public List<String> getClasspath() {
        return Collections.unmodifiableList(classpath);
    }

    public ResolverOptions addClasspathEntry(String entry) {
        classpath.add(entry);
        return this;
    }

    /** Returns the loader that resolves classes referenced by recompiled Groovy code. */
    public ClassLoader getClassLoader() {
        if (classLoader != null)
            return classLoader;
        ClassLoader context = Thread.currentThread().getContextClassLoader();
        return context != null ? context : ResolverOptions.class.getClassLoader();
    }

    public ResolverOptions setClassLoader(ClassLoader classLoader) {
        this.classLoader = classLoader;
        return this;
    }

    /**
     * Returns the Groovy compiler configuration. It should match the one that
     * compiled the running code; the default matches {@code GroovyClassLoader}'s.
     */
    public CompilerConfiguration getGroovyConfiguration() {
        return groovyConfiguration != null ? groovyConfiguration : new CompilerConfiguration(CompilerConfiguration.DEFAULT);
    }

    public ResolverOptions setGroovyConfiguration(CompilerConfiguration groovyConfiguration) {
        this.groovyConfiguration = groovyConfiguration;
        return this;
    }

    public Set<String> getExcludedClasses() {
        return Collections.unmodifiableSet(excludedClasses);
    }

    /**
     * Exclude forwarding classes from caller detection: frames of these
     * classes are skipped, so a helper that forwards to a resolving method
     * reports its own caller instead of itself.
     * @param classes   the forwarding classes
     * @return          these options
     */
    public ResolverOptions exclude(Class<?>... classes) {
        for (Class<?> c : classes)
            excludedClasses.add(c.getName());
        return this;
    }
}
