package org.clyze.source.callsite.source;

import java.io.File;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.CodeSource;
import java.util.List;
import org.apache.commons.io.FileUtils;

/** Finds the source file of a running class. */
public class SourceLocator {
    private final List<Path> sourceRoots;

    public SourceLocator(List<Path> sourceRoots) {
        this.sourceRoots = sourceRoots;
    }

    /**
     * Locate a source file.
     * @param c          the running class
     * @param fileName   the file name recorded in the class (may be null)
     * @return           the source path, or null if none exists
     */
    public Path locate(Class<?> c, String fileName) {
        // Scripts loaded from files carry their own location.
        Path own = codeSourceFile(c);
        if (own != null)
            return own;
        if (fileName == null)
            return null;
        String pkg = c.getPackageName();
        String relative = pkg.isEmpty() ? fileName : pkg.replace('.', '/') + "/" + fileName;
        for (Path root : sourceRoots) {
            Path candidate = root.resolve(relative);
            if (Files.isRegularFile(candidate))
                return candidate;
        }
        return null;
    }

    private static Path codeSourceFile(Class<?> c) {
        CodeSource cs = c.getProtectionDomain().getCodeSource();
        URL location = cs == null ? null : cs.getLocation();
        if (location == null || !"file".equals(location.getProtocol()))
            return null;
        String name = location.getPath();
        if (!name.endsWith(".groovy") && !name.endsWith(".java"))
            return null;
        File file = FileUtils.toFile(location);
        return file != null && file.isFile() ? file.toPath() : null;
    }
}
