package org.clyze.source.callsite;

import java.io.File;

/** Thrown when a source file cannot be read or parsed. */
public class MalformedSourceException extends ResolutionException {
    public final File file;

    public MalformedSourceException(File file, String message) {
        super(file + ": " + message);
        this.file = file;
    }

    public MalformedSourceException(File file, String message, Throwable cause) {
        super(file + ": " + message, cause);
        this.file = file;
    }
}
