package org.clyze.source.callsite;

/** Thrown for binding targets that cannot be expressed as plain names. */
public class UnsupportedTargetException extends ResolutionException {
    public UnsupportedTargetException(String message) {
        super(message);
    }
}
