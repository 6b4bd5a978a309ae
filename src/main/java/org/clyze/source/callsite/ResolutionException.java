package org.clyze.source.callsite;

/** Base class of all call-site resolution failures. */
public class ResolutionException extends RuntimeException {
    public ResolutionException(String message) {
        super(message);
    }

    public ResolutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
