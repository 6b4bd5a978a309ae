package org.clyze.source.callsite;

/** Thrown when an execution position cannot be mapped to exactly one call. */
public class AmbiguousCallSiteException extends ResolutionException {
    public AmbiguousCallSiteException(String message) {
        super(message);
    }
}
