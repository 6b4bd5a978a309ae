package org.clyze.source.callsite;

/** Thrown when no enclosing construct binds the value of a node. */
public class NoBindingFoundException extends ResolutionException {
    public NoBindingFoundException(String message) {
        super(message);
    }
}
