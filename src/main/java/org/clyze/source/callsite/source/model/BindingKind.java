package org.clyze.source.callsite.source.model;

/** The kinds of construct that bind the value of an expression to names. */
public enum BindingKind {
    ASSIGNMENT,
    LOOP,
    /** Comprehension clauses; neither supported language has them. */
    COMPREHENSION;

    public boolean isLoopLike() {
        return this != ASSIGNMENT;
    }
}
