package org.clyze.source.callsite.source.model;

/** The role of a syntax node, as far as call-site resolution is concerned. */
public enum NodeKind {
    /** A statement (blocks excluded), or a field initializer. */
    STATEMENT,
    /** A block of statements. */
    BODY,
    /** A method or constructor call. */
    CALL,
    /** A method, constructor or initializer. */
    CODE_UNIT,
    /** A lambda or closure, compiled to its own method. */
    NESTED_UNIT,
    /** A type declaration. */
    TYPE,
    EXPRESSION,
    OTHER;

    /** Returns true for nodes whose code runs in a compiled unit of its own. */
    public boolean startsUnit() {
        return this == CODE_UNIT || this == NESTED_UNIT || this == TYPE;
    }
}
