package org.clyze.source.callsite.matcher;

import org.clyze.source.callsite.source.model.SyntaxNode;

/** A sentinel to be placed by a front end when recompiling a file. */
public class Marker {
    public enum Kind {
        /** Mark a call so that its call instruction can be found. */
        CALL,
        /** Insert a marker statement just before a statement. */
        STATEMENT
    }

    public final Kind kind;
    public final SyntaxNode node;
    public final String sentinel;

    private Marker(Kind kind, SyntaxNode node, String sentinel) {
        this.kind = kind;
        this.node = node;
        this.sentinel = sentinel;
    }

    public static Marker call(SyntaxNode call) {
        return new Marker(Kind.CALL, call, Sentinels.SENTINEL);
    }

    public static Marker statement(SyntaxNode statement) {
        return new Marker(Kind.STATEMENT, statement, Sentinels.SENTINEL);
    }

    @Override
    public String toString() {
        return kind + " marker on " + node;
    }
}
