package org.clyze.source.callsite.source.model;

import java.util.List;

/**
 * A construct that binds a value to one or more targets. The targets are
 * parser nodes; turning them into names is left to the language front end,
 * since some target shapes cannot be named.
 */
public class BindingConstruct {
    public final BindingKind kind;
    public final SyntaxNode node;
    /** The binding targets, left to right. A tuple target contributes one entry per element. */
    public final List<Object> targets;
    /** True for assignments with more than one target expression, as in {@code a = b = v}. */
    public final boolean chained;

    public BindingConstruct(BindingKind kind, SyntaxNode node, List<Object> targets, boolean chained) {
        this.kind = kind;
        this.node = node;
        this.targets = targets;
        this.chained = chained;
    }

    @Override
    public String toString() {
        return kind + (chained ? "(chained)" : "") + " " + node;
    }
}
