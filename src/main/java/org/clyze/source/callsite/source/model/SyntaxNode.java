package org.clyze.source.callsite.source.model;

/**
 * A syntax node placed in the arena of its {@link SourceFile}. Parents are
 * arena indices, so a node never holds a reference to another node.
 */
public class SyntaxNode {
    /** The position of this node in the arena (pre-order). */
    public final int index;
    /** The arena index of the parent, or -1 for the root. */
    public final int parentIndex;
    public final NodeKind kind;
    public final TextRange range;
    /** The parser node (JavaParser or Groovy AST) this node wraps. */
    public final Object ast;
    /** One past the arena index of the last descendant. */
    int subtreeEnd;

    SyntaxNode(int index, int parentIndex, NodeKind kind, TextRange range, Object ast) {
        this.index = index;
        this.parentIndex = parentIndex;
        this.kind = kind;
        this.range = range;
        this.ast = ast;
        this.subtreeEnd = index + 1;
    }

    public int getSubtreeEnd() {
        return subtreeEnd;
    }

    public boolean isCall() {
        return kind == NodeKind.CALL;
    }

    @Override
    public String toString() {
        return ast.getClass().getSimpleName() + "#" + index + "@" + range;
    }
}
