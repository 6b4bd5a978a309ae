package org.clyze.source.callsite.source.model;

import com.google.common.collect.ImmutableList;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Collects syntax nodes in pre-order while a language-specific walker
 * enters and exits parser nodes.
 */
public class SyntaxTreeBuilder {
    private final List<SyntaxNode> nodes = new ArrayList<>();
    private final Deque<SyntaxNode> open = new ArrayDeque<>();

    public void enter(Object ast, NodeKind kind, TextRange range) {
        SyntaxNode parent = open.peek();
        SyntaxNode node = new SyntaxNode(nodes.size(), parent == null ? -1 : parent.index, kind, range, ast);
        nodes.add(node);
        open.push(node);
    }

    public void exit() {
        SyntaxNode node = open.pop();
        node.subtreeEnd = nodes.size();
    }

    /**
     * Checks whether a parser node is the innermost open one. Walkers whose
     * visit methods delegate to each other use this to record a node once.
     * @param ast   the parser node
     * @return      true if the node has just been entered
     */
    public boolean isCurrent(Object ast) {
        SyntaxNode node = open.peek();
        return node != null && node.ast == ast;
    }

    public List<SyntaxNode> build() {
        if (!open.isEmpty())
            throw new IllegalStateException("Unbalanced syntax tree walk, open nodes: " + open);
        return ImmutableList.copyOf(nodes);
    }
}
