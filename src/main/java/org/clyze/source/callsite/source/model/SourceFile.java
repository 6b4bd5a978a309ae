package org.clyze.source.callsite.source.model;

import java.io.File;
import java.util.*;
import org.clyze.source.callsite.SourceProcessor;

/**
 * A parsed source file. Its syntax nodes live in an arena in pre-order,
 * so the descendants of a node form a contiguous slice of the arena.
 * Instances are immutable once built and may be shared between threads.
 */
public class SourceFile {
    /** The parsed source file. */
    public final File file;
    /** The text of the file, as parsed. */
    public final String text;
    /** The language front end that parsed this file. */
    public final SourceProcessor processor;
    private final List<SyntaxNode> nodes;
    private final Map<Integer, List<SyntaxNode>> nodesByLine = new HashMap<>();
    private final Map<Object, SyntaxNode> nodesByAst = new IdentityHashMap<>();
    private volatile LineMap lineMap = null;

    public SourceFile(File file, String text, SourceProcessor processor, List<SyntaxNode> nodes) {
        this.file = file;
        this.text = text;
        this.processor = processor;
        this.nodes = nodes;
        for (SyntaxNode node : nodes) {
            nodesByAst.put(node.ast, node);
            if (node.range.isKnown())
                nodesByLine.computeIfAbsent(node.range.startLine, k -> new ArrayList<>()).add(node);
        }
    }

    public List<SyntaxNode> getNodes() {
        return nodes;
    }

    public SyntaxNode getNode(int index) {
        return nodes.get(index);
    }

    public SyntaxNode getRoot() {
        return nodes.get(0);
    }

    /**
     * Returns the arena node that wraps a parser node.
     * @param ast   a JavaParser or Groovy AST node of this file
     * @return      the syntax node or null if the parser node was not recorded
     */
    public SyntaxNode nodeOf(Object ast) {
        return nodesByAst.get(ast);
    }

    public SyntaxNode getParent(SyntaxNode node) {
        return node.parentIndex < 0 ? null : nodes.get(node.parentIndex);
    }

    /**
     * Returns the nodes whose range starts on a line, in pre-order.
     * @param line   the 1-based line
     * @return       the nodes (possibly empty)
     */
    public List<SyntaxNode> getNodesAt(int line) {
        return nodesByLine.getOrDefault(line, Collections.emptyList());
    }

    public List<SyntaxNode> getDescendants(SyntaxNode node) {
        return nodes.subList(node.index + 1, node.subtreeEnd);
    }

    public boolean isAncestorOrSelf(SyntaxNode ancestor, SyntaxNode node) {
        return ancestor.index <= node.index && node.index < ancestor.subtreeEnd;
    }

    /**
     * Checks whether a node belongs to the subtree of a parser node.
     * @param node   the syntax node
     * @param ast    the parser node rooting the subtree
     * @return       false also when the parser node was not recorded
     */
    public boolean within(SyntaxNode node, Object ast) {
        SyntaxNode root = nodeOf(ast);
        return root != null && isAncestorOrSelf(root, node);
    }

    /** Returns the innermost statement containing a node (the node itself included), or null. */
    public SyntaxNode containingStatement(SyntaxNode node) {
        for (SyntaxNode n = node; n != null; n = getParent(n))
            if (n.kind == NodeKind.STATEMENT)
                return n;
        return null;
    }

    public LineMap getLineMap() {
        LineMap map = lineMap;
        if (map == null) {
            map = new LineMap(text);
            lineMap = map;
        }
        return map;
    }

    /**
     * Returns the exact source text of a node.
     * @param node   a node of this file
     * @return       the text, which may span several lines
     */
    public String getSource(SyntaxNode node) {
        return getLineMap().slice(node.range);
    }

    public String getName() {
        return file.getName();
    }

    @Override
    public String toString() {
        return file.getPath();
    }
}
