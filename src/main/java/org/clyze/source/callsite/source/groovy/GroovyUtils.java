package org.clyze.source.callsite.source.groovy;

import org.codehaus.groovy.ast.ASTNode;
import org.clyze.source.callsite.source.model.TextRange;

/** A collection of utilities used during parsing of Groovy sources. */
public class GroovyUtils {
    /**
     * Groovy records 1-based columns with an exclusive last column, which is
     * also the convention of {@link TextRange}.
     * @param node   the AST node
     * @return       the node's range, or {@link TextRange#UNKNOWN} for synthetic nodes
     */
    public static TextRange createRangeFromNode(ASTNode node) {
        if (node.getLineNumber() < 1 || node.getLastLineNumber() < 1)
            return TextRange.UNKNOWN;
        return new TextRange(node.getLineNumber(), node.getColumnNumber(),
                node.getLastLineNumber(), node.getLastColumnNumber());
    }
}
