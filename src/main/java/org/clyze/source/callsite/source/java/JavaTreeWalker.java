package org.clyze.source.callsite.source.java;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.*;
import com.github.javaparser.ast.comments.Comment;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.LambdaExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.Statement;
import java.util.ArrayList;
import java.util.List;
import org.clyze.source.callsite.source.model.NodeKind;
import org.clyze.source.callsite.source.model.SyntaxNode;
import org.clyze.source.callsite.source.model.SyntaxTreeBuilder;

/** Places the nodes of a JavaParser tree in a syntax node arena. */
public class JavaTreeWalker {
    private final SyntaxTreeBuilder tree = new SyntaxTreeBuilder();

    public static List<SyntaxNode> index(Node root) {
        JavaTreeWalker walker = new JavaTreeWalker();
        walker.visit(root);
        return walker.tree.build();
    }

    private void visit(Node node) {
        tree.enter(node, kindOf(node), JavaUtils.createRangeFromNode(node));
        List<Node> children = new ArrayList<>();
        for (Node child : node.getChildNodes())
            if (!(child instanceof Comment))
                children.add(child);
        // Child lists are not always in source order.
        children.sort(JavaUtils::compareByStart);
        for (Node child : children)
            visit(child);
        tree.exit();
    }

    static NodeKind kindOf(Node node) {
        if (node instanceof BlockStmt)
            return NodeKind.BODY;
        if (node instanceof Statement || node instanceof FieldDeclaration)
            return NodeKind.STATEMENT;
        if (node instanceof MethodCallExpr || node instanceof ObjectCreationExpr)
            return NodeKind.CALL;
        if (node instanceof CallableDeclaration || node instanceof InitializerDeclaration)
            return NodeKind.CODE_UNIT;
        if (node instanceof LambdaExpr)
            return NodeKind.NESTED_UNIT;
        if (node instanceof TypeDeclaration)
            return NodeKind.TYPE;
        return node instanceof Expression ? NodeKind.EXPRESSION : NodeKind.OTHER;
    }
}
