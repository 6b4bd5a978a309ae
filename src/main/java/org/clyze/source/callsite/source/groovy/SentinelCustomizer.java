package org.clyze.source.callsite.source.groovy;

import java.util.List;
import org.codehaus.groovy.ast.ClassNode;
import org.codehaus.groovy.ast.expr.*;
import org.codehaus.groovy.ast.stmt.BlockStatement;
import org.codehaus.groovy.ast.stmt.ExpressionStatement;
import org.codehaus.groovy.ast.stmt.Statement;
import org.codehaus.groovy.classgen.GeneratorContext;
import org.codehaus.groovy.control.CompilePhase;
import org.codehaus.groovy.control.SourceUnit;
import org.codehaus.groovy.control.customizers.CompilationCustomizer;
import org.clyze.source.callsite.matcher.Marker;
import org.clyze.source.callsite.source.model.SyntaxNode;
import org.clyze.source.callsite.source.model.TextRange;

/**
 * Places a sentinel in the freshly built AST of a compilation: as an extra
 * last argument of a call, or as a constant statement before a statement.
 * The target is found by walking the new AST the same way the source index
 * walked its own parse.
 */
public class SentinelCustomizer extends CompilationCustomizer {
    private final Marker marker;
    private final boolean debug;
    private boolean done = false;
    private boolean applied = false;

    public SentinelCustomizer(Marker marker, boolean debug) {
        super(CompilePhase.CONVERSION);
        this.marker = marker;
        this.debug = debug;
    }

    public boolean isApplied() {
        return applied;
    }

    @Override
    public void call(SourceUnit source, GeneratorContext context, ClassNode classNode) {
        // Called once per class of the module; the module is walked once.
        if (done)
            return;
        done = true;
        List<SyntaxNode> nodes = GroovyTreeWalker.index(source.getAST());
        SyntaxNode target = counterpart(nodes, marker.node);
        if (target == null) {
            if (debug)
                System.out.println("WARNING: no counterpart for " + marker.node + " in fresh AST");
            return;
        }
        ConstantExpression sentinel = new ConstantExpression(marker.sentinel);
        if (marker.kind == Marker.Kind.CALL)
            applied = appendArgument(target.ast, sentinel);
        else if (target.parentIndex >= 0) {
            Object parent = nodes.get(target.parentIndex).ast;
            if (parent instanceof BlockStatement) {
                List<Statement> statements = ((BlockStatement) parent).getStatements();
                int pos = statements.indexOf(target.ast);
                if (pos >= 0) {
                    statements.add(pos, new ExpressionStatement(sentinel));
                    applied = true;
                }
            }
        }
    }

    private static SyntaxNode counterpart(List<SyntaxNode> nodes, SyntaxNode original) {
        if (original.index < nodes.size()) {
            SyntaxNode candidate = nodes.get(original.index);
            if (sameShape(candidate, original))
                return candidate;
        }
        for (SyntaxNode candidate : nodes)
            if (sameShape(candidate, original))
                return candidate;
        return null;
    }

    private static boolean sameShape(SyntaxNode n1, SyntaxNode n2) {
        TextRange r1 = n1.range;
        return n1.ast.getClass() == n2.ast.getClass() && r1.isKnown() && r1.equals(n2.range);
    }

    private static boolean appendArgument(Object call, Expression sentinel) {
        Expression args;
        if (call instanceof MethodCallExpression)
            args = ((MethodCallExpression) call).getArguments();
        else if (call instanceof StaticMethodCallExpression)
            args = ((StaticMethodCallExpression) call).getArguments();
        else if (call instanceof ConstructorCallExpression)
            args = ((ConstructorCallExpression) call).getArguments();
        else
            return false;
        if (args instanceof TupleExpression) {
            ((TupleExpression) args).addExpression(sentinel);
            return true;
        }
        if (call instanceof MethodCallExpression) {
            ((MethodCallExpression) call).setArguments(new ArgumentListExpression(args, sentinel));
            return true;
        }
        return false;
    }
}
