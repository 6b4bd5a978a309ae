package org.clyze.source.callsite.source.groovy;

import java.util.List;
import org.codehaus.groovy.ast.*;
import org.codehaus.groovy.ast.expr.*;
import org.codehaus.groovy.ast.stmt.*;
import org.clyze.source.callsite.source.model.NodeKind;
import org.clyze.source.callsite.source.model.SyntaxNode;
import org.clyze.source.callsite.source.model.SyntaxTreeBuilder;

/**
 * Places the nodes of a Groovy module in a syntax node arena. The walk
 * is deterministic, so walking a fresh parse of the same text yields the
 * same arena indices.
 */
public class GroovyTreeWalker extends CodeVisitorSupport {
    private final SyntaxTreeBuilder tree = new SyntaxTreeBuilder();

    public static List<SyntaxNode> index(ModuleNode module) {
        GroovyTreeWalker walker = new GroovyTreeWalker();
        walker.record(module, NodeKind.OTHER, () -> {
            for (ClassNode cNode : module.getClasses())
                walker.visitClass(cNode);
        });
        return walker.tree.build();
    }

    /**
     * Record a node and walk its children. Visit methods of the base class
     * delegate to each other (a declaration is visited as a binary
     * expression), so a node that is already the current one is not
     * recorded twice.
     */
    private void record(ASTNode node, NodeKind kind, Runnable children) {
        if (tree.isCurrent(node)) {
            children.run();
            return;
        }
        tree.enter(node, kind, GroovyUtils.createRangeFromNode(node));
        children.run();
        tree.exit();
    }

    private void visitClass(ClassNode cNode) {
        record(cNode, NodeKind.TYPE, () -> {
            for (FieldNode field : cNode.getFields())
                if (field.hasInitialExpression())
                    record(field, NodeKind.STATEMENT, () -> field.getInitialExpression().visit(this));
            for (Statement init : cNode.getObjectInitializerStatements())
                init.visit(this);
            for (ConstructorNode ctor : cNode.getDeclaredConstructors())
                visitMethod(ctor);
            for (MethodNode method : cNode.getMethods())
                visitMethod(method);
        });
    }

    private void visitMethod(MethodNode method) {
        record(method, NodeKind.CODE_UNIT, () -> {
            Statement code = method.getCode();
            if (code != null)
                code.visit(this);
        });
    }

    // Statements

    @Override
    public void visitBlockStatement(BlockStatement block) {
        record(block, NodeKind.BODY, () -> super.visitBlockStatement(block));
    }

    @Override
    public void visitForLoop(ForStatement forLoop) {
        record(forLoop, NodeKind.STATEMENT, () -> super.visitForLoop(forLoop));
    }

    @Override
    public void visitWhileLoop(WhileStatement loop) {
        record(loop, NodeKind.STATEMENT, () -> super.visitWhileLoop(loop));
    }

    @Override
    public void visitDoWhileLoop(DoWhileStatement loop) {
        record(loop, NodeKind.STATEMENT, () -> super.visitDoWhileLoop(loop));
    }

    @Override
    public void visitIfElse(IfStatement ifElse) {
        record(ifElse, NodeKind.STATEMENT, () -> super.visitIfElse(ifElse));
    }

    @Override
    public void visitExpressionStatement(ExpressionStatement statement) {
        record(statement, NodeKind.STATEMENT, () -> super.visitExpressionStatement(statement));
    }

    @Override
    public void visitReturnStatement(ReturnStatement statement) {
        record(statement, NodeKind.STATEMENT, () -> super.visitReturnStatement(statement));
    }

    @Override
    public void visitAssertStatement(AssertStatement statement) {
        record(statement, NodeKind.STATEMENT, () -> super.visitAssertStatement(statement));
    }

    @Override
    public void visitTryCatchFinally(TryCatchStatement statement) {
        record(statement, NodeKind.STATEMENT, () -> super.visitTryCatchFinally(statement));
    }

    @Override
    public void visitCatchStatement(CatchStatement statement) {
        record(statement, NodeKind.STATEMENT, () -> super.visitCatchStatement(statement));
    }

    @Override
    public void visitSwitch(SwitchStatement statement) {
        record(statement, NodeKind.STATEMENT, () -> super.visitSwitch(statement));
    }

    @Override
    public void visitCaseStatement(CaseStatement statement) {
        record(statement, NodeKind.STATEMENT, () -> super.visitCaseStatement(statement));
    }

    @Override
    public void visitBreakStatement(BreakStatement statement) {
        record(statement, NodeKind.STATEMENT, () -> super.visitBreakStatement(statement));
    }

    @Override
    public void visitContinueStatement(ContinueStatement statement) {
        record(statement, NodeKind.STATEMENT, () -> super.visitContinueStatement(statement));
    }

    @Override
    public void visitThrowStatement(ThrowStatement statement) {
        record(statement, NodeKind.STATEMENT, () -> super.visitThrowStatement(statement));
    }

    @Override
    public void visitSynchronizedStatement(SynchronizedStatement statement) {
        record(statement, NodeKind.STATEMENT, () -> super.visitSynchronizedStatement(statement));
    }

    // Calls and nested units

    @Override
    public void visitMethodCallExpression(MethodCallExpression call) {
        record(call, NodeKind.CALL, () -> super.visitMethodCallExpression(call));
    }

    @Override
    public void visitStaticMethodCallExpression(StaticMethodCallExpression call) {
        record(call, NodeKind.CALL, () -> super.visitStaticMethodCallExpression(call));
    }

    @Override
    public void visitConstructorCallExpression(ConstructorCallExpression call) {
        record(call, NodeKind.CALL, () -> super.visitConstructorCallExpression(call));
    }

    @Override
    public void visitClosureExpression(ClosureExpression expression) {
        record(expression, NodeKind.NESTED_UNIT, () -> super.visitClosureExpression(expression));
    }

    @Override
    public void visitLambdaExpression(LambdaExpression expression) {
        record(expression, NodeKind.NESTED_UNIT, () -> super.visitLambdaExpression(expression));
    }

    // Other expressions

    @Override
    public void visitDeclarationExpression(DeclarationExpression expression) {
        record(expression, NodeKind.EXPRESSION, () -> super.visitDeclarationExpression(expression));
    }

    @Override
    public void visitBinaryExpression(BinaryExpression expression) {
        record(expression, NodeKind.EXPRESSION, () -> super.visitBinaryExpression(expression));
    }

    @Override
    public void visitTernaryExpression(TernaryExpression expression) {
        record(expression, NodeKind.EXPRESSION, () -> super.visitTernaryExpression(expression));
    }

    @Override
    public void visitShortTernaryExpression(ElvisOperatorExpression expression) {
        record(expression, NodeKind.EXPRESSION, () -> super.visitShortTernaryExpression(expression));
    }

    @Override
    public void visitPrefixExpression(PrefixExpression expression) {
        record(expression, NodeKind.EXPRESSION, () -> super.visitPrefixExpression(expression));
    }

    @Override
    public void visitPostfixExpression(PostfixExpression expression) {
        record(expression, NodeKind.EXPRESSION, () -> super.visitPostfixExpression(expression));
    }

    @Override
    public void visitBooleanExpression(BooleanExpression expression) {
        record(expression, NodeKind.EXPRESSION, () -> super.visitBooleanExpression(expression));
    }

    @Override
    public void visitNotExpression(NotExpression expression) {
        record(expression, NodeKind.EXPRESSION, () -> super.visitNotExpression(expression));
    }

    @Override
    public void visitTupleExpression(TupleExpression expression) {
        record(expression, NodeKind.EXPRESSION, () -> super.visitTupleExpression(expression));
    }

    @Override
    public void visitArgumentlistExpression(ArgumentListExpression expression) {
        record(expression, NodeKind.EXPRESSION, () -> super.visitArgumentlistExpression(expression));
    }

    @Override
    public void visitListExpression(ListExpression expression) {
        record(expression, NodeKind.EXPRESSION, () -> super.visitListExpression(expression));
    }

    @Override
    public void visitMapExpression(MapExpression expression) {
        record(expression, NodeKind.EXPRESSION, () -> super.visitMapExpression(expression));
    }

    @Override
    public void visitMapEntryExpression(MapEntryExpression expression) {
        record(expression, NodeKind.EXPRESSION, () -> super.visitMapEntryExpression(expression));
    }

    @Override
    public void visitRangeExpression(RangeExpression expression) {
        record(expression, NodeKind.EXPRESSION, () -> super.visitRangeExpression(expression));
    }

    @Override
    public void visitPropertyExpression(PropertyExpression expression) {
        record(expression, NodeKind.EXPRESSION, () -> super.visitPropertyExpression(expression));
    }

    @Override
    public void visitAttributeExpression(AttributeExpression expression) {
        record(expression, NodeKind.EXPRESSION, () -> super.visitAttributeExpression(expression));
    }

    @Override
    public void visitFieldExpression(FieldExpression expression) {
        record(expression, NodeKind.EXPRESSION, () -> super.visitFieldExpression(expression));
    }

    @Override
    public void visitMethodPointerExpression(MethodPointerExpression expression) {
        record(expression, NodeKind.EXPRESSION, () -> super.visitMethodPointerExpression(expression));
    }

    @Override
    public void visitConstantExpression(ConstantExpression expression) {
        record(expression, NodeKind.EXPRESSION, () -> super.visitConstantExpression(expression));
    }

    @Override
    public void visitClassExpression(ClassExpression expression) {
        record(expression, NodeKind.EXPRESSION, () -> super.visitClassExpression(expression));
    }

    @Override
    public void visitVariableExpression(VariableExpression expression) {
        record(expression, NodeKind.EXPRESSION, () -> super.visitVariableExpression(expression));
    }

    @Override
    public void visitGStringExpression(GStringExpression expression) {
        record(expression, NodeKind.EXPRESSION, () -> super.visitGStringExpression(expression));
    }

    @Override
    public void visitArrayExpression(ArrayExpression expression) {
        record(expression, NodeKind.EXPRESSION, () -> super.visitArrayExpression(expression));
    }

    @Override
    public void visitSpreadExpression(SpreadExpression expression) {
        record(expression, NodeKind.EXPRESSION, () -> super.visitSpreadExpression(expression));
    }

    @Override
    public void visitSpreadMapExpression(SpreadMapExpression expression) {
        record(expression, NodeKind.EXPRESSION, () -> super.visitSpreadMapExpression(expression));
    }

    @Override
    public void visitUnaryMinusExpression(UnaryMinusExpression expression) {
        record(expression, NodeKind.EXPRESSION, () -> super.visitUnaryMinusExpression(expression));
    }

    @Override
    public void visitUnaryPlusExpression(UnaryPlusExpression expression) {
        record(expression, NodeKind.EXPRESSION, () -> super.visitUnaryPlusExpression(expression));
    }

    @Override
    public void visitBitwiseNegationExpression(BitwiseNegationExpression expression) {
        record(expression, NodeKind.EXPRESSION, () -> super.visitBitwiseNegationExpression(expression));
    }

    @Override
    public void visitCastExpression(CastExpression expression) {
        record(expression, NodeKind.EXPRESSION, () -> super.visitCastExpression(expression));
    }

    @Override
    public void visitClosureListExpression(ClosureListExpression expression) {
        record(expression, NodeKind.EXPRESSION, () -> super.visitClosureListExpression(expression));
    }
}
