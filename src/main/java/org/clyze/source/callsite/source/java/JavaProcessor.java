package org.clyze.source.callsite.source.java;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Problem;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.*;
import com.github.javaparser.ast.stmt.ForEachStmt;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.*;
import java.util.stream.Collectors;
import org.apache.commons.io.FileUtils;
import org.clyze.source.callsite.MalformedSourceException;
import org.clyze.source.callsite.SourceProcessor;
import org.clyze.source.callsite.UnsupportedTargetException;
import org.clyze.source.callsite.ir.CompilationResult;
import org.clyze.source.callsite.matcher.Marker;
import org.clyze.source.callsite.source.model.*;

/** This class handles Java source processing. */
public class JavaProcessor implements SourceProcessor {
    private final JavacCompiler compiler;
    private final boolean debug;

    public JavaProcessor(List<String> classpath, boolean debug) {
        this.compiler = new JavacCompiler(classpath, debug);
        this.debug = debug;
    }

    @Override
    public SourceFile process(File srcFile) {
        String text;
        try {
            text = FileUtils.readFileToString(srcFile, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new MalformedSourceException(srcFile, "cannot read file", ex);
        }
        ParserConfiguration config = new ParserConfiguration()
                .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17)
                .setAttributeComments(false);
        ParseResult<CompilationUnit> result = new JavaParser(config).parse(text);
        Optional<CompilationUnit> optCu = result.getResult();
        if (!result.isSuccessful() || !optCu.isPresent()) {
            String problems = result.getProblems().stream().map(Problem::getVerboseMessage).collect(Collectors.joining("\n"));
            throw new MalformedSourceException(srcFile, problems);
        }
        List<SyntaxNode> nodes = JavaTreeWalker.index(optCu.get());
        if (debug)
            System.out.println("Indexed " + srcFile + ": " + nodes.size() + " nodes");
        return new SourceFile(srcFile, text, this, nodes);
    }

    @Override
    public CallExpression describeCall(SourceFile sf, SyntaxNode call) {
        String name;
        List<Expression> args;
        if (call.ast instanceof MethodCallExpr) {
            MethodCallExpr mce = (MethodCallExpr) call.ast;
            name = mce.getNameAsString();
            args = mce.getArguments();
        } else if (call.ast instanceof ObjectCreationExpr) {
            ObjectCreationExpr oce = (ObjectCreationExpr) call.ast;
            name = oce.getType().getNameAsString();
            args = oce.getArguments();
        } else
            throw new IllegalArgumentException("Not a call: " + call);
        List<SyntaxNode> arguments = new ArrayList<>();
        for (Expression arg : args)
            arguments.add(sf.nodeOf(arg));
        return new CallExpression(call, name, arguments, Collections.emptyMap());
    }

    @Override
    public BindingConstruct bindingAt(SourceFile sf, SyntaxNode node, SyntaxNode from) {
        Object ast = node.ast;
        if (ast instanceof VariableDeclarator) {
            VariableDeclarator vd = (VariableDeclarator) ast;
            Optional<Expression> init = vd.getInitializer();
            if (init.isPresent() && sf.within(from, init.get()))
                return new BindingConstruct(BindingKind.ASSIGNMENT, node,
                        Collections.singletonList(vd), init.get() instanceof AssignExpr);
        } else if (ast instanceof AssignExpr) {
            AssignExpr ae = (AssignExpr) ast;
            if (ae.getOperator() == AssignExpr.Operator.ASSIGN && sf.within(from, ae.getValue()))
                return new BindingConstruct(BindingKind.ASSIGNMENT, node,
                        Collections.singletonList(ae.getTarget()), isChained(ae));
        } else if (ast instanceof ForEachStmt) {
            ForEachStmt fe = (ForEachStmt) ast;
            if (sf.within(from, fe.getIterable()))
                return new BindingConstruct(BindingKind.LOOP, node,
                        new ArrayList<Object>(fe.getVariable().getVariables()), false);
        }
        return null;
    }

    private static boolean isChained(AssignExpr ae) {
        if (ae.getValue() instanceof AssignExpr)
            return true;
        Node parent = ae.getParentNode().orElse(null);
        if (parent instanceof AssignExpr)
            return ((AssignExpr) parent).getValue() == ae;
        // Object x = y = f()
        return parent instanceof VariableDeclarator &&
                ((VariableDeclarator) parent).getInitializer().filter(init -> init == ae).isPresent();
    }

    @Override
    public String targetName(Object target) {
        if (target instanceof VariableDeclarator)
            return ((VariableDeclarator) target).getNameAsString();
        if (target instanceof NameExpr)
            return ((NameExpr) target).getNameAsString();
        if (target instanceof FieldAccessExpr)
            return ((FieldAccessExpr) target).getNameAsString();
        if (target instanceof ArrayAccessExpr) {
            Expression index = ((ArrayAccessExpr) target).getIndex();
            if (index instanceof StringLiteralExpr)
                return ((StringLiteralExpr) index).asString();
        }
        throw new UnsupportedTargetException("Cannot name assignment target: " + target);
    }

    @Override
    public CompilationResult compile(SourceFile sf, Marker marker) {
        return compiler.compile(sf, marker);
    }
}
