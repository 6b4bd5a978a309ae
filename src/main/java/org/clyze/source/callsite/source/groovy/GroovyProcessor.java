package org.clyze.source.callsite.source.groovy;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.*;
import org.apache.commons.io.FileUtils;
import org.codehaus.groovy.ast.ModuleNode;
import org.codehaus.groovy.ast.Parameter;
import org.codehaus.groovy.ast.expr.*;
import org.codehaus.groovy.ast.stmt.ForStatement;
import org.codehaus.groovy.control.CompilationFailedException;
import org.codehaus.groovy.control.CompilationUnit;
import org.codehaus.groovy.control.CompilerConfiguration;
import org.codehaus.groovy.control.Phases;
import org.codehaus.groovy.control.SourceUnit;
import org.codehaus.groovy.syntax.Types;
import org.clyze.source.callsite.MalformedSourceException;
import org.clyze.source.callsite.SourceProcessor;
import org.clyze.source.callsite.UnsupportedTargetException;
import org.clyze.source.callsite.ir.CompilationResult;
import org.clyze.source.callsite.matcher.Marker;
import org.clyze.source.callsite.source.model.*;

/** This class handles Groovy source processing. */
public class GroovyProcessor implements SourceProcessor {
    private final CompilerConfiguration config;
    private final GroovyCompiler compiler;
    private final boolean debug;

    public GroovyProcessor(CompilerConfiguration config, ClassLoader parentLoader, boolean debug) {
        this.config = config;
        this.compiler = new GroovyCompiler(config, parentLoader, debug);
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
        ModuleNode module;
        try {
            module = parse(srcFile.getName(), text);
        } catch (CompilationFailedException ex) {
            throw new MalformedSourceException(srcFile, ex.getMessage(), ex);
        }
        List<SyntaxNode> nodes = GroovyTreeWalker.index(module);
        if (debug)
            System.out.println("Indexed " + srcFile + ": " + nodes.size() + " nodes");
        return new SourceFile(srcFile, text, this, nodes);
    }

    /** Builds the AST of a script or class file, without resolving any names. */
    private ModuleNode parse(String name, String text) {
        CompilationUnit unit = new CompilationUnit(new CompilerConfiguration(config));
        SourceUnit source = unit.addSource(name, text);
        unit.compile(Phases.CONVERSION);
        return source.getAST();
    }

    @Override
    public CallExpression describeCall(SourceFile sf, SyntaxNode call) {
        String name;
        Expression args;
        if (call.ast instanceof MethodCallExpression) {
            MethodCallExpression mce = (MethodCallExpression) call.ast;
            name = mce.getMethodAsString();
            args = mce.getArguments();
        } else if (call.ast instanceof StaticMethodCallExpression) {
            StaticMethodCallExpression smce = (StaticMethodCallExpression) call.ast;
            name = smce.getMethod();
            args = smce.getArguments();
        } else if (call.ast instanceof ConstructorCallExpression) {
            ConstructorCallExpression cce = (ConstructorCallExpression) call.ast;
            name = cce.getType().getNameWithoutPackage();
            args = cce.getArguments();
        } else
            throw new IllegalArgumentException("Not a call: " + call);
        List<SyntaxNode> arguments = new ArrayList<>();
        Map<String, SyntaxNode> keywords = new LinkedHashMap<>();
        List<Expression> elements = args instanceof TupleExpression ?
                ((TupleExpression) args).getExpressions() : Collections.singletonList(args);
        for (Expression arg : elements) {
            if (arg instanceof MapExpression && isNamedArguments((MapExpression) arg)) {
                for (MapEntryExpression entry : ((MapExpression) arg).getMapEntryExpressions())
                    keywords.put(entry.getKeyExpression().getText(), sf.nodeOf(entry.getValueExpression()));
            } else
                arguments.add(sf.nodeOf(arg));
        }
        return new CallExpression(call, name, arguments, keywords);
    }

    /** Named arguments are collected by the parser into a map without brackets. */
    private static boolean isNamedArguments(MapExpression map) {
        return map instanceof NamedArgumentListExpression;
    }

    @Override
    public BindingConstruct bindingAt(SourceFile sf, SyntaxNode node, SyntaxNode from) {
        Object ast = node.ast;
        if (ast instanceof BinaryExpression) {
            BinaryExpression be = (BinaryExpression) ast;
            if (be.getOperation().getType() != Types.ASSIGN || !sf.within(from, be.getRightExpression()))
                return null;
            Expression left = be.getLeftExpression();
            List<Object> targets = new ArrayList<>();
            if (left instanceof TupleExpression)
                targets.addAll(((TupleExpression) left).getExpressions());
            else
                targets.add(left);
            return new BindingConstruct(BindingKind.ASSIGNMENT, node, targets, isChained(sf, node, be));
        } else if (ast instanceof ForStatement) {
            ForStatement fs = (ForStatement) ast;
            // Classic three-part loops keep their parts in a closure list.
            if (fs.getCollectionExpression() instanceof ClosureListExpression ||
                    !sf.within(from, fs.getCollectionExpression()))
                return null;
            return new BindingConstruct(BindingKind.LOOP, node,
                    Collections.singletonList(fs.getVariable()), false);
        }
        return null;
    }

    private static boolean isChained(SourceFile sf, SyntaxNode node, BinaryExpression be) {
        if (isAssignment(be.getRightExpression()))
            return true;
        SyntaxNode parent = sf.getParent(node);
        return parent != null && isAssignment(parent.ast) &&
                ((BinaryExpression) parent.ast).getRightExpression() == be;
    }

    private static boolean isAssignment(Object ast) {
        return ast instanceof BinaryExpression &&
                ((BinaryExpression) ast).getOperation().getType() == Types.ASSIGN;
    }

    @Override
    public String targetName(Object target) {
        if (target instanceof VariableExpression)
            return ((VariableExpression) target).getName();
        if (target instanceof Parameter)
            return ((Parameter) target).getName();
        if (target instanceof PropertyExpression) {
            String property = ((PropertyExpression) target).getPropertyAsString();
            if (property != null)
                return property;
        } else if (target instanceof BinaryExpression) {
            BinaryExpression subscript = (BinaryExpression) target;
            if (subscript.getOperation().getType() == Types.LEFT_SQUARE_BRACKET &&
                    subscript.getRightExpression() instanceof ConstantExpression) {
                Object key = ((ConstantExpression) subscript.getRightExpression()).getValue();
                if (key instanceof String)
                    return (String) key;
            }
        }
        String text = target instanceof Expression ? ((Expression) target).getText() : String.valueOf(target);
        throw new UnsupportedTargetException("Cannot name assignment target: " + text);
    }

    @Override
    public CompilationResult compile(SourceFile sf, Marker marker) {
        return compiler.compile(sf, marker);
    }
}
