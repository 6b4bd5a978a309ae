package org.clyze.source.callsite;

import java.io.File;
import org.clyze.source.callsite.ir.CompilationResult;
import org.clyze.source.callsite.matcher.Marker;
import org.clyze.source.callsite.source.model.BindingConstruct;
import org.clyze.source.callsite.source.model.CallExpression;
import org.clyze.source.callsite.source.model.SourceFile;
import org.clyze.source.callsite.source.model.SyntaxNode;

/** The interface of all language front ends. */
public interface SourceProcessor {
    /**
     * Parse and index a source file.
     * @param srcFile    the source file
     * @return           the indexed source file
     * @throws MalformedSourceException if the file cannot be read or parsed
     */
    SourceFile process(File srcFile);

    /**
     * Break a call node into its parts.
     * @param sf         the source file containing the node
     * @param call       a node of kind CALL
     * @return           the call's name and arguments
     */
    CallExpression describeCall(SourceFile sf, SyntaxNode call);

    /**
     * Classify a node as a binding construct.
     * @param sf         the source file containing the node
     * @param node       the candidate binding node
     * @param from       the child of {@code node} the upward walk came from
     * @return           the binding, or null if {@code node} does not bind the
     *                   value coming from {@code from}
     */
    BindingConstruct bindingAt(SourceFile sf, SyntaxNode node, SyntaxNode from);

    /**
     * Name a binding target.
     * @param target     one of {@link BindingConstruct#targets}
     * @return           the bound name
     * @throws UnsupportedTargetException if the target shape has no name
     */
    String targetName(Object target);

    /**
     * Recompile a source file, optionally carrying a sentinel marker.
     * @param sf         the source file
     * @param marker     the marker to place or null for the unmodified file
     * @return           the compiled classes, or a failed result
     */
    CompilationResult compile(SourceFile sf, Marker marker);
}
