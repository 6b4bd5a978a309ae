package org.clyze.source.callsite.target;

import java.util.ArrayList;
import java.util.List;
import org.clyze.source.callsite.NoBindingFoundException;
import org.clyze.source.callsite.UnsupportedTargetException;
import org.clyze.source.callsite.source.model.BindingConstruct;
import org.clyze.source.callsite.source.model.SourceFile;
import org.clyze.source.callsite.source.model.SyntaxNode;

/** Finds the names that receive the value of an expression. */
public class AssignmentTargetResolver {
    private final boolean debug;

    public AssignmentTargetResolver(boolean debug) {
        this.debug = debug;
    }

    /**
     * Walk up from a node to the nearest acceptable binding construct whose
     * value contains the node, without leaving the node's lambda, closure or method.
     * @param sf            the source file of the node
     * @param node          the starting node, usually a call
     * @param allowSingle   accept constructs binding a single name
     * @param allowLoops    accept loop variables
     * @return              the bound names, left to right
     * @throws UnsupportedTargetException if the accepted construct has a
     *         target that is not a name, or is a chained assignment
     * @throws NoBindingFoundException if no ancestor is acceptable
     */
    public AssignedNames resolve(SourceFile sf, SyntaxNode node, boolean allowSingle, boolean allowLoops) {
        SyntaxNode from = node;
        for (SyntaxNode current = sf.getParent(node); current != null; current = sf.getParent(current)) {
            // A lambda or closure body does not hand its values to the enclosing code.
            if (current.kind.startsUnit())
                break;
            BindingConstruct binding = sf.processor.bindingAt(sf, current, from);
            from = current;
            if (binding == null || (binding.kind.isLoopLike() && !allowLoops))
                continue;
            if (binding.chained)
                throw new UnsupportedTargetException("Chained assignment at " + sf.getSource(current));
            List<String> names = new ArrayList<>();
            for (Object target : binding.targets)
                names.add(sf.processor.targetName(target));
            if (debug)
                System.out.println("Binding " + binding + ": " + names);
            if (names.size() > 1 || allowSingle)
                return new AssignedNames(names, current);
        }
        throw new NoBindingFoundException("No binding construct receives " + sf.getSource(node) + " in " + sf);
    }
}
