package org.clyze.source.callsite;

import java.util.ArrayList;
import java.util.List;
import org.clyze.source.callsite.source.model.CallExpression;
import org.clyze.source.callsite.source.model.SourceFile;
import org.clyze.source.callsite.source.model.SyntaxNode;
import org.clyze.source.callsite.target.AssignedNames;
import org.clyze.source.callsite.target.AssignmentTargetResolver;

/** A resolved call site: the call node, where it executed, and its file. */
public class CallSite {
    private final SyntaxNode call;
    private final ExecutionPosition position;
    private final SourceFile sourceFile;
    private final AssignmentTargetResolver targets;

    public CallSite(SyntaxNode call, ExecutionPosition position, SourceFile sourceFile,
                    AssignmentTargetResolver targets) {
        this.call = call;
        this.position = position;
        this.sourceFile = sourceFile;
        this.targets = targets;
    }

    public SyntaxNode getCall() {
        return call;
    }

    public ExecutionPosition getPosition() {
        return position;
    }

    public SourceFile getSourceFile() {
        return sourceFile;
    }

    /**
     * Returns the exact source text of a node of this call site's file.
     * @param node   the node
     * @return       the text (possibly spanning several lines)
     */
    public String getSource(SyntaxNode node) {
        return sourceFile.getSource(node);
    }

    public String getCallSource() {
        return getSource(call);
    }

    public CallExpression getCallExpression() {
        return sourceFile.processor.describeCall(sourceFile, call);
    }

    /** Returns the source text of the positional arguments. */
    public List<String> getArgumentSources() {
        List<String> sources = new ArrayList<>();
        for (SyntaxNode arg : getCallExpression().arguments)
            sources.add(getSource(arg));
        return sources;
    }

    /**
     * Returns the names that receive the value of this call.
     * @param allowSingle   accept a binding of a single name
     * @param allowLoops    accept loop variables
     * @return              the names and the binding construct
     */
    public AssignedNames assignedNames(boolean allowSingle, boolean allowLoops) {
        return targets.resolve(sourceFile, call, allowSingle, allowLoops);
    }

    @Override
    public String toString() {
        return position.sourcePath + ":" + call.range + " " + getCallSource();
    }
}
