package org.clyze.source.callsite;

import org.clyze.source.callsite.matcher.CompiledFormSynthesizer;
import org.clyze.source.callsite.matcher.InstructionMatcher;
import org.clyze.source.callsite.source.SourceIndex;
import org.clyze.source.callsite.source.SourceLocator;
import org.clyze.source.callsite.source.model.SourceFile;
import org.clyze.source.callsite.source.model.SyntaxNode;
import org.clyze.source.callsite.target.AssignedNames;
import org.clyze.source.callsite.target.AssignmentTargetResolver;

/**
 * Maps execution positions to call sites. A resolver owns its caches;
 * independent resolvers share nothing. Instances are thread-safe.
 */
public class CallSiteResolver {
    private final ResolverOptions options;
    private final SourceIndex sourceIndex;
    private final InstructionMatcher matcher;
    private final AssignmentTargetResolver targets;
    private final PositionCapture capture;

    public CallSiteResolver() {
        this(ResolverOptions.defaults());
    }

    public CallSiteResolver(ResolverOptions options) {
        boolean debug = options.isDebug();
        this.options = options;
        this.sourceIndex = new SourceIndex(options);
        this.matcher = new InstructionMatcher(new CompiledFormSynthesizer(debug), debug);
        this.targets = new AssignmentTargetResolver(debug);
        this.capture = new PositionCapture(new SourceLocator(options.getSourceRoots()),
                options.getExcludedClasses(), debug);
    }

    /**
     * Resolve the call executing at a position.
     * @param position   the execution position
     * @return           the call site
     * @throws MalformedSourceException if the source cannot be parsed
     * @throws AmbiguousCallSiteException if no single call can be identified
     */
    public CallSite resolveCallSite(ExecutionPosition position) {
        SourceFile sf = sourceIndex.index(position.sourcePath);
        SyntaxNode call = matcher.matchCall(position, sf);
        if (options.isDebug())
            System.out.println("Resolved " + position + " to " + sf.getSource(call));
        return new CallSite(call, position, sf, targets);
    }

    /**
     * Capture the position of the code that called {@code callee} and resolve it.
     * @param callee   the class whose method is asking for its call site
     * @return         the call site in the caller
     */
    public CallSite resolveCaller(Class<?> callee) {
        return resolveCallSite(capture(callee));
    }

    public ExecutionPosition capture(Class<?> callee) {
        return capture.callerOf(callee);
    }

    public AssignedNames resolveAssignmentTarget(SourceFile sf, SyntaxNode node, boolean allowSingle, boolean allowLoops) {
        return targets.resolve(sf, node, allowSingle, allowLoops);
    }

    public SourceIndex getSourceIndex() {
        return sourceIndex;
    }

    public ResolverOptions getOptions() {
        return options;
    }
}
