package org.clyze.source.callsite.matcher;

import java.util.*;
import org.clyze.source.callsite.AmbiguousCallSiteException;
import org.clyze.source.callsite.source.model.NodeKind;
import org.clyze.source.callsite.source.model.SourceFile;
import org.clyze.source.callsite.source.model.SyntaxNode;

/** The statements of a source file that own the code of one line. */
public class StatementGroup {
    public final SourceFile sourceFile;
    public final int line;
    public final List<SyntaxNode> statements;

    private StatementGroup(SourceFile sourceFile, int line, List<SyntaxNode> statements) {
        this.sourceFile = sourceFile;
        this.line = line;
        this.statements = Collections.unmodifiableList(statements);
    }

    /**
     * Find the statement executing at a line: the outermost statement of the
     * nodes starting on that line or, if none starts there, the innermost
     * statement spanning it.
     * @param sf     the source file
     * @param line   the 1-based line
     * @return       a group with exactly one statement
     * @throws AmbiguousCallSiteException if no statement or several statements own the line
     */
    public static StatementGroup at(SourceFile sf, int line) {
        Set<SyntaxNode> found = new LinkedHashSet<>();
        for (SyntaxNode node : sf.getNodesAt(line)) {
            SyntaxNode stmt = sf.containingStatement(node);
            if (stmt != null)
                found.add(stmt);
        }
        List<SyntaxNode> maximal = new ArrayList<>();
        for (SyntaxNode stmt : found)
            if (found.stream().noneMatch(other -> other != stmt && sf.isAncestorOrSelf(other, stmt)))
                maximal.add(stmt);
        if (maximal.isEmpty()) {
            SyntaxNode covering = innermostCovering(sf, line);
            if (covering != null)
                maximal.add(covering);
        }
        if (maximal.isEmpty())
            throw new AmbiguousCallSiteException("No statement at " + sf + ":" + line);
        if (maximal.size() > 1)
            throw new AmbiguousCallSiteException(maximal.size() + " statements share line " + sf + ":" + line);
        return new StatementGroup(sf, line, maximal);
    }

    private static SyntaxNode innermostCovering(SourceFile sf, int line) {
        SyntaxNode best = null;
        for (SyntaxNode node : sf.getNodes())
            if (node.kind == NodeKind.STATEMENT && node.range.coversLine(line))
                // Later arena nodes covering the line are nested in earlier ones.
                best = node;
        return best;
    }

    public SyntaxNode first() {
        return statements.get(0);
    }

    /** Returns the statement that follows the group in the same body, or null. */
    public SyntaxNode next() {
        SyntaxNode first = first();
        int after = first.getSubtreeEnd();
        if (after >= sourceFile.getNodes().size())
            return null;
        SyntaxNode node = sourceFile.getNode(after);
        return node.parentIndex == first.parentIndex && node.kind == NodeKind.STATEMENT ? node : null;
    }

    /** Returns the call nodes of the group, outer to inner, left to right. */
    public List<SyntaxNode> getCalls() {
        List<SyntaxNode> calls = new ArrayList<>();
        for (SyntaxNode stmt : statements) {
            if (stmt.isCall())
                calls.add(stmt);
            for (SyntaxNode node : sourceFile.getDescendants(stmt))
                if (node.isCall())
                    calls.add(node);
        }
        return calls;
    }

    @Override
    public String toString() {
        return sourceFile + ":" + line + " " + statements;
    }
}
