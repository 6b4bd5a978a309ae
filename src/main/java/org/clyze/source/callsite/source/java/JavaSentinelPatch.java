package org.clyze.source.callsite.source.java;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.expr.LambdaExpr;
import com.github.javaparser.ast.stmt.*;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.clyze.source.callsite.matcher.Marker;
import org.clyze.source.callsite.matcher.Sentinels;
import org.clyze.source.callsite.source.model.LineMap;
import org.clyze.source.callsite.source.model.SourceFile;
import org.clyze.source.callsite.source.model.TextRange;

/**
 * Produces copies of a Java source text carrying a sentinel. Several
 * placements may be possible for a call; they are returned in the order
 * they should be tried, since only the compiler can tell which ones type-check.
 */
final class JavaSentinelPatch {
    private static final String SENTINELS = Sentinels.class.getName();

    private JavaSentinelPatch() {}

    static List<String> variants(SourceFile sf, Marker marker) {
        if (marker.kind == Marker.Kind.STATEMENT) {
            String patched = markStatement(sf, marker);
            return patched == null ? Collections.emptyList() : Collections.singletonList(patched);
        }
        Node call = (Node) marker.node.ast;
        String sentinel = literal(marker.sentinel);
        TextRange callRange = marker.node.range;
        List<String> variants = new ArrayList<>();
        Node parent = call.getParentNode().orElse(null);
        if (parent instanceof ExpressionStmt) {
            TextRange stmtRange = JavaUtils.createRangeFromNode(parent);
            boolean lambdaBody = parent.getParentNode().filter(p -> p instanceof LambdaExpr).isPresent();
            if (lambdaBody) {
                variants.add(wrap(sf, callRange, sentinel));
                // Lambda expression bodies have no semicolon of their own.
                variants.add(surround(sf, stmtRange, "{ ", "; " + SENTINELS + ".mark(" + sentinel + "); }"));
            } else {
                variants.add(surround(sf, stmtRange, "{ ", " " + SENTINELS + ".mark(" + sentinel + "); }"));
                variants.add(wrap(sf, callRange, sentinel));
            }
        } else if (parent instanceof ForStmt && inForLists((ForStmt) parent, call)) {
            variants.add(surround(sf, callRange, "", ", " + SENTINELS + ".mark(" + sentinel + ")"));
            variants.add(wrap(sf, callRange, sentinel));
        } else
            variants.add(wrap(sf, callRange, sentinel));
        return variants;
    }

    private static boolean inForLists(ForStmt forStmt, Node call) {
        return forStmt.getInitialization().stream().anyMatch(e -> e == call) ||
                forStmt.getUpdate().stream().anyMatch(e -> e == call);
    }

    /** Returns the patched text, or null if no statement may precede this one. */
    private static String markStatement(SourceFile sf, Marker marker) {
        Object ast = marker.node.ast;
        if (!(ast instanceof Statement) || ast instanceof ExplicitConstructorInvocationStmt)
            return null;
        Node parent = ((Node) ast).getParentNode().orElse(null);
        boolean inBlock = parent instanceof BlockStmt ||
                (parent instanceof SwitchEntry && ((SwitchEntry) parent).getType() == SwitchEntry.Type.STATEMENT_GROUP);
        if (!inBlock)
            return null;
        return surround(sf, marker.node.range, SENTINELS + ".mark(" + literal(marker.sentinel) + "); ", "");
    }

    private static String wrap(SourceFile sf, TextRange range, String sentinel) {
        return surround(sf, range, SENTINELS + ".after(", ", " + sentinel + ")");
    }

    private static String surround(SourceFile sf, TextRange range, String before, String after) {
        LineMap lines = sf.getLineMap();
        int start = lines.offsetOf(range.startLine, range.startColumn);
        int end = lines.offsetOf(range.endLine, range.endColumn);
        String text = sf.text;
        return text.substring(0, start) + before + text.substring(start, end) + after + text.substring(end);
    }

    private static String literal(String s) {
        return "\"" + s + "\"";
    }
}
