package org.clyze.source.callsite.source.java;

import com.github.javaparser.Position;
import com.github.javaparser.ast.Node;
import java.util.Optional;
import org.clyze.source.callsite.source.model.TextRange;

/** A collection of utilities used during parsing of Java sources. */
public class JavaUtils {
    public static TextRange createRangeFromNode(Node node) {
        Optional<Position> begin = node.getBegin();
        Optional<Position> end = node.getEnd();
        if (!begin.isPresent() || !end.isPresent())
            return TextRange.UNKNOWN;
        Position b = begin.get();
        Position e = end.get();
        return new TextRange(b.line, b.column, e.line, e.column + 1);
    }

    /** Orders nodes by their start position; nodes without one go last. */
    static int compareByStart(Node n1, Node n2) {
        Optional<Position> b1 = n1.getBegin();
        Optional<Position> b2 = n2.getBegin();
        if (b1.isPresent() && b2.isPresent())
            return b1.get().compareTo(b2.get());
        return Boolean.compare(!b1.isPresent(), !b2.isPresent());
    }
}
