package org.clyze.source.callsite.matcher;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.clyze.source.callsite.AmbiguousCallSiteException;
import org.clyze.source.callsite.ResolverOptions;
import org.clyze.source.callsite.source.SourceIndex;
import org.clyze.source.callsite.source.model.SourceFile;
import org.clyze.source.callsite.source.model.SyntaxNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.*;

public class StatementGroupTest {
    private static final String SOURCE = String.join("\n",
            "class G {",
            "    int run(int k) {",
            "        int a = f(g(k));",
            "        int b = f(1); int c = f(2);",
            "        if (k > 0) {",
            "            a++;",
            "        }",
            "        int d = f(",
            "            g(3));",
            "        return a + b + c + d;",
            "    }",
            "    int f(int x) { return x; }",
            "    int g(int x) { return x; }",
            "}",
            "");

    @TempDir
    Path dir;
    private SourceFile sf;

    @BeforeEach
    void setUp() throws IOException {
        Path file = dir.resolve("G.java");
        Files.write(file, SOURCE.getBytes(StandardCharsets.UTF_8));
        sf = new SourceIndex(ResolverOptions.defaults()).index(file);
    }

    @Test
    void callsAreOuterToInner() {
        StatementGroup group = StatementGroup.at(sf, 3);
        assertEquals("int a = f(g(k));", sf.getSource(group.first()));
        List<SyntaxNode> calls = group.getCalls();
        assertEquals(2, calls.size());
        assertEquals("f(g(k))", sf.getSource(calls.get(0)));
        assertEquals("g(k)", sf.getSource(calls.get(1)));
    }

    @Test
    void severalStatementsOnOneLine() {
        assertThrows(AmbiguousCallSiteException.class, () -> StatementGroup.at(sf, 4));
    }

    @Test
    void compoundStatementOwnsItsHeaderLine() {
        StatementGroup group = StatementGroup.at(sf, 5);
        assertTrue(sf.getSource(group.first()).startsWith("if (k > 0)"));
        assertTrue(group.getCalls().isEmpty());
    }

    @Test
    void continuationLineBelongsToItsStatement() {
        StatementGroup group = StatementGroup.at(sf, 9);
        assertEquals(8, group.first().range.startLine);
        assertEquals(2, group.getCalls().size());
    }

    @Test
    void lineWithoutStatement() {
        assertThrows(AmbiguousCallSiteException.class, () -> StatementGroup.at(sf, 1));
    }
}
