package org.clyze.source.callsite.target;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import org.clyze.source.callsite.NoBindingFoundException;
import org.clyze.source.callsite.ResolverOptions;
import org.clyze.source.callsite.UnsupportedTargetException;
import org.clyze.source.callsite.source.SourceIndex;
import org.clyze.source.callsite.source.model.CallExpression;
import org.clyze.source.callsite.source.model.SourceFile;
import org.clyze.source.callsite.source.model.SyntaxNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.*;

public class AssignmentTargetResolverTest {
    private static final String JAVA = String.join("\n",
            "class Snippet {",
            "    Object f;",
            "    void run(Object[] arr) {",
            "        Object a = make();",
            "        Object b;",
            "        b = assigned();",
            "        Object c, d;",
            "        c = d = chained();",
            "        for (Object e : items()) { use(e); }",
            "        this.f = field();",
            "        arr[0] = indexed();",
            "        use(argument());",
            "        Object g = wrap(inner());",
            "        arr[position()] = null;",
            "        Object h = c = declared();",
            "        java.util.function.Supplier<Object> lazy = () -> deferred();",
            "    }",
            "}");

    private static final String GROOVY = String.join("\n",
            "def (x, y) = pair()",
            "z = value()",
            "obj.prop = prop()",
            "map['k'] = keyed()",
            "list[0] = indexed()",
            "for (item in items()) { println item }",
            "Probe.keywords(alpha: 1, beta: 'x')",
            "p = q = chain()",
            "closure = { later() }",
            "");

    @TempDir
    Path dir;
    private SourceIndex index;
    private AssignmentTargetResolver resolver;

    @BeforeEach
    void setUp() {
        index = new SourceIndex(ResolverOptions.defaults());
        resolver = new AssignmentTargetResolver(false);
    }

    private SourceFile write(String name, String text) throws IOException {
        Path file = dir.resolve(name);
        Files.write(file, text.getBytes(StandardCharsets.UTF_8));
        return index.index(file);
    }

    private static SyntaxNode call(SourceFile sf, String name) {
        for (SyntaxNode node : sf.getNodes())
            if (node.isCall() && sf.processor.describeCall(sf, node).name.equals(name))
                return node;
        throw new AssertionError("No call to " + name + " in " + sf);
    }

    private AssignedNames names(SourceFile sf, String call, boolean allowSingle, boolean allowLoops) {
        return resolver.resolve(sf, call(sf, call), allowSingle, allowLoops);
    }

    @Test
    void javaDeclarationsAndAssignments() throws IOException {
        SourceFile sf = write("Snippet.java", JAVA);
        assertEquals(Collections.singletonList("a"), names(sf, "make", true, false).names);
        assertThrows(NoBindingFoundException.class, () -> names(sf, "make", false, false));
        assertEquals(Collections.singletonList("b"), names(sf, "assigned", true, false).names);
        assertEquals(Collections.singletonList("f"), names(sf, "field", true, false).names);
        assertEquals(Collections.singletonList("g"), names(sf, "inner", true, false).names);
    }

    @Test
    void javaLoopVariable() throws IOException {
        SourceFile sf = write("Snippet.java", JAVA);
        AssignedNames names = names(sf, "items", true, true);
        assertEquals(Collections.singletonList("e"), names.names);
        assertThrows(NoBindingFoundException.class, () -> names(sf, "items", true, false));
    }

    @Test
    void javaUnsupportedTargets() throws IOException {
        SourceFile sf = write("Snippet.java", JAVA);
        assertThrows(UnsupportedTargetException.class, () -> names(sf, "chained", true, false));
        assertThrows(UnsupportedTargetException.class, () -> names(sf, "indexed", true, false));
        assertThrows(UnsupportedTargetException.class, () -> names(sf, "declared", true, false));
    }

    @Test
    void javaValueSideOnly() throws IOException {
        SourceFile sf = write("Snippet.java", JAVA);
        assertThrows(NoBindingFoundException.class, () -> names(sf, "argument", true, true));
        assertThrows(NoBindingFoundException.class, () -> names(sf, "position", true, true));
    }

    @Test
    void javaLambdaBodyIsNotAssigned() throws IOException {
        SourceFile sf = write("Snippet.java", JAVA);
        assertThrows(NoBindingFoundException.class, () -> names(sf, "deferred", true, true));
    }

    @Test
    void groovyClosureBodyIsNotAssigned() throws IOException {
        SourceFile sf = write("snippet.groovy", GROOVY);
        assertThrows(NoBindingFoundException.class, () -> names(sf, "later", true, true));
    }

    @Test
    void groovyMultipleAssignment() throws IOException {
        SourceFile sf = write("snippet.groovy", GROOVY);
        AssignedNames names = names(sf, "pair", false, false);
        assertEquals(Arrays.asList("x", "y"), names.names);
        assertNotNull(names.binding);
    }

    @Test
    void groovySingleTargets() throws IOException {
        SourceFile sf = write("snippet.groovy", GROOVY);
        assertThrows(NoBindingFoundException.class, () -> names(sf, "value", false, false));
        assertEquals(Collections.singletonList("z"), names(sf, "value", true, false).names);
        assertEquals(Collections.singletonList("prop"), names(sf, "prop", true, false).names);
        assertEquals(Collections.singletonList("k"), names(sf, "keyed", true, false).names);
        assertThrows(UnsupportedTargetException.class, () -> names(sf, "indexed", true, false));
        assertThrows(UnsupportedTargetException.class, () -> names(sf, "chain", true, false));
    }

    @Test
    void groovyLoopVariable() throws IOException {
        SourceFile sf = write("snippet.groovy", GROOVY);
        assertEquals(Collections.singletonList("item"), names(sf, "items", true, true).names);
        assertThrows(NoBindingFoundException.class, () -> names(sf, "items", true, false));
    }

    @Test
    void groovyKeywordArguments() throws IOException {
        SourceFile sf = write("snippet.groovy", GROOVY);
        CallExpression call = sf.processor.describeCall(sf, call(sf, "keywords"));
        assertTrue(call.arguments.isEmpty());
        assertEquals(Arrays.asList("alpha", "beta"), Arrays.asList(call.keywordArguments.keySet().toArray()));
        assertNotNull(call.keywordArguments.get("alpha"));
    }
}
