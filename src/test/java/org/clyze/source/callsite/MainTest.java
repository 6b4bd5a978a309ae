package org.clyze.source.callsite;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import org.clyze.source.callsite.fixtures.JavaCalls;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class MainTest {

    private static String[] argsFor(ExecutionPosition position, String... extra) {
        String[] base = new String[] {
                "--source", position.sourcePath.toString(),
                "--class", position.unit.className,
                "--method", position.unit.methodName,
                "--descriptor", position.unit.descriptor,
                "--line", String.valueOf(position.line),
                "--offset", String.valueOf(position.offset)
        };
        String[] args = new String[base.length + extra.length];
        System.arraycopy(base, 0, args, 0, base.length);
        System.arraycopy(extra, 0, args, base.length, extra.length);
        return args;
    }

    /** Resolve a position captured at runtime, as an external tool would pass it. */
    @Test
    void resolvesCapturedPosition() {
        ExecutionPosition position = JavaCalls.position();
        CallSite site = Main.run(argsFor(position, "--assigned", "--allow-single"));
        assertNotNull(site);
        assertEquals("Probe.position()", site.getCallSource());
        assertEquals(Collections.singletonList("position"), site.assignedNames(true, false).names);
    }

    @Test
    void optionDependencies() {
        ExecutionPosition position = JavaCalls.position();
        assertNull(Main.run(argsFor(position, "--allow-loops")));
    }

    @Test
    void badInput() {
        assertNull(Main.run(new String[0]));
        assertNull(Main.run(new String[] {"--help"}));
        assertNull(Main.run(new String[] {"--source", "Missing.java", "-c", "A", "-m", "m", "-l", "1", "-o", "0"}));
        ExecutionPosition position = JavaCalls.position();
        assertNull(Main.run(new String[] {"-s", position.sourcePath.toString(), "-c", "A", "-m", "m", "-l", "x", "-o", "0"}));
    }

    @Test
    void resolutionErrorsAreReported() {
        ExecutionPosition position = JavaCalls.position();
        // Line 1 holds the package declaration, not a statement.
        String[] args = new String[] {
                "-s", position.sourcePath.toString(), "-c", position.unit.className,
                "-m", position.unit.methodName, "-l", "1", "-o", "0"
        };
        assertNull(Main.run(args));
    }

    @Test
    void internalFailuresAreReported() {
        ExecutionPosition position = JavaCalls.position();
        PrintStream err = System.err;
        ByteArrayOutputStream captured = new ByteArrayOutputStream();
        System.setErr(new PrintStream(captured, true));
        try {
            CallSite site = Main.run(argsFor(position), options -> new CallSiteResolver(options) {
                @Override
                public CallSite resolveCallSite(ExecutionPosition p) {
                    throw new IllegalStateException("Instruction count mismatch");
                }
            });
            assertNull(site);
        } finally {
            System.setErr(err);
        }
        String output = new String(captured.toByteArray(), StandardCharsets.UTF_8);
        assertTrue(output.startsWith("ERROR: Instruction count mismatch"), output);
    }
}
