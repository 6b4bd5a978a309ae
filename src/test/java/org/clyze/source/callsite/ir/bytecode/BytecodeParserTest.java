package org.clyze.source.callsite.ir.bytecode;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import org.apache.commons.io.IOUtils;
import org.clyze.source.callsite.ExecutionPosition;
import org.clyze.source.callsite.fixtures.JavaCalls;
import org.clyze.source.callsite.ir.CompiledUnit;
import org.clyze.source.callsite.ir.Instruction;
import org.clyze.source.callsite.ir.UnitKind;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.objectweb.asm.Opcodes;

import static org.junit.jupiter.api.Assertions.*;

public class BytecodeParserTest {
    private static byte[] bytes;
    private final BytecodeParser parser = new BytecodeParser(false);

    @BeforeAll
    static void readClass() throws IOException {
        try (InputStream is = JavaCalls.class.getResourceAsStream("JavaCalls.class")) {
            assertNotNull(is);
            bytes = IOUtils.toByteArray(is);
        }
    }

    @Test
    void offsetsIncrease() {
        List<CompiledUnit> units = parser.parseClass(bytes);
        assertFalse(units.isEmpty());
        for (CompiledUnit unit : units) {
            int previous = -1;
            for (Instruction insn : unit.instructions) {
                assertTrue(insn.offset > previous, unit.dump());
                previous = insn.offset;
            }
        }
    }

    @Test
    void switchPaddingIsAccountedFor() {
        CompiledUnit unit = parser.parseUnit(bytes, "afterSwitch", null);
        assertNotNull(unit);
        assertTrue(unit.instructions.stream().anyMatch(i -> i.opcode == Opcodes.LOOKUPSWITCH), unit.dump());
        List<Instruction> calls = unit.getCallInstructions();
        assertEquals("withArgs", calls.get(calls.size() - 1).name);
    }

    @Test
    void capturedOffsetIsACall() {
        ExecutionPosition position = JavaCalls.position();
        assertEquals(JavaCalls.class.getName(), position.unit.className);
        CompiledUnit unit = parser.parseUnit(bytes, position.unit.methodName, position.unit.descriptor);
        assertNotNull(unit);
        int index = unit.callIndexAt(position.offset);
        assertTrue(index >= 0, unit.dump());
        assertEquals("position", unit.getCallInstructions().get(index).name);
        assertEquals(Integer.valueOf(unit.getFirstLine()), position.unitFirstLine);
    }

    @Test
    void lambdaUnits() {
        List<CompiledUnit> units = parser.parseClass(bytes);
        assertTrue(units.stream().anyMatch(u -> u.getKind() == UnitKind.LAMBDA));
    }

    @Test
    void unknownMethod() {
        assertNull(parser.parseUnit(bytes, "noSuchMethod", null));
    }
}
