package io.github.eutro.irhtml.core.slots;

import io.github.eutro.irhtml.core.ir.Function;
import io.github.eutro.irhtml.core.ir.Module;
import io.github.eutro.irhtml.core.ir.Opcode;
import io.github.eutro.irhtml.core.ir.Type;
import io.github.eutro.irhtml.core.ir.Value;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SlotTrackerTest {
    private final Module module = new Module("slots");

    @Test
    void testLocalsNumberedOnFirstEncounter() {
        Function f = module.addFunction("f", Type.VOID);
        Value a = f.addArgument(Type.I32, null);
        Value b = f.addArgument(Type.I32, null);
        Value named = f.addArgument(Type.I32, "n");

        SlotTracker slots = new SlotTracker();
        slots.enterFunction(f);
        assertEquals(SlotTracker.NO_SLOT, slots.peekSlot(b));
        assertEquals(0, slots.getSlot(b));
        assertEquals(1, slots.getSlot(a));
        assertEquals(0, slots.getSlot(b));
        assertEquals(1, slots.peekSlot(a));
        assertEquals(SlotTracker.NO_SLOT, slots.getSlot(named));
        assertEquals(SlotTracker.NO_SLOT, slots.getSlot(Value.constant(Type.I32, 4)));
    }

    @Test
    void testLocalsRestartPerFunction() {
        Function f = module.addFunction("f", Type.VOID);
        Function g = module.addFunction("g", Type.VOID);
        Value x = f.addArgument(Type.I32, null);
        Value y = g.addArgument(Type.I32, null);

        SlotTracker slots = new SlotTracker();
        slots.enterFunction(f);
        assertEquals(0, slots.getSlot(x));
        slots.enterFunction(g);
        assertEquals(SlotTracker.NO_SLOT, slots.peekSlot(x));
        assertEquals(0, slots.getSlot(y));
        slots.exitFunction();
        assertNull(slots.getFunction());
        assertEquals(SlotTracker.NO_SLOT, slots.getSlot(y));
    }

    @Test
    void testScopesAreIndependent() {
        Value global = module.addGlobal(null, Type.I32, false, null);
        Function anon = module.addFunction(null, Type.VOID);
        Value insn = Value.instruction(Opcode.ADD, Type.I32, Value.constant(Type.I32, 1), Value.constant(Type.I32, 2));
        Value md = Value.metadata();

        SlotTracker slots = new SlotTracker();
        slots.enterFunction(anon);
        assertEquals(0, slots.getSlot(insn));
        assertEquals(0, slots.getSlot(global));
        assertEquals(1, slots.getSlot(anon.getValue()));
        assertEquals(0, slots.getSlot(md));
    }

    @Test
    void testMetadataNumberingAndVisits() {
        Value first = Value.metadata();
        Value second = Value.distinctMetadata(first);

        SlotTracker slots = new SlotTracker();
        assertEquals(0, slots.getSlot(second));
        assertEquals(1, slots.getSlot(first));
        assertEquals(0, slots.getSlot(second));
        assertEquals(2, slots.getNumberedMetadata().size());
        assertSame(second, slots.getNumberedMetadata().get(0));

        assertTrue(slots.visitMetadata(first));
        assertFalse(slots.visitMetadata(first));
    }
}
