package io.github.eutro.irhtml.core.ir;

import io.github.eutro.irhtml.core.ext.CommonExts;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ValueTest {
    @Test
    void testOperandsRecordUses() {
        Value one = Value.constant(Type.I32, 1);
        Value add = Value.instruction(Opcode.ADD, Type.I32, one, one);
        assertEquals(Arrays.asList(new Use(add, 0), new Use(add, 1)), one.getUses());
        assertTrue(one.hasMultipleUses());
    }

    @Test
    void testSetOperandMovesUse() {
        Value one = Value.constant(Type.I32, 1);
        Value two = Value.constant(Type.I32, 2);
        Value add = Value.instruction(Opcode.ADD, Type.I32, one, one);
        add.setOperand(1, two);
        assertEquals(Collections.singletonList(new Use(add, 0)), one.getUses());
        assertEquals(Collections.singletonList(new Use(add, 1)), two.getUses());

        add.setOperand(0, null);
        assertEquals(0, one.getNumUses());
        assertNull(add.getOperand(0));
        assertNull(add.getOperand(5));
    }

    @Test
    void testUseListOrder() {
        Value one = Value.constant(Type.I32, 1);
        Value a = Value.instruction(Opcode.ADD, Type.I32, one);
        Value b = Value.instruction(Opcode.ADD, Type.I32, one);
        List<Use> uses = one.getUses();
        one.setUseListOrder(Arrays.asList(uses.get(1), uses.get(0)));
        assertSame(b, one.getUses().get(0).user);
        assertSame(a, one.getUses().get(1).user);

        assertThrows(IllegalArgumentException.class,
                () -> one.setUseListOrder(Collections.singletonList(new Use(a, 0))));
        assertThrows(IllegalArgumentException.class,
                () -> one.setUseListOrder(Arrays.asList(new Use(a, 0), new Use(a, 1))));
    }

    @Test
    void testOwnership() {
        Module module = new Module("m");
        Function func = module.addFunction("f", Type.VOID);
        BasicBlock bb = func.newBb("entry");
        Value ret = new IRBuilder(func, bb).ret();

        assertSame(bb, ret.getNullable(CommonExts.OWNING_BLOCK));
        assertSame(func, ret.getNullable(CommonExts.OWNING_FUNCTION));
        assertSame(module, ret.getNullable(CommonExts.OWNING_MODULE));
        assertSame(func, bb.getFunction());

        bb.getInstructions().remove(ret);
        assertNull(ret.getNullable(CommonExts.OWNING_FUNCTION));
        assertThrows(IllegalArgumentException.class, () -> bb.getInstructions().add(Value.constant(Type.I32, 0)));
    }

    @Test
    void testInsertPoint() {
        Function func = new Module("m").addFunction("f", Type.VOID);
        BasicBlock bb = func.newBb();
        IRBuilder ib = new IRBuilder(func, bb);
        Value ret = ib.ret();
        ib.setInsertPoint(bb, 0);
        Value first = ib.alloca(Type.I32);
        Value second = ib.alloca(Type.I64);
        assertEquals(Arrays.asList(first, second, ret), bb.getInstructions());
    }
}
