package io.github.eutro.irhtml.core.ir;

import io.github.eutro.irhtml.core.ext.CommonExts;
import org.jetbrains.annotations.Nullable;

/**
 * An instruction builder, which encapsulates a position in a function
 * where instructions are being inserted.
 */
public class IRBuilder {
    /**
     * The function being inserted into.
     */
    public final Function func;
    private BasicBlock bb;
    private int index = -1;
    private @Nullable DebugLocation location;

    /**
     * Construct an instruction builder, inserting at the end of a block.
     *
     * @param func The function.
     * @param bb   One of the function's basic blocks.
     */
    public IRBuilder(Function func, BasicBlock bb) {
        this.func = func;
        this.bb = bb;
    }

    public BasicBlock getBlock() {
        return bb;
    }

    /**
     * Set the block this builder should insert at the end of.
     *
     * @param bb The block.
     */
    public void setBlock(BasicBlock bb) {
        this.bb = bb;
        this.index = -1;
    }

    /**
     * Insert before the instruction at {@code index} of {@code bb}, and after each instruction
     * inserted since.
     *
     * @param bb    The block.
     * @param index The index in the block.
     */
    public void setInsertPoint(BasicBlock bb, int index) {
        this.bb = bb;
        this.index = index;
    }

    /**
     * Set the debug location attached to instructions inserted from now on.
     *
     * @param location The location, or null for none.
     */
    public void setDebugLocation(@Nullable DebugLocation location) {
        this.location = location;
    }

    /**
     * Insert an instruction at the current position.
     *
     * @param insn The instruction.
     * @return The same instruction.
     */
    public Value insert(Value insn) {
        if (location != null && !insn.hasDebugLocation()) {
            insn.setDebugLocation(location);
        }
        if (index < 0) {
            bb.getInstructions().add(insn);
        } else {
            bb.getInstructions().add(index++, insn);
        }
        return insn;
    }

    public Value binary(Opcode op, Value lhs, Value rhs) {
        return insert(Value.instruction(op, lhs.getType(), lhs, rhs));
    }

    public Value compare(Opcode op, Predicate pred, Value lhs, Value rhs) {
        Value insn = Value.instruction(op, Type.I1, lhs, rhs);
        insn.attachExt(CommonExts.PREDICATE, pred);
        return insert(insn);
    }

    public Value icmp(Predicate pred, Value lhs, Value rhs) {
        return compare(Opcode.ICMP, pred, lhs, rhs);
    }

    public Value cast(Opcode op, Value value, Type to) {
        return insert(Value.instruction(op, to, value));
    }

    public Value select(Value cond, Value ifTrue, Value ifFalse) {
        return insert(Value.instruction(Opcode.SELECT, ifTrue.getType(), cond, ifTrue, ifFalse));
    }

    public Value alloca(Type type) {
        Value insn = Value.instruction(Opcode.ALLOCA, Type.PTR);
        insn.attachExt(CommonExts.ALLOCATED_TYPE, type);
        return insert(insn);
    }

    public Value load(Type type, Value ptr) {
        return insert(Value.instruction(Opcode.LOAD, type, ptr));
    }

    public Value store(Value value, Value ptr) {
        return insert(Value.instruction(Opcode.STORE, Type.VOID, value, ptr));
    }

    public Value gep(Type sourceType, Value base, Value... indices) {
        Value insn = Value.instruction(Opcode.GETELEMENTPTR, Type.PTR, base);
        for (Value idx : indices) {
            insn.addOperand(idx);
        }
        insn.attachExt(CommonExts.SOURCE_ELEMENT_TYPE, sourceType);
        return insert(insn);
    }

    public Value call(Function callee, Value... args) {
        Value insn = Value.instruction(Opcode.CALL, callee.getReturnType(), callee.getValue());
        for (Value arg : args) {
            insn.addOperand(arg);
        }
        return insert(insn);
    }

    /**
     * Insert a phi with no incoming values yet, see {@link #addIncoming(Value, Value, BasicBlock)}.
     *
     * @param type The type.
     * @return The phi.
     */
    public Value phi(Type type) {
        return insert(Value.instruction(Opcode.PHI, type));
    }

    public static void addIncoming(Value phi, Value value, BasicBlock pred) {
        phi.addOperand(value);
        phi.addOperand(pred.getValue());
    }

    public Value br(BasicBlock target) {
        return insert(Value.instruction(Opcode.BR, Type.VOID, target.getValue()));
    }

    public Value condBr(Value cond, BasicBlock ifTrue, BasicBlock ifFalse) {
        return insert(Value.instruction(Opcode.BR, Type.VOID, cond, ifTrue.getValue(), ifFalse.getValue()));
    }

    public Value ret() {
        return insert(Value.instruction(Opcode.RET, Type.VOID));
    }

    public Value ret(Value value) {
        return insert(Value.instruction(Opcode.RET, Type.VOID, value));
    }

    public Value unreachable() {
        return insert(Value.instruction(Opcode.UNREACHABLE, Type.VOID));
    }
}
