package io.github.eutro.irhtml.core.ir;

import io.github.eutro.irhtml.core.ext.CommonExts;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * A sequence of instructions, the last of which should be a terminator.
 * <p>
 * The block is referenced from branches and phis through its {@link #getValue() label value}.
 */
public final class BasicBlock {
    private final Value value = new Value(ValueKind.BASIC_BLOCK, null, Type.LABEL);
    private final List<Value> instructions = new TrackedList<Value>() {
        @Override
        protected void onAdded(Value elt) {
            if (elt.getKind() != ValueKind.INSTRUCTION) {
                throw new IllegalArgumentException("not an instruction: " + elt);
            }
            elt.attachExt(CommonExts.OWNING_BLOCK, BasicBlock.this);
        }

        @Override
        protected void onRemoved(Value elt) {
            elt.removeExt(CommonExts.OWNING_BLOCK);
        }
    };

    BasicBlock(@Nullable String name) {
        value.setName(name);
    }

    public Value getValue() {
        return value;
    }

    public @Nullable String getName() {
        return value.getName();
    }

    /**
     * Get the instructions of this block. The list may be modified, and instructions
     * added to it are adopted by this block.
     *
     * @return The instructions.
     */
    public List<Value> getInstructions() {
        return instructions;
    }

    public @Nullable Function getFunction() {
        return value.getNullable(CommonExts.OWNING_FUNCTION);
    }

    @Override
    public String toString() {
        return "BasicBlock{" + (value.hasName() ? value.getName() : "<unnamed>") + ", " + instructions.size() + " insns}";
    }
}
