package io.github.eutro.irhtml.core.slots;

import io.github.eutro.irhtml.core.ir.Function;
import io.github.eutro.irhtml.core.ir.Value;
import io.github.eutro.irhtml.core.ir.ValueKind;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Numbers the unnamed values of a module.
 * <p>
 * Slots are handed out the first time a value is asked about, so the numbering follows
 * the order values are encountered in, rather than the order they are defined in. There are
 * three independent counters: one for unnamed globals and functions ({@code @N}), one for
 * metadata ({@code !N}), and one for arguments, blocks and instructions ({@code %N}), which
 * restarts from zero at every {@link #enterFunction(Function) function}.
 * <p>
 * Named values and constants have no slot.
 */
public final class SlotTracker {
    public static final int NO_SLOT = -1;

    private final Map<Value, Integer> moduleSlots = new IdentityHashMap<>();
    private final Map<Value, Integer> metadataSlots = new IdentityHashMap<>();
    private final List<Value> metadataBySlot = new ArrayList<>();
    private final Map<Value, Boolean> visitedMetadata = new IdentityHashMap<>();

    private @Nullable Function function;
    private final Map<Value, Integer> localSlots = new IdentityHashMap<>();

    /**
     * Start numbering the locals of {@code func}, forgetting those of the previous function.
     *
     * @param func The function.
     */
    public void enterFunction(Function func) {
        function = func;
        localSlots.clear();
    }

    public void exitFunction() {
        function = null;
        localSlots.clear();
    }

    public @Nullable Function getFunction() {
        return function;
    }

    /**
     * Get the slot of a value, assigning the next free one in its scope if it has none yet.
     *
     * @param value The value.
     * @return The slot, or {@link #NO_SLOT} if the value is named, is a constant, or is
     * function-local while no function is entered.
     */
    public int getSlot(Value value) {
        if (value.getKind() != ValueKind.METADATA && value.hasName()) return NO_SLOT;
        switch (value.getKind().scope) {
            case FUNCTION:
                if (function == null) return NO_SLOT;
                return assign(localSlots, value);
            case MODULE:
                return assign(moduleSlots, value);
            case METADATA: {
                Integer slot = metadataSlots.get(value);
                if (slot != null) return slot;
                metadataBySlot.add(value);
                return assign(metadataSlots, value);
            }
            default:
                return NO_SLOT;
        }
    }

    /**
     * Get the slot of a value, without assigning one.
     *
     * @param value The value.
     * @return The slot, or {@link #NO_SLOT} if it has none yet.
     */
    public int peekSlot(Value value) {
        Map<Value, Integer> map;
        switch (value.getKind().scope) {
            case FUNCTION:
                map = localSlots;
                break;
            case MODULE:
                map = moduleSlots;
                break;
            case METADATA:
                map = metadataSlots;
                break;
            default:
                return NO_SLOT;
        }
        Integer slot = map.get(value);
        return slot == null ? NO_SLOT : slot;
    }

    private static int assign(Map<Value, Integer> slots, Value value) {
        Integer slot = slots.get(value);
        if (slot == null) {
            slot = slots.size();
            slots.put(value, slot);
        }
        return slot;
    }

    /**
     * Mark a metadata node as visited.
     *
     * @param node The node.
     * @return True if the node had not been visited before.
     */
    public boolean visitMetadata(Value node) {
        return visitedMetadata.put(node, Boolean.TRUE) == null;
    }

    /**
     * Get the numbered metadata nodes, in slot order. The list grows as more nodes are numbered.
     *
     * @return The nodes.
     */
    public List<Value> getNumberedMetadata() {
        return Collections.unmodifiableList(metadataBySlot);
    }
}
