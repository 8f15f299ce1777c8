package io.github.eutro.irhtml.core.ir;

import io.github.eutro.irhtml.core.ext.CommonExts;
import io.github.eutro.irhtml.core.ext.Ext;
import io.github.eutro.irhtml.core.ext.ExtHolder;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * A node of the program graph.
 * <p>
 * Values are not subclassed: what a value is is given by its {@link #getKind() kind}, and
 * whatever else it may carry (a debug location, a predicate, a linkage...) is attached
 * as an ext, see {@link CommonExts}.
 * <p>
 * Operands are references, never ownership. Setting an operand records a {@link Use}
 * on the operand, in the order the edges are made; that order is a property of
 * the graph and is kept as is.
 */
public final class Value extends ExtHolder {
    private final ValueKind kind;
    private @Nullable String name;
    private @Nullable Type type;
    private @Nullable Opcode opcode;
    private @Nullable String literal;
    private boolean distinct;

    private final List<Value> operands = new ArrayList<>();
    private final List<Use> uses = new ArrayList<>();

    Value(ValueKind kind, @Nullable String name, @Nullable Type type) {
        this.kind = kind;
        this.name = name;
        this.type = type;
    }

    /**
     * Create an instruction, not yet in any block.
     *
     * @param opcode The opcode.
     * @param type   The result type, {@link Type#VOID} if there is no result.
     * @param args   The operands.
     * @return The instruction.
     */
    public static Value instruction(@NotNull Opcode opcode, @Nullable Type type, Value... args) {
        Value insn = new Value(ValueKind.INSTRUCTION, null, type);
        insn.opcode = opcode;
        for (Value arg : args) {
            insn.addOperand(arg);
        }
        return insn;
    }

    /**
     * Create a constant, printed as {@code literal}.
     *
     * @param type    The type.
     * @param literal The text of the constant, e.g. {@code 42}, {@code null} or {@code zeroinitializer}.
     * @return The constant.
     */
    public static Value constant(@Nullable Type type, @Nullable String literal) {
        Value constant = new Value(ValueKind.CONSTANT, null, type);
        constant.literal = literal;
        return constant;
    }

    public static Value constant(Type type, long value) {
        return constant(type, Long.toString(value));
    }

    /**
     * Create a metadata string, printed as {@code !"text"}.
     *
     * @param text The text.
     * @return The string.
     */
    public static Value metadataString(String text) {
        return constant(Type.METADATA, text);
    }

    /**
     * Create a metadata tuple. It is not part of any module until referenced from one.
     *
     * @param operands The elements, which may be null.
     * @return The tuple.
     */
    public static Value metadata(Value... operands) {
        Value md = new Value(ValueKind.METADATA, null, Type.METADATA);
        for (Value operand : operands) {
            md.addOperand(operand);
        }
        return md;
    }

    public static Value distinctMetadata(Value... operands) {
        Value md = metadata(operands);
        md.distinct = true;
        return md;
    }

    public ValueKind getKind() {
        return kind;
    }

    public @Nullable String getName() {
        return name;
    }

    public boolean hasName() {
        return name != null && !name.isEmpty();
    }

    public Value setName(@Nullable String name) {
        this.name = name;
        return this;
    }

    public @Nullable Type getType() {
        return type;
    }

    public void setType(@Nullable Type type) {
        this.type = type;
    }

    /**
     * Whether this value produces something that can be referenced by name.
     * Values with an unknown type are assumed to.
     *
     * @return Whether the value has a non-void result.
     */
    public boolean hasResult() {
        return type == null || !type.isVoid();
    }

    public @Nullable Opcode getOpcode() {
        return opcode;
    }

    public @Nullable String getLiteral() {
        return literal;
    }

    public boolean isDistinct() {
        return distinct;
    }

    public boolean isMetadataString() {
        return kind == ValueKind.CONSTANT && Type.METADATA.equals(type);
    }

    public List<Value> getOperands() {
        return Collections.unmodifiableList(operands);
    }

    public int getNumOperands() {
        return operands.size();
    }

    /**
     * Get an operand, tolerating indices past the end.
     *
     * @param index The operand index.
     * @return The operand, or null if it is missing.
     */
    public @Nullable Value getOperand(int index) {
        return index < operands.size() ? operands.get(index) : null;
    }

    public void addOperand(@Nullable Value operand) {
        int index = operands.size();
        operands.add(operand);
        if (operand != null) {
            operand.uses.add(new Use(this, index));
        }
    }

    public void setOperand(int index, @Nullable Value operand) {
        Value old = operands.set(index, operand);
        if (old != null) {
            old.removeUse(this, index);
        }
        if (operand != null) {
            operand.uses.add(new Use(this, index));
        }
    }

    private void removeUse(Value user, int index) {
        Iterator<Use> it = uses.iterator();
        while (it.hasNext()) {
            Use use = it.next();
            if (use.user == user && use.operandIndex == index) {
                it.remove();
                return;
            }
        }
    }

    /**
     * Get the uses of this value, in the order they were recorded.
     *
     * @return The uses.
     */
    public List<Use> getUses() {
        return Collections.unmodifiableList(uses);
    }

    public int getNumUses() {
        return uses.size();
    }

    public boolean hasMultipleUses() {
        return uses.size() > 1;
    }

    /**
     * Reorder the uses of this value.
     *
     * @param order A permutation of {@link #getUses()}.
     * @throws IllegalArgumentException If {@code order} is not a permutation of the current uses.
     */
    public void setUseListOrder(List<Use> order) {
        if (order.size() != uses.size() || !order.containsAll(uses)) {
            throw new IllegalArgumentException("not a permutation of the use-list");
        }
        uses.clear();
        uses.addAll(order);
    }

    public boolean hasDebugLocation() {
        return hasExt(CommonExts.DEBUG_LOCATION);
    }

    public @Nullable DebugLocation getDebugLocation() {
        return getNullable(CommonExts.DEBUG_LOCATION);
    }

    public Value setDebugLocation(@Nullable DebugLocation location) {
        attachExt(CommonExts.DEBUG_LOCATION, location);
        return this;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(kind);
        if (opcode != null) sb.append(' ').append(opcode);
        if (hasName()) sb.append(' ').append(name);
        return sb.toString();
    }

    // exts
    private Object owner = null;

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.OWNING_BLOCK) {
            return owner instanceof BasicBlock ? (T) owner : null;
        } else if (ext == CommonExts.OWNING_FUNCTION) {
            if (owner instanceof Function) return (T) owner;
            if (owner instanceof BasicBlock) return (T) ((BasicBlock) owner).getFunction();
            return null;
        } else if (ext == CommonExts.OWNING_MODULE) {
            if (owner instanceof Module) return (T) owner;
            Function func = getNullable(CommonExts.OWNING_FUNCTION);
            return func == null ? null : (T) func.getModule();
        }
        return super.getNullable(ext);
    }

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CommonExts.OWNING_BLOCK
                || ext == CommonExts.OWNING_FUNCTION
                || ext == CommonExts.OWNING_MODULE) {
            owner = value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CommonExts.OWNING_BLOCK
                || ext == CommonExts.OWNING_FUNCTION
                || ext == CommonExts.OWNING_MODULE) {
            owner = null;
            return;
        }
        super.removeExt(ext);
    }
}
