package io.github.eutro.irhtml.core.ir;

import io.github.eutro.irhtml.core.ext.CommonExts;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A function: a signature, and a body of basic blocks, the first of which is the entry.
 * A function with no blocks is a declaration.
 * <p>
 * Each function is its own numbering scope for its arguments, blocks and instructions.
 */
public final class Function {
    private final Value value;
    private @Nullable Type returnType;
    private final List<Value> arguments = new ArrayList<>();
    private boolean varArgs;

    public final List<BasicBlock> blocks = new TrackedList<BasicBlock>() {
        @Override
        protected void onAdded(BasicBlock elt) {
            elt.getValue().attachExt(CommonExts.OWNING_FUNCTION, Function.this);
        }

        @Override
        protected void onRemoved(BasicBlock elt) {
            elt.getValue().removeExt(CommonExts.OWNING_FUNCTION);
        }
    }; // [0] is entry

    Function(@Nullable String name, @Nullable Type returnType) {
        this.value = new Value(ValueKind.FUNCTION, name, Type.PTR);
        this.returnType = returnType;
    }

    /**
     * Get the value by which this function is referenced, e.g. as the callee of a call.
     *
     * @return The value.
     */
    public Value getValue() {
        return value;
    }

    public @Nullable String getName() {
        return value.getName();
    }

    public @Nullable Type getReturnType() {
        return returnType;
    }

    public void setReturnType(@Nullable Type returnType) {
        this.returnType = returnType;
    }

    public boolean isVarArgs() {
        return varArgs;
    }

    public void setVarArgs(boolean varArgs) {
        this.varArgs = varArgs;
    }

    public boolean isDeclaration() {
        return blocks.isEmpty();
    }

    public Linkage getLinkage() {
        return value.getExt(CommonExts.LINKAGE).orElse(Linkage.EXTERNAL);
    }

    public void setLinkage(Linkage linkage) {
        value.attachExt(CommonExts.LINKAGE, linkage);
    }

    /**
     * Add a parameter.
     *
     * @param type The parameter type.
     * @param name The parameter name, or null to leave it to be numbered.
     * @return The argument value.
     */
    public Value addArgument(@Nullable Type type, @Nullable String name) {
        Value arg = new Value(ValueKind.ARGUMENT, name, type);
        arg.attachExt(CommonExts.OWNING_FUNCTION, this);
        arguments.add(arg);
        return arg;
    }

    public List<Value> getArguments() {
        return Collections.unmodifiableList(arguments);
    }

    public BasicBlock newBb() {
        return newBb(null);
    }

    public BasicBlock newBb(@Nullable String name) {
        BasicBlock bb = new BasicBlock(name);
        blocks.add(bb);
        return bb;
    }

    public @Nullable Module getModule() {
        return value.getNullable(CommonExts.OWNING_MODULE);
    }

    /**
     * Get the type of this function as a whole. Parameters of unknown type are left out.
     *
     * @return The function type, or null if the return type is unknown.
     */
    public @Nullable Type getFunctionType() {
        if (returnType == null) return null;
        List<Type> params = new ArrayList<>();
        for (Value argument : arguments) {
            if (argument.getType() != null) params.add(argument.getType());
        }
        return Type.function(returnType, params, varArgs);
    }

    @Override
    public @NotNull String toString() {
        return "Function{" + (value.hasName() ? value.getName() : "<unnamed>") + ", " + blocks.size() + " blocks}";
    }
}
