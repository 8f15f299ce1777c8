package io.github.eutro.irhtml.core.ir;

import io.github.eutro.irhtml.core.ext.CommonExts;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The top-level container of a program graph: global variables, functions and named metadata,
 * each in declaration order.
 */
public final class Module {
    private final String moduleId;
    private @Nullable String sourceFileName;
    private @Nullable String dataLayout;
    private @Nullable String targetTriple;

    private final List<Value> globals = new ArrayList<>();
    private final List<Function> functions = new ArrayList<>();
    private final Map<String, List<Value>> namedMetadata = new LinkedHashMap<>();

    public Module(String moduleId) {
        this.moduleId = moduleId;
    }

    public String getModuleId() {
        return moduleId;
    }

    public @Nullable String getSourceFileName() {
        return sourceFileName;
    }

    public void setSourceFileName(@Nullable String sourceFileName) {
        this.sourceFileName = sourceFileName;
    }

    public @Nullable String getDataLayout() {
        return dataLayout;
    }

    public void setDataLayout(@Nullable String dataLayout) {
        this.dataLayout = dataLayout;
    }

    public @Nullable String getTargetTriple() {
        return targetTriple;
    }

    public void setTargetTriple(@Nullable String targetTriple) {
        this.targetTriple = targetTriple;
    }

    /**
     * Add a global variable.
     *
     * @param name        The name, or null to leave it to be numbered.
     * @param valueType   The type of the variable's storage.
     * @param constant    Whether the variable is immutable.
     * @param initializer The initial value, or null for an external global.
     * @return The global, which is a pointer to its storage.
     */
    public Value addGlobal(@Nullable String name, @Nullable Type valueType, boolean constant, @Nullable Value initializer) {
        Value global = new Value(ValueKind.GLOBAL_VARIABLE, name, Type.PTR);
        global.attachExt(CommonExts.OWNING_MODULE, this);
        global.attachExt(CommonExts.VALUE_TYPE, valueType);
        global.attachExt(CommonExts.IS_CONSTANT, constant);
        if (initializer != null) {
            global.addOperand(initializer);
        }
        globals.add(global);
        return global;
    }

    public List<Value> getGlobals() {
        return Collections.unmodifiableList(globals);
    }

    public Function addFunction(@Nullable String name, @Nullable Type returnType) {
        Function func = new Function(name, returnType);
        func.getValue().attachExt(CommonExts.OWNING_MODULE, this);
        functions.add(func);
        return func;
    }

    public List<Function> getFunctions() {
        return Collections.unmodifiableList(functions);
    }

    public @Nullable Function getFunction(String name) {
        for (Function function : functions) {
            if (name.equals(function.getName())) return function;
        }
        return null;
    }

    /**
     * Add nodes to a named metadata list, creating it if needed.
     *
     * @param name  The name, e.g. {@code llvm.dbg.cu}.
     * @param nodes The nodes to append.
     */
    public void addNamedMetadata(String name, Value... nodes) {
        namedMetadata.computeIfAbsent(name, $ -> new ArrayList<>()).addAll(Arrays.asList(nodes));
    }

    public Map<String, List<Value>> getNamedMetadata() {
        return Collections.unmodifiableMap(namedMetadata);
    }

    @Override
    public String toString() {
        return "Module{" + moduleId + '}';
    }
}
