package io.github.eutro.irhtml.core.ext;

import io.github.eutro.irhtml.core.ir.*;
import io.github.eutro.irhtml.core.ir.Module;

public class CommonExts {
    public static final Ext<Module> OWNING_MODULE = Ext.create(Module.class, "OWNING_MODULE");
    public static final Ext<Function> OWNING_FUNCTION = Ext.create(Function.class, "OWNING_FUNCTION");
    public static final Ext<BasicBlock> OWNING_BLOCK = Ext.create(BasicBlock.class, "OWNING_BLOCK");

    public static final Ext<DebugLocation> DEBUG_LOCATION = Ext.create(DebugLocation.class, "DEBUG_LOCATION");
    /**
     * The name of the source variable described by a debug intrinsic call.
     */
    public static final Ext<String> DEBUG_VARIABLE = Ext.create(String.class, "DEBUG_VARIABLE");

    public static final Ext<Predicate> PREDICATE = Ext.create(Predicate.class, "PREDICATE");
    public static final Ext<Type> ALLOCATED_TYPE = Ext.create(Type.class, "ALLOCATED_TYPE");
    public static final Ext<Type> SOURCE_ELEMENT_TYPE = Ext.create(Type.class, "SOURCE_ELEMENT_TYPE");

    public static final Ext<Linkage> LINKAGE = Ext.create(Linkage.class, "LINKAGE");
    /**
     * The type of the storage of a global variable; the global itself is a pointer.
     */
    public static final Ext<Type> VALUE_TYPE = Ext.create(Type.class, "VALUE_TYPE");
    public static final Ext<Boolean> IS_CONSTANT = Ext.create(Boolean.class, "IS_CONSTANT");
}
