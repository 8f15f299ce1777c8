package io.github.eutro.irhtml.core.ir;

import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The type of a {@link Value}.
 * <p>
 * Types are structural: two types with the same shape are {@link #equals(Object) equal}.
 */
public final class Type {
    public enum Kind {
        VOID,
        INTEGER,
        FLOAT,
        DOUBLE,
        POINTER,
        LABEL,
        METADATA,
        ARRAY,
        STRUCT,
        FUNCTION,
    }

    public static final Type VOID = new Type(Kind.VOID, 0, null, Collections.emptyList(), false);
    public static final Type I1 = integer(1);
    public static final Type I8 = integer(8);
    public static final Type I16 = integer(16);
    public static final Type I32 = integer(32);
    public static final Type I64 = integer(64);
    public static final Type FLOAT = new Type(Kind.FLOAT, 0, null, Collections.emptyList(), false);
    public static final Type DOUBLE = new Type(Kind.DOUBLE, 0, null, Collections.emptyList(), false);
    public static final Type PTR = new Type(Kind.POINTER, 0, null, Collections.emptyList(), false);
    public static final Type LABEL = new Type(Kind.LABEL, 0, null, Collections.emptyList(), false);
    public static final Type METADATA = new Type(Kind.METADATA, 0, null, Collections.emptyList(), false);

    public final Kind kind;
    /**
     * Bit width for integers, element count for arrays, zero otherwise.
     */
    public final int size;
    /**
     * Element type of arrays, return type of functions, null otherwise.
     */
    public final Type element;
    /**
     * Field types of structs, parameter types of functions, empty otherwise.
     */
    public final List<Type> members;
    public final boolean varArgs;

    private Type(Kind kind, int size, Type element, List<Type> members, boolean varArgs) {
        this.kind = kind;
        this.size = size;
        this.element = element;
        this.members = members;
        this.varArgs = varArgs;
    }

    public static Type integer(int bits) {
        if (bits <= 0) throw new IllegalArgumentException("bit width must be positive: " + bits);
        return new Type(Kind.INTEGER, bits, null, Collections.emptyList(), false);
    }

    public static Type array(int count, @NotNull Type element) {
        return new Type(Kind.ARRAY, count, Objects.requireNonNull(element), Collections.emptyList(), false);
    }

    public static Type struct(Type... fields) {
        return new Type(Kind.STRUCT, 0, null, Collections.unmodifiableList(new ArrayList<>(Arrays.asList(fields))), false);
    }

    public static Type function(@NotNull Type ret, List<Type> params, boolean varArgs) {
        return new Type(Kind.FUNCTION, 0, Objects.requireNonNull(ret), Collections.unmodifiableList(new ArrayList<>(params)), varArgs);
    }

    public boolean isVoid() {
        return kind == Kind.VOID;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Type type = (Type) o;
        return size == type.size
                && varArgs == type.varArgs
                && kind == type.kind
                && Objects.equals(element, type.element)
                && members.equals(type.members);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, size, element, members, varArgs);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        appendTo(sb);
        return sb.toString();
    }

    private void appendTo(StringBuilder sb) {
        switch (kind) {
            case VOID:
                sb.append("void");
                break;
            case INTEGER:
                sb.append('i').append(size);
                break;
            case FLOAT:
                sb.append("float");
                break;
            case DOUBLE:
                sb.append("double");
                break;
            case POINTER:
                sb.append("ptr");
                break;
            case LABEL:
                sb.append("label");
                break;
            case METADATA:
                sb.append("metadata");
                break;
            case ARRAY:
                sb.append('[').append(size).append(" x ");
                element.appendTo(sb);
                sb.append(']');
                break;
            case STRUCT: {
                sb.append("{ ");
                boolean first = true;
                for (Type member : members) {
                    if (!first) sb.append(", ");
                    first = false;
                    member.appendTo(sb);
                }
                sb.append(members.isEmpty() ? "}" : " }");
                break;
            }
            case FUNCTION: {
                element.appendTo(sb);
                sb.append(" (");
                boolean first = true;
                for (Type member : members) {
                    if (!first) sb.append(", ");
                    first = false;
                    member.appendTo(sb);
                }
                if (varArgs) sb.append(first ? "..." : ", ...");
                sb.append(')');
                break;
            }
        }
    }
}
