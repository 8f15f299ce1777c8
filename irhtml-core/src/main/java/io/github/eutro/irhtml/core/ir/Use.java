package io.github.eutro.irhtml.core.ir;

import java.util.Objects;

/**
 * A use-edge: {@link #user} consumes some value as its operand number {@link #operandIndex}.
 */
public final class Use {
    public final Value user;
    public final int operandIndex;

    public Use(Value user, int operandIndex) {
        this.user = user;
        this.operandIndex = operandIndex;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Use use = (Use) o;
        return operandIndex == use.operandIndex && user == use.user;
    }

    @Override
    public int hashCode() {
        return Objects.hash(System.identityHashCode(user), operandIndex);
    }

    @Override
    public String toString() {
        return "Use{" + user.getKind() + "#" + operandIndex + '}';
    }
}
