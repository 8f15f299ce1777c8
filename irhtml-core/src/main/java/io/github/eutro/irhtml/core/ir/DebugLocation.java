package io.github.eutro.irhtml.core.ir;

import org.jetbrains.annotations.Nullable;

/**
 * A source position, and the position it was inlined at, if any.
 */
public final class DebugLocation {
    public final int line;
    public final int column;
    @Nullable
    public final DebugLocation inlinedAt;

    public DebugLocation(int line, int column) {
        this(line, column, null);
    }

    public DebugLocation(int line, int column, @Nullable DebugLocation inlinedAt) {
        this.line = line;
        this.column = column;
        this.inlinedAt = inlinedAt;
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
