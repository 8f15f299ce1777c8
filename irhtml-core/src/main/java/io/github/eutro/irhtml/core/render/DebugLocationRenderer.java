package io.github.eutro.irhtml.core.render;

import io.github.eutro.irhtml.core.ir.DebugLocation;
import org.jetbrains.annotations.Nullable;

/**
 * Formats debug locations as {@code line:col}, followed by {@code @} and the location it was
 * inlined at, for each level of inlining.
 */
public final class DebugLocationRenderer {
    private DebugLocationRenderer() {
    }

    public static String render(@Nullable DebugLocation location) {
        StringBuilder sb = new StringBuilder();
        renderTo(sb, location);
        return sb.toString();
    }

    /**
     * Append the formatted chain to {@code sb}. A null location appends nothing.
     *
     * @param sb       The builder.
     * @param location The innermost location.
     */
    public static void renderTo(StringBuilder sb, @Nullable DebugLocation location) {
        for (DebugLocation loc = location; loc != null; loc = loc.inlinedAt) {
            if (loc != location) sb.append('@');
            sb.append(loc.line).append(':').append(loc.column);
        }
    }
}
