package io.github.eutro.irhtml.core.ext;

import org.jetbrains.annotations.Nullable;

import java.util.Optional;

/**
 * Something {@link Ext}s can be attached to. See the {@link io.github.eutro.irhtml.core.ext package documentation}.
 */
public interface ExtContainer {
    /**
     * Attach {@code value} to this container under {@code ext}, replacing any previous value.
     *
     * @param ext   The ext.
     * @param value The value.
     * @param <T>   The type of the ext.
     */
    <T> void attachExt(Ext<T> ext, T value);

    /**
     * Remove whatever is attached under {@code ext}.
     *
     * @param ext The ext.
     * @param <T> The type of the ext.
     */
    <T> void removeExt(Ext<T> ext);

    /**
     * Get the value attached under {@code ext}.
     *
     * @param ext The ext.
     * @param <T> The type of the ext.
     * @return The value, or null if nothing is attached.
     */
    <T> @Nullable T getNullable(Ext<T> ext);

    default <T> Optional<T> getExt(Ext<T> ext) {
        return Optional.ofNullable(getNullable(ext));
    }

    default boolean hasExt(Ext<?> ext) {
        return getNullable(ext) != null;
    }

    /**
     * Get the value attached under {@code ext}, failing if there is none.
     *
     * @param ext The ext.
     * @param <T> The type of the ext.
     * @return The value.
     * @throws IllegalStateException If nothing is attached.
     */
    default <T> T getExtOrThrow(Ext<T> ext) {
        T value = getNullable(ext);
        if (value != null) return value;
        throw new IllegalStateException("Ext not present: " + ext.getName());
    }
}
