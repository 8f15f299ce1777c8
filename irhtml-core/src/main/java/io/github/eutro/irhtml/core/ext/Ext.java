package io.github.eutro.irhtml.core.ext;

import org.jetbrains.annotations.NotNull;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A typed key for optional data attached to a graph node through an {@link ExtContainer}.
 * <p>
 * Exts are ordered by creation, which is only used to keep {@link ExtHolder} maps
 * in a stable order.
 *
 * @param <T> The type of the attached value.
 */
public final class Ext<T> implements Comparable<Ext<?>> {
    private static final AtomicInteger ID_COUNTER = new AtomicInteger(0);

    private final int id = ID_COUNTER.getAndIncrement();
    private final Class<?> type;
    private final String name;

    private Ext(Class<?> type, String name) {
        this.type = type;
        this.name = name;
    }

    /**
     * Create a new ext.
     * <p>
     * The class is only a hint for debugging, since it cannot carry type arguments.
     *
     * @param type The erased type of values of the ext.
     * @param name The name of the ext.
     * @param <T>  The erased type.
     * @param <R>  The full type of the ext.
     * @return The new ext.
     */
    public static <T, R extends T> Ext<R> create(Class<T> type, String name) {
        return new Ext<>(type, name);
    }

    /**
     * Look this ext up in a container.
     *
     * @param ec The container.
     * @return The attached value, if any.
     */
    public Optional<T> getIn(ExtContainer ec) {
        return ec.getExt(this);
    }

    public String getName() {
        return name;
    }

    @Override
    public int compareTo(@NotNull Ext<?> o) {
        return Integer.compare(id, o.id);
    }

    @Override
    public int hashCode() {
        return id;
    }

    @Override
    public String toString() {
        return name + ": " + type.getSimpleName();
    }
}
