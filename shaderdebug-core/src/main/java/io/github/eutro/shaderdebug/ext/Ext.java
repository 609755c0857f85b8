package io.github.eutro.shaderdebug.ext;

import org.jetbrains.annotations.NotNull;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A typed key for a value stored in an {@link ExtContainer}.
 * <p>
 * Exts are ordered by creation, which is only stable within a single run.
 *
 * @param <T> The type of value the ext holds.
 */
public class Ext<T> implements Comparable<Ext<?>> {
    private static final AtomicInteger NEXT_ID = new AtomicInteger(0);

    private final Class<T> type;
    private final int id = NEXT_ID.getAndIncrement();
    private final String name;

    private Ext(Class<T> type, String name) {
        this.type = type;
        this.name = name;
    }

    /**
     * Create a new ext.
     * <p>
     * {@code R} lets callers name a generic type such as {@code List<BasicBlock>},
     * which a {@link Class} cannot express on its own.
     *
     * @param type The erased type of the value.
     * @param name A name, used only for printing.
     * @param <T>  The erased type.
     * @param <R>  The full type of the ext.
     * @return The new ext.
     */
    @SuppressWarnings("unchecked")
    public static <T, R extends T> Ext<R> create(Class<T> type, String name) {
        return (Ext<R>) new Ext<>(type, name);
    }

    public Class<T> getType() {
        return type;
    }

    public String getName() {
        return name;
    }

    /**
     * Look this ext up in a container.
     *
     * @param ec The container.
     * @return The value, if present.
     */
    public Optional<T> getIn(ExtContainer ec) {
        return ec.getExt(this);
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
