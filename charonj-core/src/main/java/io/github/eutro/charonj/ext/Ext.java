package io.github.eutro.charonj.ext;

import org.jetbrains.annotations.NotNull;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * A typed key for analysis results attached to bodies and blocks, such as
 * {@link CommonExts#IDOM} or {@link CommonExts#LOOP_FOREST}.
 * <p>
 * Exts are ordered by creation, which only decides iteration order inside an {@link ExtHolder}.
 * Exts are never exported, so that order never reaches the output.
 *
 * @param <T> The type of the attached value.
 */
public class Ext<T> implements Comparable<Ext<?>> {
    private static final AtomicInteger NEXT_ID = new AtomicInteger();

    private final int id = NEXT_ID.getAndIncrement();
    private final Class<?> type;
    private final String name;

    private Ext(Class<?> type, String name) {
        this.type = type;
        this.name = name;
    }

    /**
     * Create an ext.
     * <p>
     * {@code type} may be the raw class of a generic value type, as for {@code Ext<List<Integer>>};
     * it only shows up in {@link #toString()}.
     *
     * @param type The class of the values.
     * @param name The name, for debugging.
     * @param <T>  The class given.
     * @param <R>  The type of the values.
     * @return The new ext.
     */
    public static <T, R extends T> Ext<R> create(Class<T> type, String name) {
        return new Ext<>(type, name);
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
        return name + " (" + type.getSimpleName() + ")";
    }
}
