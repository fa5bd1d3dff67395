package io.github.eutro.charonj.ext;

import org.jetbrains.annotations.Nullable;

/**
 * Something analyses can attach {@link Ext}s to, such as a body or one of its blocks.
 * See the {@link io.github.eutro.charonj.ext package-level documentation}.
 */
public interface ExtContainer {
    <T> void attachExt(Ext<T> ext, T value);

    /**
     * Drop the value of {@code ext}, if there is one.
     */
    <T> void removeExt(Ext<T> ext);

    <T> @Nullable T getNullable(Ext<T> ext);

    /**
     * Get the value of {@code ext}, which an earlier analysis must have attached.
     *
     * @param ext The ext.
     * @param <T> The type of the ext.
     * @return Its value.
     * @throws IllegalStateException If it is not attached.
     */
    default <T> T getExtOrThrow(Ext<T> ext) {
        T value = getNullable(ext);
        if (value == null) throw new IllegalStateException("Ext not present: " + ext);
        return value;
    }
}
