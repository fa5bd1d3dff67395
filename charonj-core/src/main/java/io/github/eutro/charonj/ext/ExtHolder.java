package io.github.eutro.charonj.ext;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Map;
import java.util.TreeMap;

/**
 * An implementation of {@link ExtContainer} using a {@link Map}.
 * <p>
 * The map is transient: exts are scratch data for analyses and are
 * never part of the exported form, nor of equality.
 */
public class ExtHolder implements ExtContainer {
    @Nullable
    private transient Map<Ext<?>, Object> map = null; // most holders never get an ext

    @NotNull
    private Map<Ext<?>, Object> getMap() {
        if (map == null) {
            map = new TreeMap<>();
        }
        return map;
    }

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        getMap().put(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (map == null) return;
        Map<Ext<?>, Object> map = this.map;
        map.remove(ext);
        if (map.isEmpty()) {
            this.map = null;
        }
    }

    @SuppressWarnings("unchecked")
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (map == null) return null;
        return (T) map.get(ext);
    }
}
