package io.github.eutro.shaderdebug.ext;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Map;
import java.util.TreeMap;

/**
 * An {@link ExtContainer} backed by a lazily allocated {@link TreeMap}.
 * <p>
 * Subclasses keep their hottest exts in fields and only fall back to the map
 * for everything else.
 */
public class ExtHolder implements ExtContainer {
    @Nullable
    private Map<Ext<?>, Object> exts = null; // most holders never get any

    @NotNull
    private Map<Ext<?>, Object> exts() {
        if (exts == null) {
            exts = new TreeMap<>();
        }
        return exts;
    }

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        exts().put(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (exts == null) return;
        exts.remove(ext);
        if (exts.isEmpty()) {
            exts = null;
        }
    }

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (exts == null) return null;
        return (T) exts.get(ext);
    }
}
