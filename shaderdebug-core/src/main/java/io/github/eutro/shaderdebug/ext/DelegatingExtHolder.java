package io.github.eutro.shaderdebug.ext;

import org.jetbrains.annotations.Nullable;

/**
 * An {@link ExtHolder} which falls back to another container for exts it doesn't hold itself.
 * <p>
 * Instructions use this to see the exts of their op, and ops to see those of their key.
 */
public abstract class DelegatingExtHolder extends ExtHolder {
    /**
     * @return The container to fall back to, may be null.
     */
    protected abstract @Nullable ExtContainer getDelegate();

    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        T own = super.getNullable(ext);
        if (own != null) return own;
        ExtContainer delegate = getDelegate();
        return delegate == null ? null : delegate.getNullable(ext);
    }
}
