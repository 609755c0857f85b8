package io.github.eutro.shaderdebug.ops;

import io.github.eutro.shaderdebug.ssa.VarType;

/**
 * The immediate of buffer and texel loads and stores: which binding, and the shape of the value moved.
 */
public final class ResourceAccess {
    public final BindingSlot slot;
    public final VarType type;
    public final int components;

    public ResourceAccess(BindingSlot slot, VarType type, int components) {
        if (components < 1 || components > 4) {
            throw new IllegalArgumentException("Bad component count: " + components);
        }
        this.slot = slot;
        this.type = type;
        this.components = components;
    }

    /**
     * @return The number of bytes one value takes in the resource.
     */
    public int byteSize() {
        return components * type.byteSize();
    }

    @Override
    public String toString() {
        return slot + " " + type.suffix + components;
    }
}
