package io.github.eutro.shaderdebug.ops;

import io.github.eutro.shaderdebug.ssa.VarType;

/**
 * The immediate of groupshared loads and stores: the shape of the value moved.
 */
public final class GroupsharedAccess {
    public final VarType type;
    public final int components;

    public GroupsharedAccess(VarType type, int components) {
        if (components < 1 || components > 4) {
            throw new IllegalArgumentException("Bad component count: " + components);
        }
        this.type = type;
        this.components = components;
    }

    public int byteSize() {
        return components * type.byteSize();
    }

    @Override
    public String toString() {
        return type.suffix + components;
    }
}
