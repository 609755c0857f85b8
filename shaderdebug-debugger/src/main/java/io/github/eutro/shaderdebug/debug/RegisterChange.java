package io.github.eutro.shaderdebug.debug;

import io.github.eutro.shaderdebug.ssa.ShaderValue;
import io.github.eutro.shaderdebug.ssa.Var;
import org.jetbrains.annotations.Nullable;

public final class RegisterChange {
    public final Var var;
    public final @Nullable ShaderValue before;
    public final ShaderValue after;

    public RegisterChange(Var var, @Nullable ShaderValue before, ShaderValue after) {
        this.var = var;
        this.before = before;
        this.after = after;
    }

    @Override
    public String toString() {
        return var + ": " + before + " -> " + after;
    }
}
