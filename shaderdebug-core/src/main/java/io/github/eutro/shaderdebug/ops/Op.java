package io.github.eutro.shaderdebug.ops;

import io.github.eutro.shaderdebug.ext.DelegatingExtHolder;
import io.github.eutro.shaderdebug.ext.ExtContainer;
import io.github.eutro.shaderdebug.ssa.Insn;
import io.github.eutro.shaderdebug.ssa.Var;

import java.util.List;

/**
 * An operation: an {@link OpKey} plus any immediates.
 * <p>
 * Exts missing from the op are looked up on its key.
 */
public class Op extends DelegatingExtHolder {
    public final OpKey key;

    public Op(OpKey key) {
        this.key = key;
    }

    @Override
    protected ExtContainer getDelegate() {
        return key;
    }

    @Override
    public String toString() {
        return key.toString();
    }

    public Insn insn(Var... vars) {
        return new Insn(this, vars);
    }

    public Insn insn(List<Var> vars) {
        return new Insn(this, vars);
    }
}
