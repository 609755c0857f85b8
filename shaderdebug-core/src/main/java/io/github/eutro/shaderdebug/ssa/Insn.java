package io.github.eutro.shaderdebug.ssa;

import io.github.eutro.shaderdebug.ext.CommonExts;
import io.github.eutro.shaderdebug.ext.DelegatingExtHolder;
import io.github.eutro.shaderdebug.ext.Ext;
import io.github.eutro.shaderdebug.ext.ExtContainer;
import io.github.eutro.shaderdebug.ops.Op;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Arrays;
import java.util.Iterator;
import java.util.List;

/**
 * An instruction: an {@link Op} applied to argument variables.
 * <p>
 * Exts not found on the instruction are looked up on its op, and from there on the op key,
 * which is where evaluators and other per-op behaviour live.
 */
public final class Insn extends DelegatingExtHolder implements Iterable<Var> {
    public Op op;
    private final Var[] args;

    public Insn(Op op, List<Var> args) {
        this.op = op;
        this.args = args.toArray(new Var[0]);
    }

    public Insn(Op op, Var... args) {
        this.op = op;
        this.args = args.clone();
    }

    @Override
    protected ExtContainer getDelegate() {
        return op;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(op);
        for (Var arg : args) {
            sb.append(' ').append(arg);
        }
        return sb.toString();
    }

    public Effect assignTo(Var... vars) {
        return new Effect(Arrays.asList(vars), this);
    }

    public Effect assignTo(List<Var> vars) {
        return new Effect(vars, this);
    }

    public Control jumpsTo(BasicBlock... targets) {
        return jumpsTo(Arrays.asList(targets));
    }

    public Control jumpsTo(List<BasicBlock> targets) {
        return new Control(this, targets);
    }

    /**
     * @return A fixed-size, writable view of the arguments.
     */
    public List<Var> args() {
        return Arrays.asList(args);
    }

    public Var arg(int i) {
        return args[i];
    }

    public int arity() {
        return args.length;
    }

    @NotNull
    @Override
    public Iterator<Var> iterator() {
        return args().iterator();
    }

    // exts
    private Object owner = null;

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.OWNING_EFFECT) {
            return owner instanceof Effect ? (T) owner : null;
        } else if (ext == CommonExts.OWNING_CONTROL) {
            return owner instanceof Control ? (T) owner : null;
        }
        return super.getNullable(ext);
    }

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CommonExts.OWNING_EFFECT || ext == CommonExts.OWNING_CONTROL) {
            owner = value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CommonExts.OWNING_EFFECT || ext == CommonExts.OWNING_CONTROL) {
            owner = null;
            return;
        }
        super.removeExt(ext);
    }
}
