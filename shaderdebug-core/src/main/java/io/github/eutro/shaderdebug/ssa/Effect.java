package io.github.eutro.shaderdebug.ssa;

import io.github.eutro.shaderdebug.ext.CommonExts;
import io.github.eutro.shaderdebug.ext.DelegatingExtHolder;
import io.github.eutro.shaderdebug.ext.Ext;
import io.github.eutro.shaderdebug.ext.ExtContainer;
import org.jetbrains.annotations.Nullable;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A non-branching step of a block: an {@link Insn instruction} and the variables its results go to.
 */
public final class Effect extends DelegatingExtHolder {
    private Var[] assignsTo;
    private Insn insn;

    Effect(List<Var> assignsTo, Insn insn) {
        setAssignsTo(assignsTo);
        setInsn(insn);
    }

    @Override
    protected ExtContainer getDelegate() {
        return insn;
    }

    @Override
    public String toString() {
        if (assignsTo.length == 0) return insn.toString();
        return Arrays.stream(assignsTo)
                .map(Var::toString)
                .collect(Collectors.joining(", ", "", " = ")) + insn;
    }

    public List<Var> getAssignsTo() {
        return Collections.unmodifiableList(Arrays.asList(assignsTo));
    }

    /**
     * Set the variables this effect assigns to. The list is copied.
     *
     * @param assignsTo The variables.
     */
    public void setAssignsTo(List<Var> assignsTo) {
        this.assignsTo = assignsTo.toArray(new Var[0]);
        for (Var var : this.assignsTo) {
            var.attachExt(CommonExts.ASSIGNED_AT, this);
        }
    }

    public Insn insn() {
        return insn;
    }

    public void setInsn(Insn insn) {
        insn.attachExt(CommonExts.OWNING_EFFECT, this);
        this.insn = insn;
    }

    // exts
    private BasicBlock owner = null;

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.OWNING_BLOCK) {
            return (T) owner;
        }
        return super.getNullable(ext);
    }

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CommonExts.OWNING_BLOCK) {
            owner = (BasicBlock) value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CommonExts.OWNING_BLOCK) {
            owner = null;
            return;
        }
        super.removeExt(ext);
    }
}
