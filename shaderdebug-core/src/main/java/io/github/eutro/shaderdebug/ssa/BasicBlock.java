package io.github.eutro.shaderdebug.ssa;

import io.github.eutro.shaderdebug.ext.CommonExts;
import io.github.eutro.shaderdebug.ext.Ext;
import io.github.eutro.shaderdebug.ext.ExtHolder;
import io.github.eutro.shaderdebug.ext.TrackedList;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * A basic block: straight-line effects followed by one {@link Control}.
 */
public final class BasicBlock extends ExtHolder {
    private final TrackedList<Effect> effects = new TrackedList<Effect>(new ArrayList<>()) {
        @Override
        protected void onAdded(Effect elt) {
            elt.attachExt(CommonExts.OWNING_BLOCK, BasicBlock.this);
        }

        @Override
        protected void onRemoved(Effect elt) {
            elt.removeExt(CommonExts.OWNING_BLOCK);
        }
    };
    private Control control;

    /**
     * Get the id of this block, its position in the owning function.
     *
     * @return The id, or -1 if the block is not in a function.
     */
    public int getIndex() {
        return owner == null ? -1 : owner.blocks.indexOf(this);
    }

    public String toTargetString() {
        int index = getIndex();
        return index < 0
                ? String.format("@%08x", System.identityHashCode(this))
                : "@" + index;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(toTargetString()).append(":\n");
        for (Effect effect : effects) {
            sb.append("  ").append(effect).append('\n');
        }
        sb.append("  ").append(control);
        return sb.toString();
    }

    public List<Effect> getEffects() {
        return effects;
    }

    public void addEffect(Effect effect) {
        effects.add(effect);
    }

    public void setEffects(List<Effect> effects) {
        this.effects.setBacking(new ArrayList<>(effects));
    }

    public Control getControl() {
        return control;
    }

    public void setControl(Control control) {
        if (this.control != null) {
            this.control.removeExt(CommonExts.OWNING_BLOCK);
        }
        this.control = control;
        control.attachExt(CommonExts.OWNING_BLOCK, this);
        if (owner != null) {
            owner.getExtOrThrow(CommonExts.METADATA_STATE).graphChanged();
        }
    }

    // exts
    private Function owner = null;

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.OWNING_FUNCTION) {
            return (T) owner;
        }
        return super.getNullable(ext);
    }

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CommonExts.OWNING_FUNCTION) {
            owner = (Function) value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CommonExts.OWNING_FUNCTION) {
            owner = null;
            return;
        }
        super.removeExt(ext);
    }
}
