package io.github.eutro.shaderdebug.ssa;

import io.github.eutro.shaderdebug.ext.*;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * A shader function. Block ids are positions in {@link #blocks}; block {@code 0} is the entry.
 * <p>
 * Every variable gets its own register slot, so a lane's register file for this function
 * has {@link #getVarCount()} entries.
 */
public final class Function extends ExtHolder {
    public final String name;
    public final int paramCount;

    public final List<BasicBlock> blocks = new TrackedList<BasicBlock>(new ArrayList<>()) {
        @Override
        protected void onAdded(BasicBlock elt) {
            elt.attachExt(CommonExts.OWNING_FUNCTION, Function.this);
            metaState.graphChanged();
        }

        @Override
        protected void onRemoved(BasicBlock elt) {
            elt.removeExt(CommonExts.OWNING_FUNCTION);
            metaState.graphChanged();
        }
    }; // [0] is entry

    private int varCount = 0;

    public Function(String name, int paramCount) {
        this.name = name;
        this.paramCount = paramCount;
    }

    public Var newVar(String name) {
        return new Var(name, varCount++);
    }

    public int getVarCount() {
        return varCount;
    }

    public BasicBlock newBb() {
        BasicBlock bb = new BasicBlock();
        blocks.add(bb);
        return bb;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("fn ").append(name).append('/').append(paramCount).append(" {\n");
        for (BasicBlock block : blocks) {
            sb.append(block).append('\n');
        }
        sb.append("}");
        return sb.toString();
    }

    // exts
    private MetadataState metaState = new MetadataState();
    private ShaderProgram owner = null;

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CommonExts.METADATA_STATE) {
            metaState = (MetadataState) value;
            return;
        } else if (ext == CommonExts.OWNING_PROGRAM) {
            owner = (ShaderProgram) value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CommonExts.METADATA_STATE) {
            throw new UnsupportedOperationException("Functions always have a metadata state");
        } else if (ext == CommonExts.OWNING_PROGRAM) {
            owner = null;
            return;
        }
        super.removeExt(ext);
    }

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.METADATA_STATE) {
            return (T) metaState;
        } else if (ext == CommonExts.OWNING_PROGRAM) {
            return (T) owner;
        }
        return super.getNullable(ext);
    }
}
