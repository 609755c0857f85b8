package io.github.eutro.shaderdebug.ops;

/**
 * The immediate of buffer atomics: the read-write buffer, and the operation.
 */
public final class AtomicAccess {
    public final BindingSlot slot;
    public final AtomicOp op;

    public AtomicAccess(BindingSlot slot, AtomicOp op) {
        this.slot = slot;
        this.op = op;
    }

    @Override
    public String toString() {
        return slot + " " + op.name().toLowerCase();
    }
}
