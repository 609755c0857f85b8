package io.github.eutro.shaderdebug.ops;

/**
 * Read-modify-write operations on a 32-bit integer in memory.
 */
public enum AtomicOp {
    ADD,
    AND,
    OR,
    XOR,
    IMIN,
    IMAX,
    UMIN,
    UMAX,
    EXCHANGE,
    /**
     * Stores the value only if memory holds the comparand. Takes {@code offset compare value}.
     */
    COMPARE_EXCHANGE,
    ;

    /**
     * @return The number of operands after the offset.
     */
    public int valueOperands() {
        return this == COMPARE_EXCHANGE ? 2 : 1;
    }

    /**
     * Compute the new contents of memory.
     *
     * @param old     What memory holds.
     * @param compare The comparand, only used by {@link #COMPARE_EXCHANGE}.
     * @param value   The operand.
     * @return What memory should hold afterwards.
     */
    public int apply(int old, int compare, int value) {
        switch (this) {
            case ADD:
                return old + value;
            case AND:
                return old & value;
            case OR:
                return old | value;
            case XOR:
                return old ^ value;
            case IMIN:
                return Math.min(old, value);
            case IMAX:
                return Math.max(old, value);
            case UMIN:
                return Integer.compareUnsigned(old, value) <= 0 ? old : value;
            case UMAX:
                return Integer.compareUnsigned(old, value) >= 0 ? old : value;
            case EXCHANGE:
                return value;
            case COMPARE_EXCHANGE:
                return old == compare ? value : old;
            default:
                throw new IllegalStateException("Unknown atomic op " + this);
        }
    }
}
