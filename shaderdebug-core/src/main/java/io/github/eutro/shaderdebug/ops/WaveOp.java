package io.github.eutro.shaderdebug.ops;

/**
 * Operations across the lanes of a subgroup that are executing together.
 * <p>
 * Reductions work component-wise, in the type of their operand: floats follow float rules,
 * signed and unsigned integers compare as such.
 */
public enum WaveOp {
    /** True if the operand is true on any participating lane. */
    ANY,
    /** True if the operand is true on every participating lane. */
    ALL,
    /** Per component, true if the operand is the same on every participating lane. */
    ALL_EQUAL,
    /** A bitmask of the participating lanes where the operand is true. */
    BALLOT,
    /** The operand as seen by the lowest participating lane. */
    READ_FIRST,
    /** {@code wave read_lane_at value lane}: the operand as seen by the given lane. */
    READ_LANE_AT,
    /** The number of participating lanes. */
    COUNT,
    /** The number of participating lanes where the operand is true. */
    COUNT_BITS,
    /** The number of participating lanes below this one where the operand is true. */
    PREFIX_COUNT_BITS,
    /** The index of this lane. */
    LANE_INDEX,
    /** True on the lowest participating lane. */
    IS_FIRST_LANE,

    ACTIVE_SUM,
    ACTIVE_PRODUCT,
    ACTIVE_MIN,
    ACTIVE_MAX,
    ACTIVE_BIT_AND,
    ACTIVE_BIT_OR,
    ACTIVE_BIT_XOR,
    /** The sum over the participating lanes below this one. */
    PREFIX_SUM,
    /** The product over the participating lanes below this one. */
    PREFIX_PRODUCT,
}
