package io.github.eutro.shaderdebug.ops;

/**
 * The flavours of texture sample and gather. The operands each one takes, after the coordinates, are listed
 * in {@link #extraOperands}.
 */
public enum SampleKind {
    SAMPLE(true, 0),
    SAMPLE_BIAS(true, 1),
    SAMPLE_LEVEL(false, 1),
    SAMPLE_GRAD(false, 2),
    SAMPLE_CMP(true, 1),
    SAMPLE_CMP_LEVEL_ZERO(false, 1),
    GATHER4(false, 0),
    GATHER4_CMP(false, 1);

    /**
     * Whether the hardware would compute derivatives of the coordinates across the quad.
     */
    public final boolean implicitDerivatives;
    public final int extraOperands;

    SampleKind(boolean implicitDerivatives, int extraOperands) {
        this.implicitDerivatives = implicitDerivatives;
        this.extraOperands = extraOperands;
    }

    public boolean isCompare() {
        return this == SAMPLE_CMP || this == SAMPLE_CMP_LEVEL_ZERO || this == GATHER4_CMP;
    }

    public boolean isGather() {
        return this == GATHER4 || this == GATHER4_CMP;
    }
}
