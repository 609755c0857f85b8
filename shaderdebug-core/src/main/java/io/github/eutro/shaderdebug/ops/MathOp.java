package io.github.eutro.shaderdebug.ops;

/**
 * Math intrinsics whose results must match the GPU, so they are evaluated through the debug API.
 */
public enum MathOp {
    RCP(1),
    RSQ(1),
    SQRT(1),
    EXP2(1),
    LOG2(1),
    SIN(1),
    COS(1),
    SINCOS(2);

    /**
     * How many vectors the intrinsic produces.
     */
    public final int results;

    MathOp(int results) {
        this.results = results;
    }
}
