package io.github.eutro.shaderdebug.debug.api;

import io.github.eutro.shaderdebug.ops.SampleInfo;
import org.jetbrains.annotations.Nullable;

/**
 * Everything a {@link DebugApi} needs to compute a sample or gather. All float operands are finite.
 */
public final class SampleGatherRequest {
    public final SampleInfo info;
    public final ResourceDescriptor texture;
    public final @Nullable ResourceDescriptor sampler;
    private final float[] uv;
    private final float[] ddx;
    private final float[] ddy;
    /**
     * The lod for {@code SAMPLE_LEVEL}, the bias for {@code SAMPLE_BIAS}, otherwise 0.
     */
    public final float lodOrBias;
    /**
     * The reference value of compare samples, otherwise 0.
     */
    public final float compare;
    public final int lane;

    public SampleGatherRequest(SampleInfo info,
                               ResourceDescriptor texture,
                               @Nullable ResourceDescriptor sampler,
                               float[] uv,
                               float[] ddx,
                               float[] ddy,
                               float lodOrBias,
                               float compare,
                               int lane) {
        this.info = info;
        this.texture = texture;
        this.sampler = sampler;
        this.uv = uv.clone();
        this.ddx = ddx.clone();
        this.ddy = ddy.clone();
        this.lodOrBias = lodOrBias;
        this.compare = compare;
        this.lane = lane;
    }

    public float uv(int c) {
        return c < uv.length ? uv[c] : 0;
    }

    public float ddx(int c) {
        return c < ddx.length ? ddx[c] : 0;
    }

    public float ddy(int c) {
        return c < ddy.length ? ddy[c] : 0;
    }
}
