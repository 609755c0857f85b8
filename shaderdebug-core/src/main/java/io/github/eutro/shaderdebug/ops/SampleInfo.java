package io.github.eutro.shaderdebug.ops;

import java.util.Arrays;

/**
 * The immediate of a sample or gather op.
 */
public final class SampleInfo {
    public final SampleKind kind;
    public final BindingSlot texture;
    public final BindingSlot sampler;
    public final int[] texelOffset;

    public SampleInfo(SampleKind kind, BindingSlot texture, BindingSlot sampler, int... texelOffset) {
        this.kind = kind;
        this.texture = texture;
        this.sampler = sampler;
        this.texelOffset = texelOffset.length == 0 ? new int[3] : Arrays.copyOf(texelOffset, 3);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(kind.name().toLowerCase()).append(' ').append(texture).append(' ').append(sampler);
        if (texelOffset[0] != 0 || texelOffset[1] != 0 || texelOffset[2] != 0) {
            sb.append(" offset").append(Arrays.toString(texelOffset));
        }
        return sb.toString();
    }
}
