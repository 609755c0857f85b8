package io.github.eutro.shaderdebug.ssa;

public enum ShaderStage {
    VERTEX,
    PIXEL,
    COMPUTE;

    /**
     * @return Whether lanes of this stage are laid out in 2x2 quads with derivatives and helper lanes.
     */
    public boolean hasQuads() {
        return this == PIXEL;
    }
}
