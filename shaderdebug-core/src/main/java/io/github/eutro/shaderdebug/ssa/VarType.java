package io.github.eutro.shaderdebug.ssa;

/**
 * The scalar type of each component of a {@link ShaderValue}.
 */
public enum VarType {
    FLOAT("f"),
    SINT("i"),
    UINT("u"),
    BOOL("b");

    public final String suffix;

    VarType(String suffix) {
        this.suffix = suffix;
    }

    /**
     * @return The size of one component in bytes when stored in a buffer.
     */
    public int byteSize() {
        return 4;
    }
}
