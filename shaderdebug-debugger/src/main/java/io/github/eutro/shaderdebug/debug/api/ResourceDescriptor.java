package io.github.eutro.shaderdebug.debug.api;

import io.github.eutro.shaderdebug.ops.BindingSlot;
import io.github.eutro.shaderdebug.ssa.ShaderValue;
import io.github.eutro.shaderdebug.ssa.VarType;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * What is bound to a {@link BindingSlot}: a buffer, a texture or a sampler.
 * <p>
 * Buffer and texture contents are tightly packed, little-endian. Texels are laid out by sample, then
 * depth, then row. The data array is shared, so writes through it are seen by later reads.
 */
public final class ResourceDescriptor {
    public enum Dimension {
        BUFFER,
        TEXTURE_1D,
        TEXTURE_2D,
        TEXTURE_3D,
        SAMPLER,
    }

    public enum Filter {
        POINT,
        LINEAR,
    }

    public enum AddressMode {
        WRAP,
        CLAMP,
    }

    public final BindingSlot slot;
    public final Dimension dimension;
    public final VarType format;
    public final int components;
    public final int width;
    public final int height;
    public final int depth;
    public final int sampleCount;
    public final Filter filter;
    public final AddressMode addressMode;
    private final byte[] data;

    private ResourceDescriptor(BindingSlot slot,
                               Dimension dimension,
                               VarType format,
                               int components,
                               int width,
                               int height,
                               int depth,
                               int sampleCount,
                               Filter filter,
                               AddressMode addressMode,
                               byte[] data) {
        this.slot = slot;
        this.dimension = dimension;
        this.format = format;
        this.components = components;
        this.width = width;
        this.height = height;
        this.depth = depth;
        this.sampleCount = sampleCount;
        this.filter = filter;
        this.addressMode = addressMode;
        this.data = data;
    }

    public static ResourceDescriptor buffer(BindingSlot slot, byte[] data) {
        return new ResourceDescriptor(slot, Dimension.BUFFER, VarType.UINT, 1,
                data.length, 1, 1, 1, Filter.POINT, AddressMode.CLAMP, data);
    }

    public static ResourceDescriptor texture(BindingSlot slot,
                                             Dimension dimension,
                                             VarType format,
                                             int components,
                                             int width,
                                             int height,
                                             int depth,
                                             int sampleCount,
                                             byte[] data) {
        if (dimension == Dimension.BUFFER || dimension == Dimension.SAMPLER) {
            throw new IllegalArgumentException("Not a texture dimension: " + dimension);
        }
        if (components < 1 || components > 4) {
            throw new IllegalArgumentException("Bad component count: " + components);
        }
        long size = (long) width * height * depth * sampleCount * components * format.byteSize();
        if (size != data.length) {
            throw new IllegalArgumentException("Expected " + size + " bytes of texture data, got " + data.length);
        }
        return new ResourceDescriptor(slot, dimension, format, components,
                width, height, depth, sampleCount, Filter.POINT, AddressMode.CLAMP, data);
    }

    public static ResourceDescriptor texture2D(BindingSlot slot, VarType format, int components, int width, int height, byte[] data) {
        return texture(slot, Dimension.TEXTURE_2D, format, components, width, height, 1, 1, data);
    }

    /**
     * Build a 2D float texture from texel values.
     *
     * @param slot       The slot.
     * @param width      The width.
     * @param height     The height.
     * @param components Components per texel.
     * @param texels     The components of every texel, row by row.
     * @return The descriptor.
     */
    public static ResourceDescriptor floatTexture2D(BindingSlot slot, int width, int height, int components, float... texels) {
        ByteBuffer buf = ByteBuffer.allocate(texels.length * 4).order(ByteOrder.LITTLE_ENDIAN);
        for (float texel : texels) buf.putFloat(texel);
        return texture2D(slot, VarType.FLOAT, components, width, height, buf.array());
    }

    public static ResourceDescriptor sampler(BindingSlot slot, Filter filter, AddressMode addressMode) {
        return new ResourceDescriptor(slot, Dimension.SAMPLER, VarType.FLOAT, 1,
                0, 0, 0, 0, filter, addressMode, new byte[0]);
    }

    /**
     * @return The contents. Not a copy.
     */
    public byte[] getData() {
        return data;
    }

    public boolean isTexture() {
        return dimension != Dimension.BUFFER && dimension != Dimension.SAMPLER;
    }

    public int texelSize() {
        return components * format.byteSize();
    }

    /**
     * @param x      The column.
     * @param y      The row.
     * @param z      The slice.
     * @param sample The sample.
     * @return The byte offset of the texel, or -1 if it is out of range.
     */
    public int texelOffset(int x, int y, int z, int sample) {
        if (!isTexture()
                || x < 0 || x >= width
                || y < 0 || y >= height
                || z < 0 || z >= depth
                || sample < 0 || sample >= sampleCount) {
            return -1;
        }
        return (((sample * depth + z) * height + y) * width + x) * texelSize();
    }

    /**
     * Decode little-endian components.
     *
     * @param bytes      The bytes.
     * @param offset     Where to start.
     * @param type       The component type.
     * @param components The number of components.
     * @return The value.
     */
    public static ShaderValue decode(byte[] bytes, int offset, VarType type, int components) {
        ByteBuffer buf = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
        int[] bits = new int[components];
        for (int c = 0; c < components; c++) {
            bits[c] = buf.getInt(offset + c * 4);
        }
        return ShaderValue.ofBits(type, bits);
    }

    /**
     * Encode the first {@code components} components of a value, repeating a scalar.
     *
     * @param value      The value.
     * @param components The number of components.
     * @return The little-endian bytes.
     */
    public static byte[] encode(ShaderValue value, int components) {
        ByteBuffer buf = ByteBuffer.allocate(components * 4).order(ByteOrder.LITTLE_ENDIAN);
        for (int c = 0; c < components; c++) {
            buf.putInt(c < value.components() || value.components() == 1 ? value.splatBits(c) : 0);
        }
        return buf.array();
    }

    @Override
    public String toString() {
        switch (dimension) {
            case BUFFER:
                return "buffer " + slot + " (" + data.length + " bytes)";
            case SAMPLER:
                return "sampler " + slot + " " + filter + " " + addressMode;
            default:
                return dimension + " " + slot + " " + format.suffix + components + " " + width + "x" + height + "x" + depth;
        }
    }
}
