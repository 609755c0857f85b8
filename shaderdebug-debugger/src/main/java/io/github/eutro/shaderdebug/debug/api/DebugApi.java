package io.github.eutro.shaderdebug.debug.api;

import io.github.eutro.shaderdebug.ops.BindingSlot;
import io.github.eutro.shaderdebug.ops.MathOp;
import io.github.eutro.shaderdebug.ssa.ShaderValue;
import io.github.eutro.shaderdebug.ssa.VarType;
import org.jetbrains.annotations.Nullable;

import java.util.Arrays;
import java.util.List;

/**
 * What the debugger needs from the outside world: resources, and computations that must match the GPU.
 * <p>
 * Returning null from a method is a lane-local failure; the debugger warns and goes on with zeroes.
 * Throwing {@link UnsupportedOperationException} means the operation can never work, and fails the session.
 */
public interface DebugApi {
    /**
     * @param slot The binding.
     * @return What is bound there, or null if nothing is.
     */
    @Nullable ResourceDescriptor fetchResourceDescriptor(BindingSlot slot);

    /**
     * @param buffer The buffer.
     * @param offset The byte offset.
     * @param size   The number of bytes.
     * @return The bytes, or null if the range is out of bounds.
     */
    default byte @Nullable [] readBufferValue(ResourceDescriptor buffer, long offset, int size) {
        byte[] data = buffer.getData();
        if (offset < 0 || offset + size > data.length) return null;
        return Arrays.copyOfRange(data, (int) offset, (int) offset + size);
    }

    /**
     * @param buffer The buffer.
     * @param offset The byte offset.
     * @param bytes  The bytes to write.
     * @return Whether the write was in bounds.
     */
    default boolean writeBufferValue(ResourceDescriptor buffer, long offset, byte[] bytes) {
        byte[] data = buffer.getData();
        if (offset < 0 || offset + bytes.length > data.length) return false;
        System.arraycopy(bytes, 0, data, (int) offset, bytes.length);
        return true;
    }

    /**
     * @param texture    The texture.
     * @param coord      The integer texel coordinates; missing ones are 0.
     * @param sample     The sample index.
     * @param type       The type to read as.
     * @param components The number of components to read; missing ones read as 0.
     * @return The texel, or null if it is out of bounds.
     */
    default @Nullable ShaderValue readTexel(ResourceDescriptor texture, int[] coord, int sample, VarType type, int components) {
        int offset = texture.texelOffset(coordAt(coord, 0), coordAt(coord, 1), coordAt(coord, 2), sample);
        if (offset < 0) return null;
        ShaderValue texel = ResourceDescriptor.decode(texture.getData(), offset, type, texture.components);
        int[] bits = new int[components];
        for (int c = 0; c < components && c < texel.components(); c++) {
            bits[c] = texel.bits(c);
        }
        return ShaderValue.ofBits(type, bits);
    }

    /**
     * @param texture The texture.
     * @param coord   The integer texel coordinates.
     * @param sample  The sample index.
     * @param value   The value to write.
     * @return Whether the write was in bounds.
     */
    default boolean writeTexel(ResourceDescriptor texture, int[] coord, int sample, ShaderValue value) {
        int offset = texture.texelOffset(coordAt(coord, 0), coordAt(coord, 1), coordAt(coord, 2), sample);
        if (offset < 0) return false;
        byte[] bytes = ResourceDescriptor.encode(value, texture.components);
        System.arraycopy(bytes, 0, texture.getData(), offset, bytes.length);
        return true;
    }

    /**
     * Compute a filtered sample or gather.
     *
     * @param request The request.
     * @return The four-component result, or null on failure.
     */
    @Nullable ShaderValue calculateSampleGather(SampleGatherRequest request);

    /**
     * Compute a math intrinsic.
     *
     * @param op      The intrinsic.
     * @param operand The operand.
     * @return {@link MathOp#results} values, or null on failure.
     */
    @Nullable List<ShaderValue> calculateMathIntrinsic(MathOp op, ShaderValue operand);

    /**
     * Called for every message the debugger raises.
     *
     * @param message The message.
     */
    default void addDebugMessage(DebugMessage message) {
    }

    static int coordAt(int[] coord, int i) {
        return i < coord.length ? coord[i] : 0;
    }
}
