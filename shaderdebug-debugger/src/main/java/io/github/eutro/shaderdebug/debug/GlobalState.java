package io.github.eutro.shaderdebug.debug;

import io.github.eutro.shaderdebug.debug.api.DebugApi;
import io.github.eutro.shaderdebug.debug.api.ResourceDescriptor;
import io.github.eutro.shaderdebug.ext.CommonExts;
import io.github.eutro.shaderdebug.ops.BindingSlot;
import io.github.eutro.shaderdebug.ssa.ShaderValue;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * State shared by all lanes: constant buffers, groupshared memory and resource descriptors.
 * <p>
 * Descriptors are fetched from the {@link DebugApi} at most once per slot, including slots with nothing bound.
 * Writes to a descriptor's data are seen by every lane.
 */
public final class GlobalState {
    private final Map<Integer, List<ShaderValue>> constantBuffers = new TreeMap<>();
    private final Map<BindingSlot, Object> descriptors = new HashMap<>();
    private final byte[] groupshared;

    GlobalState(Map<Integer, List<ShaderValue>> constantBuffers, int groupsharedSize) {
        this.groupshared = new byte[groupsharedSize];
        for (Map.Entry<Integer, List<ShaderValue>> entry : constantBuffers.entrySet()) {
            this.constantBuffers.put(entry.getKey(), Collections.unmodifiableList(new ArrayList<>(entry.getValue())));
        }
    }

    /**
     * @param buffer The constant buffer.
     * @param index  The index of the vector in the buffer.
     * @return The vector, or null if the buffer isn't bound or the index is out of range.
     */
    public @Nullable ShaderValue getConstant(int buffer, int index) {
        List<ShaderValue> values = constantBuffers.get(buffer);
        if (values == null || index < 0 || index >= values.size()) return null;
        return values.get(index);
    }

    /**
     * @param offset The byte offset.
     * @param size   The number of bytes.
     * @return The bytes of groupshared memory, or null if the range is out of bounds.
     */
    public byte @Nullable [] readGroupshared(long offset, int size) {
        if (offset < 0 || offset + size > groupshared.length) return null;
        return Arrays.copyOfRange(groupshared, (int) offset, (int) offset + size);
    }

    /**
     * @param offset The byte offset.
     * @param bytes  The bytes to write.
     * @return Whether the write was in bounds.
     */
    public boolean writeGroupshared(long offset, byte[] bytes) {
        if (offset < 0 || offset + bytes.length > groupshared.length) return false;
        System.arraycopy(bytes, 0, groupshared, (int) offset, bytes.length);
        return true;
    }

    public int getGroupsharedSize() {
        return groupshared.length;
    }

    public @Nullable ResourceDescriptor getDescriptor(BindingSlot slot, DebugApi api) {
        Object cached = descriptors.get(slot);
        if (cached == null) {
            cached = CommonExts.fillNull(api.fetchResourceDescriptor(slot));
            descriptors.put(slot, cached);
        }
        return (ResourceDescriptor) CommonExts.takeNull(cached);
    }

    public int getCachedDescriptorCount() {
        return descriptors.size();
    }
}
