package io.github.eutro.shaderdebug.debug.api;

import io.github.eutro.shaderdebug.ops.BindingSlot;
import io.github.eutro.shaderdebug.ops.MathOp;
import io.github.eutro.shaderdebug.ssa.ShaderValue;
import io.github.eutro.shaderdebug.ssa.VarType;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * A {@link DebugApi} computed on the CPU, over resources bound with {@link #bind}.
 * <p>
 * Results approximate a GPU: there are no mips, so lod, bias and derivatives are ignored, and
 * comparisons pass when the reference is less than or equal to the texel.
 */
public class SoftwareDebugApi implements DebugApi {
    private final Map<BindingSlot, ResourceDescriptor> resources = new HashMap<>();
    private final List<DebugMessage> messages = new ArrayList<>();

    public SoftwareDebugApi bind(ResourceDescriptor descriptor) {
        resources.put(descriptor.slot, descriptor);
        return this;
    }

    @Override
    public @Nullable ResourceDescriptor fetchResourceDescriptor(BindingSlot slot) {
        return resources.get(slot);
    }

    @Override
    public @Nullable ShaderValue calculateSampleGather(SampleGatherRequest request) {
        ResourceDescriptor texture = request.texture;
        if (!texture.isTexture() || texture.format != VarType.FLOAT) return null;
        ResourceDescriptor.Filter filter = request.sampler == null ? ResourceDescriptor.Filter.POINT : request.sampler.filter;
        ResourceDescriptor.AddressMode mode = request.sampler == null ? ResourceDescriptor.AddressMode.CLAMP : request.sampler.addressMode;
        int[] offset = request.info.texelOffset;

        float x = request.uv(0) * texture.width - 0.5f + offset[0];
        float y = texture.dimension == ResourceDescriptor.Dimension.TEXTURE_1D
                ? 0
                : request.uv(1) * texture.height - 0.5f + offset[1];
        int z = texture.dimension == ResourceDescriptor.Dimension.TEXTURE_3D
                ? address((int) Math.floor(request.uv(2) * texture.depth), texture.depth, mode)
                : 0;
        int x0 = (int) Math.floor(x);
        int y0 = (int) Math.floor(y);

        if (request.info.kind.isGather()) {
            // D3D gather order: (0, 1), (1, 1), (1, 0), (0, 0)
            float[] out = {
                    fetch(texture, x0, y0 + 1, z, mode, 0),
                    fetch(texture, x0 + 1, y0 + 1, z, mode, 0),
                    fetch(texture, x0 + 1, y0, z, mode, 0),
                    fetch(texture, x0, y0, z, mode, 0),
            };
            if (request.info.kind.isCompare()) {
                for (int i = 0; i < 4; i++) out[i] = compare(request.compare, out[i]);
            }
            return ShaderValue.floats(out);
        }

        float[] out = new float[4];
        for (int c = 0; c < 4; c++) {
            if (c >= texture.components) {
                out[c] = c == 3 ? 1 : 0;
                continue;
            }
            if (filter == ResourceDescriptor.Filter.POINT) {
                out[c] = fetch(texture, Math.round(x), Math.round(y), z, mode, c);
            } else {
                float fx = x - x0;
                float fy = y - y0;
                float top = lerp(fetch(texture, x0, y0, z, mode, c), fetch(texture, x0 + 1, y0, z, mode, c), fx);
                float bottom = lerp(fetch(texture, x0, y0 + 1, z, mode, c), fetch(texture, x0 + 1, y0 + 1, z, mode, c), fx);
                out[c] = lerp(top, bottom, fy);
            }
        }
        if (request.info.kind.isCompare()) {
            float result = compare(request.compare, out[0]);
            return ShaderValue.floats(result, result, result, result);
        }
        return ShaderValue.floats(out);
    }

    @Override
    public @Nullable List<ShaderValue> calculateMathIntrinsic(MathOp op, ShaderValue operand) {
        if (operand.type != VarType.FLOAT) return null;
        int n = operand.components();
        float[] first = new float[n];
        float[] second = new float[n];
        for (int c = 0; c < n; c++) {
            double x = operand.getFloat(c);
            switch (op) {
                case RCP:
                    first[c] = (float) (1 / x);
                    break;
                case RSQ:
                    first[c] = (float) (1 / Math.sqrt(x));
                    break;
                case SQRT:
                    first[c] = (float) Math.sqrt(x);
                    break;
                case EXP2:
                    first[c] = (float) Math.pow(2, x);
                    break;
                case LOG2:
                    first[c] = (float) (Math.log(x) / Math.log(2));
                    break;
                case SIN:
                    first[c] = (float) Math.sin(x);
                    break;
                case COS:
                    first[c] = (float) Math.cos(x);
                    break;
                case SINCOS:
                    first[c] = (float) Math.sin(x);
                    second[c] = (float) Math.cos(x);
                    break;
            }
        }
        return op.results == 1
                ? Collections.singletonList(ShaderValue.floats(first))
                : Arrays.asList(ShaderValue.floats(first), ShaderValue.floats(second));
    }

    @Override
    public void addDebugMessage(DebugMessage message) {
        messages.add(message);
    }

    public List<DebugMessage> getMessages() {
        return Collections.unmodifiableList(messages);
    }

    private static float fetch(ResourceDescriptor texture, int x, int y, int z, ResourceDescriptor.AddressMode mode, int c) {
        int offset = texture.texelOffset(address(x, texture.width, mode), address(y, texture.height, mode), z, 0);
        if (offset < 0) return 0;
        return ResourceDescriptor.decode(texture.getData(), offset, VarType.FLOAT, texture.components).getFloat(c);
    }

    private static int address(int coord, int size, ResourceDescriptor.AddressMode mode) {
        if (mode == ResourceDescriptor.AddressMode.WRAP) {
            return Math.floorMod(coord, size);
        }
        return Math.max(0, Math.min(size - 1, coord));
    }

    private static float lerp(float a, float b, float t) {
        return a + (b - a) * t;
    }

    private static float compare(float reference, float texel) {
        return reference <= texel ? 1 : 0;
    }
}
