package io.github.eutro.shaderdebug.debug.eval;

import io.github.eutro.shaderdebug.debug.api.DebugMessage.Category;
import io.github.eutro.shaderdebug.debug.api.ResourceDescriptor;
import io.github.eutro.shaderdebug.debug.api.SampleGatherRequest;
import io.github.eutro.shaderdebug.ops.AtomicAccess;
import io.github.eutro.shaderdebug.ops.AtomicOp;
import io.github.eutro.shaderdebug.ops.BindingSlot;
import io.github.eutro.shaderdebug.ops.GroupsharedAccess;
import io.github.eutro.shaderdebug.ops.MathOp;
import io.github.eutro.shaderdebug.ops.ResourceAccess;
import io.github.eutro.shaderdebug.ops.SampleInfo;
import io.github.eutro.shaderdebug.ops.SampleKind;
import io.github.eutro.shaderdebug.ssa.ShaderValue;
import io.github.eutro.shaderdebug.ssa.VarType;
import org.jetbrains.annotations.Nullable;

import java.util.List;

import static io.github.eutro.shaderdebug.ops.ShaderOps.*;

/**
 * Lane inputs and outputs, constant buffers, buffers, textures, atomics, groupshared memory, samples
 * and math intrinsics.
 * <p>
 * Anything unbound, out of range or refused by the debug API gives a warning and zeroes. Helper lanes
 * never write.
 */
class ResourceEvaluators {
    static void register() {
        Evaluators.register(INPUT, ctx -> {
            int slot = INPUT.arg(ctx.insn().op);
            ShaderValue value = ctx.lane().getInput(slot);
            if (value == null) {
                ctx.warn(Category.EXECUTION, "Input " + slot + " was not provided, using 0");
                value = zeroVector();
            }
            ctx.setResult(value);
        });
        Evaluators.register(OUTPUT, ctx -> {
            if (!ctx.lane().isHelper()) {
                ctx.setOutput(OUTPUT.arg(ctx.insn().op), ctx.arg(0));
            }
        });
        Evaluators.register(CBUFFER_LOAD, ctx -> {
            int buffer = CBUFFER_LOAD.arg(ctx.insn().op);
            int index = ctx.arg(0).getInt(0);
            ShaderValue value = ctx.global().getConstant(buffer, index);
            if (value == null) {
                ctx.warn(Category.RESOURCE, "Constant buffer " + buffer + " has no vector " + index + ", using 0");
                value = zeroVector();
            }
            ctx.setResult(value);
        });

        Evaluators.register(BUFFER_LOAD, ctx -> {
            ResourceAccess access = BUFFER_LOAD.arg(ctx.insn().op);
            ShaderValue zero = ShaderValue.zero(access.type, access.components);
            ResourceDescriptor buffer = descriptor(ctx, access.slot);
            if (buffer == null) {
                ctx.setResult(zero);
                return;
            }
            long offset = ctx.arg(0).getUint(0);
            byte[] bytes = ctx.callApi(() -> ctx.api().readBufferValue(buffer, offset, access.byteSize()));
            if (bytes == null) {
                ctx.warn(Category.RESOURCE, "Out of bounds read of " + access.byteSize() + " bytes at "
                        + offset + " from " + buffer + ", using 0");
                ctx.setResult(zero);
                return;
            }
            ctx.setResult(ResourceDescriptor.decode(bytes, 0, access.type, access.components));
        });
        Evaluators.register(BUFFER_STORE, ctx -> {
            if (ctx.lane().isHelper()) return;
            ResourceAccess access = BUFFER_STORE.arg(ctx.insn().op);
            ResourceDescriptor buffer = descriptor(ctx, access.slot);
            if (buffer == null) return;
            long offset = ctx.arg(0).getUint(0);
            byte[] bytes = ResourceDescriptor.encode(ctx.arg(1), access.components);
            if (!ctx.callApi(() -> ctx.api().writeBufferValue(buffer, offset, bytes))) {
                ctx.warn(Category.RESOURCE, "Out of bounds write of " + bytes.length + " bytes at "
                        + offset + " to " + buffer + ", ignored");
            }
        });
        Evaluators.register(TEXEL_LOAD, ctx -> {
            ResourceAccess access = TEXEL_LOAD.arg(ctx.insn().op);
            ShaderValue zero = ShaderValue.zero(access.type, access.components);
            ResourceDescriptor texture = descriptor(ctx, access.slot);
            if (texture == null) {
                ctx.setResult(zero);
                return;
            }
            int[] coord = ctx.arg(0).toBits();
            int sample = ctx.arity() > 1 ? ctx.arg(1).getInt(0) : 0;
            ShaderValue texel = ctx.callApi(() ->
                    ctx.api().readTexel(texture, coord, sample, access.type, access.components));
            if (texel == null) {
                ctx.warn(Category.RESOURCE, "Out of bounds texel " + ctx.arg(0) + " of " + texture + ", using 0");
                texel = zero;
            }
            ctx.setResult(texel);
        });
        Evaluators.register(TEXEL_STORE, ctx -> {
            if (ctx.lane().isHelper()) return;
            ResourceAccess access = TEXEL_STORE.arg(ctx.insn().op);
            ResourceDescriptor texture = descriptor(ctx, access.slot);
            if (texture == null) return;
            int[] coord = ctx.arg(0).toBits();
            ShaderValue value = ctx.arg(1);
            if (!ctx.callApi(() -> ctx.api().writeTexel(texture, coord, 0, value))) {
                ctx.warn(Category.RESOURCE, "Out of bounds texel " + ctx.arg(0) + " of " + texture + ", write ignored");
            }
        });

        Evaluators.register(ATOMIC, ctx -> {
            AtomicAccess access = ATOMIC.arg(ctx.insn().op);
            checkAtomic(ctx, access.op);
            ShaderValue zero = ShaderValue.zero(atomicType(ctx), 1);
            if (access.slot.kind != BindingSlot.Kind.READ_WRITE) {
                ctx.warn(Category.RESOURCE, "Atomic on " + access.slot + ", which is not read-write, using 0");
                ctx.setResult(zero);
                return;
            }
            ResourceDescriptor buffer = descriptor(ctx, access.slot);
            if (buffer == null) {
                ctx.setResult(zero);
                return;
            }
            long offset = ctx.arg(0).getUint(0);
            byte[] bytes = ctx.callApi(() -> ctx.api().readBufferValue(buffer, offset, 4));
            if (bytes == null) {
                ctx.warn(Category.RESOURCE, "Out of bounds atomic at " + offset + " on " + buffer + ", using 0");
                ctx.setResult(zero);
                return;
            }
            ShaderValue old = ResourceDescriptor.decode(bytes, 0, zero.type, 1);
            if (!ctx.lane().isHelper()) {
                byte[] updated = ResourceDescriptor.encode(old.withBits(0, atomicUpdate(ctx, access.op, old)), 1);
                ctx.callApi(() -> ctx.api().writeBufferValue(buffer, offset, updated));
            }
            ctx.setResult(old);
        });

        Evaluators.register(GROUPSHARED_LOAD, ctx -> {
            GroupsharedAccess access = GROUPSHARED_LOAD.arg(ctx.insn().op);
            long offset = ctx.arg(0).getUint(0);
            byte[] bytes = ctx.global().readGroupshared(offset, access.byteSize());
            if (bytes == null) {
                ctx.warn(Category.RESOURCE, "Out of bounds groupshared read of " + access.byteSize()
                        + " bytes at " + offset + ", using 0");
                ctx.setResult(ShaderValue.zero(access.type, access.components));
                return;
            }
            ctx.setResult(ResourceDescriptor.decode(bytes, 0, access.type, access.components));
        });
        Evaluators.register(GROUPSHARED_STORE, ctx -> {
            if (ctx.lane().isHelper()) return;
            GroupsharedAccess access = GROUPSHARED_STORE.arg(ctx.insn().op);
            long offset = ctx.arg(0).getUint(0);
            byte[] bytes = ResourceDescriptor.encode(ctx.arg(1), access.components);
            if (!ctx.global().writeGroupshared(offset, bytes)) {
                ctx.warn(Category.RESOURCE, "Out of bounds groupshared write of " + bytes.length
                        + " bytes at " + offset + ", ignored");
            }
        });
        Evaluators.register(GROUPSHARED_ATOMIC, ctx -> {
            AtomicOp op = GROUPSHARED_ATOMIC.arg(ctx.insn().op);
            checkAtomic(ctx, op);
            VarType type = atomicType(ctx);
            long offset = ctx.arg(0).getUint(0);
            byte[] bytes = ctx.global().readGroupshared(offset, 4);
            if (bytes == null) {
                ctx.warn(Category.RESOURCE, "Out of bounds groupshared atomic at " + offset + ", using 0");
                ctx.setResult(ShaderValue.zero(type, 1));
                return;
            }
            ShaderValue old = ResourceDescriptor.decode(bytes, 0, type, 1);
            if (!ctx.lane().isHelper()) {
                ctx.global().writeGroupshared(offset,
                        ResourceDescriptor.encode(old.withBits(0, atomicUpdate(ctx, op, old)), 1));
            }
            ctx.setResult(old);
        });

        Evaluators.register(SAMPLE, ResourceEvaluators::sample);

        Evaluators.register(MATH, ctx -> {
            MathOp op = MATH.arg(ctx.insn().op);
            ShaderValue operand = ctx.arg(0);
            List<ShaderValue> results = ctx.callApi(() -> ctx.api().calculateMathIntrinsic(op, operand));
            if (results == null || results.size() != op.results) {
                ctx.warn(Category.CAPABILITY, "Failed to calculate " + op + " of " + operand + ", using 0");
                for (int i = 0; i < op.results; i++) {
                    ctx.setResult(i, ShaderValue.zero(VarType.FLOAT, operand.components()));
                }
                return;
            }
            for (int i = 0; i < op.results; i++) {
                ctx.setResult(i, results.get(i));
            }
        });
    }

    static ShaderValue zeroVector() {
        return ShaderValue.zero(VarType.FLOAT, 4);
    }

    private static @Nullable ResourceDescriptor descriptor(EvalContext ctx, BindingSlot slot) {
        ResourceDescriptor descriptor = ctx.callApi(() -> ctx.global().getDescriptor(slot, ctx.api()));
        if (descriptor == null) {
            ctx.warn(Category.RESOURCE, "Nothing is bound to " + slot + ", using 0");
        }
        return descriptor;
    }

    private static void checkAtomic(EvalContext ctx, AtomicOp op) {
        if (ctx.arity() != 1 + op.valueOperands()) {
            throw new IllegalStateException(op + " takes " + (1 + op.valueOperands())
                    + " operands, got " + ctx.arity() + " in " + ctx.insn());
        }
    }

    // the new contents of memory, from the operands after the offset
    private static int atomicUpdate(EvalContext ctx, AtomicOp op, ShaderValue old) {
        int compare = op.valueOperands() > 1 ? ctx.arg(1).getInt(0) : 0;
        int value = ctx.arg(ctx.arity() - 1).getInt(0);
        return op.apply(old.getInt(0), compare, value);
    }

    private static VarType atomicType(EvalContext ctx) {
        return ctx.arg(ctx.arity() - 1).type;
    }

    private static void sample(EvalContext ctx) {
        SampleInfo info = SAMPLE.arg(ctx.insn().op);
        SampleKind kind = info.kind;
        if (ctx.arity() != 1 + kind.extraOperands) {
            throw new IllegalStateException(kind + " takes " + (1 + kind.extraOperands)
                    + " operands, got " + ctx.arity() + " in " + ctx.insn());
        }

        float[] uv = sanitize(ctx, ctx.arg(0), "uv");
        float[] ddx = new float[uv.length];
        float[] ddy = new float[uv.length];
        float lodOrBias = 0;
        float compare = 0;
        switch (kind) {
            case SAMPLE:
            case SAMPLE_CMP:
                break;
            case SAMPLE_BIAS:
                lodOrBias = sanitize(ctx, ctx.arg(1), "bias")[0];
                break;
            case SAMPLE_LEVEL:
                lodOrBias = sanitize(ctx, ctx.arg(1), "lod")[0];
                break;
            case SAMPLE_GRAD:
                ddx = sanitize(ctx, ctx.arg(1), "ddx");
                ddy = sanitize(ctx, ctx.arg(2), "ddy");
                break;
            default:
                break;
        }
        if (kind.isCompare()) {
            compare = sanitize(ctx, ctx.arg(1), "compare")[0];
        }
        if (kind.implicitDerivatives) {
            ddx = implicitDerivative(ctx, true);
            ddy = implicitDerivative(ctx, false);
        }

        ResourceDescriptor texture = ctx.callApi(() -> ctx.global().getDescriptor(info.texture, ctx.api()));
        if (texture == null) {
            ctx.warn(Category.RESOURCE, "Nothing is bound to " + info.texture + ", using 0");
            ctx.setResult(zeroVector());
            return;
        }
        ResourceDescriptor sampler = ctx.callApi(() -> ctx.global().getDescriptor(info.sampler, ctx.api()));
        SampleGatherRequest request = new SampleGatherRequest(info, texture, sampler,
                uv, ddx, ddy, lodOrBias, compare, ctx.lane().getIndex());
        ShaderValue result = ctx.callApi(() -> ctx.api().calculateSampleGather(request));
        if (result == null) {
            ctx.warn(Category.CAPABILITY, "Failed to calculate " + kind + " of " + texture + ", using 0");
            result = zeroVector();
        }
        ctx.setResult(result);
    }

    private static float[] sanitize(EvalContext ctx, ShaderValue value, String operand) {
        float[] out = new float[value.components()];
        for (int c = 0; c < out.length; c++) {
            float f = value.getFloat(c);
            if (Float.isFinite(f)) {
                out[c] = f;
            } else {
                ctx.warn(Category.NUMERIC, "NaN or Inf found in texture lookup " + operand + ", using 0.0 instead");
            }
        }
        return out;
    }

    // derived values; non-finite ones were already reported on their operands
    private static float[] implicitDerivative(EvalContext ctx, boolean horizontal) {
        ShaderValue d = LaneEvaluators.derivative(ctx, ctx.insn().arg(0), horizontal, false);
        float[] out = new float[d.components()];
        for (int c = 0; c < out.length; c++) {
            float f = d.getFloat(c);
            out[c] = Float.isFinite(f) ? f : 0;
        }
        return out;
    }
}
