package io.github.eutro.shaderdebug.debug.eval;

import io.github.eutro.shaderdebug.controlflow.ConvergenceAnalysis;
import io.github.eutro.shaderdebug.debug.LaneState;
import io.github.eutro.shaderdebug.debug.api.DebugMessage.Category;
import io.github.eutro.shaderdebug.ext.CommonExts;
import io.github.eutro.shaderdebug.ops.Derivative;
import io.github.eutro.shaderdebug.ops.WaveOp;
import io.github.eutro.shaderdebug.ssa.Function;
import io.github.eutro.shaderdebug.ssa.ShaderValue;
import io.github.eutro.shaderdebug.ssa.Var;
import io.github.eutro.shaderdebug.ssa.VarType;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static io.github.eutro.shaderdebug.ops.ShaderOps.*;

/**
 * Ops that look at other lanes: derivatives, wave ops, subgroup uniformity and barriers, plus demotion.
 * <p>
 * Quads are groups of four consecutive lanes: top left, top right, bottom left, bottom right.
 */
class LaneEvaluators {
    static void register() {
        Evaluators.register(DERIV, ctx -> {
            Derivative d = DERIV.arg(ctx.insn().op);
            ctx.setResult(derivative(ctx, ctx.insn().arg(0), d.horizontal, d.fine));
        });
        Evaluators.register(WAVE, ctx -> ctx.setResult(wave(ctx, WAVE.arg(ctx.insn().op))));
        Evaluators.register(SUBGROUP_UNIFORM, ctx -> {
            Function func = ctx.frame().function;
            if (func.blocks.size() == 1) {
                ctx.setResult(ShaderValue.bools(true));
                return;
            }
            ConvergenceAnalysis analysis = func.getExtOrThrow(CommonExts.CONVERGENCE);
            ctx.setResult(ShaderValue.bools(analysis.isUniform(ctx.frame().getBlockId())));
        });
        Evaluators.register(DEMOTE, EvalContext::demote);
        // lanes are held back until all arrive, see ShaderDebugger
        Evaluators.register(BARRIER, ctx -> {
        });
    }

    /**
     * The difference of a float variable across the lane's quad. Neighbours that are elsewhere
     * count as having this lane's value. Outside pixel shaders the derivative is 0.
     *
     * @param ctx        The context.
     * @param var        The variable.
     * @param horizontal Whether to take the derivative along x, rather than y.
     * @param fine       Whether to use this lane's row or column, rather than the quad's first.
     * @return The derivative.
     */
    static ShaderValue derivative(EvalContext ctx, Var var, boolean horizontal, boolean fine) {
        ShaderValue own = ctx.frame().read(var);
        float[] out = new float[own.components()];
        if (!ctx.session().getProgram().stage.hasQuads()) {
            return ShaderValue.floats(out);
        }
        int index = ctx.lane().getIndex();
        int quad = index & ~3;
        int first;
        if (horizontal) {
            first = quad + (fine ? index & 2 : 0);
        } else {
            first = quad + (fine ? index & 1 : 0);
        }
        int second = first + (horizontal ? 1 : 2);
        ShaderValue a = neighbour(ctx, first, var, own);
        ShaderValue b = neighbour(ctx, second, var, own);
        for (int c = 0; c < out.length; c++) {
            out[c] = Float.intBitsToFloat(b.splatBits(c)) - Float.intBitsToFloat(a.splatBits(c));
        }
        return ShaderValue.floats(out);
    }

    private static ShaderValue neighbour(EvalContext ctx, int lane, Var var, ShaderValue fallback) {
        List<LaneState> lanes = ctx.session().getLanes();
        if (lane >= lanes.size()) return fallback;
        ShaderValue value = ctx.valueIn(lanes.get(lane), var);
        return value == null ? fallback : value;
    }

    private static ShaderValue operand(EvalContext ctx, LaneState lane) {
        ShaderValue value = ctx.valueIn(lane, ctx.insn().arg(0));
        if (value == null) {
            throw new IllegalStateException("Lane " + lane.getIndex() + " has no value for " + ctx.insn().arg(0));
        }
        return value;
    }

    private static ShaderValue wave(EvalContext ctx, WaveOp op) {
        List<LaneState> participants = ctx.waveParticipants();
        switch (op) {
            case ANY:
            case ALL: {
                boolean any = false;
                boolean all = true;
                for (LaneState lane : participants) {
                    boolean b = operand(ctx, lane).getBool(0);
                    any |= b;
                    all &= b;
                }
                return ShaderValue.bools(op == WaveOp.ANY ? any : all);
            }
            case ALL_EQUAL: {
                ShaderValue own = ctx.arg(0);
                boolean[] equal = new boolean[own.components()];
                Arrays.fill(equal, true);
                for (LaneState lane : participants) {
                    ShaderValue value = operand(ctx, lane);
                    for (int c = 0; c < equal.length; c++) {
                        equal[c] &= value.splatBits(c) == own.bits(c);
                    }
                }
                return ShaderValue.bools(equal);
            }
            case BALLOT: {
                int[] mask = new int[4];
                for (LaneState lane : participants) {
                    int i = lane.getIndex();
                    if (i < 128 && operand(ctx, lane).getBool(0)) {
                        mask[i / 32] |= 1 << (i % 32);
                    }
                }
                return ShaderValue.uints(mask);
            }
            case READ_FIRST:
                return participants.isEmpty()
                        ? ctx.arg(0)
                        : operand(ctx, participants.get(0));
            case READ_LANE_AT: {
                int index = ctx.arg(1).getInt(0);
                for (LaneState lane : participants) {
                    if (lane.getIndex() == index) return operand(ctx, lane);
                }
                ctx.warn(Category.EXECUTION, "Lane " + index + " is not executing " + ctx.insn() + ", using 0");
                ShaderValue own = ctx.arg(0);
                return ShaderValue.zero(own.type, own.components());
            }
            case COUNT:
                return ShaderValue.uints(participants.size());
            case COUNT_BITS:
            case PREFIX_COUNT_BITS: {
                int count = 0;
                for (LaneState lane : participants) {
                    if (op == WaveOp.PREFIX_COUNT_BITS && lane.getIndex() >= ctx.lane().getIndex()) break;
                    if (operand(ctx, lane).getBool(0)) count++;
                }
                return ShaderValue.uints(count);
            }
            case LANE_INDEX:
                return ShaderValue.uints(ctx.lane().getIndex());
            case IS_FIRST_LANE:
                return ShaderValue.bools(!participants.isEmpty() && participants.get(0) == ctx.lane());
            case PREFIX_SUM:
            case PREFIX_PRODUCT: {
                List<LaneState> below = new ArrayList<>();
                for (LaneState lane : participants) {
                    if (lane.getIndex() >= ctx.lane().getIndex()) break;
                    below.add(lane);
                }
                return reduce(ctx, below, op == WaveOp.PREFIX_SUM ? WaveOp.ACTIVE_SUM : WaveOp.ACTIVE_PRODUCT);
            }
            case ACTIVE_SUM:
            case ACTIVE_PRODUCT:
            case ACTIVE_MIN:
            case ACTIVE_MAX:
            case ACTIVE_BIT_AND:
            case ACTIVE_BIT_OR:
            case ACTIVE_BIT_XOR:
                return reduce(ctx, participants, op);
            default:
                throw new IllegalStateException("Unknown wave op " + op);
        }
    }

    private static ShaderValue reduce(EvalContext ctx, List<LaneState> lanes, WaveOp op) {
        ShaderValue own = ctx.arg(0);
        VarType type = own.type;
        int[] acc = new int[own.components()];
        Arrays.fill(acc, identity(op, type));
        for (LaneState lane : lanes) {
            ShaderValue value = operand(ctx, lane);
            for (int c = 0; c < acc.length; c++) {
                acc[c] = combine(op, type, acc[c], value.splatBits(c));
            }
        }
        return ShaderValue.ofBits(type, acc);
    }

    private static int identity(WaveOp op, VarType type) {
        boolean isFloat = type == VarType.FLOAT;
        switch (op) {
            case ACTIVE_PRODUCT:
                return isFloat ? Float.floatToRawIntBits(1) : 1;
            case ACTIVE_MIN:
                if (isFloat) return Float.floatToRawIntBits(Float.POSITIVE_INFINITY);
                return type == VarType.SINT ? Integer.MAX_VALUE : -1;
            case ACTIVE_MAX:
                if (isFloat) return Float.floatToRawIntBits(Float.NEGATIVE_INFINITY);
                return type == VarType.SINT ? Integer.MIN_VALUE : 0;
            case ACTIVE_BIT_AND:
                return -1;
            default:
                return 0;
        }
    }

    private static int combine(WaveOp op, VarType type, int a, int b) {
        if (type == VarType.FLOAT) {
            float x = Float.intBitsToFloat(a);
            float y = Float.intBitsToFloat(b);
            switch (op) {
                case ACTIVE_SUM:
                    return Float.floatToRawIntBits(x + y);
                case ACTIVE_PRODUCT:
                    return Float.floatToRawIntBits(x * y);
                case ACTIVE_MIN:
                    return Float.floatToRawIntBits(Numerics.fmin(x, y));
                case ACTIVE_MAX:
                    return Float.floatToRawIntBits(Numerics.fmax(x, y));
                default:
                    break;
            }
        }
        switch (op) {
            case ACTIVE_SUM:
                return a + b;
            case ACTIVE_PRODUCT:
                return a * b;
            case ACTIVE_MIN:
                if (type == VarType.SINT) return Math.min(a, b);
                return Integer.compareUnsigned(a, b) <= 0 ? a : b;
            case ACTIVE_MAX:
                if (type == VarType.SINT) return Math.max(a, b);
                return Integer.compareUnsigned(a, b) >= 0 ? a : b;
            case ACTIVE_BIT_AND:
                return a & b;
            case ACTIVE_BIT_OR:
                return a | b;
            case ACTIVE_BIT_XOR:
                return a ^ b;
            default:
                throw new IllegalStateException("Not a reduction: " + op);
        }
    }
}
