package io.github.eutro.shaderdebug.debug.eval;

import io.github.eutro.shaderdebug.debug.DebugExts;
import io.github.eutro.shaderdebug.ops.Op;
import io.github.eutro.shaderdebug.ops.OpKey;
import io.github.eutro.shaderdebug.ssa.Insn;
import org.jetbrains.annotations.Nullable;

/**
 * Registry of evaluators, attached to op keys as {@link DebugExts#EFFECT_EVALUATOR} and
 * {@link DebugExts#CONTROL_EVALUATOR}.
 * <p>
 * Ops without an evaluator fail the session when a lane reaches them. Embedders can support extra ops
 * by registering evaluators for their keys.
 */
public class Evaluators {
    private static boolean bootstrapped;

    /**
     * Register evaluators for every built-in op. Idempotent.
     */
    public static synchronized void bootstrap() {
        if (bootstrapped) return;
        bootstrapped = true;
        FlowEvaluators.register();
        ArithmeticEvaluators.register();
        ResourceEvaluators.register();
        LaneEvaluators.register();
    }

    public static void register(OpKey key, EffectEvaluator evaluator) {
        key.attachExt(DebugExts.EFFECT_EVALUATOR, evaluator);
    }

    public static void register(Op op, EffectEvaluator evaluator) {
        register(op.key, evaluator);
    }

    public static void registerControl(OpKey key, ControlEvaluator evaluator) {
        key.attachExt(DebugExts.CONTROL_EVALUATOR, evaluator);
    }

    public static void registerControl(Op op, ControlEvaluator evaluator) {
        registerControl(op.key, evaluator);
    }

    public static @Nullable EffectEvaluator effectEvaluator(Insn insn) {
        return insn.op.key.getNullable(DebugExts.EFFECT_EVALUATOR);
    }

    public static @Nullable ControlEvaluator controlEvaluator(Insn insn) {
        return insn.op.key.getNullable(DebugExts.CONTROL_EVALUATOR);
    }
}
