package io.github.eutro.shaderdebug.debug;

import io.github.eutro.shaderdebug.debug.eval.ControlEvaluator;
import io.github.eutro.shaderdebug.debug.eval.EffectEvaluator;
import io.github.eutro.shaderdebug.ext.Ext;

/**
 * Exts used by the debugger.
 */
public class DebugExts {
    /**
     * How to execute an effect op. Attached to {@link io.github.eutro.shaderdebug.ops.OpKey}s.
     */
    public static final Ext<EffectEvaluator> EFFECT_EVALUATOR = Ext.create(EffectEvaluator.class, "EFFECT_EVALUATOR");
    /**
     * How to execute a control op. Attached to {@link io.github.eutro.shaderdebug.ops.OpKey}s.
     */
    public static final Ext<ControlEvaluator> CONTROL_EVALUATOR = Ext.create(ControlEvaluator.class, "CONTROL_EVALUATOR");
    public static final Ext<FunctionLayout> LAYOUT = Ext.create(FunctionLayout.class, "LAYOUT");
}
