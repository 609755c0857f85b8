package io.github.eutro.shaderdebug.debug.eval;

/**
 * Executes an effect for one lane, setting its results on the context.
 */
@FunctionalInterface
public interface EffectEvaluator {
    void evaluate(EvalContext ctx);
}
