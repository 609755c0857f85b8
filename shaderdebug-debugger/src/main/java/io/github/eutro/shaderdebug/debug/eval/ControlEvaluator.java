package io.github.eutro.shaderdebug.debug.eval;

import io.github.eutro.shaderdebug.ssa.BasicBlock;
import org.jetbrains.annotations.Nullable;

/**
 * Executes a control for one lane.
 */
@FunctionalInterface
public interface ControlEvaluator {
    /**
     * @param ctx The context.
     * @return The block to continue at, or null if the lane leaves the function.
     */
    @Nullable BasicBlock evaluate(EvalContext ctx);
}
