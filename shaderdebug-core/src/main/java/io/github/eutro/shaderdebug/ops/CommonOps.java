package io.github.eutro.shaderdebug.ops;

import io.github.eutro.shaderdebug.ssa.BasicBlock;
import io.github.eutro.shaderdebug.ssa.Function;
import io.github.eutro.shaderdebug.ssa.Insn;
import io.github.eutro.shaderdebug.ssa.ShaderValue;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Structural ops: control flow, calls, arguments, phis and constants.
 */
public class CommonOps {
    /**
     * Control: an unconditional jump to its only target.
     */
    public static final Op BR = new SimpleOpKey("br").create();
    /**
     * Control: jumps to the first target if its bool argument is true, otherwise to the second.
     */
    public static final Op BR_IF = new SimpleOpKey("br_if").create();
    /**
     * Control: compares its integer argument against the case values, jumping to the target
     * after the matching case, or to the first target if none match.
     */
    public static final UnaryOpKey<int[]> SWITCH = new UnaryOpKey<>("switch", Arrays::toString);
    /**
     * Control: leaves the function, returning its argument, if any.
     */
    public static final Op RETURN = new SimpleOpKey("return").create();
    /**
     * Control: discards the lane. It stops executing and its outputs are thrown away.
     */
    public static final Op KILL = new SimpleOpKey("discard").create();

    /**
     * Effect: returns its argument.
     */
    public static final Op IDENTITY = new SimpleOpKey("id").create();
    /**
     * Effect: returns the argument corresponding to the block the lane came from.
     * <p>
     * Must precede any other effect in its block.
     */
    public static final UnaryOpKey<List<BasicBlock>> PHI = new UnaryOpKey<>("phi", bbs ->
            bbs.stream().map(BasicBlock::toTargetString).collect(Collectors.joining(" ")));
    /**
     * Effect: returns the {@code n}th argument of the function.
     */
    public static final UnaryOpKey<Integer> ARG = new UnaryOpKey<>("arg");
    /**
     * Effect: returns the constant.
     */
    public static final UnaryOpKey<ShaderValue> CONST = new UnaryOpKey<>("const");
    /**
     * Effect: calls the function with its arguments, returning what it returns.
     */
    public static final UnaryOpKey<Function> CALL = new UnaryOpKey<>("call", f -> f.name);

    public static Insn constant(ShaderValue k) {
        return CONST.create(k).insn();
    }
}
