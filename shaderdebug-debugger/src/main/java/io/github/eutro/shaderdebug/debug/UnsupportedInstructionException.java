package io.github.eutro.shaderdebug.debug;

import io.github.eutro.shaderdebug.ssa.Insn;

/**
 * Thrown when a lane reaches an instruction that has no evaluator, or that the debug API refuses to compute.
 */
public class UnsupportedInstructionException extends ShaderDebugException {
    public UnsupportedInstructionException(Insn insn, ExecutionPoint at) {
        this(insn, at, null);
    }

    public UnsupportedInstructionException(Insn insn, ExecutionPoint at, Throwable cause) {
        super(Kind.UNSUPPORTED_INSTRUCTION, "Unsupported instruction " + insn + " at " + at, cause);
    }
}
