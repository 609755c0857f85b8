package io.github.eutro.shaderdebug.debug;

import org.jetbrains.annotations.Nullable;

/**
 * Thrown when executing a step fails for any other reason, such as a malformed instruction or an error
 * thrown by the debug API.
 */
public class ExecutionErrorException extends ShaderDebugException {
    public ExecutionErrorException(int lane, @Nullable ExecutionPoint at, Throwable cause) {
        super(Kind.EXECUTION_ERROR, "Lane " + lane + " failed at " + at + ": " + cause, cause);
    }

    public ExecutionErrorException(int step, Throwable cause) {
        super(Kind.EXECUTION_ERROR, "Step " + step + " failed: " + cause, cause);
    }
}
