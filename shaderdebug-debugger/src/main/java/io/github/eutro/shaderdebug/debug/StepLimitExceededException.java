package io.github.eutro.shaderdebug.debug;

/**
 * Thrown when a session runs past {@link DebuggerConfig#maxSteps}, usually because the shader loops forever.
 */
public class StepLimitExceededException extends ShaderDebugException {
    public StepLimitExceededException(int limit) {
        super(Kind.STEP_LIMIT_EXCEEDED, "Shader debugging aborted after " + limit + " steps", null);
    }
}
