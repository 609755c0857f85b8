package io.github.eutro.shaderdebug.debug;

/**
 * A failure that ends a debug session. The session cannot be continued afterwards.
 */
public abstract class ShaderDebugException extends RuntimeException {
    public enum Kind {
        /**
         * The shader uses an instruction the debugger (or its debug API) can't execute.
         */
        UNSUPPORTED_INSTRUCTION,
        /**
         * The shader ran for longer than the configured step limit.
         */
        STEP_LIMIT_EXCEEDED,
        /**
         * Executing an instruction failed unexpectedly, leaving the lanes in an inconsistent state.
         */
        EXECUTION_ERROR,
    }

    private final Kind kind;

    protected ShaderDebugException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}
