package io.github.eutro.shaderdebug.debug;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Settings of a {@link ShaderDebugger}.
 * <p>
 * Defaults can be overridden with the {@code SHADERDEBUG_MAX_STEPS} and {@code SHADERDEBUG_TRACE_STEPS}
 * environment variables.
 */
public final class DebuggerConfig {
    private static final Logger LOGGER = LoggerFactory.getLogger(DebuggerConfig.class);

    public static final int DEFAULT_MAX_STEPS = envInt("SHADERDEBUG_MAX_STEPS", 100_000);
    public static boolean TRACE_STEPS = System.getenv("SHADERDEBUG_TRACE_STEPS") != null;

    public static final DebuggerConfig DEFAULT = new DebuggerConfig(DEFAULT_MAX_STEPS, TRACE_STEPS);

    /**
     * The most simulation steps a session may take before it is aborted.
     */
    public final int maxSteps;
    /**
     * Whether to log every instruction every lane executes, at trace level.
     */
    public final boolean traceSteps;

    public DebuggerConfig(int maxSteps, boolean traceSteps) {
        if (maxSteps <= 0) throw new IllegalArgumentException("maxSteps must be positive, got " + maxSteps);
        this.maxSteps = maxSteps;
        this.traceSteps = traceSteps;
    }

    public DebuggerConfig withMaxSteps(int maxSteps) {
        return new DebuggerConfig(maxSteps, traceSteps);
    }

    public DebuggerConfig withTraceSteps(boolean traceSteps) {
        return new DebuggerConfig(maxSteps, traceSteps);
    }

    private static int envInt(String name, int fallback) {
        String value = System.getenv(name);
        if (value == null) return fallback;
        return parsePositive(name, value, fallback);
    }

    /**
     * Parse a positive setting, warning about and ignoring anything else.
     *
     * @param name     The setting, for the warning.
     * @param value    Its text.
     * @param fallback The value to use if the text is not a positive number.
     * @return The value.
     */
    public static int parsePositive(String name, String value, int fallback) {
        int parsed;
        try {
            parsed = Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            LOGGER.warn("Ignoring {}={}, not a number", name, value);
            return fallback;
        }
        if (parsed <= 0) {
            LOGGER.warn("Ignoring {}={}, not positive", name, value);
            return fallback;
        }
        return parsed;
    }

    @Override
    public String toString() {
        return "DebuggerConfig{maxSteps=" + maxSteps + ", traceSteps=" + traceSteps + '}';
    }
}
