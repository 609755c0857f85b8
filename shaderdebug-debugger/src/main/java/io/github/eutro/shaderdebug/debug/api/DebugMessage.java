package io.github.eutro.shaderdebug.debug.api;

/**
 * A diagnostic raised while debugging.
 */
public final class DebugMessage {
    public enum Severity {
        HIGH,
        MEDIUM,
        LOW,
        INFO,
    }

    public enum Category {
        EXECUTION,
        RESOURCE,
        NUMERIC,
        CAPABILITY,
    }

    public final Severity severity;
    public final Category category;
    /**
     * The lane, or -1 if the message concerns the whole session.
     */
    public final int lane;
    public final int step;
    public final String text;

    public DebugMessage(Severity severity, Category category, int lane, int step, String text) {
        this.severity = severity;
        this.category = category;
        this.lane = lane;
        this.step = step;
        this.text = text;
    }

    @Override
    public String toString() {
        return "[" + severity + "/" + category + "] "
                + (lane < 0 ? "" : "lane " + lane + ", ")
                + "step " + step + ": " + text;
    }
}
