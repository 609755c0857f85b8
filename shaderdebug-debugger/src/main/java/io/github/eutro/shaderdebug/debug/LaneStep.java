package io.github.eutro.shaderdebug.debug;

import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.List;

/**
 * What one lane did in one step.
 */
public final class LaneStep {
    private final int lane;
    private final ExecutionPoint executed;
    private final String instruction;
    private final @Nullable ExecutionPoint next;
    private final boolean helper;
    private final List<RegisterChange> changes;

    public LaneStep(int lane,
                    ExecutionPoint executed,
                    String instruction,
                    @Nullable ExecutionPoint next,
                    boolean helper,
                    List<RegisterChange> changes) {
        this.lane = lane;
        this.executed = executed;
        this.instruction = instruction;
        this.next = next;
        this.helper = helper;
        this.changes = Collections.unmodifiableList(changes);
    }

    public int getLane() {
        return lane;
    }

    public ExecutionPoint getExecuted() {
        return executed;
    }

    /**
     * @return The text of the instruction executed.
     */
    public String getInstruction() {
        return instruction;
    }

    /**
     * @return Where the lane will continue, or null if it finished.
     */
    public @Nullable ExecutionPoint getNext() {
        return next;
    }

    public boolean isHelper() {
        return helper;
    }

    public List<RegisterChange> getChanges() {
        return changes;
    }

    @Override
    public String toString() {
        return "lane " + lane + " " + executed + ": " + instruction + (changes.isEmpty() ? "" : " " + changes);
    }
}
