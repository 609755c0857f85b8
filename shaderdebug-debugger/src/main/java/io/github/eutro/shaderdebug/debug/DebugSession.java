package io.github.eutro.shaderdebug.debug;

import io.github.eutro.shaderdebug.debug.api.DebugApi;
import io.github.eutro.shaderdebug.debug.api.DebugMessage;
import io.github.eutro.shaderdebug.ssa.ShaderProgram;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.List;

/**
 * A debugging run of one shader program over a group of lanes. Created by
 * {@link ShaderDebugger#beginDebug}, advanced by {@link ShaderDebugger#continueDebug}.
 */
public final class DebugSession {
    private static final Logger LOGGER = LoggerFactory.getLogger(DebugSession.class);

    public enum Status {
        RUNNING,
        /**
         * Every active lane has finished.
         */
        FINISHED,
        /**
         * A fatal error occurred, see {@link #getFailure()}.
         */
        FAILED,
        /**
         * The step limit was hit.
         */
        ABORTED,
    }

    private final ShaderProgram program;
    private final DebugApi api;
    private final int activeLane;
    private final List<LaneState> lanes;
    private final GlobalState global;
    private final List<DebugMessage> messages = new ArrayList<>();
    final List<MergePoint> mergePoints = new ArrayList<>();
    private Status status = Status.RUNNING;
    private @Nullable ShaderDebugException failure;
    private int stepIndex;

    // the step in progress
    private BitSet stepMask = new BitSet();
    private ExecutionPoint[] stepStart;

    DebugSession(ShaderProgram program, DebugApi api, int activeLane, List<LaneState> lanes, GlobalState global) {
        this.program = program;
        this.api = api;
        this.activeLane = activeLane;
        this.lanes = Collections.unmodifiableList(lanes);
        this.global = global;
        this.stepStart = new ExecutionPoint[lanes.size()];
    }

    public ShaderProgram getProgram() {
        return program;
    }

    public DebugApi getApi() {
        return api;
    }

    /**
     * @return The lane the user is debugging.
     */
    public int getActiveLane() {
        return activeLane;
    }

    public List<LaneState> getLanes() {
        return lanes;
    }

    public LaneState getLane(int lane) {
        return lanes.get(lane);
    }

    public GlobalState getGlobal() {
        return global;
    }

    public List<DebugMessage> getMessages() {
        return Collections.unmodifiableList(messages);
    }

    public List<MergePoint> getMergePoints() {
        return Collections.unmodifiableList(mergePoints);
    }

    public Status getStatus() {
        return status;
    }

    public @Nullable ShaderDebugException getFailure() {
        return failure;
    }

    /**
     * @return The number of steps taken so far.
     */
    public int getStepCount() {
        return stepIndex;
    }

    public boolean isFinished() {
        for (LaneState lane : lanes) {
            if (lane.isRunnable()) return false;
        }
        return true;
    }

    /**
     * @return The lanes executing in the current step.
     */
    public BitSet getStepMask() {
        return (BitSet) stepMask.clone();
    }

    /**
     * @param lane The lane.
     * @return Where the lane was when the current step started, or null if it isn't executing in this step.
     */
    public @Nullable ExecutionPoint getStepStart(int lane) {
        return stepMask.get(lane) ? stepStart[lane] : null;
    }

    /**
     * Record a message, pass it to the debug API and log it.
     *
     * @param severity The severity.
     * @param category The category.
     * @param lane     The lane it concerns, or -1.
     * @param text     The text.
     */
    public void report(DebugMessage.Severity severity, DebugMessage.Category category, int lane, String text) {
        DebugMessage message = new DebugMessage(severity, category, lane, stepIndex, text);
        messages.add(message);
        api.addDebugMessage(message);
        if (severity == DebugMessage.Severity.HIGH || severity == DebugMessage.Severity.MEDIUM) {
            LOGGER.warn("{}", message);
        } else {
            LOGGER.debug("{}", message);
        }
    }

    void beginStep(BitSet mask) {
        stepMask = mask;
        for (int i = 0; i < lanes.size(); i++) {
            stepStart[i] = mask.get(i) ? lanes.get(i).point() : null;
        }
    }

    int finishStep() {
        return stepIndex++;
    }

    void setFinished() {
        status = Status.FINISHED;
    }

    void fail(Status status, ShaderDebugException failure) {
        this.status = status;
        this.failure = failure;
    }
}
