package io.github.eutro.shaderdebug.debug;

import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.List;

/**
 * One simulation step: every lane in the active mask executing one instruction, in lane order.
 */
public final class StepResult {
    private final int stepIndex;
    private final List<LaneStep> lanes;

    public StepResult(int stepIndex, List<LaneStep> lanes) {
        this.stepIndex = stepIndex;
        this.lanes = Collections.unmodifiableList(lanes);
    }

    public int getStepIndex() {
        return stepIndex;
    }

    public List<LaneStep> getLanes() {
        return lanes;
    }

    public @Nullable LaneStep forLane(int lane) {
        for (LaneStep step : lanes) {
            if (step.getLane() == lane) return step;
        }
        return null;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("step ").append(stepIndex).append(':');
        for (LaneStep step : lanes) {
            sb.append("\n  ").append(step);
        }
        return sb.toString();
    }
}
