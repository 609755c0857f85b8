package io.github.eutro.shaderdebug.debug;

import io.github.eutro.shaderdebug.ssa.Function;
import io.github.eutro.shaderdebug.ssa.ShaderValue;
import io.github.eutro.shaderdebug.ssa.Var;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * The state of one lane of a {@link DebugSession}.
 */
public final class LaneState {
    private final int index;
    private final boolean active;
    private boolean helper;
    private boolean dead;
    private boolean finished;
    private final Map<Integer, ShaderValue> inputs;
    private final Map<Integer, ShaderValue> outputs = new TreeMap<>();
    private final List<StackFrame> stack = new ArrayList<>();
    private @Nullable ShaderValue returnValue;

    LaneState(int index, LaneSetup setup, Function entry) {
        this.index = index;
        this.active = setup.isActive();
        this.helper = setup.isHelper();
        this.inputs = setup.getInputs();
        stack.add(new StackFrame(entry, Collections.emptyList()));
    }

    public int getIndex() {
        return index;
    }

    /**
     * @return Whether the lane was enabled when the session began.
     */
    public boolean isActive() {
        return active;
    }

    public boolean isHelper() {
        return helper;
    }

    /**
     * @return Whether the lane was discarded.
     */
    public boolean isDead() {
        return dead;
    }

    public boolean isFinished() {
        return finished;
    }

    /**
     * @return Whether the lane still has instructions to execute.
     */
    public boolean isRunnable() {
        return active && !finished;
    }

    public @Nullable ShaderValue getInput(int slot) {
        return inputs.get(slot);
    }

    public Map<Integer, ShaderValue> getOutputs() {
        return Collections.unmodifiableMap(outputs);
    }

    public @Nullable ShaderValue getReturnValue() {
        return returnValue;
    }

    /**
     * @return The number of frames below the current one.
     */
    public int getDepth() {
        return stack.size() - 1;
    }

    /**
     * @return The innermost frame, or null once the lane has finished.
     */
    public @Nullable StackFrame currentFrame() {
        return stack.isEmpty() ? null : stack.get(stack.size() - 1);
    }

    public @Nullable StackFrame frameAt(int depth) {
        return depth < stack.size() ? stack.get(depth) : null;
    }

    public List<StackFrame> getStack() {
        return Collections.unmodifiableList(stack);
    }

    /**
     * @return Where the lane is, or null if it has finished.
     */
    public @Nullable ExecutionPoint point() {
        StackFrame frame = currentFrame();
        return frame == null ? null : frame.point(getDepth());
    }

    /**
     * Read a register of the innermost frame.
     *
     * @param var The variable.
     * @return Its value, or null if it is not assigned yet or the lane has finished.
     */
    public @Nullable ShaderValue getRegister(Var var) {
        StackFrame frame = currentFrame();
        return frame == null ? null : frame.peek(var);
    }

    void push(StackFrame frame) {
        stack.add(frame);
    }

    StackFrame pop() {
        return stack.remove(stack.size() - 1);
    }

    void setOutput(int slot, ShaderValue value) {
        outputs.put(slot, value);
    }

    // a helper's outputs are thrown away
    void demote() {
        helper = true;
        outputs.clear();
    }

    void finish(@Nullable ShaderValue returnValue) {
        this.returnValue = returnValue;
        finished = true;
        stack.clear();
    }

    void kill() {
        dead = true;
        outputs.clear();
        finish(null);
    }

    @Override
    public String toString() {
        return "lane " + index + (helper ? " (helper)" : "") + (finished ? " finished" : " at " + point());
    }
}
