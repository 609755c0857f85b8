package io.github.eutro.shaderdebug.debug.eval;

import io.github.eutro.shaderdebug.debug.DebugSession;
import io.github.eutro.shaderdebug.debug.ExecutionPoint;
import io.github.eutro.shaderdebug.debug.GlobalState;
import io.github.eutro.shaderdebug.debug.LaneState;
import io.github.eutro.shaderdebug.debug.StackFrame;
import io.github.eutro.shaderdebug.debug.UnsupportedInstructionException;
import io.github.eutro.shaderdebug.debug.api.DebugApi;
import io.github.eutro.shaderdebug.debug.api.DebugMessage;
import io.github.eutro.shaderdebug.ssa.BasicBlock;
import io.github.eutro.shaderdebug.ssa.Function;
import io.github.eutro.shaderdebug.ssa.Insn;
import io.github.eutro.shaderdebug.ssa.ShaderValue;
import io.github.eutro.shaderdebug.ssa.Var;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Supplier;

/**
 * The view one lane has while executing one instruction.
 * <p>
 * Evaluators read operands and shared state through it, and record what the instruction does: results,
 * outputs, calls, returns, discards and demotions. The debugger applies these once the evaluator returns.
 */
public final class EvalContext {
    private final DebugSession session;
    private final LaneState lane;
    private final StackFrame frame;
    private final ExecutionPoint point;
    private final Insn insn;
    private final List<BasicBlock> targets;
    private final ShaderValue[] results;
    private final Map<Integer, ShaderValue> outputs = new TreeMap<>();

    private @Nullable Function call;
    private List<ShaderValue> callArgs = Collections.emptyList();
    private @Nullable ShaderValue returnValue;
    private boolean killed;
    private boolean demoted;

    public EvalContext(DebugSession session,
                       LaneState lane,
                       StackFrame frame,
                       ExecutionPoint point,
                       Insn insn,
                       List<BasicBlock> targets,
                       int resultCount) {
        this.session = session;
        this.lane = lane;
        this.frame = frame;
        this.point = point;
        this.insn = insn;
        this.targets = targets;
        this.results = new ShaderValue[resultCount];
    }

    public DebugSession session() {
        return session;
    }

    public DebugApi api() {
        return session.getApi();
    }

    public GlobalState global() {
        return session.getGlobal();
    }

    public LaneState lane() {
        return lane;
    }

    public StackFrame frame() {
        return frame;
    }

    public ExecutionPoint point() {
        return point;
    }

    public Insn insn() {
        return insn;
    }

    /**
     * @return The targets of the control being executed, empty for effects.
     */
    public List<BasicBlock> targets() {
        return targets;
    }

    public int arity() {
        return insn.arity();
    }

    public ShaderValue arg(int i) {
        return frame.read(insn.arg(i));
    }

    public List<ShaderValue> args() {
        List<ShaderValue> values = new ArrayList<>(insn.arity());
        for (Var var : insn.args()) {
            values.add(frame.read(var));
        }
        return values;
    }

    public int resultCount() {
        return results.length;
    }

    public void setResult(ShaderValue value) {
        setResult(0, value);
    }

    /**
     * Set a result. Results past the number of variables assigned are dropped.
     *
     * @param i     The result index.
     * @param value The value.
     */
    public void setResult(int i, ShaderValue value) {
        if (i < results.length) results[i] = value;
    }

    public @Nullable ShaderValue getResult(int i) {
        return results[i];
    }

    public void setOutput(int slot, ShaderValue value) {
        outputs.put(slot, value);
    }

    public Map<Integer, ShaderValue> getOutputs() {
        return outputs;
    }

    public void call(Function function, List<ShaderValue> args) {
        call = function;
        callArgs = args;
    }

    public @Nullable Function getCall() {
        return call;
    }

    public List<ShaderValue> getCallArgs() {
        return callArgs;
    }

    public void setReturnValue(@Nullable ShaderValue value) {
        returnValue = value;
    }

    public @Nullable ShaderValue getReturnValue() {
        return returnValue;
    }

    public void kill() {
        killed = true;
    }

    public boolean isKilled() {
        return killed;
    }

    public void demote() {
        demoted = true;
    }

    public boolean isDemoted() {
        return demoted;
    }

    public void warn(DebugMessage.Category category, String text) {
        session.report(DebugMessage.Severity.MEDIUM, category, lane.getIndex(), text);
    }

    /**
     * Call into the debug API, turning {@link UnsupportedOperationException} into a session failure.
     *
     * @param call The call.
     * @param <T>  The result type.
     * @return What the call returned.
     */
    public <T> T callApi(Supplier<T> call) {
        try {
            return call.get();
        } catch (UnsupportedOperationException e) {
            throw new UnsupportedInstructionException(insn, point, e);
        }
    }

    /**
     * Read a variable as another lane sees it, in the same invocation depth of the same function.
     *
     * @param other The other lane.
     * @param var   The variable.
     * @return Its value, or null if the other lane is elsewhere or hasn't assigned it.
     */
    public @Nullable ShaderValue valueIn(LaneState other, Var var) {
        if (other == lane) return frame.peek(var);
        StackFrame otherFrame = other.frameAt(point.depth);
        if (otherFrame == null || otherFrame.function != frame.function) return null;
        return otherFrame.peek(var);
    }

    /**
     * @return The non-helper lanes of this step that started it at the same point as this one, in lane order.
     */
    public List<LaneState> waveParticipants() {
        List<LaneState> participants = new ArrayList<>();
        for (LaneState other : session.getLanes()) {
            if (other.isHelper()) continue;
            if (point.equals(session.getStepStart(other.getIndex()))) {
                participants.add(other);
            }
        }
        return participants;
    }
}
