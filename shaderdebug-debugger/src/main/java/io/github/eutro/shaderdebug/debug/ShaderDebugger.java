package io.github.eutro.shaderdebug.debug;

import io.github.eutro.shaderdebug.controlflow.ConvergenceAnalysis;
import io.github.eutro.shaderdebug.debug.api.DebugApi;
import io.github.eutro.shaderdebug.debug.eval.ControlEvaluator;
import io.github.eutro.shaderdebug.debug.eval.EffectEvaluator;
import io.github.eutro.shaderdebug.debug.eval.EvalContext;
import io.github.eutro.shaderdebug.debug.eval.Evaluators;
import io.github.eutro.shaderdebug.ext.CommonExts;
import io.github.eutro.shaderdebug.ext.MetadataState;
import io.github.eutro.shaderdebug.ops.ShaderOps;
import io.github.eutro.shaderdebug.passes.IRPass;
import io.github.eutro.shaderdebug.passes.InPlaceIRPass;
import io.github.eutro.shaderdebug.passes.meta.CheckPhis;
import io.github.eutro.shaderdebug.ssa.BasicBlock;
import io.github.eutro.shaderdebug.ssa.Control;
import io.github.eutro.shaderdebug.ssa.Effect;
import io.github.eutro.shaderdebug.ssa.Function;
import io.github.eutro.shaderdebug.ssa.Insn;
import io.github.eutro.shaderdebug.ssa.ShaderProgram;
import io.github.eutro.shaderdebug.ssa.ShaderValue;
import io.github.eutro.shaderdebug.ssa.Var;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Simulates a group of lanes running a shader program, one instruction per lane per step.
 * <p>
 * Lanes that split at a branch are held at the branch's convergent block until the others catch up,
 * so they go on together as they would on a GPU. Lanes that reach a barrier are held there until every
 * running lane has reached one.
 */
public class ShaderDebugger {
    private static final Logger LOGGER = LoggerFactory.getLogger(ShaderDebugger.class);

    static {
        Evaluators.bootstrap();
    }

    /**
     * Validates a function and computes what the debugger needs of it.
     */
    public static final IRPass<Function, Function> PREPARE = CheckPhis.INSTANCE
            .then((InPlaceIRPass<Function>) func -> func.getExtOrThrow(CommonExts.METADATA_STATE)
                    .ensureValid(func, MetadataState.CONVERGENCE))
            .then(FunctionLayout.COMPUTE);

    private final DebugApi api;
    private final DebuggerConfig config;

    public ShaderDebugger(DebugApi api) {
        this(api, DebuggerConfig.DEFAULT);
    }

    public ShaderDebugger(DebugApi api, DebuggerConfig config) {
        this.api = api;
        this.config = config;
    }

    public DebuggerConfig getConfig() {
        return config;
    }

    public DebugSession beginDebug(ShaderProgram program, int activeLane, List<LaneSetup> lanes) {
        return beginDebug(program, activeLane, lanes, Collections.emptyMap());
    }

    /**
     * Start debugging a program. Nothing is executed until {@link #continueDebug}.
     *
     * @param program         The program; its entry point takes no arguments.
     * @param activeLane      The lane being debugged.
     * @param lanes           The initial state of each lane.
     * @param constantBuffers The contents of each constant buffer, as vectors.
     * @return The session.
     * @throws IllegalArgumentException if there are no lanes, or {@code activeLane} isn't one of them.
     * @throws IllegalStateException    if the program is malformed.
     */
    public DebugSession beginDebug(ShaderProgram program,
                                   int activeLane,
                                   List<LaneSetup> lanes,
                                   Map<Integer, List<ShaderValue>> constantBuffers) {
        if (lanes.isEmpty()) throw new IllegalArgumentException("No lanes to debug");
        if (activeLane < 0 || activeLane >= lanes.size()) {
            throw new IllegalArgumentException("Active lane " + activeLane + " is not one of " + lanes.size() + " lanes");
        }
        for (Function func : program.getFunctions()) {
            PREPARE.run(func);
        }
        Function entry = program.getEntryPoint();
        List<LaneState> states = new ArrayList<>(lanes.size());
        for (int i = 0; i < lanes.size(); i++) {
            states.add(new LaneState(i, lanes.get(i), entry));
        }
        LOGGER.info("Debugging {} ({}) with {} lanes, active lane {}",
                program.name, program.stage, lanes.size(), activeLane);
        GlobalState global = new GlobalState(constantBuffers, program.getGroupsharedSize());
        return new DebugSession(program, api, activeLane, states, global);
    }

    public List<StepResult> continueDebug(DebugSession session) {
        return continueDebug(session, Integer.MAX_VALUE);
    }

    /**
     * Run a session until it finishes, or for at most {@code maxSteps} steps.
     *
     * @param session  The session.
     * @param maxSteps The most steps to take in this call.
     * @return The steps taken, in order. Empty if the session has already finished.
     * @throws IllegalStateException       if the session failed or was aborted earlier.
     * @throws StepLimitExceededException  if the session runs past {@link DebuggerConfig#maxSteps}.
     * @throws ShaderDebugException        if a lane hits an unsupported instruction, or executing a step fails.
     *                                     The session is left {@link DebugSession.Status#FAILED}.
     */
    public List<StepResult> continueDebug(DebugSession session, int maxSteps) {
        if (session.getApi() != api) {
            throw new IllegalArgumentException("Session belongs to another debugger");
        }
        switch (session.getStatus()) {
            case FINISHED:
                return Collections.emptyList();
            case FAILED:
            case ABORTED:
                throw new IllegalStateException("Session is " + session.getStatus() + ", it cannot be continued",
                        session.getFailure());
            default:
                break;
        }

        List<StepResult> results = new ArrayList<>();
        try {
            while (results.size() < maxSteps && !session.isFinished()) {
                if (session.getStepCount() >= config.maxSteps) {
                    throw new StepLimitExceededException(config.maxSteps);
                }
                results.add(step(session));
            }
        } catch (StepLimitExceededException e) {
            LOGGER.error("Debugging {} aborted after {} steps", session.getProgram().name, session.getStepCount());
            session.fail(DebugSession.Status.ABORTED, e);
            throw e;
        } catch (ShaderDebugException e) {
            LOGGER.error("Debugging {} failed", session.getProgram().name, e);
            session.fail(DebugSession.Status.FAILED, e);
            throw e;
        } catch (RuntimeException e) {
            ExecutionErrorException wrapped = new ExecutionErrorException(session.getStepCount(), e);
            LOGGER.error("Debugging {} failed", session.getProgram().name, wrapped);
            session.fail(DebugSession.Status.FAILED, wrapped);
            throw wrapped;
        }
        if (session.isFinished()) {
            session.setFinished();
            LOGGER.debug("Debugging {} finished after {} steps", session.getProgram().name, session.getStepCount());
        }
        return results;
    }

    private StepResult step(DebugSession session) {
        BitSet mask = activeMask(session);
        session.beginStep(mask);

        List<LaneStep> steps = new ArrayList<>(mask.cardinality());
        // start point -> target block -> lanes
        Map<ExecutionPoint, Map<Integer, BitSet>> branches = new LinkedHashMap<>();
        for (int i = mask.nextSetBit(0); i >= 0; i = mask.nextSetBit(i + 1)) {
            LaneState lane = session.getLane(i);
            LaneStep laneStep;
            try {
                laneStep = stepLane(session, lane, branches);
            } catch (ShaderDebugException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new ExecutionErrorException(i, lane.point(), e);
            }
            if (config.traceSteps) LOGGER.trace("{}", laneStep);
            steps.add(laneStep);
        }
        recordDivergence(session, branches);
        return new StepResult(session.finishStep(), steps);
    }

    /**
     * Lanes run unless they have finished, or are waiting for others to arrive at a merge point or a barrier.
     */
    private BitSet activeMask(DebugSession session) {
        releaseMergePoints(session);

        boolean allAtBarrier = true;
        for (LaneState lane : session.getLanes()) {
            if (lane.isRunnable() && !isAtBarrier(lane)) {
                allAtBarrier = false;
                break;
            }
        }

        BitSet mask = new BitSet();
        BitSet runnable = new BitSet();
        for (LaneState lane : session.getLanes()) {
            if (!lane.isRunnable()) continue;
            runnable.set(lane.getIndex());
            if (isWaiting(session, lane)) continue;
            if (!allAtBarrier && isAtBarrier(lane)) continue;
            mask.set(lane.getIndex());
        }
        if (mask.isEmpty() && !runnable.isEmpty()) {
            LOGGER.error("No lanes can run at step {}, waiting at {} or a barrier in divergent code;"
                    + " forcing all lanes to run", session.getStepCount(), session.mergePoints);
            session.mergePoints.clear();
            return runnable;
        }
        return mask;
    }

    private static void releaseMergePoints(DebugSession session) {
        Iterator<MergePoint> it = session.mergePoints.iterator();
        while (it.hasNext()) {
            MergePoint mp = it.next();
            boolean arrived = true;
            for (LaneState lane : session.getLanes()) {
                if (!mp.hasParticipant(lane.getIndex())
                        || !lane.isRunnable()
                        || lane.getDepth() < mp.depth) {
                    continue;
                }
                if (!mp.isAt(lane)) {
                    arrived = false;
                    break;
                }
            }
            if (arrived) it.remove();
        }
    }

    private static boolean isAtBarrier(LaneState lane) {
        StackFrame frame = lane.currentFrame();
        Effect effect = frame == null ? null : frame.currentEffect();
        return effect != null && effect.insn().op.key == ShaderOps.BARRIER.key;
    }

    private static boolean isWaiting(DebugSession session, LaneState lane) {
        for (MergePoint mp : session.mergePoints) {
            if (mp.hasParticipant(lane.getIndex()) && mp.isAt(lane)) return true;
        }
        return false;
    }

    private static void recordDivergence(DebugSession session, Map<ExecutionPoint, Map<Integer, BitSet>> branches) {
        for (Map.Entry<ExecutionPoint, Map<Integer, BitSet>> entry : branches.entrySet()) {
            if (entry.getValue().size() < 2) continue;
            ExecutionPoint at = entry.getKey();
            ConvergenceAnalysis analysis = at.function.getExtOrThrow(CommonExts.CONVERGENCE);
            Integer convergent = analysis.getConvergentBlock(at.block);
            if (convergent == null) {
                LOGGER.debug("Lanes diverged at {} with no convergent block", at);
                continue;
            }
            BitSet lanes = new BitSet();
            for (BitSet group : entry.getValue().values()) lanes.or(group);
            boolean covered = false;
            for (MergePoint mp : session.mergePoints) {
                if (mp.covers(at.function, at.depth, convergent, lanes)) {
                    covered = true;
                    break;
                }
            }
            if (!covered) {
                MergePoint mp = new MergePoint(at.function, at.depth, convergent, lanes);
                LOGGER.debug("Lanes {} diverged at {}, merging at block {}", lanes, at, convergent);
                session.mergePoints.add(mp);
            }
        }
    }

    private LaneStep stepLane(DebugSession session, LaneState lane, Map<ExecutionPoint, Map<Integer, BitSet>> branches) {
        StackFrame frame = lane.currentFrame();
        if (frame == null) throw new IllegalStateException("Stepping finished " + lane);
        ExecutionPoint at = frame.point(lane.getDepth());
        BasicBlock block = frame.getBlock();
        List<RegisterChange> changes = new ArrayList<>();
        String text;

        Effect effect = frame.currentEffect();
        if (effect != null) {
            text = effect.toString();
            Insn insn = effect.insn();
            EffectEvaluator evaluator = Evaluators.effectEvaluator(insn);
            if (evaluator == null) throw new UnsupportedInstructionException(insn, at);
            List<Var> assigns = effect.getAssignsTo();
            EvalContext ctx = new EvalContext(session, lane, frame, at, insn, Collections.emptyList(), assigns.size());
            evaluator.evaluate(ctx);

            if (!lane.isHelper()) {
                for (Map.Entry<Integer, ShaderValue> output : ctx.getOutputs().entrySet()) {
                    lane.setOutput(output.getKey(), output.getValue());
                }
            }
            if (ctx.isDemoted()) lane.demote();
            Function callee = ctx.getCall();
            if (callee != null) {
                lane.push(new StackFrame(callee, ctx.getCallArgs()));
            } else {
                for (int i = 0; i < assigns.size(); i++) {
                    ShaderValue value = ctx.getResult(i);
                    if (value == null) {
                        throw new IllegalStateException(insn + " produced no value for " + assigns.get(i));
                    }
                    changes.add(new RegisterChange(assigns.get(i), frame.write(assigns.get(i), value), value));
                }
                frame.advance();
            }
        } else {
            Control control = block.getControl();
            text = control.toString();
            Insn insn = control.insn();
            ControlEvaluator evaluator = Evaluators.controlEvaluator(insn);
            if (evaluator == null) throw new UnsupportedInstructionException(insn, at);
            EvalContext ctx = new EvalContext(session, lane, frame, at, insn, control.targets, 0);
            BasicBlock next = evaluator.evaluate(ctx);

            if (ctx.isKilled()) {
                lane.kill();
            } else if (next == null) {
                returnFrom(lane, ctx.getReturnValue(), changes);
            } else {
                if (control.targets.size() > 1) {
                    branches.computeIfAbsent(at, k -> new TreeMap<>())
                            .computeIfAbsent(frame.layout.blockId(next), k -> new BitSet())
                            .set(lane.getIndex());
                }
                frame.jump(next);
            }
        }
        return new LaneStep(lane.getIndex(), at, text, lane.point(), lane.isHelper(), changes);
    }

    private static void returnFrom(LaneState lane, @Nullable ShaderValue value, List<RegisterChange> changes) {
        lane.pop();
        StackFrame caller = lane.currentFrame();
        if (caller == null) {
            lane.finish(value);
            return;
        }
        Effect call = caller.currentEffect();
        if (call == null) throw new IllegalStateException("Returned to a frame that isn't calling");
        List<Var> assigns = call.getAssignsTo();
        if (!assigns.isEmpty()) {
            if (value == null) {
                throw new IllegalStateException(call + " expects a value, but the callee returned none");
            }
            Var var = assigns.get(0);
            changes.add(new RegisterChange(var, caller.write(var, value), value));
        }
        caller.advance();
    }
}
