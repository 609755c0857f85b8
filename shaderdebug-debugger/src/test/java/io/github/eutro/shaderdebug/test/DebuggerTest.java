package io.github.eutro.shaderdebug.test;

import io.github.eutro.shaderdebug.debug.*;
import io.github.eutro.shaderdebug.debug.api.SoftwareDebugApi;
import io.github.eutro.shaderdebug.ops.CommonOps;
import io.github.eutro.shaderdebug.ops.GroupsharedAccess;
import io.github.eutro.shaderdebug.ops.MathOp;
import io.github.eutro.shaderdebug.ops.ShaderOps;
import io.github.eutro.shaderdebug.ops.SimpleOpKey;
import io.github.eutro.shaderdebug.ssa.*;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static io.github.eutro.shaderdebug.test.Shaders.*;
import static org.junit.jupiter.api.Assertions.*;

public class DebuggerTest {
    // y = x > 0 ? x * x : -x + -x
    static ShaderProgram branchy() {
        ShaderProgram program = new ShaderProgram("branchy", ShaderStage.PIXEL);
        Function main = program.newFunction("main", 0);
        BasicBlock entry = main.newBb();
        BasicBlock then = main.newBb();
        BasicBlock otherwise = main.newBb();
        BasicBlock join = main.newBb();

        IRBuilder ib = new IRBuilder(main, entry);
        Var x = input(ib, 0, "x");
        Var zero = ib.constant(ShaderValue.floats(0), "zero");
        Var cond = ib.insert(ShaderOps.FLT.insn(zero, x), "cond");
        ib.insertCtrl(CommonOps.BR_IF.insn(cond).jumpsTo(then, otherwise));

        ib.setBlock(then);
        Var square = ib.insert(ShaderOps.FMUL.insn(x, x), "square");
        ib.insertCtrl(Control.br(join));

        ib.setBlock(otherwise);
        Var neg = ib.insert(ShaderOps.FNEG.insn(x), "neg");
        Var doubled = ib.insert(ShaderOps.FADD.insn(neg, neg), "doubled");
        ib.insertCtrl(Control.br(join));

        ib.setBlock(join);
        Var y = ib.insert(CommonOps.PHI.create(Arrays.asList(then, otherwise)).insn(square, doubled), "y");
        output(ib, 0, y);
        ret(ib);
        return program;
    }

    static List<LaneSetup> branchyLanes() {
        return lanes(
                ShaderValue.floats(1),
                ShaderValue.floats(2),
                ShaderValue.floats(-1),
                ShaderValue.floats(3));
    }

    @Test
    void testLanesReconvergeAtConvergentBlock() {
        ShaderDebugger debugger = new ShaderDebugger(new SoftwareDebugApi());
        DebugSession session = debugger.beginDebug(branchy(), 0, branchyLanes());
        List<StepResult> steps = new ArrayList<>(debugger.continueDebug(session, 4));

        // the branch splits lane 2 from the others
        StepResult branch = steps.get(3);
        assertEquals(4, branch.getLanes().size());
        assertEquals(1, branch.forLane(0).getNext().block);
        assertEquals(2, branch.forLane(2).getNext().block);
        assertEquals(1, session.getMergePoints().size());
        assertEquals(3, session.getMergePoints().get(0).block);

        steps.addAll(debugger.continueDebug(session));
        assertEquals(DebugSession.Status.FINISHED, session.getStatus());
        assertEquals(10, steps.size());
        assertTrue(session.getMergePoints().isEmpty());

        // lanes 0, 1 and 3 arrive first and wait for lane 2
        StepResult catchUp = steps.get(6);
        assertEquals(1, catchUp.getLanes().size());
        assertEquals(2, catchUp.getLanes().get(0).getLane());

        // then they all run the join together
        StepResult joined = steps.get(7);
        assertEquals(4, joined.getLanes().size());
        ExecutionPoint at = joined.getLanes().get(0).getExecuted();
        assertEquals(3, at.block);
        for (LaneStep step : joined.getLanes()) {
            assertEquals(at, step.getExecuted());
        }

        assertEquals(ShaderValue.floats(1), output(session, 0, 0));
        assertEquals(ShaderValue.floats(4), output(session, 1, 0));
        assertEquals(ShaderValue.floats(2), output(session, 2, 0));
        assertEquals(ShaderValue.floats(9), output(session, 3, 0));
    }

    // out = 0; do { out += 1 } while (out < n)
    static ShaderProgram counting() {
        ShaderProgram program = new ShaderProgram("counting", ShaderStage.COMPUTE);
        Function main = program.newFunction("main", 0);
        BasicBlock entry = main.newBb();
        BasicBlock loop = main.newBb();
        BasicBlock exit = main.newBb();

        IRBuilder ib = new IRBuilder(main, entry);
        Var n = input(ib, 0, "n");
        Var zero = ib.constant(ShaderValue.uints(0), "zero");
        Var one = ib.constant(ShaderValue.uints(1), "one");
        ib.insertCtrl(Control.br(loop));

        ib.setBlock(loop);
        Var next = main.newVar("next");
        Var count = ib.insert(CommonOps.PHI.create(Arrays.asList(entry, loop)).insn(zero, next), "count");
        ib.insert(ShaderOps.IADD.insn(count, one).assignTo(next));
        Var again = ib.insert(ShaderOps.ULT.insn(next, n), "again");
        ib.insertCtrl(CommonOps.BR_IF.insn(again).jumpsTo(loop, exit));

        ib.setBlock(exit);
        output(ib, 0, next);
        ret(ib);
        return program;
    }

    @Test
    void testLanesWaitAtLoopExit() {
        ShaderDebugger debugger = new ShaderDebugger(new SoftwareDebugApi());
        DebugSession session = debugger.beginDebug(counting(), 0, lanes(
                ShaderValue.uints(1),
                ShaderValue.uints(2),
                ShaderValue.uints(3),
                ShaderValue.uints(4)));
        List<StepResult> steps = new ArrayList<>(debugger.continueDebug(session, 8));

        // lane 0 leaves after one iteration, and waits at the exit for the others
        assertEquals(2, steps.get(7).forLane(0).getNext().block);
        assertEquals(1, steps.get(7).forLane(1).getNext().block);
        assertEquals(1, session.getMergePoints().size());
        MergePoint exit = session.getMergePoints().get(0);
        assertEquals(2, exit.block);
        assertEquals(4, exit.getParticipants().cardinality());

        steps.addAll(debugger.continueDebug(session));
        assertEquals(DebugSession.Status.FINISHED, session.getStatus());
        assertEquals(22, steps.size());
        assertEquals(3, steps.get(8).getLanes().size());
        assertNull(steps.get(8).forLane(0));
        assertEquals(2, steps.get(12).getLanes().size());
        for (int step = 16; step < 20; step++) {
            assertEquals(1, steps.get(step).getLanes().size());
            assertEquals(3, steps.get(step).getLanes().get(0).getLane());
        }
        assertEquals(4, steps.get(20).getLanes().size());
        for (int lane = 0; lane < 4; lane++) {
            assertEquals(ShaderValue.uints(lane + 1), output(session, lane, 0));
        }
    }

    @Test
    void testLoopCarriedPhisSwap() {
        ShaderProgram program = new ShaderProgram("swapping", ShaderStage.COMPUTE);
        Function main = program.newFunction("main", 0);
        BasicBlock entry = main.newBb();
        BasicBlock loop = main.newBb();
        BasicBlock exit = main.newBb();

        IRBuilder ib = new IRBuilder(main, entry);
        Var one = ib.constant(ShaderValue.floats(1), "one");
        Var two = ib.constant(ShaderValue.floats(2), "two");
        Var zero = ib.constant(ShaderValue.uints(0), "zero");
        Var step = ib.constant(ShaderValue.uints(1), "step");
        Var limit = ib.constant(ShaderValue.uints(2), "limit");
        ib.insertCtrl(Control.br(loop));

        ib.setBlock(loop);
        List<BasicBlock> preds = Arrays.asList(entry, loop);
        Var a = main.newVar("a");
        Var b = main.newVar("b");
        Var next = main.newVar("next");
        ib.insert(CommonOps.PHI.create(preds).insn(one, b).assignTo(a));
        ib.insert(CommonOps.PHI.create(preds).insn(two, a).assignTo(b));
        Var i = ib.insert(CommonOps.PHI.create(preds).insn(zero, next), "i");
        ib.insert(ShaderOps.IADD.insn(i, step).assignTo(next));
        Var again = ib.insert(ShaderOps.ULT.insn(next, limit), "again");
        ib.insertCtrl(CommonOps.BR_IF.insn(again).jumpsTo(loop, exit));

        ib.setBlock(exit);
        output(ib, 0, a);
        output(ib, 1, b);
        ret(ib);

        ShaderDebugger debugger = new ShaderDebugger(new SoftwareDebugApi());
        DebugSession session = debugger.beginDebug(program, 0, lanes(ShaderValue.floats(0)));
        debugger.continueDebug(session);
        assertEquals(DebugSession.Status.FINISHED, session.getStatus());
        assertEquals(ShaderValue.floats(2), output(session, 0, 0));
        assertEquals(ShaderValue.floats(1), output(session, 0, 1));
    }

    @Test
    void testBarrierHoldsLanesUntilAllArrive() {
        ShaderProgram program = new ShaderProgram("exchange", ShaderStage.COMPUTE);
        program.setGroupsharedSize(8);
        Function main = program.newFunction("main", 0);
        BasicBlock entry = main.newBb();
        BasicBlock left = main.newBb();
        BasicBlock right = main.newBb();
        GroupsharedAccess access = new GroupsharedAccess(VarType.UINT, 1);

        IRBuilder ib = new IRBuilder(main, entry);
        Var x = input(ib, 0, "x");
        Var zero = ib.constant(ShaderValue.floats(0), "zero");
        Var cond = ib.insert(ShaderOps.FLT.insn(zero, x), "cond");
        ib.insertCtrl(CommonOps.BR_IF.insn(cond).jumpsTo(left, right));

        // left writes slot 0 and reads slot 1; right takes one step longer to write slot 1
        ib.setBlock(left);
        Var one = ib.constant(ShaderValue.uints(1), "one");
        Var slot0 = ib.constant(ShaderValue.uints(0), "slot0");
        ib.insert(ShaderOps.GROUPSHARED_STORE.create(access).insn(slot0, one).assignTo());
        ib.insert(ShaderOps.BARRIER.insn().assignTo());
        Var slot1 = ib.constant(ShaderValue.uints(4), "slot1");
        output(ib, 0, ib.insert(ShaderOps.GROUPSHARED_LOAD.create(access).insn(slot1), "theirs"));
        ret(ib);

        ib.setBlock(right);
        Var two = ib.constant(ShaderValue.uints(2), "two");
        Var four = ib.constant(ShaderValue.uints(4), "four");
        Var mine = ib.insert(ShaderOps.IADD.insn(four, ib.constant(ShaderValue.uints(0), "nothing")), "mine");
        ib.insert(ShaderOps.GROUPSHARED_STORE.create(access).insn(mine, two).assignTo());
        ib.insert(ShaderOps.BARRIER.insn().assignTo());
        Var other = ib.constant(ShaderValue.uints(0), "other");
        output(ib, 0, ib.insert(ShaderOps.GROUPSHARED_LOAD.create(access).insn(other), "theirs"));
        ret(ib);

        ShaderDebugger debugger = new ShaderDebugger(new SoftwareDebugApi());
        DebugSession session = debugger.beginDebug(program, 0, lanes(ShaderValue.floats(1), ShaderValue.floats(-1)));
        List<StepResult> steps = debugger.continueDebug(session);
        assertEquals(DebugSession.Status.FINISHED, session.getStatus());

        // lane 0 reaches its barrier first and waits for lane 1's store
        StepResult waiting = steps.get(8);
        assertEquals(1, waiting.getLanes().size());
        assertEquals(1, waiting.getLanes().get(0).getLane());
        StepResult barrier = steps.get(9);
        assertEquals(2, barrier.getLanes().size());
        for (LaneStep step : barrier.getLanes()) {
            assertTrue(step.getInstruction().contains("barrier"));
        }

        assertEquals(ShaderValue.uints(2), output(session, 0, 0));
        assertEquals(ShaderValue.uints(1), output(session, 1, 0));
    }

    @Test
    void testStepsRecordRegisterChanges() {
        ShaderDebugger debugger = new ShaderDebugger(new SoftwareDebugApi());
        DebugSession session = debugger.beginDebug(branchy(), 2, branchyLanes());
        List<StepResult> steps = debugger.continueDebug(session);

        LaneStep input = steps.get(0).forLane(2);
        assertEquals(1, input.getChanges().size());
        RegisterChange change = input.getChanges().get(0);
        assertEquals("x", change.var.name);
        assertNull(change.before);
        assertEquals(ShaderValue.floats(-1), change.after);
        assertEquals(0, input.getExecuted().instruction);
        assertEquals(1, input.getNext().instruction);
        assertTrue(input.getInstruction().contains("input"));
        assertTrue(steps.get(9).forLane(2).getChanges().isEmpty());
        assertNull(steps.get(9).forLane(2).getNext());
    }

    @Test
    void testContinueInBatches() {
        ShaderDebugger debugger = new ShaderDebugger(new SoftwareDebugApi());
        DebugSession session = debugger.beginDebug(branchy(), 0, branchyLanes());

        List<StepResult> first = debugger.continueDebug(session, 4);
        assertEquals(4, first.size());
        assertEquals(DebugSession.Status.RUNNING, session.getStatus());
        assertEquals(4, session.getStepCount());

        List<StepResult> rest = debugger.continueDebug(session);
        assertEquals(6, rest.size());
        assertEquals(4, rest.get(0).getStepIndex());
        assertEquals(DebugSession.Status.FINISHED, session.getStatus());
        assertTrue(debugger.continueDebug(session).isEmpty());
    }

    @Test
    void testInactiveLanesNeverRun() {
        ShaderDebugger debugger = new ShaderDebugger(new SoftwareDebugApi());
        List<LaneSetup> lanes = branchyLanes();
        lanes.set(2, lanes.get(2).inactive());
        DebugSession session = debugger.beginDebug(branchy(), 0, lanes);
        List<StepResult> steps = debugger.continueDebug(session);

        assertEquals(9, steps.size());
        for (StepResult step : steps) {
            assertNull(step.forLane(2));
        }
        assertFalse(session.getLane(2).isFinished());
        assertTrue(session.getLane(2).getOutputs().isEmpty());
    }

    @Test
    void testBadArguments() {
        ShaderDebugger debugger = new ShaderDebugger(new SoftwareDebugApi());
        assertThrows(IllegalArgumentException.class,
                () -> debugger.beginDebug(branchy(), 0, Collections.emptyList()));
        assertThrows(IllegalArgumentException.class,
                () -> debugger.beginDebug(branchy(), 4, branchyLanes()));
        DebugSession session = debugger.beginDebug(branchy(), 0, branchyLanes());
        assertThrows(IllegalArgumentException.class,
                () -> new ShaderDebugger(new SoftwareDebugApi()).continueDebug(session));
    }

    static ShaderProgram spinning() {
        ShaderProgram program = new ShaderProgram("spinning", ShaderStage.COMPUTE);
        Function main = program.newFunction("main", 0);
        BasicBlock entry = main.newBb();
        BasicBlock loop = main.newBb();
        BasicBlock exit = main.newBb();

        IRBuilder ib = new IRBuilder(main, entry);
        Var forever = ib.constant(ShaderValue.bools(true), "forever");
        ib.insertCtrl(Control.br(loop));
        ib.setBlock(loop);
        ib.insertCtrl(CommonOps.BR_IF.insn(forever).jumpsTo(loop, exit));
        ib.setBlock(exit);
        ret(ib);
        return program;
    }

    @Test
    void testStepLimitAbortsSession() {
        ShaderDebugger debugger = new ShaderDebugger(new SoftwareDebugApi(), DebuggerConfig.DEFAULT.withMaxSteps(50));
        DebugSession session = debugger.beginDebug(spinning(), 0, lanes(ShaderValue.floats(0)));

        StepLimitExceededException e = assertThrows(StepLimitExceededException.class,
                () -> debugger.continueDebug(session));
        assertEquals(ShaderDebugException.Kind.STEP_LIMIT_EXCEEDED, e.getKind());
        assertEquals(DebugSession.Status.ABORTED, session.getStatus());
        assertSame(e, session.getFailure());
        assertEquals(50, session.getStepCount());
        assertThrows(IllegalStateException.class, () -> debugger.continueDebug(session));
    }

    @Test
    void testConfigRejectsNonPositiveLimit() {
        assertThrows(IllegalArgumentException.class, () -> DebuggerConfig.DEFAULT.withMaxSteps(0));
        DebuggerConfig config = DebuggerConfig.DEFAULT.withMaxSteps(7).withTraceSteps(true);
        assertEquals(7, config.maxSteps);
        assertTrue(config.traceSteps);
        assertEquals(DebuggerConfig.DEFAULT_MAX_STEPS, DebuggerConfig.DEFAULT.maxSteps);
    }

    @Test
    void testUnexpectedErrorFailsSession() {
        ShaderProgram program = new ShaderProgram("swizzling", ShaderStage.COMPUTE);
        Function main = program.newFunction("main", 0);
        IRBuilder ib = new IRBuilder(main, main.newBb());
        Var v = input(ib, 0, "v");
        output(ib, 0, ib.insert(ShaderOps.SWIZZLE.create(new int[]{1}).insn(v), "y"));
        ret(ib);

        ShaderDebugger debugger = new ShaderDebugger(new SoftwareDebugApi());
        DebugSession session = debugger.beginDebug(program, 0,
                lanes(ShaderValue.floats(1, 2), ShaderValue.floats(1)));
        ShaderDebugException e = assertThrows(ShaderDebugException.class, () -> debugger.continueDebug(session));
        assertEquals(ShaderDebugException.Kind.EXECUTION_ERROR, e.getKind());
        assertInstanceOf(IllegalStateException.class, e.getCause());
        assertTrue(e.getMessage().startsWith("Lane 1"));
        assertEquals(DebugSession.Status.FAILED, session.getStatus());
        assertSame(e, session.getFailure());
        assertThrows(IllegalStateException.class, () -> debugger.continueDebug(session));
    }

    @Test
    void testBadStepLimitSettingsAreIgnored() {
        assertEquals(250, DebuggerConfig.parsePositive("SHADERDEBUG_MAX_STEPS", " 250 ", 100));
        assertEquals(100, DebuggerConfig.parsePositive("SHADERDEBUG_MAX_STEPS", "0", 100));
        assertEquals(100, DebuggerConfig.parsePositive("SHADERDEBUG_MAX_STEPS", "-5", 100));
        assertEquals(100, DebuggerConfig.parsePositive("SHADERDEBUG_MAX_STEPS", "lots", 100));
        assertTrue(DebuggerConfig.DEFAULT_MAX_STEPS > 0);
    }

    @Test
    void testUnsupportedInstructionFailsSession() {
        ShaderProgram program = new ShaderProgram("mystery", ShaderStage.COMPUTE);
        Function main = program.newFunction("main", 0);
        IRBuilder ib = new IRBuilder(main, main.newBb());
        Var one = ib.constant(ShaderValue.floats(1), "one");
        ib.insert(new SimpleOpKey("mystery").create().insn(one), "what");
        ret(ib);

        ShaderDebugger debugger = new ShaderDebugger(new SoftwareDebugApi());
        DebugSession session = debugger.beginDebug(program, 0, lanes(ShaderValue.floats(0)));
        UnsupportedInstructionException e = assertThrows(UnsupportedInstructionException.class,
                () -> debugger.continueDebug(session));
        assertEquals(ShaderDebugException.Kind.UNSUPPORTED_INSTRUCTION, e.getKind());
        assertTrue(e.getMessage().contains("mystery"));
        assertEquals(DebugSession.Status.FAILED, session.getStatus());
        assertThrows(IllegalStateException.class, () -> debugger.continueDebug(session));
    }

    @Test
    void testRefusedCapabilityFailsSession() {
        ShaderProgram program = new ShaderProgram("refused", ShaderStage.COMPUTE);
        Function main = program.newFunction("main", 0);
        IRBuilder ib = new IRBuilder(main, main.newBb());
        Var x = input(ib, 0, "x");
        ib.insert(ShaderOps.MATH.create(MathOp.RCP).insn(x), "rcp");
        ret(ib);

        SoftwareDebugApi api = new SoftwareDebugApi() {
            @Override
            public List<ShaderValue> calculateMathIntrinsic(MathOp op, ShaderValue operand) {
                throw new UnsupportedOperationException("no math here");
            }
        };
        ShaderDebugger debugger = new ShaderDebugger(api);
        DebugSession session = debugger.beginDebug(program, 0, lanes(ShaderValue.floats(2)));
        UnsupportedInstructionException e = assertThrows(UnsupportedInstructionException.class,
                () -> debugger.continueDebug(session));
        assertInstanceOf(UnsupportedOperationException.class, e.getCause());
        assertEquals(DebugSession.Status.FAILED, session.getStatus());
    }

    @Test
    void testCallsAndReturns() {
        ShaderProgram program = new ShaderProgram("calls", ShaderStage.COMPUTE);
        Function main = program.newFunction("main", 0);
        Function twice = program.newFunction("twice", 1);

        IRBuilder fb = new IRBuilder(twice, twice.newBb());
        Var a = fb.insert(CommonOps.ARG.create(0).insn(), "a");
        Var sum = fb.insert(ShaderOps.FADD.insn(a, a), "sum");
        fb.insertCtrl(CommonOps.RETURN.insn(sum).jumpsTo());

        IRBuilder ib = new IRBuilder(main, main.newBb());
        Var x = input(ib, 0, "x");
        Var y = ib.insert(CommonOps.CALL.create(twice).insn(x), "y");
        Var z = ib.insert(CommonOps.CALL.create(twice).insn(y), "z");
        output(ib, 0, z);
        ib.insertCtrl(CommonOps.RETURN.insn(z).jumpsTo());

        ShaderDebugger debugger = new ShaderDebugger(new SoftwareDebugApi());
        DebugSession session = debugger.beginDebug(program, 0, lanes(ShaderValue.floats(3)));
        List<StepResult> steps = debugger.continueDebug(session);

        assertEquals(ShaderValue.floats(12), output(session, 0, 0));
        assertEquals(ShaderValue.floats(12), session.getLane(0).getReturnValue());
        // input, call, arg, add, return, call, arg, add, return, output, return
        assertEquals(11, steps.size());
        LaneStep inCallee = steps.get(2).forLane(0);
        assertEquals(1, inCallee.getExecuted().depth);
        assertSame(twice, inCallee.getExecuted().function);
        LaneStep returned = steps.get(4).forLane(0);
        assertEquals("y", returned.getChanges().get(0).var.name);
        assertEquals(0, returned.getNext().depth);
    }

    @Test
    void testDiscardDropsOutputs() {
        ShaderProgram program = new ShaderProgram("discard", ShaderStage.PIXEL);
        Function main = program.newFunction("main", 0);
        BasicBlock entry = main.newBb();
        BasicBlock kill = main.newBb();
        BasicBlock live = main.newBb();

        IRBuilder ib = new IRBuilder(main, entry);
        Var mode = input(ib, 0, "mode");
        Var one = ib.constant(ShaderValue.ints(1), "one");
        output(ib, 0, one);
        Var killIt = ib.insert(ShaderOps.IEQ.insn(mode, one), "kill");
        ib.insertCtrl(CommonOps.BR_IF.insn(killIt).jumpsTo(kill, live));

        ib.setBlock(kill);
        ib.insertCtrl(CommonOps.KILL.insn().jumpsTo());

        ib.setBlock(live);
        Var two = ib.constant(ShaderValue.ints(2), "two");
        Var big = ib.insert(ShaderOps.IEQ.insn(mode, two), "big");
        Var picked = ib.insert(ShaderOps.SELECT.insn(big, two, one), "picked");
        output(ib, 1, picked);
        ret(ib);

        ShaderDebugger debugger = new ShaderDebugger(new SoftwareDebugApi());
        DebugSession session = debugger.beginDebug(program, 0,
                lanes(ShaderValue.ints(0), ShaderValue.ints(1)));
        debugger.continueDebug(session);

        LaneState kept = session.getLane(0);
        assertFalse(kept.isDead());
        assertEquals(ShaderValue.ints(1), output(session, 0, 1));

        LaneState killed = session.getLane(1);
        assertTrue(killed.isDead());
        assertTrue(killed.isFinished());
        assertTrue(killed.getOutputs().isEmpty());
    }

    @Test
    void testDemotedLaneDropsOutputs() {
        ShaderProgram program = new ShaderProgram("demote", ShaderStage.PIXEL);
        Function main = program.newFunction("main", 0);
        IRBuilder ib = new IRBuilder(main, main.newBb());
        Var x = input(ib, 0, "x");
        output(ib, 0, x);
        ib.insert(ShaderOps.DEMOTE.insn().assignTo());
        output(ib, 1, x);
        ret(ib);

        ShaderDebugger debugger = new ShaderDebugger(new SoftwareDebugApi());
        DebugSession session = debugger.beginDebug(program, 0, lanes(ShaderValue.floats(1)));
        List<StepResult> steps = debugger.continueDebug(session);

        LaneState lane = session.getLane(0);
        assertTrue(lane.isHelper());
        assertFalse(lane.isDead());
        assertTrue(lane.getOutputs().isEmpty());
        assertFalse(steps.get(1).forLane(0).isHelper());
        assertTrue(steps.get(2).forLane(0).isHelper());
    }
}
