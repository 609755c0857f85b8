package io.github.eutro.shaderdebug.test;

import io.github.eutro.shaderdebug.debug.DebugSession;
import io.github.eutro.shaderdebug.debug.LaneSetup;
import io.github.eutro.shaderdebug.debug.ShaderDebugger;
import io.github.eutro.shaderdebug.debug.api.DebugMessage;
import io.github.eutro.shaderdebug.debug.api.SoftwareDebugApi;
import io.github.eutro.shaderdebug.ops.*;
import io.github.eutro.shaderdebug.ssa.*;
import org.jetbrains.annotations.Nullable;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Consumer;

import static io.github.eutro.shaderdebug.test.Shaders.*;
import static org.junit.jupiter.api.Assertions.*;

public class EvaluatorTest {
    static DebugSession run(ShaderStage stage, List<LaneSetup> lanes, Consumer<IRBuilder> body) {
        return run(new SoftwareDebugApi(), stage, lanes, body);
    }

    static DebugSession run(SoftwareDebugApi api, ShaderStage stage, List<LaneSetup> lanes, Consumer<IRBuilder> body) {
        ShaderProgram program = new ShaderProgram("test", stage);
        Function main = program.newFunction("main", 0);
        IRBuilder ib = new IRBuilder(main, main.newBb());
        body.accept(ib);
        ret(ib);
        ShaderDebugger debugger = new ShaderDebugger(api);
        DebugSession session = debugger.beginDebug(program, 0, lanes);
        debugger.continueDebug(session);
        assertEquals(DebugSession.Status.FINISHED, session.getStatus());
        return session;
    }

    static Var k(IRBuilder ib, ShaderValue value) {
        return ib.constant(value, "k");
    }

    static Var op(IRBuilder ib, Op op, Var... args) {
        return ib.insert(op.insn(args), op.key.mnemonic);
    }

    @Test
    void testMinMaxIgnoreSingleNaN() {
        DebugSession session = run(ShaderStage.COMPUTE, lanes(ShaderValue.floats(0)), ib -> {
            Var nan = k(ib, ShaderValue.floats(Float.NaN, 2, Float.NaN));
            Var one = k(ib, ShaderValue.floats(1, Float.NaN, Float.NaN));
            output(ib, 0, op(ib, ShaderOps.FMIN, nan, one));
            output(ib, 1, op(ib, ShaderOps.FMAX, nan, one));
            output(ib, 2, op(ib, ShaderOps.FMIN, one, nan));
        });
        ShaderValue min = output(session, 0, 0);
        ShaderValue max = output(session, 0, 1);
        assertEquals(1f, min.getFloat(0));
        assertEquals(2f, min.getFloat(1));
        assertTrue(Float.isNaN(min.getFloat(2)));
        assertEquals(1f, max.getFloat(0));
        assertEquals(2f, max.getFloat(1));
        assertTrue(Float.isNaN(max.getFloat(2)));
        assertEquals(min, output(session, 0, 2));
    }

    @Test
    void testFloatArithmetic() {
        DebugSession session = run(ShaderStage.COMPUTE, lanes(ShaderValue.floats(0)), ib -> {
            Var v = k(ib, ShaderValue.floats(1.5f, -2.25f, Float.NaN, 3));
            Var s = k(ib, ShaderValue.floats(2));
            output(ib, 0, op(ib, ShaderOps.FMUL, v, s));
            output(ib, 1, op(ib, ShaderOps.FSAT, v));
            output(ib, 2, op(ib, ShaderOps.FFLOOR, v));
            output(ib, 3, op(ib, ShaderOps.FFRAC, v));
            output(ib, 4, op(ib, ShaderOps.FMAD, s, s, s));
            Var w = k(ib, ShaderValue.floats(1, 2, 3));
            output(ib, 5, op(ib, ShaderOps.FDOT, w, w));
            output(ib, 6, op(ib, ShaderOps.FLT, v, s));
        });
        assertEquals(3f, output(session, 0, 0).getFloat(0));
        assertEquals(-4.5f, output(session, 0, 0).getFloat(1));
        assertEquals(ShaderValue.floats(1, 0, 0, 1), output(session, 0, 1));
        assertEquals(-3f, output(session, 0, 2).getFloat(1));
        assertEquals(0.75f, output(session, 0, 3).getFloat(1));
        assertEquals(ShaderValue.floats(6), output(session, 0, 4));
        assertEquals(ShaderValue.floats(14), output(session, 0, 5));
        assertEquals(ShaderValue.bools(true, true, false, false), output(session, 0, 6));
    }

    @Test
    void testIntegerArithmetic() {
        DebugSession session = run(ShaderStage.COMPUTE, lanes(ShaderValue.floats(0)), ib -> {
            Var a = k(ib, ShaderValue.ints(7, -7, Integer.MAX_VALUE));
            Var zero = k(ib, ShaderValue.ints(0));
            Var two = k(ib, ShaderValue.ints(2));
            output(ib, 0, op(ib, ShaderOps.IDIV, a, two));
            output(ib, 1, op(ib, ShaderOps.IDIV, a, zero));
            output(ib, 2, op(ib, ShaderOps.IADD, a, two));
            output(ib, 3, op(ib, ShaderOps.ISHR, a, two));
            Var u = k(ib, ShaderValue.uints(-1, 5));
            output(ib, 4, op(ib, ShaderOps.UDIV, u, k(ib, ShaderValue.uints(2))));
            output(ib, 5, op(ib, ShaderOps.UREM, u, k(ib, ShaderValue.uints(0))));
            output(ib, 6, op(ib, ShaderOps.ULT, u, k(ib, ShaderValue.uints(6))));
            output(ib, 7, op(ib, ShaderOps.NOT, k(ib, ShaderValue.bools(true, false))));
        });
        assertEquals(ShaderValue.ints(3, -3, Integer.MAX_VALUE / 2), output(session, 0, 0));
        assertEquals(ShaderValue.ints(-1, -1, -1), output(session, 0, 1));
        assertEquals(ShaderValue.ints(9, -5, Integer.MIN_VALUE + 1), output(session, 0, 2));
        assertEquals(ShaderValue.ints(1, -2, Integer.MAX_VALUE >> 2), output(session, 0, 3));
        assertEquals(ShaderValue.uints(Integer.MAX_VALUE, 2), output(session, 0, 4));
        assertEquals(ShaderValue.uints(-1, -1), output(session, 0, 5));
        assertEquals(ShaderValue.bools(false, true), output(session, 0, 6));
        assertEquals(ShaderValue.bools(false, true), output(session, 0, 7));
    }

    @Test
    void testConversionsAndShuffles() {
        DebugSession session = run(ShaderStage.COMPUTE, lanes(ShaderValue.floats(0)), ib -> {
            Var f = k(ib, ShaderValue.floats(-1.5f, 3e10f, Float.NaN, 2.5f));
            output(ib, 0, op(ib, ShaderOps.FTOI, f));
            output(ib, 1, op(ib, ShaderOps.FTOU, f));
            output(ib, 2, op(ib, ShaderOps.UTOF, k(ib, ShaderValue.uints(-1))));
            output(ib, 3, ib.insert(ShaderOps.SWIZZLE.create(new int[]{3, 0}).insn(f), "zx"));
            Var one = k(ib, ShaderValue.floats(1));
            output(ib, 4, op(ib, ShaderOps.VECTOR, one, f));
            output(ib, 5, ib.insert(ShaderOps.BITCAST.create(VarType.UINT).insn(one), "bits"));
            Var cond = k(ib, ShaderValue.bools(true, false));
            output(ib, 6, op(ib, ShaderOps.SELECT, cond, one, k(ib, ShaderValue.floats(0))));
        });
        assertEquals(ShaderValue.ints(-1, Integer.MAX_VALUE, 0, 2), output(session, 0, 0));
        assertEquals(ShaderValue.uints(0, -1, 0, 2), output(session, 0, 1));
        assertEquals(ShaderValue.floats(4294967295f), output(session, 0, 2));
        assertEquals(ShaderValue.floats(2.5f, -1.5f), output(session, 0, 3));
        assertEquals(ShaderValue.floats(1, -1.5f), output(session, 0, 4));
        assertEquals(ShaderValue.uints(0x3f800000), output(session, 0, 5));
        assertEquals(ShaderValue.floats(1, 0), output(session, 0, 6));
    }

    @Test
    void testSwitch() {
        ShaderProgram program = new ShaderProgram("switch", ShaderStage.COMPUTE);
        Function main = program.newFunction("main", 0);
        BasicBlock entry = main.newBb();
        BasicBlock fallback = main.newBb();
        BasicBlock three = main.newBb();
        BasicBlock seven = main.newBb();
        BasicBlock join = main.newBb();

        IRBuilder ib = new IRBuilder(main, entry);
        Var x = input(ib, 0, "x");
        ib.insertCtrl(CommonOps.SWITCH.create(new int[]{3, 7}).insn(x).jumpsTo(fallback, three, seven));
        Var[] picks = new Var[3];
        BasicBlock[] arms = {fallback, three, seven};
        for (int i = 0; i < arms.length; i++) {
            ib.setBlock(arms[i]);
            picks[i] = ib.constant(ShaderValue.ints(i), "pick");
            ib.insertCtrl(Control.br(join));
        }
        ib.setBlock(join);
        Var picked = ib.insert(CommonOps.PHI.create(Arrays.asList(arms)).insn(picks), "picked");
        output(ib, 0, picked);
        ret(ib);

        ShaderDebugger debugger = new ShaderDebugger(new SoftwareDebugApi());
        DebugSession session = debugger.beginDebug(program, 0,
                lanes(ShaderValue.ints(7), ShaderValue.ints(3), ShaderValue.ints(5)));
        debugger.continueDebug(session);
        assertEquals(ShaderValue.ints(2), output(session, 0, 0));
        assertEquals(ShaderValue.ints(1), output(session, 1, 0));
        assertEquals(ShaderValue.ints(0), output(session, 2, 0));
    }

    @Test
    void testQuadDerivatives() {
        List<LaneSetup> quad = lanes(
                ShaderValue.floats(1),
                ShaderValue.floats(2),
                ShaderValue.floats(5),
                ShaderValue.floats(9));
        DebugSession session = run(ShaderStage.PIXEL, quad, ib -> {
            Var x = input(ib, 0, "x");
            for (Derivative d : Derivative.values()) {
                output(ib, d.ordinal(), ib.insert(ShaderOps.DERIV.create(d).insn(x), "d"));
            }
        });
        for (int lane = 0; lane < 4; lane++) {
            assertEquals(ShaderValue.floats(1), output(session, lane, Derivative.DDX_COARSE.ordinal()));
            assertEquals(ShaderValue.floats(4), output(session, lane, Derivative.DDY_COARSE.ordinal()));
        }
        assertEquals(ShaderValue.floats(1), output(session, 1, Derivative.DDX_FINE.ordinal()));
        assertEquals(ShaderValue.floats(4), output(session, 2, Derivative.DDX_FINE.ordinal()));
        assertEquals(ShaderValue.floats(4), output(session, 0, Derivative.DDY_FINE.ordinal()));
        assertEquals(ShaderValue.floats(7), output(session, 3, Derivative.DDY_FINE.ordinal()));
    }

    @Test
    void testDerivativesOutsidePixelShadersAreZero() {
        DebugSession session = run(ShaderStage.COMPUTE, lanes(ShaderValue.floats(1), ShaderValue.floats(2)), ib -> {
            Var x = input(ib, 0, "x");
            output(ib, 0, ib.insert(ShaderOps.DERIV.create(Derivative.DDX_COARSE).insn(x), "dx"));
        });
        assertEquals(ShaderValue.floats(0), output(session, 0, 0));
        assertEquals(ShaderValue.floats(0), output(session, 1, 0));
    }

    @Test
    void testWaveOpsSkipHelpers() {
        List<LaneSetup> lanes = lanes(
                ShaderValue.bools(true),
                ShaderValue.bools(false),
                ShaderValue.bools(true),
                ShaderValue.bools(true));
        lanes.set(0, LaneSetup.create().withInput(0, ShaderValue.bools(true)).withInput(1, ShaderValue.floats(42)));
        lanes.set(3, lanes.get(3).asHelper());
        DebugSession session = run(ShaderStage.PIXEL, lanes, ib -> {
            Var b = input(ib, 0, "b");
            Var f = ib.insert(ShaderOps.INPUT.create(1).insn(), "f");
            output(ib, 0, ib.insert(ShaderOps.WAVE.create(WaveOp.ANY).insn(b), "any"));
            output(ib, 1, ib.insert(ShaderOps.WAVE.create(WaveOp.ALL).insn(b), "all"));
            output(ib, 2, ib.insert(ShaderOps.WAVE.create(WaveOp.BALLOT).insn(b), "ballot"));
            output(ib, 3, ib.insert(ShaderOps.WAVE.create(WaveOp.COUNT).insn(), "count"));
            output(ib, 4, ib.insert(ShaderOps.WAVE.create(WaveOp.READ_FIRST).insn(f), "first"));
        });
        for (int lane = 0; lane < 3; lane++) {
            assertEquals(ShaderValue.bools(true), output(session, lane, 0));
            assertEquals(ShaderValue.bools(false), output(session, lane, 1));
            assertEquals(ShaderValue.uints(0b101, 0, 0, 0), output(session, lane, 2));
            assertEquals(ShaderValue.uints(3), output(session, lane, 3));
            assertEquals(ShaderValue.floats(42), output(session, lane, 4));
        }
        assertTrue(session.getLane(3).getOutputs().isEmpty());
    }

    static Var wave(IRBuilder ib, WaveOp op, Var... args) {
        return ib.insert(ShaderOps.WAVE.create(op).insn(args), op.name().toLowerCase());
    }

    @Test
    void testWaveReductionsAndPrefixes() {
        float[] fs = {1, 2, 3, 4};
        int[] is = {-2, 5, 3, -7};
        int[] us = {1, 2, 4, 8};
        List<LaneSetup> lanes = new ArrayList<>();
        for (int lane = 0; lane < 4; lane++) {
            lanes.add(LaneSetup.create()
                    .withInput(0, ShaderValue.floats(fs[lane]))
                    .withInput(1, ShaderValue.ints(is[lane]))
                    .withInput(2, ShaderValue.uints(us[lane])));
        }
        DebugSession session = run(ShaderStage.COMPUTE, lanes, ib -> {
            Var f = input(ib, 0, "f");
            Var i = input(ib, 1, "i");
            Var u = input(ib, 2, "u");
            output(ib, 0, wave(ib, WaveOp.ACTIVE_SUM, f));
            output(ib, 1, wave(ib, WaveOp.ACTIVE_PRODUCT, f));
            output(ib, 2, wave(ib, WaveOp.PREFIX_SUM, f));
            output(ib, 3, wave(ib, WaveOp.PREFIX_PRODUCT, f));
            output(ib, 4, wave(ib, WaveOp.ACTIVE_MIN, i));
            output(ib, 5, wave(ib, WaveOp.ACTIVE_MAX, i));
            output(ib, 6, wave(ib, WaveOp.ACTIVE_BIT_OR, u));
            output(ib, 7, wave(ib, WaveOp.ACTIVE_BIT_AND, u));
            output(ib, 8, wave(ib, WaveOp.ACTIVE_BIT_XOR, u));
            output(ib, 9, wave(ib, WaveOp.ACTIVE_MAX, u));
        });
        float[] prefixSums = {0, 1, 3, 6};
        float[] prefixProducts = {1, 1, 2, 6};
        for (int lane = 0; lane < 4; lane++) {
            assertEquals(ShaderValue.floats(10), output(session, lane, 0));
            assertEquals(ShaderValue.floats(24), output(session, lane, 1));
            assertEquals(ShaderValue.floats(prefixSums[lane]), output(session, lane, 2));
            assertEquals(ShaderValue.floats(prefixProducts[lane]), output(session, lane, 3));
            assertEquals(ShaderValue.ints(-7), output(session, lane, 4));
            assertEquals(ShaderValue.ints(5), output(session, lane, 5));
            assertEquals(ShaderValue.uints(15), output(session, lane, 6));
            assertEquals(ShaderValue.uints(0), output(session, lane, 7));
            assertEquals(ShaderValue.uints(15), output(session, lane, 8));
            assertEquals(ShaderValue.uints(8), output(session, lane, 9));
        }
    }

    @Test
    void testWaveLaneQueries() {
        DebugSession session = run(ShaderStage.COMPUTE,
                lanes(ShaderValue.floats(1), ShaderValue.floats(2), ShaderValue.floats(3), ShaderValue.floats(4)), ib -> {
                    Var f = input(ib, 0, "f");
                    output(ib, 0, wave(ib, WaveOp.LANE_INDEX));
                    output(ib, 1, wave(ib, WaveOp.IS_FIRST_LANE));
                    output(ib, 2, wave(ib, WaveOp.READ_LANE_AT, f, k(ib, ShaderValue.uints(2))));
                    output(ib, 3, wave(ib, WaveOp.READ_LANE_AT, f, k(ib, ShaderValue.uints(9))));
                    Var pair = op(ib, ShaderOps.VECTOR, k(ib, ShaderValue.floats(7)), f);
                    output(ib, 4, wave(ib, WaveOp.ALL_EQUAL, pair));
                    Var big = op(ib, ShaderOps.FLT, k(ib, ShaderValue.floats(1.5f)), f);
                    output(ib, 5, wave(ib, WaveOp.COUNT_BITS, big));
                    output(ib, 6, wave(ib, WaveOp.PREFIX_COUNT_BITS, big));
                });
        int[] prefixCounts = {0, 0, 1, 2};
        for (int lane = 0; lane < 4; lane++) {
            assertEquals(ShaderValue.uints(lane), output(session, lane, 0));
            assertEquals(ShaderValue.bools(lane == 0), output(session, lane, 1));
            assertEquals(ShaderValue.floats(3), output(session, lane, 2));
            assertEquals(ShaderValue.floats(0), output(session, lane, 3));
            assertEquals(ShaderValue.bools(true, false), output(session, lane, 4));
            assertEquals(ShaderValue.uints(3), output(session, lane, 5));
            assertEquals(ShaderValue.uints(prefixCounts[lane]), output(session, lane, 6));
        }
        // reading a lane that isn't there warns on every lane
        assertEquals(4, session.getMessages().size());
        for (DebugMessage message : session.getMessages()) {
            assertEquals(DebugMessage.Category.EXECUTION, message.category);
        }
    }

    @Test
    void testSubgroupUniformity() {
        ShaderProgram program = DebuggerTest.branchy();
        Function main = program.getEntryPoint();
        for (int block = 0; block < 4; block++) {
            BasicBlock bb = main.blocks.get(block);
            Var v = main.newVar("uniform");
            bb.getEffects().add(0, ShaderOps.SUBGROUP_UNIFORM.insn().assignTo(v));
            bb.getEffects().add(1 + (block == 3 ? 1 : 0),
                    ShaderOps.OUTPUT.create(10 + block).insn(v).assignTo());
        }
        // keep the phi first in the join
        BasicBlock join = main.blocks.get(3);
        join.getEffects().add(0, join.getEffects().remove(1));

        ShaderDebugger debugger = new ShaderDebugger(new SoftwareDebugApi());
        DebugSession session = debugger.beginDebug(program, 0, DebuggerTest.branchyLanes());
        debugger.continueDebug(session);
        assertEquals(ShaderValue.bools(true), output(session, 0, 10));
        assertEquals(ShaderValue.bools(false), output(session, 0, 11));
        assertEquals(ShaderValue.bools(false), output(session, 2, 12));
        assertEquals(ShaderValue.bools(true), output(session, 2, 13));
    }

    @Test
    void testSingleBlockFunctionIsUniform() {
        DebugSession session = run(ShaderStage.COMPUTE, lanes(ShaderValue.floats(0)),
                ib -> output(ib, 0, op(ib, ShaderOps.SUBGROUP_UNIFORM)));
        assertEquals(ShaderValue.bools(true), output(session, 0, 0));
    }

    @Test
    void testMathIntrinsics() {
        DebugSession session = run(ShaderStage.COMPUTE, lanes(ShaderValue.floats(4)), ib -> {
            Var x = input(ib, 0, "x");
            output(ib, 0, ib.insert(ShaderOps.MATH.create(MathOp.RSQ).insn(x), "rsq"));
            Var sin = ib.func.newVar("sin");
            Var cos = ib.func.newVar("cos");
            ib.insert(ShaderOps.MATH.create(MathOp.SINCOS).insn(k(ib, ShaderValue.floats(0))).assignTo(sin, cos));
            output(ib, 1, sin);
            output(ib, 2, cos);
        });
        assertEquals(ShaderValue.floats(0.5f), output(session, 0, 0));
        assertEquals(ShaderValue.floats(0), output(session, 0, 1));
        assertEquals(ShaderValue.floats(1), output(session, 0, 2));
        assertTrue(session.getMessages().isEmpty());
    }

    @Test
    void testFailedMathIntrinsicGivesZero() {
        SoftwareDebugApi api = new SoftwareDebugApi() {
            @Override
            public @Nullable List<ShaderValue> calculateMathIntrinsic(MathOp op, ShaderValue operand) {
                return null;
            }
        };
        DebugSession session = run(api, ShaderStage.COMPUTE, lanes(ShaderValue.floats(4, 9)), ib ->
                output(ib, 0, ib.insert(ShaderOps.MATH.create(MathOp.SQRT).insn(input(ib, 0, "x")), "sqrt")));
        assertEquals(ShaderValue.floats(0, 0), output(session, 0, 0));
        assertEquals(1, session.getMessages().size());
        DebugMessage message = session.getMessages().get(0);
        assertEquals(DebugMessage.Category.CAPABILITY, message.category);
        assertEquals(0, message.lane);
        assertEquals(1, api.getMessages().size());
    }

    @Test
    void testMissingInputGivesZero() {
        DebugSession session = run(ShaderStage.COMPUTE, lanes(ShaderValue.floats(0)),
                ib -> output(ib, 0, input(ib, 5, "missing")));
        assertEquals(ShaderValue.floats(0, 0, 0, 0), output(session, 0, 0));
        assertEquals(1, session.getMessages().size());
    }
}
