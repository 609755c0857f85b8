package io.github.eutro.shaderdebug.debug.eval;

import io.github.eutro.shaderdebug.ops.Op;
import io.github.eutro.shaderdebug.ssa.ShaderValue;
import io.github.eutro.shaderdebug.ssa.VarType;

import static io.github.eutro.shaderdebug.ops.ShaderOps.*;

/**
 * Component-wise arithmetic, comparisons, conversions and vector shuffling.
 * <p>
 * Integer arithmetic wraps. Integer division by zero gives all ones, as does unsigned remainder by zero.
 */
class ArithmeticEvaluators {
    interface FloatOp1 {
        float apply(float a);
    }

    interface FloatOp2 {
        float apply(float a, float b);
    }

    interface IntOp1 {
        int apply(int a);
    }

    interface IntOp2 {
        int apply(int a, int b);
    }

    interface FloatTest {
        boolean test(float a, float b);
    }

    interface IntTest {
        boolean test(int a, int b);
    }

    static void register() {
        floats(FADD, (a, b) -> a + b);
        floats(FSUB, (a, b) -> a - b);
        floats(FMUL, (a, b) -> a * b);
        floats(FDIV, (a, b) -> a / b);
        floats(FMIN, Numerics::fmin);
        floats(FMAX, Numerics::fmax);
        floats(FNEG, a -> -a);
        floats(FABS, Math::abs);
        floats(FSAT, Numerics::saturate);
        floats(FFLOOR, a -> (float) Math.floor(a));
        floats(FFRAC, a -> a - (float) Math.floor(a));
        Evaluators.register(FMAD, ctx -> {
            ShaderValue a = ctx.arg(0), b = ctx.arg(1), c = ctx.arg(2);
            int n = Math.max(a.components(), Math.max(b.components(), c.components()));
            float[] out = new float[n];
            for (int i = 0; i < n; i++) {
                out[i] = f(a, i) * f(b, i) + f(c, i);
            }
            ctx.setResult(ShaderValue.floats(out));
        });
        Evaluators.register(FDOT, ctx -> {
            ShaderValue a = ctx.arg(0), b = ctx.arg(1);
            int n = Math.max(a.components(), b.components());
            float sum = 0;
            for (int i = 0; i < n; i++) {
                sum += f(a, i) * f(b, i);
            }
            ctx.setResult(ShaderValue.floats(sum));
        });

        ints(IADD, (a, b) -> a + b);
        ints(ISUB, (a, b) -> a - b);
        ints(IMUL, (a, b) -> a * b);
        ints(IDIV, (a, b) -> b == 0 ? -1 : a / b);
        ints(UDIV, (a, b) -> b == 0 ? -1 : Integer.divideUnsigned(a, b));
        ints(UREM, (a, b) -> b == 0 ? -1 : Integer.remainderUnsigned(a, b));
        ints(IMIN, Math::min);
        ints(IMAX, Math::max);
        ints(UMIN, (a, b) -> Integer.compareUnsigned(a, b) <= 0 ? a : b);
        ints(UMAX, (a, b) -> Integer.compareUnsigned(a, b) >= 0 ? a : b);
        ints(AND, (a, b) -> a & b);
        ints(OR, (a, b) -> a | b);
        ints(XOR, (a, b) -> a ^ b);
        ints(SHL, (a, b) -> a << (b & 31));
        ints(ISHR, (a, b) -> a >> (b & 31));
        ints(USHR, (a, b) -> a >>> (b & 31));
        ints(INEG, a -> -a);
        Evaluators.register(NOT, ctx -> {
            ShaderValue a = ctx.arg(0);
            int mask = a.type == VarType.BOOL ? 1 : -1;
            int[] out = new int[a.components()];
            for (int i = 0; i < out.length; i++) {
                out[i] = a.bits(i) ^ mask;
            }
            ctx.setResult(ShaderValue.ofBits(a.type, out));
        });

        fcompare(FEQ, (a, b) -> a == b);
        fcompare(FNE, (a, b) -> a != b);
        fcompare(FLT, (a, b) -> a < b);
        fcompare(FGE, (a, b) -> a >= b);
        icompare(IEQ, (a, b) -> a == b);
        icompare(INE, (a, b) -> a != b);
        icompare(ILT, (a, b) -> a < b);
        icompare(IGE, (a, b) -> a >= b);
        icompare(ULT, (a, b) -> Integer.compareUnsigned(a, b) < 0);
        icompare(UGE, (a, b) -> Integer.compareUnsigned(a, b) >= 0);

        Evaluators.register(SELECT, ctx -> {
            ShaderValue cond = ctx.arg(0), a = ctx.arg(1), b = ctx.arg(2);
            int n = Math.max(cond.components(), Math.max(a.components(), b.components()));
            int[] out = new int[n];
            for (int i = 0; i < n; i++) {
                out[i] = cond.splatBits(i) != 0 ? a.splatBits(i) : b.splatBits(i);
            }
            ctx.setResult(ShaderValue.ofBits(a.type, out));
        });

        convert(FTOI, VarType.SINT, bits -> Numerics.ftoi(Float.intBitsToFloat(bits)));
        convert(FTOU, VarType.UINT, bits -> Numerics.ftou(Float.intBitsToFloat(bits)));
        convert(ITOF, VarType.FLOAT, bits -> Float.floatToRawIntBits((float) bits));
        convert(UTOF, VarType.FLOAT, bits -> Float.floatToRawIntBits((float) Integer.toUnsignedLong(bits)));
        Evaluators.register(BITCAST, ctx -> ctx.setResult(ctx.arg(0).withType(BITCAST.arg(ctx.insn().op))));

        Evaluators.register(SWIZZLE, ctx -> {
            ShaderValue a = ctx.arg(0);
            int[] lanes = SWIZZLE.arg(ctx.insn().op);
            int[] out = new int[lanes.length];
            for (int i = 0; i < lanes.length; i++) {
                if (lanes[i] >= a.components()) {
                    throw new IllegalStateException("Swizzle " + ctx.insn() + " reads past the end of " + a);
                }
                out[i] = a.bits(lanes[i]);
            }
            ctx.setResult(ShaderValue.ofBits(a.type, out));
        });
        Evaluators.register(VECTOR, ctx -> {
            int[] out = new int[ctx.arity()];
            VarType type = null;
            for (int i = 0; i < out.length; i++) {
                ShaderValue v = ctx.arg(i);
                if (type == null) type = v.type;
                out[i] = v.bits(0);
            }
            if (type == null) throw new IllegalStateException("Empty vector " + ctx.insn());
            ctx.setResult(ShaderValue.ofBits(type, out));
        });
    }

    private static float f(ShaderValue v, int c) {
        return Float.intBitsToFloat(v.splatBits(c));
    }

    private static void floats(Op op, FloatOp1 fn) {
        Evaluators.register(op, ctx -> {
            ShaderValue a = ctx.arg(0);
            float[] out = new float[a.components()];
            for (int i = 0; i < out.length; i++) {
                out[i] = fn.apply(a.getFloat(i));
            }
            ctx.setResult(ShaderValue.floats(out));
        });
    }

    private static void floats(Op op, FloatOp2 fn) {
        Evaluators.register(op, ctx -> {
            ShaderValue a = ctx.arg(0), b = ctx.arg(1);
            float[] out = new float[Math.max(a.components(), b.components())];
            for (int i = 0; i < out.length; i++) {
                out[i] = fn.apply(f(a, i), f(b, i));
            }
            ctx.setResult(ShaderValue.floats(out));
        });
    }

    private static void ints(Op op, IntOp1 fn) {
        Evaluators.register(op, ctx -> {
            ShaderValue a = ctx.arg(0);
            int[] out = new int[a.components()];
            for (int i = 0; i < out.length; i++) {
                out[i] = fn.apply(a.bits(i));
            }
            ctx.setResult(ShaderValue.ofBits(a.type, out));
        });
    }

    private static void ints(Op op, IntOp2 fn) {
        Evaluators.register(op, ctx -> {
            ShaderValue a = ctx.arg(0), b = ctx.arg(1);
            int[] out = new int[Math.max(a.components(), b.components())];
            for (int i = 0; i < out.length; i++) {
                out[i] = fn.apply(a.splatBits(i), b.splatBits(i));
            }
            ctx.setResult(ShaderValue.ofBits(a.type, out));
        });
    }

    private static void fcompare(Op op, FloatTest test) {
        Evaluators.register(op, ctx -> {
            ShaderValue a = ctx.arg(0), b = ctx.arg(1);
            boolean[] out = new boolean[Math.max(a.components(), b.components())];
            for (int i = 0; i < out.length; i++) {
                out[i] = test.test(f(a, i), f(b, i));
            }
            ctx.setResult(ShaderValue.bools(out));
        });
    }

    private static void icompare(Op op, IntTest test) {
        Evaluators.register(op, ctx -> {
            ShaderValue a = ctx.arg(0), b = ctx.arg(1);
            boolean[] out = new boolean[Math.max(a.components(), b.components())];
            for (int i = 0; i < out.length; i++) {
                out[i] = test.test(a.splatBits(i), b.splatBits(i));
            }
            ctx.setResult(ShaderValue.bools(out));
        });
    }

    private static void convert(Op op, VarType to, IntOp1 fn) {
        Evaluators.register(op, ctx -> {
            ShaderValue a = ctx.arg(0);
            int[] out = new int[a.components()];
            for (int i = 0; i < out.length; i++) {
                out[i] = fn.apply(a.bits(i));
            }
            ctx.setResult(ShaderValue.ofBits(to, out));
        });
    }
}
