package io.github.eutro.shaderdebug.ops;

import io.github.eutro.shaderdebug.ssa.VarType;

import java.util.Arrays;

/**
 * Ops specific to shader code: arithmetic, comparisons, resource access and cross-lane operations.
 * <p>
 * Binary arithmetic ops work component-wise; a scalar operand is broadcast to the width of the other.
 */
public class ShaderOps {
    public static final Op
            FADD = op("fadd"),
            FSUB = op("fsub"),
            FMUL = op("fmul"),
            FDIV = op("fdiv"),
            FNEG = op("fneg"),
            FABS = op("fabs"),
            FSAT = op("fsat"),
            FFLOOR = op("ffloor"),
            FFRAC = op("ffrac"),
            FMAD = op("fmad"),
            FDOT = op("fdot");

    /**
     * Component-wise float min. If exactly one operand is NaN the other is returned.
     */
    public static final Op FMIN = op("fmin");
    /**
     * Component-wise float max. If exactly one operand is NaN the other is returned.
     */
    public static final Op FMAX = op("fmax");

    public static final Op
            IADD = op("iadd"),
            ISUB = op("isub"),
            IMUL = op("imul"),
            IDIV = op("idiv"),
            UDIV = op("udiv"),
            UREM = op("urem"),
            INEG = op("ineg"),
            IMIN = op("imin"),
            IMAX = op("imax"),
            UMIN = op("umin"),
            UMAX = op("umax"),
            AND = op("and"),
            OR = op("or"),
            XOR = op("xor"),
            NOT = op("not"),
            SHL = op("shl"),
            ISHR = op("ishr"),
            USHR = op("ushr");

    // comparisons, producing bools
    public static final Op
            FEQ = op("feq"),
            FNE = op("fne"),
            FLT = op("flt"),
            FGE = op("fge"),
            IEQ = op("ieq"),
            INE = op("ine"),
            ILT = op("ilt"),
            IGE = op("ige"),
            ULT = op("ult"),
            UGE = op("uge");

    /**
     * Effect: {@code select cond a b}, component-wise.
     */
    public static final Op SELECT = op("select");

    public static final Op
            FTOI = op("ftoi"),
            FTOU = op("ftou"),
            ITOF = op("itof"),
            UTOF = op("utof");
    /**
     * Effect: reinterprets the bits of its argument as another type.
     */
    public static final UnaryOpKey<VarType> BITCAST = new UnaryOpKey<>("bitcast", t -> t.name().toLowerCase());
    /**
     * Effect: picks components of its argument, e.g. {@code swizzle [2, 1]} gives {@code .zy}.
     */
    public static final UnaryOpKey<int[]> SWIZZLE = new UnaryOpKey<>("swizzle", Arrays::toString);
    /**
     * Effect: builds a vector out of the first component of each argument.
     */
    public static final Op VECTOR = op("vector");

    /**
     * Effect: reads the lane's input at the given slot.
     */
    public static final UnaryOpKey<Integer> INPUT = new UnaryOpKey<>("input");
    /**
     * Effect: writes the lane's output at the given slot.
     */
    public static final UnaryOpKey<Integer> OUTPUT = new UnaryOpKey<>("output");
    /**
     * Effect: reads the vector at the index given by its argument from a constant buffer.
     */
    public static final UnaryOpKey<Integer> CBUFFER_LOAD = new UnaryOpKey<>("cbuffer_load");

    /**
     * Effect: {@code buffer_load offset}, reading at a byte offset.
     */
    public static final UnaryOpKey<ResourceAccess> BUFFER_LOAD = new UnaryOpKey<>("buffer_load");
    /**
     * Effect: {@code buffer_store offset value}.
     */
    public static final UnaryOpKey<ResourceAccess> BUFFER_STORE = new UnaryOpKey<>("buffer_store");
    /**
     * Effect: {@code texel_load coord [sample]}, with integer coordinates.
     */
    public static final UnaryOpKey<ResourceAccess> TEXEL_LOAD = new UnaryOpKey<>("texel_load");
    /**
     * Effect: {@code texel_store coord value}.
     */
    public static final UnaryOpKey<ResourceAccess> TEXEL_STORE = new UnaryOpKey<>("texel_store");
    /**
     * Effect: {@code sample uv extra...}, a filtered texture sample or gather, see {@link SampleKind}.
     */
    public static final UnaryOpKey<SampleInfo> SAMPLE = new UnaryOpKey<>("sample");
    /**
     * Effect: {@code atomic offset value}, or {@code atomic offset compare value} for compare-exchange,
     * on a 32-bit integer of a read-write buffer. Returns what memory held before.
     */
    public static final UnaryOpKey<AtomicAccess> ATOMIC = new UnaryOpKey<>("atomic");

    /**
     * Effect: {@code groupshared_load offset}, reading the memory shared by the lanes of a workgroup.
     */
    public static final UnaryOpKey<GroupsharedAccess> GROUPSHARED_LOAD = new UnaryOpKey<>("groupshared_load");
    /**
     * Effect: {@code groupshared_store offset value}.
     */
    public static final UnaryOpKey<GroupsharedAccess> GROUPSHARED_STORE = new UnaryOpKey<>("groupshared_store");
    /**
     * Effect: an atomic on groupshared memory, with the same operands as {@link #ATOMIC}.
     */
    public static final UnaryOpKey<AtomicOp> GROUPSHARED_ATOMIC =
            new UnaryOpKey<>("groupshared_atomic", a -> a.name().toLowerCase());
    /**
     * Effect: a workgroup barrier. No lane executes it until every running lane has reached one.
     */
    public static final Op BARRIER = op("barrier");

    /**
     * Effect: a math intrinsic computed by the debug API.
     */
    public static final UnaryOpKey<MathOp> MATH = new UnaryOpKey<>("math", m -> m.name().toLowerCase());

    /**
     * Effect: a screen-space derivative of its argument, from the lanes of the quad.
     */
    public static final UnaryOpKey<Derivative> DERIV = new UnaryOpKey<>("deriv", d -> d.name().toLowerCase());
    /**
     * Effect: an operation over the lanes executing it together, see {@link WaveOp}.
     */
    public static final UnaryOpKey<WaveOp> WAVE = new UnaryOpKey<>("wave", w -> w.name().toLowerCase());
    /**
     * Effect: whether the current block is executed by every lane of the subgroup together.
     */
    public static final Op SUBGROUP_UNIFORM = op("subgroup_uniform");
    /**
     * Effect: turns the lane into a helper lane. It keeps running for derivatives only.
     */
    public static final Op DEMOTE = op("demote");

    private static Op op(String mnemonic) {
        return new SimpleOpKey(mnemonic).create();
    }
}
