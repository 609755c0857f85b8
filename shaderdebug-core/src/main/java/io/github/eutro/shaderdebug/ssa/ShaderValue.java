package io.github.eutro.shaderdebug.ssa;

import org.jetbrains.annotations.NotNull;

import java.util.Arrays;

/**
 * An immutable value of one to four components, all of the same {@link VarType}.
 * <p>
 * Components are stored as raw 32-bit patterns; floats keep their exact bits,
 * so NaN payloads and signed zeroes survive a round trip through a register.
 */
public final class ShaderValue {
    public static final int MAX_COMPONENTS = 4;

    public final VarType type;
    private final int[] bits;

    private ShaderValue(VarType type, int[] bits) {
        if (bits.length == 0 || bits.length > MAX_COMPONENTS) {
            throw new IllegalArgumentException("Bad component count: " + bits.length);
        }
        this.type = type;
        this.bits = bits;
    }

    public static ShaderValue ofBits(VarType type, int... bits) {
        return new ShaderValue(type, bits.clone());
    }

    public static ShaderValue floats(float... values) {
        int[] bits = new int[values.length];
        for (int i = 0; i < values.length; i++) {
            bits[i] = Float.floatToRawIntBits(values[i]);
        }
        return new ShaderValue(VarType.FLOAT, bits);
    }

    public static ShaderValue ints(int... values) {
        return new ShaderValue(VarType.SINT, values.clone());
    }

    public static ShaderValue uints(int... values) {
        return new ShaderValue(VarType.UINT, values.clone());
    }

    public static ShaderValue bools(boolean... values) {
        int[] bits = new int[values.length];
        for (int i = 0; i < values.length; i++) {
            bits[i] = values[i] ? 1 : 0;
        }
        return new ShaderValue(VarType.BOOL, bits);
    }

    public static ShaderValue zero(VarType type, int components) {
        return new ShaderValue(type, new int[components]);
    }

    public int components() {
        return bits.length;
    }

    public int bits(int c) {
        return bits[c];
    }

    public float getFloat(int c) {
        return Float.intBitsToFloat(bits[c]);
    }

    public int getInt(int c) {
        return bits[c];
    }

    public long getUint(int c) {
        return Integer.toUnsignedLong(bits[c]);
    }

    public boolean getBool(int c) {
        return bits[c] != 0;
    }

    /**
     * Broadcasts component {@code c}, or returns component 0 for scalars, so scalar
     * operands can be mixed with vectors.
     *
     * @param c The component.
     * @return The raw bits.
     */
    public int splatBits(int c) {
        return bits.length == 1 ? bits[0] : bits[c];
    }

    public ShaderValue withBits(int c, int value) {
        int[] copy = bits.clone();
        copy[c] = value;
        return new ShaderValue(type, copy);
    }

    public ShaderValue withType(VarType type) {
        return type == this.type ? this : new ShaderValue(type, bits);
    }

    /**
     * @return A copy of the raw component bits.
     */
    public int[] toBits() {
        return bits.clone();
    }

    public boolean isZero() {
        for (int b : bits) {
            if (b != 0) return false;
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ShaderValue)) return false;
        ShaderValue that = (ShaderValue) o;
        return type == that.type && Arrays.equals(bits, that.bits);
    }

    @Override
    public int hashCode() {
        return 31 * type.hashCode() + Arrays.hashCode(bits);
    }

    @Override
    public @NotNull String toString() {
        StringBuilder sb = new StringBuilder();
        if (bits.length > 1) sb.append('(');
        for (int i = 0; i < bits.length; i++) {
            if (i != 0) sb.append(", ");
            switch (type) {
                case FLOAT:
                    sb.append(getFloat(i));
                    break;
                case SINT:
                    sb.append(getInt(i));
                    break;
                case UINT:
                    sb.append(Integer.toUnsignedString(bits[i])).append('u');
                    break;
                case BOOL:
                    sb.append(getBool(i));
                    break;
            }
        }
        if (bits.length > 1) sb.append(')');
        return sb.toString();
    }
}
