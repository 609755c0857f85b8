package io.github.eutro.shaderdebug.debug.eval;

/**
 * Float rules that differ from Java's.
 */
public class Numerics {
    /**
     * Min where a single NaN operand loses.
     */
    public static float fmin(float a, float b) {
        if (Float.isNaN(a)) return b;
        if (Float.isNaN(b)) return a;
        return a < b ? a : b;
    }

    /**
     * Max where a single NaN operand loses.
     */
    public static float fmax(float a, float b) {
        if (Float.isNaN(a)) return b;
        if (Float.isNaN(b)) return a;
        return a >= b ? a : b;
    }

    /**
     * Clamp to [0, 1], with NaN going to 0.
     */
    public static float saturate(float x) {
        if (!(x > 0)) return 0;
        return x < 1 ? x : 1;
    }

    /**
     * Float to signed int, saturating, with NaN going to 0.
     */
    public static int ftoi(float x) {
        return (int) x;
    }

    /**
     * Float to unsigned int, saturating, with NaN going to 0.
     */
    public static int ftou(float x) {
        if (!(x > 0)) return 0;
        if (x >= 4294967295f) return -1;
        return (int) (long) x;
    }
}
