package io.github.eutro.shaderdebug.ops;

import java.util.Objects;

/**
 * Where a shader finds a resource: the kind of binding, its register space and its register.
 * <p>
 * Used as the key of the debugger's descriptor cache.
 */
public final class BindingSlot {
    public enum Kind {
        CONSTANT_BUFFER("b"),
        READ_ONLY("t"),
        READ_WRITE("u"),
        SAMPLER("s");

        public final String prefix;

        Kind(String prefix) {
            this.prefix = prefix;
        }
    }

    public final Kind kind;
    public final int space;
    public final int register;

    public BindingSlot(Kind kind, int space, int register) {
        this.kind = kind;
        this.space = space;
        this.register = register;
    }

    public static BindingSlot readOnly(int register) {
        return new BindingSlot(Kind.READ_ONLY, 0, register);
    }

    public static BindingSlot readWrite(int register) {
        return new BindingSlot(Kind.READ_WRITE, 0, register);
    }

    public static BindingSlot sampler(int register) {
        return new BindingSlot(Kind.SAMPLER, 0, register);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BindingSlot)) return false;
        BindingSlot that = (BindingSlot) o;
        return space == that.space && register == that.register && kind == that.kind;
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, space, register);
    }

    @Override
    public String toString() {
        return kind.prefix + register + (space == 0 ? "" : ", space" + space);
    }
}
