package io.github.eutro.shaderdebug.ops;

import org.jetbrains.annotations.Nullable;

import java.util.Objects;
import java.util.function.Function;

/**
 * A key for ops carrying a single immediate of type {@code T}.
 *
 * @param <T> The type of the immediate.
 */
public class UnaryOpKey<T> extends OpKey {
    private final Function<T, String> printer;

    public UnaryOpKey(String mnemonic, Function<T, String> printer) {
        super(mnemonic);
        this.printer = printer;
    }

    public UnaryOpKey(String mnemonic) {
        this(mnemonic, Objects::toString);
    }

    public class UnaryOp extends Op {
        public final T arg;

        private UnaryOp(T arg) {
            super(UnaryOpKey.this);
            this.arg = arg;
        }

        @Override
        public String toString() {
            return key + " " + printer.apply(arg);
        }
    }

    /**
     * Get the immediate of {@code op}, if it is an op of this key.
     *
     * @param op The op.
     * @return The immediate, or null if the op has a different key.
     */
    @SuppressWarnings("unchecked")
    @Nullable
    public T argNullable(Op op) {
        return op.key == this ? ((UnaryOp) op).arg : null;
    }

    /**
     * Get the immediate of {@code op}, which must be an op of this key.
     *
     * @param op The op.
     * @return The immediate.
     * @throws ClassCastException if the op has a different key.
     */
    public T arg(Op op) {
        if (op.key != this) {
            throw new ClassCastException(op + " is not a " + mnemonic);
        }
        @SuppressWarnings("unchecked")
        UnaryOp unary = (UnaryOp) op;
        return unary.arg;
    }

    public UnaryOp create(T arg) {
        if (arg == null) {
            throw new IllegalArgumentException("Immediate of " + mnemonic + " is null");
        }
        return new UnaryOp(arg);
    }
}
