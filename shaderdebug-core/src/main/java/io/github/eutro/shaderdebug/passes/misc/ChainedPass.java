package io.github.eutro.shaderdebug.passes.misc;

import io.github.eutro.shaderdebug.passes.IRPass;

/**
 * Runs one pass, then another on its result.
 *
 * @param <A> The input type.
 * @param <B> The intermediate type.
 * @param <C> The output type.
 */
public class ChainedPass<A, B, C> implements IRPass<A, C> {
    private final IRPass<A, B> first;
    private final IRPass<B, C> second;

    public ChainedPass(IRPass<A, B> first, IRPass<B, C> second) {
        this.first = first;
        this.second = second;
    }

    @Override
    public boolean isInPlace() {
        return first.isInPlace() && second.isInPlace();
    }

    @Override
    public C run(A a) {
        B b = first.run(a);
        try {
            return second.run(b);
        } catch (RuntimeException e) {
            e.addSuppressed(new RuntimeException("running " + second + " after " + first));
            throw e;
        }
    }

    @Override
    public String toString() {
        return first + " -> " + second;
    }
}
