package io.github.eutro.shaderdebug.passes;

import io.github.eutro.shaderdebug.passes.misc.ChainedPass;

/**
 * A transformation or analysis over some IR.
 *
 * @param <A> The input type.
 * @param <B> The output type.
 */
public interface IRPass<A, B> {
    B run(A a);

    /**
     * @return Whether this pass returns its (possibly mutated) input.
     */
    default boolean isInPlace() {
        return false;
    }

    default <C> IRPass<A, C> then(IRPass<B, C> next) {
        return new ChainedPass<>(this, next);
    }
}
