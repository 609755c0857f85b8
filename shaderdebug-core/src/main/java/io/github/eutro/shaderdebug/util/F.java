package io.github.eutro.shaderdebug.util;

/**
 * A unary function, named so it doesn't collide with {@link io.github.eutro.shaderdebug.ssa.Function}.
 *
 * @param <A> The argument type.
 * @param <B> The return type.
 */
@FunctionalInterface
public interface F<A, B> {
    B apply(A a);

    default <C> F<A, C> andThen(F<B, C> g) {
        return a -> g.apply(apply(a));
    }
}
