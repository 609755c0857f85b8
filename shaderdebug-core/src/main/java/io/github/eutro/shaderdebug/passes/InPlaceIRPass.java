package io.github.eutro.shaderdebug.passes;

/**
 * An {@link IRPass} that mutates its input and returns it.
 *
 * @param <T> The type of IR.
 */
public interface InPlaceIRPass<T> extends IRPass<T, T> {
    void runInPlace(T t);

    @Override
    default T run(T t) {
        runInPlace(t);
        return t;
    }

    @Override
    default boolean isInPlace() {
        return true;
    }
}
