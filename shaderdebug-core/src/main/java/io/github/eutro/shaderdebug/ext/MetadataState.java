package io.github.eutro.shaderdebug.ext;

import io.github.eutro.shaderdebug.passes.IRPass;
import io.github.eutro.shaderdebug.passes.meta.ComputeConvergence;
import io.github.eutro.shaderdebug.passes.meta.ComputePreds;
import io.github.eutro.shaderdebug.ssa.Function;

import java.util.BitSet;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Tracks which derived data of a {@link Function} is currently up to date.
 */
public class MetadataState {
    public static class MetaKind {
        private static final AtomicInteger COUNTER = new AtomicInteger();
        public final int id = COUNTER.getAndIncrement();
        public final String name;

        private MetaKind(String name) {
            this.name = name;
        }

        @Override
        public String toString() {
            return name;
        }
    }

    /**
     * A kind of metadata that can be brought up to date by running in-place passes.
     *
     * @param <T> The type of IR the passes run on.
     */
    public static class ComputableMetaKind<T> extends MetaKind {
        private final IRPass<T, T>[] passes;

        @SafeVarargs
        private ComputableMetaKind(String name, IRPass<T, T>... passes) {
            super(name);
            this.passes = passes;
        }

        void computeFor(T t) {
            for (IRPass<T, T> pass : passes) {
                if (!pass.isInPlace()) throw new IllegalArgumentException("Pass is not in-place: " + pass);
                pass.run(t);
            }
        }
    }

    public static final ComputableMetaKind<Function>
            PREDS = new ComputableMetaKind<>("PREDS", ComputePreds.INSTANCE),
            CONVERGENCE = new ComputableMetaKind<>("CONVERGENCE", ComputeConvergence.INSTANCE);

    private final BitSet valid = new BitSet();

    public boolean isValid(MetaKind kind) {
        return valid.get(kind.id);
    }

    @SafeVarargs
    public final <T> void ensureValid(T t, ComputableMetaKind<T>... kinds) {
        for (ComputableMetaKind<T> kind : kinds) {
            if (!isValid(kind)) {
                kind.computeFor(t);
                validate(kind);
            }
        }
    }

    public void validate(MetaKind... kinds) {
        for (MetaKind kind : kinds) {
            valid.set(kind.id);
        }
    }

    public void invalidate(MetaKind... kinds) {
        for (MetaKind kind : kinds) {
            valid.clear(kind.id);
        }
    }

    /**
     * Call after adding, removing or retargeting blocks.
     */
    public void graphChanged() {
        invalidate(PREDS, CONVERGENCE);
    }
}
