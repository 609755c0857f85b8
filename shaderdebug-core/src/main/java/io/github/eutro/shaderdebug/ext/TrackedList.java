package io.github.eutro.shaderdebug.ext;

import java.util.*;

/**
 * A list view that is told about every element entering or leaving it.
 * <p>
 * Functions use this to keep {@link CommonExts#OWNING_FUNCTION} up to date on their blocks,
 * and blocks to keep {@link CommonExts#OWNING_BLOCK} up to date on their effects.
 *
 * @param <E> The element type.
 */
public abstract class TrackedList<E> extends AbstractList<E> implements RandomAccess {
    private List<E> backing;

    public TrackedList(List<E> backing) {
        this.backing = backing;
    }

    /**
     * Replace the backing list, detaching every old element and attaching every new one.
     *
     * @param backing The new backing list.
     */
    public void setBacking(List<E> backing) {
        for (E e : this.backing) {
            onRemoved(e);
        }
        this.backing = backing;
        for (E e : backing) {
            onAdded(e);
        }
    }

    protected abstract void onAdded(E elt);

    protected abstract void onRemoved(E elt);

    @Override
    public E get(int index) {
        return backing.get(index);
    }

    @Override
    public int size() {
        return backing.size();
    }

    @Override
    public E set(int index, E element) {
        E old = backing.set(index, element);
        onRemoved(old);
        onAdded(element);
        return old;
    }

    @Override
    public void add(int index, E element) {
        onAdded(element);
        backing.add(index, element);
    }

    @Override
    public E remove(int index) {
        E old = backing.remove(index);
        onRemoved(old);
        return old;
    }

    @Override
    public void clear() {
        for (E e : backing) {
            onRemoved(e);
        }
        backing.clear();
    }
}
