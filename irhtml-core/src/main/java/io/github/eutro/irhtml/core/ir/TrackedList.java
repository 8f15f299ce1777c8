package io.github.eutro.irhtml.core.ir;

import java.util.AbstractList;
import java.util.ArrayList;
import java.util.List;
import java.util.RandomAccess;

/**
 * A list that tells its owner about every element entering or leaving it,
 * so the owner can keep the back-references of its children current.
 *
 * @param <E> The element type.
 */
abstract class TrackedList<E> extends AbstractList<E> implements RandomAccess {
    private final List<E> viewed = new ArrayList<>();

    protected abstract void onAdded(E elt);

    protected abstract void onRemoved(E elt);

    @Override
    public E get(int index) {
        return viewed.get(index);
    }

    @Override
    public int size() {
        return viewed.size();
    }

    @Override
    public E set(int index, E element) {
        E removed = viewed.set(index, element);
        onRemoved(removed);
        onAdded(element);
        return removed;
    }

    @Override
    public void add(int index, E element) {
        onAdded(element);
        viewed.add(index, element);
        modCount++;
    }

    @Override
    public E remove(int index) {
        E removed = viewed.remove(index);
        onRemoved(removed);
        modCount++;
        return removed;
    }
}
