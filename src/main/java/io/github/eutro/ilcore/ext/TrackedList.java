package io.github.eutro.ilcore.ext;

import java.util.AbstractList;
import java.util.Collection;
import java.util.List;
import java.util.ListIterator;
import java.util.RandomAccess;

/**
 * A list view over another list, which notifies subclasses when elements are added or removed.
 * <p>
 * {@link #onAdded(Object)} is called <i>before</i> the element is inserted, so it may reject
 * the element by throwing, leaving the list unchanged. {@link #onRemoved(Object)} is called
 * after the element is gone, and {@link #onChanged(int)} after every structural change,
 * with the lowest index whose element may differ.
 *
 * @param <E> The type of elements in the list.
 */
public abstract class TrackedList<E> extends AbstractList<E> implements RandomAccess /* probably */ {
    private final List<E> viewed;

    /**
     * Construct a tracked list viewing the given list, which should be empty.
     *
     * @param viewed The viewed list.
     */
    protected TrackedList(List<E> viewed) {
        this.viewed = viewed;
    }

    /**
     * Called before an element is added to the list.
     *
     * @param elt The element.
     */
    protected abstract void onAdded(E elt);

    /**
     * Called after an element is removed from the list.
     *
     * @param elt The element.
     */
    protected abstract void onRemoved(E elt);

    /**
     * Called after the list changed structurally, or had an element replaced.
     *
     * @param fromIndex The first index that may have changed.
     */
    protected void onChanged(int fromIndex) {
    }

    @Override
    public E get(int index) {
        return viewed.get(index);
    }

    @Override
    public int size() {
        return viewed.size();
    }

    @Override
    public boolean add(E e) {
        add(size(), e);
        return true;
    }

    @Override
    public E set(int index, E element) {
        E old = viewed.get(index);
        onAdded(element);
        viewed.set(index, element);
        if (old != element) onRemoved(old);
        onChanged(index);
        return old;
    }

    @Override
    public void add(int index, E element) {
        if (index < 0 || index > size()) throw new IndexOutOfBoundsException("Index: " + index + ", Size: " + size());
        onAdded(element);
        viewed.add(index, element);
        onChanged(index);
    }

    @Override
    public E remove(int index) {
        E removed = viewed.remove(index);
        onRemoved(removed);
        onChanged(index);
        return removed;
    }

    @Override
    public void clear() {
        if (viewed.isEmpty()) return;
        Object[] removed = viewed.toArray();
        viewed.clear();
        for (Object e : removed) {
            @SuppressWarnings("unchecked")
            E elt = (E) e;
            onRemoved(elt);
        }
        onChanged(0);
    }

    @Override
    public boolean addAll(int index, Collection<? extends E> c) {
        if (c.isEmpty()) return false;
        for (E e : c) {
            onAdded(e);
        }
        viewed.addAll(index, c);
        onChanged(index);
        return true;
    }

    @Override
    public boolean addAll(Collection<? extends E> c) {
        return addAll(size(), c);
    }

    @Override
    public ListIterator<E> listIterator(int index) {
        ListIterator<E> li = viewed.listIterator(index);
        return new ListIterator<E>() {
            E last;
            int lastIndex = -1;

            @Override
            public boolean hasNext() {
                return li.hasNext();
            }

            @Override
            public E next() {
                lastIndex = li.nextIndex();
                return last = li.next();
            }

            @Override
            public boolean hasPrevious() {
                return li.hasPrevious();
            }

            @Override
            public E previous() {
                lastIndex = li.previousIndex();
                return last = li.previous();
            }

            @Override
            public int nextIndex() {
                return li.nextIndex();
            }

            @Override
            public int previousIndex() {
                return li.previousIndex();
            }

            @Override
            public void remove() {
                li.remove();
                onRemoved(last);
                onChanged(lastIndex);
                last = null;
                lastIndex = -1;
            }

            @Override
            public void set(E e) {
                if (lastIndex < 0) throw new IllegalStateException();
                onAdded(e);
                li.set(e);
                if (last != e) onRemoved(last);
                onChanged(lastIndex);
                last = e;
            }

            @Override
            public void add(E e) {
                int at = li.nextIndex();
                onAdded(e);
                li.add(e);
                onChanged(at);
                last = null;
                lastIndex = -1;
            }
        };
    }
}
