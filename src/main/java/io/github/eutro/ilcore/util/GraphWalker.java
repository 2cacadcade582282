package io.github.eutro.ilcore.util;

import io.github.eutro.ilcore.il.ILInstruction;

import java.util.*;

/**
 * A class for walking a graph depth-first, in pre- or post-order.
 *
 * @param <T> The type of a node in the graph.
 */
public class GraphWalker<T> {
    /**
     * The root of the walk.
     */
    final T root;
    /**
     * The successor function.
     */
    final F<? super T, ? extends Iterable<? extends T>> getChildren;

    /**
     * Construct a graph walker from a root node and a successor function.
     * <p>
     * Elements yielded later by the successor function will be visited first.
     *
     * @param root        The root of the graph to walk from.
     * @param getChildren The successor function of the graph.
     */
    public GraphWalker(T root, F<? super T, ? extends Iterable<? extends T>> getChildren) {
        this.root = root;
        this.getChildren = getChildren;
    }

    /**
     * Create a graph walker over an instruction tree.
     * <p>
     * Children are visited in slot order, the first child first.
     *
     * @param root The root of the tree.
     * @return The graph walker.
     */
    public static GraphWalker<ILInstruction> treeWalker(ILInstruction root) {
        return new GraphWalker<>(root, $ -> reversedIterable($.getChildren()));
    }

    /**
     * Get an iterable that iterates over the list in reverse, using its {@link List#listIterator()}).
     *
     * @param ts  The list.
     * @param <T> The type of elements in the list.
     * @return The iterable.
     */
    private static <T> Iterable<T> reversedIterable(List<T> ts) {
        return () -> {
            ListIterator<T> li = ts.listIterator(ts.size());
            return new Iterator<T>() {
                @Override
                public boolean hasNext() {
                    return li.hasPrevious();
                }

                @Override
                public T next() {
                    return li.previous();
                }
            };
        };
    }

    /**
     * An order over a graph.
     *
     * @param <T> The type of each node.
     */
    public interface Order<T> extends Iterable<T> {
        /**
         * Collect this order to a list.
         *
         * @return The elements of the graph, in this order.
         */
        default List<T> toList() {
            List<T> ls = new ArrayList<>();
            for (T t : this) {
                ls.add(t);
            }
            return ls;
        }
    }

    /**
     * Get the pre-order traversal of the graph.
     *
     * @return The pre-order.
     */
    public Order<T> preOrder() {
        return PreIter::new;
    }

    /**
     * Get the post-order traversal of the graph.
     *
     * @return The post-order.
     */
    public Order<T> postOrder() {
        return PostIter::new;
    }

    private class PreIter implements Iterator<T> {
        private final List<T> stack = new ArrayList<>();
        private final Set<T> seen = Collections.newSetFromMap(new IdentityHashMap<>());

        {
            stack.add(root);
            seen.add(root);
        }

        @Override
        public boolean hasNext() {
            return !stack.isEmpty();
        }

        @Override
        public T next() {
            if (stack.isEmpty()) throw new NoSuchElementException();
            T top = stack.remove(stack.size() - 1);
            for (T next : getChildren.apply(top)) {
                if (seen.add(next)) {
                    stack.add(next);
                }
            }
            return top;
        }
    }

    private class PostIter implements Iterator<T> {
        @SuppressWarnings("unchecked")
        private final T sentinel = (T) new Object();
        private final Deque<T> stack = new ArrayDeque<>();
        private final Set<T> seen = Collections.newSetFromMap(new IdentityHashMap<>());

        {
            stack.add(root);
            seen.add(root);
        }

        @Override
        public boolean hasNext() {
            return !stack.isEmpty();
        }

        @Override
        public T next() {
            if (stack.isEmpty()) throw new NoSuchElementException();
            while (true) {
                T last = stack.getLast();
                if (last == sentinel) {
                    stack.removeLast();
                    return stack.removeLast();
                } else {
                    stack.addLast(sentinel);
                    for (T next : getChildren.apply(last)) {
                        if (seen.add(next)) {
                            stack.addLast(next);
                        }
                    }
                }
            }
        }
    }
}
