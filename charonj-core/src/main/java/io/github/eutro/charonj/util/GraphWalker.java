package io.github.eutro.charonj.util;

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
     *
     * @param root        The root of the graph to walk from.
     * @param getChildren The successor function of the graph.
     */
    public GraphWalker(T root, F<? super T, ? extends Iterable<? extends T>> getChildren) {
        this.root = root;
        this.getChildren = getChildren;
    }

    /**
     * Create a graph walker over a {@link Graph}, from its entry.
     *
     * @param graph The graph.
     * @param <T>   The type of a node.
     * @return The graph walker.
     */
    public static <T> GraphWalker<T> of(Graph<T> graph) {
        return new GraphWalker<>(graph.entry(), graph::successors);
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
     * <p>
     * Elements yielded later by the successor function will be visited first.
     * This is the cheapest walk, useful for reachability.
     *
     * @return The pre-order.
     */
    public Order<T> preOrder() {
        return PreIter::new;
    }

    /**
     * Get the depth-first post-order traversal of the graph.
     * <p>
     * Successors are explored in the order the successor function yields them.
     *
     * @return The post-order.
     */
    public Order<T> postOrder() {
        return () -> postOrderList().iterator();
    }

    /**
     * Get the reverse post-order of the graph, the canonical visitation order of
     * every flow analysis here. Every node comes before its successors, unless
     * the edge between them is a back edge.
     *
     * @return The reverse post-order.
     */
    public Order<T> reversePostOrder() {
        return () -> {
            List<T> ls = postOrderList();
            Collections.reverse(ls);
            return ls.iterator();
        };
    }

    private List<T> postOrderList() {
        List<T> out = new ArrayList<>();
        Set<T> seen = new HashSet<>();
        Deque<Pair<T, Iterator<? extends T>>> stack = new ArrayDeque<>();
        seen.add(root);
        stack.push(Pair.of(root, getChildren.apply(root).iterator()));
        while (!stack.isEmpty()) {
            Pair<T, Iterator<? extends T>> top = stack.peek();
            if (top.right.hasNext()) {
                T next = top.right.next();
                if (seen.add(next)) {
                    stack.push(Pair.of(next, getChildren.apply(next).iterator()));
                }
            } else {
                stack.pop();
                out.add(top.left);
            }
        }
        return out;
    }

    private class PreIter implements Iterator<T> {
        private final List<T> stack = new ArrayList<>();
        private final Set<T> seen = new HashSet<>();

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
}
