package io.github.eutro.charonj.util;

import java.util.*;

/**
 * Tarjan's strongly connected components.
 */
public final class StronglyConnected {
    private StronglyConnected() {
    }

    /**
     * Compute the strongly connected components of a graph.
     * <p>
     * Components are returned in reverse topological order: a component comes after every
     * component reachable from it. Within a component, nodes are in the order of {@code nodes}.
     *
     * @param nodes The nodes of the graph, in canonical order.
     * @param succ  The successor function. Successors not in {@code nodes} are ignored.
     * @param <N>   The type of a node.
     * @return The components.
     */
    public static <N> List<List<N>> compute(List<N> nodes, F<N, ? extends Iterable<N>> succ) {
        Map<N, Integer> position = new HashMap<>();
        for (N node : nodes) position.put(node, position.size());

        class Runner {
            final int[] index = new int[nodes.size()];
            final int[] low = new int[nodes.size()];
            final boolean[] onStack = new boolean[nodes.size()];
            final Deque<Integer> stack = new ArrayDeque<>();
            final List<List<N>> out = new ArrayList<>();
            int counter = 1;

            void enter(int v, Deque<Pair<Integer, Iterator<N>>> calls) {
                index[v] = low[v] = counter++;
                stack.push(v);
                onStack[v] = true;
                calls.push(Pair.of(v, succ.apply(nodes.get(v)).iterator()));
            }

            void strongConnect(int root) {
                Deque<Pair<Integer, Iterator<N>>> calls = new ArrayDeque<>();
                enter(root, calls);
                while (!calls.isEmpty()) {
                    Pair<Integer, Iterator<N>> top = calls.peek();
                    int v = top.left;
                    if (top.right.hasNext()) {
                        Integer w = position.get(top.right.next());
                        if (w == null) continue;
                        if (index[w] == 0) {
                            enter(w, calls);
                        } else if (onStack[w]) {
                            low[v] = Math.min(low[v], index[w]);
                        }
                        continue;
                    }
                    calls.pop();
                    if (low[v] == index[v]) emit(v);
                    if (!calls.isEmpty()) {
                        int caller = calls.peek().left;
                        low[caller] = Math.min(low[caller], low[v]);
                    }
                }
            }

            void emit(int v) {
                List<Integer> members = new ArrayList<>();
                int w;
                do {
                    w = stack.pop();
                    onStack[w] = false;
                    members.add(w);
                } while (w != v);
                Collections.sort(members);
                List<N> component = new ArrayList<>();
                for (int m : members) component.add(nodes.get(m));
                out.add(component);
            }
        }
        Runner r = new Runner();
        for (int v = 0; v < nodes.size(); v++) {
            if (r.index[v] == 0) r.strongConnect(v);
        }
        return r.out;
    }
}
