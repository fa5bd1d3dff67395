package io.github.eutro.charonj.util;

import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * The dominator tree of a {@link Graph}, rooted at its entry.
 * <p>
 * Only nodes reachable from the entry are part of the tree.
 */
/*
 Thomas Lengauer and Robert Endre Tarjan. A fast algorithm for finding dominators in a flow-graph.
 ACM Transactions on Programming Languages and Systems, 1(1):121-141, July 1979.
*/
public final class Dominators<N> {
    private final List<N> order; // reverse post-order, [0] is the entry
    private final Map<N, Integer> index;
    private final int[] idom; // indices into order, -1 for the entry
    // pre- and post-order numbers in the dominator tree; a dominates b iff b's interval is inside a's
    private final int[] enter, exit;

    private Dominators(List<N> order, Map<N, Integer> index, int[] idom) {
        this.order = order;
        this.index = index;
        this.idom = idom;
        this.enter = new int[idom.length];
        this.exit = new int[idom.length];
        number();
    }

    private void number() {
        int count = idom.length;
        if (count == 0) return;
        List<List<Integer>> children = new ArrayList<>(count);
        for (int i = 0; i < count; i++) children.add(new ArrayList<>());
        for (int i = 1; i < count; i++) children.get(idom[i]).add(i);
        int clock = 0;
        int[] stack = new int[count];
        int[] next = new int[count];
        int depth = 0;
        enter[0] = clock++;
        stack[depth++] = 0;
        while (depth > 0) {
            int v = stack[depth - 1];
            List<Integer> cs = children.get(v);
            if (next[v] == cs.size()) {
                exit[v] = clock++;
                depth--;
                continue;
            }
            int c = cs.get(next[v]++);
            enter[c] = clock++;
            stack[depth++] = c;
        }
    }

    /**
     * Compute the dominator tree of a graph.
     *
     * @param graph The graph.
     * @param <N>   The type of a node.
     * @return The dominator tree.
     */
    public static <N> Dominators<N> compute(Graph<N> graph) {
        List<N> order = new ArrayList<>();
        Map<N, Integer> index = new HashMap<>();
        // numbering is 1-based below, 0 is the sentinel "no vertex"

        class Runner {
            int n;
            int[][] succ;
            int[] dom, parent, ancestor, child, vertex, label, semi, size;
            List<List<Integer>> pred, bucket;

            int number(N node) {
                Integer i = index.get(node);
                if (i != null) return i + 1;
                index.put(node, order.size());
                order.add(node);
                return order.size();
            }

            void collect() {
                // number nodes in reverse post-order, so the entry is 1
                for (N node : GraphWalker.of(graph).reversePostOrder()) {
                    number(node);
                }
                succ = new int[order.size() + 1][];
                for (int i = 0; i < order.size(); i++) {
                    List<N> succs = graph.successors(order.get(i));
                    int[] s = new int[succs.size()];
                    for (int j = 0; j < s.length; j++) {
                        s[j] = index.get(succs.get(j)) + 1;
                    }
                    succ[i + 1] = s;
                }
            }

            void visit(int v) {
                semi[v] = ++n;
                vertex[n] = label[v] = v;
                ancestor[v] = child[v] = 0;
                size[v] = 1;
            }

            void dfs(int root) {
                int[] stack = new int[succ.length];
                int[] next = new int[succ.length];
                int depth = 0;
                visit(root);
                stack[depth++] = root;
                while (depth > 0) {
                    int v = stack[depth - 1];
                    if (next[v] == succ[v].length) {
                        depth--;
                        continue;
                    }
                    int w = succ[v][next[v]++];
                    if (semi[w] == 0) {
                        parent[w] = v;
                        visit(w);
                        stack[depth++] = w;
                    }
                    pred.get(w).add(v);
                }
            }

            void compress(int v) {
                // the chain of ancestors to compress, root-most last
                List<Integer> path = new ArrayList<>();
                for (int u = v; ancestor[ancestor[u]] != 0; u = ancestor[u]) {
                    path.add(u);
                }
                for (int i = path.size() - 1; i >= 0; i--) {
                    int u = path.get(i);
                    if (semi[label[ancestor[u]]] < semi[label[u]]) {
                        label[u] = label[ancestor[u]];
                    }
                    ancestor[u] = ancestor[ancestor[u]];
                }
            }

            int eval(int v) {
                if (ancestor[v] == 0) {
                    return label[v];
                } else {
                    compress(v);
                    return semi[label[ancestor[v]]] >= semi[label[v]]
                            ? label[v]
                            : label[ancestor[v]];
                }
            }

            void link(int v, int w) {
                int s = w;
                while (semi[label[w]] < semi[label[child[s]]]) {
                    if (size[s] + size[child[child[s]]] >= 2 * size[child[s]]) {
                        ancestor[child[s]] = s;
                        child[s] = child[child[s]];
                    } else {
                        size[child[s]] = size[s];
                        s = ancestor[s] = child[s];
                    }
                }
                label[s] = label[w];
                size[v] += size[w];
                if (size[v] < 2 * size[w]) {
                    int t = s;
                    s = child[v];
                    child[v] = t;
                }
                while (s != 0) {
                    ancestor[s] = v;
                    s = child[s];
                }
            }

            int[] run() {
                collect();
                int count = order.size();
                dom = new int[count + 1];
                parent = new int[count + 1];
                ancestor = new int[count + 1];
                child = new int[count + 1];
                vertex = new int[count + 1];
                label = new int[count + 1];
                semi = new int[count + 1];
                size = new int[count + 1];
                pred = new ArrayList<>();
                bucket = new ArrayList<>();
                for (int v = 0; v <= count; ++v) {
                    pred.add(new ArrayList<>());
                    bucket.add(new ArrayList<>());
                }
                n = 0;
                dfs(1);
                size[0] = label[0] = semi[0] = 0;
                int u, w;
                for (int i = n; i >= 2; i--) {
                    w = vertex[i];
                    for (int v : pred.get(w)) {
                        u = eval(v);
                        if (semi[u] < semi[w]) {
                            semi[w] = semi[u];
                        }
                    }
                    bucket.get(vertex[semi[w]]).add(w);
                    link(parent[w], w);
                    for (int v : bucket.get(parent[w])) {
                        u = eval(v);
                        dom[v] = semi[u] < semi[v] ? u : parent[w];
                    }
                    bucket.get(parent[w]).clear();
                }
                for (int i = 2; i <= n; ++i) {
                    w = vertex[i];
                    if (dom[w] != vertex[semi[w]]) {
                        dom[w] = dom[dom[w]];
                    }
                }
                dom[1] = 0;

                int[] idom = new int[count];
                for (int i = 0; i < count; i++) {
                    idom[i] = dom[i + 1] - 1;
                }
                return idom;
            }
        }
        int[] idom = new Runner().run();
        return new Dominators<>(order, index, idom);
    }

    /**
     * Get the nodes reachable from the entry, in the canonical order used for numbering.
     *
     * @return The nodes.
     */
    public List<N> reachable() {
        return Collections.unmodifiableList(order);
    }

    /**
     * Get whether the node is reachable from the entry.
     *
     * @param node The node.
     * @return Whether it is reachable.
     */
    public boolean isReachable(N node) {
        return index.containsKey(node);
    }

    /**
     * Get the immediate dominator of a node.
     *
     * @param node The node.
     * @return Its immediate dominator, or null if it is the entry or unreachable.
     */
    public @Nullable N idom(N node) {
        Integer i = index.get(node);
        if (i == null || idom[i] < 0) return null;
        return order.get(idom[i]);
    }

    /**
     * Get whether {@code a} dominates {@code b}. Every node dominates itself.
     *
     * @param a The potential dominator.
     * @param b The potentially dominated node.
     * @return Whether {@code a} dominates {@code b}.
     */
    public boolean dominates(N a, N b) {
        Integer ai = index.get(a);
        Integer bi = index.get(b);
        if (ai == null || bi == null) return false;
        return enter[ai] <= enter[bi] && exit[bi] <= exit[ai];
    }
}
