package io.github.eutro.charonj.util;

import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * The natural loops of a graph, and its irreducible regions.
 * <p>
 * An edge {@code n -> h} is a back edge iff {@code h} dominates {@code n}. The loop of a header {@code h}
 * is the union, over its back edges {@code n -> h}, of the nodes that reach {@code n} without passing
 * through {@code h}, and {@code h} itself. Loops with distinct headers are either disjoint or nested.
 * <p>
 * An irreducible region is a strongly connected component, of more than one node,
 * of the graph with its back edges removed. A graph is reducible iff it has no such regions.
 * <p>
 * Only nodes reachable from the entry are considered. All lists are in reverse post-order.
 *
 * @param <N> The type of a node.
 */
public final class LoopForest<N> {
    private final List<N> rpo;
    private final Map<N, Integer> rpoIndex;
    private final Set<Pair<N, N>> backEdges;
    private final Map<N, Set<N>> bodies;
    private final Map<N, N> parents;
    private final Map<N, N> innermost;
    private final List<List<N>> regions;
    private final Map<N, List<N>> regionOf;

    private LoopForest(List<N> rpo,
                       Map<N, Integer> rpoIndex,
                       Set<Pair<N, N>> backEdges,
                       Map<N, Set<N>> bodies,
                       Map<N, N> parents,
                       Map<N, N> innermost,
                       List<List<N>> regions,
                       Map<N, List<N>> regionOf) {
        this.rpo = rpo;
        this.rpoIndex = rpoIndex;
        this.backEdges = backEdges;
        this.bodies = bodies;
        this.parents = parents;
        this.innermost = innermost;
        this.regions = regions;
        this.regionOf = regionOf;
    }

    /**
     * Compute the loop forest of a graph.
     *
     * @param graph The graph.
     * @param doms  The dominator tree of the graph.
     * @param <N>   The type of a node.
     * @return The loop forest.
     */
    public static <N> LoopForest<N> compute(Graph<N> graph, Dominators<N> doms) {
        List<N> rpo = doms.reachable();
        Map<N, Integer> rpoIndex = new HashMap<>();
        for (N n : rpo) rpoIndex.put(n, rpoIndex.size());

        Map<N, List<N>> preds = new HashMap<>();
        for (N n : rpo) preds.put(n, new ArrayList<>());
        Set<Pair<N, N>> backEdges = new HashSet<>();
        Map<N, List<N>> latches = new LinkedHashMap<>();
        for (N n : rpo) {
            for (N s : graph.successors(n)) {
                preds.get(s).add(n);
                if (doms.dominates(s, n)) {
                    backEdges.add(Pair.of(n, s));
                    latches.computeIfAbsent(s, k -> new ArrayList<>()).add(n);
                }
            }
        }

        Comparator<N> byRpo = Comparator.comparing(rpoIndex::get);
        List<N> headers = new ArrayList<>(latches.keySet());
        headers.sort(byRpo);

        Map<N, Set<N>> bodies = new LinkedHashMap<>();
        for (N h : headers) {
            Set<N> body = new HashSet<>();
            body.add(h);
            Deque<N> work = new ArrayDeque<>();
            for (N latch : latches.get(h)) {
                if (body.add(latch)) work.push(latch);
            }
            while (!work.isEmpty()) {
                N n = work.pop();
                for (N p : preds.get(n)) {
                    if (body.add(p)) work.push(p);
                }
            }
            List<N> sorted = new ArrayList<>(body);
            sorted.sort(byRpo);
            bodies.put(h, Collections.unmodifiableSet(new LinkedHashSet<>(sorted)));
        }

        // largest loops first, so inner loops overwrite outer ones
        List<N> bySize = new ArrayList<>(headers);
        bySize.sort(Comparator.<N>comparingInt(h -> -bodies.get(h).size()).thenComparing(byRpo));
        Map<N, N> innermost = new HashMap<>();
        Map<N, N> parents = new HashMap<>();
        for (N h : bySize) {
            N enclosing = innermost.get(h);
            if (enclosing != null) parents.put(h, enclosing);
            for (N n : bodies.get(h)) innermost.put(n, h);
        }

        List<List<N>> components = StronglyConnected.compute(rpo, n -> {
            List<N> succs = new ArrayList<>();
            for (N s : graph.successors(n)) {
                if (!backEdges.contains(Pair.of(n, s))) succs.add(s);
            }
            return succs;
        });
        List<List<N>> regions = new ArrayList<>();
        for (List<N> component : components) {
            if (component.size() > 1) regions.add(Collections.unmodifiableList(component));
        }
        regions.sort(Comparator.comparing(r -> rpoIndex.get(r.get(0))));
        Map<N, List<N>> regionOf = new HashMap<>();
        for (List<N> region : regions) {
            for (N n : region) regionOf.put(n, region);
        }

        return new LoopForest<>(
                Collections.unmodifiableList(rpo),
                rpoIndex,
                backEdges,
                bodies,
                parents,
                innermost,
                Collections.unmodifiableList(regions),
                regionOf
        );
    }

    /**
     * Get the reachable nodes in reverse post-order.
     *
     * @return The nodes.
     */
    public List<N> reversePostOrder() {
        return rpo;
    }

    /**
     * Get the position of a node in reverse post-order.
     *
     * @param node The node.
     * @return Its position, or {@link Integer#MAX_VALUE} if it is unreachable.
     */
    public int rpoIndex(N node) {
        Integer i = rpoIndex.get(node);
        return i == null ? Integer.MAX_VALUE : i;
    }

    public boolean isBackEdge(N from, N to) {
        return backEdges.contains(Pair.of(from, to));
    }

    /**
     * Get the loop headers, outer loops before the loops they contain.
     *
     * @return The headers.
     */
    public List<N> headers() {
        return new ArrayList<>(bodies.keySet());
    }

    public boolean isHeader(N node) {
        return bodies.containsKey(node);
    }

    /**
     * Get the body of the loop with the given header.
     *
     * @param header The header.
     * @return The body, including the header, or an empty set if it is not a header.
     */
    public Set<N> body(N header) {
        Set<N> body = bodies.get(header);
        return body == null ? Collections.emptySet() : body;
    }

    /**
     * Get the header of the loop immediately enclosing the loop of {@code header}.
     *
     * @param header The header.
     * @return The enclosing header, or null for an outermost loop.
     */
    public @Nullable N parent(N header) {
        return parents.get(header);
    }

    /**
     * Get the header of the innermost loop containing a node. For a header this is the node itself.
     *
     * @param node The node.
     * @return The innermost header, or null if the node is in no loop.
     */
    public @Nullable N innermost(N node) {
        return innermost.get(node);
    }

    /**
     * Get the loop a node is considered to be at the level of: the innermost loop containing it,
     * except that a header is at the level of the loop enclosing its own.
     *
     * @param node The node.
     * @return The header of that loop, or null for the top level.
     */
    public @Nullable N level(N node) {
        N inner = innermost.get(node);
        if (inner != null && inner.equals(node)) return parents.get(node);
        return inner;
    }

    /**
     * Get the number of loops containing a node.
     *
     * @param node The node.
     * @return The depth, 0 outside of any loop.
     */
    public int depth(N node) {
        int depth = 0;
        N h = innermost.get(node);
        while (h != null) {
            depth++;
            h = parents.get(h);
        }
        return depth;
    }

    /**
     * Get the irreducible regions, ordered by their first node.
     *
     * @return The regions.
     */
    public List<List<N>> irreducibleRegions() {
        return regions;
    }

    public @Nullable List<N> regionOf(N node) {
        return regionOf.get(node);
    }

    public boolean isReducible() {
        return regions.isEmpty();
    }
}
