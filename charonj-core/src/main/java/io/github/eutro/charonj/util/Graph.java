package io.github.eutro.charonj.util;

import java.util.List;

/**
 * A minimal directed graph: a node set and a successor lookup.
 * <p>
 * The graph algorithms in this package only ever see a graph through this interface,
 * so they can be run on hand-built graphs as well as on function bodies.
 * All orders derived from a graph follow the order of {@link #nodes()} and {@link #successors(Object)},
 * so implementations must return those in a deterministic order.
 *
 * @param <N> The type of a node.
 */
public interface Graph<N> {
    /**
     * Get the entry node of the graph.
     *
     * @return The entry node.
     */
    N entry();

    /**
     * Get all nodes of the graph, in a canonical order.
     *
     * @return The nodes.
     */
    List<N> nodes();

    /**
     * Get the successors of a node, in a canonical order.
     *
     * @param node The node.
     * @return Its successors.
     */
    List<N> successors(N node);
}
