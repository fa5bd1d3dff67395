package io.github.eutro.charonj.ullbc;

import io.github.eutro.charonj.expr.Local;
import io.github.eutro.charonj.ext.CommonExts;
import io.github.eutro.charonj.ext.Ext;
import io.github.eutro.charonj.ext.ExtHolder;
import io.github.eutro.charonj.ext.MetadataState;
import io.github.eutro.charonj.util.Graph;
import org.jetbrains.annotations.Nullable;

import java.util.AbstractList;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * An unstructured function body: locals, and a control-flow graph of {@link BasicBlock}s.
 * <p>
 * Block 0 is the entry. Local 0 is the return place, locals {@code 1..argCount} are the arguments.
 */
public class UllbcBody extends ExtHolder {
    public final List<Local> locals;
    public final int argCount;
    public final List<BasicBlock> blocks;

    public UllbcBody(List<Local> locals, int argCount, List<BasicBlock> blocks) {
        this.locals = new ArrayList<>(locals);
        this.argCount = argCount;
        this.blocks = new ArrayList<>(blocks);
    }

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        T value = super.getNullable(ext);
        if (value == null && ext == CommonExts.METADATA_STATE) {
            // bodies read back from the exported form have no exts yet
            MetadataState ms = new MetadataState();
            attachExt(CommonExts.METADATA_STATE, ms);
            return (T) ms;
        }
        return value;
    }

    /**
     * Get a view of this body as a graph over block indices, for structuring.
     * Unwind edges are not part of this graph.
     *
     * @return The graph.
     */
    public Graph<Integer> asGraph() {
        return graph(false);
    }

    /**
     * Get a view of this body as a graph over block indices, including unwind edges.
     *
     * @return The graph.
     */
    public Graph<Integer> asFullGraph() {
        return graph(true);
    }

    private Graph<Integer> graph(boolean withUnwind) {
        return new Graph<Integer>() {
            @Override
            public Integer entry() {
                return 0;
            }

            @Override
            public List<Integer> nodes() {
                return new AbstractList<Integer>() {
                    @Override
                    public Integer get(int index) {
                        return index;
                    }

                    @Override
                    public int size() {
                        return blocks.size();
                    }
                };
            }

            @Override
            public List<Integer> successors(Integer node) {
                Terminator terminator = blocks.get(node).getTerminator();
                return withUnwind ? terminator.allTargets() : terminator.targets();
            }
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        UllbcBody that = (UllbcBody) o;
        return argCount == that.argCount && locals.equals(that.locals) && blocks.equals(that.blocks);
    }

    @Override
    public int hashCode() {
        return Objects.hash(locals, argCount, blocks);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Local local : locals) {
            sb.append("let ").append(local).append(";\n");
        }
        for (int i = 0; i < blocks.size(); i++) {
            sb.append("bb").append(i).append(": ").append(blocks.get(i)).append("\n");
        }
        return sb.toString();
    }
}
