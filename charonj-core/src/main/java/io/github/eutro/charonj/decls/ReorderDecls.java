package io.github.eutro.charonj.decls;

import io.github.eutro.charonj.util.StronglyConnected;

import java.util.*;

/**
 * Orders the declarations of a crate into {@link DeclarationGroup}s,
 * such that every group comes after the groups it refers to.
 */
public final class ReorderDecls {
    private ReorderDecls() {
    }

    /**
     * Compute the declaration groups of a table.
     * <p>
     * Groups are the strongly connected components of the reference graph. The order is a pure
     * function of the table: ties are broken by the position of declarations in {@link DeclTable#getAll()}.
     *
     * @param table The table.
     * @return The groups, dependencies first.
     */
    public static List<DeclarationGroup> compute(DeclTable table) {
        List<DeclId> nodes = new ArrayList<>();
        Map<DeclId, Set<DeclId>> refs = new HashMap<>();
        for (Declaration decl : table.getAll()) {
            nodes.add(decl.id);
            refs.put(decl.id, ReferenceCollector.collect(decl));
        }

        List<DeclarationGroup> groups = new ArrayList<>();
        for (List<DeclId> component : StronglyConnected.compute(nodes, refs::get)) {
            DeclId first = component.get(0);
            boolean recursive = component.size() > 1 || refs.get(first).contains(first);
            DeclarationGroup.Kind kind = groupKind(first.kind);
            for (DeclId id : component) {
                if (id.kind != first.kind) {
                    kind = DeclarationGroup.Kind.MIXED;
                    break;
                }
            }
            groups.add(new DeclarationGroup(kind, recursive, component));
        }
        return groups;
    }

    private static DeclarationGroup.Kind groupKind(DeclId.Kind kind) {
        return DeclarationGroup.Kind.valueOf(kind.name());
    }
}
