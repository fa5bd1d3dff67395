package io.github.eutro.charonj.types;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The generic arguments an item is instantiated with.
 */
public final class GenericArgs {
    public static final GenericArgs EMPTY = new GenericArgs(
            Collections.emptyList(),
            Collections.emptyList(),
            Collections.emptyList(),
            Collections.emptyList());

    public final List<Region> regions;
    public final List<Ty> types;
    public final List<ConstGeneric> constGenerics;
    /**
     * One reference per where-clause of the instantiated item, in clause order.
     */
    public final List<TraitRef> traitRefs;

    public GenericArgs(List<Region> regions, List<Ty> types, List<ConstGeneric> constGenerics, List<TraitRef> traitRefs) {
        this.regions = Collections.unmodifiableList(new ArrayList<>(regions));
        this.types = Collections.unmodifiableList(new ArrayList<>(types));
        this.constGenerics = Collections.unmodifiableList(new ArrayList<>(constGenerics));
        this.traitRefs = Collections.unmodifiableList(new ArrayList<>(traitRefs));
    }

    public static GenericArgs ofTypes(List<Ty> types) {
        return new GenericArgs(Collections.emptyList(), types, Collections.emptyList(), Collections.emptyList());
    }

    public GenericArgs withTraitRefs(List<TraitRef> traitRefs) {
        return new GenericArgs(regions, types, constGenerics, traitRefs);
    }

    public boolean isEmpty() {
        return regions.isEmpty() && types.isEmpty() && constGenerics.isEmpty() && traitRefs.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        GenericArgs that = (GenericArgs) o;
        return regions.equals(that.regions)
                && types.equals(that.types)
                && constGenerics.equals(that.constGenerics)
                && traitRefs.equals(that.traitRefs);
    }

    @Override
    public int hashCode() {
        return Objects.hash(regions, types, constGenerics, traitRefs);
    }

    @Override
    public String toString() {
        if (regions.isEmpty() && types.isEmpty() && constGenerics.isEmpty()) return "";
        List<Object> all = new ArrayList<>();
        all.addAll(regions);
        all.addAll(types);
        all.addAll(constGenerics);
        StringBuilder sb = new StringBuilder("<");
        for (int i = 0; i < all.size(); i++) {
            if (i != 0) sb.append(", ");
            sb.append(all.get(i));
        }
        return sb.append(">").toString();
    }
}
