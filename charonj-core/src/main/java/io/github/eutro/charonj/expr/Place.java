package io.github.eutro.charonj.expr;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A memory location: a local, followed by projections.
 */
public final class Place {
    public final int local;
    public final List<ProjectionElem> projection;

    public Place(int local, List<ProjectionElem> projection) {
        this.local = local;
        this.projection = Collections.unmodifiableList(new ArrayList<>(projection));
    }

    public static Place local(int local) {
        return new Place(local, Collections.emptyList());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Place place = (Place) o;
        return local == place.local && projection.equals(place.projection);
    }

    @Override
    public int hashCode() {
        return Objects.hash(local, projection);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("_").append(local);
        for (ProjectionElem elem : projection) {
            if (elem.kind == ProjectionElem.Kind.DEREF) {
                sb.insert(0, "(*").append(")");
            } else {
                sb.append(elem);
            }
        }
        return sb.toString();
    }
}
