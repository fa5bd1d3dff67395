package io.github.eutro.charonj.types;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The generic parameters of a declaration. Every index here is local to the declaration.
 */
public final class GenericParams {
    public static final GenericParams EMPTY = new GenericParams(
            Collections.emptyList(),
            Collections.emptyList(),
            Collections.emptyList(),
            Collections.emptyList());

    public final List<Param> regions;
    public final List<Param> types;
    public final List<ConstParam> constGenerics;
    /**
     * The where-clauses, which callers must discharge.
     */
    public final List<TraitClause> traitClauses;

    public GenericParams(List<Param> regions, List<Param> types, List<ConstParam> constGenerics, List<TraitClause> traitClauses) {
        this.regions = Collections.unmodifiableList(new ArrayList<>(regions));
        this.types = Collections.unmodifiableList(new ArrayList<>(types));
        this.constGenerics = Collections.unmodifiableList(new ArrayList<>(constGenerics));
        this.traitClauses = Collections.unmodifiableList(new ArrayList<>(traitClauses));
    }

    public GenericParams withTraitClauses(List<TraitClause> clauses) {
        return new GenericParams(regions, types, constGenerics, clauses);
    }

    /**
     * A region or type parameter.
     */
    public static final class Param {
        public final int index;
        public final String name;

        public Param(int index, String name) {
            this.index = index;
            this.name = name;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Param param = (Param) o;
            return index == param.index && name.equals(param.name);
        }

        @Override
        public int hashCode() {
            return Objects.hash(index, name);
        }

        @Override
        public String toString() {
            return name;
        }
    }

    public static final class ConstParam {
        public final int index;
        public final String name;
        public final LiteralTy ty;

        public ConstParam(int index, String name, LiteralTy ty) {
            this.index = index;
            this.name = name;
            this.ty = ty;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            ConstParam that = (ConstParam) o;
            return index == that.index && name.equals(that.name) && ty == that.ty;
        }

        @Override
        public int hashCode() {
            return Objects.hash(index, name, ty);
        }

        @Override
        public String toString() {
            return "const " + name + ": " + ty.text;
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        GenericParams that = (GenericParams) o;
        return regions.equals(that.regions)
                && types.equals(that.types)
                && constGenerics.equals(that.constGenerics)
                && traitClauses.equals(that.traitClauses);
    }

    @Override
    public int hashCode() {
        return Objects.hash(regions, types, constGenerics, traitClauses);
    }
}
