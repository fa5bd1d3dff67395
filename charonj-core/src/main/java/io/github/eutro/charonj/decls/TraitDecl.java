package io.github.eutro.charonj.decls;

import io.github.eutro.charonj.names.Name;
import io.github.eutro.charonj.types.TraitClause;
import io.github.eutro.charonj.types.Ty;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A trait declaration. Type parameter 0 of its generics is {@code Self}.
 */
public final class TraitDecl extends Declaration {
    /**
     * The clauses on {@code Self} the trait requires, e.g. {@code Ord: Eq}.
     */
    public List<TraitClause> parentClauses = new ArrayList<>();
    public List<String> assocTypes = new ArrayList<>();
    public List<AssocConst> consts = new ArrayList<>();
    public List<Method> methods = new ArrayList<>();
    /**
     * Whether the trait may be satisfied without an implementation in the crate.
     */
    public boolean builtin = false;

    public TraitDecl(DeclId id, Name name) {
        super(id, name);
    }

    public @Nullable Method getMethod(String name) {
        for (Method method : methods) {
            if (method.name.equals(name)) return method;
        }
        return null;
    }

    public static final class AssocConst {
        public final String name;
        public final Ty ty;
        /**
         * The global holding the default value, if the trait provides one.
         */
        public final @Nullable DeclId defaultValue;

        public AssocConst(String name, Ty ty, @Nullable DeclId defaultValue) {
            this.name = name;
            this.ty = ty;
            this.defaultValue = defaultValue;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            AssocConst that = (AssocConst) o;
            return name.equals(that.name) && ty.equals(that.ty) && Objects.equals(defaultValue, that.defaultValue);
        }

        @Override
        public int hashCode() {
            return Objects.hash(name, ty, defaultValue);
        }
    }

    public static final class Method {
        public final String name;
        /**
         * The function declaring the method.
         */
        public final @Nullable DeclId fun;
        public final boolean provided;

        public Method(String name, @Nullable DeclId fun, boolean provided) {
            this.name = name;
            this.fun = fun;
            this.provided = provided;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Method method = (Method) o;
            return provided == method.provided && name.equals(method.name) && Objects.equals(fun, method.fun);
        }

        @Override
        public int hashCode() {
            return Objects.hash(name, fun, provided);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TraitDecl that = (TraitDecl) o;
        return commonEquals(that)
                && builtin == that.builtin
                && parentClauses.equals(that.parentClauses)
                && assocTypes.equals(that.assocTypes)
                && consts.equals(that.consts)
                && methods.equals(that.methods);
    }
}
