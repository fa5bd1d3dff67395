package io.github.eutro.charonj.feed;

import com.google.gson.annotations.SerializedName;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * The import feed: a crate, as described by the host compiler adapter.
 * <p>
 * These classes mirror the JSON format field for field (with snake_case keys), and carry no behaviour;
 * {@link io.github.eutro.charonj.translate.Importer} gives them meaning. Items refer to each other by name.
 * Variant nodes (types, statements, rvalues, terminators, ...) are discriminated by their {@code kind}.
 */
public final class Feed {
    private Feed() {
    }

    public static class Crate {
        public String name;
        public List<Item> items = new ArrayList<>();
    }

    public static class Item {
        /**
         * One of {@code type}, {@code fun}, {@code global}, {@code trait_decl}, {@code trait_impl}.
         */
        public String kind;
        public String name;
        public boolean local = true;
        public boolean opaque = false;
        public Generics generics = new Generics();
        /**
         * The where-clauses of the item. The {@code Self} type comes first in the arguments of each.
         */
        public List<Clause> predicates = new ArrayList<>();
        /**
         * Further obligations the item must satisfy, to be resolved.
         */
        public List<Clause> obligations = new ArrayList<>();

        // type
        /**
         * One of {@code struct}, {@code enum}, {@code opaque}.
         */
        public @Nullable String adt;
        public List<Field> fields = new ArrayList<>();
        public List<Variant> variants = new ArrayList<>();

        // fun
        public List<Ty> inputs = new ArrayList<>();
        public @Nullable Ty output;
        public boolean unsafe = false;
        public @Nullable MethodOf methodOf;
        public @Nullable Body body;

        // global
        public @Nullable Ty ty;

        // trait_decl
        public List<Clause> parents = new ArrayList<>();
        public List<AssocType> assocTypes = new ArrayList<>();
        public List<AssocConst> consts = new ArrayList<>();
        public List<Method> methods = new ArrayList<>();
        public boolean builtin = false;

        // trait_impl
        /**
         * The implemented trait, {@code Self} first.
         */
        public @Nullable Clause trait;
    }

    public static class Generics {
        public List<String> regions = new ArrayList<>();
        public List<String> types = new ArrayList<>();
        public List<ConstParam> consts = new ArrayList<>();
    }

    public static class ConstParam {
        public String name;
        public String ty;
    }

    public static class Clause {
        public String trait;
        public List<Ty> args = new ArrayList<>();
        public List<ConstArg> constArgs = new ArrayList<>();
    }

    /**
     * A const generic argument: exactly one of {@code var}, {@code value} (with {@code ty}), or {@code global}.
     */
    public static class ConstArg {
        public @Nullable Integer var;
        public @Nullable String value;
        public @Nullable String ty;
        public @Nullable String global;
    }

    public static class Field {
        public @Nullable String name;
        public Ty ty;
    }

    public static class Variant {
        public String name;
        public List<Field> fields = new ArrayList<>();
        public @Nullable String discriminant;
        /**
         * The integer type of the discriminant, {@code isize} by default.
         */
        public @Nullable String discriminantTy;
    }

    /**
     * Marks a function as the method of a trait declaration or implementation.
     */
    public static class MethodOf {
        public @Nullable String trait;
        public @Nullable String impl;
        public String method;
        public boolean provided = false;
    }

    public static class AssocType {
        public String name;
        public @Nullable Ty ty;
    }

    public static class AssocConst {
        public String name;
        public @Nullable Ty ty;
        /**
         * The global holding the value.
         */
        public @Nullable String value;
    }

    public static class Method {
        public String name;
        public @Nullable String fun;
        public boolean provided = false;
    }

    /**
     * A type. {@code kind} is one of {@code adt}, {@code tuple}, {@code box}, {@code array}, {@code slice},
     * {@code str}, {@code var}, {@code never}, {@code ref}, {@code ptr}, {@code projection}, {@code fn},
     * or the name of a literal type ({@code bool}, {@code char}, {@code u8}, {@code isize}, ...).
     */
    public static class Ty {
        public String kind;
        public @Nullable String name;
        public List<Ty> args = new ArrayList<>();
        public List<ConstArg> constArgs = new ArrayList<>();
        public @Nullable Integer index;
        public @Nullable Ty ty;
        @SerializedName("mut")
        public boolean isMut = false;
        /**
         * {@code static}, {@code erased}, or the index of a region variable.
         */
        public @Nullable String region;
        public @Nullable Clause trait;
        public @Nullable String item;
        public List<Ty> inputs = new ArrayList<>();
        public @Nullable Ty output;
    }

    public static class Body {
        public List<Local> locals = new ArrayList<>();
        public int argCount;
        public List<Block> blocks = new ArrayList<>();
    }

    public static class Local {
        public @Nullable String name;
        public Ty ty;
    }

    public static class Block {
        public List<Statement> statements = new ArrayList<>();
        public @Nullable Terminator terminator;
    }

    public static class Place {
        public int local;
        public List<Projection> projection = new ArrayList<>();
    }

    /**
     * {@code deref}, {@code field} (of the type {@code adt}, or of a tuple), or {@code index} by a local.
     */
    public static class Projection {
        public String kind;
        public @Nullable String adt;
        public @Nullable Integer variant;
        public int field;
        public int local;
    }

    /**
     * {@code copy}, {@code move} or {@code const}.
     */
    public static class Operand {
        public String kind;
        public @Nullable Place place;
        public @Nullable Ty ty;
        public @Nullable String value;
    }

    /**
     * {@code use}, {@code ref}, {@code unop}, {@code binop}, {@code cast}, {@code discriminant},
     * {@code aggregate}, {@code global} or {@code len}.
     */
    public static class Rvalue {
        public String kind;
        public @Nullable Operand operand;
        public @Nullable Place place;
        public @Nullable String borrow;
        public @Nullable String op;
        public @Nullable Operand left;
        public @Nullable Operand right;
        public @Nullable Ty ty;
        public @Nullable String adt;
        /**
         * For aggregates, {@code adt}, {@code tuple} or {@code array}.
         */
        public @Nullable String aggregate;
        public @Nullable Integer variant;
        public List<Ty> args = new ArrayList<>();
        public List<Operand> operands = new ArrayList<>();
        public @Nullable String name;
    }

    /**
     * {@code assign}, {@code fake_read}, {@code set_discriminant}, {@code storage_live},
     * {@code storage_dead}, {@code deinit}, {@code drop} or {@code nop}.
     */
    public static class Statement {
        public String kind;
        public @Nullable Place place;
        public @Nullable Rvalue rvalue;
        public int variant;
        public int local;
    }

    /**
     * {@code goto}, {@code if}, {@code switch}, {@code return}, {@code abort}, {@code call} or {@code assert}.
     */
    public static class Terminator {
        public String kind;
        public int target;
        public @Nullable Operand discr;
        @SerializedName("then")
        public int thenTarget;
        @SerializedName("else")
        public int elseTarget;
        public @Nullable String intTy;
        public List<String> values = new ArrayList<>();
        public List<Integer> targets = new ArrayList<>();
        public @Nullable Integer otherwise;
        /**
         * {@code panic} or {@code undefined_behavior}.
         */
        public @Nullable String cause;
        public @Nullable Fn func;
        public List<Operand> args = new ArrayList<>();
        public @Nullable Place dest;
        public @Nullable Integer unwind;
        public @Nullable Operand cond;
        public boolean expected = true;
    }

    /**
     * A callee: {@code regular} (a function item, by {@code name}), {@code trait_method}
     * ({@code method} of {@code trait}), or {@code assumed} (a builtin, by {@code name}).
     */
    public static class Fn {
        public String kind;
        public @Nullable String name;
        public @Nullable Clause trait;
        public @Nullable String method;
        public List<Ty> args = new ArrayList<>();
        public List<ConstArg> constArgs = new ArrayList<>();
    }
}
