package io.github.eutro.charonj.resolve;

import io.github.eutro.charonj.decls.Declaration;
import io.github.eutro.charonj.decls.DeclId;
import io.github.eutro.charonj.types.GenericParams;
import org.jetbrains.annotations.Nullable;

/**
 * The context an obligation is resolved in: the generics of the item it occurs in.
 * The type variables of the scope are rigid.
 */
public final class Scope {
    public final Declaration owner;
    public final GenericParams params;
    /**
     * The trait whose declaration the item belongs to, if any, making {@code Self: ThisTrait} hold.
     */
    public final @Nullable DeclId selfTrait;

    public Scope(Declaration owner, GenericParams params, @Nullable DeclId selfTrait) {
        this.owner = owner;
        this.params = params;
        this.selfTrait = selfTrait;
    }

    public static Scope of(Declaration owner) {
        return new Scope(owner, owner.generics, null);
    }
}
