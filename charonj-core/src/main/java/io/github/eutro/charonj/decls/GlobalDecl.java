package io.github.eutro.charonj.decls;

import io.github.eutro.charonj.llbc.LlbcBody;
import io.github.eutro.charonj.names.Name;
import io.github.eutro.charonj.types.Ty;
import io.github.eutro.charonj.ullbc.UllbcBody;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * A global: a constant or static, with the body that computes its value.
 */
public final class GlobalDecl extends Declaration implements BodyOwner {
    public Ty ty = Ty.UNIT;
    public @Nullable UllbcBody body;
    public @Nullable LlbcBody llbcBody;

    public GlobalDecl(DeclId id, Name name) {
        super(id, name);
    }

    @Override
    public Declaration getDeclaration() {
        return this;
    }

    @Override
    public @Nullable UllbcBody getBody() {
        return body;
    }

    @Override
    public void setBody(@Nullable UllbcBody body) {
        this.body = body;
    }

    @Override
    public @Nullable LlbcBody getLlbcBody() {
        return llbcBody;
    }

    @Override
    public void setLlbcBody(@Nullable LlbcBody body) {
        this.llbcBody = body;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        GlobalDecl that = (GlobalDecl) o;
        return commonEquals(that)
                && ty.equals(that.ty)
                && Objects.equals(body, that.body)
                && Objects.equals(llbcBody, that.llbcBody);
    }
}
