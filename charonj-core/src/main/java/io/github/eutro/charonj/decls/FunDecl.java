package io.github.eutro.charonj.decls;

import io.github.eutro.charonj.llbc.LlbcBody;
import io.github.eutro.charonj.names.Name;
import io.github.eutro.charonj.types.Ty;
import io.github.eutro.charonj.ullbc.UllbcBody;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.Objects;

public final class FunDecl extends Declaration implements BodyOwner {
    public FunSig sig = new FunSig(false, Collections.emptyList(), Ty.UNIT);
    public FunKind kind = FunKind.REGULAR;
    public @Nullable UllbcBody body;
    public @Nullable LlbcBody llbcBody;

    public FunDecl(DeclId id, Name name) {
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
        FunDecl that = (FunDecl) o;
        return commonEquals(that)
                && sig.equals(that.sig)
                && kind.equals(that.kind)
                && Objects.equals(body, that.body)
                && Objects.equals(llbcBody, that.llbcBody);
    }
}
