package io.github.eutro.charonj.decls;

import io.github.eutro.charonj.llbc.LlbcBody;
import io.github.eutro.charonj.ullbc.UllbcBody;
import org.jetbrains.annotations.Nullable;

/**
 * A declaration that may carry a body: a function, or the initializer of a global.
 */
public interface BodyOwner {
    Declaration getDeclaration();

    @Nullable UllbcBody getBody();

    void setBody(@Nullable UllbcBody body);

    @Nullable LlbcBody getLlbcBody();

    void setLlbcBody(@Nullable LlbcBody body);
}
