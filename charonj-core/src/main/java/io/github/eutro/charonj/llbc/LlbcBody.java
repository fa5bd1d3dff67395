package io.github.eutro.charonj.llbc;

import io.github.eutro.charonj.expr.Local;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A structured function body.
 * <p>
 * The locals are those of the unstructured body it was built from, followed by any join flags
 * the structuring introduced.
 */
public final class LlbcBody {
    public final List<Local> locals;
    public final int argCount;
    public final Stmt.Sequence body;

    public LlbcBody(List<Local> locals, int argCount, Stmt.Sequence body) {
        this.locals = Collections.unmodifiableList(new ArrayList<>(locals));
        this.argCount = argCount;
        this.body = body;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        LlbcBody llbcBody = (LlbcBody) o;
        return argCount == llbcBody.argCount && locals.equals(llbcBody.locals) && body.equals(llbcBody.body);
    }

    @Override
    public int hashCode() {
        return Objects.hash(locals, argCount, body);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Local local : locals) {
            sb.append("let ").append(local).append(";\n");
        }
        return sb.append(body).toString();
    }
}
