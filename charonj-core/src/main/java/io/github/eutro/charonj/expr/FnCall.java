package io.github.eutro.charonj.expr;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A function call: callee, arguments and the place the result is written to.
 */
public final class FnCall {
    public final FnPtr func;
    public final List<Operand> args;
    public final Place dest;

    public FnCall(FnPtr func, List<Operand> args, Place dest) {
        this.func = func;
        this.args = Collections.unmodifiableList(new ArrayList<>(args));
        this.dest = dest;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FnCall fnCall = (FnCall) o;
        return func.equals(fnCall.func) && args.equals(fnCall.args) && dest.equals(fnCall.dest);
    }

    @Override
    public int hashCode() {
        return Objects.hash(func, args, dest);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder().append(dest).append(" := ").append(func).append("(");
        for (int i = 0; i < args.size(); i++) {
            if (i != 0) sb.append(", ");
            sb.append(args.get(i));
        }
        return sb.append(")").toString();
    }
}
