package io.github.eutro.charonj.translate;

import io.github.eutro.charonj.decls.DeclId;
import io.github.eutro.charonj.decls.MalformedFeedException;
import io.github.eutro.charonj.decls.TraitDecl;
import io.github.eutro.charonj.expr.*;
import io.github.eutro.charonj.feed.Feed;
import io.github.eutro.charonj.resolve.Scope;
import io.github.eutro.charonj.resolve.TraitResolver;
import io.github.eutro.charonj.types.*;
import io.github.eutro.charonj.ullbc.*;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

import static io.github.eutro.charonj.translate.TypeTranslator.required;

/**
 * Builds the {@link UllbcBody} of one item from its feed body.
 * <p>
 * Every block target and local is checked. Unreachable blocks are kept; the {@link Importer} removes them
 * once every item is imported.
 */
final class BodyBuilder {
    private final Importer importer;
    private final TypeTranslator types;
    private final TraitResolver resolver;
    private final Scope scope;
    private int localCount;
    private int blockCount;

    BodyBuilder(Importer importer, TypeTranslator types, TraitResolver resolver, Scope scope) {
        this.importer = importer;
        this.types = types;
        this.resolver = resolver;
        this.scope = scope;
    }

    /**
     * Build a body.
     *
     * @param body The feed body.
     * @return The body, with unreachable blocks removed.
     * @throws MalformedFeedException         If the body is structurally broken.
     * @throws UnsupportedConstructException If the body uses a construct that has no translation.
     */
    UllbcBody build(Feed.Body body) {
        if (body.locals.isEmpty()) throw malformed("body has no return place");
        if (body.argCount < 0 || body.argCount >= body.locals.size()) {
            throw malformed("argument count " + body.argCount + " out of range for " + body.locals.size() + " locals");
        }
        if (body.blocks.isEmpty()) throw malformed("body has no entry block");
        localCount = body.locals.size();
        blockCount = body.blocks.size();

        List<Local> locals = new ArrayList<>(localCount);
        for (Feed.Local local : body.locals) {
            locals.add(new Local(locals.size(), local.name, types.translate(local.ty, scope)));
        }
        List<BasicBlock> blocks = new ArrayList<>(blockCount);
        for (int i = 0; i < blockCount; i++) {
            Feed.Block block = body.blocks.get(i);
            List<Statement> stmts = new ArrayList<>(block.statements.size());
            for (Feed.Statement stmt : block.statements) {
                stmts.add(statement(stmt));
            }
            if (block.terminator == null) throw malformed("block " + i + " has no terminator");
            Terminator term = terminator(block.terminator);
            for (int target : term.allTargets()) {
                if (target < 0 || target >= blockCount) {
                    throw malformed("block " + i + " jumps to missing block " + target);
                }
            }
            blocks.add(new BasicBlock(stmts, term));
        }
        return new UllbcBody(locals, body.argCount, blocks);
    }

    private MalformedFeedException malformed(String message) {
        return new MalformedFeedException(message + ", in " + scope.owner);
    }

    private UnsupportedConstructException unsupported(String what, String kind) {
        return new UnsupportedConstructException("unsupported " + what + " '" + kind + "'");
    }

    private int local(int local) {
        if (local < 0 || local >= localCount) throw malformed("local " + local + " out of range");
        return local;
    }

    private Place place(@Nullable Feed.Place place) {
        if (place == null) throw malformed("missing place");
        List<ProjectionElem> projection = new ArrayList<>(place.projection.size());
        for (Feed.Projection elem : place.projection) {
            switch (required(elem.kind, "projection kind", scope)) {
                case "deref":
                    projection.add(ProjectionElem.DEREF);
                    break;
                case "field":
                    projection.add(ProjectionElem.field(
                            elem.adt == null ? null : importer.ref(elem.adt, DeclId.Kind.TYPE),
                            elem.variant,
                            elem.field));
                    break;
                case "index":
                    projection.add(ProjectionElem.index(local(elem.local)));
                    break;
                default:
                    throw unsupported("projection", elem.kind);
            }
        }
        return new Place(local(place.local), projection);
    }

    private Operand operand(@Nullable Feed.Operand op) {
        if (op == null) throw malformed("missing operand");
        switch (required(op.kind, "operand kind", scope)) {
            case "copy":
                return Operand.copy(place(op.place));
            case "move":
                return Operand.move(place(op.place));
            case "const": {
                Ty ty = types.translate(op.ty, scope);
                if (op.value == null) return Operand.constant(ty, null);
                if (!(ty instanceof Ty.Literal)) throw malformed("literal value for non-literal type " + ty);
                return Operand.constant(ty, types.literal(((Ty.Literal) ty).ty, op.value, scope));
            }
            default:
                throw unsupported("operand", op.kind);
        }
    }

    private List<Operand> operands(List<Feed.Operand> ops) {
        List<Operand> out = new ArrayList<>(ops.size());
        for (Feed.Operand op : ops) {
            out.add(operand(op));
        }
        return out;
    }

    private Rvalue rvalue(@Nullable Feed.Rvalue rv) {
        if (rv == null) throw malformed("missing rvalue");
        switch (required(rv.kind, "rvalue kind", scope)) {
            case "use":
                return new Rvalue.Use(operand(rv.operand));
            case "ref":
                return new Rvalue.Ref(place(rv.place), borrow(rv.borrow));
            case "unop": {
                String op = required(rv.op, "unary operator", scope);
                if (op.equals("not")) return new Rvalue.UnaryOp(UnOp.NOT, operand(rv.operand));
                if (op.equals("neg")) return new Rvalue.UnaryOp(UnOp.NEG, operand(rv.operand));
                throw unsupported("unary operator", op);
            }
            case "binop": {
                String name = required(rv.op, "binary operator", scope);
                BinOp op = BinOp.fromFeedName(name);
                if (op == null) throw unsupported("binary operator", name);
                return new Rvalue.BinaryOp(op, operand(rv.left), operand(rv.right));
            }
            case "cast":
                return new Rvalue.Cast(operand(rv.operand), types.translate(rv.ty, scope));
            case "discriminant":
                return new Rvalue.Discriminant(place(rv.place),
                        importer.ref(required(rv.adt, "discriminant adt", scope), DeclId.Kind.TYPE));
            case "aggregate":
                return new Rvalue.Aggregate(aggregate(rv), operands(rv.operands));
            case "global":
                return new Rvalue.Global(
                        importer.ref(required(rv.name, "global name", scope), DeclId.Kind.GLOBAL),
                        types.args(rv.args, new ArrayList<>(), scope));
            case "len":
                return new Rvalue.Len(place(rv.place));
            default:
                throw unsupported("rvalue", rv.kind);
        }
    }

    private BorrowKind borrow(@Nullable String borrow) {
        if (borrow == null) return BorrowKind.SHARED;
        switch (borrow) {
            case "shared":
                return BorrowKind.SHARED;
            case "mut":
                return BorrowKind.MUT;
            case "two_phase_mut":
                return BorrowKind.TWO_PHASE_MUT;
            case "shallow":
                return BorrowKind.SHALLOW;
            default:
                throw unsupported("borrow kind", borrow);
        }
    }

    private AggregateKind aggregate(Feed.Rvalue rv) {
        switch (required(rv.aggregate, "aggregate kind", scope)) {
            case "adt":
                return AggregateKind.adt(
                        importer.ref(required(rv.adt, "aggregate adt", scope), DeclId.Kind.TYPE),
                        rv.variant,
                        types.args(rv.args, new ArrayList<>(), scope));
            case "tuple":
                return AggregateKind.tuple();
            case "array":
                return AggregateKind.array(types.translate(rv.ty, scope));
            default:
                throw unsupported("aggregate", rv.aggregate);
        }
    }

    private Statement statement(Feed.Statement stmt) {
        switch (required(stmt.kind, "statement kind", scope)) {
            case "assign":
                return new Statement.Assign(place(stmt.place), rvalue(stmt.rvalue));
            case "fake_read":
                return new Statement.FakeRead(place(stmt.place));
            case "set_discriminant":
                return new Statement.SetDiscriminant(place(stmt.place), stmt.variant);
            case "storage_live":
                return new Statement.StorageLive(local(stmt.local));
            case "storage_dead":
                return new Statement.StorageDead(local(stmt.local));
            case "deinit":
                return new Statement.Deinit(place(stmt.place));
            case "drop":
                return new Statement.Drop(place(stmt.place));
            case "nop":
                return Statement.NOP;
            default:
                throw unsupported("statement", stmt.kind);
        }
    }

    private Terminator terminator(Feed.Terminator term) {
        switch (required(term.kind, "terminator kind", scope)) {
            case "goto":
                return new Terminator.Goto(term.target);
            case "if":
                return new Terminator.Switch(operand(term.discr),
                        new SwitchTargets.If(term.thenTarget, term.elseTarget));
            case "switch": {
                LiteralTy intTy = types.literalTy(term.intTy, scope);
                if (!intTy.isInteger()) throw malformed("switch on non-integer type " + intTy.text);
                if (term.values.size() != term.targets.size()) {
                    throw malformed("switch with " + term.values.size() + " values and "
                            + term.targets.size() + " targets");
                }
                List<Literal> values = new ArrayList<>(term.values.size());
                for (String value : term.values) {
                    Literal lit = types.literal(intTy, value, scope);
                    if (values.contains(lit)) throw malformed("duplicate switch value " + value);
                    values.add(lit);
                }
                return new Terminator.Switch(operand(term.discr),
                        new SwitchTargets.SwitchInt(intTy, values, term.targets, term.otherwise));
            }
            case "return":
                return Terminator.RETURN;
            case "abort":
                if (term.cause == null || term.cause.equals("panic")) return new Terminator.Abort(AbortKind.PANIC);
                if (term.cause.equals("undefined_behavior")) return new Terminator.Abort(AbortKind.UNDEFINED_BEHAVIOR);
                throw unsupported("abort cause", term.cause);
            case "call": {
                FnPtr func = fnPtr(required(term.func, "callee", scope));
                FnCall call = new FnCall(func, operands(term.args), place(term.dest));
                return new Terminator.Call(call, term.target, term.unwind);
            }
            case "assert":
                return new Terminator.Assert(operand(term.cond), term.expected, term.target);
            default:
                throw unsupported("terminator", term.kind);
        }
    }

    private FnPtr fnPtr(Feed.Fn fn) {
        switch (required(fn.kind, "callee kind", scope)) {
            case "regular": {
                DeclId callee = importer.ref(required(fn.name, "callee name", scope), DeclId.Kind.FUN);
                GenericArgs args = types.args(fn.args, fn.constArgs, scope);
                return FnPtr.regular(callee, resolver.resolveArgs(importer.funGenerics(callee), args, scope));
            }
            case "trait_method": {
                TraitDeclRef obligation = types.clause(required(fn.trait, "method trait", scope), scope);
                String method = required(fn.method, "method name", scope);
                TraitDecl trait = importer.getTable().getTraitDecl(obligation.traitId);
                TraitDecl.Method decl = trait.getMethod(method);
                if (decl == null) throw malformed("trait " + trait.name + " has no method " + method);
                TraitRef ref = resolver.resolve(obligation, scope);
                GenericArgs args = types.args(fn.args, fn.constArgs, scope);
                return FnPtr.traitMethod(ref, method, decl.fun, args);
            }
            case "assumed":
                return FnPtr.assumed(required(fn.name, "builtin name", scope), types.args(fn.args, fn.constArgs, scope));
            default:
                throw unsupported("callee", fn.kind);
        }
    }
}
