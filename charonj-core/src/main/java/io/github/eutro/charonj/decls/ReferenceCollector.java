package io.github.eutro.charonj.decls;

import io.github.eutro.charonj.expr.*;
import io.github.eutro.charonj.types.*;
import io.github.eutro.charonj.ullbc.BasicBlock;
import io.github.eutro.charonj.ullbc.Statement;
import io.github.eutro.charonj.ullbc.Terminator;
import io.github.eutro.charonj.ullbc.UllbcBody;
import org.jetbrains.annotations.Nullable;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Collects the ids of the declarations a declaration refers to, in order of first occurrence.
 */
public final class ReferenceCollector {
    private final Set<DeclId> refs = new LinkedHashSet<>();

    private ReferenceCollector() {
    }

    /**
     * Collect the references of a declaration. A declaration may refer to itself.
     *
     * @param decl The declaration.
     * @return The ids it refers to.
     */
    public static Set<DeclId> collect(Declaration decl) {
        ReferenceCollector rc = new ReferenceCollector();
        rc.declaration(decl);
        return rc.refs;
    }

    private void declaration(Declaration decl) {
        params(decl.generics);
        for (TraitRef obligation : decl.obligations) traitRef(obligation);
        if (decl instanceof TypeDecl) {
            TypeDecl td = (TypeDecl) decl;
            for (TypeDecl.Field field : td.fields) ty(field.ty);
            for (TypeDecl.Variant variant : td.variants) {
                for (TypeDecl.Field field : variant.fields) ty(field.ty);
            }
        } else if (decl instanceof FunDecl) {
            FunDecl fd = (FunDecl) decl;
            for (Ty input : fd.sig.inputs) ty(input);
            ty(fd.sig.output);
            id(fd.kind.traitDecl);
            id(fd.kind.traitImpl);
            body(fd.body);
        } else if (decl instanceof GlobalDecl) {
            GlobalDecl gd = (GlobalDecl) decl;
            ty(gd.ty);
            body(gd.body);
        } else if (decl instanceof TraitDecl) {
            TraitDecl td = (TraitDecl) decl;
            for (TraitClause clause : td.parentClauses) clause(clause);
            for (TraitDecl.AssocConst c : td.consts) {
                ty(c.ty);
                id(c.defaultValue);
            }
            for (TraitDecl.Method method : td.methods) id(method.fun);
        } else if (decl instanceof TraitImpl) {
            TraitImpl ti = (TraitImpl) decl;
            if (ti.implTrait != null) declRef(ti.implTrait);
            for (TraitRef ref : ti.parentTraitRefs) traitRef(ref);
            for (Ty ty : ti.assocTypes.values()) ty(ty);
            for (DeclId c : ti.consts.values()) id(c);
            for (DeclId m : ti.methods.values()) id(m);
        }
    }

    private void id(@Nullable DeclId id) {
        if (id != null) refs.add(id);
    }

    private void params(GenericParams params) {
        for (TraitClause clause : params.traitClauses) clause(clause);
    }

    private void clause(TraitClause clause) {
        id(clause.traitId);
        args(clause.generics);
    }

    private void args(GenericArgs args) {
        for (Ty ty : args.types) ty(ty);
        for (ConstGeneric cg : args.constGenerics) id(cg.global);
        for (TraitRef ref : args.traitRefs) traitRef(ref);
    }

    private void declRef(TraitDeclRef ref) {
        id(ref.traitId);
        args(ref.generics);
    }

    private void traitRef(TraitRef ref) {
        ref.instance.accept(instanceVisitor);
        args(ref.generics);
        declRef(ref.traitDeclRef);
    }

    private final TraitInstanceId.Visitor<Void> instanceVisitor = new TraitInstanceId.Visitor<Void>() {
        @Override
        public Void visitTraitImpl(TraitInstanceId.TraitImpl id) {
            id(id.implId);
            return null;
        }

        @Override
        public Void visitBuiltinOrAuto(TraitInstanceId.BuiltinOrAuto id) {
            id(id.traitId);
            return null;
        }

        @Override
        public Void visitClause(TraitInstanceId.Clause id) {
            return null;
        }

        @Override
        public Void visitParentClause(TraitInstanceId.ParentClause id) {
            id.instance.accept(this);
            id(id.traitId);
            return null;
        }

        @Override
        public Void visitSelfId(TraitInstanceId.SelfId id) {
            return null;
        }

        @Override
        public Void visitUnresolved(TraitInstanceId.Unresolved id) {
            return null;
        }
    };

    private void ty(Ty ty) {
        ty.accept(tyVisitor);
    }

    private final Ty.Visitor<Void> tyVisitor = new Ty.Visitor<Void>() {
        @Override
        public Void visitAdt(Ty.Adt ty) {
            id(ty.id.adt);
            args(ty.generics);
            return null;
        }

        @Override
        public Void visitTypeVar(Ty.TypeVar ty) {
            return null;
        }

        @Override
        public Void visitLiteral(Ty.Literal ty) {
            return null;
        }

        @Override
        public Void visitNever(Ty.Never ty) {
            return null;
        }

        @Override
        public Void visitRef(Ty.Ref ty) {
            ty.ty.accept(this);
            return null;
        }

        @Override
        public Void visitRawPtr(Ty.RawPtr ty) {
            ty.ty.accept(this);
            return null;
        }

        @Override
        public Void visitTraitType(Ty.TraitType ty) {
            traitRef(ty.traitRef);
            return null;
        }

        @Override
        public Void visitArrow(Ty.Arrow ty) {
            for (Ty input : ty.inputs) input.accept(this);
            ty.output.accept(this);
            return null;
        }
    };

    private void body(@Nullable UllbcBody body) {
        if (body == null) return;
        for (Local local : body.locals) ty(local.ty);
        for (BasicBlock block : body.blocks) {
            for (Statement statement : block.statements) statement.accept(statementVisitor);
            block.getTerminator().accept(terminatorVisitor);
        }
    }

    private void place(Place place) {
        for (ProjectionElem elem : place.projection) id(elem.adt);
    }

    private void operand(Operand op) {
        if (op.place != null) place(op.place);
        if (op.ty != null) ty(op.ty);
    }

    private void fnCall(FnCall call) {
        FnPtr fn = call.func;
        id(fn.fun);
        if (fn.traitRef != null) traitRef(fn.traitRef);
        args(fn.generics);
        for (Operand arg : call.args) operand(arg);
        place(call.dest);
    }

    private final Rvalue.Visitor<Void> rvalueVisitor = new Rvalue.Visitor<Void>() {
        @Override
        public Void visitUse(Rvalue.Use rv) {
            operand(rv.operand);
            return null;
        }

        @Override
        public Void visitRef(Rvalue.Ref rv) {
            place(rv.place);
            return null;
        }

        @Override
        public Void visitUnaryOp(Rvalue.UnaryOp rv) {
            operand(rv.operand);
            return null;
        }

        @Override
        public Void visitBinaryOp(Rvalue.BinaryOp rv) {
            operand(rv.left);
            operand(rv.right);
            return null;
        }

        @Override
        public Void visitCast(Rvalue.Cast rv) {
            operand(rv.operand);
            ty(rv.target);
            return null;
        }

        @Override
        public Void visitDiscriminant(Rvalue.Discriminant rv) {
            place(rv.place);
            id(rv.adt);
            return null;
        }

        @Override
        public Void visitAggregate(Rvalue.Aggregate rv) {
            id(rv.aggregate.adt);
            args(rv.aggregate.generics);
            if (rv.aggregate.elemTy != null) ty(rv.aggregate.elemTy);
            for (Operand op : rv.operands) operand(op);
            return null;
        }

        @Override
        public Void visitGlobal(Rvalue.Global rv) {
            id(rv.global);
            args(rv.generics);
            return null;
        }

        @Override
        public Void visitLen(Rvalue.Len rv) {
            place(rv.place);
            return null;
        }
    };

    private final Statement.Visitor<Void> statementVisitor = new Statement.Visitor<Void>() {
        @Override
        public Void visitAssign(Statement.Assign stmt) {
            place(stmt.place);
            stmt.rvalue.accept(rvalueVisitor);
            return null;
        }

        @Override
        public Void visitFakeRead(Statement.FakeRead stmt) {
            place(stmt.place);
            return null;
        }

        @Override
        public Void visitSetDiscriminant(Statement.SetDiscriminant stmt) {
            place(stmt.place);
            return null;
        }

        @Override
        public Void visitStorageLive(Statement.StorageLive stmt) {
            return null;
        }

        @Override
        public Void visitStorageDead(Statement.StorageDead stmt) {
            return null;
        }

        @Override
        public Void visitDeinit(Statement.Deinit stmt) {
            place(stmt.place);
            return null;
        }

        @Override
        public Void visitDrop(Statement.Drop stmt) {
            place(stmt.place);
            return null;
        }

        @Override
        public Void visitNop(Statement.Nop stmt) {
            return null;
        }
    };

    private final Terminator.Visitor<Void> terminatorVisitor = new Terminator.Visitor<Void>() {
        @Override
        public Void visitGoto(Terminator.Goto term) {
            return null;
        }

        @Override
        public Void visitSwitch(Terminator.Switch term) {
            operand(term.discriminant);
            return null;
        }

        @Override
        public Void visitReturn(Terminator.Return term) {
            return null;
        }

        @Override
        public Void visitAbort(Terminator.Abort term) {
            return null;
        }

        @Override
        public Void visitCall(Terminator.Call term) {
            fnCall(term.call);
            return null;
        }

        @Override
        public Void visitAssert(Terminator.Assert term) {
            operand(term.cond);
            return null;
        }
    };
}
