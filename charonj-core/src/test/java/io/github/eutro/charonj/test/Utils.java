package io.github.eutro.charonj.test;

import io.github.eutro.charonj.decls.DeclTable;
import io.github.eutro.charonj.decls.Declaration;
import io.github.eutro.charonj.decls.FunDecl;
import io.github.eutro.charonj.expr.FnCall;
import io.github.eutro.charonj.expr.FnPtr;
import io.github.eutro.charonj.expr.Local;
import io.github.eutro.charonj.expr.Operand;
import io.github.eutro.charonj.expr.Place;
import io.github.eutro.charonj.feed.Feed;
import io.github.eutro.charonj.feed.FeedReader;
import io.github.eutro.charonj.llbc.Stmt;
import io.github.eutro.charonj.translate.Importer;
import io.github.eutro.charonj.translate.TranslateConfig;
import io.github.eutro.charonj.types.GenericArgs;
import io.github.eutro.charonj.types.Literal;
import io.github.eutro.charonj.types.LiteralTy;
import io.github.eutro.charonj.types.Ty;
import io.github.eutro.charonj.ullbc.*;
import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.NoSuchElementException;

public class Utils {
    /**
     * The boolean local branched on by {@link #branch(int, int)}.
     */
    public static final int COND = 1;
    /**
     * The integer local switched on by {@link #switchOn(Integer, int...)}.
     */
    public static final int DISCR = 2;

    @NotNull
    public static Feed.Crate getFeed(String name) throws IOException {
        try (InputStream stream = Utils.class.getResourceAsStream(name)) {
            if (stream == null) throw new IOException("missing resource " + name);
            return FeedReader.read(stream);
        }
    }

    public static DeclTable importFeed(String name, TranslateConfig config) throws IOException {
        return Importer.importCrate(getFeed(name), config);
    }

    public static <T extends Declaration> T find(List<T> decls, String name) {
        for (T decl : decls) {
            if (decl.name.toString().equals(name)) return decl;
        }
        throw new NoSuchElementException(name);
    }

    public static FunDecl fun(DeclTable table, String name) {
        return find(table.getFuns(), name);
    }

    /**
     * Build a body where block {@code i} consists of the marker {@link #mark(int) mark(i)} and the i-th terminator.
     */
    public static UllbcBody cfg(Terminator... terms) {
        List<Local> locals = new ArrayList<>();
        locals.add(new Local(0, null, Ty.UNIT));
        locals.add(new Local(COND, "c", Ty.literal(LiteralTy.BOOL)));
        locals.add(new Local(DISCR, "d", Ty.literal(LiteralTy.U32)));
        List<BasicBlock> blocks = new ArrayList<>();
        for (int i = 0; i < terms.length; i++) {
            List<Statement> stmts = new ArrayList<>();
            stmts.add(mark(i));
            blocks.add(new BasicBlock(stmts, terms[i]));
        }
        return new UllbcBody(locals, 2, blocks);
    }

    public static Statement mark(int block) {
        return new Statement.StorageLive(block);
    }

    public static Stmt marked(int block) {
        return new Stmt.Simple(mark(block));
    }

    public static Terminator goTo(int target) {
        return new Terminator.Goto(target);
    }

    public static Terminator ret() {
        return Terminator.RETURN;
    }

    /**
     * A call to an opaque function, which may unwind to {@code unwind}.
     */
    public static Terminator call(int target, Integer unwind) {
        FnCall call = new FnCall(FnPtr.assumed("f", GenericArgs.EMPTY), new ArrayList<>(), Place.local(0));
        return new Terminator.Call(call, target, unwind);
    }

    public static Terminator assertion(int target) {
        return new Terminator.Assert(cond(), true, target);
    }

    public static Terminator branch(int then, int otherwise) {
        return new Terminator.Switch(cond(), new SwitchTargets.If(then, otherwise));
    }

    public static Operand cond() {
        return Operand.copy(Place.local(COND));
    }

    public static Operand discr() {
        return Operand.copy(Place.local(DISCR));
    }

    /**
     * A switch on the values {@code 0 .. targets.length - 1}, in order.
     */
    public static Terminator switchOn(Integer otherwise, int... targets) {
        List<Literal> values = new ArrayList<>();
        List<Integer> valueTargets = new ArrayList<>();
        for (int i = 0; i < targets.length; i++) {
            values.add(u32(i));
            valueTargets.add(targets[i]);
        }
        return new Terminator.Switch(discr(), new SwitchTargets.SwitchInt(LiteralTy.U32, values, valueTargets, otherwise));
    }

    public static Literal u32(int value) {
        return Literal.integer(LiteralTy.U32, value);
    }

    public static List<Literal> u32s(int... values) {
        List<Literal> out = new ArrayList<>();
        for (int value : values) out.add(u32(value));
        return out;
    }

    public static Stmt.Sequence seq(Stmt... stmts) {
        return new Stmt.Sequence(new ArrayList<>(Arrays.asList(stmts)));
    }
}
