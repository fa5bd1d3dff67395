package io.github.eutro.charonj.test;

import io.github.eutro.charonj.decls.DeclTable;
import io.github.eutro.charonj.decls.Diagnostic;
import io.github.eutro.charonj.decls.FunDecl;
import io.github.eutro.charonj.expr.Operand;
import io.github.eutro.charonj.expr.Place;
import io.github.eutro.charonj.expr.AbortKind;
import io.github.eutro.charonj.llbc.Stmt;
import io.github.eutro.charonj.passes.IRPass;
import io.github.eutro.charonj.passes.convert.RemoveReadDiscriminant;
import io.github.eutro.charonj.translate.CrateStructuring;
import io.github.eutro.charonj.translate.DuplicationMode;
import io.github.eutro.charonj.translate.TranslateConfig;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;

import static io.github.eutro.charonj.test.Utils.*;
import static org.junit.jupiter.api.Assertions.*;

public class CrateStructuringTest {
    static DeclTable structured(DuplicationMode mode, int threads) throws IOException {
        DeclTable table = importFeed(ImporterTest.DEMO, TranslateConfig.DEFAULT);
        table.freeze();
        new CrateStructuring(mode, threads).runInPlace(table);
        return table;
    }

    @Test
    void mustBeFrozen() throws IOException {
        DeclTable table = importFeed(ImporterTest.DEMO, TranslateConfig.DEFAULT);
        assertThrows(IllegalStateException.class,
                () -> new CrateStructuring(TranslateConfig.DEFAULT).runInPlace(table));
    }

    @Test
    void structuresMain() throws IOException {
        DeclTable table = structured(DuplicationMode.DUPLICATE_TAILS, 1);
        List<Stmt> stmts = fun(table, "demo::main").llbcBody.body.stmts;
        assertEquals(8, stmts.size());
        assertTrue(stmts.get(3) instanceof Stmt.Call);

        Stmt.Loop loop = (Stmt.Loop) stmts.get(4);
        Stmt.If exitTest = (Stmt.If) loop.body.stmts.get(1);
        assertEquals(Operand.copy(Place.local(5)), exitTest.cond);
        assertEquals(new Stmt.Continue(0), exitTest.thenBranch.stmts.get(1));
        assertEquals(seq(new Stmt.Break(0)), exitTest.elseBranch);

        Stmt.Switch sw = (Stmt.Switch) stmts.get(6);
        assertEquals(2, sw.arms.size());
        assertEquals(seq(), sw.arms.get(0).body);
        assertEquals(seq(), sw.arms.get(1).body);
        assertEquals(seq(new Stmt.Abort(AbortKind.UNDEFINED_BEHAVIOR)), sw.otherwise);
        assertEquals(Stmt.RETURN, stmts.get(7));
    }

    @Test
    void discriminantReadsBecomeMatches() throws IOException {
        DeclTable table = structured(DuplicationMode.DUPLICATE_TAILS, 1);
        RemoveReadDiscriminant.INSTANCE.runInPlace(table);
        List<Stmt> stmts = fun(table, "demo::main").llbcBody.body.stmts;
        assertEquals(7, stmts.size());
        // both variants are covered, so the unreachable fallback goes away
        assertEquals(new Stmt.Match(Place.local(6), Arrays.asList(
                new Stmt.MatchArm(Collections.singletonList(0), seq()),
                new Stmt.MatchArm(Collections.singletonList(1), seq())
        ), null), stmts.get(5));
        assertEquals(Stmt.RETURN, stmts.get(6));
        assertTrue(table.getDiagnostics().stream().noneMatch(d ->
                d.kind == Diagnostic.Kind.UNSUPPORTED_CONSTRUCT && d.itemName.equals("demo::main")));
    }

    @Test
    void chainedPasses() throws IOException {
        DeclTable table = importFeed(ImporterTest.DEMO, TranslateConfig.DEFAULT);
        IRPass<DeclTable, DeclTable> chain = new CrateStructuring(DuplicationMode.DUPLICATE_TAILS, 2)
                .then(RemoveReadDiscriminant.INSTANCE);
        assertTrue(chain.isInPlace());

        IllegalStateException e = assertThrows(IllegalStateException.class, () -> chain.run(table));
        assertEquals(1, e.getSuppressed().length);
        assertEquals("running pass 0 in chain (CrateStructuring)", e.getSuppressed()[0].getMessage());

        table.freeze();
        assertSame(table, chain.run(table));
        assertTrue(fun(table, "demo::main").llbcBody.body.stmts.get(5) instanceof Stmt.Match);
    }

    @Test
    void irreducibleBodiesReported() throws IOException {
        DeclTable table = structured(DuplicationMode.SYNTHETIC_JOIN, 1);
        FunDecl shaky = fun(table, "demo::shaky");
        assertNotNull(shaky.llbcBody);
        Diagnostic diagnostic = table.getDiagnostics().stream()
                .filter(d -> d.kind == Diagnostic.Kind.IRREDUCIBLE_REGION)
                .findFirst()
                .orElseThrow(AssertionError::new);
        assertEquals(shaky.id, diagnostic.item);
        assertEquals(new HashSet<>(Arrays.asList(1, 2)), new HashSet<>(diagnostic.blocks));
        assertEquals(1, table.getDiagnostics().stream().filter(d -> d.kind == Diagnostic.Kind.IRREDUCIBLE_REGION).count());
    }

    @Test
    void opaqueItemsHaveNoStructuredBody() throws IOException {
        DeclTable table = structured(DuplicationMode.DUPLICATE_TAILS, 1);
        assertNull(fun(table, "demo::weird").llbcBody);
        assertNull(fun(table, "demo::needs_missing").llbcBody);
        assertNotNull(find(table.getGlobals(), "demo::LIMIT").llbcBody);
    }

    @Test
    void threadCountDoesNotMatter() throws IOException {
        for (DuplicationMode mode : DuplicationMode.values()) {
            assertEquals(structured(mode, 1), structured(mode, 4), mode::toString);
        }
    }
}
