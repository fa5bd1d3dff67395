package io.github.eutro.charonj.test;

import io.github.eutro.charonj.decls.*;
import io.github.eutro.charonj.translate.TranslateConfig;
import io.github.eutro.charonj.types.*;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static io.github.eutro.charonj.test.Utils.*;
import static org.junit.jupiter.api.Assertions.*;

public class TraitResolverTest {
    static DeclTable traits() throws IOException {
        return importFeed("/feeds/traits.json", TranslateConfig.DEFAULT);
    }

    @Test
    void clausesBeforeImpls() throws IOException {
        DeclTable table = traits();
        DeclId derived = find(table.getTraitDecls(), "x::Derived").id;
        DeclId sized = find(table.getTraitDecls(), "x::Sized").id;
        List<TraitRef> obligations = fun(table, "x::f").obligations;

        assertEquals(new TraitInstanceId.Clause(0), obligations.get(0).instance);
        assertEquals(new TraitInstanceId.ParentClause(new TraitInstanceId.Clause(0), derived, 0),
                obligations.get(1).instance);
        assertEquals(new TraitInstanceId.BuiltinOrAuto(sized), obligations.get(2).instance);
    }

    @Test
    void selfInsideTraits() throws IOException {
        DeclTable table = traits();
        DeclId derived = find(table.getTraitDecls(), "x::Derived").id;
        FunDecl m = fun(table, "x::Derived::m");
        assertEquals(FunKind.Kind.TRAIT_METHOD_DECL, m.kind.kind);
        assertTrue(m.kind.provided);
        assertEquals(TraitInstanceId.SELF, m.obligations.get(0).instance);
        assertEquals(new TraitInstanceId.ParentClause(TraitInstanceId.SELF, derived, 0), m.obligations.get(1).instance);
    }

    @Test
    void implsWithWhereClauses() throws IOException {
        DeclTable table = traits();
        DeclId forU32 = find(table.getTraitImpls(), "x::{impl#0}").id;
        DeclId forW = find(table.getTraitImpls(), "x::{impl#1}").id;
        TraitRef ref = fun(table, "x::f").obligations.get(3);
        assertEquals(new TraitInstanceId.TraitImpl(forW), ref.instance);
        assertEquals(Ty.literal(LiteralTy.U32), ref.generics.types.get(0));
        assertEquals(new TraitInstanceId.TraitImpl(forU32), ref.generics.traitRefs.get(0).instance);
    }

    @Test
    void ambiguousImplsAreReported() throws IOException {
        DeclTable table = traits();
        TraitRef ref = fun(table, "x::f").obligations.get(4);
        assertTrue(ref.instance instanceof TraitInstanceId.Unresolved);
        assertFalse(ref.instance.isResolved());

        assertEquals(1, table.getDiagnostics().size());
        Diagnostic diagnostic = table.getDiagnostics().get(0);
        assertEquals(Diagnostic.Kind.UNRESOLVED_CLAUSE, diagnostic.kind);
        assertEquals("x::f", diagnostic.itemName);
        assertTrue(diagnostic.message.startsWith("2 implementations"), diagnostic.message);
    }

    @Test
    void projectionsNormalised() throws IOException {
        DeclTable table = traits();
        assertEquals(Ty.literal(LiteralTy.BOOL), find(table.getGlobals(), "x::G").ty);
        assertEquals(Ty.literal(LiteralTy.U32), find(table.getGlobals(), "x::H").ty);
    }
}
