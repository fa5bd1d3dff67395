package io.github.eutro.charonj.test;

import io.github.eutro.charonj.decls.*;
import io.github.eutro.charonj.feed.FeedReader;
import io.github.eutro.charonj.translate.Importer;
import io.github.eutro.charonj.translate.TranslateConfig;
import io.github.eutro.charonj.types.*;
import io.github.eutro.charonj.ullbc.Terminator;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.NoSuchElementException;

import static io.github.eutro.charonj.test.Utils.*;
import static org.junit.jupiter.api.Assertions.*;

public class ImporterTest {
    static final String DEMO = "/feeds/demo.json";

    static DeclTable importJson(String json) {
        return Importer.importCrate(FeedReader.read(json.replace('\'', '"')), TranslateConfig.DEFAULT);
    }

    static Terminator.Call callIn(FunDecl fun, int block) {
        return (Terminator.Call) fun.body.blocks.get(block).getTerminator();
    }

    @Test
    void importsDemo() throws IOException {
        DeclTable table = importFeed(DEMO, TranslateConfig.DEFAULT);
        assertEquals("demo", table.crateName);
        assertFalse(table.isFrozen());

        TraitDecl clone = find(table.getTraitDecls(), "core::clone::Clone");
        assertFalse(clone.isLocal);
        assertEquals(1, clone.methods.size());

        TypeDecl point = find(table.getTypes(), "demo::Point");
        assertEquals(TypeDecl.Kind.STRUCT, point.kind);
        assertEquals(2, point.fields.size());
        assertEquals(Ty.literal(LiteralTy.I32), point.fields.get(1).ty);

        TypeDecl option = find(table.getTypes(), "demo::Option");
        assertEquals(TypeDecl.Kind.ENUM, option.kind);
        assertEquals(Literal.integer(LiteralTy.ISIZE, 0), option.variants.get(0).discriminant);
        assertEquals(Literal.integer(LiteralTy.ISIZE, 1), option.variants.get(1).discriminant);
        assertEquals(new Ty.TypeVar(0), option.variants.get(1).fields.get(0).ty);

        GlobalDecl limit = find(table.getGlobals(), "demo::LIMIT");
        assertEquals(Ty.literal(LiteralTy.U32), limit.ty);
        assertNotNull(limit.body);

        assertThrows(NoSuchElementException.class, () -> fun(table, "other::unused"));
    }

    @Test
    void traitMethodsAndImpls() throws IOException {
        DeclTable table = importFeed(DEMO, TranslateConfig.DEFAULT);
        TraitImpl impl = find(table.getTraitImpls(), "demo::{impl#0}");
        TraitDecl clone = find(table.getTraitDecls(), "core::clone::Clone");
        assertEquals(clone.id, impl.implTrait.traitId);

        FunDecl method = fun(table, "demo::{impl#0}::clone");
        assertEquals(FunKind.traitMethodImpl(impl.id, clone.id, "clone"), method.kind);
        assertEquals(method.id, impl.methods.get("clone"));

        // inside dup, T: Clone comes from its own where-clause
        FunDecl dup = fun(table, "demo::dup");
        assertEquals(1, dup.generics.traitClauses.size());
        TraitRef inDup = callIn(dup, 0).call.func.traitRef;
        assertEquals(new TraitInstanceId.Clause(0), inDup.instance);

        // main calls dup::<Point>, whose clause is discharged by the impl
        FunDecl main = fun(table, "demo::main");
        Terminator.Call call = callIn(main, 0);
        assertEquals(dup.id, call.call.func.fun);
        TraitRef viaImpl = call.call.func.generics.traitRefs.get(0);
        assertEquals(new TraitInstanceId.TraitImpl(impl.id), viaImpl.instance);
    }

    @Test
    void unreachableBlocksDropped() throws IOException {
        DeclTable table = importFeed(DEMO, TranslateConfig.DEFAULT);
        assertEquals(8, fun(table, "demo::main").body.blocks.size());
    }

    @Test
    void diagnostics() throws IOException {
        DeclTable table = importFeed(DEMO, TranslateConfig.DEFAULT);
        FunDecl missing = fun(table, "demo::needs_missing");
        assertFalse(missing.obligations.get(0).instance.isResolved());
        FunDecl weird = fun(table, "demo::weird");
        assertTrue(weird.opaque);
        assertNull(weird.body);

        assertEquals(2, table.getDiagnostics().size());
        Diagnostic unresolved = table.getDiagnostics().stream()
                .filter(d -> d.kind == Diagnostic.Kind.UNRESOLVED_CLAUSE)
                .findFirst()
                .orElseThrow(AssertionError::new);
        assertEquals("demo::needs_missing", unresolved.itemName);
        assertEquals(missing.id, unresolved.item);
        Diagnostic unsupported = table.getDiagnostics().stream()
                .filter(d -> d.kind == Diagnostic.Kind.UNSUPPORTED_CONSTRUCT)
                .findFirst()
                .orElseThrow(AssertionError::new);
        assertEquals("demo::weird", unsupported.itemName);
        assertTrue(unsupported.message.contains("inline_asm"), unsupported.message);
    }

    @Test
    void opaquePatterns() throws IOException {
        DeclTable plain = importFeed(DEMO, TranslateConfig.DEFAULT);
        assertFalse(fun(plain, "demo::secret::hidden").opaque);
        assertNotNull(fun(plain, "demo::secret::hidden").body);

        DeclTable hidden = importFeed(DEMO, TranslateConfig.builder().opaque("demo::secret").build());
        FunDecl fun = fun(hidden, "demo::secret::hidden");
        assertTrue(fun.opaque);
        assertNull(fun.body);
        assertEquals(Ty.literal(LiteralTy.U32), fun.sig.output);
        assertFalse(fun(hidden, "demo::main").opaque);
    }

    @Test
    void deterministicIds() throws IOException {
        assertEquals(importFeed(DEMO, TranslateConfig.DEFAULT), importFeed(DEMO, TranslateConfig.DEFAULT));
    }

    @Test
    void malformedFeeds() {
        assertThrows(MalformedFeedException.class, () -> FeedReader.read("{'name': 'x', 'items': ["));
        assertThrows(MalformedFeedException.class, () -> FeedReader.read("{\"items\": []}"));
        assertThrows(MalformedFeedException.class, () -> importJson("{'name': 'x', 'items': ["
                + "{'kind': 'global', 'name': 'x::A', 'ty': {'kind': 'u8'}},"
                + "{'kind': 'global', 'name': 'x::A', 'ty': {'kind': 'u8'}}]}"));
        assertThrows(MalformedFeedException.class, () -> importJson("{'name': 'x', 'items': ["
                + "{'kind': 'global', 'name': 'x::A', 'ty': {'kind': 'adt', 'name': 'x::Missing'}}]}"));
        assertThrows(MalformedFeedException.class, () -> importJson("{'name': 'x', 'items': ["
                + "{'kind': 'module', 'name': 'x::m'}]}"));
        assertThrows(MalformedFeedException.class, () -> importJson("{'name': 'x', 'items': ["
                + "{'kind': 'trait_decl', 'name': 'x::T'}]}"));
        assertThrows(MalformedFeedException.class, () -> importJson("{'name': 'x', 'items': ["
                + "{'kind': 'fun', 'name': 'x::f', 'body': {'locals': [{'ty': {'kind': 'tuple'}}], 'arg_count': 0,"
                + " 'blocks': [{'terminator': {'kind': 'goto', 'target': 3}}]}}]}"));
        assertThrows(MalformedFeedException.class, () -> importJson("{'name': 'x', 'items': ["
                + "{'kind': 'type', 'name': 'x::T', 'adt': 'struct'},"
                + "{'kind': 'global', 'name': 'x::G', 'ty': {'kind': 'adt', 'name': 'x::G'}}]}"));
    }

    @Test
    void unknownTypeDefinitions() {
        DeclTable table = importJson("{'name': 'x', 'items': [{'kind': 'type', 'name': 'x::U', 'adt': 'union'}]}");
        TypeDecl u = find(table.getTypes(), "x::U");
        assertEquals(TypeDecl.Kind.ERROR, u.kind);
        assertEquals(Diagnostic.Kind.UNSUPPORTED_CONSTRUCT, table.getDiagnostics().get(0).kind);
    }
}
