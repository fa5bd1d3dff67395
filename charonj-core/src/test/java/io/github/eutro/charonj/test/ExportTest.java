package io.github.eutro.charonj.test;

import io.github.eutro.charonj.decls.*;
import io.github.eutro.charonj.export.CrateExporter;
import io.github.eutro.charonj.passes.convert.RemoveReadDiscriminant;
import io.github.eutro.charonj.translate.CrateStructuring;
import io.github.eutro.charonj.translate.DuplicationMode;
import io.github.eutro.charonj.translate.TranslateConfig;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static io.github.eutro.charonj.test.Utils.*;
import static org.junit.jupiter.api.Assertions.*;

public class ExportTest {
    static DeclTable demo() throws IOException {
        DeclTable table = importFeed(ImporterTest.DEMO, TranslateConfig.DEFAULT);
        table.freeze();
        new CrateStructuring(DuplicationMode.SYNTHETIC_JOIN, 2).runInPlace(table);
        RemoveReadDiscriminant.INSTANCE.runInPlace(table);
        return table;
    }

    @Test
    void roundTrip() throws IOException {
        DeclTable table = demo();
        DeclTable decoded = CrateExporter.decode(CrateExporter.export(table, true));
        assertTrue(decoded.isFrozen());
        assertEquals(table, decoded);
        assertEquals(table.getDiagnostics(), decoded.getDiagnostics());
    }

    @Test
    void byteIdentical() throws IOException {
        assertArrayEquals(CrateExporter.export(demo(), true), CrateExporter.export(demo(), true));
        assertArrayEquals(CrateExporter.export(demo(), false), CrateExporter.export(demo(), false));
    }

    @Test
    void documentShape() throws IOException {
        DeclTable table = demo();
        String text = new String(CrateExporter.export(table, false), StandardCharsets.UTF_8);
        JsonObject root = JsonParser.parseString(text).getAsJsonObject();
        assertEquals(CrateExporter.SCHEMA_VERSION, root.get("schema_version").getAsInt());
        assertEquals("demo", root.get("crate_name").getAsString());
        assertEquals(table.getFuns().size(), root.getAsJsonArray("functions").size());
        assertFalse(text.contains("llbc_body"));
        assertTrue(new String(CrateExporter.export(table, true), StandardCharsets.UTF_8).contains("llbc_body"));

        // the structured bodies are left out, so they decode as absent
        DeclTable ullbcOnly = CrateExporter.decode(text.getBytes(StandardCharsets.UTF_8));
        assertNull(fun(ullbcOnly, "demo::main").llbcBody);
        assertEquals(fun(table, "demo::main").body, fun(ullbcOnly, "demo::main").body);
    }

    @Test
    void dependenciesComeFirst() throws IOException {
        DeclTable table = demo();
        List<DeclarationGroup> groups = ReorderDecls.compute(table);
        int total = 0;
        for (DeclarationGroup group : groups) total += group.ids.size();
        assertEquals(table.getAll().size(), total);

        FunDecl main = fun(table, "demo::main");
        FunDecl dup = fun(table, "demo::dup");
        assertTrue(indexOf(groups, dup.id) < indexOf(groups, main.id));
        assertTrue(indexOf(groups, find(table.getTypes(), "demo::Point").id) < indexOf(groups, main.id));

        // an impl and its method refer to each other
        TraitImpl impl = find(table.getTraitImpls(), "demo::{impl#0}");
        DeclarationGroup implGroup = groups.get(indexOf(groups, impl.id));
        assertTrue(implGroup.recursive);
        assertEquals(DeclarationGroup.Kind.MIXED, implGroup.kind);
        assertTrue(implGroup.ids.contains(fun(table, "demo::{impl#0}::clone").id));
    }

    static int indexOf(List<DeclarationGroup> groups, DeclId id) {
        for (int i = 0; i < groups.size(); i++) {
            if (groups.get(i).ids.contains(id)) return i;
        }
        throw new AssertionError("no group for " + id);
    }

    @Test
    void rejectsOtherVersions() {
        SchemaVersionMismatchException e = assertThrows(SchemaVersionMismatchException.class,
                () -> CrateExporter.decode("{\"schema_version\": 99}".getBytes(StandardCharsets.UTF_8)));
        assertEquals(99, e.found);
        assertEquals(CrateExporter.SCHEMA_VERSION, e.expected);
    }

    @Test
    void rejectsBrokenDocuments() {
        assertThrows(ExportFormatException.class,
                () -> CrateExporter.decode("[1, 2".getBytes(StandardCharsets.UTF_8)));
        assertThrows(ExportFormatException.class,
                () -> CrateExporter.decode("[]".getBytes(StandardCharsets.UTF_8)));
        assertThrows(ExportFormatException.class,
                () -> CrateExporter.decode("{\"crate_name\": \"x\"}".getBytes(StandardCharsets.UTF_8)));
        assertThrows(ExportFormatException.class,
                () -> CrateExporter.decode("{\"schema_version\": 1, \"crate_name\": \"x\"}".getBytes(StandardCharsets.UTF_8)));
    }
}
