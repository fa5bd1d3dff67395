package io.github.eutro.charonj.test;

import io.github.eutro.charonj.decls.*;
import io.github.eutro.charonj.names.Name;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

public class DeclTableTest {
    @Test
    void idsPerKind() {
        DeclTable table = new DeclTable("demo");
        DeclId a = table.register(DeclId.Kind.FUN, Name.parse("demo::a"));
        DeclId t = table.register(DeclId.Kind.TYPE, Name.parse("demo::T"));
        DeclId b = table.register(DeclId.Kind.FUN, Name.parse("demo::b"));
        assertEquals(DeclId.of(DeclId.Kind.FUN, 0), a);
        assertEquals(DeclId.of(DeclId.Kind.TYPE, 0), t);
        assertEquals(DeclId.of(DeclId.Kind.FUN, 1), b);

        assertEquals("demo::b", table.getFun(b).name.toString());
        assertTrue(table.lookup(t) instanceof TypeDecl);
        assertEquals(2, table.size(DeclId.Kind.FUN));
        assertEquals(0, table.size(DeclId.Kind.GLOBAL));
        assertEquals(Arrays.asList(table.lookup(t), table.lookup(a), table.lookup(b)), table.getAll());
        assertEquals(2, table.getBodyOwners().size());
    }

    @Test
    void unknownIds() {
        DeclTable table = new DeclTable("demo");
        DeclId t = table.register(DeclId.Kind.TYPE, Name.parse("demo::T"));
        UnknownIdException e = assertThrows(UnknownIdException.class,
                () -> table.lookup(DeclId.of(DeclId.Kind.TYPE, 1)));
        assertEquals(DeclId.of(DeclId.Kind.TYPE, 1), e.id);
        assertThrows(UnknownIdException.class, () -> table.getFun(t));
        assertThrows(IllegalArgumentException.class, () -> DeclId.of(DeclId.Kind.FUN, -1));
    }

    @Test
    void frozenTablesRejectRegistration() {
        DeclTable table = new DeclTable("demo");
        table.register(DeclId.Kind.GLOBAL, Name.parse("demo::X"));
        table.freeze();
        table.freeze();
        assertTrue(table.isFrozen());
        assertThrows(IllegalStateException.class, () -> table.register(DeclId.Kind.GLOBAL, Name.parse("demo::Y")));
        assertThrows(IllegalStateException.class,
                () -> table.restore(new GlobalDecl(DeclId.of(DeclId.Kind.GLOBAL, 1), Name.parse("demo::Y"))));
        // diagnostics may still be reported while structuring a frozen table
        table.report(new Diagnostic(Diagnostic.Kind.IRREDUCIBLE_REGION, table.lookup(DeclId.of(DeclId.Kind.GLOBAL, 0)), "m"));
        assertEquals(1, table.getDiagnostics().size());
    }

    @Test
    void restoreInOrder() {
        DeclTable table = new DeclTable("demo");
        table.restore(new GlobalDecl(DeclId.of(DeclId.Kind.GLOBAL, 0), Name.parse("demo::A")));
        assertThrows(IllegalArgumentException.class,
                () -> table.restore(new GlobalDecl(DeclId.of(DeclId.Kind.GLOBAL, 2), Name.parse("demo::C"))));
        table.restore(new GlobalDecl(DeclId.of(DeclId.Kind.GLOBAL, 1), Name.parse("demo::B")));
        assertEquals("demo::B", table.getGlobal(DeclId.of(DeclId.Kind.GLOBAL, 1)).name.toString());
    }
}
