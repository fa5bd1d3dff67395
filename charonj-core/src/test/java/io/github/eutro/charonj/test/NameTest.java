package io.github.eutro.charonj.test;

import io.github.eutro.charonj.names.Name;
import io.github.eutro.charonj.names.NamePattern;
import io.github.eutro.charonj.names.PathElem;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class NameTest {
    @Test
    void parsing() {
        Name name = Name.parse("demo::{impl#2}::clone#1");
        assertEquals(3, name.elems.size());
        assertEquals(PathElem.ident("demo", 0), name.elems.get(0));
        assertEquals(PathElem.impl(2), name.elems.get(1));
        assertEquals(PathElem.ident("clone", 1), name.elems.get(2));
        assertEquals("demo::{impl#2}::clone#1", name.toString());
        assertEquals(PathElem.ident("a#b", 0), PathElem.parse("a#b"));

        assertThrows(IllegalArgumentException.class, () -> Name.parse(""));
        assertThrows(IllegalArgumentException.class, () -> Name.parse("demo::::x"));
    }

    @Test
    void patterns() {
        NamePattern module = NamePattern.parse("demo::secret");
        assertTrue(module.matches(Name.parse("demo::secret")));
        assertTrue(module.matches(Name.parse("demo::secret::hidden")));
        assertFalse(module.matches(Name.parse("demo")));
        assertFalse(module.matches(Name.parse("demo::secrets")));

        NamePattern wild = NamePattern.parse("core::*::fmt");
        assertTrue(wild.matches(Name.parse("core::str::fmt")));
        assertTrue(wild.matches(Name.parse("core::{impl#3}::fmt::inner")));
        assertFalse(wild.matches(Name.parse("core::fmt")));
        assertFalse(wild.matches(Name.parse("alloc::str::fmt")));

        assertTrue(NamePattern.parse("demo::clone").matches(Name.parse("demo::clone")));
        assertFalse(NamePattern.parse("demo::clone").matches(Name.parse("demo::clone#1")));

        assertEquals(NamePattern.parse("a::*"), NamePattern.parse("a::*"));
        assertThrows(IllegalArgumentException.class, () -> NamePattern.parse(""));
        assertThrows(IllegalArgumentException.class, () -> NamePattern.parse("a::"));
    }
}
