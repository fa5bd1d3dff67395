package io.github.eutro.charonj.decls;

/**
 * Thrown when decoding an exported crate written with a different schema version.
 */
public class SchemaVersionMismatchException extends TranslationException {
    public final int expected;
    public final int found;

    public SchemaVersionMismatchException(int expected, int found) {
        super("Schema version mismatch: expected " + expected + ", found " + found);
        this.expected = expected;
        this.found = found;
    }
}
