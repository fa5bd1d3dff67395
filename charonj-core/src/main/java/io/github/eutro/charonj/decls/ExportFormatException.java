package io.github.eutro.charonj.decls;

/**
 * Thrown when an exported crate cannot be decoded.
 */
public class ExportFormatException extends TranslationException {
    public ExportFormatException(String message) {
        super(message);
    }

    public ExportFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
