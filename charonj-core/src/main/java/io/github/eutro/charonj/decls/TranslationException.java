package io.github.eutro.charonj.decls;

/**
 * A fatal error while translating or exporting a crate.
 * <p>
 * Recoverable problems are not exceptions; they are recorded as {@link Diagnostic}s on the {@link DeclTable}.
 */
public class TranslationException extends RuntimeException {
    public TranslationException(String message) {
        super(message);
    }

    public TranslationException(String message, Throwable cause) {
        super(message, cause);
    }
}
