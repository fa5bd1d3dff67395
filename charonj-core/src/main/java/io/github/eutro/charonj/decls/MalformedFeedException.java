package io.github.eutro.charonj.decls;

/**
 * Thrown when the import feed is inconsistent: unknown or duplicate names, kinds that disagree
 * with how an item is referenced, or structurally broken bodies.
 */
public class MalformedFeedException extends TranslationException {
    public MalformedFeedException(String message) {
        super(message);
    }

    public MalformedFeedException(String message, Throwable cause) {
        super(message, cause);
    }
}
