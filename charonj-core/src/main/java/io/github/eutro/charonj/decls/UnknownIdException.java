package io.github.eutro.charonj.decls;

/**
 * Thrown when a {@link DeclId} is looked up that was never registered, or that is of the wrong kind.
 */
public class UnknownIdException extends TranslationException {
    public final DeclId id;

    public UnknownIdException(DeclId id, String message) {
        super(message);
        this.id = id;
    }
}
