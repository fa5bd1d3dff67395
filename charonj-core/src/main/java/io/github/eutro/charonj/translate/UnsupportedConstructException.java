package io.github.eutro.charonj.translate;

import io.github.eutro.charonj.decls.TranslationException;

/**
 * Thrown while building a body that uses a construct with no translation.
 * The item is kept, without its body.
 */
class UnsupportedConstructException extends TranslationException {
    UnsupportedConstructException(String message) {
        super(message);
    }
}
