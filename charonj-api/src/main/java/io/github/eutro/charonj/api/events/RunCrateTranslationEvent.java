package io.github.eutro.charonj.api.events;

import io.github.eutro.charonj.api.CrateTranslation;
import io.github.eutro.charonj.api.CrateTranslator;
import org.jetbrains.annotations.NotNull;

/**
 * Fired on the translator when a crate translation starts running.
 *
 * @see CrateTranslator
 * @see CrateTranslation
 */
public class RunCrateTranslationEvent implements TranslatorEvent {
    @NotNull
    public CrateTranslation translation;

    public RunCrateTranslationEvent(@NotNull CrateTranslation translation) {
        this.translation = translation;
    }
}
