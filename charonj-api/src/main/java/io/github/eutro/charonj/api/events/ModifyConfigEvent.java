package io.github.eutro.charonj.api.events;

import io.github.eutro.charonj.api.CrateTranslation;
import io.github.eutro.charonj.translate.TranslateConfig;
import org.jetbrains.annotations.NotNull;

/**
 * Fired before the crate is imported, to adjust the options it is translated with.
 *
 * @see CrateTranslation
 */
public class ModifyConfigEvent implements CrateTranslateEvent {
    /**
     * The options, seeded from the translator's.
     */
    @NotNull
    public TranslateConfig.Builder configBuilder;

    public ModifyConfigEvent(@NotNull TranslateConfig.Builder configBuilder) {
        this.configBuilder = configBuilder;
    }
}
