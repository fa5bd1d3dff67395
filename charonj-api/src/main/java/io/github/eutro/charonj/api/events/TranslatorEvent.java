package io.github.eutro.charonj.api.events;

import io.github.eutro.charonj.api.CrateTranslator;

/**
 * An event fired on a {@link CrateTranslator}.
 */
public interface TranslatorEvent {
}
