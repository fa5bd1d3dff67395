package io.github.eutro.charonj.api.events;

import io.github.eutro.charonj.api.CrateTranslation;

/**
 * An event fired during the translation of a single crate.
 *
 * @see CrateTranslation
 */
public interface CrateTranslateEvent {
}
