package io.github.eutro.charonj.api.events;

import org.jetbrains.annotations.NotNull;

import java.util.function.Consumer;

/**
 * A source of translation events that listeners can subscribe to.
 * <p>
 * A {@link io.github.eutro.charonj.api.CrateTranslator} dispatches {@link TranslatorEvent}s, and each
 * {@link io.github.eutro.charonj.api.CrateTranslation} dispatches {@link CrateTranslateEvent}s;
 * {@link io.github.eutro.charonj.api.CrateTranslator#lift()} subscribes to the latter for every crate.
 *
 * @param <S> The supertype of the events.
 */
public interface EventDispatcher<S> {
    /**
     * Subscribe to an event class.
     * <p>
     * Events are matched by their exact class, as passed to dispatch.
     *
     * @param eventClass The event class.
     * @param listener   The listener.
     * @param <T>        The event type.
     */
    <T extends S> void listen(Class<T> eventClass, @NotNull Consumer<T> listener);
}
