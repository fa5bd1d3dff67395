package io.github.eutro.charonj.api.events;

import org.jetbrains.annotations.NotNull;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * An {@link EventDispatcher} which also fires its events.
 * <p>
 * Listeners of one event class run in the order they were added. A listener that throws stops the
 * dispatch, and the failure is marked with the event being dispatched.
 *
 * @param <S> The supertype of the events.
 */
public class EventSupplier<S> implements EventDispatcher<S> {
    private final Map<Class<?>, List<Consumer<?>>> listeners = new ConcurrentHashMap<>();

    @Override
    public <T extends S> void listen(Class<T> eventClass, @NotNull Consumer<T> listener) {
        List<Consumer<?>> list = listeners.computeIfAbsent(eventClass, k -> new ArrayList<>());
        if (!list.contains(listener)) list.add(listener);
    }

    /**
     * Fire an event, stopping early if a listener cancels it.
     *
     * @param eventClass The exact class of the event.
     * @param event      The event.
     * @param <T>        The type of the event.
     * @return The event, after every listener has seen it.
     */
    public <T extends S> T dispatch(Class<T> eventClass, T event) {
        List<Consumer<?>> eventListeners = listeners.getOrDefault(eventClass, Collections.emptyList());
        // listeners may subscribe more listeners while the event is dispatched
        for (Consumer<?> listener : new ArrayList<>(eventListeners)) {
            if (event instanceof CancellableEvent && ((CancellableEvent) event).isCancelled()) {
                break;
            }
            @SuppressWarnings("unchecked")
            Consumer<T> typed = (Consumer<T>) listener;
            try {
                typed.accept(event);
            } catch (RuntimeException | Error t) {
                t.addSuppressed(new RuntimeException("dispatching " + eventClass.getSimpleName()));
                throw t;
            }
        }
        return event;
    }
}
