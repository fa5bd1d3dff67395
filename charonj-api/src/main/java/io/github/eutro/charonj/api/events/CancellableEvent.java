package io.github.eutro.charonj.api.events;

/**
 * An event that a listener can cancel, so that no later listener receives it.
 */
public interface CancellableEvent {
    boolean isCancelled();

    void cancel();
}
