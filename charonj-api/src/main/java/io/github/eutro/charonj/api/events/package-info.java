/**
 * Events that occur during a translation.
 * <p>
 * These can be used to adjust the options of a crate, to run extra passes, to collect
 * diagnostics, and to decide where the output goes.
 * <p>
 * Everything revolves around {@link io.github.eutro.charonj.api.events.EventSupplier}s,
 * which can dispatch (or have dispatched on them) events that subclass a specific type.
 */
package io.github.eutro.charonj.api.events;
