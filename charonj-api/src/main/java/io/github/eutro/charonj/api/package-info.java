/**
 * A high level API for translating crate feeds into declaration tables and their exported form.
 * <p>
 * Start with a {@link io.github.eutro.charonj.api.CrateTranslator}, attach
 * {@link io.github.eutro.charonj.api.bits.Bit bits} or listeners to it, then submit and run crates.
 */
package io.github.eutro.charonj.api;
