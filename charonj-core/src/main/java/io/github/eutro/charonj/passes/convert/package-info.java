/**
 * {@link io.github.eutro.charonj.passes.IRPass IR passes} that convert bodies between representations,
 * or rewrite them into a different shape.
 */
package io.github.eutro.charonj.passes.convert;
