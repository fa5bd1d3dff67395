/**
 * The ext API allows for associating arbitrary data with
 * instances of {@link io.github.eutro.charonj.ext.ExtContainer}.
 *
 * <pre>{@code
 * UllbcBody body = ...;
 * body.getExtOrThrow(CommonExts.METADATA_STATE).ensureValid(body, MetadataState.DOMS);
 *
 * BasicBlock block = body.blocks.get(3);
 * block.getExtOrThrow(CommonExts.IDOM); // => the index of the block's immediate dominator
 * }</pre>
 * <p>
 * This is useful for the analyses the structuring runs over a body, which require some extra scratch data
 * on each block, that they then discard after. It also keeps that data out of the IR proper:
 * exts are never serialized, and never take part in equality.
 */
package io.github.eutro.charonj.ext;
