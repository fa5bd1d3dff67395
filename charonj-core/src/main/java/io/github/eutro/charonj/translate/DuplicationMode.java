package io.github.eutro.charonj.translate;

/**
 * What to do with blocks that several arms of a branch jump to, but that are not where the branch rejoins.
 */
public enum DuplicationMode {
    /**
     * Copy the shared code into every arm that reaches it.
     */
    DUPLICATE_TAILS,
    /**
     * Emit the shared code once after the branch, guarded by a boolean flag that the arms set.
     */
    SYNTHETIC_JOIN,
}
