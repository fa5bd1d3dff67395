package io.github.eutro.charonj.api.events;

import io.github.eutro.charonj.api.CrateTranslation;
import io.github.eutro.charonj.decls.DeclTable;
import org.jetbrains.annotations.NotNull;

/**
 * Fired once every body has been structured, and the built-in structured passes have run.
 * <p>
 * Not fired at all if structured output is turned off.
 *
 * @see CrateTranslation
 */
public class LlbcPassesEvent implements CrateTranslateEvent {
    /**
     * The frozen table, with structured bodies attached.
     */
    @NotNull
    public DeclTable table;

    public LlbcPassesEvent(@NotNull DeclTable table) {
        this.table = table;
    }
}
