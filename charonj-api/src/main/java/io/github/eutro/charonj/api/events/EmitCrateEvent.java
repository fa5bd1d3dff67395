package io.github.eutro.charonj.api.events;

import io.github.eutro.charonj.api.CrateTranslation;
import io.github.eutro.charonj.decls.DeclTable;
import org.jetbrains.annotations.NotNull;

/**
 * Fired when a crate has been translated in full and should be emitted.
 *
 * @see CrateTranslation
 */
public class EmitCrateEvent implements CrateTranslateEvent, CancellableEvent {
    /**
     * The frozen table of the crate.
     */
    @NotNull
    public DeclTable table;
    /**
     * Whether the bodies in the table were structured.
     */
    public boolean structured;
    private boolean cancelled = false;

    public EmitCrateEvent(@NotNull DeclTable table, boolean structured) {
        this.table = table;
        this.structured = structured;
    }

    @Override
    public boolean isCancelled() {
        return cancelled;
    }

    @Override
    public void cancel() {
        cancelled = true;
    }
}
