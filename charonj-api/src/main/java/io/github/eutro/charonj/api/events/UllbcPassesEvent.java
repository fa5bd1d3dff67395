package io.github.eutro.charonj.api.events;

import io.github.eutro.charonj.api.CrateTranslation;
import io.github.eutro.charonj.decls.DeclTable;
import org.jetbrains.annotations.NotNull;

/**
 * Fired just after the crate is imported, while the table is still open.
 * <p>
 * Listeners may run extra passes over the unstructured bodies here.
 * Whatever they do, the table is frozen right after this event.
 *
 * @see CrateTranslation
 */
public class UllbcPassesEvent implements CrateTranslateEvent {
    @NotNull
    public DeclTable table;

    public UllbcPassesEvent(@NotNull DeclTable table) {
        this.table = table;
    }
}
