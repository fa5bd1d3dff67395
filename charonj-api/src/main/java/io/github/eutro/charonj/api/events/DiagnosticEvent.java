package io.github.eutro.charonj.api.events;

import io.github.eutro.charonj.api.CrateTranslation;
import io.github.eutro.charonj.decls.Diagnostic;
import org.jetbrains.annotations.NotNull;

/**
 * Fired once for each diagnostic recorded on the crate, in the order they were recorded,
 * just before the crate is emitted.
 *
 * @see CrateTranslation
 */
public class DiagnosticEvent implements CrateTranslateEvent {
    @NotNull
    public final Diagnostic diagnostic;

    public DiagnosticEvent(@NotNull Diagnostic diagnostic) {
        this.diagnostic = diagnostic;
    }
}
