package io.github.eutro.charonj.api;

import io.github.eutro.charonj.api.events.*;
import io.github.eutro.charonj.decls.DeclTable;
import io.github.eutro.charonj.decls.Diagnostic;
import io.github.eutro.charonj.feed.Feed;
import io.github.eutro.charonj.names.NamePattern;
import io.github.eutro.charonj.passes.IRPass;
import io.github.eutro.charonj.passes.convert.RemoveReadDiscriminant;
import io.github.eutro.charonj.translate.CrateStructuring;
import io.github.eutro.charonj.translate.Importer;
import io.github.eutro.charonj.translate.TranslateConfig;
import org.jetbrains.annotations.NotNull;

/**
 * The translation of a single crate feed.
 * <p>
 * Translation, performed when {@link #run()} is called, goes as follows:
 * <ol>
 *     <li>{@link RunCrateTranslationEvent} is fired on the {@link CrateTranslator translator}.</li>
 *     <li>{@link ModifyConfigEvent} is fired.</li>
 *     <li>The feed is {@link Importer imported} into a declaration table, with unstructured bodies.</li>
 *     <li>{@link UllbcPassesEvent} is fired.</li>
 *     <li>The table is frozen.</li>
 *     <li>If structured output is on, every body is {@link CrateStructuring structured},
 *     discriminant reads are {@link RemoveReadDiscriminant turned into matches} if enabled,
 *     and {@link LlbcPassesEvent} is fired.</li>
 *     <li>{@link DiagnosticEvent} is fired for each diagnostic.</li>
 *     <li>{@link EmitCrateEvent} is fired.</li>
 * </ol>
 * A fatal error stops the translation where it happens, so nothing is emitted for the crate.
 */
public class CrateTranslation extends EventSupplier<CrateTranslateEvent> {
    private final CrateTranslator translator;

    /**
     * The feed being translated.
     */
    @NotNull
    public Feed.Crate crate;

    CrateTranslation(CrateTranslator translator, @NotNull Feed.Crate crate) {
        this.translator = translator;
        this.crate = crate;
    }

    /**
     * Run the translation.
     * <p>
     * See the documentation of this class for details.
     *
     * @return The table that was emitted.
     */
    public DeclTable run() {
        translator.dispatch(RunCrateTranslationEvent.class, new RunCrateTranslationEvent(this));
        TranslateConfig config = dispatch(ModifyConfigEvent.class,
                new ModifyConfigEvent(translator.getConfig().toBuilder()))
                .configBuilder
                .build();

        DeclTable table = Importer.importCrate(crate, config);
        table = dispatch(UllbcPassesEvent.class, new UllbcPassesEvent(table)).table;
        table.freeze();

        if (config.structureOutput) {
            IRPass<DeclTable, DeclTable> structuring = new CrateStructuring(config);
            if (config.removeReadDiscriminant) {
                structuring = structuring.then(RemoveReadDiscriminant.INSTANCE);
            }
            table = dispatch(LlbcPassesEvent.class, new LlbcPassesEvent(structuring.run(table))).table;
        }

        for (Diagnostic diagnostic : table.getDiagnostics()) {
            dispatch(DiagnosticEvent.class, new DiagnosticEvent(diagnostic));
        }
        dispatch(EmitCrateEvent.class, new EmitCrateEvent(table, config.structureOutput));
        return table;
    }

    /**
     * Import items matching the pattern without their bodies, for this crate only.
     *
     * @param pattern The name pattern.
     * @return This, for convenience.
     */
    public CrateTranslation opaque(String pattern) {
        NamePattern parsed = NamePattern.parse(pattern);
        listen(ModifyConfigEvent.class, evt -> evt.configBuilder.opaque(parsed));
        return this;
    }
}
