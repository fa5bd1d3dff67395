package io.github.eutro.charonj.api;

import io.github.eutro.charonj.api.bits.Bit;
import io.github.eutro.charonj.api.events.*;
import io.github.eutro.charonj.decls.DeclTable;
import io.github.eutro.charonj.feed.Feed;
import io.github.eutro.charonj.feed.FeedReader;
import io.github.eutro.charonj.translate.TranslateConfig;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.io.Reader;
import java.nio.file.Path;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.function.Consumer;

/**
 * Entry point for translating crates.
 * <p>
 * Submitting a feed only parses it; the returned {@link CrateTranslation} does the work when it is
 * {@link CrateTranslation#run() run}. Listeners added here through {@link #lift()} are attached to
 * every crate translation that runs afterwards.
 */
public class CrateTranslator extends EventSupplier<TranslatorEvent> {
    private final TranslateConfig config;

    public CrateTranslator() {
        this(TranslateConfig.DEFAULT);
    }

    /**
     * Construct a translator whose crates start out with the given options.
     *
     * @param config The options.
     */
    public CrateTranslator(TranslateConfig config) {
        this.config = config;
    }

    public TranslateConfig getConfig() {
        return config;
    }

    @Contract(pure = true)
    public CrateTranslation submitFile(Path path) throws IOException {
        return submitFeed(FeedReader.read(path));
    }

    @Contract(pure = true)
    public CrateTranslation submitReader(Reader reader) {
        return submitFeed(FeedReader.read(reader));
    }

    @Contract(pure = true)
    public CrateTranslation submitText(String json) {
        return submitFeed(FeedReader.read(json));
    }

    // not really pure, but the result should not be dropped
    @Contract(pure = true)
    @NotNull
    public CrateTranslation submitFeed(Feed.Crate crate) {
        return new CrateTranslation(this, crate);
    }

    /**
     * Get a dispatcher which attaches listeners to every crate translation run by this translator.
     *
     * @return The dispatcher.
     */
    public EventDispatcher<CrateTranslateEvent> lift() {
        return new EventDispatcher<CrateTranslateEvent>() {
            @Override
            public <T extends CrateTranslateEvent> void listen(Class<T> eventClass, @NotNull Consumer<T> listener) {
                CrateTranslator.this.listen(RunCrateTranslationEvent.class, evt ->
                        evt.translation.listen(eventClass, listener));
            }
        };
    }

    /**
     * Collect every emitted crate into a queue.
     *
     * @return The queue.
     */
    public BlockingQueue<DeclTable> outputsAsQueue() {
        BlockingQueue<DeclTable> queue = new LinkedBlockingQueue<>();
        lift().listen(EmitCrateEvent.class, evt -> queue.add(evt.table));
        return queue;
    }

    public <T> T add(Bit<? super CrateTranslator, T> bit) {
        return bit.addTo(this);
    }
}
