package io.github.eutro.charonj.api;

import io.github.eutro.charonj.api.bits.DiagnosticSummary;
import io.github.eutro.charonj.api.bits.OutputsToDirectory;
import io.github.eutro.charonj.api.events.*;
import io.github.eutro.charonj.decls.DeclTable;
import io.github.eutro.charonj.decls.Diagnostic;
import io.github.eutro.charonj.decls.FunDecl;
import io.github.eutro.charonj.decls.MalformedFeedException;
import io.github.eutro.charonj.export.CrateExporter;
import io.github.eutro.charonj.feed.Feed;
import io.github.eutro.charonj.feed.FeedReader;
import io.github.eutro.charonj.translate.TranslateConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.BlockingQueue;

import static org.junit.jupiter.api.Assertions.*;

public class CrateTranslatorTest {
    static Feed.Crate small() throws IOException {
        try (InputStream in = CrateTranslatorTest.class.getResourceAsStream("/feeds/small.json")) {
            if (in == null) throw new IOException("missing small.json");
            return FeedReader.read(in);
        }
    }

    static FunDecl fun(DeclTable table, String name) {
        for (FunDecl fun : table.getFuns()) {
            if (fun.name.toString().equals(name)) return fun;
        }
        throw new NoSuchElementException(name);
    }

    static TranslateConfig.Builder config() {
        return TranslateConfig.builder().threads(2);
    }

    @Test
    void translatesAndEmits() throws IOException {
        CrateTranslator translator = new CrateTranslator(config().build());
        BlockingQueue<DeclTable> outputs = translator.outputsAsQueue();
        DiagnosticSummary summary = translator.add(DiagnosticSummary.BIT);

        DeclTable table = translator.submitFeed(small()).run();
        assertSame(table, outputs.poll());
        assertTrue(outputs.isEmpty());
        assertTrue(table.isFrozen());
        assertNotNull(fun(table, "small::count").llbcBody);
        assertNotNull(fun(table, "small::tangle").llbcBody);
        assertNull(fun(table, "small::odd").body);

        assertEquals(2, summary.getDiagnostics().size());
        assertEquals(1, summary.count(Diagnostic.Kind.IRREDUCIBLE_REGION));
        assertEquals(1, summary.count(Diagnostic.Kind.UNSUPPORTED_CONSTRUCT));
        assertEquals(0, summary.count(Diagnostic.Kind.UNRESOLVED_CLAUSE));

        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        summary.print(new PrintStream(bytes, true, "UTF-8"));
        String printed = new String(bytes.toByteArray(), StandardCharsets.UTF_8);
        assertTrue(printed.contains("warning: IRREDUCIBLE_REGION in small::tangle"), printed);
        assertTrue(printed.contains("2 diagnostics"), printed);
    }

    @Test
    void eventOrder() throws IOException {
        CrateTranslator translator = new CrateTranslator(config().build());
        List<String> seen = new ArrayList<>();
        translator.listen(RunCrateTranslationEvent.class, evt -> seen.add("run"));
        EventDispatcher<CrateTranslateEvent> lifted = translator.lift();
        lifted.listen(ModifyConfigEvent.class, evt -> seen.add("config"));
        lifted.listen(UllbcPassesEvent.class, evt -> {
            assertFalse(evt.table.isFrozen());
            seen.add("ullbc");
        });
        lifted.listen(LlbcPassesEvent.class, evt -> {
            assertTrue(evt.table.isFrozen());
            seen.add("llbc");
        });
        lifted.listen(DiagnosticEvent.class, evt -> seen.add("diagnostic"));
        lifted.listen(EmitCrateEvent.class, evt -> {
            assertTrue(evt.structured);
            seen.add("emit");
        });
        translator.submitFeed(small()).run();
        assertEquals(Arrays.asList("run", "config", "ullbc", "llbc", "diagnostic", "diagnostic", "emit"), seen);
    }

    @Test
    void ullbcOnly(@TempDir Path dir) throws IOException {
        CrateTranslator translator = new CrateTranslator(config().structureOutput(false).build());
        new OutputsToDirectory<>(dir).addTo(translator.lift());
        List<String> seen = new ArrayList<>();
        translator.lift().listen(LlbcPassesEvent.class, evt -> seen.add("llbc"));

        DeclTable table = translator.submitFeed(small()).run();
        assertTrue(seen.isEmpty());
        assertNull(fun(table, "small::count").llbcBody);
        assertNotNull(fun(table, "small::count").body);
        assertTrue(Files.exists(dir.resolve("small" + OutputsToDirectory.ULLBC_SUFFIX)));
        assertFalse(Files.exists(dir.resolve("small" + OutputsToDirectory.LLBC_SUFFIX)));
    }

    @Test
    void writesBothDocuments(@TempDir Path dir) throws IOException {
        Path out = dir.resolve("nested").resolve("out");
        CrateTranslator translator = new CrateTranslator(config().build());
        new OutputsToDirectory<>(out).addTo(translator.lift());
        DeclTable table = translator.submitFeed(small()).run();

        DeclTable llbc = CrateExporter.decode(Files.readAllBytes(out.resolve("small.llbc.json")));
        assertEquals(table, llbc);
        DeclTable ullbc = CrateExporter.decode(Files.readAllBytes(out.resolve("small.ullbc.json")));
        assertNull(fun(ullbc, "small::count").llbcBody);
        assertEquals(fun(table, "small::count").body, fun(ullbc, "small::count").body);
    }

    @Test
    void failedWriteLeavesNoFiles(@TempDir Path dir) throws IOException {
        // a non-empty directory in the way of the structured output
        Path blocked = Files.createDirectories(dir.resolve("small" + OutputsToDirectory.LLBC_SUFFIX));
        Files.write(blocked.resolve("keep"), new byte[]{1});
        CrateTranslator translator = new CrateTranslator(config().build());
        new OutputsToDirectory<>(dir).addTo(translator.lift());

        assertThrows(RuntimeException.class, () -> translator.submitFeed(small()).run());
        try (java.util.stream.Stream<Path> files = Files.list(dir)) {
            assertEquals(Arrays.asList(blocked), files.collect(java.util.stream.Collectors.toList()));
        }
        assertTrue(Files.exists(blocked.resolve("keep")));
    }

    @Test
    void cancelledEmissionWritesNothing(@TempDir Path dir) throws IOException {
        CrateTranslator translator = new CrateTranslator(config().build());
        translator.lift().listen(EmitCrateEvent.class, EmitCrateEvent::cancel);
        new OutputsToDirectory<>(dir).addTo(translator.lift());
        BlockingQueue<DeclTable> outputs = translator.outputsAsQueue();

        translator.submitFeed(small()).run();
        assertTrue(outputs.isEmpty());
        try (java.util.stream.Stream<Path> files = Files.list(dir)) {
            assertEquals(0, files.count());
        }
    }

    @Test
    void perCrateOptions() throws IOException {
        CrateTranslator translator = new CrateTranslator(config().build());
        DeclTable hidden = translator.submitFeed(small()).opaque("small::secret").run();
        assertTrue(fun(hidden, "small::secret::key").opaque);
        assertNull(fun(hidden, "small::secret::key").body);

        // only that translation was affected
        DeclTable plain = translator.submitFeed(small()).run();
        assertFalse(fun(plain, "small::secret::key").opaque);
        assertTrue(translator.getConfig().opaqueItems.isEmpty());

        translator.lift().listen(ModifyConfigEvent.class, evt -> evt.configBuilder.opaque("small::count"));
        DeclTable modified = translator.submitFeed(small()).run();
        assertTrue(fun(modified, "small::count").opaque);
    }

    @Test
    void malformedFeedsFail() {
        CrateTranslator translator = new CrateTranslator();
        assertThrows(MalformedFeedException.class, () -> translator.submitText("{\"items\": []}"));
        assertThrows(MalformedFeedException.class, () -> translator.submitText(
                "{\"name\": \"x\", \"items\": [{\"kind\": \"global\", \"name\": \"x::G\"}]}").run());
    }
}
