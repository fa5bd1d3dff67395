package io.github.eutro.charonj;

import io.github.eutro.charonj.export.CrateExporter;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.io.UnsupportedEncodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

import static org.junit.jupiter.api.Assertions.*;

public class CliTest {
    private final ByteArrayOutputStream outBytes = new ByteArrayOutputStream();
    private final ByteArrayOutputStream errBytes = new ByteArrayOutputStream();

    int run(String... args) throws UnsupportedEncodingException {
        return Cli.run(args,
                new PrintStream(outBytes, true, "UTF-8"),
                new PrintStream(errBytes, true, "UTF-8"));
    }

    String out() {
        return new String(outBytes.toByteArray(), StandardCharsets.UTF_8);
    }

    String err() {
        return new String(errBytes.toByteArray(), StandardCharsets.UTF_8);
    }

    static Path copyFeed(Path dir) throws IOException {
        Path feed = dir.resolve("small.json");
        try (InputStream in = CliTest.class.getResourceAsStream("/feeds/small.json")) {
            if (in == null) throw new IOException("missing small.json");
            Files.copy(in, feed, StandardCopyOption.REPLACE_EXISTING);
        }
        return feed;
    }

    @Test
    void help() throws IOException {
        assertEquals(0, run("--help"));
        assertTrue(out().startsWith("usage: charonj"), out());
        assertEquals(1, run());
        assertTrue(err().startsWith("usage: charonj"), err());
    }

    @Test
    void badFlags() throws IOException {
        assertEquals(1, run("--bogus", "x.json"));
        assertTrue(err().contains("--bogus: unknown flag"), err());
        assertEquals(1, run("-j", "0", "x.json"));
        assertTrue(err().contains("invalid thread count"), err());
        assertEquals(1, run("-j", "many", "x.json"));
        assertEquals(1, run("--duplication", "sometimes", "x.json"));
        assertTrue(err().contains("unknown mode"), err());
        assertEquals(1, run("--opaque", "a::::b", "x.json"));
        assertEquals(1, run("-o"));
        assertTrue(err().contains("expected directory"), err());
    }

    @Test
    void translates(@TempDir Path dir) throws IOException {
        Path feed = copyFeed(dir);
        Path out = dir.resolve("out");
        assertEquals(0, run("-o", out.toString(),
                "--duplication", "synthetic-join",
                "-j", "2",
                "--no-match-rewrite",
                "--opaque", "small::secret",
                feed.toString()));
        assertTrue(Files.exists(out.resolve("small.ullbc.json")));
        assertTrue(Files.exists(out.resolve("small.llbc.json")));
        assertNotNull(CrateExporter.decode(Files.readAllBytes(out.resolve("small.llbc.json"))));
        assertTrue(err().contains("2 diagnostics"), err());
    }

    @Test
    void ullbcOnly(@TempDir Path dir) throws IOException {
        Path feed = copyFeed(dir);
        Path out = dir.resolve("out");
        assertEquals(0, run("--ullbc-only", "--output", out.toString(), "--", feed.toString()));
        assertTrue(Files.exists(out.resolve("small.ullbc.json")));
        assertFalse(Files.exists(out.resolve("small.llbc.json")));
    }

    @Test
    void failuresDoNotStopOtherFeeds(@TempDir Path dir) throws IOException {
        Path feed = copyFeed(dir);
        Path broken = dir.resolve("broken.json");
        Files.write(broken, "{\"items\": []}".getBytes(StandardCharsets.UTF_8));
        Path out = dir.resolve("out");
        assertEquals(1, run("-o", out.toString(),
                dir.resolve("missing.json").toString(), broken.toString(), feed.toString()));
        assertTrue(err().contains("could not read file"), err());
        assertTrue(err().contains("no crate name"), err());
        assertTrue(Files.exists(out.resolve("small.llbc.json")));
    }
}
