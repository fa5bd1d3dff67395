package io.github.eutro.charonj.feed;

import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import io.github.eutro.charonj.decls.MalformedFeedException;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads an import feed from JSON.
 */
public final class FeedReader {
    private static final Gson GSON = new GsonBuilder()
            .setFieldNamingPolicy(FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES)
            .create();

    private FeedReader() {
    }

    /**
     * Read a feed.
     *
     * @param reader The reader to read the JSON from.
     * @return The feed.
     * @throws MalformedFeedException If the JSON could not be parsed, or has no crate name.
     */
    public static Feed.Crate read(Reader reader) {
        Feed.Crate crate;
        try {
            crate = GSON.fromJson(reader, Feed.Crate.class);
        } catch (JsonParseException e) {
            throw new MalformedFeedException("Unparsable import feed: " + e.getMessage(), e);
        }
        if (crate == null) {
            throw new MalformedFeedException("Empty import feed");
        }
        if (crate.name == null) {
            throw new MalformedFeedException("Import feed has no crate name");
        }
        return crate;
    }

    public static Feed.Crate read(String json) {
        return read(new StringReader(json));
    }

    public static Feed.Crate read(InputStream in) {
        return read(new InputStreamReader(in, StandardCharsets.UTF_8));
    }

    public static Feed.Crate read(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(reader);
        }
    }
}
