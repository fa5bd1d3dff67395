package io.github.eutro.charonj.export;

import com.google.gson.*;
import com.google.gson.reflect.TypeToken;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonWriter;

import java.io.IOException;
import java.lang.reflect.Modifier;
import java.util.*;

/**
 * Writes values of closed variant sets as JSON objects tagged with the {@code kind} of variant they are,
 * and reads them back.
 * <p>
 * A closed variant set is an abstract class whose variants are its nested subclasses. The tag is the
 * simple name of the variant class. Only values whose declared type is the abstract class are tagged;
 * a field declared as a specific variant needs no tag.
 */
final class TaggedTypeAdapterFactory implements TypeAdapterFactory {
    static final String TAG = "kind";

    private final Set<Class<?>> bases;

    TaggedTypeAdapterFactory(Class<?>... bases) {
        this.bases = new HashSet<>(Arrays.asList(bases));
    }

    @Override
    public <T> TypeAdapter<T> create(Gson gson, TypeToken<T> type) {
        Class<? super T> raw = type.getRawType();
        if (!bases.contains(raw)) return null;
        Map<String, Class<?>> variants = new HashMap<>();
        for (Class<?> nested : raw.getDeclaredClasses()) {
            if (raw.isAssignableFrom(nested) && !Modifier.isAbstract(nested.getModifiers())) {
                variants.put(nested.getSimpleName(), nested);
            }
        }
        TypeAdapter<JsonElement> elements = gson.getAdapter(JsonElement.class);
        return new TypeAdapter<T>() {
            @SuppressWarnings("unchecked")
            @Override
            public void write(JsonWriter out, T value) throws IOException {
                if (value == null) {
                    out.nullValue();
                    return;
                }
                Class<?> variant = value.getClass();
                if (variants.get(variant.getSimpleName()) != variant) {
                    throw new JsonIOException("not a variant of " + raw.getSimpleName() + ": " + variant);
                }
                TypeAdapter<Object> delegate = (TypeAdapter<Object>) gson.getAdapter(variant);
                JsonObject tagged = new JsonObject();
                tagged.addProperty(TAG, variant.getSimpleName());
                for (Map.Entry<String, JsonElement> e : delegate.toJsonTree(value).getAsJsonObject().entrySet()) {
                    tagged.add(e.getKey(), e.getValue());
                }
                elements.write(out, tagged);
            }

            @SuppressWarnings("unchecked")
            @Override
            public T read(JsonReader in) throws IOException {
                JsonElement element = elements.read(in);
                if (element == null || element.isJsonNull()) return null;
                if (!element.isJsonObject()) {
                    throw new JsonParseException("expected an object for " + raw.getSimpleName() + ", got " + element);
                }
                JsonObject obj = element.getAsJsonObject().deepCopy();
                JsonElement tag = obj.remove(TAG);
                if (tag == null || !tag.isJsonPrimitive()) {
                    throw new JsonParseException("missing " + TAG + " for " + raw.getSimpleName());
                }
                Class<?> variant = variants.get(tag.getAsString());
                if (variant == null) {
                    throw new JsonParseException("unknown " + raw.getSimpleName() + " " + TAG + " '" + tag.getAsString() + "'");
                }
                return (T) gson.getAdapter(variant).fromJsonTree(obj);
            }
        };
    }
}
