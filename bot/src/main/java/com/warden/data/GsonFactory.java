package com.warden.data;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;

/**
 * Centralized factory for Gson instances.
 *
 * <p>Instants and durations are written as ISO-8601 strings rather than through
 * reflection, which the module system blocks for java.time internals.
 * Durations are also accepted as a bare number of milliseconds when read, so
 * configuration files can say {@code "tickInterval": 100}.
 */
public final class GsonFactory {

    private GsonFactory() {
        // Utility class - prevent instantiation
    }

    /**
     * Create a Gson instance with java.time adapters registered.
     *
     * @return configured Gson instance
     */
    public static Gson create() {
        return builder().create();
    }

    /**
     * Create a Gson instance with pretty printing enabled.
     *
     * @return configured Gson instance with pretty printing
     */
    public static Gson createPrettyPrinting() {
        return builder().setPrettyPrinting().create();
    }

    /**
     * Get a GsonBuilder pre-configured with the java.time adapters.
     *
     * @return pre-configured GsonBuilder
     */
    public static GsonBuilder builder() {
        return new GsonBuilder()
                .registerTypeAdapter(Instant.class, new InstantAdapter())
                .registerTypeAdapter(Duration.class, new DurationAdapter());
    }

    // ========================================================================
    // TypeAdapters
    // ========================================================================

    /**
     * {@link Instant} as ISO-8601, e.g. "2024-01-15T10:30:00Z".
     */
    private static class InstantAdapter extends TypeAdapter<Instant> {
        @Override
        public void write(JsonWriter out, Instant value) throws IOException {
            if (value == null) {
                out.nullValue();
            } else {
                out.value(value.toString());
            }
        }

        @Override
        public Instant read(JsonReader in) throws IOException {
            if (in.peek() == JsonToken.NULL) {
                in.nextNull();
                return null;
            }
            return Instant.parse(in.nextString());
        }
    }

    /**
     * {@link Duration} as ISO-8601 ("PT1.5S") or as a plain millisecond count.
     */
    private static class DurationAdapter extends TypeAdapter<Duration> {
        @Override
        public void write(JsonWriter out, Duration value) throws IOException {
            if (value == null) {
                out.nullValue();
            } else {
                out.value(value.toString());
            }
        }

        @Override
        public Duration read(JsonReader in) throws IOException {
            JsonToken token = in.peek();
            if (token == JsonToken.NULL) {
                in.nextNull();
                return null;
            }
            if (token == JsonToken.NUMBER) {
                return Duration.ofMillis(in.nextLong());
            }
            return Duration.parse(in.nextString());
        }
    }
}
