package com.warden.data;

import com.google.gson.Gson;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import lombok.extern.slf4j.Slf4j;

import javax.annotation.Nullable;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads JSON documents from the classpath or the file system.
 *
 * Usage:
 * <pre>
 * JsonObject data = JsonResourceLoader.load(gson, "/warden.json");
 * JsonObject file = JsonResourceLoader.load(gson, Path.of("warden.json"));
 * </pre>
 */
@Slf4j
public final class JsonResourceLoader {

    private JsonResourceLoader() {
        // Utility class - prevent instantiation
    }

    /**
     * Load a JSON object from a classpath resource.
     *
     * @param gson         the Gson instance for parsing
     * @param resourcePath the classpath resource path (e.g., "/warden.json")
     * @return the parsed JsonObject
     * @throws JsonLoadException if the resource is missing or malformed
     */
    public static JsonObject load(Gson gson, String resourcePath) {
        try (InputStream is = JsonResourceLoader.class.getResourceAsStream(resourcePath)) {
            if (is == null) {
                throw new JsonLoadException("Resource not found: " + resourcePath);
            }
            return read(gson, new InputStreamReader(is, StandardCharsets.UTF_8), resourcePath);
        } catch (IOException e) {
            throw new JsonLoadException("I/O error reading " + resourcePath, e);
        }
    }

    /**
     * Load a JSON object from a file.
     *
     * @param gson the Gson instance for parsing
     * @param file the file to read
     * @return the parsed JsonObject
     * @throws JsonLoadException if the file is missing or malformed
     */
    public static JsonObject load(Gson gson, Path file) {
        if (!Files.isRegularFile(file)) {
            throw new JsonLoadException("File not found: " + file);
        }
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return read(gson, reader, file.toString());
        } catch (IOException e) {
            throw new JsonLoadException("I/O error reading " + file, e);
        }
    }

    /**
     * Try to load a classpath resource, returning null when it is absent or unreadable.
     *
     * @param gson         the Gson instance
     * @param resourcePath the resource path
     * @return JsonObject or null
     */
    @Nullable
    public static JsonObject tryLoadOptional(Gson gson, String resourcePath) {
        try {
            return load(gson, resourcePath);
        } catch (JsonLoadException e) {
            log.debug("Optional JSON resource not found or failed to load: {}", resourcePath);
            return null;
        }
    }

    private static JsonObject read(Gson gson, Reader reader, String source) {
        try {
            JsonObject result = gson.fromJson(reader, JsonObject.class);
            if (result == null) {
                throw new JsonLoadException("Parsed JSON is null for: " + source);
            }
            return result;
        } catch (JsonParseException e) {
            throw new JsonLoadException("Malformed JSON in " + source + ": " + e.getMessage(), e);
        }
    }

    /**
     * Exception thrown when JSON loading fails.
     */
    public static class JsonLoadException extends RuntimeException {
        public JsonLoadException(String message) {
            super(message);
        }

        public JsonLoadException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
