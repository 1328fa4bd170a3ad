package com.warden.recovery;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.warden.config.BotConfig;
import com.warden.config.ConfigException;
import com.warden.data.GsonFactory;
import com.warden.data.JsonResourceLoader;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Lookup from error kind to severity.
 *
 * <p>The default table ships as the classpath resource {@value #DEFAULT_RESOURCE};
 * configuration may override individual entries. Kinds missing from the table are
 * treated as {@link ErrorSeverity#CRITICAL}.
 */
@Slf4j
public final class SeverityTable {

    public static final String DEFAULT_RESOURCE = "/recovery/severity-table.json";

    private final Map<ErrorKind, ErrorSeverity> table;

    public SeverityTable(Map<ErrorKind, ErrorSeverity> entries) {
        Map<ErrorKind, ErrorSeverity> copy = new EnumMap<>(ErrorKind.class);
        copy.putAll(entries);
        this.table = Collections.unmodifiableMap(copy);
    }

    /**
     * The bundled default table.
     *
     * @throws ConfigException if the resource names an unknown kind or severity
     */
    public static SeverityTable defaults() {
        JsonObject json = JsonResourceLoader.load(GsonFactory.create(), DEFAULT_RESOURCE);
        return new SeverityTable(parse(json, DEFAULT_RESOURCE));
    }

    /**
     * Default table with the configured overrides applied.
     */
    public static SeverityTable fromConfig(BotConfig config) {
        Map<ErrorKind, ErrorSeverity> entries = new EnumMap<>(defaults().table);
        config.getSeverityOverrides().forEach((code, severity) -> {
            ErrorKind kind = ErrorKind.fromCode(code)
                    .orElseThrow(() -> new ConfigException("Unknown error kind '" + code + "'"));
            ErrorSeverity value = ErrorSeverity.valueOf(severity);
            log.info("Severity override: {} -> {}", kind, value);
            entries.put(kind, value);
        });
        return new SeverityTable(entries);
    }

    private static Map<ErrorKind, ErrorSeverity> parse(JsonObject json, String source) {
        Map<ErrorKind, ErrorSeverity> entries = new EnumMap<>(ErrorKind.class);
        for (Map.Entry<String, JsonElement> entry : json.entrySet()) {
            ErrorKind kind = ErrorKind.fromCode(entry.getKey())
                    .orElseThrow(() -> new ConfigException(
                            "Unknown error kind '" + entry.getKey() + "' in " + source));
            try {
                entries.put(kind, ErrorSeverity.valueOf(entry.getValue().getAsString()));
            } catch (IllegalArgumentException | UnsupportedOperationException | IllegalStateException e) {
                throw new ConfigException("Bad severity for '" + entry.getKey() + "' in " + source, e);
            }
        }
        return entries;
    }

    public ErrorSeverity classify(ErrorKind kind) {
        return table.getOrDefault(kind, ErrorSeverity.CRITICAL);
    }

    public boolean contains(ErrorKind kind) {
        return table.containsKey(kind);
    }

    public Map<ErrorKind, ErrorSeverity> asMap() {
        return table;
    }

    @Override
    public String toString() {
        return "SeverityTable" + table;
    }
}
