package com.warden.config;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.warden.data.GsonFactory;
import com.warden.data.JsonResourceLoader;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads {@link BotConfig} from JSON.
 *
 * <p>The document is split into sections mirroring the option groups:
 * <pre>
 * {
 *   "timing":      { "tickInterval": 100, "observationTimeout": "PT2S", ... },
 *   "observation": { "confidenceFloor": 0.6, "faultLabels": { "death": "character-death" } },
 *   "safety":      { "healthFloorPercent": 30, "rejuvBeforeChicken": true, ... },
 *   "exit":        { "saveExitButtonX": 960, "cancelKeyRepeats": 2, ... },
 *   "recovery":    { "retryThreshold": 3, "severityOverrides": { "stuck": "RUN_ENDING" } },
 *   "stuck":       { "windowSize": 5, "epsilon": 10 },
 *   "runs":        { "enabled": ["pindle"], "count": 0, "timeout": "PT2M", "minHealthToStart": 50 }
 * }
 * </pre>
 * Durations are ISO-8601 strings or plain milliseconds. Missing keys keep their defaults.
 */
@Slf4j
public final class BotConfigLoader {

    private static final Gson GSON = GsonFactory.create();

    private BotConfigLoader() {
        // Utility class - prevent instantiation
    }

    /**
     * Load and validate configuration from a file.
     *
     * @param file JSON file
     * @return validated configuration
     * @throws ConfigException if the file is unreadable or a value is invalid
     */
    public static BotConfig load(Path file) {
        try {
            BotConfig config = parse(JsonResourceLoader.load(GSON, file));
            log.info("Loaded configuration from {}", file);
            return config;
        } catch (JsonResourceLoader.JsonLoadException e) {
            throw new ConfigException("Cannot read configuration: " + e.getMessage(), e);
        }
    }

    /**
     * Load and validate configuration from a classpath resource.
     *
     * @param resourcePath classpath resource, e.g. "/warden.json"
     * @return validated configuration
     * @throws ConfigException if the resource is unreadable or a value is invalid
     */
    public static BotConfig loadResource(String resourcePath) {
        try {
            BotConfig config = parse(JsonResourceLoader.load(GSON, resourcePath));
            log.info("Loaded configuration from classpath {}", resourcePath);
            return config;
        } catch (JsonResourceLoader.JsonLoadException e) {
            throw new ConfigException("Cannot read configuration: " + e.getMessage(), e);
        }
    }

    /**
     * Load the classpath resource if present, otherwise fall back to defaults.
     *
     * @param resourcePath classpath resource
     * @return validated configuration
     */
    public static BotConfig loadResourceOrDefaults(String resourcePath) {
        JsonObject root = JsonResourceLoader.tryLoadOptional(GSON, resourcePath);
        if (root == null) {
            log.warn("No configuration found at {}, using defaults", resourcePath);
            return BotConfig.DEFAULTS;
        }
        return parse(root);
    }

    /**
     * Build a validated configuration from a parsed document.
     *
     * @param root the JSON root object
     * @return validated configuration
     * @throws ConfigException if a value has the wrong type or is out of range
     */
    public static BotConfig parse(JsonObject root) {
        BotConfig d = BotConfig.DEFAULTS;
        BotConfig.BotConfigBuilder b = d.toBuilder();

        try {
            JsonObject timing = section(root, "timing");
            b.tickInterval(duration(timing, "tickInterval", d.getTickInterval()));
            b.observationTimeout(duration(timing, "observationTimeout", d.getObservationTimeout()));
            b.actionTimeout(duration(timing, "actionTimeout", d.getActionTimeout()));
            b.transitionWaitTimeout(duration(timing, "transitionWaitTimeout", d.getTransitionWaitTimeout()));

            JsonObject observation = section(root, "observation");
            b.confidenceFloor(decimal(observation, "confidenceFloor", d.getConfidenceFloor()));
            b.faultLabels(stringMap(observation, "faultLabels", d.getFaultLabels()));

            JsonObject safety = section(root, "safety");
            b.healthFloorPercent(integer(safety, "healthFloorPercent", d.getHealthFloorPercent()));
            b.manaFloorPercent(integer(safety, "manaFloorPercent", d.getManaFloorPercent()));
            b.healthWarningPercent(integer(safety, "healthWarningPercent", d.getHealthWarningPercent()));
            b.healthSampleInterval(duration(safety, "sampleInterval", d.getHealthSampleInterval()));
            b.healthSampleTimeout(duration(safety, "sampleTimeout", d.getHealthSampleTimeout()));
            b.healthSampleBufferSize(integer(safety, "sampleBufferSize", d.getHealthSampleBufferSize()));
            b.potionCooldown(duration(safety, "potionCooldown", d.getPotionCooldown()));
            b.rejuvBeforeChicken(bool(safety, "rejuvBeforeChicken", d.isRejuvBeforeChicken()));
            b.rejuvSettleDelay(duration(safety, "rejuvSettleDelay", d.getRejuvSettleDelay()));
            b.healthPotionKey(string(safety, "healthPotionKey", d.getHealthPotionKey()));
            b.rejuvPotionKey(string(safety, "rejuvPotionKey", d.getRejuvPotionKey()));

            JsonObject exit = section(root, "exit");
            b.exitAttemptTimeout(duration(exit, "attemptTimeout", d.getExitAttemptTimeout()));
            b.exitTemplate(string(exit, "template", d.getExitTemplate()));
            b.saveExitButtonX(integer(exit, "saveExitButtonX", d.getSaveExitButtonX()));
            b.saveExitButtonY(integer(exit, "saveExitButtonY", d.getSaveExitButtonY()));
            b.cancelKey(string(exit, "cancelKey", d.getCancelKey()));
            b.cancelKeyRepeats(integer(exit, "cancelKeyRepeats", d.getCancelKeyRepeats()));

            JsonObject recovery = section(root, "recovery");
            b.retryThreshold(integer(recovery, "retryThreshold", d.getRetryThreshold()));
            b.maxConsecutiveFailedRuns(integer(recovery, "maxConsecutiveFailedRuns", d.getMaxConsecutiveFailedRuns()));
            b.maxDeathsPerSession(integer(recovery, "maxDeathsPerSession", d.getMaxDeathsPerSession()));
            b.recoveryWait(duration(recovery, "wait", d.getRecoveryWait()));
            b.severityOverrides(stringMap(recovery, "severityOverrides", d.getSeverityOverrides()));
            b.escapeMinX(integer(recovery, "escapeMinX", d.getEscapeMinX()));
            b.escapeMaxX(integer(recovery, "escapeMaxX", d.getEscapeMaxX()));
            b.escapeMinY(integer(recovery, "escapeMinY", d.getEscapeMinY()));
            b.escapeMaxY(integer(recovery, "escapeMaxY", d.getEscapeMaxY()));

            JsonObject stuck = section(root, "stuck");
            b.stuckWindowSize(integer(stuck, "windowSize", d.getStuckWindowSize()));
            b.stuckEpsilon(decimal(stuck, "epsilon", d.getStuckEpsilon()));

            JsonObject runs = section(root, "runs");
            b.enabledRuns(stringList(runs, "enabled", d.getEnabledRuns()));
            b.runCount(integer(runs, "count", d.getRunCount()));
            b.runTimeout(duration(runs, "timeout", d.getRunTimeout()));
            b.minHealthToStartRun(integer(runs, "minHealthToStart", d.getMinHealthToStartRun()));
        } catch (ClassCastException | IllegalStateException | NumberFormatException | JsonParseException
                 | DateTimeParseException e) {
            throw new ConfigException("Malformed configuration value: " + e.getMessage(), e);
        }

        return b.build().validate();
    }

    // ========================================================================
    // Field readers
    // ========================================================================

    private static JsonObject section(JsonObject root, String name) {
        JsonElement element = root.get(name);
        if (element == null || element.isJsonNull()) {
            return new JsonObject();
        }
        if (!element.isJsonObject()) {
            throw new ConfigException("Section '" + name + "' must be an object");
        }
        return element.getAsJsonObject();
    }

    private static Duration duration(JsonObject section, String key, Duration fallback) {
        JsonElement element = section.get(key);
        if (element == null || element.isJsonNull()) {
            return fallback;
        }
        return GSON.fromJson(element, Duration.class);
    }

    private static int integer(JsonObject section, String key, int fallback) {
        JsonElement element = section.get(key);
        return element == null || element.isJsonNull() ? fallback : element.getAsInt();
    }

    private static double decimal(JsonObject section, String key, double fallback) {
        JsonElement element = section.get(key);
        return element == null || element.isJsonNull() ? fallback : element.getAsDouble();
    }

    private static boolean bool(JsonObject section, String key, boolean fallback) {
        JsonElement element = section.get(key);
        return element == null || element.isJsonNull() ? fallback : element.getAsBoolean();
    }

    private static String string(JsonObject section, String key, String fallback) {
        JsonElement element = section.get(key);
        return element == null || element.isJsonNull() ? fallback : element.getAsString();
    }

    private static List<String> stringList(JsonObject section, String key, List<String> fallback) {
        JsonElement element = section.get(key);
        if (element == null || element.isJsonNull()) {
            return fallback;
        }
        List<String> values = new ArrayList<>();
        for (JsonElement item : element.getAsJsonArray()) {
            values.add(item.getAsString());
        }
        return List.copyOf(values);
    }

    private static Map<String, String> stringMap(JsonObject section, String key, Map<String, String> fallback) {
        JsonElement element = section.get(key);
        if (element == null || element.isJsonNull()) {
            return fallback;
        }
        Map<String, String> values = new LinkedHashMap<>();
        for (Map.Entry<String, JsonElement> entry : element.getAsJsonObject().entrySet()) {
            values.put(entry.getKey(), entry.getValue().getAsString());
        }
        return Map.copyOf(values);
    }
}
