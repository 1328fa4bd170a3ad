package com.warden.config;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class BotConfigLoaderTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private static JsonObject json(String text) {
        return JsonParser.parseString(text).getAsJsonObject();
    }

    // ========================================================================
    // Loading
    // ========================================================================

    @Test
    public void testLoadResource_ReadsEverySection() {
        BotConfig config = BotConfigLoader.loadResource("/config/warden-test.json");

        assertEquals(Duration.ofMillis(250), config.getTickInterval());
        assertEquals(Duration.ofMillis(1500), config.getObservationTimeout());
        assertEquals(0.75, config.getConfidenceFloor(), 0.0);
        assertEquals(Map.of("you_died", "character-death", "connection_lost", "disconnect"),
                config.getFaultLabels());
        assertEquals(40, config.getHealthFloorPercent());
        assertEquals(10, config.getManaFloorPercent());
        assertFalse(config.isRejuvBeforeChicken());
        assertEquals(1000, config.getSaveExitButtonX());
        assertEquals(3, config.getCancelKeyRepeats());
        assertEquals(4, config.getRetryThreshold());
        assertEquals(Map.of("stuck", "RUN_ENDING"), config.getSeverityOverrides());
        assertEquals(6, config.getStuckWindowSize());
        assertEquals(12.5, config.getStuckEpsilon(), 0.0);
        assertEquals(List.of("pindleskin", "mephisto"), config.getEnabledRuns());
        assertEquals(10, config.getRunCount());
        assertEquals(Duration.ofMinutes(3), config.getRunTimeout());
    }

    @Test
    public void testLoadResource_MissingKeysKeepDefaults() {
        BotConfig config = BotConfigLoader.loadResource("/config/warden-test.json");

        assertEquals(BotConfig.DEFAULTS.getActionTimeout(), config.getActionTimeout());
        assertEquals(BotConfig.DEFAULTS.getSaveExitButtonY(), config.getSaveExitButtonY());
        assertEquals(BotConfig.DEFAULTS.getMinHealthToStartRun(), config.getMinHealthToStartRun());
        assertEquals(60, config.getEffectiveHealthWarningPercent());
    }

    @Test
    public void testLoad_FromFile() throws Exception {
        Path file = folder.newFile("warden.json").toPath();
        Files.writeString(file, "{\"recovery\": {\"maxDeathsPerSession\": 2}}", StandardCharsets.UTF_8);

        assertEquals(2, BotConfigLoader.load(file).getMaxDeathsPerSession());
    }

    @Test(expected = ConfigException.class)
    public void testLoad_MissingFile_Throws() {
        BotConfigLoader.load(folder.getRoot().toPath().resolve("absent.json"));
    }

    @Test(expected = ConfigException.class)
    public void testLoad_MalformedJson_Throws() throws Exception {
        Path file = folder.newFile("broken.json").toPath();
        Files.writeString(file, "{\"timing\": ", StandardCharsets.UTF_8);

        BotConfigLoader.load(file);
    }

    @Test
    public void testLoadResourceOrDefaults_Missing_UsesDefaults() {
        assertSame(BotConfig.DEFAULTS, BotConfigLoader.loadResourceOrDefaults("/config/absent.json"));
    }

    // ========================================================================
    // Validation
    // ========================================================================

    @Test
    public void testParse_Empty_Defaults() {
        BotConfig config = BotConfigLoader.parse(new JsonObject());

        assertEquals(BotConfig.DEFAULTS, config);
    }

    @Test(expected = ConfigException.class)
    public void testParse_WrongType_Throws() {
        BotConfigLoader.parse(json("{\"safety\": {\"healthFloorPercent\": \"low\"}}"));
    }

    @Test(expected = ConfigException.class)
    public void testParse_BadDuration_Throws() {
        BotConfigLoader.parse(json("{\"timing\": {\"tickInterval\": \"soon\"}}"));
    }

    @Test(expected = ConfigException.class)
    public void testParse_SectionNotObject_Throws() {
        BotConfigLoader.parse(json("{\"stuck\": 5}"));
    }

    @Test(expected = ConfigException.class)
    public void testParse_OutOfRange_Throws() {
        BotConfigLoader.parse(json("{\"safety\": {\"healthFloorPercent\": 150}}"));
    }

    @Test(expected = ConfigException.class)
    public void testParse_UnknownFaultKind_Throws() {
        BotConfigLoader.parse(json("{\"observation\": {\"faultLabels\": {\"x\": \"meteor\"}}}"));
    }
}
