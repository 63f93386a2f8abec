package io.leavesfly.meer.config;

import io.leavesfly.meer.exception.ConfigException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ConfigLoader 单元测试
 */
class ConfigLoaderTest {

    private static final String CONFIG = "{\n"
            + "  \"default_model\": \"fast\",\n"
            + "  \"models\": {\n"
            + "    \"fast\": {\"provider\": \"openai\", \"model\": \"gpt-4o-mini\"},\n"
            + "    \"smart\": {\"provider\": \"openai\", \"model\": \"gpt-4o\", \"temperature\": 0.2}\n"
            + "  },\n"
            + "  \"providers\": {\n"
            + "    \"openai\": {\"type\": \"openai\", \"base_url\": \"https://api.openai.com/v1\", \"api_key\": \"sk-file\",\n"
            + "               \"rate_limit\": {\"window_ms\": 1000, \"max_requests\": 5, \"sleep_ms\": 100}}\n"
            + "  },\n"
            + "  \"loop_control\": {\"max_iterations\": 12},\n"
            + "  \"orchestrator\": {\"default_timeout_ms\": 90000},\n"
            + "  \"unknown_section\": true\n"
            + "}";

    @TempDir
    Path dir;

    private final ConfigLoader loader = new ConfigLoader(new MeerConfiguration().objectMapper());

    @Test
    void testLoadFromFile() throws Exception {
        Path file = dir.resolve("config.json");
        Files.writeString(file, CONFIG);

        MeerConfig config = loader.loadConfig(file, Map.of());

        assertEquals("fast", config.getDefaultModel());
        assertEquals("gpt-4o", config.getModels().get("smart").getModel());
        assertEquals(0.2, config.getModels().get("smart").getTemperature());
        LLMProviderConfig provider = config.getProviders().get("openai");
        assertEquals(LLMProviderConfig.ProviderType.OPENAI, provider.getType());
        assertEquals("sk-file", provider.getApiKey());
        assertEquals(5, provider.getRateLimit().getMaxRequests());
        assertEquals(12, config.getLoopControl().getMaxIterations());
        assertEquals(90_000L, config.getOrchestrator().getDefaultTimeoutMs());
        assertEquals(3, config.getRetry().getMaxAttempts());
    }

    @Test
    void testEnvironmentOverrides() throws Exception {
        Path file = dir.resolve("config.json");
        Files.writeString(file, CONFIG);

        MeerConfig config = loader.loadConfig(file, Map.of(
                ConfigLoader.ENV_MODEL_NAME, "smart",
                ConfigLoader.ENV_API_KEY, "sk-env",
                ConfigLoader.ENV_BASE_URL, "http://localhost:8080/v1"));

        assertEquals("smart", config.getDefaultModel());
        assertEquals("sk-env", config.getProviders().get("openai").getApiKey());
        assertEquals("http://localhost:8080/v1", config.getProviders().get("openai").getBaseUrl());
    }

    @Test
    void testUnknownModelFromEnvironmentIsIgnored() throws Exception {
        Path file = dir.resolve("config.json");
        Files.writeString(file, CONFIG);

        MeerConfig config = loader.loadConfig(file, Map.of(ConfigLoader.ENV_MODEL_NAME, "missing"));

        assertEquals("fast", config.getDefaultModel());
    }

    @Test
    void testMissingFileWritesDefaults() {
        Path file = dir.resolve("nested/config.json");

        MeerConfig config = loader.loadConfig(file, Map.of());

        assertTrue(Files.exists(file));
        assertEquals("", config.getDefaultModel());
        assertEquals(10, config.getLoopControl().getMaxIterations());
        assertEquals(60_000L, config.getOrchestrator().getDefaultTimeoutMs());
    }

    @Test
    void testInvalidConfigIsRejected() throws Exception {
        Path brokenJson = dir.resolve("broken.json");
        Files.writeString(brokenJson, "{ not json");
        Path unknownProvider = dir.resolve("unknown.json");
        Files.writeString(unknownProvider,
                "{\"default_model\": \"a\", \"models\": {\"a\": {\"provider\": \"nowhere\"}}}");
        Path missingDefault = dir.resolve("default.json");
        Files.writeString(missingDefault, "{\"default_model\": \"ghost\"}");

        assertThrows(ConfigException.class, () -> loader.loadConfig(brokenJson, Map.of()));
        ConfigException e = assertThrows(ConfigException.class, () -> loader.loadConfig(unknownProvider, Map.of()));
        assertTrue(e.getMessage().contains("unknown provider 'nowhere'"));
        assertThrows(ConfigException.class, () -> loader.loadConfig(missingDefault, Map.of()));
    }

    @Test
    void testSaveAndReload() {
        Path file = dir.resolve("saved.json");
        MeerConfig config = MeerConfig.builder()
                .loopControl(LoopControlConfig.builder().maxIterations(4).build())
                .build();

        loader.saveConfig(config, file);

        assertEquals(4, loader.loadConfig(file, Map.of()).getLoopControl().getMaxIterations());
    }
}
