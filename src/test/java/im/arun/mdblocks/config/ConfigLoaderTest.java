package im.arun.mdblocks.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void noFileNoEnvironment_usesDefaults() {
        MdBlocksConfig config = new ConfigLoader(null, Map.of()).load();

        assertEquals("http://127.0.0.1:12315", config.getApiUrl());
        assertNull(config.getApiToken());
        assertFalse(config.hasApiToken());
        assertEquals(2, config.getMaxRetries());
    }

    @Test
    void explicitFile_overridesDefaults() throws IOException {
        Path file = tempDir.resolve("mdblocks.yaml");
        Files.writeString(file, "apiUrl: http://logseq.local:9999\nmaxRetries: 5\nunknownKey: ignored\n");

        MdBlocksConfig config = new ConfigLoader(file.toString(), Map.of()).load();

        assertEquals("http://logseq.local:9999", config.getApiUrl());
        assertEquals(5, config.getMaxRetries());
        assertEquals(3, config.getConnectTimeoutSeconds());
    }

    @Test
    void missingFile_fallsBackToDefaults() {
        MdBlocksConfig config = new ConfigLoader(tempDir.resolve("absent.yaml").toString(), Map.of()).load();
        assertEquals("http://127.0.0.1:12315", config.getApiUrl());
    }

    @Test
    void unreadableFile_fallsBackToDefaults() throws IOException {
        Path file = tempDir.resolve("broken.yaml");
        Files.writeString(file, "maxRetries: [not a number\n");

        MdBlocksConfig config = new ConfigLoader(file.toString(), Map.of()).load();
        assertEquals(2, config.getMaxRetries());
    }

    @Test
    void environment_overridesFile() throws IOException {
        Path file = tempDir.resolve("mdblocks.yaml");
        Files.writeString(file, "apiUrl: http://from-file:1\n");
        Map<String, String> env = Map.of(
                ConfigLoader.ENV_API_URL, "http://from-env:2",
                ConfigLoader.ENV_API_TOKEN, "env-token");

        MdBlocksConfig config = new ConfigLoader(file.toString(), env).load();

        assertEquals("http://from-env:2", config.getApiUrl());
        assertEquals("env-token", config.getApiToken());
    }

    @Test
    void userOptions_overrideEnvironment() {
        Map<String, String> env = Map.of(ConfigLoader.ENV_API_TOKEN, "env-token");
        Map<String, Object> options = new HashMap<>();
        options.put("api_token", "cli-token");
        options.put("readTimeoutSeconds", "30");
        options.put("retry_backoff_millis", 10);

        MdBlocksConfig config = new ConfigLoader(null, env).load(options);

        assertEquals("cli-token", config.getApiToken());
        assertEquals(30, config.getReadTimeoutSeconds());
        assertEquals(10, config.getRetryBackoffMillis());
    }

    @Test
    void badOptionValues_areSkipped() {
        Map<String, Object> options = new HashMap<>();
        options.put("max_retries", "many");
        options.put("no_such_option", "x");

        MdBlocksConfig config = new ConfigLoader(null, Map.of()).load(options);
        assertEquals(2, config.getMaxRetries());
    }

    @Test
    void eachLoad_returnsFreshCopy() {
        ConfigLoader loader = new ConfigLoader(null, Map.of());
        MdBlocksConfig first = loader.load(Map.of("api_url", "http://changed"));
        MdBlocksConfig second = loader.load();

        assertEquals("http://changed", first.getApiUrl());
        assertEquals("http://127.0.0.1:12315", second.getApiUrl());
    }
}
