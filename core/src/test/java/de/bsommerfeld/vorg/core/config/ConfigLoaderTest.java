package de.bsommerfeld.vorg.core.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_shouldWriteDefaultsWhenFileIsMissing() {
        Path configPath = tempDir.resolve("nested").resolve("config.toml");

        VorgConfig config = ConfigLoader.load(configPath);

        assertTrue(Files.exists(configPath));
        assertEquals(8000, config.getServer().getPort());
        assertEquals("vorg.db", config.getRepository().getDatabaseFile());
    }

    @Test
    void load_shouldReadBackWrittenDefaults() {
        Path configPath = tempDir.resolve("config.toml");
        ConfigLoader.load(configPath);

        VorgConfig reloaded = ConfigLoader.load(configPath);
        assertEquals("localhost", reloaded.getServer().getHost());
        assertEquals(30, reloaded.getServer().getSessionTimeoutSeconds());
    }

    @Test
    void load_shouldOverrideOnlyPresentKeys() throws Exception {
        Path configPath = tempDir.resolve("config.toml");
        Files.writeString(configPath, """
                debug-mode = true

                [server]
                port = 9000
                worker-threads = 2
                """, StandardCharsets.UTF_8);

        VorgConfig config = ConfigLoader.load(configPath);

        assertTrue(config.isDebugMode());
        assertEquals(9000, config.getServer().getPort());
        assertEquals(2, config.getServer().resolveWorkerThreads());
        assertEquals("localhost", config.getServer().getHost());
        assertEquals("vorg.db", config.getRepository().getDatabaseFile());
    }

    @Test
    void load_shouldIgnoreUnknownKeys() throws Exception {
        Path configPath = tempDir.resolve("config.toml");
        Files.writeString(configPath, """
                legacy-option = "x"

                [server]
                port = 8100
                """, StandardCharsets.UTF_8);

        assertEquals(8100, ConfigLoader.load(configPath).getServer().getPort());
    }

    @Test
    void load_shouldFailOnMalformedToml() throws Exception {
        Path configPath = tempDir.resolve("config.toml");
        Files.writeString(configPath, "[server\nport = = 1", StandardCharsets.UTF_8);

        assertThrows(ConfigurationException.class, () -> ConfigLoader.load(configPath));
    }

    @Test
    void load_shouldFailOnInvalidValues() throws Exception {
        Path configPath = tempDir.resolve("config.toml");
        Files.writeString(configPath, "[server]\nsession-timeout-seconds = 0\n", StandardCharsets.UTF_8);

        assertThrows(ConfigurationException.class, () -> ConfigLoader.load(configPath));
    }

    @Test
    void load_shouldFailOnZeroHeaderLimit() throws Exception {
        Path configPath = tempDir.resolve("config.toml");
        Files.writeString(configPath, "[server]\nmax-header-bytes = 0\n", StandardCharsets.UTF_8);

        var e = assertThrows(ConfigurationException.class, () -> ConfigLoader.load(configPath));
        assertTrue(e.getMessage().contains(configPath.toString()), e.getMessage());
    }
}
