package de.bsommerfeld.vorg.core.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads {@link VorgConfig} from a TOML file, writing the defaults first if
 * the file does not exist yet. Keys missing from an existing file keep their
 * defaults; unknown keys are ignored.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    private static final TomlMapper MAPPER = TomlMapper.builder()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    private ConfigLoader() {
    }

    /**
     * @param configPath location of {@code config.toml}
     * @return the loaded configuration, never {@code null}
     * @throws ConfigurationException if the file cannot be written or parsed
     */
    public static VorgConfig load(Path configPath) {
        try {
            if (!Files.exists(configPath)) {
                writeDefaults(configPath);
            }
            LOG.info("Loading configuration from: {}", configPath.toAbsolutePath());
            VorgConfig config = MAPPER.readValue(configPath.toFile(), VorgConfig.class);
            if (config == null)
                return new VorgConfig();
            return config;
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from " + configPath, e);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid configuration in " + configPath + ": " + e.getMessage(), e);
        }
    }

    private static void writeDefaults(Path configPath) throws IOException {
        Path parent = configPath.toAbsolutePath().getParent();
        if (parent != null)
            Files.createDirectories(parent);
        MAPPER.writeValue(configPath.toFile(), new VorgConfig());
        LOG.info("Wrote default configuration to {}", configPath.toAbsolutePath());
    }
}
