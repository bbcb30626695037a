package de.bsommerfeld.vorg.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Root of {@code config.toml}. Every field carries a default so that a fresh
 * installation runs without any file edits.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class VorgConfig {

    @JsonProperty("debug-mode")
    private boolean debugMode = false;

    @JsonProperty("server")
    private ServerConfig server = new ServerConfig();

    @JsonProperty("repository")
    private RepositoryConfig repository = new RepositoryConfig();

    public boolean isDebugMode() {
        return debugMode;
    }

    public void setDebugMode(boolean debugMode) {
        this.debugMode = debugMode;
    }

    public ServerConfig getServer() {
        return server;
    }

    public RepositoryConfig getRepository() {
        return repository;
    }
}
