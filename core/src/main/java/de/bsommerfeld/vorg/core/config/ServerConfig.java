package de.bsommerfeld.vorg.core.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;

/**
 * Listener and session settings of the HTTP front end.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ServerConfig {

    @JsonProperty("host")
    private String host = "localhost";

    @JsonProperty("port")
    private int port = 8000;

    /** Read/write deadline per request/response cycle, reset every iteration. */
    @JsonProperty("session-timeout-seconds")
    private int sessionTimeoutSeconds = 30;

    /** 0 selects the detected hardware parallelism. */
    @JsonProperty("worker-threads")
    private int workerThreads = 0;

    @JsonProperty("max-header-bytes")
    private int maxHeaderBytes = 8 * 1024;

    @JsonProperty("max-body-bytes")
    private int maxBodyBytes = 1024 * 1024;

    /** 0 leaves the accept backlog to the platform. */
    @JsonProperty("backlog")
    private int backlog = 0;

    public String getHost() {
        return host;
    }

    public void setHost(String host) {
        this.host = host;
    }

    public int getPort() {
        return port;
    }

    public void setPort(int port) {
        if (port < 0 || port > 65535)
            throw new IllegalArgumentException("Port out of range: " + port);
        this.port = port;
    }

    public int getSessionTimeoutSeconds() {
        return sessionTimeoutSeconds;
    }

    public void setSessionTimeoutSeconds(int sessionTimeoutSeconds) {
        if (sessionTimeoutSeconds <= 0)
            throw new IllegalArgumentException("Session timeout must be positive: " + sessionTimeoutSeconds);
        this.sessionTimeoutSeconds = sessionTimeoutSeconds;
    }

    @JsonIgnore
    public Duration getSessionTimeout() {
        return Duration.ofSeconds(sessionTimeoutSeconds);
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    public void setWorkerThreads(int workerThreads) {
        if (workerThreads < 0)
            throw new IllegalArgumentException("Worker threads must not be negative: " + workerThreads);
        this.workerThreads = workerThreads;
    }

    /**
     * Returns the configured worker count, or the number of available
     * processors (at least 1) when none is configured.
     */
    @JsonIgnore
    public int resolveWorkerThreads() {
        if (workerThreads > 0)
            return workerThreads;
        return Math.max(1, Runtime.getRuntime().availableProcessors());
    }

    public int getMaxHeaderBytes() {
        return maxHeaderBytes;
    }

    public void setMaxHeaderBytes(int maxHeaderBytes) {
        if (maxHeaderBytes <= 0)
            throw new IllegalArgumentException("Header limit must be positive: " + maxHeaderBytes);
        this.maxHeaderBytes = maxHeaderBytes;
    }

    public int getMaxBodyBytes() {
        return maxBodyBytes;
    }

    public void setMaxBodyBytes(int maxBodyBytes) {
        if (maxBodyBytes < 0 || maxBodyBytes == Integer.MAX_VALUE)
            throw new IllegalArgumentException("Body limit out of range: " + maxBodyBytes);
        this.maxBodyBytes = maxBodyBytes;
    }

    public int getBacklog() {
        return backlog;
    }

    public void setBacklog(int backlog) {
        if (backlog < 0)
            throw new IllegalArgumentException("Backlog must not be negative: " + backlog);
        this.backlog = backlog;
    }
}
