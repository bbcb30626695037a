package de.bsommerfeld.vorg.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import de.bsommerfeld.vorg.core.config.ServerConfig;
import org.eclipse.jetty.server.HttpConfiguration;
import org.eclipse.jetty.server.HttpConnectionFactory;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;
import org.eclipse.jetty.util.thread.QueuedThreadPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.Objects;

/**
 * HTTP listener on an embedded Jetty server. One shared pool runs the
 * acceptor, the selector and a fixed number of workers; sessions and
 * handlers share those workers, there is no thread per connection.
 *
 * <p>
 * Jetty owns HTTP/1.x framing, keep-alive and pipelining. Every request is
 * dispatched through the {@link HandlerRegistry}. A connection that stays
 * silent for the session timeout is closed. A failing connection is logged
 * and dropped without affecting the listener or other connections. The
 * server runs until {@link #close()} or process exit.
 */
public final class ProtocolServer implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(ProtocolServer.class);

    private static final String WORKER_NAME = "vorg-worker";

    // Leased from the pool next to the workers.
    private static final int ACCEPTORS = 1;
    private static final int SELECTORS = 1;

    private final ServerConfig config;
    private final HandlerRegistry registry;
    private final ResponseRenderer renderer;

    private Server server;

    public ProtocolServer(ServerConfig config, HandlerRegistry registry) {
        this(config, registry, new ObjectMapper());
    }

    public ProtocolServer(ServerConfig config, HandlerRegistry registry, ObjectMapper objectMapper) {
        this.config = Objects.requireNonNull(config, "config");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.renderer = new ResponseRenderer(Objects.requireNonNull(objectMapper, "objectMapper"));
    }

    /**
     * Binds the configured endpoint with address reuse enabled and starts
     * accepting. Port 0 binds an ephemeral port.
     *
     * @return the bound address
     * @throws IOException if the listener cannot be bound or started
     */
    public synchronized InetSocketAddress start() throws IOException {
        if (server != null)
            throw new IllegalStateException("Server already started");

        int workers = config.resolveWorkerThreads();
        QueuedThreadPool pool = new QueuedThreadPool(workers + ACCEPTORS + SELECTORS);
        pool.setName(WORKER_NAME);
        pool.setReservedThreads(0);

        Server newServer = new Server(pool);
        ServerConnector connector = new ServerConnector(newServer, ACCEPTORS, SELECTORS,
                new HttpConnectionFactory(httpConfiguration()));
        connector.setHost(config.getHost());
        connector.setPort(config.getPort());
        connector.setReuseAddress(true);
        connector.setIdleTimeout(config.getSessionTimeout().toMillis());
        connector.setAcceptQueueSize(config.getBacklog());
        newServer.addConnector(connector);

        newServer.setHandler(new DispatchHandler(registry, renderer, config.getMaxBodyBytes()));
        newServer.setErrorHandler(new MalformedRequestHandler(renderer));

        try {
            newServer.start();
        } catch (Exception e) {
            IOException failure = e instanceof IOException io
                    ? io
                    : new IOException("Failed to start listener on " + config.getHost() + ":" + config.getPort(), e);
            try {
                newServer.stop();
            } catch (Exception stopError) {
                failure.addSuppressed(stopError);
            }
            throw failure;
        }

        server = newServer;
        InetSocketAddress address = new InetSocketAddress(config.getHost(), connector.getLocalPort());
        LOG.info("Listening on {} with {} worker threads and {} routes", address, workers, registry.size());
        return address;
    }

    /** Blocks until the server has stopped after {@link #close()}. */
    public void awaitTermination() throws InterruptedException {
        Server current;
        synchronized (this) {
            current = server;
        }
        if (current == null)
            throw new IllegalStateException("Server not started");
        current.join();
    }

    /**
     * Stops accepting and closes every open connection. Requests being
     * handled at this moment are abandoned.
     */
    @Override
    public synchronized void close() {
        if (server == null || server.isStopping() || server.isStopped())
            return;
        LOG.info("Stopping listener on {}", config.getHost());
        try {
            server.stop();
        } catch (Exception e) {
            LOG.warn("Failed to stop listener", e);
        }
    }

    private HttpConfiguration httpConfiguration() {
        HttpConfiguration http = new HttpConfiguration();
        http.setSendServerVersion(false);
        http.setSendXPoweredBy(false);
        http.setSendDateHeader(false);
        http.setRequestHeaderSize(config.getMaxHeaderBytes());
        return http;
    }
}
