package de.bsommerfeld.vorg.app;

import com.google.inject.CreationException;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.ProvisionException;
import de.bsommerfeld.vorg.core.util.StorageUtils;
import de.bsommerfeld.vorg.db.RepositoryStore;
import de.bsommerfeld.vorg.db.StoreCorruptedException;
import de.bsommerfeld.vorg.db.StoreIOException;
import de.bsommerfeld.vorg.server.ProtocolServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Command line entry point: {@code vorg server <repository>}.
 */
public final class VorgMain {

    static final String APP_NAME = "vorg";

    static {
        // Initialize Logging Directory via StorageUtils
        Path logDir = StorageUtils.getLogsDir(APP_NAME);
        try {
            if (!Files.exists(logDir)) {
                Files.createDirectories(logDir);
            }
            System.setProperty("LOG_DIR", logDir.toAbsolutePath().toString());
        } catch (IOException e) {
            System.err.println("Failed to create log directory: " + logDir);
            e.printStackTrace();
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(VorgMain.class);

    private static final String USAGE = """
            Vorg file manager:
              vorg [--help] <command>
            Commands:
              server <repository>    run the vorg web interface for a repository
            """;

    private static final String SERVER_USAGE = """
            Run vorg server:
              vorg server <repository>
            """;

    private VorgMain() {
    }

    public static void main(String[] args) {
        int status = run(args);
        if (status != 0)
            System.exit(status);
    }

    static int run(String[] args) {
        if (args.length == 0 || args[0].equals("--help")) {
            System.out.print(USAGE);
            return 0;
        }
        if (!args[0].equals("server")) {
            System.err.println("Unknown command: " + args[0]);
            System.err.print(USAGE);
            return 2;
        }
        if (args.length < 2) {
            System.out.print(SERVER_USAGE);
            return 0;
        }
        return runServer(Paths.get(args[1]));
    }

    private static int runServer(Path repositoryRoot) {
        Injector injector;
        RepositoryStore store;
        try {
            injector = Guice.createInjector(new AppModule(repositoryRoot));
            // Resolve the store first so a broken repository never binds a port
            store = injector.getInstance(RepositoryStore.class);
        } catch (CreationException e) {
            LOG.error("Failed to initialize vorg", e);
            return 1;
        } catch (ProvisionException e) {
            if (e.getCause() instanceof StoreCorruptedException) {
                LOG.error("Repository at {} is corrupted and needs manual repair: {}",
                        repositoryRoot.toAbsolutePath(), e.getCause().getMessage());
            } else {
                LOG.error("Failed to open repository at {}", repositoryRoot.toAbsolutePath(), e);
            }
            return 1;
        }

        ProtocolServer server = injector.getInstance(ProtocolServer.class);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> shutdown(server, store), "vorg-shutdown"));

        try {
            InetSocketAddress address = server.start();
            LOG.info("vorg serving {} on http://{}:{}", repositoryRoot.toAbsolutePath(),
                    address.getHostString(), address.getPort());
            server.awaitTermination();
            return 0;
        } catch (IOException e) {
            LOG.error("Failed to start server", e);
            shutdown(server, store);
            return 1;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            shutdown(server, store);
            return 1;
        }
    }

    private static void shutdown(ProtocolServer server, RepositoryStore store) {
        server.close();
        try {
            store.close();
        } catch (StoreIOException e) {
            LOG.warn("Failed to close repository", e);
        }
    }
}
