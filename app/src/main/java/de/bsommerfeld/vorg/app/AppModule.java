package de.bsommerfeld.vorg.app;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import com.google.inject.name.Named;
import com.google.inject.name.Names;
import de.bsommerfeld.vorg.core.config.ConfigLoader;
import de.bsommerfeld.vorg.core.config.RepositoryConfig;
import de.bsommerfeld.vorg.core.config.ServerConfig;
import de.bsommerfeld.vorg.core.config.VorgConfig;
import de.bsommerfeld.vorg.core.util.StorageUtils;
import de.bsommerfeld.vorg.db.RepositoryException;
import de.bsommerfeld.vorg.db.RepositoryStore;
import de.bsommerfeld.vorg.db.SqlRepositoryStore;
import de.bsommerfeld.vorg.server.HandlerRegistry;
import de.bsommerfeld.vorg.server.ProtocolServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Guice module for the server process: configuration, repository store,
 * routes and listener.
 */
public class AppModule extends AbstractModule {

    private static final Logger LOG = LoggerFactory.getLogger(AppModule.class);

    static final String REPOSITORY_ROOT = "repositoryRoot";

    private final Path repositoryRoot;
    private final Path configPath;

    public AppModule(Path repositoryRoot) {
        this(repositoryRoot, StorageUtils.getConfigFile(VorgMain.APP_NAME));
    }

    AppModule(Path repositoryRoot, Path configPath) {
        this.repositoryRoot = repositoryRoot;
        this.configPath = configPath;
    }

    @Override
    protected void configure() {
        VorgConfig config = ConfigLoader.load(configPath);
        if (config.isDebugMode())
            LOG.info("Debug mode enabled");

        bind(VorgConfig.class).toInstance(config);
        bind(ServerConfig.class).toInstance(config.getServer());
        bind(RepositoryConfig.class).toInstance(config.getRepository());
        bind(Path.class).annotatedWith(Names.named(REPOSITORY_ROOT)).toInstance(repositoryRoot);
    }

    @Provides
    @Singleton
    ObjectMapper provideObjectMapper() {
        return new ObjectMapper();
    }

    /**
     * Opens the repository once per injector. A corrupted store surfaces as
     * a {@code ProvisionException} caused by
     * {@link de.bsommerfeld.vorg.db.StoreCorruptedException}.
     */
    @Provides
    @Singleton
    RepositoryStore provideRepositoryStore(@Named(REPOSITORY_ROOT) Path root, RepositoryConfig config)
            throws RepositoryException {
        return SqlRepositoryStore.connect(StorageUtils.resolveDatabase(root, config.getDatabaseFile()));
    }

    @Provides
    @Singleton
    HandlerRegistry provideHandlerRegistry(VorgRoutes routes) {
        return routes.registry();
    }

    @Provides
    @Singleton
    ProtocolServer provideProtocolServer(ServerConfig config, HandlerRegistry registry, ObjectMapper mapper) {
        return new ProtocolServer(config, registry, mapper);
    }
}
