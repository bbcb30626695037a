package de.bsommerfeld.vorg.app;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.inject.Inject;
import de.bsommerfeld.vorg.core.config.VorgConfig;
import de.bsommerfeld.vorg.core.domain.Collection;
import de.bsommerfeld.vorg.db.RepositoryStore;
import de.bsommerfeld.vorg.db.StoreIOException;
import de.bsommerfeld.vorg.server.HandlerRegistry;
import de.bsommerfeld.vorg.server.HttpMethod;
import de.bsommerfeld.vorg.server.HttpRequest;
import de.bsommerfeld.vorg.server.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * HTTP routes of the repository server. Handlers close over the store and
 * translate its results and failures into {@link Response}s.
 */
public class VorgRoutes {

    private static final Logger LOG = LoggerFactory.getLogger(VorgRoutes.class);

    static final String STORE_ERROR_MESSAGE = "Failed to read collections from the repository.";

    private final RepositoryStore store;
    private final ObjectMapper mapper;
    private final boolean debugMode;

    @Inject
    public VorgRoutes(RepositoryStore store, ObjectMapper mapper, VorgConfig config) {
        this.store = store;
        this.mapper = mapper;
        this.debugMode = config.isDebugMode();
    }

    public HandlerRegistry registry() {
        return HandlerRegistry.builder()
                .register(HttpMethod.GET, "/", this::helloWorld)
                .register(HttpMethod.GET, "/collections", this::collections)
                .build();
    }

    Response helloWorld(HttpRequest request) {
        return Response.json(mapper.createObjectNode().put("message", "Hello, World!"));
    }

    Response collections(HttpRequest request) {
        List<Collection> collections;
        try {
            collections = store.getCollections();
        } catch (StoreIOException e) {
            LOG.error("Failed to read collections", e);
            // Store details only leave the process in debug mode
            return Response.serverError(debugMode ? STORE_ERROR_MESSAGE + " " + e.getMessage() : STORE_ERROR_MESSAGE);
        }

        ObjectNode payload = mapper.createObjectNode();
        ArrayNode array = payload.putArray("collections");
        for (Collection collection : collections) {
            array.add(CollectionJson.toJson(mapper, collection));
        }
        return Response.json(payload);
    }
}
