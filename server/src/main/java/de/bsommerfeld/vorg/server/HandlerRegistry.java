package de.bsommerfeld.vorg.server;

import com.google.common.collect.ImmutableMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable route table, assembled through {@link #builder()} before the
 * server starts and only read afterwards, so sessions share it without
 * locking.
 *
 * <p>
 * Lookup is by exact (method, target) match. A {@code HEAD} without its own
 * registration falls back to the {@code GET} handler of the same target.
 * Anything else unmatched, including methods outside {@link HttpMethod},
 * gets the {@link Response.Kind#NOT_FOUND} fallback.
 */
public final class HandlerRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(HandlerRegistry.class);

    static final String INTERNAL_ERROR_MESSAGE = "Internal server error";

    private final ImmutableMap<RouteKey, Handler> handlers;

    private HandlerRegistry(ImmutableMap<RouteKey, Handler> handlers) {
        this.handlers = handlers;
    }

    public static Builder builder() {
        return new Builder();
    }

    public int size() {
        return handlers.size();
    }

    /**
     * Resolves the handler for the raw {@code method} token and
     * {@code target}, never {@code null}. Extension methods nothing can be
     * registered for resolve to the fallback.
     */
    Handler lookup(String method, String target) {
        Optional<HttpMethod> known = HttpMethod.fromToken(method);
        if (known.isEmpty())
            return HandlerRegistry::unknownRoute;
        Handler handler = handlers.get(new RouteKey(known.get(), target));
        if (handler == null && known.get() == HttpMethod.HEAD)
            handler = handlers.get(new RouteKey(HttpMethod.GET, target));
        return handler != null ? handler : HandlerRegistry::unknownRoute;
    }

    /**
     * Runs the matching handler. Exceptions and {@code null} results are
     * turned into {@link Response.Kind#SERVER_ERROR} so one failing handler
     * cannot take its session down.
     */
    Response dispatch(HttpRequest request) {
        Handler handler = lookup(request.method(), request.target());
        Response response;
        try {
            response = handler.handle(request);
        } catch (RuntimeException e) {
            LOG.error("Handler for {} failed", request, e);
            return Response.serverError(INTERNAL_ERROR_MESSAGE);
        }
        if (response == null) {
            LOG.error("Handler for {} returned no response", request);
            return Response.serverError(INTERNAL_ERROR_MESSAGE);
        }
        return response;
    }

    private static Response unknownRoute(HttpRequest request) {
        return Response.notFound("Route " + request.target() + " is not found.");
    }

    /**
     * Collects registrations. Registering a key twice keeps the later handler
     * and logs a warning.
     */
    public static final class Builder {

        private final Map<RouteKey, Handler> handlers = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder register(HttpMethod method, String route, Handler handler) {
            RouteKey key = new RouteKey(method, route);
            Objects.requireNonNull(handler, "handler");
            if (handlers.put(key, handler) != null)
                LOG.warn("Handler for {} registered twice, the later registration wins", key);
            return this;
        }

        public HandlerRegistry build() {
            return new HandlerRegistry(ImmutableMap.copyOf(handlers));
        }
    }
}
