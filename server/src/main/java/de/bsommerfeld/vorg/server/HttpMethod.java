package de.bsommerfeld.vorg.server;

import java.util.Optional;

/**
 * Methods handlers can be registered for. Tokens are case-sensitive; a
 * request with any other token is still dispatched and ends in the
 * not-found fallback.
 */
public enum HttpMethod {
    GET,
    HEAD,
    POST,
    PUT,
    DELETE,
    PATCH,
    OPTIONS,
    TRACE,
    CONNECT;

    static Optional<HttpMethod> fromToken(String token) {
        for (HttpMethod method : values()) {
            if (method.name().equals(token))
                return Optional.of(method);
        }
        return Optional.empty();
    }
}
