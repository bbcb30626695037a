package de.bsommerfeld.vorg.server;

import java.util.Objects;

/** Registry key: method plus the exact request target. */
record RouteKey(HttpMethod method, String route) {

    RouteKey {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(route, "route");
    }

    @Override
    public String toString() {
        return method + " " + route;
    }
}
