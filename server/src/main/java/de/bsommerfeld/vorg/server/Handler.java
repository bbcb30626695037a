package de.bsommerfeld.vorg.server;

/**
 * Maps one request to exactly one response. Runs synchronously on a worker
 * thread; a thrown exception is answered with {@link Response.Kind#SERVER_ERROR}.
 */
@FunctionalInterface
public interface Handler {

    Response handle(HttpRequest request);
}
