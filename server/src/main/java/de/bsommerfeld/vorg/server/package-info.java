/**
 * HTTP engine on embedded Jetty: listener, exact-match dispatch and rendering
 * of a closed set of response variants.
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 *   ProtocolServer          ← Jetty Server, one connector, shared worker pool
 *        │
 *        ├── DispatchHandler         ← every parsed request
 *        │    ┌────┴─────────────┐
 *        │    HandlerRegistry    ResponseRenderer
 *        │    (method, target)   Response → HttpResponse
 *        │
 *        └── MalformedRequestHandler ← bytes Jetty could not parse
 * </pre>
 *
 * <h2>Response Variants</h2>
 *
 * <pre>
 * ┌─────────────────┬────────┬───────────────────────────────┐
 * │ Kind            │ Status │ Content-Type                  │
 * ├─────────────────┼────────┼───────────────────────────────┤
 * │ NOT_FOUND       │ 404    │ text/plain; charset=utf-8     │
 * │ SERVER_ERROR    │ 500    │ text/plain; charset=utf-8     │
 * │ INVALID_REQUEST │ 400    │ text/plain; charset=utf-8     │
 * │ JSON            │ 400    │ application/json              │
 * └─────────────────┴────────┴───────────────────────────────┘
 * </pre>
 *
 * <h2>Wire Behavior</h2>
 * <ul>
 * <li>Every response carries {@code Server}, {@code Content-Type} and
 * {@code Content-Length}. Keep-alive, pipelining and {@code Connection}
 * headers are Jetty's.</li>
 * <li>{@code HEAD} is served by the {@code GET} handler unless registered
 * explicitly; the body is dropped after rendering.</li>
 * <li>Unknown methods and unknown targets get {@code 404} naming the target.
 * Requests Jetty cannot parse get {@code 404} naming the parse failure, and
 * the connection is closed.</li>
 * <li>Bodies over the configured limit get {@code 400} and the connection is
 * closed.</li>
 * </ul>
 */
package de.bsommerfeld.vorg.server;
