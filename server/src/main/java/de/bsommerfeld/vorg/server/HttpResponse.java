package de.bsommerfeld.vorg.server;

import com.google.common.collect.ImmutableMap;
import org.eclipse.jetty.util.Callback;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

/**
 * A rendered response: status, the headers vorg sets itself and the body
 * bytes. Connection management headers are left to Jetty.
 * {@code Content-Length} may describe a body that was dropped for
 * {@code HEAD}.
 */
public final class HttpResponse {

    private final int status;
    private final String reason;
    private final ImmutableMap<String, String> headers;
    private final byte[] body;

    HttpResponse(int status, String reason, ImmutableMap<String, String> headers, byte[] body) {
        this.status = status;
        this.reason = reason;
        this.headers = headers;
        this.body = body;
    }

    public int status() {
        return status;
    }

    public String reason() {
        return reason;
    }

    public ImmutableMap<String, String> headers() {
        return headers;
    }

    public byte[] body() {
        return body.clone();
    }

    public String bodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }

    /** Sets status and headers on {@code response} and writes the body as its last content. */
    void writeTo(org.eclipse.jetty.server.Response response, Callback callback) {
        response.setStatus(status);
        headers.forEach(response.getHeaders()::put);
        response.write(true, ByteBuffer.wrap(body), callback);
    }
}
