package de.bsommerfeld.vorg.server;

import com.google.common.collect.ImmutableMap;
import org.eclipse.jetty.http.HttpField;
import org.eclipse.jetty.http.HttpHeader;
import org.eclipse.jetty.http.HttpHeaderValue;
import org.eclipse.jetty.io.Content;
import org.eclipse.jetty.io.EofException;
import org.eclipse.jetty.server.Request;
import org.eclipse.jetty.util.Callback;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.SocketAddress;
import java.nio.channels.ClosedChannelException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Bridges Jetty to the {@link HandlerRegistry}. Each request is copied into an
 * {@link HttpRequest}, dispatched synchronously on the Jetty worker that
 * received it and answered with the rendered {@link HttpResponse}. Jetty
 * keeps requests of one connection in arrival order.
 */
final class DispatchHandler extends org.eclipse.jetty.server.Handler.Abstract {

    private static final Logger LOG = LoggerFactory.getLogger(DispatchHandler.class);

    private final HandlerRegistry registry;
    private final ResponseRenderer renderer;
    private final int maxBodyBytes;

    DispatchHandler(HandlerRegistry registry, ResponseRenderer renderer, int maxBodyBytes) {
        this.registry = registry;
        this.renderer = renderer;
        this.maxBodyBytes = maxBodyBytes;
    }

    @Override
    public boolean handle(Request request, org.eclipse.jetty.server.Response response, Callback callback) {
        SocketAddress peer = request.getConnectionMetaData().getRemoteSocketAddress();

        Optional<String> body;
        try {
            body = readBody(request);
        } catch (IOException e) {
            LOG.debug("Failed to read request body from {}", peer, e);
            callback.failed(e);
            return true;
        }

        if (body.isEmpty()) {
            LOG.debug("Rejecting request from {}: body exceeds {} bytes", peer, maxBodyBytes);
            response.getHeaders().put(HttpHeader.CONNECTION, HttpHeaderValue.CLOSE.asString());
            renderer.renderRejection(Response.invalidRequest("Request body exceeds " + maxBodyBytes + " bytes"))
                    .writeTo(response, callback);
            return true;
        }

        HttpRequest copy = new HttpRequest(
                request.getMethod(),
                target(request),
                request.getConnectionMetaData().getHttpVersion().asString(),
                headers(request),
                body.get());
        Response result = registry.dispatch(copy);
        LOG.debug("{} from {} -> {}", copy, peer, result.kind());

        renderer.render(result, copy).writeTo(response, Callback.from(callback::succeeded, failure -> {
            if (isRoutineEnd(failure)) {
                LOG.debug("Peer {} went away before the response to {} was written", peer, copy);
            } else {
                LOG.warn("Failed to write response to {} for {}: {}", peer, copy, failure.toString());
            }
            callback.failed(failure);
        }));
        return true;
    }

    /** Path plus query exactly as sent, the key routes are matched against. */
    private static String target(Request request) {
        return Objects.requireNonNullElse(request.getHttpURI().getPathQuery(), "");
    }

    private static ImmutableMap<String, String> headers(Request request) {
        Map<String, String> folded = new LinkedHashMap<>();
        for (HttpField field : request.getHeaders()) {
            folded.merge(field.getLowerCaseName(), Objects.requireNonNullElse(field.getValue(), ""),
                    (first, next) -> first + ", " + next);
        }
        return ImmutableMap.copyOf(folded);
    }

    /**
     * Reads the whole body as UTF-8. Empty when it is larger than the
     * configured limit; the rest of the body is left unread then.
     */
    private Optional<String> readBody(Request request) throws IOException {
        long declared = request.getLength();
        if (declared > maxBodyBytes)
            return Optional.empty();
        if (declared == 0)
            return Optional.of("");

        InputStream in = Content.Source.asInputStream(request);
        byte[] bytes = in.readNBytes(maxBodyBytes + 1);
        if (bytes.length > maxBodyBytes)
            return Optional.empty();
        return Optional.of(new String(bytes, StandardCharsets.UTF_8));
    }

    private static boolean isRoutineEnd(Throwable failure) {
        return failure instanceof EofException || failure instanceof ClosedChannelException;
    }
}
