package de.bsommerfeld.vorg.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;

/**
 * Turns a {@link Response} into an {@link HttpResponse}: status and content
 * type from the variant, {@code Server: vorg} on everything. {@code HEAD}
 * responses lose their body but keep the length of the body they would have
 * had.
 */
final class ResponseRenderer {

    private static final Logger LOG = LoggerFactory.getLogger(ResponseRenderer.class);

    static final String SERVER_NAME = "vorg";

    private static final byte[] EMPTY = new byte[0];

    private final ObjectMapper objectMapper;

    ResponseRenderer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    HttpResponse render(Response response, HttpRequest request) {
        byte[] body = encodeBody(response);
        Response.Kind kind = response.kind();
        if (body == null) {
            kind = Response.Kind.SERVER_ERROR;
            body = "Failed to serialize response".getBytes(StandardCharsets.UTF_8);
        }
        return build(kind, body, request.isHead());
    }

    /** Renders a response for bytes that never formed a request. */
    HttpResponse renderRejection(Response response) {
        byte[] body = encodeBody(response);
        return build(response.kind(), body != null ? body : EMPTY, false);
    }

    private static HttpResponse build(Response.Kind kind, byte[] body, boolean headOnly) {
        ImmutableMap<String, String> headers = ImmutableMap.of(
                "Server", SERVER_NAME,
                "Content-Type", kind.contentType(),
                "Content-Length", Integer.toString(body.length));
        return new HttpResponse(kind.status(), kind.reason(), headers, headOnly ? EMPTY : body);
    }

    private byte[] encodeBody(Response response) {
        if (response.kind() != Response.Kind.JSON)
            return response.message().getBytes(StandardCharsets.UTF_8);
        try {
            return objectMapper.writeValueAsBytes(response.payload());
        } catch (JsonProcessingException e) {
            LOG.error("Failed to serialize JSON response payload", e);
            return null;
        }
    }
}
