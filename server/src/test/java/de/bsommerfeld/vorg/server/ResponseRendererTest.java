package de.bsommerfeld.vorg.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.nio.charset.StandardCharsets;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class ResponseRendererTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final ResponseRenderer renderer = new ResponseRenderer(MAPPER);

    static Stream<Arguments> variants() {
        return Stream.of(
                Arguments.of(Response.notFound("gone"), 404, "Not Found", "text/plain; charset=utf-8", "gone"),
                Arguments.of(Response.serverError("oops"), 500, "Internal Server Error",
                        "text/plain; charset=utf-8", "oops"),
                Arguments.of(Response.invalidRequest("bad"), 400, "Bad Request", "text/plain; charset=utf-8", "bad"),
                Arguments.of(Response.json(MAPPER.createObjectNode().put("message", "Hello, World!")), 400,
                        "Bad Request", "application/json", "{\"message\":\"Hello, World!\"}"));
    }

    @ParameterizedTest
    @MethodSource("variants")
    void render_shouldMapVariantToStatusAndContentType(Response response, int status, String reason,
            String contentType, String body) {
        var rendered = renderer.render(response, request("GET"));

        assertEquals(status, rendered.status());
        assertEquals(reason, rendered.reason());
        assertEquals(contentType, rendered.headers().get("Content-Type"));
        assertEquals(body, rendered.bodyAsString());
        assertEquals(Integer.toString(body.getBytes(StandardCharsets.UTF_8).length),
                rendered.headers().get("Content-Length"));
        assertEquals("vorg", rendered.headers().get("Server"));
    }

    @Test
    void render_shouldDropBodyButKeepHeadersForHead() {
        var response = Response.notFound("Route /x is not found.");

        var get = renderer.render(response, request("GET"));
        var head = renderer.render(response, request("HEAD"));

        assertEquals(get.status(), head.status());
        assertEquals(get.headers(), head.headers());
        assertEquals(0, head.body().length);
        assertEquals("22", head.headers().get("Content-Length"));
    }

    @Test
    void render_shouldKeepBodyForExtensionMethods() {
        var rendered = renderer.render(Response.notFound("Route /x is not found."), request("PROPFIND"));

        assertEquals(404, rendered.status());
        assertEquals("Route /x is not found.", rendered.bodyAsString());
    }

    @Test
    void render_shouldLeaveConnectionManagementToTransport() {
        var rendered = renderer.render(Response.notFound("x"), request("GET"));

        assertEquals(ImmutableList.of("Server", "Content-Type", "Content-Length"),
                rendered.headers().keySet().asList());
    }

    @Test
    void render_shouldMultiByteCountContentLength() {
        var rendered = renderer.render(Response.notFound("grüße"), request("GET"));
        assertEquals("7", rendered.headers().get("Content-Length"));
    }

    @Test
    void renderRejection_shouldRenderFullBody() {
        var rendered = renderer.renderRejection(Response.notFound("Malformed request: No URI"));

        assertEquals(404, rendered.status());
        assertEquals("Malformed request: No URI", rendered.bodyAsString());
        assertEquals("text/plain; charset=utf-8", rendered.headers().get("Content-Type"));
    }

    private static HttpRequest request(String method) {
        return new HttpRequest(method, "/x", "HTTP/1.1", ImmutableMap.of(), "");
    }
}
