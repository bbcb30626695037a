package de.bsommerfeld.vorg.server;

import com.google.common.collect.ImmutableMap;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class HttpRequestTest {

    @Test
    void header_shouldLookUpCaseInsensitively() {
        var request = new HttpRequest("GET", "/", "HTTP/1.1", ImmutableMap.of("content-type", "application/json"), "");

        assertEquals("application/json", request.header("Content-Type").orElseThrow());
        assertTrue(request.header("Accept").isEmpty());
    }

    @Test
    void knownMethod_shouldResolveRegisteredMethodTokens() {
        var request = new HttpRequest("DELETE", "/x", "HTTP/1.1", ImmutableMap.of(), "");
        assertEquals(HttpMethod.DELETE, request.knownMethod().orElseThrow());
    }

    @ParameterizedTest
    @ValueSource(strings = { "PROPFIND", "MKCOL", "get", "Head" })
    void knownMethod_shouldBeEmptyForExtensionOrMiscasedTokens(String token) {
        var request = new HttpRequest(token, "/x", "HTTP/1.1", ImmutableMap.of(), "");

        assertTrue(request.knownMethod().isEmpty());
        assertEquals(token, request.method());
    }

    @Test
    void isHead_shouldOnlyMatchExactHeadToken() {
        assertTrue(new HttpRequest("HEAD", "/", "HTTP/1.1", ImmutableMap.of(), "").isHead());
        assertFalse(new HttpRequest("head", "/", "HTTP/1.1", ImmutableMap.of(), "").isHead());
        assertFalse(new HttpRequest("GET", "/", "HTTP/1.1", ImmutableMap.of(), "").isHead());
    }

    @Test
    void toString_shouldRenderRequestLine() {
        var request = new HttpRequest("PROPFIND", "/x?depth=1", "HTTP/1.0", ImmutableMap.of(), "");
        assertEquals("PROPFIND /x?depth=1 HTTP/1.0", request.toString());
    }
}
