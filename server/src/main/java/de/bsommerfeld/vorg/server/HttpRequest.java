package de.bsommerfeld.vorg.server;

import com.google.common.collect.ImmutableMap;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * One request as handed to a {@link Handler}. The method is the raw token
 * from the request line, so methods the engine has no constant for still
 * reach dispatch. Header names are stored lower-case; repeated headers are
 * folded into one comma-separated value. The target is kept verbatim
 * (path plus query) and is what routes are matched against.
 */
public final class HttpRequest {

    private final String method;
    private final String target;
    private final String protocol;
    private final ImmutableMap<String, String> headers;
    private final String body;

    public HttpRequest(String method, String target, String protocol,
            ImmutableMap<String, String> headers, String body) {
        this.method = Objects.requireNonNull(method, "method");
        this.target = Objects.requireNonNull(target, "target");
        this.protocol = Objects.requireNonNull(protocol, "protocol");
        this.headers = Objects.requireNonNull(headers, "headers");
        this.body = Objects.requireNonNull(body, "body");
    }

    public String method() {
        return method;
    }

    /** The method as a known constant, empty for extension methods like {@code PROPFIND}. */
    public Optional<HttpMethod> knownMethod() {
        return HttpMethod.fromToken(method);
    }

    public boolean isHead() {
        return HttpMethod.HEAD.name().equals(method);
    }

    public String target() {
        return target;
    }

    /** The protocol version token, e.g. {@code HTTP/1.1}. */
    public String protocol() {
        return protocol;
    }

    public ImmutableMap<String, String> headers() {
        return headers;
    }

    public Optional<String> header(String name) {
        return Optional.ofNullable(headers.get(name.toLowerCase(Locale.ROOT)));
    }

    public String body() {
        return body;
    }

    @Override
    public String toString() {
        return method + " " + target + " " + protocol;
    }
}
