package de.bsommerfeld.vorg.server;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Objects;

/**
 * What a {@link Handler} answers with. The set of variants is closed; each
 * {@link Kind} fixes the status line and content type it renders to.
 *
 * <p>
 * Text variants carry a message, {@link Kind#JSON} carries an object
 * payload. {@code JSON} renders with status 400, which existing clients
 * depend on.
 */
public final class Response {

    static final String TEXT = "text/plain; charset=utf-8";
    static final String JSON_TYPE = "application/json";

    public enum Kind {
        NOT_FOUND(404, "Not Found", TEXT),
        SERVER_ERROR(500, "Internal Server Error", TEXT),
        INVALID_REQUEST(400, "Bad Request", TEXT),
        JSON(400, "Bad Request", JSON_TYPE);

        private final int status;
        private final String reason;
        private final String contentType;

        Kind(int status, String reason, String contentType) {
            this.status = status;
            this.reason = reason;
            this.contentType = contentType;
        }

        public int status() {
            return status;
        }

        public String reason() {
            return reason;
        }

        public String contentType() {
            return contentType;
        }
    }

    private final Kind kind;
    private final String message;
    private final ObjectNode payload;

    private Response(Kind kind, String message, ObjectNode payload) {
        this.kind = kind;
        this.message = message;
        this.payload = payload;
    }

    public static Response notFound(String message) {
        return new Response(Kind.NOT_FOUND, Objects.requireNonNull(message, "message"), null);
    }

    public static Response serverError(String message) {
        return new Response(Kind.SERVER_ERROR, Objects.requireNonNull(message, "message"), null);
    }

    public static Response invalidRequest(String message) {
        return new Response(Kind.INVALID_REQUEST, Objects.requireNonNull(message, "message"), null);
    }

    public static Response json(ObjectNode payload) {
        return new Response(Kind.JSON, null, Objects.requireNonNull(payload, "payload"));
    }

    public Kind kind() {
        return kind;
    }

    /** The text body; {@code null} for {@link Kind#JSON}. */
    public String message() {
        return message;
    }

    /** The object body; {@code null} for the text kinds. */
    public ObjectNode payload() {
        return payload;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Response other))
            return false;
        return kind == other.kind
                && Objects.equals(message, other.message)
                && Objects.equals(payload, other.payload);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, message, payload);
    }

    @Override
    public String toString() {
        return kind + "[" + (kind == Kind.JSON ? payload : message) + "]";
    }
}
