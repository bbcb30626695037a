package de.bsommerfeld.vorg.server;

import org.eclipse.jetty.http.HttpStatus;
import org.eclipse.jetty.server.Request;
import org.eclipse.jetty.server.handler.ErrorHandler;
import org.eclipse.jetty.util.Callback;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Server-wide error handler. Jetty routes requests it cannot parse here
 * before any dispatch happens; those are answered like an unknown route,
 * with {@link Response.Kind#NOT_FOUND} and a message naming the parse
 * failure. Jetty closes the connection afterwards. Other errors keep Jetty's
 * default rendering.
 */
final class MalformedRequestHandler extends ErrorHandler {

    private static final Logger LOG = LoggerFactory.getLogger(MalformedRequestHandler.class);

    private final ResponseRenderer renderer;

    MalformedRequestHandler(ResponseRenderer renderer) {
        this.renderer = renderer;
    }

    @Override
    public boolean handle(Request request, org.eclipse.jetty.server.Response response, Callback callback)
            throws Exception {
        int status = response.getStatus();
        if (request.getAttribute(ERROR_STATUS) instanceof Integer code)
            status = code;
        if (!isMalformed(status))
            return super.handle(request, response, callback);

        String reason = request.getAttribute(ERROR_MESSAGE) instanceof String message && !message.isBlank()
                ? message
                : HttpStatus.getMessage(status);
        LOG.debug("Unparseable request from {}: {}",
                request.getConnectionMetaData().getRemoteSocketAddress(), reason);

        renderer.renderRejection(Response.notFound("Malformed request: " + reason)).writeTo(response, callback);
        return true;
    }

    /** Syntax errors and unknown protocol versions, as reported by Jetty's parser. */
    static boolean isMalformed(int status) {
        return status == HttpStatus.BAD_REQUEST_400 || status == HttpStatus.HTTP_VERSION_NOT_SUPPORTED_505;
    }
}
