package promptgrid.coordinator.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelHandler.Sharable;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.*;
import promptgrid.coordinator.api.Controller;
import promptgrid.coordinator.api.Controller.ControllerResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static io.netty.handler.codec.http.HttpHeaderNames.CONTENT_TYPE;
import static io.netty.handler.codec.http.HttpResponseStatus.*;
import static io.netty.handler.codec.http.HttpVersion.HTTP_1_1;

/**
 * Central router that dispatches HTTP requests to registered controllers.
 *
 * Only /api/v1/* endpoints are served; everything else returns 404.
 *
 * This handler is @Sharable because it has no per-channel state.
 */
@Sharable
public class RouterHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

    private static final Logger log = LoggerFactory.getLogger(RouterHandler.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
            .findAndRegisterModules();

    private final List<Controller> controllers = new ArrayList<>();

    /**
     * Register a controller to handle requests.
     * Controllers are checked in order of registration.
     */
    public RouterHandler registerController(Controller controller) {
        controllers.add(controller);
        log.debug("Registered controller: {}", controller.getClass().getSimpleName());
        return this;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest req) {
        ControllerResponse response = route(ctx, req);
        writeSafe(ctx, response.status(), response.contentType(), response.body());
    }

    /**
     * Dispatch a request to the first matching controller.
     */
    public ControllerResponse route(ChannelHandlerContext ctx, FullHttpRequest req) {
        String uri = req.uri();
        HttpMethod method = req.method();

        // Extract path without query string
        String path = uri.contains("?") ? uri.substring(0, uri.indexOf("?")) : uri;

        try {
            for (Controller controller : controllers) {
                if (controller.matches(method, path)) {
                    return controller.handle(ctx, req, path);
                }
            }

            log.debug("No handler for: {} {}", method, path);
            return ControllerResponse.notFound("not found");

        } catch (IllegalArgumentException e) {
            log.warn("Validation error: {}", e.getMessage());
            return ControllerResponse.badRequest(e.getMessage());
        } catch (Throwable t) {
            log.error("Handler error: {} {}", method, path, t);

            // Full error chain for debugging
            StringBuilder errorChain = new StringBuilder(t.toString());
            Throwable cause = t.getCause();
            while (cause != null) {
                errorChain.append(" <- ").append(cause);
                cause = cause.getCause();
            }
            return ControllerResponse.error(errorChain.toString());
        }
    }

    /**
     * Safe write that catches any exceptions during response writing.
     */
    private void writeSafe(ChannelHandlerContext ctx, HttpResponseStatus status, String contentType, String body) {
        try {
            byte[] bytes = (body == null ? "" : body).getBytes(StandardCharsets.UTF_8);
            FullHttpResponse response = new DefaultFullHttpResponse(HTTP_1_1, status, Unpooled.wrappedBuffer(bytes));
            response.headers().set(CONTENT_TYPE, contentType + "; charset=utf-8");
            response.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, bytes.length);
            ctx.writeAndFlush(response);
        } catch (Throwable t) {
            log.error("Failed to write response, closing channel", t);
            ctx.close();
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.error("Unhandled exception in channel: {}", cause.getMessage(), cause);
        try {
            writeSafe(ctx, INTERNAL_SERVER_ERROR, "application/json", "{\"error\":\"channel error\"}");
        } finally {
            ctx.close();
        }
    }

    /**
     * Get the shared ObjectMapper for JSON serialization.
     */
    public static ObjectMapper mapper() {
        return MAPPER;
    }
}
