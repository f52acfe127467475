package promptgrid.coordinator.server;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.DefaultFullHttpRequest;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpVersion;
import promptgrid.coordinator.api.Controller;
import promptgrid.coordinator.api.Controller.ControllerResponse;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RouterHandlerTest {

    private static FullHttpRequest get(String uri) {
        return new DefaultFullHttpRequest(HttpVersion.HTTP_1_1, HttpMethod.GET, uri);
    }

    private static Controller fixed(String path, RuntimeException failure) {
        return new Controller() {
            @Override
            public boolean matches(HttpMethod method, String p) {
                return method.equals(HttpMethod.GET) && p.equals(path);
            }

            @Override
            public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String p) {
                if (failure != null) {
                    throw failure;
                }
                return ControllerResponse.json("{\"path\":\"" + p + "\"}");
            }
        };
    }

    @Test
    void dispatchesOnPathWithoutQueryString() {
        RouterHandler router = new RouterHandler().registerController(fixed("/api/v1/x", null));

        ControllerResponse response = router.route(null, get("/api/v1/x?verbose=true"));

        assertEquals(HttpResponseStatus.OK, response.status());
        assertEquals("{\"path\":\"/api/v1/x\"}", response.body());
    }

    @Test
    void unknownPathIsNotFound() {
        RouterHandler router = new RouterHandler().registerController(fixed("/api/v1/x", null));

        assertEquals(HttpResponseStatus.NOT_FOUND, router.route(null, get("/api/v1/y")).status());
        assertEquals(HttpResponseStatus.NOT_FOUND,
                router.route(null, new DefaultFullHttpRequest(HttpVersion.HTTP_1_1, HttpMethod.POST, "/api/v1/x"))
                        .status());
    }

    @Test
    void validationErrorsAreBadRequest() {
        RouterHandler router = new RouterHandler()
                .registerController(fixed("/api/v1/x", new IllegalArgumentException("bad \"id\"")));

        ControllerResponse response = router.route(null, get("/api/v1/x"));

        assertEquals(HttpResponseStatus.BAD_REQUEST, response.status());
        assertEquals("{\"error\":\"bad \\\"id\\\"\"}", response.body());
    }

    @Test
    void unexpectedErrorsCarryTheirCauseChain() {
        RuntimeException failure = new IllegalStateException("outer", new RuntimeException("pool exhausted"));
        RouterHandler router = new RouterHandler().registerController(fixed("/api/v1/x", failure));

        ControllerResponse response = router.route(null, get("/api/v1/x"));

        assertEquals(HttpResponseStatus.INTERNAL_SERVER_ERROR, response.status());
        assertTrue(response.body().contains("pool exhausted"));
    }
}
