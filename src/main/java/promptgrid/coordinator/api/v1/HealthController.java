package promptgrid.coordinator.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import promptgrid.coordinator.api.Controller;
import promptgrid.coordinator.api.v1.dto.HealthResponse;
import promptgrid.coordinator.model.RowTaskStatus;
import promptgrid.coordinator.server.RouterHandler;
import promptgrid.coordinator.service.GridService;
import promptgrid.coordinator.store.Database;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.management.ManagementFactory;
import java.time.Duration;
import java.util.Map;

/**
 * Health check controller.
 * GET /api/v1/health
 */
public class HealthController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(HealthController.class);
    private static final String VERSION = "1.0.0";

    private final Database database;
    private final GridService gridService;

    public HealthController(Database database, GridService gridService) {
        this.database = database;
        this.gridService = gridService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/health".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            if (!database.isHealthy()) {
                HealthResponse response = HealthResponse.unhealthy("connection failed");
                return ControllerResponse.json(HttpResponseStatus.SERVICE_UNAVAILABLE,
                        RouterHandler.mapper().writeValueAsString(response));
            }

            Map<RowTaskStatus, Integer> counts = gridService.taskCounts();
            HealthResponse response = HealthResponse.healthy(
                    formatUptime(),
                    VERSION,
                    counts.get(RowTaskStatus.PENDING),
                    counts.get(RowTaskStatus.IN_PROGRESS),
                    counts.get(RowTaskStatus.FAILED));

            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));

        } catch (Exception e) {
            log.error("Health check failed", e);
            try {
                HealthResponse response = HealthResponse.unhealthy(e.getMessage());
                return ControllerResponse.json(HttpResponseStatus.SERVICE_UNAVAILABLE,
                        RouterHandler.mapper().writeValueAsString(response));
            } catch (Exception ex) {
                return ControllerResponse.error("health check failed");
            }
        }
    }

    private String formatUptime() {
        long uptimeMs = ManagementFactory.getRuntimeMXBean().getUptime();
        Duration duration = Duration.ofMillis(uptimeMs);
        long hours = duration.toHours();
        long minutes = duration.toMinutesPart();
        return hours + "h " + minutes + "m";
    }
}
