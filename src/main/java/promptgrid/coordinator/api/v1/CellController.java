package promptgrid.coordinator.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import promptgrid.coordinator.api.Controller;
import promptgrid.coordinator.api.v1.dto.CellSummaryResponse;
import promptgrid.coordinator.api.v1.dto.FailedTaskResponse;
import promptgrid.coordinator.model.CellSummary;
import promptgrid.coordinator.server.RouterHandler;
import promptgrid.coordinator.service.GridService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for work cell status (read-only).
 *
 * GET /api/v1/cells - All cells with task counts
 * GET /api/v1/cells/{cellId} - One cell
 * GET /api/v1/cells/{cellId}/failed - Failed row tasks of a cell
 */
public class CellController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(CellController.class);

    private static final Pattern CELLS_PATTERN = Pattern.compile("^/api/v1/cells$");
    private static final Pattern CELL_BY_ID_PATTERN = Pattern.compile("^/api/v1/cells/([^/]+)$");
    private static final Pattern CELL_FAILED_PATTERN = Pattern.compile("^/api/v1/cells/([^/]+)/failed$");

    private final GridService gridService;

    public CellController(GridService gridService) {
        this.gridService = gridService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (!method.equals(HttpMethod.GET)) {
            return false;
        }
        return CELLS_PATTERN.matcher(path).matches()
                || CELL_BY_ID_PATTERN.matcher(path).matches()
                || CELL_FAILED_PATTERN.matcher(path).matches();
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            if (CELLS_PATTERN.matcher(path).matches()) {
                return handleListCells();
            }

            Matcher failedMatcher = CELL_FAILED_PATTERN.matcher(path);
            if (failedMatcher.matches()) {
                return handleFailedTasks(failedMatcher.group(1));
            }

            Matcher cellMatcher = CELL_BY_ID_PATTERN.matcher(path);
            if (cellMatcher.matches()) {
                return handleGetCell(cellMatcher.group(1));
            }

            return ControllerResponse.notFound("unknown cell endpoint");

        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        } catch (Exception e) {
            log.error("Cell controller error", e);
            return ControllerResponse.error("internal error");
        }
    }

    private ControllerResponse handleListCells() throws Exception {
        List<CellSummaryResponse> cells = gridService.summaries().stream()
                .map(CellSummaryResponse::from)
                .toList();

        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(
                Map.of("count", cells.size(), "cells", cells)));
    }

    private ControllerResponse handleGetCell(String cellId) throws Exception {
        Optional<CellSummary> summary = gridService.summary(cellId);
        if (summary.isEmpty()) {
            return ControllerResponse.notFound("cell not found: " + cellId);
        }
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(
                CellSummaryResponse.from(summary.get())));
    }

    private ControllerResponse handleFailedTasks(String cellId) throws Exception {
        if (gridService.summary(cellId).isEmpty()) {
            return ControllerResponse.notFound("cell not found: " + cellId);
        }

        List<FailedTaskResponse> failed = gridService.failedTasks(cellId).stream()
                .map(FailedTaskResponse::from)
                .toList();

        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(
                Map.of("cellId", cellId, "count", failed.size(), "tasks", failed)));
    }
}
