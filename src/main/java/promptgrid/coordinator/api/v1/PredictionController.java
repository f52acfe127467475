package promptgrid.coordinator.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.QueryStringDecoder;
import promptgrid.coordinator.api.Controller;
import promptgrid.coordinator.api.v1.dto.PredictionResponse;
import promptgrid.coordinator.model.PredictionQuery;
import promptgrid.coordinator.server.RouterHandler;
import promptgrid.coordinator.service.GridService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Latest prediction per (cell, row).
 * GET /api/v1/predictions?modelId=&promptId=&datasetId=&family=
 */
public class PredictionController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(PredictionController.class);

    private final GridService gridService;

    public PredictionController(GridService gridService) {
        this.gridService = gridService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/predictions".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            Map<String, List<String>> params = new QueryStringDecoder(req.uri()).parameters();

            PredictionQuery query = PredictionQuery.all()
                    .withModelId(param(params, "modelId"))
                    .withPromptId(param(params, "promptId"))
                    .withDatasetId(param(params, "datasetId"))
                    .withFamily(param(params, "family"));

            List<PredictionResponse> predictions = gridService.latestPredictions(query).stream()
                    .map(PredictionResponse::from)
                    .toList();

            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(
                    Map.of("count", predictions.size(), "predictions", predictions)));

        } catch (Exception e) {
            log.error("Prediction controller error", e);
            return ControllerResponse.error("internal error");
        }
    }

    private static String param(Map<String, List<String>> params, String name) {
        List<String> values = params.get(name);
        if (values == null || values.isEmpty() || values.get(0).isBlank()) {
            return null;
        }
        return values.get(0).trim();
    }
}
