package promptgrid.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import promptgrid.coordinator.model.Prediction;

import java.time.Instant;

/**
 * The authoritative prediction for one (cell, row).
 * GET /api/v1/predictions
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PredictionResponse(
        @JsonProperty("cellId") String cellId,
        @JsonProperty("rowId") String rowId,
        @JsonProperty("modelId") String modelId,
        @JsonProperty("promptId") String promptId,
        @JsonProperty("datasetId") String datasetId,
        @JsonProperty("label") String label,
        @JsonProperty("latencyMs") long latencyMs,
        @JsonProperty("workerId") String workerId,
        @JsonProperty("createdAt") Instant createdAt) {

    public static PredictionResponse from(Prediction p) {
        return new PredictionResponse(p.cellId(), p.rowId(), p.modelId(), p.promptId(), p.datasetId(),
                p.label(), p.latencyMs(), p.workerId(), p.createdAt());
    }
}
