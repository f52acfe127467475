package promptgrid.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import promptgrid.coordinator.model.CellSummary;
import promptgrid.coordinator.model.WorkCell;

import java.time.Instant;

/**
 * Response DTO for one work cell and its task counts.
 * GET /api/v1/cells, GET /api/v1/cells/{id}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CellSummaryResponse(
        @JsonProperty("id") String id,
        @JsonProperty("modelId") String modelId,
        @JsonProperty("promptId") String promptId,
        @JsonProperty("datasetId") String datasetId,
        @JsonProperty("status") String status,
        @JsonProperty("activeWorkers") int activeWorkers,
        @JsonProperty("reopenCount") int reopenCount,
        @JsonProperty("totalTasks") int totalTasks,
        @JsonProperty("pending") int pending,
        @JsonProperty("inProgress") int inProgress,
        @JsonProperty("done") int done,
        @JsonProperty("failed") int failed,
        @JsonProperty("progressPercent") int progressPercent,
        @JsonProperty("createdAt") Instant createdAt,
        @JsonProperty("finishedAt") Instant finishedAt) {

    public static CellSummaryResponse from(CellSummary summary) {
        WorkCell cell = summary.cell();
        return new CellSummaryResponse(
                cell.id(),
                cell.modelId(),
                cell.promptId(),
                cell.datasetId(),
                cell.status().name(),
                cell.activeWorkers(),
                cell.reopenCount(),
                summary.total(),
                summary.pending(),
                summary.inProgress(),
                summary.done(),
                summary.failed(),
                summary.progressPercent(),
                cell.createdAt(),
                cell.finishedAt());
    }
}
