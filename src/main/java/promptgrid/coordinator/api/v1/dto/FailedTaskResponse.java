package promptgrid.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import promptgrid.coordinator.model.RowTask;

import java.time.Instant;

/**
 * A FAILED row task.
 * GET /api/v1/cells/{id}/failed
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FailedTaskResponse(
        @JsonProperty("taskId") long taskId,
        @JsonProperty("rowId") String rowId,
        @JsonProperty("retryCount") int retryCount,
        @JsonProperty("lastError") String lastError,
        @JsonProperty("updatedAt") Instant updatedAt) {

    public static FailedTaskResponse from(RowTask task) {
        return new FailedTaskResponse(task.id(), task.rowId(), task.retryCount(), task.lastError(),
                task.updatedAt());
    }
}
