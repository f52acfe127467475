package promptgrid.coordinator.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable snapshot of a work cell: the unit of coordination for one
 * (model, prompt, dataset) combination.
 */
public final class WorkCell {
    private final String id;
    private final String modelId;
    private final String promptId;
    private final String datasetId;
    private final CellStatus status;
    private final int activeWorkers;
    private final int totalTasks;
    private final int reopenCount;
    private final Instant createdAt;
    private final Instant finishedAt;

    private WorkCell(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.modelId = Objects.requireNonNull(builder.modelId, "modelId is required");
        this.promptId = Objects.requireNonNull(builder.promptId, "promptId is required");
        this.datasetId = Objects.requireNonNull(builder.datasetId, "datasetId is required");
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.activeWorkers = builder.activeWorkers;
        this.totalTasks = builder.totalTasks;
        this.reopenCount = builder.reopenCount;
        this.createdAt = builder.createdAt;
        this.finishedAt = builder.finishedAt;
    }

    public String id() {
        return id;
    }

    public String modelId() {
        return modelId;
    }

    public String promptId() {
        return promptId;
    }

    public String datasetId() {
        return datasetId;
    }

    public CellStatus status() {
        return status;
    }

    public int activeWorkers() {
        return activeWorkers;
    }

    public int totalTasks() {
        return totalTasks;
    }

    public int reopenCount() {
        return reopenCount;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant finishedAt() {
        return finishedAt;
    }

    public boolean isDone() {
        return status == CellStatus.DONE;
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .modelId(modelId)
                .promptId(promptId)
                .datasetId(datasetId)
                .status(status)
                .activeWorkers(activeWorkers)
                .totalTasks(totalTasks)
                .reopenCount(reopenCount)
                .createdAt(createdAt)
                .finishedAt(finishedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String modelId;
        private String promptId;
        private String datasetId;
        private CellStatus status = CellStatus.AVAILABLE;
        private int activeWorkers;
        private int totalTasks;
        private int reopenCount;
        private Instant createdAt;
        private Instant finishedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder modelId(String modelId) {
            this.modelId = modelId;
            return this;
        }

        public Builder promptId(String promptId) {
            this.promptId = promptId;
            return this;
        }

        public Builder datasetId(String datasetId) {
            this.datasetId = datasetId;
            return this;
        }

        public Builder status(CellStatus status) {
            this.status = status;
            return this;
        }

        public Builder activeWorkers(int activeWorkers) {
            this.activeWorkers = activeWorkers;
            return this;
        }

        public Builder totalTasks(int totalTasks) {
            this.totalTasks = totalTasks;
            return this;
        }

        public Builder reopenCount(int reopenCount) {
            this.reopenCount = reopenCount;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder finishedAt(Instant finishedAt) {
            this.finishedAt = finishedAt;
            return this;
        }

        public WorkCell build() {
            return new WorkCell(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof WorkCell cell))
            return false;
        return Objects.equals(id, cell.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "WorkCell{id='" + id + "', model='" + modelId + "', prompt='" + promptId
                + "', dataset='" + datasetId + "', status=" + status + ", activeWorkers=" + activeWorkers + "}";
    }
}
