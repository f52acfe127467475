package promptgrid.coordinator.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Result of one successful predict call. Append-only; the most recent record
 * for a (cell, row) pair is authoritative.
 */
public final class Prediction {
    private final long id;
    private final String cellId;
    private final String rowId;
    private final String modelId;
    private final String promptId;
    private final String datasetId;
    private final String label;
    private final long latencyMs;
    private final String workerId;
    private final Instant createdAt;

    private Prediction(Builder builder) {
        this.id = builder.id;
        this.cellId = Objects.requireNonNull(builder.cellId, "cellId is required");
        this.rowId = Objects.requireNonNull(builder.rowId, "rowId is required");
        this.modelId = builder.modelId;
        this.promptId = builder.promptId;
        this.datasetId = builder.datasetId;
        this.label = builder.label;
        this.latencyMs = builder.latencyMs;
        this.workerId = builder.workerId;
        this.createdAt = builder.createdAt;
    }

    public long id() {
        return id;
    }

    public String cellId() {
        return cellId;
    }

    public String rowId() {
        return rowId;
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

    public String label() {
        return label;
    }

    public long latencyMs() {
        return latencyMs;
    }

    public String workerId() {
        return workerId;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private long id;
        private String cellId;
        private String rowId;
        private String modelId;
        private String promptId;
        private String datasetId;
        private String label;
        private long latencyMs;
        private String workerId;
        private Instant createdAt;

        public Builder id(long id) {
            this.id = id;
            return this;
        }

        public Builder cellId(String cellId) {
            this.cellId = cellId;
            return this;
        }

        public Builder rowId(String rowId) {
            this.rowId = rowId;
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

        public Builder label(String label) {
            this.label = label;
            return this;
        }

        public Builder latencyMs(long latencyMs) {
            this.latencyMs = latencyMs;
            return this;
        }

        public Builder workerId(String workerId) {
            this.workerId = workerId;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Prediction build() {
            return new Prediction(this);
        }
    }

    @Override
    public String toString() {
        return "Prediction{cell='" + cellId + "', row='" + rowId + "', label='" + label + "', latencyMs=" + latencyMs
                + "}";
    }
}
