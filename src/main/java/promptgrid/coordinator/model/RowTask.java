package promptgrid.coordinator.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable snapshot of one (cell, row) prediction unit.
 */
public final class RowTask {
    private final long id;
    private final String cellId;
    private final String rowId;
    private final RowTaskStatus status;
    private final int retryCount;
    private final int maxRetries;
    private final String claimedBy; // worker ID or null
    private final Instant claimedAt;
    private final String lastError;
    private final Instant updatedAt;

    private RowTask(Builder builder) {
        this.id = builder.id;
        this.cellId = Objects.requireNonNull(builder.cellId, "cellId is required");
        this.rowId = Objects.requireNonNull(builder.rowId, "rowId is required");
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.retryCount = builder.retryCount;
        this.maxRetries = builder.maxRetries;
        this.claimedBy = builder.claimedBy;
        this.claimedAt = builder.claimedAt;
        this.lastError = builder.lastError;
        this.updatedAt = builder.updatedAt;
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

    public RowTaskStatus status() {
        return status;
    }

    public int retryCount() {
        return retryCount;
    }

    public int maxRetries() {
        return maxRetries;
    }

    public String claimedBy() {
        return claimedBy;
    }

    public Instant claimedAt() {
        return claimedAt;
    }

    public String lastError() {
        return lastError;
    }

    public Instant updatedAt() {
        return updatedAt;
    }

    /** True if the next reset would still return the task to PENDING */
    public boolean canRetry() {
        return retryCount + 1 <= maxRetries;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    /** Copy of this task carrying a refreshed claim timestamp */
    public RowTask withClaimedAt(Instant claimedAt) {
        return toBuilder().claimedAt(claimedAt).build();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .cellId(cellId)
                .rowId(rowId)
                .status(status)
                .retryCount(retryCount)
                .maxRetries(maxRetries)
                .claimedBy(claimedBy)
                .claimedAt(claimedAt)
                .lastError(lastError)
                .updatedAt(updatedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private long id;
        private String cellId;
        private String rowId;
        private RowTaskStatus status = RowTaskStatus.PENDING;
        private int retryCount = 0;
        private int maxRetries = 3;
        private String claimedBy;
        private Instant claimedAt;
        private String lastError;
        private Instant updatedAt;

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

        public Builder status(RowTaskStatus status) {
            this.status = status;
            return this;
        }

        public Builder retryCount(int retryCount) {
            this.retryCount = retryCount;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder claimedBy(String claimedBy) {
            this.claimedBy = claimedBy;
            return this;
        }

        public Builder claimedAt(Instant claimedAt) {
            this.claimedAt = claimedAt;
            return this;
        }

        public Builder lastError(String lastError) {
            this.lastError = lastError;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public RowTask build() {
            return new RowTask(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof RowTask task))
            return false;
        return id == task.id;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(id);
    }

    @Override
    public String toString() {
        return "RowTask{id=" + id + ", cell='" + cellId + "', row='" + rowId + "', status=" + status
                + ", retryCount=" + retryCount + ", claimedBy='" + claimedBy + "'}";
    }
}
