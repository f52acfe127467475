package promptgrid.coordinator.model;

/**
 * Execution status of a single (cell, row) prediction.
 */
public enum RowTaskStatus {
    /** Waiting to be claimed */
    PENDING,
    /** Claimed by a worker, prediction running */
    IN_PROGRESS,
    /** Prediction written */
    DONE,
    /** Retry ceiling exceeded; never claimed again */
    FAILED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }
}
