package promptgrid.coordinator.model;

/**
 * Result of sending an IN_PROGRESS row task back after a failed or abandoned attempt.
 */
public enum RetryOutcome {
    /** Task returned to PENDING with its retry counter incremented */
    REQUEUED,

    /** Retry ceiling exceeded, task is now FAILED */
    FAILED,

    /**
     * The task no longer matched the claim we held (completed, reset or
     * re-claimed meanwhile); nothing was changed
     */
    LOST
}
