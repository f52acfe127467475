package promptgrid.coordinator.model;

/**
 * Result of completing a row task.
 */
public enum CompletionResult {
    /** Task moved to DONE and its prediction appended */
    COMPLETED,

    /** Claim no longer held by the caller; no prediction written */
    LOST
}
