package promptgrid.coordinator.repository;

import promptgrid.coordinator.model.CompletionResult;
import promptgrid.coordinator.model.Prediction;
import promptgrid.coordinator.model.RetryOutcome;
import promptgrid.coordinator.model.RowTask;
import promptgrid.coordinator.model.RowTaskStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository for row tasks.
 *
 * Transitions out of IN_PROGRESS are compare-and-set on the claim the caller
 * holds ({@code claimedAt}, and {@code claimedBy} for workers), so a worker
 * and the watchdog can never both act on the same claim.
 */
public interface RowTaskRepository {

    /**
     * Atomically claim up to {@code limit} PENDING tasks of a cell, moving
     * them to IN_PROGRESS with {@code claimedAt = now}.
     *
     * @return the claimed tasks; empty when the cell has no PENDING task left
     */
    List<RowTask> claimBatch(String cellId, String workerId, int limit, Instant now);

    /**
     * Move an IN_PROGRESS task's claim timestamp forward.
     *
     * @return false if the task no longer carries this claim
     */
    boolean touch(RowTask claimed, Instant now);

    /**
     * Move the claim timestamp of every task still held forward, in one
     * transaction. Tasks that lost their claim are left out of the result.
     *
     * @return the tasks still held, in the given order, carrying the new claim
     */
    List<RowTask> touchAll(List<RowTask> claimed, Instant now);

    /**
     * Mark a claimed task DONE and append its prediction, in one transaction.
     */
    CompletionResult complete(RowTask claimed, Prediction prediction, Instant now);

    /**
     * Return a claimed task after a failed predict call: retry counter + 1,
     * then PENDING, or FAILED if the counter exceeds the task's ceiling.
     * Guarded by worker and claim timestamp.
     */
    RetryOutcome failAttempt(RowTask claimed, String error, Instant now);

    /**
     * IN_PROGRESS tasks whose claim is older than {@code claimedBefore}.
     */
    List<RowTask> findStuck(Instant claimedBefore);

    /**
     * Return an abandoned task. Same transition as
     * {@link #failAttempt(RowTask, String, Instant)} but guarded only by the
     * original claim timestamp.
     */
    RetryOutcome resetStuck(RowTask stuck, Instant now);

    /**
     * Send a DONE task back to PENDING so it is predicted again. The retry
     * counter is left as is.
     *
     * @return true if the task was DONE and is now PENDING
     */
    boolean requeueDone(String cellId, String rowId, Instant now);

    Optional<RowTask> findById(long taskId);

    Optional<RowTask> find(String cellId, String rowId);

    List<RowTask> findByCell(String cellId);

    List<RowTask> findByCellAndStatus(String cellId, RowTaskStatus status);

    int countByStatus(RowTaskStatus status);
}
