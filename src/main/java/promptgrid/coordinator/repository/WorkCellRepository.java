package promptgrid.coordinator.repository;

import promptgrid.coordinator.model.CellLease;
import promptgrid.coordinator.model.CellRegistration;
import promptgrid.coordinator.model.CellStatus;
import promptgrid.coordinator.model.CellSummary;
import promptgrid.coordinator.model.WorkCell;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Repository for work cells and the leases workers hold on them.
 *
 * Every method that moves a cell across a decision point (claim, release,
 * lease expiry, reopen, settle) is a single transaction guarded on the
 * state it expects; losing a race changes nothing.
 */
public interface WorkCellRepository {

    /**
     * Create the cell for (model, prompt, dataset) together with one PENDING
     * row task per dataset row, in a single transaction. The cell is not
     * visible to other connections before all of its tasks exist.
     *
     * If the combination already exists nothing is written and the existing
     * cell is returned with {@code created = false}.
     *
     * @param cellId     ID to use if the cell is created
     * @param maxRetries retry ceiling stored on every new row task
     */
    CellRegistration createWithTasks(String cellId, String modelId, String promptId, String datasetId,
            int maxRetries, Instant now);

    Optional<WorkCell> findById(String cellId);

    Optional<WorkCell> findByCombination(String modelId, String promptId, String datasetId);

    List<WorkCell> findAll();

    List<WorkCell> findByStatus(CellStatus status);

    /**
     * Atomically claim one cell whose model family is in {@code families} and
     * that still has PENDING tasks. AVAILABLE cells are preferred; IN_USE
     * cells may be joined by further workers. The cell moves to IN_USE, its
     * active worker count is incremented and a lease is recorded for the worker.
     *
     * @return the claimed cell, or empty if nothing is eligible
     */
    Optional<WorkCell> claim(String workerId, Set<String> families, Instant now);

    /**
     * Refresh the worker's lease on a cell.
     *
     * @return false if the lease no longer exists (expired by the watchdog)
     */
    boolean renewLease(String cellId, String workerId, Instant now);

    /**
     * Atomically drop the worker's lease, decrement the active worker count
     * and resolve the cell status: DONE if no worker remains and every task is
     * terminal, IN_USE while other workers remain, AVAILABLE otherwise.
     *
     * @return the cell status after the release
     */
    CellStatus release(String cellId, String workerId, Instant now);

    /**
     * Leases not renewed since {@code renewedBefore}.
     */
    List<CellLease> findExpiredLeases(Instant renewedBefore);

    /**
     * Expire an abandoned lease. Guarded by the lease's renewal timestamp; if
     * the worker renewed or released it meanwhile, nothing changes.
     *
     * @return the resolved cell status, or empty if the lease was not expired
     */
    Optional<CellStatus> expireLease(CellLease lease, Instant now);

    /**
     * DONE cells that have at least one PENDING task.
     */
    List<WorkCell> findDoneWithPending();

    /**
     * Reopen a DONE cell that has PENDING tasks: IN_USE if workers are still
     * active, AVAILABLE otherwise. A DONE cell whose tasks are all terminal
     * is never reopened.
     *
     * @return the new status, or empty if the cell was not reopened
     */
    Optional<CellStatus> reopen(String cellId, Instant now);

    /**
     * AVAILABLE cells without active workers whose tasks are all terminal.
     */
    List<WorkCell> findSettleable();

    /**
     * Move a settleable cell to DONE.
     *
     * @return true if the cell was settled
     */
    boolean settle(String cellId, Instant now);

    List<CellLease> findLeases(String cellId);

    /**
     * Every cell with its row tasks counted by status.
     */
    List<CellSummary> summaries();

    Optional<CellSummary> summary(String cellId);
}
