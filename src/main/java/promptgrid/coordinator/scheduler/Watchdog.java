package promptgrid.coordinator.scheduler;

import promptgrid.coordinator.config.GridConfig;
import promptgrid.coordinator.model.CellLease;
import promptgrid.coordinator.model.CellStatus;
import promptgrid.coordinator.model.RetryOutcome;
import promptgrid.coordinator.model.RowTask;
import promptgrid.coordinator.model.WorkCell;
import promptgrid.coordinator.repository.RowTaskRepository;
import promptgrid.coordinator.repository.WorkCellRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Periodic reconciliation pass over the grid.
 *
 * Workers can vanish mid-task (crash, preemption, hang). A pass:
 * 1. Returns IN_PROGRESS tasks claimed longer than the stale threshold ago
 * to PENDING, or FAILED once their retry ceiling is exceeded
 * 2. Expires cell leases not renewed within the stale threshold and resolves
 * the cell as a release would
 * 3. Reopens DONE cells that have PENDING tasks again
 * 4. Settles AVAILABLE cells without workers whose tasks are all terminal
 *
 * Every change is a compare-and-set, so a pass racing with live workers or
 * with another pass never undoes legitimate progress.
 */
public class Watchdog implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(Watchdog.class);

    private final WorkCellRepository cells;
    private final RowTaskRepository tasks;
    private final GridConfig config;
    private final Clock clock;

    public Watchdog(WorkCellRepository cells, RowTaskRepository tasks, GridConfig config, Clock clock) {
        this.cells = cells;
        this.tasks = tasks;
        this.config = config;
        this.clock = clock;
    }

    @Override
    public void run() {
        try {
            runOnce();
        } catch (Exception e) {
            log.error("Watchdog error", e);
        }
    }

    /**
     * Run one full pass.
     */
    public WatchdogReport runOnce() {
        Instant now = clock.instant();
        Instant cutoff = now.minus(config.staleThreshold());
        Counters c = new Counters();

        resetStuckTasks(cutoff, now, c);
        expireLeases(cutoff, now, c);
        reopenCells(now, c);
        settleCells(now, c);

        WatchdogReport report = c.toReport();
        if (report.changes() > 0 || report.errors() > 0) {
            log.info("Watchdog pass: {} requeued, {} failed, {} lost, {} leases expired, {} reopened, {} settled, {} errors",
                    report.tasksRequeued(), report.tasksFailed(), report.tasksLost(), report.leasesExpired(),
                    report.cellsReopened(), report.cellsSettled(), report.errors());
        } else {
            log.debug("Watchdog pass: nothing to do");
        }
        return report;
    }

    private void resetStuckTasks(Instant cutoff, Instant now, Counters c) {
        List<RowTask> stuck = tasks.findStuck(cutoff);

        for (RowTask task : stuck) {
            try {
                RetryOutcome outcome = resetStuck(task, now);
                switch (outcome) {
                    case REQUEUED -> {
                        c.requeued++;
                        log.warn("Reset stuck task {} (cell {}, row {}, claimed by {} at {}) -> PENDING, retry {}",
                                task.id(), task.cellId(), task.rowId(), task.claimedBy(), task.claimedAt(),
                                task.retryCount() + 1);
                    }
                    case FAILED -> {
                        c.failed++;
                        log.warn("Stuck task {} (cell {}, row {}) exceeded {} retries -> FAILED",
                                task.id(), task.cellId(), task.rowId(), task.maxRetries());
                    }
                    case LOST -> {
                        c.lost++;
                        log.debug("Stuck task {} moved on before reset", task.id());
                    }
                }
            } catch (Exception e) {
                c.errors++;
                log.error("Failed to reset stuck task {}", task.id(), e);
            }
        }
    }

    private void expireLeases(Instant cutoff, Instant now, Counters c) {
        List<CellLease> expired = cells.findExpiredLeases(cutoff);

        for (CellLease lease : expired) {
            try {
                Optional<CellStatus> status = expireLease(lease, now);
                if (status.isPresent()) {
                    c.leasesExpired++;
                    log.warn("Expired lease of worker {} on cell {} (last renewed {}) -> {}",
                            lease.workerId(), lease.cellId(), lease.renewedAt(), status.get());
                }
            } catch (Exception e) {
                c.errors++;
                log.error("Failed to expire lease of worker {} on cell {}", lease.workerId(), lease.cellId(), e);
            }
        }
    }

    private void reopenCells(Instant now, Counters c) {
        List<WorkCell> invalidated = cells.findDoneWithPending();

        for (WorkCell cell : invalidated) {
            try {
                Optional<CellStatus> status = reopen(cell, now);
                if (status.isPresent()) {
                    c.reopened++;
                    log.warn("Reopened cell {}: DONE -> {}", cell.id(), status.get());
                }
            } catch (Exception e) {
                c.errors++;
                log.error("Failed to reopen cell {}", cell.id(), e);
            }
        }
    }

    private void settleCells(Instant now, Counters c) {
        List<WorkCell> settleable = cells.findSettleable();

        for (WorkCell cell : settleable) {
            try {
                if (settle(cell, now)) {
                    c.settled++;
                    log.info("Settled cell {} -> DONE", cell.id());
                }
            } catch (Exception e) {
                c.errors++;
                log.error("Failed to settle cell {}", cell.id(), e);
            }
        }
    }

    // Per-entity steps, one transaction each

    protected RetryOutcome resetStuck(RowTask task, Instant now) {
        return tasks.resetStuck(task, now);
    }

    protected Optional<CellStatus> expireLease(CellLease lease, Instant now) {
        return cells.expireLease(lease, now);
    }

    protected Optional<CellStatus> reopen(WorkCell cell, Instant now) {
        return cells.reopen(cell.id(), now);
    }

    protected boolean settle(WorkCell cell, Instant now) {
        return cells.settle(cell.id(), now);
    }

    private static final class Counters {
        int requeued;
        int failed;
        int lost;
        int leasesExpired;
        int reopened;
        int settled;
        int errors;

        WatchdogReport toReport() {
            return new WatchdogReport(requeued, failed, lost, leasesExpired, reopened, settled, errors);
        }
    }
}
