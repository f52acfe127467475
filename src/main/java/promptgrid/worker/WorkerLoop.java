package promptgrid.worker;

import promptgrid.coordinator.config.GridConfig;
import promptgrid.coordinator.model.CellStatus;
import promptgrid.coordinator.model.CompletionResult;
import promptgrid.coordinator.model.DatasetRow;
import promptgrid.coordinator.model.Model;
import promptgrid.coordinator.model.Prediction;
import promptgrid.coordinator.model.Prompt;
import promptgrid.coordinator.model.RetryOutcome;
import promptgrid.coordinator.model.RowTask;
import promptgrid.coordinator.model.WorkCell;
import promptgrid.coordinator.repository.CatalogRepository;
import promptgrid.coordinator.repository.RowTaskRepository;
import promptgrid.coordinator.repository.WorkCellRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * One worker: claims a cell its predictors can serve, drains it batch by
 * batch, releases it, and repeats until no eligible cell is left.
 *
 * The loop shares nothing in memory with other workers; every decision goes
 * through the store. Stops cleanly on Thread.interrupt(), leaving in-flight
 * tasks IN_PROGRESS for the watchdog.
 */
public final class WorkerLoop implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(WorkerLoop.class);

    /** Consecutive cells aborted by store errors before the worker gives up */
    private static final int MAX_CELL_ERRORS = 3;

    private final String workerId;
    private final WorkCellRepository cells;
    private final RowTaskRepository tasks;
    private final CatalogRepository catalog;
    private final PredictorRegistry predictors;
    private final GridConfig config;
    private final Clock clock;
    private final WorkerStats stats = new WorkerStats();

    public WorkerLoop(String workerId,
            WorkCellRepository cells,
            RowTaskRepository tasks,
            CatalogRepository catalog,
            PredictorRegistry predictors,
            GridConfig config,
            Clock clock) {
        this.workerId = workerId;
        this.cells = cells;
        this.tasks = tasks;
        this.catalog = catalog;
        this.predictors = predictors;
        this.config = config;
        this.clock = clock;
    }

    @Override
    public void run() {
        log.info("Worker {} started (families {})", workerId, predictors.families());

        // Cached: a predict call that ignores cancellation must not block the next one
        ExecutorService predictExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "predict-" + workerId);
            t.setDaemon(true);
            return t;
        });

        int cellErrors = 0;
        try {
            while (!Thread.currentThread().isInterrupted()) {
                Optional<WorkCell> claimed = cells.claim(workerId, predictors.families(), clock.instant());
                if (claimed.isEmpty()) {
                    log.info("Worker {}: no eligible cell left", workerId);
                    break;
                }

                WorkCell cell = claimed.get();
                stats.recordCell();
                try {
                    processCell(cell, predictExecutor);
                    cellErrors = 0;
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } catch (RuntimeException e) {
                    cellErrors++;
                    log.error("Worker {} aborted cell {}", workerId, cell.id(), e);
                    if (cellErrors >= MAX_CELL_ERRORS) {
                        log.error("Worker {} stopping after {} consecutive cell errors", workerId, cellErrors);
                        break;
                    }
                } finally {
                    releaseCell(cell);
                }
            }
        } catch (RuntimeException e) {
            log.error("Worker {} cannot claim cells, stopping", workerId, e);
        } finally {
            predictExecutor.shutdownNow();
        }

        log.info("Worker {} stopped: {}", workerId, stats);
    }

    /**
     * Claim and process batches until the cell has no PENDING task left.
     */
    private void processCell(WorkCell cell, ExecutorService predictExecutor) throws InterruptedException {
        Model model = catalog.findModel(cell.modelId())
                .orElseThrow(() -> new IllegalStateException("Unknown model " + cell.modelId()));
        Prompt prompt = catalog.findPrompt(cell.promptId())
                .orElseThrow(() -> new IllegalStateException("Unknown prompt " + cell.promptId()));
        Predictor predictor = predictors.forFamily(model.family())
                .orElseThrow(() -> new IllegalStateException(
                        "No predictor for family " + model.family() + " of cell " + cell.id()));

        boolean leaseHeld = true;
        while (leaseHeld) {
            List<RowTask> batch = tasks.claimBatch(cell.id(), workerId, config.batchSize(), clock.instant());
            if (batch.isEmpty()) {
                return;
            }
            stats.recordBatch(batch.size());
            log.debug("Worker {} claimed batch of {} on cell {}", workerId, batch.size(), cell.id());

            Map<String, DatasetRow> rows = catalog.findRowsByIds(batch.stream().map(RowTask::rowId).toList());

            List<RowTask> queued = batch;
            while (!queued.isEmpty()) {
                if (Thread.currentThread().isInterrupted()) {
                    throw new InterruptedException("Worker " + workerId + " interrupted");
                }
                if (leaseHeld && !cells.renewLease(cell.id(), workerId, clock.instant())) {
                    // Finish what we hold, claim nothing more
                    leaseHeld = false;
                    log.warn("Worker {} lost its lease on cell {}, finishing current batch", workerId, cell.id());
                }

                // Heartbeat the rest of the batch: queued tasks wait on every predict call ahead of them
                List<RowTask> held = tasks.touchAll(queued, clock.instant());
                if (held.size() < queued.size()) {
                    int lost = queued.size() - held.size();
                    for (int i = 0; i < lost; i++) {
                        stats.recordLost();
                    }
                    log.warn("Worker {} no longer holds {} task(s) of cell {}, skipping them",
                            workerId, lost, cell.id());
                }
                if (held.isEmpty()) {
                    break;
                }

                RowTask next = held.get(0);
                processTask(cell, model, prompt, predictor, next, rows.get(next.rowId()), predictExecutor);
                queued = held.subList(1, held.size());
            }
        }
    }

    private void processTask(WorkCell cell, Model model, Prompt prompt, Predictor predictor, RowTask held,
            DatasetRow row, ExecutorService predictExecutor) throws InterruptedException {

        if (row == null) {
            fail(held, "Row " + held.rowId() + " not found");
            return;
        }

        long start = System.nanoTime();
        Future<String> future = predictExecutor.submit(() -> predictor.predict(model, prompt, row));
        String label;
        try {
            label = future.get(config.predictTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            fail(held, "predict timed out after " + config.predictTimeout().toMillis() + "ms");
            return;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            fail(held, cause.getClass().getSimpleName() + ": " + cause.getMessage());
            return;
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        }
        long latencyMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        Prediction prediction = Prediction.builder()
                .cellId(cell.id())
                .rowId(row.id())
                .modelId(cell.modelId())
                .promptId(cell.promptId())
                .datasetId(cell.datasetId())
                .label(label)
                .latencyMs(latencyMs)
                .workerId(workerId)
                .build();

        CompletionResult result = tasks.complete(held, prediction, clock.instant());
        if (result == CompletionResult.COMPLETED) {
            stats.recordSuccess();
        } else {
            stats.recordLost();
        }
    }

    private void fail(RowTask held, String error) {
        stats.recordFailedAttempt();
        RetryOutcome outcome = tasks.failAttempt(held, error, clock.instant());
        switch (outcome) {
            case REQUEUED -> log.debug("Worker {}: task {} failed ({}), requeued", workerId, held.id(), error);
            case FAILED -> log.warn("Worker {}: task {} (row {}) exceeded {} retries -> FAILED: {}",
                    workerId, held.id(), held.rowId(), held.maxRetries(), error);
            case LOST -> {
                stats.recordLost();
                log.warn("Worker {}: task {} was reset before its failure was recorded", workerId, held.id());
            }
        }
    }

    private void releaseCell(WorkCell cell) {
        // Release even when stopping; the flag is restored afterwards
        boolean interrupted = Thread.interrupted();
        try {
            CellStatus status = cells.release(cell.id(), workerId, clock.instant());
            log.debug("Worker {} released cell {} -> {}", workerId, cell.id(), status);
        } catch (RuntimeException e) {
            // The lease stays behind and is expired by the watchdog
            log.error("Worker {} failed to release cell {}", workerId, cell.id(), e);
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    public String workerId() {
        return workerId;
    }

    /**
     * Counters of this loop. Read them after {@link #run()} has returned.
     */
    public WorkerStats stats() {
        return stats;
    }
}
