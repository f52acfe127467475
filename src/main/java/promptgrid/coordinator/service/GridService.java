package promptgrid.coordinator.service;

import promptgrid.coordinator.model.CellSummary;
import promptgrid.coordinator.model.Prediction;
import promptgrid.coordinator.model.PredictionQuery;
import promptgrid.coordinator.model.RowTask;
import promptgrid.coordinator.model.RowTaskStatus;
import promptgrid.coordinator.repository.PredictionRepository;
import promptgrid.coordinator.repository.RowTaskRepository;
import promptgrid.coordinator.repository.WorkCellRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reporting over the grid and explicit operator actions.
 */
public class GridService {

    private static final Logger log = LoggerFactory.getLogger(GridService.class);

    private final WorkCellRepository cells;
    private final RowTaskRepository tasks;
    private final PredictionRepository predictions;
    private final Clock clock;

    public GridService(WorkCellRepository cells, RowTaskRepository tasks, PredictionRepository predictions,
            Clock clock) {
        this.cells = cells;
        this.tasks = tasks;
        this.predictions = predictions;
        this.clock = clock;
    }

    public List<CellSummary> summaries() {
        return cells.summaries();
    }

    public Optional<CellSummary> summary(String cellId) {
        return cells.summary(cellId);
    }

    /**
     * FAILED row tasks of a cell, with their last error.
     *
     * @throws IllegalArgumentException if the cell does not exist
     */
    public List<RowTask> failedTasks(String cellId) {
        if (cells.findById(cellId).isEmpty()) {
            throw new IllegalArgumentException("Unknown cell: " + cellId);
        }
        return tasks.findByCellAndStatus(cellId, RowTaskStatus.FAILED);
    }

    public List<Prediction> latestPredictions(PredictionQuery query) {
        return predictions.findLatest(query);
    }

    /**
     * Row task counts across the whole grid.
     */
    public Map<RowTaskStatus, Integer> taskCounts() {
        Map<RowTaskStatus, Integer> counts = new EnumMap<>(RowTaskStatus.class);
        for (RowTaskStatus status : RowTaskStatus.values()) {
            counts.put(status, tasks.countByStatus(status));
        }
        return counts;
    }

    /**
     * Send a DONE row task back to PENDING so it is predicted again. The next
     * watchdog pass reopens the cell if it was already DONE. FAILED tasks are
     * never revived.
     *
     * @return true if the task was requeued
     */
    public boolean rescore(String cellId, String rowId) {
        RowTask task = tasks.find(cellId, rowId)
                .orElseThrow(() -> new IllegalArgumentException("No task for cell " + cellId + ", row " + rowId));

        if (task.status() != RowTaskStatus.DONE) {
            log.info("Not re-scoring task {} (cell {}, row {}): status {}", task.id(), cellId, rowId, task.status());
            return false;
        }

        boolean requeued = tasks.requeueDone(cellId, rowId, clock.instant());
        if (requeued) {
            log.warn("Re-score requested: task {} (cell {}, row {}) DONE -> PENDING", task.id(), cellId, rowId);
        }
        return requeued;
    }
}
