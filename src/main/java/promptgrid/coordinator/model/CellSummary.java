package promptgrid.coordinator.model;

import java.util.Objects;

/**
 * Read model: a work cell with its row tasks counted by status.
 */
public record CellSummary(WorkCell cell, int pending, int inProgress, int done, int failed) {

    public CellSummary {
        Objects.requireNonNull(cell, "cell is required");
    }

    public int total() {
        return pending + inProgress + done + failed;
    }

    /** Tasks that no longer need a worker */
    public int terminal() {
        return done + failed;
    }

    public int progressPercent() {
        int total = total();
        if (total == 0)
            return 100;
        return terminal() * 100 / total;
    }
}
