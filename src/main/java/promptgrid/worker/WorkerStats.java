package promptgrid.worker;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Counters of one worker loop run. Not thread-safe; owned by its loop.
 */
public final class WorkerStats {

    private int cellsClaimed;
    private int succeeded;
    private int failedAttempts;
    private int lost;
    private final List<Integer> batchSizes = new ArrayList<>();

    void recordCell() {
        cellsClaimed++;
    }

    void recordBatch(int size) {
        batchSizes.add(size);
    }

    void recordSuccess() {
        succeeded++;
    }

    void recordFailedAttempt() {
        failedAttempts++;
    }

    void recordLost() {
        lost++;
    }

    public int cellsClaimed() {
        return cellsClaimed;
    }

    /** Sizes of the non-empty batches, in claim order */
    public List<Integer> batchSizes() {
        return Collections.unmodifiableList(batchSizes);
    }

    public int succeeded() {
        return succeeded;
    }

    public int failedAttempts() {
        return failedAttempts;
    }

    /** Tasks whose claim was taken away (watchdog reset) before the worker finished */
    public int lost() {
        return lost;
    }

    @Override
    public String toString() {
        return "WorkerStats{cells=" + cellsClaimed + ", batches=" + batchSizes.size() + ", succeeded=" + succeeded
                + ", failedAttempts=" + failedAttempts + ", lost=" + lost + "}";
    }
}
