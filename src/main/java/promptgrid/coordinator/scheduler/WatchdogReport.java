package promptgrid.coordinator.scheduler;

/**
 * What a single watchdog pass changed.
 *
 * @param tasksLost stuck tasks completed or reset by someone else before the reset landed
 * @param errors    entities whose processing threw
 */
public record WatchdogReport(
        int tasksRequeued,
        int tasksFailed,
        int tasksLost,
        int leasesExpired,
        int cellsReopened,
        int cellsSettled,
        int errors) {

    public static final WatchdogReport EMPTY = new WatchdogReport(0, 0, 0, 0, 0, 0, 0);

    /** Number of state changes the pass made */
    public int changes() {
        return tasksRequeued + tasksFailed + leasesExpired + cellsReopened + cellsSettled;
    }
}
