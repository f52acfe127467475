package promptgrid.coordinator.scheduler;

import promptgrid.coordinator.config.GridConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Runs the watchdog at a fixed rate on a single daemon thread, so passes
 * never overlap within one coordinator.
 */
public class Scheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);

    private final ScheduledExecutorService executor;
    private final Watchdog watchdog;
    private final GridConfig config;

    private volatile boolean running = false;

    public Scheduler(Watchdog watchdog, GridConfig config) {
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "promptgrid-watchdog");
            t.setDaemon(true);
            return t;
        });
        this.watchdog = watchdog;
        this.config = config;
    }

    /**
     * Start the scheduler.
     */
    public void start() {
        if (running) {
            log.warn("Scheduler already running");
            return;
        }

        running = true;

        long intervalMs = config.watchdogInterval().toMillis();
        executor.scheduleAtFixedRate(
                watchdog,
                intervalMs, // initial delay
                intervalMs, // interval
                TimeUnit.MILLISECONDS);
        log.info("Watchdog scheduled every {}ms (stale threshold {})", intervalMs, config.staleThreshold());
    }

    /**
     * Stop the scheduler gracefully.
     */
    public void stop() {
        if (!running) {
            return;
        }

        running = false;
        executor.shutdown();

        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("Scheduler forcefully stopped");
            } else {
                log.info("Scheduler stopped gracefully");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    public Watchdog watchdog() {
        return watchdog;
    }
}
