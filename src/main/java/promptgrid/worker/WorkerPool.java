package promptgrid.worker;

import promptgrid.coordinator.config.GridConfig;
import promptgrid.coordinator.repository.CatalogRepository;
import promptgrid.coordinator.repository.RowTaskRepository;
import promptgrid.coordinator.repository.WorkCellRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Bounded pool of independent worker loops.
 * Call start() to spawn the loops, awaitCompletion() to wait until every
 * loop has run out of eligible cells, stop() to interrupt them.
 */
public final class WorkerPool {

    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);

    private final WorkCellRepository cells;
    private final RowTaskRepository tasks;
    private final CatalogRepository catalog;
    private final GridConfig config;
    private final Clock clock;

    private ExecutorService executor;
    private final List<WorkerLoop> loops = new ArrayList<>();
    private final List<Future<?>> futures = new ArrayList<>();
    private volatile boolean running;

    public WorkerPool(WorkCellRepository cells, RowTaskRepository tasks, CatalogRepository catalog,
            GridConfig config, Clock clock) {
        this.cells = cells;
        this.tasks = tasks;
        this.catalog = catalog;
        this.config = config;
        this.clock = clock;
    }

    /**
     * Start {@code threads} loops named {@code <workerId>-<n>}, all serving
     * the families registered in {@code predictors}.
     */
    public synchronized void start(String workerId, int threads, PredictorRegistry predictors) {
        if (running) {
            log.warn("Worker pool already running");
            return;
        }
        if (predictors.isEmpty()) {
            throw new IllegalArgumentException("Worker " + workerId + " has no predictor registered");
        }

        loops.clear();
        futures.clear();
        executor = Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r);
            t.setDaemon(true);
            return t;
        });

        for (int i = 1; i <= threads; i++) {
            String loopId = threads == 1 ? workerId : workerId + "-" + i;
            WorkerLoop loop = new WorkerLoop(loopId, cells, tasks, catalog, predictors, config, clock);
            loops.add(loop);
            futures.add(executor.submit(() -> {
                Thread.currentThread().setName("worker-" + loopId);
                loop.run();
            }));
        }

        running = true;
        log.info("Worker pool started: {} loops for {}, families {}", threads, workerId, predictors.families());
    }

    /**
     * Start a pool as declared by a worker profile.
     */
    public void start(WorkerProfile profile, PredictorRegistry predictors) {
        start(profile.workerId(), profile.threads(), predictors);
    }

    /**
     * Block until every loop has finished.
     *
     * @return per-loop counters
     */
    public List<WorkerStats> awaitCompletion() throws InterruptedException {
        List<Future<?>> pending;
        synchronized (this) {
            pending = new ArrayList<>(futures);
        }
        for (Future<?> future : pending) {
            try {
                future.get();
            } catch (ExecutionException e) {
                log.error("Worker loop crashed", e.getCause());
            }
        }
        List<WorkerStats> stats = stats();
        stop();
        return stats;
    }

    /**
     * Interrupt all loops and shut the pool down.
     */
    public synchronized void stop() {
        if (!running)
            return;

        running = false;

        if (executor != null) {
            executor.shutdownNow();
            try {
                if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                    log.warn("Worker pool did not terminate in time");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            executor = null;
        }

        log.info("Worker pool stopped");
    }

    public synchronized List<WorkerStats> stats() {
        return loops.stream().map(WorkerLoop::stats).toList();
    }

    public boolean isRunning() {
        return running;
    }
}
