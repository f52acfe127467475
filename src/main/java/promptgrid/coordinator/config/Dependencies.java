package promptgrid.coordinator.config;

import promptgrid.coordinator.api.v1.CellController;
import promptgrid.coordinator.api.v1.HealthController;
import promptgrid.coordinator.api.v1.PredictionController;
import promptgrid.coordinator.repository.CatalogRepository;
import promptgrid.coordinator.repository.PredictionRepository;
import promptgrid.coordinator.repository.RowTaskRepository;
import promptgrid.coordinator.repository.WorkCellRepository;
import promptgrid.coordinator.scheduler.Scheduler;
import promptgrid.coordinator.scheduler.Watchdog;
import promptgrid.coordinator.server.RouterHandler;
import promptgrid.coordinator.service.GridService;
import promptgrid.coordinator.service.TaskExpander;
import promptgrid.coordinator.store.Database;
import promptgrid.coordinator.store.JdbcCatalogRepository;
import promptgrid.coordinator.store.JdbcPredictionRepository;
import promptgrid.coordinator.store.JdbcRowTaskRepository;
import promptgrid.coordinator.store.JdbcWorkCellRepository;
import promptgrid.worker.WorkerPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Manual dependency injection container.
 * Creates and wires all service dependencies.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(GridConfig.fromEnv());
 * deps.startScheduler(); // start the watchdog
 * TaskExpander expander = deps.taskExpander();
 * // ... use services ...
 * deps.close(); // cleanup
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final GridConfig config;
    private final Clock clock;
    private final Database database;
    private final CatalogRepository catalogRepository;
    private final WorkCellRepository workCellRepository;
    private final RowTaskRepository rowTaskRepository;
    private final PredictionRepository predictionRepository;
    private final TaskExpander taskExpander;
    private final GridService gridService;
    private final Watchdog watchdog;

    // Router (lazy-initialized)
    private RouterHandler routerHandler;

    // Scheduler (lazy-initialized)
    private Scheduler scheduler;

    private Dependencies(GridConfig config, Clock clock) {
        this.config = config.validate();
        this.clock = clock;

        log.info("Initializing dependencies with config: {}", config);

        // Infrastructure
        this.database = new Database(config);

        // Repositories
        this.catalogRepository = new JdbcCatalogRepository(database);
        this.workCellRepository = new JdbcWorkCellRepository(database);
        this.rowTaskRepository = new JdbcRowTaskRepository(database);
        this.predictionRepository = new JdbcPredictionRepository(database);

        // Services
        this.taskExpander = new TaskExpander(catalogRepository, workCellRepository, config, clock);
        this.gridService = new GridService(workCellRepository, rowTaskRepository, predictionRepository, clock);
        this.watchdog = new Watchdog(workCellRepository, rowTaskRepository, config, clock);

        log.info("Dependencies initialized successfully");
    }

    /**
     * Create dependencies with the given config.
     *
     * @throws IllegalArgumentException if the config is inconsistent
     */
    public static Dependencies create(GridConfig config) {
        return new Dependencies(config, Clock.systemUTC());
    }

    /**
     * Create dependencies with an explicit clock (tests).
     */
    public static Dependencies create(GridConfig config, Clock clock) {
        return new Dependencies(config, clock);
    }

    /**
     * Create dependencies with environment-based config.
     */
    public static Dependencies create() {
        return create(GridConfig.fromEnv());
    }

    // Getters
    public GridConfig config() {
        return config;
    }

    public Clock clock() {
        return clock;
    }

    public Database database() {
        return database;
    }

    public CatalogRepository catalogRepository() {
        return catalogRepository;
    }

    public WorkCellRepository workCellRepository() {
        return workCellRepository;
    }

    public RowTaskRepository rowTaskRepository() {
        return rowTaskRepository;
    }

    public PredictionRepository predictionRepository() {
        return predictionRepository;
    }

    public TaskExpander taskExpander() {
        return taskExpander;
    }

    public GridService gridService() {
        return gridService;
    }

    public Watchdog watchdog() {
        return watchdog;
    }

    /**
     * A new, not yet started worker pool bound to this store.
     */
    public WorkerPool newWorkerPool() {
        return new WorkerPool(workCellRepository, rowTaskRepository, catalogRepository, config, clock);
    }

    /**
     * Get a fully configured RouterHandler with all controllers registered.
     */
    public synchronized RouterHandler routerHandler() {
        if (routerHandler == null) {
            routerHandler = new RouterHandler()
                    .registerController(new HealthController(database, gridService))
                    .registerController(new CellController(gridService))
                    .registerController(new PredictionController(gridService));
            log.info("RouterHandler created with {} controllers", 3);
        }
        return routerHandler;
    }

    /**
     * Get the scheduler (creates it if not yet created).
     */
    public synchronized Scheduler scheduler() {
        if (scheduler == null) {
            scheduler = new Scheduler(watchdog, config);
        }
        return scheduler;
    }

    /**
     * Start the periodic watchdog.
     */
    public void startScheduler() {
        scheduler().start();
    }

    public void stopScheduler() {
        if (scheduler != null) {
            scheduler.stop();
        }
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        // Stop scheduler first
        if (scheduler != null) {
            try {
                scheduler.stop();
            } catch (Exception e) {
                log.warn("Error stopping scheduler: {}", e.getMessage());
            }
        }

        try {
            database.close();
        } catch (Exception e) {
            log.warn("Error closing database: {}", e.getMessage());
        }

        log.info("Dependencies closed");
    }
}
