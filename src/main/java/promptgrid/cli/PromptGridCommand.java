package promptgrid.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import promptgrid.coordinator.api.v1.dto.CellSummaryResponse;
import promptgrid.coordinator.config.Dependencies;
import promptgrid.coordinator.config.GridConfig;
import promptgrid.coordinator.model.Dataset;
import promptgrid.coordinator.model.DatasetRow;
import promptgrid.coordinator.model.WorkCell;
import promptgrid.coordinator.scheduler.WatchdogReport;
import promptgrid.coordinator.server.GridHttpServer;
import promptgrid.coordinator.server.RouterHandler;
import promptgrid.coordinator.service.TaskExpander;
import promptgrid.worker.PredictorRegistry;
import promptgrid.worker.SimulatedPredictor;
import promptgrid.worker.WorkerPool;
import promptgrid.worker.WorkerProfile;
import promptgrid.worker.WorkerProfileLoader;
import promptgrid.worker.WorkerStats;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

@Command(
        name = "promptgrid",
        mixinStandardHelpOptions = true,
        description = "Prompt x model x dataset inference grid",
        subcommands = {
                PromptGridCommand.ServeCommand.class,
                PromptGridCommand.WorkCommand.class,
                PromptGridCommand.WatchdogCommand.class,
                PromptGridCommand.StatusCommand.class,
                PromptGridCommand.LoadCommand.class,
                PromptGridCommand.RescoreCommand.class
        }
)
public final class PromptGridCommand implements Runnable {

    @Option(names = {"--db-url"}, description = "JDBC URL of the shared store (default: PROMPTGRID_DB_URL or local H2)")
    String dbUrl;

    @Override
    public void run() {
        System.out.println("Use subcommands: serve | work | watchdog | status | load | rescore");
    }

    GridConfig config() {
        GridConfig config = GridConfig.fromEnv();
        if (dbUrl != null && !dbUrl.isBlank()) {
            config.withDatabaseUrl(dbUrl);
        }
        return config;
    }

    /**
     * Register everything a manifest declares and the full grid over it.
     */
    static List<WorkCell> register(GridManifest manifest, TaskExpander expander) {
        for (GridManifest.ModelEntry m : manifest.models()) {
            expander.registerModel(m.id(), m.name(), m.family());
        }
        for (GridManifest.PromptEntry p : manifest.prompts()) {
            expander.registerPrompt(p.id(), p.template());
        }
        for (GridManifest.DatasetEntry d : manifest.datasets()) {
            List<DatasetRow> rows = d.rows().stream()
                    .map(r -> new DatasetRow(r.id(), d.id(), r.content(), r.expectedLabel()))
                    .toList();
            expander.registerDataset(new Dataset(d.id(), d.name()), rows);
        }
        return expander.registerGrid(
                manifest.models().stream().map(GridManifest.ModelEntry::id).toList(),
                manifest.prompts().stream().map(GridManifest.PromptEntry::id).toList(),
                manifest.datasets().stream().map(GridManifest.DatasetEntry::id).toList());
    }

    @Command(name = "serve", description = "Run the coordinator: schema, watchdog and HTTP status API")
    static final class ServeCommand implements Callable<Integer> {
        @ParentCommand
        PromptGridCommand parent;

        @Option(names = {"--port"}, description = "HTTP port (default: PROMPTGRID_PORT or 8080)")
        Integer port;

        @Override
        public Integer call() throws Exception {
            GridConfig config = parent.config();
            if (port != null) {
                config.withServerPort(port);
            }

            try (Dependencies deps = Dependencies.create(config);
                    GridHttpServer server = new GridHttpServer(config.serverHost(), config.serverPort(),
                            deps.routerHandler())) {
                deps.startScheduler();
                server.start();
                Runtime.getRuntime().addShutdownHook(new Thread(server::stop, "promptgrid-shutdown"));
                server.awaitTermination();
            }
            return 0;
        }
    }

    @Command(name = "work", description = "Run worker loops until no eligible cell remains")
    static final class WorkCommand implements Callable<Integer> {
        @ParentCommand
        PromptGridCommand parent;

        @Option(names = {"--profile"}, required = true, description = "Worker profile INI file")
        Path profile;

        @Override
        public Integer call() throws Exception {
            WorkerProfile workerProfile = WorkerProfileLoader.load(profile);

            // No real backend ships with the grid; every declared family is simulated
            PredictorRegistry predictors = new PredictorRegistry();
            for (String family : workerProfile.families()) {
                predictors.register(family, new SimulatedPredictor(workerProfile.simulated()));
            }

            try (Dependencies deps = Dependencies.create(parent.config())) {
                WorkerPool pool = deps.newWorkerPool();
                pool.start(workerProfile, predictors);
                List<WorkerStats> stats = pool.awaitCompletion();

                int succeeded = stats.stream().mapToInt(WorkerStats::succeeded).sum();
                int failed = stats.stream().mapToInt(WorkerStats::failedAttempts).sum();
                System.out.println("Worker " + workerProfile.workerId() + " finished: "
                        + succeeded + " predictions, " + failed + " failed attempts");
            }
            return 0;
        }
    }

    @Command(name = "watchdog", description = "Run the watchdog (one pass with --once)")
    static final class WatchdogCommand implements Callable<Integer> {
        @ParentCommand
        PromptGridCommand parent;

        @Option(names = {"--once"}, description = "Run a single reconciliation pass and exit")
        boolean once;

        @Override
        public Integer call() throws Exception {
            try (Dependencies deps = Dependencies.create(parent.config())) {
                if (once) {
                    WatchdogReport report = deps.watchdog().runOnce();
                    System.out.println(RouterHandler.mapper().writeValueAsString(report));
                    return report.errors() == 0 ? 0 : 1;
                }

                deps.startScheduler();
                Thread.currentThread().join();
            }
            return 0;
        }
    }

    @Command(name = "status", description = "Print cell summaries as JSON")
    static final class StatusCommand implements Callable<Integer> {
        @ParentCommand
        PromptGridCommand parent;

        @Override
        public Integer call() throws Exception {
            try (Dependencies deps = Dependencies.create(parent.config())) {
                List<CellSummaryResponse> cells = deps.gridService().summaries().stream()
                        .map(CellSummaryResponse::from)
                        .toList();
                System.out.println(RouterHandler.mapper().writerWithDefaultPrettyPrinter().writeValueAsString(cells));
            }
            return 0;
        }
    }

    @Command(name = "load", description = "Register models, prompts, datasets and their grid from a JSON manifest")
    static final class LoadCommand implements Callable<Integer> {
        @ParentCommand
        PromptGridCommand parent;

        @Parameters(index = "0", description = "Manifest JSON file")
        Path manifest;

        @Override
        public Integer call() throws Exception {
            ObjectMapper mapper = RouterHandler.mapper();
            GridManifest gridManifest = mapper.readValue(manifest.toFile(), GridManifest.class);

            try (Dependencies deps = Dependencies.create(parent.config())) {
                List<WorkCell> cells = register(gridManifest, deps.taskExpander());
                System.out.println("Registered grid of " + cells.size() + " cells");
            }
            return 0;
        }
    }

    @Command(name = "rescore", description = "Send a DONE row task back to PENDING")
    static final class RescoreCommand implements Callable<Integer> {
        @ParentCommand
        PromptGridCommand parent;

        @Parameters(index = "0", description = "Cell id")
        String cellId;

        @Parameters(index = "1", description = "Row id")
        String rowId;

        @Override
        public Integer call() {
            try (Dependencies deps = Dependencies.create(parent.config())) {
                boolean requeued = deps.gridService().rescore(cellId, rowId);
                System.out.println(requeued ? "Requeued" : "Not requeued (task is not DONE)");
                return requeued ? 0 : 1;
            }
        }
    }
}
