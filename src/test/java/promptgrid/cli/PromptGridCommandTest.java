package promptgrid.cli;

import promptgrid.coordinator.config.GridConfig;
import promptgrid.coordinator.model.CellStatus;
import promptgrid.coordinator.model.Prediction;
import promptgrid.coordinator.model.RowTask;
import promptgrid.coordinator.model.RowTaskStatus;
import promptgrid.coordinator.model.WorkCell;
import promptgrid.coordinator.server.RouterHandler;
import promptgrid.coordinator.service.TaskExpander;
import promptgrid.support.MutableClock;
import promptgrid.support.TestStore;
import picocli.CommandLine;
import org.junit.jupiter.api.*;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PromptGridCommandTest {

    private TestStore store;

    @BeforeEach
    void setup() {
        store = TestStore.open();
    }

    @AfterEach
    void teardown() {
        store.close();
    }

    private static Path manifestFile() throws Exception {
        return Paths.get(PromptGridCommandTest.class.getResource("/grid-manifest.json").toURI());
    }

    private int run(String... args) {
        String[] full = new String[args.length + 2];
        full[0] = "--db-url";
        full[1] = store.url;
        System.arraycopy(args, 0, full, 2, args.length);
        return new CommandLine(new PromptGridCommand()).execute(full);
    }

    @Test
    void manifestRegistersFullGrid() throws Exception {
        GridManifest manifest = RouterHandler.mapper()
                .readValue(manifestFile().toFile(), GridManifest.class);
        TaskExpander expander = new TaskExpander(store.catalog, store.cells, GridConfig.defaults(),
                MutableClock.at("2024-05-01T10:00:00Z"));

        List<WorkCell> cells = PromptGridCommand.register(manifest, expander);

        assertEquals(2, cells.size());
        assertEquals(3, store.catalog.countRows("reviews"));
        assertNull(store.catalog.findRow("reviews-3").orElseThrow().expectedLabel());
        assertEquals(6, store.tasks.countByStatus(RowTaskStatus.PENDING));

        // Loading the same manifest again changes nothing
        assertEquals(cells, PromptGridCommand.register(manifest, expander));
        assertEquals(6, store.tasks.countByStatus(RowTaskStatus.PENDING));
    }

    @Test
    void loadStatusAndWatchdogCommands() throws Exception {
        assertEquals(0, run("load", manifestFile().toString()));
        assertEquals(2, store.cells.findAll().size());

        assertEquals(0, run("status"));
        assertEquals(0, run("watchdog", "--once"));
        assertTrue(store.cells.findAll().stream().allMatch(c -> c.status() == CellStatus.AVAILABLE));
    }

    @Test
    void rescoreRequeuesDoneRowOnly() throws Exception {
        assertEquals(0, run("load", manifestFile().toString()));
        WorkCell cell = store.cells.findAll().get(0);
        RowTask claimed = store.tasks.claimBatch(cell.id(), "w1", 1, Instant.now()).get(0);
        store.tasks.complete(claimed, Prediction.builder()
                .cellId(cell.id())
                .rowId(claimed.rowId())
                .modelId(cell.modelId())
                .promptId(cell.promptId())
                .datasetId(cell.datasetId())
                .label("positive")
                .workerId("w1")
                .build(), Instant.now());

        assertEquals(0, run("rescore", cell.id(), claimed.rowId()));
        assertEquals(RowTaskStatus.PENDING, store.tasks.findById(claimed.id()).orElseThrow().status());
        assertEquals(1, run("rescore", cell.id(), claimed.rowId()));
    }

    @Test
    void missingArgumentsAreUsageErrors() {
        assertEquals(2, run("rescore", "only-cell"));
        assertEquals(2, run("work"));
    }
}
