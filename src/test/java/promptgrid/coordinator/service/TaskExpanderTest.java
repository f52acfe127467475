package promptgrid.coordinator.service;

import promptgrid.coordinator.config.GridConfig;
import promptgrid.coordinator.model.CellRegistration;
import promptgrid.coordinator.model.CellStatus;
import promptgrid.coordinator.model.Dataset;
import promptgrid.coordinator.model.DatasetRow;
import promptgrid.coordinator.model.RowTask;
import promptgrid.coordinator.model.RowTaskStatus;
import promptgrid.coordinator.model.WorkCell;
import promptgrid.support.MutableClock;
import promptgrid.support.TestStore;
import org.junit.jupiter.api.*;

import java.util.List;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class TaskExpanderTest {

    private TestStore store;
    private TaskExpander expander;

    @BeforeEach
    void setup() {
        store = TestStore.open();
        GridConfig config = GridConfig.defaults().withMaxRetries(5);
        expander = new TaskExpander(store.catalog, store.cells, config, MutableClock.at("2024-05-01T10:00:00Z"));
    }

    @AfterEach
    void teardown() {
        store.close();
    }

    private static List<DatasetRow> rows(String datasetId, int n) {
        return IntStream.range(0, n)
                .mapToObj(i -> new DatasetRow(datasetId + "-" + i, datasetId, "text " + i, null))
                .toList();
    }

    @Test
    void registerDatasetIsIdempotent() {
        Dataset reviews = new Dataset("reviews", "Reviews");

        assertEquals(3, expander.registerDataset(reviews, rows("reviews", 3)));
        assertEquals(0, expander.registerDataset(reviews, rows("reviews", 3)));
        assertEquals(1, expander.registerDataset(reviews, rows("reviews", 4)));
        assertEquals(4, store.catalog.countRows("reviews"));
    }

    @Test
    void registerDatasetRejectsForeignRows() {
        List<DatasetRow> mixed = List.of(new DatasetRow("x-1", "other", "text", null));

        assertThrows(IllegalArgumentException.class,
                () -> expander.registerDataset(new Dataset("reviews", "Reviews"), mixed));
        assertTrue(store.catalog.findDataset("reviews").isEmpty());
    }

    @Test
    void registerModelNeedsFamily() {
        assertThrows(IllegalArgumentException.class, () -> expander.registerModel("m", "M", " "));
        assertTrue(expander.registerModel("m", "M", "transformers"));
        assertFalse(expander.registerModel("m", "M", "transformers"));
    }

    @Test
    void registerWorkCellExpandsOncePerCombination() {
        expander.registerModel("bert", null, "transformers");
        expander.registerPrompt("p1", "Classify {text}");
        expander.registerDataset(new Dataset("reviews", null), rows("reviews", 4));

        CellRegistration first = expander.registerWorkCell("bert", "p1", "reviews");
        CellRegistration second = expander.registerWorkCell("bert", "p1", "reviews");

        assertTrue(first.created());
        assertFalse(second.created());
        assertEquals(first.cell().id(), second.cell().id());
        assertEquals(CellStatus.AVAILABLE, first.cell().status());

        List<RowTask> tasks = store.tasks.findByCell(first.cell().id());
        assertEquals(4, tasks.size());
        assertTrue(tasks.stream().allMatch(t -> t.maxRetries() == 5));
    }

    @Test
    void rowsAddedLaterGetNoTaskInExistingCell() {
        expander.registerModel("bert", null, "transformers");
        expander.registerPrompt("p1", "Classify {text}");
        expander.registerDataset(new Dataset("reviews", null), rows("reviews", 2));
        WorkCell cell = expander.registerWorkCell("bert", "p1", "reviews").cell();

        expander.registerDataset(new Dataset("reviews", null), rows("reviews", 3));

        assertEquals(2, store.tasks.findByCell(cell.id()).size());
    }

    @Test
    void registerWorkCellRejectsUnknownIds() {
        expander.registerModel("bert", null, "transformers");
        expander.registerPrompt("p1", "Classify {text}");
        expander.registerDataset(new Dataset("reviews", null), rows("reviews", 1));

        assertThrows(IllegalArgumentException.class, () -> expander.registerWorkCell("nope", "p1", "reviews"));
        assertThrows(IllegalArgumentException.class, () -> expander.registerWorkCell("bert", "nope", "reviews"));
        assertThrows(IllegalArgumentException.class, () -> expander.registerWorkCell("bert", "p1", "nope"));
        assertTrue(store.cells.findAll().isEmpty());
    }

    @Test
    void registerGridCreatesCrossProduct() {
        expander.registerModel("bert", null, "transformers");
        expander.registerModel("llama", null, "local-llm");
        expander.registerPrompt("p1", "Classify {text}");
        expander.registerPrompt("p2", "Label {text}");
        expander.registerDataset(new Dataset("reviews", null), rows("reviews", 3));

        List<WorkCell> grid = expander.registerGrid(List.of("bert", "llama"), List.of("p1", "p2"), List.of("reviews"));
        List<WorkCell> again = expander.registerGrid(List.of("bert", "llama"), List.of("p1", "p2"), List.of("reviews"));

        assertEquals(4, grid.size());
        assertEquals(grid, again);
        assertEquals(4, store.cells.findAll().size());
        assertEquals(12, store.tasks.countByStatus(RowTaskStatus.PENDING));
    }
}
