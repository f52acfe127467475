package promptgrid.coordinator.store;

import promptgrid.coordinator.model.Dataset;
import promptgrid.coordinator.model.DatasetRow;
import promptgrid.coordinator.model.Model;
import promptgrid.coordinator.model.Prompt;
import promptgrid.support.TestStore;
import org.junit.jupiter.api.*;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JdbcCatalogRepositoryTest {

    private TestStore store;
    private JdbcCatalogRepository catalog;

    @BeforeEach
    void setup() {
        store = TestStore.open();
        catalog = store.catalog;
    }

    @AfterEach
    void teardown() {
        store.close();
    }

    @Test
    void savesAreInsertIfAbsent() {
        assertTrue(catalog.saveModel(new Model("bert", "BERT base", "transformers")));
        assertFalse(catalog.saveModel(new Model("bert", "Renamed", "other")));

        Model stored = catalog.findModel("bert").orElseThrow();
        assertEquals("BERT base", stored.name());
        assertEquals("transformers", stored.family());

        assertTrue(catalog.savePrompt(new Prompt("p1", "Classify: {text}")));
        assertFalse(catalog.savePrompt(new Prompt("p1", "changed")));
        assertEquals("Classify: {text}", catalog.findPrompt("p1").orElseThrow().template());

        assertTrue(catalog.saveDataset(new Dataset("d1", "Reviews")));
        assertFalse(catalog.saveDataset(new Dataset("d1", "Other")));
        assertEquals("Reviews", catalog.findDataset("d1").orElseThrow().name());
    }

    @Test
    void saveRowsSkipsExistingRows() {
        catalog.saveDataset(new Dataset("d1", "Reviews"));
        DatasetRow a = new DatasetRow("r1", "d1", "great", "pos");
        DatasetRow b = new DatasetRow("r2", "d1", "awful", "neg");

        assertEquals(1, catalog.saveRows(List.of(a)));
        assertEquals(1, catalog.saveRows(List.of(a, b)));
        assertEquals(0, catalog.saveRows(List.of(a, b)));
        assertEquals(0, catalog.saveRows(List.of()));

        assertEquals(List.of(a, b), catalog.findRows("d1"));
        assertEquals(2, catalog.countRows("d1"));
    }

    @Test
    void rowsKeepMissingExpectedLabel() {
        catalog.saveDataset(new Dataset("d1", "Reviews"));
        catalog.saveRows(List.of(new DatasetRow("r1", "d1", "meh", null)));

        assertNull(catalog.findRow("r1").orElseThrow().expectedLabel());
    }

    @Test
    void findRowsByIdsOmitsUnknownIds() {
        store.dataset("d1", 3);

        Map<String, DatasetRow> found = catalog.findRowsByIds(List.of("d1-000", "d1-002", "ghost"));

        assertEquals(2, found.size());
        assertEquals("text 2", found.get("d1-002").content());
        assertTrue(catalog.findRowsByIds(List.of()).isEmpty());
    }

    @Test
    void unknownIdsAreEmpty() {
        assertTrue(catalog.findModel("x").isEmpty());
        assertTrue(catalog.findPrompt("x").isEmpty());
        assertTrue(catalog.findDataset("x").isEmpty());
        assertTrue(catalog.findRow("x").isEmpty());
        assertEquals(0, catalog.countRows("x"));
    }
}
