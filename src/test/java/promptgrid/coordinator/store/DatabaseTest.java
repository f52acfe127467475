package promptgrid.coordinator.store;

import promptgrid.coordinator.model.Dataset;
import promptgrid.support.TestStore;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DatabaseTest {

    @Test
    void schemaInitializationIsRepeatable() {
        String url = TestStore.newUrl();

        try (Database first = new Database(url, 2)) {
            assertTrue(first.isHealthy());
            new JdbcCatalogRepository(first).saveDataset(new Dataset("d1", "D1"));
        }
        try (Database second = new Database(url, 2)) {
            assertTrue(second.isHealthy());
            assertTrue(new JdbcCatalogRepository(second).findDataset("d1").isPresent());
        }
    }

    @Test
    void closedPoolIsUnhealthy() {
        Database db = new Database(TestStore.newUrl(), 1);
        db.close();

        assertFalse(db.isHealthy());
    }
}
