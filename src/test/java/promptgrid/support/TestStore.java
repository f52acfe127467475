package promptgrid.support;

import promptgrid.coordinator.model.Dataset;
import promptgrid.coordinator.model.DatasetRow;
import promptgrid.coordinator.model.Model;
import promptgrid.coordinator.model.Prompt;
import promptgrid.coordinator.store.Database;
import promptgrid.coordinator.store.JdbcCatalogRepository;
import promptgrid.coordinator.store.JdbcPredictionRepository;
import promptgrid.coordinator.store.JdbcRowTaskRepository;
import promptgrid.coordinator.store.JdbcWorkCellRepository;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * A private in-memory store per test, with the repositories wired and
 * helpers to seed reference data.
 */
public final class TestStore implements AutoCloseable {

    public final String url;
    public final Database db;
    public final JdbcCatalogRepository catalog;
    public final JdbcWorkCellRepository cells;
    public final JdbcRowTaskRepository tasks;
    public final JdbcPredictionRepository predictions;

    private TestStore(String url, int poolSize) {
        this.url = url;
        this.db = new Database(url, poolSize);
        this.catalog = new JdbcCatalogRepository(db);
        this.cells = new JdbcWorkCellRepository(db);
        this.tasks = new JdbcRowTaskRepository(db);
        this.predictions = new JdbcPredictionRepository(db);
    }

    public static String newUrl() {
        return "jdbc:h2:mem:pg-" + UUID.randomUUID()
                + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE;LOCK_TIMEOUT=10000";
    }

    public static TestStore open() {
        return new TestStore(newUrl(), 10);
    }

    public static TestStore open(int poolSize) {
        return new TestStore(newUrl(), poolSize);
    }

    public Model model(String id, String family) {
        Model model = new Model(id, id, family);
        catalog.saveModel(model);
        return model;
    }

    public Prompt prompt(String id) {
        Prompt prompt = new Prompt(id, "Label this: {text}");
        catalog.savePrompt(prompt);
        return prompt;
    }

    /**
     * A dataset with rows {@code <id>-000 .. <id>-<n-1>}.
     */
    public List<DatasetRow> dataset(String id, int rowCount) {
        catalog.saveDataset(new Dataset(id, id));
        List<DatasetRow> rows = new ArrayList<>();
        for (int i = 0; i < rowCount; i++) {
            rows.add(new DatasetRow(String.format("%s-%03d", id, i), id, "text " + i, i % 2 == 0 ? "yes" : "no"));
        }
        catalog.saveRows(rows);
        return rows;
    }

    /**
     * Run raw SQL, for arranging states no public operation produces.
     */
    public void execute(String sql) {
        try (Connection conn = db.getConnection();
                Statement st = conn.createStatement()) {
            st.execute(sql);
            conn.commit();
        } catch (SQLException e) {
            throw new RuntimeException(e);
        }
    }

    @Override
    public void close() {
        try (Connection conn = db.getConnection();
                Statement st = conn.createStatement()) {
            st.execute("SHUTDOWN");
        } catch (SQLException e) {
            // already gone
        }
        db.close();
    }
}
