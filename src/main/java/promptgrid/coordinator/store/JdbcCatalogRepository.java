package promptgrid.coordinator.store;

import promptgrid.coordinator.model.Dataset;
import promptgrid.coordinator.model.DatasetRow;
import promptgrid.coordinator.model.Model;
import promptgrid.coordinator.model.Prompt;
import promptgrid.coordinator.repository.CatalogRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * JDBC implementation of CatalogRepository.
 * Repeated registration is a no-op: a duplicate key is reported as
 * "not created" rather than as an error.
 */
public class JdbcCatalogRepository implements CatalogRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcCatalogRepository.class);

    private final Database db;

    public JdbcCatalogRepository(Database db) {
        this.db = db;
    }

    @Override
    public boolean saveDataset(Dataset dataset) {
        String sql = """
                    INSERT INTO datasets (id, name, created_at) VALUES (?, ?, ?)
                """;

        return insertIfAbsent(sql, "dataset " + dataset.id(), ps -> {
            ps.setString(1, dataset.id());
            ps.setString(2, dataset.name());
            ps.setTimestamp(3, JdbcSupport.ts(Instant.now()));
        });
    }

    @Override
    public int saveRows(List<DatasetRow> rows) {
        if (rows.isEmpty())
            return 0;

        String sql = """
                    INSERT INTO dataset_rows (id, dataset_id, content, expected_label, created_at)
                    VALUES (?, ?, ?, ?, ?)
                """;

        // A concurrent registration of the same rows surfaces as a unique
        // violation; re-filter against what now exists and try again.
        for (int attempt = 1;; attempt++) {
            Map<String, DatasetRow> existing = findRowsByIds(rows.stream().map(DatasetRow::id).toList());
            List<DatasetRow> missing = rows.stream()
                    .filter(row -> !existing.containsKey(row.id()))
                    .toList();
            if (missing.isEmpty()) {
                log.debug("All {} rows already registered", rows.size());
                return 0;
            }

            try (Connection conn = db.getConnection()) {
                try (PreparedStatement ps = conn.prepareStatement(sql)) {
                    Timestamp now = JdbcSupport.ts(Instant.now());
                    for (DatasetRow row : missing) {
                        ps.setString(1, row.id());
                        ps.setString(2, row.datasetId());
                        ps.setString(3, row.content());
                        ps.setString(4, row.expectedLabel());
                        ps.setTimestamp(5, now);
                        ps.addBatch();
                    }
                    ps.executeBatch();
                    conn.commit();

                    log.debug("Saved {} of {} rows", missing.size(), rows.size());
                    return missing.size();
                } catch (SQLException e) {
                    conn.rollback();
                    if (!isUniqueViolation(e) || attempt >= 3) {
                        throw e;
                    }
                    log.debug("Rows registered concurrently, retrying (attempt {})", attempt);
                }
            } catch (SQLException e) {
                throw new RuntimeException("Failed to save rows batch of " + rows.size(), e);
            }
        }
    }

    @Override
    public boolean saveModel(Model model) {
        String sql = """
                    INSERT INTO models (id, name, family, created_at) VALUES (?, ?, ?, ?)
                """;

        return insertIfAbsent(sql, "model " + model.id(), ps -> {
            ps.setString(1, model.id());
            ps.setString(2, model.name());
            ps.setString(3, model.family());
            ps.setTimestamp(4, JdbcSupport.ts(Instant.now()));
        });
    }

    @Override
    public boolean savePrompt(Prompt prompt) {
        String sql = """
                    INSERT INTO prompts (id, template, created_at) VALUES (?, ?, ?)
                """;

        return insertIfAbsent(sql, "prompt " + prompt.id(), ps -> {
            ps.setString(1, prompt.id());
            ps.setString(2, prompt.template());
            ps.setTimestamp(3, JdbcSupport.ts(Instant.now()));
        });
    }

    @Override
    public Optional<Dataset> findDataset(String datasetId) {
        String sql = "SELECT id, name FROM datasets WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, datasetId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(new Dataset(rs.getString("id"), rs.getString("name")));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find dataset: " + datasetId, e);
        }
    }

    @Override
    public Optional<Model> findModel(String modelId) {
        String sql = "SELECT id, name, family FROM models WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, modelId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(new Model(rs.getString("id"), rs.getString("name"), rs.getString("family")));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find model: " + modelId, e);
        }
    }

    @Override
    public Optional<Prompt> findPrompt(String promptId) {
        String sql = "SELECT id, template FROM prompts WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, promptId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(new Prompt(rs.getString("id"), rs.getString("template")));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find prompt: " + promptId, e);
        }
    }

    @Override
    public Optional<DatasetRow> findRow(String rowId) {
        String sql = "SELECT * FROM dataset_rows WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, rowId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find row: " + rowId, e);
        }
    }

    @Override
    public List<DatasetRow> findRows(String datasetId) {
        String sql = "SELECT * FROM dataset_rows WHERE dataset_id = ? ORDER BY id";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, datasetId);
            List<DatasetRow> rows = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    rows.add(mapRow(rs));
                }
            }
            return rows;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find rows for dataset: " + datasetId, e);
        }
    }

    @Override
    public Map<String, DatasetRow> findRowsByIds(Collection<String> rowIds) {
        if (rowIds.isEmpty())
            return Map.of();

        String sql = "SELECT * FROM dataset_rows WHERE id IN (" + JdbcSupport.placeholders(rowIds) + ")";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            int i = 1;
            for (String rowId : rowIds) {
                ps.setString(i++, rowId);
            }

            Map<String, DatasetRow> rows = new HashMap<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    DatasetRow row = mapRow(rs);
                    rows.put(row.id(), row);
                }
            }
            return rows;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find " + rowIds.size() + " rows", e);
        }
    }

    @Override
    public int countRows(String datasetId) {
        String sql = "SELECT COUNT(*) FROM dataset_rows WHERE dataset_id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, datasetId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return rs.getInt(1);
                }
            }
            return 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count rows for dataset: " + datasetId, e);
        }
    }

    // Helper methods

    @FunctionalInterface
    private interface Binder {
        void bind(PreparedStatement ps) throws SQLException;
    }

    private boolean insertIfAbsent(String sql, String what, Binder binder) {
        try (Connection conn = db.getConnection()) {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                binder.bind(ps);
                int inserted = ps.executeUpdate();
                conn.commit();

                if (inserted > 0) {
                    log.debug("Registered {}", what);
                }
                return inserted > 0;
            } catch (SQLException e) {
                conn.rollback();
                if (isUniqueViolation(e)) {
                    log.debug("{} registered concurrently", what);
                    return false;
                }
                throw e;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to save " + what, e);
        }
    }

    /** Batch failures may wrap the constraint violation */
    private static boolean isUniqueViolation(SQLException e) {
        for (SQLException cur = e; cur != null; cur = cur.getNextException()) {
            if (JdbcSupport.isUniqueViolation(cur))
                return true;
        }
        return e.getCause() instanceof SQLException cause && JdbcSupport.isUniqueViolation(cause);
    }

    private DatasetRow mapRow(ResultSet rs) throws SQLException {
        return new DatasetRow(
                rs.getString("id"),
                rs.getString("dataset_id"),
                rs.getString("content"),
                rs.getString("expected_label"));
    }
}
