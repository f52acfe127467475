package promptgrid.coordinator.store;

import promptgrid.coordinator.model.Prediction;
import promptgrid.coordinator.model.PredictionQuery;
import promptgrid.coordinator.repository.PredictionRepository;

import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * JDBC implementation of PredictionRepository.
 */
public class JdbcPredictionRepository implements PredictionRepository {

    private final Database db;

    public JdbcPredictionRepository(Database db) {
        this.db = db;
    }

    /**
     * Append a prediction inside the caller's transaction.
     */
    static void insert(Connection conn, Prediction prediction, Instant now) throws SQLException {
        String sql = """
                    INSERT INTO predictions (cell_id, row_id, model_id, prompt_id, dataset_id, label,
                                             latency_ms, worker_id, created_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, prediction.cellId());
            ps.setString(2, prediction.rowId());
            ps.setString(3, prediction.modelId());
            ps.setString(4, prediction.promptId());
            ps.setString(5, prediction.datasetId());
            ps.setString(6, prediction.label());
            ps.setLong(7, prediction.latencyMs());
            ps.setString(8, prediction.workerId());
            ps.setTimestamp(9, JdbcSupport.ts(prediction.createdAt() != null ? prediction.createdAt() : now));
            ps.executeUpdate();
        }
    }

    @Override
    public List<Prediction> findByCell(String cellId) {
        String sql = "SELECT * FROM predictions WHERE cell_id = ? ORDER BY id";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, cellId);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find predictions of cell: " + cellId, e);
        }
    }

    @Override
    public List<Prediction> findLatest(PredictionQuery query) {
        StringBuilder sql = new StringBuilder("""
                    SELECT p.* FROM predictions p
                    JOIN models m ON m.id = p.model_id
                    WHERE p.id = (SELECT MAX(q.id) FROM predictions q
                                  WHERE q.cell_id = p.cell_id AND q.row_id = p.row_id)
                """);

        List<String> params = new ArrayList<>();
        if (query.modelId() != null) {
            sql.append(" AND p.model_id = ?");
            params.add(query.modelId());
        }
        if (query.promptId() != null) {
            sql.append(" AND p.prompt_id = ?");
            params.add(query.promptId());
        }
        if (query.datasetId() != null) {
            sql.append(" AND p.dataset_id = ?");
            params.add(query.datasetId());
        }
        if (query.family() != null) {
            sql.append(" AND m.family = ?");
            params.add(query.family());
        }
        sql.append(" ORDER BY p.cell_id, p.row_id");

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql.toString())) {

            for (int i = 0; i < params.size(); i++) {
                ps.setString(i + 1, params.get(i));
            }
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to query predictions: " + query, e);
        }
    }

    @Override
    public int countByCell(String cellId) {
        String sql = "SELECT COUNT(*) FROM predictions WHERE cell_id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, cellId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return rs.getInt(1);
                }
            }
            return 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count predictions of cell: " + cellId, e);
        }
    }

    private List<Prediction> executeQuery(PreparedStatement ps) throws SQLException {
        List<Prediction> results = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                results.add(mapRow(rs));
            }
        }
        return results;
    }

    private Prediction mapRow(ResultSet rs) throws SQLException {
        return Prediction.builder()
                .id(rs.getLong("id"))
                .cellId(rs.getString("cell_id"))
                .rowId(rs.getString("row_id"))
                .modelId(rs.getString("model_id"))
                .promptId(rs.getString("prompt_id"))
                .datasetId(rs.getString("dataset_id"))
                .label(rs.getString("label"))
                .latencyMs(rs.getLong("latency_ms"))
                .workerId(rs.getString("worker_id"))
                .createdAt(JdbcSupport.getInstant(rs, "created_at"))
                .build();
    }
}
