package promptgrid.coordinator.store;

import promptgrid.coordinator.model.CompletionResult;
import promptgrid.coordinator.model.Prediction;
import promptgrid.coordinator.model.RetryOutcome;
import promptgrid.coordinator.model.RowTask;
import promptgrid.coordinator.model.RowTaskStatus;
import promptgrid.coordinator.repository.RowTaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * JDBC implementation of RowTaskRepository.
 * Every transition is a single guarded UPDATE; an update count of zero means
 * another actor got there first.
 */
public class JdbcRowTaskRepository implements RowTaskRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcRowTaskRepository.class);

    private static final int MAX_ERROR_LENGTH = 2048;

    /** Re-selections when every candidate of a batch was taken by others */
    private static final int CLAIM_ATTEMPTS = 3;

    /**
     * Shared by worker failures and watchdog resets: one more attempt spent,
     * FAILED once the counter passes the task's ceiling, PENDING otherwise.
     */
    private static final String RETURN_SQL = """
                UPDATE row_tasks
                SET retry_count = retry_count + 1,
                    status = CASE WHEN retry_count + 1 > max_retries THEN 'FAILED' ELSE 'PENDING' END,
                    claimed_by = NULL,
                    claimed_at = NULL,
                    last_error = ?,
                    updated_at = ?
                WHERE id = ? AND status = 'IN_PROGRESS' AND claimed_at = ?
            """;

    private final Database db;

    public JdbcRowTaskRepository(Database db) {
        this.db = db;
    }

    @Override
    public List<RowTask> claimBatch(String cellId, String workerId, int limit, Instant now) {
        if (limit <= 0) {
            return List.of();
        }

        String selectSql = """
                    SELECT * FROM row_tasks
                    WHERE cell_id = ? AND status = 'PENDING'
                    ORDER BY id
                    LIMIT ?
                """;

        String updateSql = """
                    UPDATE row_tasks
                    SET status = 'IN_PROGRESS', claimed_by = ?, claimed_at = ?, updated_at = ?
                    WHERE id = ? AND status = 'PENDING'
                """;

        Timestamp claimedAt = JdbcSupport.ts(now);
        List<RowTask> claimed = new ArrayList<>();

        try (Connection conn = db.getConnection()) {
            try (PreparedStatement selectPs = conn.prepareStatement(selectSql);
                    PreparedStatement updatePs = conn.prepareStatement(updateSql)) {

                for (int attempt = 1; attempt <= CLAIM_ATTEMPTS && claimed.isEmpty(); attempt++) {
                    selectPs.setString(1, cellId);
                    selectPs.setInt(2, limit);
                    List<RowTask> candidates = executeQuery(selectPs);
                    if (candidates.isEmpty()) {
                        break;
                    }

                    // Ascending id order keeps concurrent claimers from deadlocking
                    for (RowTask candidate : candidates) {
                        updatePs.setString(1, workerId);
                        updatePs.setTimestamp(2, claimedAt);
                        updatePs.setTimestamp(3, claimedAt);
                        updatePs.setLong(4, candidate.id());
                        if (updatePs.executeUpdate() == 1) {
                            claimed.add(candidate.toBuilder()
                                    .status(RowTaskStatus.IN_PROGRESS)
                                    .claimedBy(workerId)
                                    .claimedAt(claimedAt.toInstant())
                                    .updatedAt(claimedAt.toInstant())
                                    .build());
                        }
                    }
                }

                conn.commit();

                if (!claimed.isEmpty()) {
                    log.debug("Worker {} claimed {} tasks of cell {}", workerId, claimed.size(), cellId);
                }
                return claimed;
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to claim tasks of cell " + cellId + " for worker " + workerId, e);
        }
    }

    @Override
    public boolean touch(RowTask claimed, Instant now) {
        return !touchAll(List.of(claimed), now).isEmpty();
    }

    @Override
    public List<RowTask> touchAll(List<RowTask> claimed, Instant now) {
        if (claimed.isEmpty()) {
            return List.of();
        }

        String sql = """
                    UPDATE row_tasks
                    SET claimed_at = ?, updated_at = ?
                    WHERE id = ? AND status = 'IN_PROGRESS' AND claimed_by = ? AND claimed_at = ?
                """;

        Timestamp ts = JdbcSupport.ts(now);

        try (Connection conn = db.getConnection()) {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                for (RowTask task : claimed) {
                    ps.setTimestamp(1, ts);
                    ps.setTimestamp(2, ts);
                    ps.setLong(3, task.id());
                    ps.setString(4, task.claimedBy());
                    JdbcSupport.setTimestamp(ps, 5, task.claimedAt());
                    ps.addBatch();
                }

                int[] counts = ps.executeBatch();
                conn.commit();

                List<RowTask> held = new ArrayList<>(claimed.size());
                for (int i = 0; i < claimed.size(); i++) {
                    if (counts[i] > 0) {
                        held.add(claimed.get(i).withClaimedAt(ts.toInstant()));
                    }
                }
                return held;
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to touch " + claimed.size() + " tasks of cell "
                    + claimed.get(0).cellId(), e);
        }
    }

    @Override
    public CompletionResult complete(RowTask claimed, Prediction prediction, Instant now) {
        // claimed_by and claimed_at stay on the row as an audit trail
        String sql = """
                    UPDATE row_tasks
                    SET status = 'DONE', last_error = NULL, updated_at = ?
                    WHERE id = ? AND status = 'IN_PROGRESS' AND claimed_by = ? AND claimed_at = ?
                """;

        try (Connection conn = db.getConnection()) {
            try {
                int updated;
                try (PreparedStatement ps = conn.prepareStatement(sql)) {
                    ps.setTimestamp(1, JdbcSupport.ts(now));
                    ps.setLong(2, claimed.id());
                    ps.setString(3, claimed.claimedBy());
                    JdbcSupport.setTimestamp(ps, 4, claimed.claimedAt());
                    updated = ps.executeUpdate();
                }

                if (updated == 0) {
                    conn.rollback();
                    log.warn("Task {} (cell {}, row {}) no longer held by {}, prediction discarded",
                            claimed.id(), claimed.cellId(), claimed.rowId(), claimed.claimedBy());
                    return CompletionResult.LOST;
                }

                JdbcPredictionRepository.insert(conn, prediction, now);
                conn.commit();

                log.debug("Task {} completed by {}", claimed.id(), claimed.claimedBy());
                return CompletionResult.COMPLETED;
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to complete task: " + claimed.id(), e);
        }
    }

    @Override
    public RetryOutcome failAttempt(RowTask claimed, String error, Instant now) {
        return returnTask(RETURN_SQL + " AND claimed_by = ?", claimed, error, now, true);
    }

    @Override
    public List<RowTask> findStuck(Instant claimedBefore) {
        String sql = """
                    SELECT * FROM row_tasks
                    WHERE status = 'IN_PROGRESS' AND claimed_at < ?
                    ORDER BY claimed_at, id
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setTimestamp(1, JdbcSupport.ts(claimedBefore));
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find stuck tasks", e);
        }
    }

    @Override
    public RetryOutcome resetStuck(RowTask stuck, Instant now) {
        String error = "Abandoned by " + stuck.claimedBy() + " (claimed at " + stuck.claimedAt() + ")";
        return returnTask(RETURN_SQL, stuck, error, now, false);
    }

    @Override
    public boolean requeueDone(String cellId, String rowId, Instant now) {
        String sql = """
                    UPDATE row_tasks
                    SET status = 'PENDING', claimed_by = NULL, claimed_at = NULL, updated_at = ?
                    WHERE cell_id = ? AND row_id = ? AND status = 'DONE'
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setTimestamp(1, JdbcSupport.ts(now));
            ps.setString(2, cellId);
            ps.setString(3, rowId);

            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to requeue task of cell " + cellId + ", row " + rowId, e);
        }
    }

    @Override
    public Optional<RowTask> findById(long taskId) {
        String sql = "SELECT * FROM row_tasks WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setLong(1, taskId);
            return single(executeQuery(ps));
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find task: " + taskId, e);
        }
    }

    @Override
    public Optional<RowTask> find(String cellId, String rowId) {
        String sql = "SELECT * FROM row_tasks WHERE cell_id = ? AND row_id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, cellId);
            ps.setString(2, rowId);
            return single(executeQuery(ps));
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find task of cell " + cellId + ", row " + rowId, e);
        }
    }

    @Override
    public List<RowTask> findByCell(String cellId) {
        String sql = "SELECT * FROM row_tasks WHERE cell_id = ? ORDER BY id";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, cellId);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find tasks of cell: " + cellId, e);
        }
    }

    @Override
    public List<RowTask> findByCellAndStatus(String cellId, RowTaskStatus status) {
        String sql = "SELECT * FROM row_tasks WHERE cell_id = ? AND status = ? ORDER BY id";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, cellId);
            ps.setString(2, status.name());
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find " + status + " tasks of cell: " + cellId, e);
        }
    }

    @Override
    public int countByStatus(RowTaskStatus status) {
        String sql = "SELECT COUNT(*) FROM row_tasks WHERE status = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, status.name());
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return rs.getInt(1);
                }
            }
            return 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count tasks by status: " + status, e);
        }
    }

    // Helper methods

    private RetryOutcome returnTask(String sql, RowTask task, String error, Instant now, boolean guardWorker) {
        try (Connection conn = db.getConnection()) {
            try {
                int updated;
                try (PreparedStatement ps = conn.prepareStatement(sql)) {
                    ps.setString(1, truncate(error));
                    ps.setTimestamp(2, JdbcSupport.ts(now));
                    ps.setLong(3, task.id());
                    JdbcSupport.setTimestamp(ps, 4, task.claimedAt());
                    if (guardWorker) {
                        ps.setString(5, task.claimedBy());
                    }
                    updated = ps.executeUpdate();
                }

                if (updated == 0) {
                    conn.rollback();
                    return RetryOutcome.LOST;
                }

                RowTaskStatus status;
                try (PreparedStatement ps = conn.prepareStatement("SELECT status FROM row_tasks WHERE id = ?")) {
                    ps.setLong(1, task.id());
                    try (ResultSet rs = ps.executeQuery()) {
                        if (!rs.next()) {
                            throw new SQLException("Task vanished after update: " + task.id());
                        }
                        status = RowTaskStatus.valueOf(rs.getString(1));
                    }
                }
                conn.commit();

                return status == RowTaskStatus.FAILED ? RetryOutcome.FAILED : RetryOutcome.REQUEUED;
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to return task: " + task.id(), e);
        }
    }

    private static String truncate(String error) {
        if (error == null || error.length() <= MAX_ERROR_LENGTH) {
            return error;
        }
        return error.substring(0, MAX_ERROR_LENGTH);
    }

    private static Optional<RowTask> single(List<RowTask> tasks) {
        return tasks.isEmpty() ? Optional.empty() : Optional.of(tasks.get(0));
    }

    private List<RowTask> executeQuery(PreparedStatement ps) throws SQLException {
        List<RowTask> results = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                results.add(mapRow(rs));
            }
        }
        return results;
    }

    private RowTask mapRow(ResultSet rs) throws SQLException {
        return RowTask.builder()
                .id(rs.getLong("id"))
                .cellId(rs.getString("cell_id"))
                .rowId(rs.getString("row_id"))
                .status(RowTaskStatus.valueOf(rs.getString("status")))
                .retryCount(rs.getInt("retry_count"))
                .maxRetries(rs.getInt("max_retries"))
                .claimedBy(rs.getString("claimed_by"))
                .claimedAt(JdbcSupport.getInstant(rs, "claimed_at"))
                .lastError(rs.getString("last_error"))
                .updatedAt(JdbcSupport.getInstant(rs, "updated_at"))
                .build();
    }
}
