package promptgrid.coordinator.store;

import promptgrid.coordinator.model.CellLease;
import promptgrid.coordinator.model.CellRegistration;
import promptgrid.coordinator.model.CellStatus;
import promptgrid.coordinator.model.CellSummary;
import promptgrid.coordinator.model.RowTaskStatus;
import promptgrid.coordinator.model.WorkCell;
import promptgrid.coordinator.repository.WorkCellRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * JDBC implementation of WorkCellRepository.
 *
 * Claims are optimistic: candidates are read without locks, then taken with
 * an UPDATE guarded on the status they were read with. Releases and lease
 * expiry lock the cell row with their first UPDATE, which serializes them
 * against each other and against concurrent claims of the same cell.
 */
public class JdbcWorkCellRepository implements WorkCellRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcWorkCellRepository.class);

    /** Candidates examined per claim attempt */
    private static final int CLAIM_CANDIDATES = 16;

    private final Database db;

    public JdbcWorkCellRepository(Database db) {
        this.db = db;
    }

    @Override
    public CellRegistration createWithTasks(String cellId, String modelId, String promptId, String datasetId,
            int maxRetries, Instant now) {
        String insertCellSql = """
                    INSERT INTO work_cells (id, model_id, prompt_id, dataset_id, status, active_workers,
                                            total_tasks, created_at)
                    VALUES (?, ?, ?, ?, 'AVAILABLE', 0, 0, ?)
                """;

        String expandSql = """
                    INSERT INTO row_tasks (cell_id, row_id, status, retry_count, max_retries, updated_at)
                    SELECT ?, r.id, 'PENDING', 0, ?, ?
                    FROM dataset_rows r
                    WHERE r.dataset_id = ?
                    ORDER BY r.id
                """;

        String totalSql = "UPDATE work_cells SET total_tasks = ? WHERE id = ?";

        try (Connection conn = db.getConnection()) {
            try {
                Timestamp ts = JdbcSupport.ts(now);

                try (PreparedStatement ps = conn.prepareStatement(insertCellSql)) {
                    ps.setString(1, cellId);
                    ps.setString(2, modelId);
                    ps.setString(3, promptId);
                    ps.setString(4, datasetId);
                    ps.setTimestamp(5, ts);
                    ps.executeUpdate();
                }

                int expanded;
                try (PreparedStatement ps = conn.prepareStatement(expandSql)) {
                    ps.setString(1, cellId);
                    ps.setInt(2, maxRetries);
                    ps.setTimestamp(3, ts);
                    ps.setString(4, datasetId);
                    expanded = ps.executeUpdate();
                }

                try (PreparedStatement ps = conn.prepareStatement(totalSql)) {
                    ps.setInt(1, expanded);
                    ps.setString(2, cellId);
                    ps.executeUpdate();
                }

                // Cell and tasks become visible together
                conn.commit();

                log.info("Created cell {} ({}/{}/{}) with {} row tasks",
                        cellId, modelId, promptId, datasetId, expanded);

                WorkCell cell = findById(conn, cellId)
                        .orElseThrow(() -> new SQLException("Cell vanished after insert: " + cellId));
                return new CellRegistration(cell, true);

            } catch (SQLException e) {
                conn.rollback();
                if (!JdbcSupport.isUniqueViolation(e)) {
                    throw e;
                }
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to create cell for " + modelId + "/" + promptId + "/" + datasetId, e);
        }

        // Duplicate (model, prompt, dataset): a no-op returning the existing cell
        WorkCell existing = findByCombination(modelId, promptId, datasetId)
                .orElseThrow(() -> new IllegalStateException(
                        "Unique violation but no cell for " + modelId + "/" + promptId + "/" + datasetId));
        log.debug("Cell for {}/{}/{} already exists: {}", modelId, promptId, datasetId, existing.id());
        return new CellRegistration(existing, false);
    }

    @Override
    public Optional<WorkCell> findById(String cellId) {
        try (Connection conn = db.getConnection()) {
            return findById(conn, cellId);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find cell: " + cellId, e);
        }
    }

    @Override
    public Optional<WorkCell> findByCombination(String modelId, String promptId, String datasetId) {
        String sql = "SELECT * FROM work_cells WHERE model_id = ? AND prompt_id = ? AND dataset_id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, modelId);
            ps.setString(2, promptId);
            ps.setString(3, datasetId);
            List<WorkCell> found = executeQuery(ps);
            return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find cell for " + modelId + "/" + promptId + "/" + datasetId, e);
        }
    }

    @Override
    public List<WorkCell> findAll() {
        String sql = "SELECT * FROM work_cells ORDER BY created_at, id";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list cells", e);
        }
    }

    @Override
    public List<WorkCell> findByStatus(CellStatus status) {
        String sql = "SELECT * FROM work_cells WHERE status = ? ORDER BY created_at, id";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, status.name());
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find cells by status: " + status, e);
        }
    }

    @Override
    public Optional<WorkCell> claim(String workerId, Set<String> families, Instant now) {
        if (families.isEmpty()) {
            return Optional.empty();
        }

        String candidatesSql = """
                    SELECT c.id FROM work_cells c
                    JOIN models m ON m.id = c.model_id
                    WHERE c.status IN ('AVAILABLE', 'IN_USE')
                      AND m.family IN (%s)
                      AND EXISTS (SELECT 1 FROM row_tasks t WHERE t.cell_id = c.id AND t.status = 'PENDING')
                      AND NOT EXISTS (SELECT 1 FROM cell_leases l WHERE l.cell_id = c.id AND l.worker_id = ?)
                    ORDER BY CASE WHEN c.status = 'AVAILABLE' THEN 0 ELSE 1 END, c.created_at, c.id
                    LIMIT ?
                """.formatted(JdbcSupport.placeholders(families));

        String takeSql = """
                    UPDATE work_cells
                    SET status = 'IN_USE', active_workers = active_workers + 1, finished_at = NULL
                    WHERE id = ? AND status IN ('AVAILABLE', 'IN_USE')
                """;

        String leaseSql = "INSERT INTO cell_leases (cell_id, worker_id, renewed_at) VALUES (?, ?, ?)";

        try (Connection conn = db.getConnection()) {
            try {
                List<String> candidates = new ArrayList<>();
                try (PreparedStatement ps = conn.prepareStatement(candidatesSql)) {
                    int i = 1;
                    for (String family : families) {
                        ps.setString(i++, family);
                    }
                    ps.setString(i++, workerId);
                    ps.setInt(i, CLAIM_CANDIDATES);
                    try (ResultSet rs = ps.executeQuery()) {
                        while (rs.next()) {
                            candidates.add(rs.getString(1));
                        }
                    }
                }

                for (String cellId : candidates) {
                    int taken;
                    try (PreparedStatement ps = conn.prepareStatement(takeSql)) {
                        ps.setString(1, cellId);
                        taken = ps.executeUpdate();
                    }
                    if (taken == 0) {
                        // Finished by someone else between read and update
                        continue;
                    }

                    try (PreparedStatement ps = conn.prepareStatement(leaseSql)) {
                        ps.setString(1, cellId);
                        ps.setString(2, workerId);
                        ps.setTimestamp(3, JdbcSupport.ts(now));
                        ps.executeUpdate();
                    }

                    conn.commit();

                    WorkCell cell = findById(conn, cellId)
                            .orElseThrow(() -> new SQLException("Claimed cell vanished: " + cellId));
                    log.info("Worker {} claimed cell {} (active workers: {})",
                            workerId, cellId, cell.activeWorkers());
                    return Optional.of(cell);
                }

                conn.rollback();
                return Optional.empty();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to claim cell for worker: " + workerId, e);
        }
    }

    @Override
    public boolean renewLease(String cellId, String workerId, Instant now) {
        String sql = "UPDATE cell_leases SET renewed_at = ? WHERE cell_id = ? AND worker_id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setTimestamp(1, JdbcSupport.ts(now));
            ps.setString(2, cellId);
            ps.setString(3, workerId);
            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to renew lease on cell " + cellId + " for " + workerId, e);
        }
    }

    @Override
    public CellStatus release(String cellId, String workerId, Instant now) {
        String dropLeaseSql = "DELETE FROM cell_leases WHERE cell_id = ? AND worker_id = ?";

        try (Connection conn = db.getConnection()) {
            try {
                int dropped;
                try (PreparedStatement ps = conn.prepareStatement(dropLeaseSql)) {
                    ps.setString(1, cellId);
                    ps.setString(2, workerId);
                    dropped = ps.executeUpdate();
                }

                if (dropped == 0) {
                    // The watchdog expired this lease and already resolved the cell
                    conn.commit();
                    CellStatus current = findById(conn, cellId).map(WorkCell::status)
                            .orElseThrow(() -> new SQLException("Unknown cell: " + cellId));
                    log.warn("Worker {} released cell {} but held no lease (status {})", workerId, cellId, current);
                    return current;
                }

                CellStatus status = decrementAndResolve(conn, cellId, now);
                conn.commit();

                if (status == CellStatus.DONE) {
                    log.info("Worker {} released cell {} -> DONE", workerId, cellId);
                } else {
                    log.info("Worker {} released cell {} -> {}", workerId, cellId, status);
                }
                return status;
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to release cell " + cellId + " for worker " + workerId, e);
        }
    }

    @Override
    public List<CellLease> findExpiredLeases(Instant renewedBefore) {
        String sql = "SELECT * FROM cell_leases WHERE renewed_at < ? ORDER BY renewed_at";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setTimestamp(1, JdbcSupport.ts(renewedBefore));
            return executeLeaseQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find expired leases", e);
        }
    }

    @Override
    public Optional<CellStatus> expireLease(CellLease lease, Instant now) {
        String dropLeaseSql = "DELETE FROM cell_leases WHERE cell_id = ? AND worker_id = ? AND renewed_at = ?";

        try (Connection conn = db.getConnection()) {
            try {
                int dropped;
                try (PreparedStatement ps = conn.prepareStatement(dropLeaseSql)) {
                    ps.setString(1, lease.cellId());
                    ps.setString(2, lease.workerId());
                    ps.setTimestamp(3, JdbcSupport.ts(lease.renewedAt()));
                    dropped = ps.executeUpdate();
                }

                if (dropped == 0) {
                    // Renewed or released since it was read
                    conn.rollback();
                    return Optional.empty();
                }

                CellStatus status = decrementAndResolve(conn, lease.cellId(), now);
                conn.commit();
                return Optional.of(status);
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to expire lease of " + lease.workerId() + " on cell " + lease.cellId(),
                    e);
        }
    }

    @Override
    public List<WorkCell> findDoneWithPending() {
        String sql = """
                    SELECT c.* FROM work_cells c
                    WHERE c.status = 'DONE'
                      AND EXISTS (SELECT 1 FROM row_tasks t WHERE t.cell_id = c.id AND t.status = 'PENDING')
                    ORDER BY c.created_at, c.id
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find done cells with pending tasks", e);
        }
    }

    @Override
    public Optional<CellStatus> reopen(String cellId, Instant now) {
        String sql = """
                    UPDATE work_cells
                    SET status = CASE WHEN active_workers > 0 THEN 'IN_USE' ELSE 'AVAILABLE' END,
                        reopen_count = reopen_count + 1,
                        finished_at = NULL
                    WHERE id = ? AND status = 'DONE'
                      AND EXISTS (SELECT 1 FROM row_tasks t WHERE t.cell_id = ? AND t.status = 'PENDING')
                """;

        try (Connection conn = db.getConnection()) {
            try {
                int updated;
                try (PreparedStatement ps = conn.prepareStatement(sql)) {
                    ps.setString(1, cellId);
                    ps.setString(2, cellId);
                    updated = ps.executeUpdate();
                }

                if (updated == 0) {
                    conn.rollback();
                    return Optional.empty();
                }

                CellStatus status = findById(conn, cellId).map(WorkCell::status)
                        .orElseThrow(() -> new SQLException("Reopened cell vanished: " + cellId));
                conn.commit();
                return Optional.of(status);
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to reopen cell: " + cellId, e);
        }
    }

    @Override
    public List<WorkCell> findSettleable() {
        String sql = """
                    SELECT c.* FROM work_cells c
                    WHERE c.status = 'AVAILABLE' AND c.active_workers = 0
                      AND NOT EXISTS (SELECT 1 FROM row_tasks t
                                      WHERE t.cell_id = c.id AND t.status IN ('PENDING', 'IN_PROGRESS'))
                    ORDER BY c.created_at, c.id
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find settleable cells", e);
        }
    }

    @Override
    public boolean settle(String cellId, Instant now) {
        String sql = """
                    UPDATE work_cells
                    SET status = 'DONE', finished_at = ?
                    WHERE id = ? AND status = 'AVAILABLE' AND active_workers = 0
                      AND NOT EXISTS (SELECT 1 FROM row_tasks t
                                      WHERE t.cell_id = ? AND t.status IN ('PENDING', 'IN_PROGRESS'))
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setTimestamp(1, JdbcSupport.ts(now));
            ps.setString(2, cellId);
            ps.setString(3, cellId);
            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to settle cell: " + cellId, e);
        }
    }

    @Override
    public List<CellLease> findLeases(String cellId) {
        String sql = "SELECT * FROM cell_leases WHERE cell_id = ? ORDER BY worker_id";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, cellId);
            return executeLeaseQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find leases of cell: " + cellId, e);
        }
    }

    @Override
    public List<CellSummary> summaries() {
        String countsSql = "SELECT cell_id, status, COUNT(*) AS n FROM row_tasks GROUP BY cell_id, status";

        List<WorkCell> cells = findAll();
        Map<String, Map<RowTaskStatus, Integer>> counts = new HashMap<>();

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(countsSql);
                ResultSet rs = ps.executeQuery()) {

            while (rs.next()) {
                counts.computeIfAbsent(rs.getString("cell_id"), k -> new EnumMap<>(RowTaskStatus.class))
                        .put(RowTaskStatus.valueOf(rs.getString("status")), rs.getInt("n"));
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count row tasks", e);
        }

        List<CellSummary> summaries = new ArrayList<>(cells.size());
        for (WorkCell cell : cells) {
            summaries.add(toSummary(cell, counts.getOrDefault(cell.id(), Map.of())));
        }
        return summaries;
    }

    @Override
    public Optional<CellSummary> summary(String cellId) {
        String countsSql = "SELECT status, COUNT(*) AS n FROM row_tasks WHERE cell_id = ? GROUP BY status";

        try (Connection conn = db.getConnection()) {
            Optional<WorkCell> cell = findById(conn, cellId);
            if (cell.isEmpty()) {
                return Optional.empty();
            }

            Map<RowTaskStatus, Integer> counts = new EnumMap<>(RowTaskStatus.class);
            try (PreparedStatement ps = conn.prepareStatement(countsSql)) {
                ps.setString(1, cellId);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        counts.put(RowTaskStatus.valueOf(rs.getString("status")), rs.getInt("n"));
                    }
                }
            }
            return Optional.of(toSummary(cell.get(), counts));
        } catch (SQLException e) {
            throw new RuntimeException("Failed to summarize cell: " + cellId, e);
        }
    }

    // Helper methods

    /**
     * Decrement the active worker count and decide the cell status, inside
     * the caller's transaction. The decrement takes the cell's row lock, so
     * two releasing workers resolve one after the other.
     */
    private CellStatus decrementAndResolve(Connection conn, String cellId, Instant now) throws SQLException {
        String decrementSql = """
                    UPDATE work_cells SET active_workers = active_workers - 1
                    WHERE id = ? AND active_workers > 0
                """;

        String openTasksSql = """
                    SELECT COUNT(*) FROM row_tasks
                    WHERE cell_id = ? AND status IN ('PENDING', 'IN_PROGRESS')
                """;

        String statusSql = "UPDATE work_cells SET status = ?, finished_at = ? WHERE id = ?";

        try (PreparedStatement ps = conn.prepareStatement(decrementSql)) {
            ps.setString(1, cellId);
            if (ps.executeUpdate() != 1) {
                // Leases and active_workers disagree; roll back rather than resolve from a bad count
                throw new SQLException("Cell " + cellId + " had a lease but no active workers");
            }
        }

        WorkCell cell = findById(conn, cellId)
                .orElseThrow(() -> new SQLException("Unknown cell: " + cellId));

        int openTasks;
        try (PreparedStatement ps = conn.prepareStatement(openTasksSql)) {
            ps.setString(1, cellId);
            try (ResultSet rs = ps.executeQuery()) {
                rs.next();
                openTasks = rs.getInt(1);
            }
        }

        CellStatus status;
        if (cell.activeWorkers() > 0) {
            status = CellStatus.IN_USE;
        } else if (openTasks > 0) {
            status = CellStatus.AVAILABLE;
        } else {
            status = CellStatus.DONE;
        }

        try (PreparedStatement ps = conn.prepareStatement(statusSql)) {
            ps.setString(1, status.name());
            JdbcSupport.setTimestamp(ps, 2, status == CellStatus.DONE ? now : null);
            ps.setString(3, cellId);
            ps.executeUpdate();
        }

        return status;
    }

    private Optional<WorkCell> findById(Connection conn, String cellId) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("SELECT * FROM work_cells WHERE id = ?")) {
            ps.setString(1, cellId);
            List<WorkCell> found = executeQuery(ps);
            return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
        }
    }

    private static CellSummary toSummary(WorkCell cell, Map<RowTaskStatus, Integer> counts) {
        return new CellSummary(cell,
                counts.getOrDefault(RowTaskStatus.PENDING, 0),
                counts.getOrDefault(RowTaskStatus.IN_PROGRESS, 0),
                counts.getOrDefault(RowTaskStatus.DONE, 0),
                counts.getOrDefault(RowTaskStatus.FAILED, 0));
    }

    private List<WorkCell> executeQuery(PreparedStatement ps) throws SQLException {
        List<WorkCell> results = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                results.add(mapRow(rs));
            }
        }
        return results;
    }

    private List<CellLease> executeLeaseQuery(PreparedStatement ps) throws SQLException {
        List<CellLease> results = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                results.add(new CellLease(
                        rs.getString("cell_id"),
                        rs.getString("worker_id"),
                        JdbcSupport.getInstant(rs, "renewed_at")));
            }
        }
        return results;
    }

    private WorkCell mapRow(ResultSet rs) throws SQLException {
        return WorkCell.builder()
                .id(rs.getString("id"))
                .modelId(rs.getString("model_id"))
                .promptId(rs.getString("prompt_id"))
                .datasetId(rs.getString("dataset_id"))
                .status(CellStatus.valueOf(rs.getString("status")))
                .activeWorkers(rs.getInt("active_workers"))
                .totalTasks(rs.getInt("total_tasks"))
                .reopenCount(rs.getInt("reopen_count"))
                .createdAt(JdbcSupport.getInstant(rs, "created_at"))
                .finishedAt(JdbcSupport.getInstant(rs, "finished_at"))
                .build();
    }
}
