package promptgrid.coordinator.store;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import promptgrid.coordinator.config.GridConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Database connection pool and schema management.
 * Uses HikariCP for connection pooling. Connections are handed out with
 * auto-commit disabled; every repository method commits or rolls back itself.
 */
public final class Database implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Database.class);

    /** SQLState for unique / primary key violations (H2 and PostgreSQL) */
    static final String UNIQUE_VIOLATION = "23505";

    private final HikariDataSource dataSource;

    public Database(GridConfig config) {
        this(config.databaseUrl(), config.databasePoolSize());
    }

    public Database(String jdbcUrl, int poolSize) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setMaximumPoolSize(poolSize);
        hikariConfig.setMinimumIdle(Math.min(2, poolSize));
        hikariConfig.setConnectionTimeout(5000);
        hikariConfig.setIdleTimeout(300000);
        hikariConfig.setPoolName("promptgrid-db-pool");
        hikariConfig.setAutoCommit(false);
        hikariConfig.setTransactionIsolation("TRANSACTION_READ_COMMITTED");

        this.dataSource = new HikariDataSource(hikariConfig);

        log.info("Database pool initialized: {}", jdbcUrl);

        initSchema();
    }

    /**
     * Get a connection from the pool.
     * Caller is responsible for closing the connection.
     */
    public Connection getConnection() throws SQLException {
        return dataSource.getConnection();
    }

    public DataSource getDataSource() {
        return dataSource;
    }

    /**
     * Check if database is healthy.
     */
    public boolean isHealthy() {
        try (Connection conn = getConnection()) {
            return conn.isValid(2);
        } catch (SQLException e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return false;
        }
    }

    private void initSchema() {
        try (Connection conn = getConnection();
                Statement st = conn.createStatement()) {

            // ---------- REFERENCE DATA ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS datasets (
                            id              VARCHAR(128) PRIMARY KEY,
                            name            VARCHAR(512) NOT NULL,
                            created_at      TIMESTAMP DEFAULT CURRENT_TIMESTAMP
                        );
                    """);

            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS dataset_rows (
                            id              VARCHAR(128) PRIMARY KEY,
                            dataset_id      VARCHAR(128) NOT NULL REFERENCES datasets(id),
                            content         CLOB NOT NULL,
                            expected_label  VARCHAR(256),
                            created_at      TIMESTAMP DEFAULT CURRENT_TIMESTAMP
                        );
                    """);

            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS models (
                            id              VARCHAR(128) PRIMARY KEY,
                            name            VARCHAR(512) NOT NULL,
                            family          VARCHAR(128) NOT NULL,
                            created_at      TIMESTAMP DEFAULT CURRENT_TIMESTAMP
                        );
                    """);

            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS prompts (
                            id              VARCHAR(128) PRIMARY KEY,
                            template        CLOB NOT NULL,
                            created_at      TIMESTAMP DEFAULT CURRENT_TIMESTAMP
                        );
                    """);

            // ---------- WORK CELLS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS work_cells (
                            id              VARCHAR(64) PRIMARY KEY,
                            model_id        VARCHAR(128) NOT NULL REFERENCES models(id),
                            prompt_id       VARCHAR(128) NOT NULL REFERENCES prompts(id),
                            dataset_id      VARCHAR(128) NOT NULL REFERENCES datasets(id),
                            status          VARCHAR(20) DEFAULT 'AVAILABLE' NOT NULL,
                            active_workers  INT DEFAULT 0 NOT NULL,
                            total_tasks     INT DEFAULT 0 NOT NULL,
                            reopen_count    INT DEFAULT 0 NOT NULL,
                            created_at      TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            finished_at     TIMESTAMP,
                            CONSTRAINT uq_work_cells_triple UNIQUE (model_id, prompt_id, dataset_id),
                            CONSTRAINT ck_work_cells_active CHECK (active_workers >= 0)
                        );
                    """);

            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS cell_leases (
                            cell_id         VARCHAR(64) NOT NULL REFERENCES work_cells(id),
                            worker_id       VARCHAR(128) NOT NULL,
                            renewed_at      TIMESTAMP NOT NULL,
                            PRIMARY KEY (cell_id, worker_id)
                        );
                    """);

            // ---------- ROW TASKS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS row_tasks (
                            id              BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                            cell_id         VARCHAR(64) NOT NULL REFERENCES work_cells(id),
                            row_id          VARCHAR(128) NOT NULL REFERENCES dataset_rows(id),
                            status          VARCHAR(20) DEFAULT 'PENDING' NOT NULL,
                            retry_count     INT DEFAULT 0 NOT NULL,
                            max_retries     INT DEFAULT 3 NOT NULL,
                            claimed_by      VARCHAR(128),
                            claimed_at      TIMESTAMP,
                            last_error      VARCHAR(2048),
                            updated_at      TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            CONSTRAINT uq_row_tasks_cell_row UNIQUE (cell_id, row_id)
                        );
                    """);

            // ---------- PREDICTIONS (append-only) ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS predictions (
                            id              BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                            cell_id         VARCHAR(64) NOT NULL REFERENCES work_cells(id),
                            row_id          VARCHAR(128) NOT NULL,
                            model_id        VARCHAR(128) NOT NULL,
                            prompt_id       VARCHAR(128) NOT NULL,
                            dataset_id      VARCHAR(128) NOT NULL,
                            label           VARCHAR(1024),
                            latency_ms      BIGINT NOT NULL,
                            worker_id       VARCHAR(128),
                            created_at      TIMESTAMP DEFAULT CURRENT_TIMESTAMP
                        );
                    """);

            // Indexes
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_rows_dataset ON dataset_rows(dataset_id);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_cells_status ON work_cells(status);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_row_tasks_cell_status ON row_tasks(cell_id, status);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_row_tasks_status_claimed ON row_tasks(status, claimed_at);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_leases_renewed ON cell_leases(renewed_at);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_predictions_cell_row ON predictions(cell_id, row_id);");

            st.executeBatch();
            conn.commit();

            log.info("Database schema initialized");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to initialize database schema", e);
        }
    }

    @Override
    public void close() {
        if (dataSource != null && !dataSource.isClosed()) {
            dataSource.close();
            log.info("Database pool closed");
        }
    }
}
