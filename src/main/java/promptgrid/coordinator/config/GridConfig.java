package promptgrid.coordinator.config;

import java.time.Duration;

/**
 * Configuration holder for the grid coordinator and its workers.
 * All settings have sensible defaults.
 */
public final class GridConfig {

    // Database settings
    private String databaseUrl = "jdbc:h2:file:./data/promptgrid;AUTO_SERVER=TRUE;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE;LOCK_TIMEOUT=10000";
    private int databasePoolSize = 10;

    // Server settings
    private int serverPort = 8080;
    private String serverHost = "0.0.0.0";

    // Worker settings
    private int batchSize = 10;
    private int maxRetries = 3;
    private Duration predictTimeout = Duration.ofMinutes(2);

    // Watchdog settings
    private Duration staleThreshold = Duration.ofMinutes(5);
    private Duration watchdogInterval = Duration.ofSeconds(30);

    private GridConfig() {
    }

    public static GridConfig defaults() {
        return new GridConfig();
    }

    public static GridConfig fromEnv() {
        GridConfig config = new GridConfig();

        // Override from environment variables
        String dbUrl = System.getenv("PROMPTGRID_DB_URL");
        if (dbUrl != null && !dbUrl.isBlank()) {
            config.databaseUrl = dbUrl;
        }

        String poolSize = System.getenv("PROMPTGRID_DB_POOL_SIZE");
        if (poolSize != null && !poolSize.isBlank()) {
            config.databasePoolSize = Integer.parseInt(poolSize.trim());
        }

        String host = System.getenv("PROMPTGRID_HOST");
        if (host != null && !host.isBlank()) {
            config.serverHost = host.trim();
        }

        String port = System.getenv("PROMPTGRID_PORT");
        if (port != null && !port.isBlank()) {
            config.serverPort = Integer.parseInt(port.trim());
        }

        String batchSize = System.getenv("PROMPTGRID_BATCH_SIZE");
        if (batchSize != null && !batchSize.isBlank()) {
            config.batchSize = Integer.parseInt(batchSize.trim());
        }

        String maxRetries = System.getenv("PROMPTGRID_MAX_RETRIES");
        if (maxRetries != null && !maxRetries.isBlank()) {
            config.maxRetries = Integer.parseInt(maxRetries.trim());
        }

        String predictTimeout = System.getenv("PROMPTGRID_PREDICT_TIMEOUT_SEC");
        if (predictTimeout != null && !predictTimeout.isBlank()) {
            config.predictTimeout = Duration.ofSeconds(Long.parseLong(predictTimeout.trim()));
        }

        String staleThreshold = System.getenv("PROMPTGRID_STALE_THRESHOLD_SEC");
        if (staleThreshold != null && !staleThreshold.isBlank()) {
            config.staleThreshold = Duration.ofSeconds(Long.parseLong(staleThreshold.trim()));
        }

        String watchdogInterval = System.getenv("PROMPTGRID_WATCHDOG_INTERVAL_SEC");
        if (watchdogInterval != null && !watchdogInterval.isBlank()) {
            config.watchdogInterval = Duration.ofSeconds(Long.parseLong(watchdogInterval.trim()));
        }

        return config;
    }

    /**
     * Check the settings against each other.
     *
     * @throws IllegalArgumentException on the first violated constraint
     */
    public GridConfig validate() {
        if (databasePoolSize < 1) {
            throw new IllegalArgumentException("databasePoolSize must be >= 1, got " + databasePoolSize);
        }
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be >= 1, got " + batchSize);
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0, got " + maxRetries);
        }
        if (isNotPositive(predictTimeout)) {
            throw new IllegalArgumentException("predictTimeout must be positive, got " + predictTimeout);
        }
        if (isNotPositive(staleThreshold)) {
            throw new IllegalArgumentException("staleThreshold must be positive, got " + staleThreshold);
        }
        if (isNotPositive(watchdogInterval)) {
            throw new IllegalArgumentException("watchdogInterval must be positive, got " + watchdogInterval);
        }
        // A live worker must give up on a predict call before the watchdog gives up on the worker
        if (predictTimeout.compareTo(staleThreshold) >= 0) {
            throw new IllegalArgumentException("predictTimeout (" + predictTimeout
                    + ") must be shorter than staleThreshold (" + staleThreshold + ")");
        }
        return this;
    }

    private static boolean isNotPositive(Duration d) {
        return d == null || d.isZero() || d.isNegative();
    }

    // Getters
    public String databaseUrl() {
        return databaseUrl;
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    public int serverPort() {
        return serverPort;
    }

    public String serverHost() {
        return serverHost;
    }

    public int batchSize() {
        return batchSize;
    }

    public int maxRetries() {
        return maxRetries;
    }

    public Duration predictTimeout() {
        return predictTimeout;
    }

    public Duration staleThreshold() {
        return staleThreshold;
    }

    public Duration watchdogInterval() {
        return watchdogInterval;
    }

    // Fluent setters for testing/customization
    public GridConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public GridConfig withDatabasePoolSize(int poolSize) {
        this.databasePoolSize = poolSize;
        return this;
    }

    public GridConfig withServerHost(String host) {
        this.serverHost = host;
        return this;
    }

    public GridConfig withServerPort(int port) {
        this.serverPort = port;
        return this;
    }

    public GridConfig withBatchSize(int batchSize) {
        this.batchSize = batchSize;
        return this;
    }

    public GridConfig withMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
        return this;
    }

    public GridConfig withPredictTimeout(Duration timeout) {
        this.predictTimeout = timeout;
        return this;
    }

    public GridConfig withStaleThreshold(Duration threshold) {
        this.staleThreshold = threshold;
        return this;
    }

    public GridConfig withWatchdogInterval(Duration interval) {
        this.watchdogInterval = interval;
        return this;
    }

    @Override
    public String toString() {
        return "GridConfig{" +
                "databaseUrl='" + databaseUrl + '\'' +
                ", serverPort=" + serverPort +
                ", batchSize=" + batchSize +
                ", maxRetries=" + maxRetries +
                ", predictTimeout=" + predictTimeout +
                ", staleThreshold=" + staleThreshold +
                '}';
    }
}
