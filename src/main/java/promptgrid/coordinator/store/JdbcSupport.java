package promptgrid.coordinator.store;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Collection;
import java.util.Collections;

/**
 * Small JDBC helpers shared by the repositories.
 */
final class JdbcSupport {

    private JdbcSupport() {
    }

    /**
     * Timestamps are stored with millisecond precision so that a value read
     * back from the store compares equal in a guarded UPDATE.
     */
    static Timestamp ts(Instant instant) {
        return Timestamp.from(instant.truncatedTo(ChronoUnit.MILLIS));
    }

    static void setTimestamp(PreparedStatement ps, int index, Instant instant) throws SQLException {
        if (instant != null) {
            ps.setTimestamp(index, ts(instant));
        } else {
            ps.setNull(index, Types.TIMESTAMP);
        }
    }

    static Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }

    static Instant getInstant(ResultSet rs, String column) throws SQLException {
        return toInstant(rs.getTimestamp(column));
    }

    static boolean isUniqueViolation(SQLException e) {
        return Database.UNIQUE_VIOLATION.equals(e.getSQLState());
    }

    /** "?, ?, ?" for an IN clause */
    static String placeholders(Collection<?> values) {
        return String.join(", ", Collections.nCopies(values.size(), "?"));
    }
}
