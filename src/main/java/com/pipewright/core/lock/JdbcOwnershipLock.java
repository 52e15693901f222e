package com.pipewright.core.lock;

import com.pipewright.core.model.RunStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * JDBC-backed {@link OwnershipLock}.
 * <p>
 * The primary key on {@code reference_id} makes the claim atomic across
 * processes: an insert either creates the row or conflicts with the current
 * holder's row. Timestamps are stored as epoch milliseconds.
 */
public class JdbcOwnershipLock implements OwnershipLock {

    private static final Logger log = LoggerFactory.getLogger(JdbcOwnershipLock.class);

    private static final String TABLE_NAME = "run_locks";

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                reference_id VARCHAR(255) PRIMARY KEY,
                run_id       VARCHAR(64)  NOT NULL,
                status       VARCHAR(32)  NOT NULL,
                acquired_at  BIGINT       NOT NULL,
                updated_at   BIGINT       NOT NULL
            )
            """.formatted(TABLE_NAME);

    private static final String INSERT_SQL = """
            INSERT INTO %s (reference_id, run_id, status, acquired_at, updated_at)
            VALUES (?, ?, ?, ?, ?)
            ON CONFLICT (reference_id) DO NOTHING
            """.formatted(TABLE_NAME);

    private static final String UPDATE_STATUS_SQL = """
            UPDATE %s SET status = ?, updated_at = ?
            WHERE reference_id = ? AND run_id = ?
            """.formatted(TABLE_NAME);

    private static final String SELECT_SQL = """
            SELECT reference_id, run_id, status, acquired_at, updated_at
            FROM %s
            WHERE reference_id = ?
            """.formatted(TABLE_NAME);

    private static final String SELECT_ALL_SQL = """
            SELECT reference_id, run_id, status, acquired_at, updated_at
            FROM %s
            ORDER BY acquired_at ASC
            """.formatted(TABLE_NAME);

    private static final String DELETE_OWNED_SQL = """
            DELETE FROM %s WHERE reference_id = ? AND run_id = ?
            """.formatted(TABLE_NAME);

    private static final String DELETE_SQL = """
            DELETE FROM %s WHERE reference_id = ?
            """.formatted(TABLE_NAME);

    private static final String DELETE_STALE_SQL = """
            DELETE FROM %s WHERE updated_at < ?
            """.formatted(TABLE_NAME);

    private final DataSource dataSource;

    public JdbcOwnershipLock(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
    }

    /**
     * Creates the lock table if it does not already exist.
     */
    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(CREATE_TABLE_SQL)) {
            stmt.execute();
            log.info("Lock table '{}' ensured", TABLE_NAME);
        }
    }

    @Override
    public boolean acquire(String referenceId, String runId) {
        long now = Instant.now().toEpochMilli();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(INSERT_SQL)) {
            stmt.setString(1, referenceId);
            stmt.setString(2, runId);
            stmt.setString(3, RunStatus.PENDING.name());
            stmt.setLong(4, now);
            stmt.setLong(5, now);
            if (stmt.executeUpdate() == 1) {
                log.info("Run {} acquired work item {}", runId, referenceId);
                return true;
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to acquire lock for " + referenceId, e);
        }

        Optional<LockRecord> holder = find(referenceId);
        if (holder.isPresent() && holder.get().runId().equals(runId)) {
            log.debug("Run {} already holds work item {}", runId, referenceId);
            return true;
        }
        log.warn("Work item {} already owned by run {}", referenceId,
                holder.map(LockRecord::runId).orElse("<released concurrently>"));
        return false;
    }

    @Override
    public boolean updateStatus(String referenceId, String runId, RunStatus status) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(UPDATE_STATUS_SQL)) {
            stmt.setString(1, status.name());
            stmt.setLong(2, Instant.now().toEpochMilli());
            stmt.setString(3, referenceId);
            stmt.setString(4, runId);
            boolean updated = stmt.executeUpdate() == 1;
            if (!updated) {
                log.warn("Run {} does not own work item {}, status not updated", runId, referenceId);
            }
            return updated;
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to update lock status for " + referenceId, e);
        }
    }

    @Override
    public boolean release(String referenceId, String runId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(DELETE_OWNED_SQL)) {
            stmt.setString(1, referenceId);
            stmt.setString(2, runId);
            boolean released = stmt.executeUpdate() == 1;
            if (released) {
                log.info("Run {} released work item {}", runId, referenceId);
            } else {
                log.warn("Run {} does not own work item {}, nothing released", runId, referenceId);
            }
            return released;
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to release lock for " + referenceId, e);
        }
    }

    @Override
    public boolean forceRelease(String referenceId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(DELETE_SQL)) {
            stmt.setString(1, referenceId);
            boolean released = stmt.executeUpdate() > 0;
            if (released) {
                log.warn("Force-released work item {}", referenceId);
            }
            return released;
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to force-release lock for " + referenceId, e);
        }
    }

    @Override
    public Optional<LockRecord> find(String referenceId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_SQL)) {
            stmt.setString(1, referenceId);
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(fromResultSet(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to read lock for " + referenceId, e);
        }
    }

    @Override
    public List<LockRecord> listActive() {
        var locks = new ArrayList<LockRecord>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_ALL_SQL);
             ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                locks.add(fromResultSet(rs));
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to list locks", e);
        }
        return locks;
    }

    @Override
    public int releaseStale(Duration maxAge) {
        long cutoff = Instant.now().minus(maxAge).toEpochMilli();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(DELETE_STALE_SQL)) {
            stmt.setLong(1, cutoff);
            int released = stmt.executeUpdate();
            if (released > 0) {
                log.info("Released {} stale lock(s) older than {}", released, maxAge);
            }
            return released;
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to release stale locks", e);
        }
    }

    private static LockRecord fromResultSet(ResultSet rs) throws SQLException {
        return new LockRecord(
                rs.getString("reference_id"),
                rs.getString("run_id"),
                RunStatus.valueOf(rs.getString("status")),
                Instant.ofEpochMilli(rs.getLong("acquired_at")),
                Instant.ofEpochMilli(rs.getLong("updated_at")));
    }
}
