package com.pipewright.core.idempotency;

import com.pipewright.core.model.RunStatus;
import com.pipewright.core.model.Step;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * JDBC-backed {@link RunStatusRepository}.
 * <p>
 * Rows live in {@code run_status}, created by {@link #createTables()}. The SQL
 * sticks to the subset shared by SQLite and PostgreSQL.
 */
public class JdbcRunStatusRepository implements RunStatusRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcRunStatusRepository.class);

    private static final String TABLE_NAME = "run_status";

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                reference_id VARCHAR(255) PRIMARY KEY,
                run_id       VARCHAR(64)  NOT NULL,
                status       VARCHAR(32)  NOT NULL,
                current_step VARCHAR(32),
                updated_at   BIGINT       NOT NULL
            )
            """.formatted(TABLE_NAME);

    private static final String UPSERT_SQL = """
            INSERT INTO %s (reference_id, run_id, status, current_step, updated_at)
            VALUES (?, ?, ?, ?, ?)
            ON CONFLICT (reference_id)
            DO UPDATE SET run_id = EXCLUDED.run_id,
                          status = EXCLUDED.status,
                          current_step = EXCLUDED.current_step,
                          updated_at = EXCLUDED.updated_at
            """.formatted(TABLE_NAME);

    private static final String SELECT_SQL = """
            SELECT reference_id, run_id, status, current_step, updated_at
            FROM %s
            WHERE reference_id = ?
            """.formatted(TABLE_NAME);

    private static final String SELECT_ALL_SQL = """
            SELECT reference_id, run_id, status, current_step, updated_at
            FROM %s
            ORDER BY updated_at DESC
            """.formatted(TABLE_NAME);

    private static final String DELETE_SQL = """
            DELETE FROM %s WHERE reference_id = ?
            """.formatted(TABLE_NAME);

    private final DataSource dataSource;

    public JdbcRunStatusRepository(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
    }

    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(CREATE_TABLE_SQL)) {
            stmt.execute();
            log.info("Status table '{}' ensured", TABLE_NAME);
        }
    }

    @Override
    public Optional<RecordedStatus> find(String referenceId) {
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
            throw new IllegalStateException("Failed to read recorded status for " + referenceId, e);
        }
    }

    @Override
    public void upsert(RecordedStatus status) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(UPSERT_SQL)) {
            stmt.setString(1, status.referenceId());
            stmt.setString(2, status.runId());
            stmt.setString(3, status.status().name());
            stmt.setString(4, status.currentStep() != null ? status.currentStep().name() : null);
            stmt.setLong(5, (status.updatedAt() != null ? status.updatedAt() : Instant.now()).toEpochMilli());
            stmt.executeUpdate();
            log.debug("Recorded status {} / {} for {}", status.status(), status.currentStep(), status.referenceId());
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to write recorded status for " + status.referenceId(), e);
        }
    }

    @Override
    public boolean delete(String referenceId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(DELETE_SQL)) {
            stmt.setString(1, referenceId);
            return stmt.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to delete recorded status for " + referenceId, e);
        }
    }

    @Override
    public List<RecordedStatus> findAll() {
        var statuses = new ArrayList<RecordedStatus>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_ALL_SQL);
             ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                statuses.add(fromResultSet(rs));
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to list recorded statuses", e);
        }
        return statuses;
    }

    private static RecordedStatus fromResultSet(ResultSet rs) throws SQLException {
        String step = rs.getString("current_step");
        return new RecordedStatus(
                rs.getString("reference_id"),
                rs.getString("run_id"),
                RunStatus.valueOf(rs.getString("status")),
                step != null ? Step.valueOf(step) : null,
                Instant.ofEpochMilli(rs.getLong("updated_at")));
    }
}
