package net.stepwise.adapter.jdbc.repo;

import net.stepwise.adapter.jdbc.TxContext;
import net.stepwise.adapter.jdbc.mapper.RowMappers;
import net.stepwise.core.model.ErrorInfo;
import net.stepwise.core.model.Migration;
import net.stepwise.core.model.MigrationStatus;
import net.stepwise.core.spi.MigrationRepository;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static net.stepwise.adapter.jdbc.JdbcUtil.setNullableLong;
import static net.stepwise.adapter.jdbc.JdbcUtil.setNullableString;
import static net.stepwise.adapter.jdbc.JdbcUtil.ts;

public final class JdbcMigrationRepository implements MigrationRepository {

    private Connection mustConn() {
        return TxContext.require();
    }

    @Override
    public Migration insertIfAbsent(Migration draft) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            INSERT INTO TB_MIGRATION(MIGRATION_NAME, ARGUMENTS, SHARD, CONNECTION_NAME, TABLE_NAME, STATUS,
                                     PROCESSED_COUNT, ESTIMATED_TOTAL, ATTEMPTS, MAX_ATTEMPTS, ITERATION_PAUSE_MS,
                                     CREATED_AT, UPDATED_AT)
            VALUES (?, ?, ?, ?, ?, ?, 0, ?, 0, ?, ?, ?, ?)
            ON CONFLICT DO NOTHING
            RETURNING *
        """)) {
            ps.setString(1, draft.name());
            ps.setString(2, draft.arguments());
            setNullableString(ps, 3, draft.shard());
            setNullableString(ps, 4, draft.connectionName());
            setNullableString(ps, 5, draft.tableName());
            ps.setString(6, draft.status().code());
            setNullableLong(ps, 7, draft.estimatedTotal());
            ps.setInt(8, draft.maxAttempts());
            ps.setLong(9, draft.iterationPause().toMillis());
            ps.setTimestamp(10, ts(draft.createdAt()));
            ps.setTimestamp(11, ts(draft.updatedAt()));
            try (var rs = ps.executeQuery()) {
                if (rs.next()) return RowMappers.toMigration(rs);
            }
        }
        // 동시에 같은 설정이 먼저 들어갔다
        return findByConfiguration(draft.name(), draft.arguments(), draft.shard())
                .orElseThrow(() -> new IllegalStateException("Migration " + draft.name() + " vanished after conflict"));
    }

    @Override
    public Optional<Migration> findById(long id) throws Exception {
        try (var ps = mustConn().prepareStatement("SELECT * FROM TB_MIGRATION WHERE ID=?")) {
            ps.setLong(1, id);
            return one(ps);
        }
    }

    @Override
    public Optional<Migration> findByConfiguration(String name, String arguments, String shard) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            SELECT *
              FROM TB_MIGRATION
             WHERE MIGRATION_NAME = ?
               AND md5(ARGUMENTS) = md5(?)
               AND COALESCE(SHARD, '') = COALESCE(CAST(? AS VARCHAR), '')
               AND ARGUMENTS = ?
        """)) {
            ps.setString(1, name);
            ps.setString(2, arguments);
            setNullableString(ps, 3, shard);
            ps.setString(4, arguments);
            return one(ps);
        }
    }

    @Override
    public List<Migration> findByNameAndArguments(String name, String arguments) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            SELECT *
              FROM TB_MIGRATION
             WHERE MIGRATION_NAME = ?
               AND md5(ARGUMENTS) = md5(?)
               AND ARGUMENTS = ?
             ORDER BY ID
        """)) {
            ps.setString(1, name);
            ps.setString(2, arguments);
            ps.setString(3, arguments);
            return many(ps);
        }
    }

    @Override
    public List<Migration> findSchedulable(String shard) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            SELECT *
              FROM TB_MIGRATION
             WHERE STATUS IN ('PENDING', 'ENQUEUED', 'RUNNING', 'PAUSING', 'CANCELLING', 'ERRORED')
               AND (CAST(? AS VARCHAR) IS NULL OR SHARD = ?)
             ORDER BY CREATED_AT, ID
        """)) {
            setNullableString(ps, 1, shard);
            setNullableString(ps, 2, shard);
            return many(ps);
        }
    }

    @Override
    public boolean updateStatus(long id, MigrationStatus from, MigrationStatus to, Instant at) throws Exception {
        from.checkTransition(to);
        try (var ps = mustConn().prepareStatement("""
            UPDATE TB_MIGRATION
               SET STATUS        = ?,
                   STARTED_AT    = CASE WHEN ? AND STARTED_AT IS NULL THEN ? ELSE STARTED_AT END,
                   FINISHED_AT   = CASE WHEN ? THEN ? ELSE FINISHED_AT END,
                   ERROR_CLASS   = NULL,
                   ERROR_MESSAGE = NULL,
                   BACKTRACE     = NULL,
                   UPDATED_AT    = ?
             WHERE ID = ? AND STATUS = ?
        """)) {
            ps.setString(1, to.code());
            ps.setBoolean(2, to == MigrationStatus.RUNNING);
            ps.setTimestamp(3, ts(at));
            ps.setBoolean(4, to.isTerminal());
            ps.setTimestamp(5, ts(at));
            ps.setTimestamp(6, ts(at));
            ps.setLong(7, id);
            ps.setString(8, from.code());
            return ps.executeUpdate() == 1;
        }
    }

    @Override
    public boolean recordFailure(long id, MigrationStatus from, MigrationStatus to,
                                 int attempts, ErrorInfo error, Instant at) throws Exception {
        from.checkTransition(to);
        try (var ps = mustConn().prepareStatement("""
            UPDATE TB_MIGRATION
               SET STATUS        = ?,
                   ATTEMPTS      = ?,
                   ERROR_CLASS   = ?,
                   ERROR_MESSAGE = ?,
                   BACKTRACE     = ?,
                   FINISHED_AT   = CASE WHEN ? THEN ? ELSE FINISHED_AT END,
                   UPDATED_AT    = ?
             WHERE ID = ? AND STATUS = ?
        """)) {
            ps.setString(1, to.code());
            ps.setInt(2, attempts);
            setNullableString(ps, 3, error.errorClass());
            setNullableString(ps, 4, error.message());
            setNullableString(ps, 5, error.backtrace());
            ps.setBoolean(6, to.isTerminal());
            ps.setTimestamp(7, ts(at));
            ps.setTimestamp(8, ts(at));
            ps.setLong(9, id);
            ps.setString(10, from.code());
            return ps.executeUpdate() == 1;
        }
    }

    @Override
    public boolean resetForRetry(long id, Instant at) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            UPDATE TB_MIGRATION
               SET STATUS        = 'PENDING',
                   ATTEMPTS      = 0,
                   ERROR_CLASS   = NULL,
                   ERROR_MESSAGE = NULL,
                   BACKTRACE     = NULL,
                   STARTED_AT    = NULL,
                   FINISHED_AT   = NULL,
                   UPDATED_AT    = ?
             WHERE ID = ? AND STATUS = 'FAILED'
        """)) {
            ps.setTimestamp(1, ts(at));
            ps.setLong(2, id);
            return ps.executeUpdate() == 1;
        }
    }

    @Override
    public boolean recordProgress(long id, String expectedCursor, String cursor, long processedDelta, Instant at) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            UPDATE TB_MIGRATION
               SET CURSOR_VALUE    = ?,
                   PROCESSED_COUNT = PROCESSED_COUNT + ?,
                   UPDATED_AT      = ?
             WHERE ID = ?
               AND STATUS IN ('RUNNING', 'PAUSING', 'CANCELLING')
               AND CURSOR_VALUE IS NOT DISTINCT FROM CAST(? AS VARCHAR)
        """)) {
            ps.setString(1, cursor);
            ps.setLong(2, processedDelta);
            ps.setTimestamp(3, ts(at));
            ps.setLong(4, id);
            ps.setString(5, expectedCursor);
            return ps.executeUpdate() == 1;
        }
    }

    @Override
    public boolean touch(long id, MigrationStatus expected, Instant at) throws Exception {
        try (var ps = mustConn().prepareStatement("UPDATE TB_MIGRATION SET UPDATED_AT=? WHERE ID=? AND STATUS=?")) {
            ps.setTimestamp(1, ts(at));
            ps.setLong(2, id);
            ps.setString(3, expected.code());
            return ps.executeUpdate() == 1;
        }
    }

    private static Optional<Migration> one(PreparedStatement ps) throws SQLException {
        try (var rs = ps.executeQuery()) {
            return rs.next() ? Optional.of(RowMappers.toMigration(rs)) : Optional.empty();
        }
    }

    private static List<Migration> many(PreparedStatement ps) throws SQLException {
        List<Migration> out = new ArrayList<>();
        try (var rs = ps.executeQuery()) {
            while (rs.next()) out.add(RowMappers.toMigration(rs));
        }
        return out;
    }
}
