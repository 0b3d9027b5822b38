package net.stepwise.adapter.jdbc.repo;

import net.stepwise.adapter.jdbc.TxContext;
import net.stepwise.adapter.jdbc.mapper.RowMappers;
import net.stepwise.core.model.ErrorInfo;
import net.stepwise.core.model.SliceRun;
import net.stepwise.core.spi.SliceRepository;

import java.sql.Connection;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static net.stepwise.adapter.jdbc.JdbcUtil.setNullableString;
import static net.stepwise.adapter.jdbc.JdbcUtil.ts;

public final class JdbcSliceRepository implements SliceRepository {

    private Connection mustConn() {
        return TxContext.require();
    }

    @Override
    public SliceRun begin(long migrationId, long min, long max, Instant at) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            INSERT INTO TB_MIGRATION_SLICE(MIGRATION_ID, MIN_VALUE, MAX_VALUE, STATUS, ATTEMPTS,
                                           STARTED_AT, CREATED_AT, UPDATED_AT)
            VALUES (?, ?, ?, 'RUNNING', 1, ?, ?, ?)
            ON CONFLICT (MIGRATION_ID, MIN_VALUE) DO UPDATE
               SET MAX_VALUE     = EXCLUDED.MAX_VALUE,
                   STATUS        = 'RUNNING',
                   ATTEMPTS      = TB_MIGRATION_SLICE.ATTEMPTS + 1,
                   ERROR_CLASS   = NULL,
                   ERROR_MESSAGE = NULL,
                   STARTED_AT    = EXCLUDED.STARTED_AT,
                   FINISHED_AT   = NULL,
                   UPDATED_AT    = EXCLUDED.UPDATED_AT
            RETURNING *
        """)) {
            ps.setLong(1, migrationId);
            ps.setLong(2, min);
            ps.setLong(3, max);
            ps.setTimestamp(4, ts(at));
            ps.setTimestamp(5, ts(at));
            ps.setTimestamp(6, ts(at));
            try (var rs = ps.executeQuery()) {
                rs.next();
                return RowMappers.toSliceRun(rs);
            }
        }
    }

    @Override
    public void markSucceeded(long sliceId, Instant at) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            UPDATE TB_MIGRATION_SLICE
               SET STATUS='SUCCEEDED', FINISHED_AT=?, UPDATED_AT=?
             WHERE ID=?
        """)) {
            ps.setTimestamp(1, ts(at));
            ps.setTimestamp(2, ts(at));
            ps.setLong(3, sliceId);
            ps.executeUpdate();
        }
    }

    @Override
    public void markFailed(long sliceId, ErrorInfo error, Instant at) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            UPDATE TB_MIGRATION_SLICE
               SET STATUS='FAILED', ERROR_CLASS=?, ERROR_MESSAGE=?, FINISHED_AT=?, UPDATED_AT=?
             WHERE ID=?
        """)) {
            setNullableString(ps, 1, error.errorClass());
            setNullableString(ps, 2, error.message());
            ps.setTimestamp(3, ts(at));
            ps.setTimestamp(4, ts(at));
            ps.setLong(5, sliceId);
            ps.executeUpdate();
        }
    }

    @Override
    public List<SliceRun> findByMigration(long migrationId) throws Exception {
        try (var ps = mustConn().prepareStatement(
                "SELECT * FROM TB_MIGRATION_SLICE WHERE MIGRATION_ID=? ORDER BY MIN_VALUE")) {
            ps.setLong(1, migrationId);
            List<SliceRun> out = new ArrayList<>();
            try (var rs = ps.executeQuery()) {
                while (rs.next()) out.add(RowMappers.toSliceRun(rs));
            }
            return out;
        }
    }
}
